/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.jsweave.ast;

import io.jsweave.semantic.ScopeId;

/**
 * Arrow function. An expression-bodied arrow ({@code x => x + 1}) keeps its body as a
 * {@link FunctionBody} holding a single {@link ExpressionStatement} and has
 * {@link #expression} set.
 */
public class ArrowFunctionExpression extends BaseNode implements Expression, ScopeOwner {

    public boolean async;
    public boolean expression;
    public FormalParameters params;
    public FunctionBody body;

    private ScopeId scopeId;

    public ArrowFunctionExpression(Span span, boolean async, boolean expression, FormalParameters params, FunctionBody body) {
        super(span);
        this.async = async;
        this.expression = expression;
        this.params = params;
        this.body = body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ARROW_FUNCTION_EXPRESSION;
    }

    /**
     * @return the body expression of an expression-bodied arrow, else null
     */
    public Expression getExpression() {
        if (expression && body.statements.size() == 1 && body.statements.get(0) instanceof ExpressionStatement es) {
            return es.expression;
        }
        return null;
    }

    @Override
    public ScopeId getScopeId() {
        return scopeId;
    }

    @Override
    public void setScopeId(ScopeId scopeId) {
        this.scopeId = scopeId;
    }

}
