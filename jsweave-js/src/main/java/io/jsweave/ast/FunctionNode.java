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
 * A {@code function} declaration or expression, including async and generator forms.
 */
public class FunctionNode extends BaseNode implements Expression, Statement, ScopeOwner {

    public enum Type {
        DECLARATION, EXPRESSION
    }

    public Type type;
    public BindingIdentifier id;
    public boolean async;
    public boolean generator;
    public FormalParameters params;
    public FunctionBody body;

    private ScopeId scopeId;

    public FunctionNode(Span span, Type type, BindingIdentifier id, boolean async, boolean generator,
                        FormalParameters params, FunctionBody body) {
        super(span);
        this.type = type;
        this.id = id;
        this.async = async;
        this.generator = generator;
        this.params = params;
        this.body = body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION;
    }

    public boolean isDeclaration() {
        return type == Type.DECLARATION;
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
