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

import java.util.ArrayList;
import java.util.List;

public class CallExpression extends BaseNode implements Expression {

    public Expression callee;
    public final List<Argument> arguments;
    public boolean optional;

    public CallExpression(Span span, Expression callee, List<Argument> arguments, boolean optional) {
        super(span);
        this.callee = callee;
        this.arguments = new ArrayList<>(arguments);
        this.optional = optional;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CALL_EXPRESSION;
    }

    /**
     * @return name of the called function for {@code foo()} and {@code a.foo()}, else null
     */
    public String getCalleeName() {
        Expression expr = callee.withoutParentheses();
        if (expr instanceof IdentifierReference ref) {
            return ref.name;
        }
        if (expr instanceof MemberExpression member) {
            return member.getStaticPropertyName();
        }
        return null;
    }

}
