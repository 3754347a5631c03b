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

public class ComputedMemberExpression extends BaseNode implements MemberExpression {

    public Expression object;
    public Expression expression;
    public boolean optional;

    public ComputedMemberExpression(Span span, Expression object, Expression expression, boolean optional) {
        super(span);
        this.object = object;
        this.expression = expression;
        this.optional = optional;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPUTED_MEMBER_EXPRESSION;
    }

    @Override
    public Expression getObject() {
        return object;
    }

    @Override
    public boolean isOptional() {
        return optional;
    }

    @Override
    public String getStaticPropertyName() {
        if (expression instanceof StringLiteral sl) {
            return sl.value;
        }
        return null;
    }

    @Override
    public Span getStaticPropertySpan() {
        return expression instanceof StringLiteral ? expression.getSpan() : null;
    }

}
