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

import java.util.List;

/**
 * Factory for synthetic nodes. Everything built here carries {@link Span#EMPTY} unless a
 * span is passed.
 */
public class AstBuilder {

    public static final AstBuilder INSTANCE = new AstBuilder();

    public IdentifierName identifierName(String name) {
        return new IdentifierName(Span.EMPTY, name);
    }

    public IdentifierReference identifierReference(String name) {
        return new IdentifierReference(Span.EMPTY, name);
    }

    public StringLiteral stringLiteral(String value) {
        return new StringLiteral(Span.EMPTY, value);
    }

    public NumericLiteral numericLiteral(double value) {
        String raw = value == Math.rint(value) && !Double.isInfinite(value) ? Long.toString((long) value) : Double.toString(value);
        return new NumericLiteral(Span.EMPTY, value, raw);
    }

    public BooleanLiteral booleanLiteral(boolean value) {
        return new BooleanLiteral(Span.EMPTY, value);
    }

    public NullLiteral nullLiteral() {
        return new NullLiteral(Span.EMPTY);
    }

    public ThisExpression thisExpression() {
        return new ThisExpression(Span.EMPTY);
    }

    public StaticMemberExpression staticMember(Expression object, String property) {
        return new StaticMemberExpression(Span.EMPTY, object, identifierName(property), false);
    }

    public CallExpression call(Expression callee, List<Argument> arguments) {
        return new CallExpression(Span.EMPTY, callee, arguments, false);
    }

    public YieldExpression yield(boolean delegate, Expression argument) {
        return new YieldExpression(Span.EMPTY, delegate, argument);
    }

    public ParenthesizedExpression parenthesized(Expression expression) {
        return new ParenthesizedExpression(Span.EMPTY, expression);
    }

    public ExpressionStatement expressionStatement(Expression expression) {
        return new ExpressionStatement(Span.EMPTY, expression);
    }

    public ReturnStatement returnStatement(Expression argument) {
        return new ReturnStatement(Span.EMPTY, argument);
    }

    public BlockStatement blockStatement(List<Statement> body) {
        return new BlockStatement(Span.EMPTY, body);
    }

    public VariableDeclaration variableDeclaration(VariableDeclaration.Kind kind, BindingPattern id, Expression init) {
        VariableDeclarator declarator = new VariableDeclarator(Span.EMPTY, id, init);
        return new VariableDeclaration(Span.EMPTY, kind, List.of(declarator));
    }

    public FormalParameters formalParameters(List<BindingPattern> items) {
        return new FormalParameters(Span.EMPTY, items);
    }

    public FunctionBody functionBody(List<Statement> statements) {
        return new FunctionBody(Span.EMPTY, statements);
    }

    public FunctionNode functionExpression(BindingIdentifier id, boolean async, boolean generator,
                                           FormalParameters params, FunctionBody body) {
        return new FunctionNode(Span.EMPTY, FunctionNode.Type.EXPRESSION, id, async, generator, params, body);
    }

    public ArrowFunctionExpression arrowFunction(boolean async, FormalParameters params, FunctionBody body) {
        return new ArrowFunctionExpression(Span.EMPTY, async, false, params, body);
    }

}
