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

public enum NodeKind {

    PROGRAM,
    //==== statements
    EXPRESSION_STATEMENT,
    BLOCK_STATEMENT,
    VARIABLE_DECLARATION,
    VARIABLE_DECLARATOR,
    RETURN_STATEMENT,
    IF_STATEMENT,
    THROW_STATEMENT,
    EMPTY_STATEMENT,
    IMPORT_DECLARATION,
    IMPORT_SPECIFIER,
    IMPORT_DEFAULT_SPECIFIER,
    IMPORT_NAMESPACE_SPECIFIER,
    EXPORT_DEFAULT_DECLARATION,
    EXPORT_NAMED_DECLARATION,
    //==== functions
    FUNCTION(true),
    ARROW_FUNCTION_EXPRESSION(true),
    FORMAL_PARAMETERS,
    FUNCTION_BODY,
    //==== patterns
    BINDING_IDENTIFIER,
    OBJECT_PATTERN,
    BINDING_PROPERTY,
    ARRAY_PATTERN,
    ASSIGNMENT_PATTERN,
    //==== expressions
    IDENTIFIER_REFERENCE,
    IDENTIFIER_NAME,
    THIS_EXPRESSION,
    NULL_LITERAL,
    BOOLEAN_LITERAL,
    NUMERIC_LITERAL,
    STRING_LITERAL,
    ARRAY_EXPRESSION,
    ELISION,
    OBJECT_EXPRESSION,
    OBJECT_PROPERTY,
    SPREAD_ELEMENT,
    CALL_EXPRESSION,
    NEW_EXPRESSION,
    STATIC_MEMBER_EXPRESSION,
    COMPUTED_MEMBER_EXPRESSION,
    UNARY_EXPRESSION,
    UPDATE_EXPRESSION,
    BINARY_EXPRESSION,
    LOGICAL_EXPRESSION,
    CONDITIONAL_EXPRESSION,
    ASSIGNMENT_EXPRESSION,
    SEQUENCE_EXPRESSION,
    PARENTHESIZED_EXPRESSION,
    AWAIT_EXPRESSION,
    YIELD_EXPRESSION,
    //==== jsx
    JSX_ELEMENT,
    JSX_OPENING_ELEMENT,
    JSX_CLOSING_ELEMENT,
    JSX_FRAGMENT,
    JSX_OPENING_FRAGMENT,
    JSX_CLOSING_FRAGMENT,
    JSX_IDENTIFIER,
    JSX_MEMBER_EXPRESSION,
    JSX_NAMESPACED_NAME,
    JSX_ATTRIBUTE,
    JSX_SPREAD_ATTRIBUTE,
    JSX_EXPRESSION_CONTAINER,
    JSX_EMPTY_EXPRESSION,
    JSX_TEXT;

    public final boolean functionLike;

    NodeKind() {
        this(false);
    }

    NodeKind(boolean functionLike) {
        this.functionLike = functionLike;
    }

    public boolean oneOf(NodeKind... kinds) {
        for (NodeKind kind : kinds) {
            if (this == kind) {
                return true;
            }
        }
        return false;
    }

}
