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
package io.jsweave.traverse;

/**
 * Syntactic position of a child inside its parent. List slots pair with an index in
 * {@link Ancestor}.
 */
public enum Slot {

    PROGRAM_BODY(true),
    EXPRESSION_STATEMENT_EXPRESSION,
    BLOCK_BODY(true),
    VARIABLE_DECLARATIONS(true),
    VARIABLE_DECLARATOR_ID,
    VARIABLE_DECLARATOR_INIT,
    RETURN_ARGUMENT,
    IF_TEST,
    IF_CONSEQUENT,
    IF_ALTERNATE,
    THROW_ARGUMENT,
    IMPORT_SPECIFIERS(true),
    IMPORT_SOURCE,
    IMPORT_SPECIFIER_LOCAL,
    EXPORT_DEFAULT_DECLARATION,
    EXPORT_NAMED_DECLARATION,
    //==== functions
    FUNCTION_ID,
    FUNCTION_PARAMS,
    FUNCTION_BODY,
    ARROW_PARAMS,
    ARROW_BODY,
    FORMAL_PARAMETERS_ITEMS(true),
    FUNCTION_BODY_STATEMENTS(true),
    //==== patterns
    OBJECT_PATTERN_PROPERTIES(true),
    BINDING_PROPERTY_KEY,
    BINDING_PROPERTY_VALUE,
    ARRAY_PATTERN_ELEMENTS(true),
    ASSIGNMENT_PATTERN_LEFT,
    ASSIGNMENT_PATTERN_RIGHT,
    //==== expressions
    ARRAY_ELEMENTS(true),
    OBJECT_PROPERTIES(true),
    OBJECT_PROPERTY_KEY,
    OBJECT_PROPERTY_VALUE,
    SPREAD_ARGUMENT,
    CALL_CALLEE,
    CALL_ARGUMENTS(true),
    NEW_CALLEE,
    NEW_ARGUMENTS(true),
    MEMBER_OBJECT,
    MEMBER_PROPERTY,
    UNARY_ARGUMENT,
    UPDATE_ARGUMENT,
    BINARY_LEFT,
    BINARY_RIGHT,
    LOGICAL_LEFT,
    LOGICAL_RIGHT,
    CONDITIONAL_TEST,
    CONDITIONAL_CONSEQUENT,
    CONDITIONAL_ALTERNATE,
    ASSIGNMENT_LEFT,
    ASSIGNMENT_RIGHT,
    SEQUENCE_EXPRESSIONS(true),
    PARENTHESIZED_EXPRESSION,
    AWAIT_ARGUMENT,
    YIELD_ARGUMENT,
    //==== jsx
    JSX_ELEMENT_OPENING,
    JSX_ELEMENT_CHILDREN(true),
    JSX_ELEMENT_CLOSING,
    JSX_OPENING_ELEMENT_NAME,
    JSX_OPENING_ELEMENT_ATTRIBUTES(true),
    JSX_CLOSING_ELEMENT_NAME,
    JSX_FRAGMENT_OPENING,
    JSX_FRAGMENT_CHILDREN(true),
    JSX_FRAGMENT_CLOSING,
    JSX_MEMBER_OBJECT,
    JSX_MEMBER_PROPERTY,
    JSX_NAMESPACE,
    JSX_NAMESPACED_NAME,
    JSX_ATTRIBUTE_NAME,
    JSX_ATTRIBUTE_VALUE,
    JSX_SPREAD_ATTRIBUTE_ARGUMENT,
    JSX_EXPRESSION_CONTAINER_EXPRESSION;

    public final boolean list;

    Slot() {
        this(false);
    }

    Slot(boolean list) {
        this.list = list;
    }

}
