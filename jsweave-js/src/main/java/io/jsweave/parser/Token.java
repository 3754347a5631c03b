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
package io.jsweave.parser;

import io.jsweave.ast.Span;

/**
 * A lexed token. {@code newlineBefore} is set when a line terminator precedes the token,
 * which drives automatic semicolon insertion.
 */
public record Token(TokenType type, int start, int end, String text, boolean newlineBefore) {

    public Span span() {
        return new Span(start, end);
    }

    /**
     * @return true for identifiers and keywords, which may all be used as property names
     */
    public boolean isIdentifierName() {
        return type == TokenType.IDENT || type.keyword;
    }

    public boolean isIdent(String name) {
        return type == TokenType.IDENT && text.equals(name);
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "_EOF_" : text;
    }

}
