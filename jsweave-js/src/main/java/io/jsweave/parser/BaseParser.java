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
import io.jsweave.common.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Token cursor shared by the grammar. The current token is always scanned on demand from
 * the end of the previous one, in the mode the grammar asks for.
 */
abstract class BaseParser {

    static final Logger logger = LoggerFactory.getLogger(BaseParser.class);

    final Source source;
    final JsLexer lexer;

    Token current;
    int prevEnd;

    BaseParser(Source source) {
        this.source = source;
        this.lexer = new JsLexer(source);
        this.current = lexer.scan(0);
    }

    /**
     * Advances in script mode.
     */
    Token next() {
        Token token = current;
        prevEnd = token.end();
        current = lexer.scan(token.end());
        return token;
    }

    Token nextJsxTag() {
        Token token = current;
        prevEnd = token.end();
        current = lexer.scanJsxTag(token.end());
        return token;
    }

    Token nextJsxChild() {
        Token token = current;
        prevEnd = token.end();
        current = lexer.scanJsxChild(token.end());
        return token;
    }

    Token peekToken() {
        return lexer.scan(current.end());
    }

    boolean is(TokenType type) {
        return current.type() == type;
    }

    boolean isIdent(String name) {
        return current.isIdent(name);
    }

    boolean accept(TokenType type) {
        if (current.type() == type) {
            next();
            return true;
        }
        return false;
    }

    Token expect(TokenType type) {
        if (current.type() != type) {
            error(type);
        }
        return next();
    }

    Span span(int start) {
        return new Span(start, Math.max(start, prevEnd));
    }

    void error(String message) {
        throw exception(message, current.start());
    }

    void error(String message, int offset) {
        throw exception(message, offset);
    }

    void error(TokenType... expected) {
        error("expected: " + Arrays.asList(expected) + " but found: " + current.type());
    }

    ParserException unexpected() {
        return exception("unexpected token: " + current.type(), current.start());
    }

    ParserException exception(String message, int offset) {
        String display = source.getName() + ":" + source.getPositionDisplay(offset);
        if (logger.isTraceEnabled()) {
            logger.trace("syntax error at {}: {}", display, message);
        }
        return new ParserException(message + "\n" + display + " " + current, offset);
    }

}
