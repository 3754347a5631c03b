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

import io.jsweave.common.Source;

import static io.jsweave.parser.TokenType.*;

/**
 * Hand-rolled lexer for the JavaScript and JSX subset. Scanning is position based: the
 * parser asks for the token starting at an offset in one of three modes (script, JSX tag,
 * JSX children), which is how it switches between JavaScript and JSX without a state stack.
 * Whitespace and comments are skipped and folded into {@link Token#newlineBefore()}.
 */
public class JsLexer {

    protected final Source source;
    protected final String text;
    protected final int length;

    protected int pos;
    protected int tokenStart;
    protected boolean newline;

    public JsLexer(Source source) {
        this.source = source;
        this.text = source.getText();
        this.length = text.length();
    }

    // ========== Public API ==========

    public Token scan(int from) {
        pos = from;
        skipTrivia();
        tokenStart = pos;
        TokenType type = scanToken();
        return token(type);
    }

    /**
     * Scans inside a JSX tag, where names may contain hyphens, strings have no escapes and
     * every punctuator is a single char.
     */
    public Token scanJsxTag(int from) {
        pos = from;
        skipTrivia();
        tokenStart = pos;
        if (isAtEnd()) {
            return token(EOF);
        }
        char c = peek();
        if (isIdentifierStart(c)) {
            while (!isAtEnd() && (isIdentifierPart(peek()) || peek() == '-')) {
                pos++;
            }
            return token(JSX_IDENT);
        }
        pos++;
        switch (c) {
            case '"':
            case '\'':
                while (!isAtEnd() && peek() != c) {
                    pos++;
                }
                if (isAtEnd()) {
                    throw new ParserException("unterminated string in jsx attribute", tokenStart);
                }
                pos++;
                return token(c == '"' ? D_STRING : S_STRING);
            case '<':
                return token(LT);
            case '>':
                return token(GT);
            case '/':
                return token(SLASH);
            case '=':
                return token(EQ);
            case '{':
                return token(L_CURLY);
            case '}':
                return token(R_CURLY);
            case '.':
                return token(DOT);
            case ':':
                return token(COLON);
            default:
                throw new ParserException("unexpected character in jsx tag: " + c, tokenStart);
        }
    }

    /**
     * Scans between JSX tags: text up to the next {@code <} or {@code {}, or one of those two.
     */
    public Token scanJsxChild(int from) {
        pos = from;
        newline = false;
        tokenStart = pos;
        if (isAtEnd()) {
            return token(EOF);
        }
        char c = peek();
        if (c == '<') {
            pos++;
            return token(LT);
        }
        if (c == '{') {
            pos++;
            return token(L_CURLY);
        }
        while (!isAtEnd() && peek() != '<' && peek() != '{') {
            pos++;
        }
        return token(JSX_TEXT);
    }

    private Token token(TokenType type) {
        return new Token(type, tokenStart, pos, text.substring(tokenStart, pos), newline);
    }

    // ========== Character Utilities ==========

    protected boolean isAtEnd() {
        return pos >= length;
    }

    protected char peek() {
        return pos >= length ? '\0' : text.charAt(pos);
    }

    protected char peek(int offset) {
        int index = pos + offset;
        return (index < 0 || index >= length) ? '\0' : text.charAt(index);
    }

    protected boolean match(char expected) {
        if (pos >= length || text.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$'
                || (c > 127 && Character.isJavaIdentifierStart(c));
    }

    static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || (c > 127 && Character.isJavaIdentifierPart(c));
    }

    // ========== Whitespace and Comments ==========

    private void skipTrivia() {
        newline = false;
        while (pos < length) {
            char c = text.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f' || c == '\u00a0' || c == '\ufeff') {
                pos++;
            } else if (c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029') {
                pos++;
                newline = true;
            } else if (c == '/' && peek(1) == '/') {
                while (pos < length && text.charAt(pos) != '\n' && text.charAt(pos) != '\r') {
                    pos++;
                }
            } else if (c == '/' && peek(1) == '*') {
                int start = pos;
                pos += 2;
                while (true) {
                    if (pos >= length) {
                        throw new ParserException("unterminated comment", start);
                    }
                    char cc = text.charAt(pos);
                    if (cc == '*' && peek(1) == '/') {
                        pos += 2;
                        break;
                    }
                    if (cc == '\n') {
                        newline = true;
                    }
                    pos++;
                }
            } else {
                break;
            }
        }
    }

    // ========== Main Scanner ==========

    private TokenType scanToken() {
        if (isAtEnd()) {
            return EOF;
        }
        char c = peek();
        if (c == '"' || c == '\'') {
            return scanString(c);
        }
        if (c == '`') {
            throw new ParserException("template literals are not supported", pos);
        }
        if (isIdentifierStart(c)) {
            return scanIdentifier();
        }
        if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            return scanNumber();
        }
        return scanOperator();
    }

    private TokenType scanString(char quote) {
        pos++;
        while (pos < length) {
            char c = text.charAt(pos);
            if (c == quote) {
                pos++;
                return quote == '"' ? D_STRING : S_STRING;
            }
            if (c == '\\' && pos + 1 < length) {
                pos += 2;
                continue;
            }
            if (c == '\n') {
                break;
            }
            pos++;
        }
        throw new ParserException("unterminated string", tokenStart);
    }

    private TokenType scanIdentifier() {
        while (pos < length && isIdentifierPart(text.charAt(pos))) {
            pos++;
        }
        TokenType keyword = TokenType.keyword(text.substring(tokenStart, pos));
        return keyword == null ? IDENT : keyword;
    }

    private TokenType scanNumber() {
        if (peek() == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
            pos += 2;
            while (!isAtEnd() && isHexDigit(peek())) {
                pos++;
            }
            return NUMBER;
        }
        while (!isAtEnd() && isDigit(peek())) {
            pos++;
        }
        if (peek() == '.') {
            pos++;
            while (!isAtEnd() && isDigit(peek())) {
                pos++;
            }
        }
        if (peek() == 'e' || peek() == 'E') {
            int mark = pos;
            pos++;
            if (peek() == '+' || peek() == '-') {
                pos++;
            }
            if (!isDigit(peek())) {
                pos = mark;
                return NUMBER;
            }
            while (!isAtEnd() && isDigit(peek())) {
                pos++;
            }
        }
        return NUMBER;
    }

    private TokenType scanOperator() {
        char c = text.charAt(pos++);
        switch (c) {
            case '{':
                return L_CURLY;
            case '}':
                return R_CURLY;
            case '[':
                return L_BRACKET;
            case ']':
                return R_BRACKET;
            case '(':
                return L_PAREN;
            case ')':
                return R_PAREN;
            case ',':
                return COMMA;
            case ':':
                return COLON;
            case ';':
                return SEMI;
            case '~':
                return TILDE;
            case '.':
                if (peek() == '.' && peek(1) == '.') {
                    pos += 2;
                    return DOT_DOT_DOT;
                }
                return DOT;
            case '?':
                if (peek() == '.' && !isDigit(peek(1))) {
                    pos++;
                    return QUES_DOT;
                }
                if (match('?')) {
                    return match('=') ? QUES_QUES_EQ : QUES_QUES;
                }
                return QUES;
            case '=':
                if (match('>')) {
                    return EQ_GT;
                }
                if (match('=')) {
                    return match('=') ? EQ_EQ_EQ : EQ_EQ;
                }
                return EQ;
            case '!':
                if (match('=')) {
                    return match('=') ? NOT_EQ_EQ : NOT_EQ;
                }
                return NOT;
            case '<':
                if (match('<')) {
                    return match('=') ? LT_LT_EQ : LT_LT;
                }
                return match('=') ? LT_EQ : LT;
            case '>':
                if (match('>')) {
                    if (match('>')) {
                        return match('=') ? GT_GT_GT_EQ : GT_GT_GT;
                    }
                    return match('=') ? GT_GT_EQ : GT_GT;
                }
                return match('=') ? GT_EQ : GT;
            case '&':
                if (match('&')) {
                    return match('=') ? AMP_AMP_EQ : AMP_AMP;
                }
                return match('=') ? AMP_EQ : AMP;
            case '|':
                if (match('|')) {
                    return match('=') ? PIPE_PIPE_EQ : PIPE_PIPE;
                }
                return match('=') ? PIPE_EQ : PIPE;
            case '^':
                return match('=') ? CARET_EQ : CARET;
            case '+':
                if (match('+')) {
                    return PLUS_PLUS;
                }
                return match('=') ? PLUS_EQ : PLUS;
            case '-':
                if (match('-')) {
                    return MINUS_MINUS;
                }
                return match('=') ? MINUS_EQ : MINUS;
            case '*':
                if (match('*')) {
                    return match('=') ? STAR_STAR_EQ : STAR_STAR;
                }
                return match('=') ? STAR_EQ : STAR;
            case '/':
                return match('=') ? SLASH_EQ : SLASH;
            case '%':
                return match('=') ? PERCENT_EQ : PERCENT;
            default:
                throw new ParserException("unexpected character: " + c, tokenStart);
        }
    }

}
