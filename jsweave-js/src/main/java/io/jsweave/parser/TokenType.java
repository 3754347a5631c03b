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

import java.util.HashMap;
import java.util.Map;

public enum TokenType {

    EOF,
    L_CURLY,
    R_CURLY,
    L_BRACKET,
    R_BRACKET,
    L_PAREN,
    R_PAREN,
    COMMA,
    COLON,
    SEMI,
    DOT_DOT_DOT,
    QUES_DOT,
    DOT,
    //==== keywords
    NULL(true),
    TRUE(true),
    FALSE(true),
    FUNCTION(true),
    RETURN(true),
    THROW(true),
    NEW(true),
    VAR(true),
    LET(true),
    CONST(true),
    IF(true),
    ELSE(true),
    TYPEOF(true),
    INSTANCEOF(true),
    DELETE(true),
    IN(true),
    THIS(true),
    VOID(true),
    IMPORT(true),
    EXPORT(true),
    DEFAULT(true),
    //==== operators
    EQ_EQ_EQ,
    EQ_EQ,
    EQ,
    EQ_GT, // arrow
    LT_LT_EQ,
    LT_LT,
    LT_EQ,
    LT,
    GT_GT_GT_EQ,
    GT_GT_GT,
    GT_GT_EQ,
    GT_GT,
    GT_EQ,
    GT,
    NOT_EQ_EQ,
    NOT_EQ,
    NOT,
    PIPE_PIPE_EQ,
    PIPE_PIPE,
    PIPE_EQ,
    PIPE,
    AMP_AMP_EQ,
    AMP_AMP,
    AMP_EQ,
    AMP,
    CARET_EQ,
    CARET,
    QUES_QUES_EQ,
    QUES_QUES,
    QUES,
    PLUS_PLUS,
    PLUS_EQ,
    PLUS,
    MINUS_MINUS,
    MINUS_EQ,
    MINUS,
    STAR_STAR_EQ,
    STAR_STAR,
    STAR_EQ,
    STAR,
    SLASH_EQ,
    SLASH,
    PERCENT_EQ,
    PERCENT,
    TILDE,
    //==== literals
    S_STRING,
    D_STRING,
    NUMBER,
    IDENT,
    //==== jsx
    JSX_IDENT,
    JSX_TEXT;

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : values()) {
            if (type.keyword) {
                KEYWORDS.put(type.name().toLowerCase(), type);
            }
        }
    }

    public final boolean keyword;

    TokenType() {
        this(false);
    }

    TokenType(boolean keyword) {
        this.keyword = keyword;
    }

    static TokenType keyword(String text) {
        return KEYWORDS.get(text);
    }

    public boolean oneOf(TokenType... types) {
        for (TokenType type : types) {
            if (this == type) {
                return true;
            }
        }
        return false;
    }

    public boolean isAssignment() {
        return switch (this) {
            case EQ, PLUS_EQ, MINUS_EQ, STAR_EQ, SLASH_EQ, PERCENT_EQ, STAR_STAR_EQ, LT_LT_EQ, GT_GT_EQ, GT_GT_GT_EQ,
                 AMP_EQ, PIPE_EQ, CARET_EQ, AMP_AMP_EQ, PIPE_PIPE_EQ, QUES_QUES_EQ -> true;
            default -> false;
        };
    }

    /**
     * @return binding power of a binary operator, or 0 when the token is not one
     */
    public int precedence() {
        return switch (this) {
            case QUES_QUES -> 1;
            case PIPE_PIPE -> 2;
            case AMP_AMP -> 3;
            case PIPE -> 4;
            case CARET -> 5;
            case AMP -> 6;
            case EQ_EQ, NOT_EQ, EQ_EQ_EQ, NOT_EQ_EQ -> 7;
            case LT, GT, LT_EQ, GT_EQ, INSTANCEOF, IN -> 8;
            case LT_LT, GT_GT, GT_GT_GT -> 9;
            case PLUS, MINUS -> 10;
            case STAR, SLASH, PERCENT -> 11;
            case STAR_STAR -> 12;
            default -> 0;
        };
    }

    public boolean isLogical() {
        return oneOf(PIPE_PIPE, AMP_AMP, QUES_QUES);
    }

}
