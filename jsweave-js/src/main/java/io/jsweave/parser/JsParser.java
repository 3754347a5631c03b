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

import io.jsweave.ast.*;
import io.jsweave.common.Source;

import java.util.ArrayList;
import java.util.List;

import static io.jsweave.parser.TokenType.*;

/**
 * Recursive-descent parser for the JavaScript and JSX subset. Binary operators use binding
 * powers from {@link TokenType#precedence()}. Parentheses are kept as
 * {@link ParenthesizedExpression} nodes so spans and printing stay faithful to the source.
 * <p>
 * Not supported: classes, loops, switch, try, template literals, regular expressions,
 * rest and spread in patterns, export lists.
 */
public class JsParser extends BaseParser {

    private boolean inAsync;
    private boolean inGenerator;
    private int functionDepth;
    private int jsxClosingStart;

    public JsParser(Source source) {
        super(source);
    }

    public static Program parse(String text) {
        return new JsParser(Source.of(text)).parse();
    }

    public static Program parse(Source source) {
        return new JsParser(source).parse();
    }

    public Program parse() {
        List<Statement> body = new ArrayList<>();
        while (!is(EOF)) {
            body.add(parseStatement(true));
        }
        return new Program(new Span(0, source.length()), body);
    }

    // ========== Statements ==========

    private Statement parseStatement(boolean topLevel) {
        int start = current.start();
        switch (current.type()) {
            case L_CURLY:
                return parseBlock();
            case VAR:
            case LET:
            case CONST: {
                VariableDeclaration decl = parseVariableDeclaration(start);
                semi();
                decl.span = span(start);
                return decl;
            }
            case FUNCTION:
                return parseFunction(start, false, FunctionNode.Type.DECLARATION, true);
            case RETURN: {
                next();
                Expression argument = null;
                if (!is(SEMI) && !is(R_CURLY) && !is(EOF) && !current.newlineBefore()) {
                    argument = parseExpression();
                }
                semi();
                return new ReturnStatement(span(start), argument);
            }
            case IF: {
                next();
                expect(L_PAREN);
                Expression test = parseExpression();
                expect(R_PAREN);
                Statement consequent = parseStatement(false);
                Statement alternate = accept(ELSE) ? parseStatement(false) : null;
                return new IfStatement(span(start), test, consequent, alternate);
            }
            case THROW: {
                next();
                if (current.newlineBefore()) {
                    error("illegal newline after throw");
                }
                Expression argument = parseExpression();
                semi();
                return new ThrowStatement(span(start), argument);
            }
            case SEMI:
                next();
                return new EmptyStatement(span(start));
            case IMPORT:
                if (!topLevel) {
                    error("import declarations may only appear at top level");
                }
                return parseImport(start);
            case EXPORT:
                if (!topLevel) {
                    error("export declarations may only appear at top level");
                }
                return parseExport(start);
            default:
                if (isAsyncFunctionAhead()) {
                    next();
                    return parseFunction(start, true, FunctionNode.Type.DECLARATION, true);
                }
                Expression expression = parseExpression();
                semi();
                return new ExpressionStatement(span(start), expression);
        }
    }

    private void semi() {
        if (is(SEMI)) {
            next();
        } else if (!is(R_CURLY) && !is(EOF) && !current.newlineBefore()) {
            error(SEMI);
        }
    }

    private boolean isAsyncFunctionAhead() {
        if (!isIdent("async")) {
            return false;
        }
        Token ahead = peekToken();
        return ahead.type() == FUNCTION && !ahead.newlineBefore();
    }

    private BlockStatement parseBlock() {
        int start = current.start();
        expect(L_CURLY);
        List<Statement> body = new ArrayList<>();
        while (!is(R_CURLY) && !is(EOF)) {
            body.add(parseStatement(false));
        }
        expect(R_CURLY);
        return new BlockStatement(span(start), body);
    }

    private VariableDeclaration parseVariableDeclaration(int start) {
        VariableDeclaration.Kind kind = switch (next().type()) {
            case LET -> VariableDeclaration.Kind.LET;
            case CONST -> VariableDeclaration.Kind.CONST;
            default -> VariableDeclaration.Kind.VAR;
        };
        List<VariableDeclarator> declarators = new ArrayList<>();
        do {
            int declStart = current.start();
            BindingPattern id = parseBindingPattern();
            Expression init = accept(EQ) ? parseAssignment() : null;
            declarators.add(new VariableDeclarator(span(declStart), id, init));
        } while (accept(COMMA));
        return new VariableDeclaration(span(start), kind, declarators);
    }

    private ImportDeclaration parseImport(int start) {
        next();
        List<ImportDeclarationSpecifier> specifiers = new ArrayList<>();
        if (is(D_STRING) || is(S_STRING)) {
            StringLiteral moduleName = parseStringLiteral();
            semi();
            return new ImportDeclaration(span(start), specifiers, moduleName);
        }
        boolean more = true;
        if (is(IDENT)) {
            BindingIdentifier local = parseBindingIdentifier();
            specifiers.add(new ImportDefaultSpecifier(local.span, local));
            more = accept(COMMA);
        }
        if (more && is(STAR)) {
            int specStart = current.start();
            next();
            expectIdent("as");
            BindingIdentifier local = parseBindingIdentifier();
            specifiers.add(new ImportNamespaceSpecifier(span(specStart), local));
        } else if (more && is(L_CURLY)) {
            next();
            while (!is(R_CURLY)) {
                int specStart = current.start();
                Token imported = current;
                String importedName;
                if (is(D_STRING) || is(S_STRING)) {
                    importedName = parseStringLiteral().value;
                } else if (current.isIdentifierName()) {
                    importedName = next().text();
                } else {
                    throw unexpected();
                }
                BindingIdentifier local;
                if (isIdent("as")) {
                    next();
                    local = parseBindingIdentifier();
                } else {
                    if (imported.type() != IDENT) {
                        error("expected 'as' after " + imported.text(), imported.start());
                    }
                    local = new BindingIdentifier(imported.span(), importedName);
                }
                specifiers.add(new ImportSpecifier(span(specStart), importedName, local));
                if (!accept(COMMA)) {
                    break;
                }
            }
            expect(R_CURLY);
        } else if (more) {
            throw unexpected();
        }
        expectIdent("from");
        if (!is(D_STRING) && !is(S_STRING)) {
            error(D_STRING, S_STRING);
        }
        StringLiteral moduleName = parseStringLiteral();
        semi();
        return new ImportDeclaration(span(start), specifiers, moduleName);
    }

    private Statement parseExport(int start) {
        next();
        if (accept(DEFAULT)) {
            int declStart = current.start();
            Expression declaration;
            if (is(FUNCTION)) {
                declaration = parseFunction(declStart, false, FunctionNode.Type.DECLARATION, false);
            } else if (isAsyncFunctionAhead()) {
                next();
                declaration = parseFunction(declStart, true, FunctionNode.Type.DECLARATION, false);
            } else {
                declaration = parseAssignment();
                semi();
            }
            return new ExportDefaultDeclaration(span(start), declaration);
        }
        if (is(VAR) || is(LET) || is(CONST) || is(FUNCTION) || isAsyncFunctionAhead()) {
            Statement declaration = parseStatement(false);
            return new ExportNamedDeclaration(span(start), declaration);
        }
        error("export lists are not supported");
        return null;
    }

    private void expectIdent(String name) {
        if (!isIdent(name)) {
            error("expected: " + name + " but found: " + current);
        }
        next();
    }

    // ========== Functions ==========

    private FunctionNode parseFunction(int start, boolean async, FunctionNode.Type type, boolean idRequired) {
        expect(FUNCTION);
        boolean generator = accept(STAR);
        BindingIdentifier id = null;
        if (is(IDENT)) {
            id = parseBindingIdentifier();
        } else if (idRequired) {
            error(IDENT);
        }
        return parseFunctionRest(start, type, id, async, generator);
    }

    private FunctionNode parseFunctionRest(int start, FunctionNode.Type type, BindingIdentifier id, boolean async, boolean generator) {
        boolean savedAsync = inAsync;
        boolean savedGenerator = inGenerator;
        inAsync = async;
        inGenerator = generator;
        functionDepth++;
        try {
            FormalParameters params = parseFormalParameters();
            FunctionBody body = parseFunctionBody();
            return new FunctionNode(span(start), type, id, async, generator, params, body);
        } finally {
            inAsync = savedAsync;
            inGenerator = savedGenerator;
            functionDepth--;
        }
    }

    private FormalParameters parseFormalParameters() {
        int start = current.start();
        expect(L_PAREN);
        List<BindingPattern> items = new ArrayList<>();
        while (!is(R_PAREN)) {
            if (is(DOT_DOT_DOT)) {
                error("rest parameters are not supported");
            }
            items.add(parseBindingElement());
            if (!accept(COMMA)) {
                break;
            }
        }
        expect(R_PAREN);
        return new FormalParameters(span(start), items);
    }

    private FunctionBody parseFunctionBody() {
        int start = current.start();
        expect(L_CURLY);
        List<Statement> statements = new ArrayList<>();
        while (!is(R_CURLY) && !is(EOF)) {
            statements.add(parseStatement(false));
        }
        expect(R_CURLY);
        return new FunctionBody(span(start), statements);
    }

    private boolean isArrowAhead() {
        if (is(IDENT)) {
            Token ahead = peekToken();
            if (isIdent("async") && !ahead.newlineBefore()) {
                if (ahead.type() == IDENT) {
                    return lexer.scan(ahead.end()).type() == EQ_GT;
                }
                if (ahead.type() == L_PAREN) {
                    return isParenthesizedArrow(ahead);
                }
            }
            return ahead.type() == EQ_GT;
        }
        return is(L_PAREN) && isParenthesizedArrow(current);
    }

    private boolean isParenthesizedArrow(Token lparen) {
        int depth = 0;
        Token token = lparen;
        try {
            while (token.type() != EOF) {
                if (token.type().oneOf(L_PAREN, L_BRACKET, L_CURLY)) {
                    depth++;
                } else if (token.type().oneOf(R_PAREN, R_BRACKET, R_CURLY)) {
                    depth--;
                    if (depth == 0) {
                        Token after = lexer.scan(token.end());
                        return after.type() == EQ_GT && !after.newlineBefore();
                    }
                }
                token = lexer.scan(token.end());
            }
        } catch (ParserException e) {
            // jsx text or other input the script lexer cannot read, so not an arrow head
            logger.trace("arrow lookahead stopped: {}", e.getMessage());
        }
        return false;
    }

    private ArrowFunctionExpression parseArrow(int start) {
        boolean async = false;
        if (isIdent("async") && peekToken().type() != EQ_GT) {
            next();
            async = true;
        }
        FormalParameters params;
        if (is(IDENT)) {
            BindingIdentifier param = parseBindingIdentifier();
            params = new FormalParameters(param.span, List.of(param));
        } else {
            params = parseFormalParameters();
        }
        expect(EQ_GT);
        boolean savedAsync = inAsync;
        boolean savedGenerator = inGenerator;
        inAsync = async;
        inGenerator = false;
        functionDepth++;
        try {
            if (is(L_CURLY)) {
                FunctionBody body = parseFunctionBody();
                return new ArrowFunctionExpression(span(start), async, false, params, body);
            }
            Expression expression = parseAssignment();
            Span bodySpan = expression.getSpan();
            FunctionBody body = new FunctionBody(bodySpan, List.of(new ExpressionStatement(bodySpan, expression)));
            return new ArrowFunctionExpression(span(start), async, true, params, body);
        } finally {
            inAsync = savedAsync;
            inGenerator = savedGenerator;
            functionDepth--;
        }
    }

    // ========== Patterns ==========

    private BindingPattern parseBindingElement() {
        int start = current.start();
        BindingPattern target = parseBindingPattern();
        if (accept(EQ)) {
            return new AssignmentPattern(span(start), target, parseAssignment());
        }
        return target;
    }

    private BindingPattern parseBindingPattern() {
        switch (current.type()) {
            case IDENT:
                return parseBindingIdentifier();
            case L_CURLY:
                return parseObjectPattern();
            case L_BRACKET:
                return parseArrayPattern();
            default:
                throw unexpected();
        }
    }

    private BindingIdentifier parseBindingIdentifier() {
        Token token = expect(IDENT);
        return new BindingIdentifier(token.span(), token.text());
    }

    private ObjectPattern parseObjectPattern() {
        int start = current.start();
        expect(L_CURLY);
        List<BindingProperty> properties = new ArrayList<>();
        while (!is(R_CURLY)) {
            if (is(DOT_DOT_DOT)) {
                error("rest elements are not supported");
            }
            int propStart = current.start();
            Token keyToken = current;
            boolean computed = false;
            PropertyKey key;
            if (accept(L_BRACKET)) {
                key = parseAssignment();
                expect(R_BRACKET);
                computed = true;
            } else {
                key = parsePropertyName();
            }
            BindingPattern value;
            boolean shorthand = false;
            if (accept(COLON)) {
                value = parseBindingElement();
            } else {
                if (computed || keyToken.type() != IDENT) {
                    error(COLON);
                }
                shorthand = true;
                value = new BindingIdentifier(keyToken.span(), keyToken.text());
                if (accept(EQ)) {
                    value = new AssignmentPattern(span(propStart), value, parseAssignment());
                }
            }
            properties.add(new BindingProperty(span(propStart), key, value, shorthand, computed));
            if (!accept(COMMA)) {
                break;
            }
        }
        expect(R_CURLY);
        return new ObjectPattern(span(start), properties);
    }

    private ArrayPattern parseArrayPattern() {
        int start = current.start();
        expect(L_BRACKET);
        List<BindingPattern> elements = new ArrayList<>();
        while (!is(R_BRACKET)) {
            if (accept(COMMA)) {
                elements.add(null);
                continue;
            }
            if (is(DOT_DOT_DOT)) {
                error("rest elements are not supported");
            }
            elements.add(parseBindingElement());
            if (!is(R_BRACKET)) {
                expect(COMMA);
            }
        }
        expect(R_BRACKET);
        return new ArrayPattern(span(start), elements);
    }

    private PropertyKey parsePropertyName() {
        if (is(D_STRING) || is(S_STRING)) {
            return parseStringLiteral();
        }
        if (is(NUMBER)) {
            return parseNumericLiteral();
        }
        if (current.isIdentifierName()) {
            Token token = next();
            return new IdentifierName(token.span(), token.text());
        }
        throw unexpected();
    }

    // ========== Expressions ==========

    private Expression parseExpression() {
        int start = current.start();
        Expression first = parseAssignment();
        if (!is(COMMA)) {
            return first;
        }
        List<Expression> expressions = new ArrayList<>();
        expressions.add(first);
        while (accept(COMMA)) {
            expressions.add(parseAssignment());
        }
        return new SequenceExpression(span(start), expressions);
    }

    private Expression parseAssignment() {
        int start = current.start();
        if (isArrowAhead()) {
            return parseArrow(start);
        }
        if (inGenerator && isIdent("yield")) {
            return parseYield(start);
        }
        Expression left = parseConditional();
        if (current.type().isAssignment()) {
            AssignmentTarget target = toAssignmentTarget(left);
            String operator = next().text();
            Expression right = parseAssignment();
            return new AssignmentExpression(span(start), operator, target, right);
        }
        return left;
    }

    private AssignmentTarget toAssignmentTarget(Expression expression) {
        Expression inner = expression.withoutParentheses();
        if (inner instanceof IdentifierReference || inner instanceof MemberExpression) {
            return (AssignmentTarget) inner;
        }
        error("invalid assignment target", expression.getSpan().start());
        return null;
    }

    private YieldExpression parseYield(int start) {
        next();
        boolean delegate = accept(STAR);
        Expression argument = null;
        if (delegate || !(current.newlineBefore() || current.type().oneOf(R_PAREN, R_BRACKET, R_CURLY, COMMA, SEMI, COLON, EOF))) {
            argument = parseAssignment();
        }
        return new YieldExpression(span(start), delegate, argument);
    }

    private Expression parseConditional() {
        int start = current.start();
        Expression test = parseBinary(0);
        if (!accept(QUES)) {
            return test;
        }
        Expression consequent = parseAssignment();
        expect(COLON);
        Expression alternate = parseAssignment();
        return new ConditionalExpression(span(start), test, consequent, alternate);
    }

    private Expression parseBinary(int minPrecedence) {
        int start = current.start();
        Expression left = parseUnary();
        while (true) {
            TokenType type = current.type();
            int precedence = type.precedence();
            if (precedence == 0 || precedence <= minPrecedence) {
                break;
            }
            String operator = next().text();
            // exponent is right associative
            Expression right = parseBinary(type == STAR_STAR ? precedence - 1 : precedence);
            if (type.isLogical()) {
                left = new LogicalExpression(span(start), left, operator, right);
            } else {
                left = new BinaryExpression(span(start), left, operator, right);
            }
        }
        return left;
    }

    private Expression parseUnary() {
        int start = current.start();
        switch (current.type()) {
            case NOT:
            case MINUS:
            case PLUS:
            case TILDE:
            case TYPEOF:
            case VOID:
            case DELETE: {
                String operator = next().text();
                Expression argument = parseUnary();
                return new UnaryExpression(span(start), operator, argument);
            }
            case PLUS_PLUS:
            case MINUS_MINUS: {
                String operator = next().text();
                Expression argument = parseUnary();
                return new UpdateExpression(span(start), operator, true, toAssignmentTarget(argument));
            }
            default:
                if (isAwaitAhead()) {
                    next();
                    Expression argument = parseUnary();
                    return new AwaitExpression(span(start), argument);
                }
                return parsePostfix();
        }
    }

    private boolean isAwaitAhead() {
        if (!isIdent("await")) {
            return false;
        }
        if (inAsync) {
            return true;
        }
        if (functionDepth > 0) {
            return false;
        }
        // top level await, unless used as a plain identifier
        Token ahead = peekToken();
        return !ahead.newlineBefore()
                && !ahead.type().oneOf(SEMI, R_PAREN, R_BRACKET, R_CURLY, COMMA, COLON, DOT, QUES_DOT, EOF)
                && !ahead.type().isAssignment() && ahead.type().precedence() == 0;
    }

    private Expression parsePostfix() {
        int start = current.start();
        Expression expression = parseLeftHandSide();
        if ((is(PLUS_PLUS) || is(MINUS_MINUS)) && !current.newlineBefore()) {
            AssignmentTarget target = toAssignmentTarget(expression);
            String operator = next().text();
            return new UpdateExpression(span(start), operator, false, target);
        }
        return expression;
    }

    private Expression parseLeftHandSide() {
        int start = current.start();
        Expression expression = is(NEW) ? parseNew() : parsePrimary();
        return parseCallTail(start, expression, true);
    }

    private Expression parseNew() {
        int start = current.start();
        expect(NEW);
        int calleeStart = current.start();
        Expression callee = is(NEW) ? parseNew() : parsePrimary();
        callee = parseCallTail(calleeStart, callee, false);
        List<Argument> arguments = is(L_PAREN) ? parseArguments() : List.of();
        return new NewExpression(span(start), callee, arguments);
    }

    private Expression parseCallTail(int start, Expression expression, boolean allowCalls) {
        while (true) {
            if (accept(DOT)) {
                IdentifierName property = parseIdentifierName();
                expression = new StaticMemberExpression(span(start), expression, property, false);
            } else if (allowCalls && accept(QUES_DOT)) {
                if (is(L_PAREN)) {
                    List<Argument> arguments = parseArguments();
                    expression = new CallExpression(span(start), expression, arguments, true);
                } else if (accept(L_BRACKET)) {
                    Expression property = parseExpression();
                    expect(R_BRACKET);
                    expression = new ComputedMemberExpression(span(start), expression, property, true);
                } else {
                    IdentifierName property = parseIdentifierName();
                    expression = new StaticMemberExpression(span(start), expression, property, true);
                }
            } else if (accept(L_BRACKET)) {
                Expression property = parseExpression();
                expect(R_BRACKET);
                expression = new ComputedMemberExpression(span(start), expression, property, false);
            } else if (allowCalls && is(L_PAREN)) {
                List<Argument> arguments = parseArguments();
                expression = new CallExpression(span(start), expression, arguments, false);
            } else {
                return expression;
            }
        }
    }

    private List<Argument> parseArguments() {
        expect(L_PAREN);
        List<Argument> arguments = new ArrayList<>();
        while (!is(R_PAREN)) {
            int start = current.start();
            if (accept(DOT_DOT_DOT)) {
                Expression argument = parseAssignment();
                arguments.add(new SpreadElement(span(start), argument));
            } else {
                arguments.add(parseAssignment());
            }
            if (!accept(COMMA)) {
                break;
            }
        }
        expect(R_PAREN);
        return arguments;
    }

    private IdentifierName parseIdentifierName() {
        if (!current.isIdentifierName()) {
            error(IDENT);
        }
        Token token = next();
        return new IdentifierName(token.span(), token.text());
    }

    private Expression parsePrimary() {
        int start = current.start();
        Token token = current;
        switch (token.type()) {
            case IDENT:
                if (isAsyncFunctionAhead()) {
                    next();
                    return parseFunction(start, true, FunctionNode.Type.EXPRESSION, false);
                }
                next();
                return new IdentifierReference(token.span(), token.text());
            case THIS:
                next();
                return new ThisExpression(token.span());
            case NULL:
                next();
                return new NullLiteral(token.span());
            case TRUE:
            case FALSE:
                next();
                return new BooleanLiteral(token.span(), token.type() == TRUE);
            case NUMBER:
                return parseNumericLiteral();
            case D_STRING:
            case S_STRING:
                return parseStringLiteral();
            case L_BRACKET:
                return parseArray();
            case L_CURLY:
                return parseObject();
            case L_PAREN: {
                next();
                Expression expression = parseExpression();
                expect(R_PAREN);
                return new ParenthesizedExpression(span(start), expression);
            }
            case FUNCTION:
                return parseFunction(start, false, FunctionNode.Type.EXPRESSION, false);
            case LT:
                return parseJsx();
            default:
                throw unexpected();
        }
    }

    private NumericLiteral parseNumericLiteral() {
        Token token = expect(NUMBER);
        String raw = token.text();
        double value;
        try {
            if (raw.length() > 2 && (raw.charAt(1) == 'x' || raw.charAt(1) == 'X')) {
                value = Long.parseLong(raw.substring(2), 16);
            } else {
                value = Double.parseDouble(raw);
            }
        } catch (NumberFormatException e) {
            throw exception("invalid number: " + raw, token.start());
        }
        return new NumericLiteral(token.span(), value, raw);
    }

    private StringLiteral parseStringLiteral() {
        Token token = next();
        return new StringLiteral(token.span(), unescape(token.text()));
    }

    private ArrayExpression parseArray() {
        int start = current.start();
        expect(L_BRACKET);
        List<ArrayElement> elements = new ArrayList<>();
        while (!is(R_BRACKET)) {
            int elementStart = current.start();
            if (is(COMMA)) {
                elements.add(new Elision(new Span(elementStart, elementStart)));
                next();
                continue;
            }
            if (accept(DOT_DOT_DOT)) {
                Expression argument = parseAssignment();
                elements.add(new SpreadElement(span(elementStart), argument));
            } else {
                elements.add(parseAssignment());
            }
            if (!is(R_BRACKET)) {
                expect(COMMA);
            }
        }
        expect(R_BRACKET);
        return new ArrayExpression(span(start), elements);
    }

    private ObjectExpression parseObject() {
        int start = current.start();
        expect(L_CURLY);
        List<ObjectPropertyKind> properties = new ArrayList<>();
        while (!is(R_CURLY)) {
            int propStart = current.start();
            if (accept(DOT_DOT_DOT)) {
                Expression argument = parseAssignment();
                properties.add(new SpreadElement(span(propStart), argument));
            } else {
                properties.add(parseObjectProperty(propStart));
            }
            if (!accept(COMMA)) {
                break;
            }
        }
        expect(R_CURLY);
        return new ObjectExpression(span(start), properties);
    }

    private ObjectProperty parseObjectProperty(int start) {
        boolean async = false;
        boolean generator = false;
        if (isIdent("async")) {
            Token ahead = peekToken();
            if (!ahead.newlineBefore() && !ahead.type().oneOf(COLON, COMMA, R_CURLY, L_PAREN)) {
                next();
                async = true;
            }
        }
        if (accept(STAR)) {
            generator = true;
        }
        Token keyToken = current;
        boolean computed = false;
        PropertyKey key;
        if (accept(L_BRACKET)) {
            key = parseAssignment();
            expect(R_BRACKET);
            computed = true;
        } else {
            key = parsePropertyName();
        }
        if (is(L_PAREN)) {
            FunctionNode method = parseFunctionRest(current.start(), FunctionNode.Type.EXPRESSION, null, async, generator);
            return new ObjectProperty(span(start), key, method, false, true, computed);
        }
        if (async || generator) {
            error(L_PAREN);
        }
        if (accept(COLON)) {
            Expression value = parseAssignment();
            return new ObjectProperty(span(start), key, value, false, false, computed);
        }
        if (computed || keyToken.type() != IDENT) {
            error(COLON);
        }
        IdentifierReference value = new IdentifierReference(keyToken.span(), keyToken.text());
        return new ObjectProperty(span(start), key, value, true, false, false);
    }

    static String unescape(String raw) {
        String text = raw.substring(1, raw.length() - 1);
        if (text.indexOf('\\') == -1) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i++);
            if (c != '\\' || i >= text.length()) {
                sb.append(c);
                continue;
            }
            char e = text.charAt(i++);
            switch (e) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'v' -> sb.append('\u000B');
                case '0' -> sb.append('\0');
                case '\n' -> {
                    // line continuation
                }
                case 'x' -> {
                    sb.append((char) Integer.parseInt(text.substring(i, Math.min(i + 2, text.length())), 16));
                    i += 2;
                }
                case 'u' -> {
                    if (i < text.length() && text.charAt(i) == '{') {
                        int close = text.indexOf('}', i);
                        sb.appendCodePoint(Integer.parseInt(text.substring(i + 1, close), 16));
                        i = close + 1;
                    } else {
                        sb.append((char) Integer.parseInt(text.substring(i, Math.min(i + 4, text.length())), 16));
                        i += 4;
                    }
                }
                default -> sb.append(e);
            }
        }
        return sb.toString();
    }

    // ========== JSX ==========

    private Expression parseJsx() {
        int start = current.start();
        nextJsxTag();
        Expression element = parseJsxAfterLt(start);
        next(); // past the final '>', back to script mode
        return element;
    }

    /**
     * Parses an element or fragment whose {@code <} is already consumed. Leaves the closing
     * {@code >} as the current token.
     */
    private Expression parseJsxAfterLt(int start) {
        if (is(GT)) {
            JsxOpeningFragment opening = new JsxOpeningFragment(new Span(start, current.end()));
            List<JsxChild> children = parseJsxChildren();
            int closeStart = jsxClosingStart;
            nextJsxTag();
            if (!is(GT)) {
                error("expected corresponding closing tag for fragment", closeStart);
            }
            JsxClosingFragment closing = new JsxClosingFragment(new Span(closeStart, current.end()));
            return new JsxFragment(new Span(start, current.end()), opening, children, closing);
        }
        JsxElementName name = parseJsxElementName();
        List<JsxAttributeItem> attributes = new ArrayList<>();
        while (true) {
            if (is(JSX_IDENT)) {
                attributes.add(parseJsxAttribute());
            } else if (is(L_CURLY)) {
                attributes.add(parseJsxSpreadAttribute());
            } else {
                break;
            }
        }
        if (is(SLASH)) {
            nextJsxTag();
            if (!is(GT)) {
                error(GT);
            }
            JsxOpeningElement opening = new JsxOpeningElement(new Span(start, current.end()), name, attributes, true);
            return new JsxElement(new Span(start, current.end()), opening, List.of(), null);
        }
        if (!is(GT)) {
            error(GT);
        }
        JsxOpeningElement opening = new JsxOpeningElement(new Span(start, current.end()), name, attributes, false);
        List<JsxChild> children = parseJsxChildren();
        int closeStart = jsxClosingStart;
        nextJsxTag();
        if (!is(JSX_IDENT)) {
            error("expected corresponding closing tag for <" + jsxName(name) + ">", closeStart);
        }
        JsxElementName closeName = parseJsxElementName();
        if (!is(GT)) {
            error(GT);
        }
        if (!jsxName(closeName).equals(jsxName(name))) {
            error("expected corresponding closing tag for <" + jsxName(name) + ">", closeStart);
        }
        JsxClosingElement closing = new JsxClosingElement(new Span(closeStart, current.end()), closeName);
        return new JsxElement(new Span(start, current.end()), opening, children, closing);
    }

    /**
     * Starts on the {@code >} of an opening tag and stops on the {@code /} of the matching
     * closing tag, recording where that tag starts.
     */
    private List<JsxChild> parseJsxChildren() {
        List<JsxChild> children = new ArrayList<>();
        while (true) {
            nextJsxChild();
            switch (current.type()) {
                case JSX_TEXT:
                    children.add(new JsxText(current.span(), current.text()));
                    break;
                case L_CURLY:
                    children.add(parseJsxChildContainer());
                    break;
                case LT: {
                    int ltStart = current.start();
                    nextJsxTag();
                    if (is(SLASH)) {
                        jsxClosingStart = ltStart;
                        return children;
                    }
                    children.add((JsxChild) parseJsxAfterLt(ltStart));
                    break;
                }
                default:
                    error("unterminated jsx contents");
            }
        }
    }

    private JsxExpressionContainer parseJsxChildContainer() {
        int start = current.start();
        next();
        if (is(R_CURLY)) {
            return new JsxExpressionContainer(new Span(start, current.end()),
                    new JsxEmptyExpression(new Span(start + 1, current.start())));
        }
        if (is(DOT_DOT_DOT)) {
            error("jsx spread children are not supported");
        }
        Expression expression = parseExpression();
        if (!is(R_CURLY)) {
            error(R_CURLY);
        }
        return new JsxExpressionContainer(new Span(start, current.end()), expression);
    }

    private JsxElementName parseJsxElementName() {
        if (!is(JSX_IDENT)) {
            error(JSX_IDENT);
        }
        Token first = nextJsxTag();
        JsxIdentifier identifier = new JsxIdentifier(first.span(), first.text());
        if (is(COLON)) {
            nextJsxTag();
            if (!is(JSX_IDENT)) {
                error(JSX_IDENT);
            }
            Token second = nextJsxTag();
            return new JsxNamespacedName(new Span(first.start(), second.end()), identifier,
                    new JsxIdentifier(second.span(), second.text()));
        }
        JsxElementName name = identifier;
        while (is(DOT)) {
            nextJsxTag();
            if (!is(JSX_IDENT)) {
                error(JSX_IDENT);
            }
            Token property = nextJsxTag();
            name = new JsxMemberExpression(new Span(first.start(), property.end()), name,
                    new JsxIdentifier(property.span(), property.text()));
        }
        return name;
    }

    private JsxAttribute parseJsxAttribute() {
        Token first = nextJsxTag();
        JsxAttributeName name = new JsxIdentifier(first.span(), first.text());
        if (is(COLON)) {
            nextJsxTag();
            if (!is(JSX_IDENT)) {
                error(JSX_IDENT);
            }
            Token second = nextJsxTag();
            name = new JsxNamespacedName(new Span(first.start(), second.end()), (JsxIdentifier) name,
                    new JsxIdentifier(second.span(), second.text()));
        }
        JsxAttributeValue value = null;
        if (is(EQ)) {
            nextJsxTag();
            switch (current.type()) {
                case D_STRING:
                case S_STRING: {
                    Token token = nextJsxTag();
                    value = new StringLiteral(token.span(), token.text().substring(1, token.text().length() - 1));
                    break;
                }
                case L_CURLY: {
                    int start = current.start();
                    next();
                    if (is(R_CURLY)) {
                        error("jsx attributes must only be assigned a non-empty expression");
                    }
                    Expression expression = parseAssignment();
                    if (!is(R_CURLY)) {
                        error(R_CURLY);
                    }
                    value = new JsxExpressionContainer(new Span(start, current.end()), expression);
                    nextJsxTag();
                    break;
                }
                case LT: {
                    int start = current.start();
                    nextJsxTag();
                    value = (JsxAttributeValue) parseJsxAfterLt(start);
                    nextJsxTag();
                    break;
                }
                default:
                    throw unexpected();
            }
        }
        return new JsxAttribute(span(first.start()), name, value);
    }

    private JsxSpreadAttribute parseJsxSpreadAttribute() {
        int start = current.start();
        next();
        expect(DOT_DOT_DOT);
        Expression argument = parseAssignment();
        if (!is(R_CURLY)) {
            error(R_CURLY);
        }
        Span span = new Span(start, current.end());
        nextJsxTag();
        return new JsxSpreadAttribute(span, argument);
    }

    static String jsxName(JsxElementName name) {
        if (name instanceof JsxIdentifier identifier) {
            return identifier.name;
        }
        if (name instanceof JsxNamespacedName namespaced) {
            return namespaced.namespace.name + ":" + namespaced.name.name;
        }
        JsxMemberExpression member = (JsxMemberExpression) name;
        return jsxName(member.object) + "." + member.property.name;
    }

}
