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
package io.jsweave.codegen;

import io.jsweave.ast.*;
import io.jsweave.parser.JsParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodegenTest {

    static final AstBuilder ast = AstBuilder.INSTANCE;

    @Test
    void testLiterals() {
        assertEquals("\"a\\\"b\\\\c\\n\"", Codegen.generate(ast.stringLiteral("a\"b\\c\n")));
        assertEquals("3", Codegen.generate(ast.numericLiteral(3)));
        assertEquals("1.5", Codegen.generate(ast.numericLiteral(1.5)));
        assertEquals("true", Codegen.generate(ast.booleanLiteral(true)));
        assertEquals("null", Codegen.generate(ast.nullLiteral()));
    }

    @Test
    void testLeadingFunctionWrapped() {
        FunctionNode fn = ast.functionExpression(null, false, false, ast.formalParameters(List.of()), ast.functionBody(List.of()));
        Statement statement = ast.expressionStatement(ast.call(fn, List.of()));
        assertEquals("(function () {}());", Codegen.generate(statement));
    }

    @Test
    void testGeneratedNodes() {
        IdentifierReference x = ast.identifierReference("x");
        FunctionBody body = ast.functionBody(List.of(ast.returnStatement(ast.yield(false, x))));
        FunctionNode generator = ast.functionExpression(null, false, true, ast.formalParameters(List.of()), body);
        assertEquals("function* () { return yield x; }", Codegen.generate(generator));
        assertEquals("yield* x", Codegen.generate(ast.yield(true, x)));
        assertEquals("yield", Codegen.generate(ast.yield(false, null)));
        Statement decl = ast.variableDeclaration(VariableDeclaration.Kind.CONST, new BindingIdentifier(Span.EMPTY, "y"),
                ast.staticMember(ast.thisExpression(), "value"));
        assertEquals("const y = this.value;", Codegen.generate(decl));
        assertEquals("{}", Codegen.generate(ast.blockStatement(List.of())));
        assertEquals("(x)", Codegen.generate(ast.parenthesized(x)));
    }

    @Test
    void testArrowObjectBody() {
        Program program = JsParser.parse("const f = () => ({});");
        assertEquals("const f = () => ({});", Codegen.generate(program));
    }

    @Test
    void testJsxAttributeQuotes() {
        Program program = JsParser.parse("<a title='say \"hi\"' alt='x' />;");
        assertEquals("<a title='say \"hi\"' alt=\"x\" />;", Codegen.generate(program));
    }

}
