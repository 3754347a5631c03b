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
import io.jsweave.codegen.Codegen;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsParserTest {

    private static void same(String text) {
        assertEquals(text, Codegen.generate(JsParser.parse(text)));
    }

    private static void printed(String text, String expected) {
        assertEquals(expected, Codegen.generate(JsParser.parse(text)));
    }

    private static Expression expr(String text) {
        Program program = JsParser.parse(text);
        return ((ExpressionStatement) program.body.get(0)).expression;
    }

    private static void error(String text) {
        assertThrows(ParserException.class, () -> JsParser.parse(text));
    }

    @Test
    void testDeclarations() {
        same("var a = 1, b;");
        same("let x = a ? b : c;");
        same("const { a, b: [c, d = 2] } = obj;");
        printed("var a = 1\nvar b = 2", "var a = 1;\nvar b = 2;");
    }

    @Test
    void testFunctions() {
        same("function f(a, b = 1) { return a + b; }");
        same("async function g() { await x; }");
        same("function* gen() { yield 1; yield* other(); }");
        same("const f = async (x) => x * 2;");
        printed("x => ({ a: x })", "(x) => ({ a: x });");
        printed("const h = function () {}", "const h = function () {};");
        printed("const o = { async load() { return 1; }, *items() {}, k }",
                "const o = { async load() { return 1; }, *items() {}, k };");
    }

    @Test
    void testExpressions() {
        same("a = b += 1;");
        same("(1 + 2) * 3;");
        same("a?.b?.(c)[d];");
        same("new Foo(1);");
        same("[1, , 2];");
        same("x++ && !y;");
        same("typeof a === \"string\";");
        printed("f(...args, 'x')", "f(...args, \"x\");");
    }

    @Test
    void testPrecedence() {
        BinaryExpression sum = (BinaryExpression) expr("1 + 2 * 3");
        assertEquals("+", sum.operator);
        assertEquals("*", ((BinaryExpression) sum.right).operator);
        LogicalExpression or = (LogicalExpression) expr("a || b && c");
        assertEquals("||", or.operator);
        assertInstanceOf(LogicalExpression.class, or.right);
        BinaryExpression power = (BinaryExpression) expr("2 ** 3 ** 2");
        assertInstanceOf(BinaryExpression.class, power.right);
    }

    @Test
    void testStatements() {
        same("if (a) b(); else { c(); }");
        same("throw new Error(\"x\");");
        same(";");
        printed("function f() { return\n1 }", "function f() { return; 1; }");
    }

    @Test
    void testModules() {
        printed("import React, { useState as us, Children } from 'react';",
                "import React, { useState as us, Children } from \"react\";");
        printed("import * as ns from 'm'", "import * as ns from \"m\";");
        printed("import 'side'", "import \"side\";");
        same("export default function () {}");
        same("export const a = 1;");
    }

    @Test
    void testAwait() {
        assertInstanceOf(AwaitExpression.class, expr("await x"));
        assertInstanceOf(IdentifierReference.class, expr("await"));
        FunctionNode fn = (FunctionNode) JsParser.parse("function f() { await(1); }").body.get(0);
        ExpressionStatement call = (ExpressionStatement) fn.body.statements.get(0);
        assertInstanceOf(CallExpression.class, call.expression);
    }

    @Test
    void testJsx() {
        same("<div className=\"a\" {...rest}>hi {name}<br /></div>;");
        same("<>a</>;");
        same("<Foo.Bar x={1} />;");
        same("<svg:rect />;");
        same("<input disabled />;");
        same("<p>{}</p>;");
        same("items.map((x) => <li key={x}>{x}</li>);");
    }

    @Test
    void testJsxStructure() {
        JsxElement element = (JsxElement) expr("<audio muted><track kind='captions' /></audio>");
        assertEquals("audio", element.openingElement.getIdentifierName());
        assertNull(element.openingElement.getAttribute("muted").value);
        assertEquals(1, element.children.size());
        JsxElement track = (JsxElement) element.children.get(0);
        assertTrue(track.openingElement.selfClosing);
        assertNull(track.closingElement);
        assertEquals("captions", track.openingElement.getAttribute("kind").getStringValue());
        assertEquals("audio", JsParser.jsxName(element.closingElement.name));
    }

    @Test
    void testSpans() {
        Program program = JsParser.parse("foo();\n<audio></audio>;");
        assertEquals(new Span(0, 23), program.span);
        assertEquals(new Span(0, 6), program.body.get(0).getSpan());
        JsxElement audio = (JsxElement) ((ExpressionStatement) program.body.get(1)).expression;
        assertEquals(new Span(7, 22), audio.span);
        assertEquals(new Span(7, 14), audio.openingElement.span);
        assertEquals(new Span(14, 22), audio.closingElement.span);
    }

    @Test
    void testUnescape() {
        assertEquals("a\nb", JsParser.unescape("'a\\nb'"));
        assertEquals("it's", JsParser.unescape("\"it\\'s\""));
        assertEquals("A", JsParser.unescape("'\\u0041'"));
    }

    @Test
    void testErrors() {
        error("a +");
        error("let 1 = 2;");
        error("`tpl`");
        error("<div></span>;");
        error("1 = 2;");
        error("function () {}");
        error("function f() { import 'x'; }");
        error("a b");
    }

    @Test
    void testErrorPosition() {
        ParserException e = assertThrows(ParserException.class, () -> JsParser.parse("let a = 1;\nlet = ;"));
        assertEquals(15, e.getOffset());
        assertTrue(e.getMessage().contains("(inline):2:5"), e.getMessage());
    }

}
