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
package io.jsweave.transform;

import io.jsweave.ast.*;
import io.jsweave.semantic.CompilationUnit;
import io.jsweave.semantic.SemanticBuilder;
import io.jsweave.semantic.SymbolId;
import io.jsweave.semantic.SymbolTable;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AsyncToGeneratorTest {

    private static String transform(String text) {
        TransformResult result = new Transformer().transform(text);
        assertTrue(result.failures().isEmpty(), result.failures().toString());
        assertFalse(result.isAborted());
        return result.code();
    }

    private static void same(String text) {
        assertEquals(text, transform(text));
    }

    @Test
    void testFunctionDeclaration() {
        assertEquals("function f(a) { return babelHelpers.asyncToGenerator(this, null, function* () { return yield g(a); }); }",
                transform("async function f(a) { return await g(a); }"));
        assertEquals("function f() { return babelHelpers.asyncToGenerator(this, null, function* () {}); }",
                transform("async function f() {}"));
    }

    @Test
    void testFunctionExpression() {
        assertEquals("const f = function () { return babelHelpers.asyncToGenerator(this, null, function* () { yield x; }); };",
                transform("const f = async function () { await x; };"));
    }

    @Test
    void testArrow() {
        assertEquals("const f = (x) => babelHelpers.asyncToGenerator(this, null, function* () { return yield x; });",
                transform("const f = async (x) => await x;"));
        assertEquals("const f = () => babelHelpers.asyncToGenerator(this, null, function* () { yield a; b(); });",
                transform("const f = async () => { await a; b(); };"));
    }

    @Test
    void testMethod() {
        assertEquals("const o = { load() { return babelHelpers.asyncToGenerator(this, null, function* () { return yield x; }); } };",
                transform("const o = { async load() { return await x; } };"));
    }

    @Test
    void testNested() {
        assertEquals("function outer() { return babelHelpers.asyncToGenerator(this, null, function* () { "
                        + "const inner = () => babelHelpers.asyncToGenerator(this, null, function* () { return yield 1; }); "
                        + "return yield inner(); }); }",
                transform("async function outer() { const inner = async () => await 1; return await inner(); }"));
        assertEquals("function f() { return babelHelpers.asyncToGenerator(this, null, function* () { "
                        + "function g() { return await; } yield g(); }); }",
                transform("async function f() { function g() { return await; } await g(); }"));
    }

    @Test
    void testPrecedence() {
        assertEquals("function f() { return babelHelpers.asyncToGenerator(this, null, function* () { "
                        + "return (yield a) + (yield b).c; }); }",
                transform("async function f() { return await a + (await b).c; }"));
        assertEquals("function f() { return babelHelpers.asyncToGenerator(this, null, function* () { "
                        + "x = yield a; g(yield b, [yield c]); }); }",
                transform("async function f() { x = await a; g(await b, [await c]); }"));
    }

    @Test
    void testUntouched() {
        same("await x;");
        same("async function* gen() { await x; }");
        same("function plain() { return 1; }");
        same("const f = (x) => x;");
    }

    @Test
    void testIdempotent() {
        String once = transform("async function f(a) { const b = await a; return async () => b; }");
        assertEquals(once, transform(once));
    }

    @Test
    void testGeneratorScope() {
        CompilationUnit unit = SemanticBuilder.parse("async function f(a) { return await a; }");
        int scopes = unit.getSymbols().getScopeCount();
        new Transformer().transform(unit);
        FunctionNode f = (FunctionNode) unit.getProgram().body.get(0);
        assertFalse(f.async);
        ReturnStatement ret = (ReturnStatement) f.body.statements.get(0);
        CallExpression call = (CallExpression) ret.argument;
        FunctionNode generator = (FunctionNode) call.arguments.get(2);
        assertTrue(generator.generator);
        assertEquals(scopes + 1, unit.getSymbols().getScopeCount());
        assertEquals(f.getScopeId(), unit.getSymbols().getScope(generator.getScopeId()).parentId);
    }

    @Test
    void testHelperReference() {
        CompilationUnit unit = SemanticBuilder.parse("async function f() {}");
        new Transformer().transform(unit);
        assertTrue(unit.getSymbols().isUnresolvedGlobal("babelHelpers"));

        unit = SemanticBuilder.parse("import babelHelpers from '@babel/runtime/helpers';\nasync function f() {}\nasync function g() {}");
        new Transformer().transform(unit);
        SymbolTable symbols = unit.getSymbols();
        SymbolId helper = symbols.getScope(symbols.getRootScopeId()).getBinding("babelHelpers");
        assertEquals(2, symbols.getSymbol(helper).getReferences().size());
        assertFalse(symbols.isUnresolvedGlobal("babelHelpers"));
    }

    @Test
    void testHelperIgnoresMovedLocal() {
        CompilationUnit unit = SemanticBuilder.parse("async function f() { var babelHelpers; await a; }");
        TransformResult result = new Transformer().transform(unit);
        assertEquals("function f() { return babelHelpers.asyncToGenerator(this, null, function* () { var babelHelpers; yield a; }); }",
                result.code());
        SymbolTable symbols = unit.getSymbols();
        FunctionNode f = (FunctionNode) unit.getProgram().body.get(0);
        SymbolId local = symbols.getBindings(f.getScopeId()).get("babelHelpers");
        assertNotNull(local);
        assertTrue(symbols.getSymbol(local).getReferences().isEmpty());
        assertTrue(symbols.isUnresolvedGlobal("babelHelpers"));
    }

    @Test
    void testCustomHelper() {
        TransformOptions options = TransformOptions.fromJson("{\"helperObject\": \"rt\", \"helperMethod\": \"co\"}");
        TransformResult result = new Transformer(options).transform("const f = async () => 1;");
        assertEquals("const f = () => rt.co(this, null, function* () { return 1; });", result.code());
        assertEquals("(inline)", result.name());
    }

}
