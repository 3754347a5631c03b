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
package io.jsweave.semantic;

import io.jsweave.ast.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SemanticBuilderTest {

    private static Symbol symbol(CompilationUnit unit, ScopeId scopeId, String name) {
        SymbolId id = unit.getSymbols().getScope(scopeId).getBinding(name);
        assertNotNull(id, name + " not bound in " + unit.getSymbols().getScope(scopeId));
        return unit.getSymbols().getSymbol(id);
    }

    private static List<Reference> references(CompilationUnit unit) {
        SymbolTable table = unit.getSymbols();
        List<Reference> list = new ArrayList<>();
        for (int i = 0; i < table.getReferenceCount(); i++) {
            list.add(table.getReference(new ReferenceId(i)));
        }
        return list;
    }

    private static Expression expression(Statement statement) {
        return ((ExpressionStatement) statement).expression;
    }

    @Test
    void testHoisting() {
        CompilationUnit unit = SemanticBuilder.parse("f(); x; function f() {} var x = 1;");
        ScopeId root = unit.getProgram().getScopeId();
        assertEquals(unit.getSymbols().getRootScopeId(), root);
        assertTrue(symbol(unit, root, "f").flags.isFunction());
        assertTrue(symbol(unit, root, "x").flags.contains(SymbolFlags.FUNCTION_SCOPED_VARIABLE));
        assertTrue(unit.getSymbols().getUnresolvedReferences().isEmpty());
    }

    @Test
    void testVarAndLetInBlock() {
        CompilationUnit unit = SemanticBuilder.parse("function g() { { var v = 1; let w = 2; const c = 3; } }");
        FunctionNode g = (FunctionNode) unit.getProgram().body.get(0);
        BlockStatement block = (BlockStatement) g.body.statements.get(0);
        assertEquals(Set.of("v"), unit.getSymbols().getBindings(g.getScopeId()).keySet());
        assertEquals(Set.of("w", "c"), unit.getSymbols().getBindings(block.getScopeId()).keySet());
        assertEquals(ScopeKind.BLOCK, unit.getSymbols().getScope(block.getScopeId()).kind);
        assertTrue(symbol(unit, block.getScopeId(), "c").flags.contains(SymbolFlags.CONST_VARIABLE));
        assertTrue(symbol(unit, unit.getProgram().getScopeId(), "g").flags.isFunction());
    }

    @Test
    void testShadowing() {
        CompilationUnit unit = SemanticBuilder.parse("let a = 1; { let a = 2; a; } a;");
        List<Statement> body = unit.getProgram().body;
        BlockStatement block = (BlockStatement) body.get(1);
        IdentifierReference inner = (IdentifierReference) expression(block.body.get(1));
        IdentifierReference outer = (IdentifierReference) expression(body.get(2));
        SymbolTable table = unit.getSymbols();
        Symbol innerA = symbol(unit, block.getScopeId(), "a");
        Symbol outerA = symbol(unit, unit.getProgram().getScopeId(), "a");
        assertNotEquals(innerA.id, outerA.id);
        assertEquals(innerA.id, table.getReference(inner.referenceId).getSymbolId());
        assertEquals(outerA.id, table.getReference(outer.referenceId).getSymbolId());
    }

    @Test
    void testParameters() {
        CompilationUnit unit = SemanticBuilder.parse("function h(p, { q }, [r = 1]) { return p + q + r; }");
        FunctionNode h = (FunctionNode) unit.getProgram().body.get(0);
        for (String name : List.of("p", "q", "r")) {
            assertTrue(symbol(unit, h.getScopeId(), name).flags.contains(SymbolFlags.PARAMETER), name);
        }
        assertTrue(unit.getSymbols().getUnresolvedReferences().isEmpty());
        assertEquals(Set.of("h"), unit.getSymbols().getBindings(unit.getProgram().getScopeId()).keySet());
    }

    @Test
    void testArrowScope() {
        CompilationUnit unit = SemanticBuilder.parse("const f = (x) => x;");
        VariableDeclaration decl = (VariableDeclaration) unit.getProgram().body.get(0);
        ArrowFunctionExpression arrow = (ArrowFunctionExpression) decl.declarations.get(0).init;
        assertEquals(ScopeKind.ARROW, unit.getSymbols().getScope(arrow.getScopeId()).kind);
        Symbol x = symbol(unit, arrow.getScopeId(), "x");
        IdentifierReference ref = (IdentifierReference) arrow.getExpression();
        assertEquals(x.id, unit.getSymbols().getReference(ref.referenceId).getSymbolId());
    }

    @Test
    void testNamedFunctionExpression() {
        CompilationUnit unit = SemanticBuilder.parse("const k = function self() { self; };");
        VariableDeclaration decl = (VariableDeclaration) unit.getProgram().body.get(0);
        FunctionNode fn = (FunctionNode) decl.declarations.get(0).init;
        Symbol self = symbol(unit, fn.getScopeId(), "self");
        assertEquals(Set.of("k"), unit.getSymbols().getBindings(unit.getProgram().getScopeId()).keySet());
        assertEquals(1, self.getReferences().size());
    }

    @Test
    void testVarRedeclaration() {
        CompilationUnit unit = SemanticBuilder.parse("var a = 1; var a = 2; a;");
        assertEquals(1, unit.getSymbols().getSymbolCount());
        VariableDeclaration second = (VariableDeclaration) unit.getProgram().body.get(1);
        BindingIdentifier id = (BindingIdentifier) second.declarations.get(0).id;
        assertEquals(new SymbolId(0), id.symbolId);
    }

    @Test
    void testImports() {
        CompilationUnit unit = SemanticBuilder.parse(
                "import React, { Children as C } from 'react';\nimport * as ns from './m';\nimport './side';");
        ModuleRecord module = unit.getModule();
        assertEquals(List.of(
                new ImportEntry("react", ImportEntry.DEFAULT, "React"),
                new ImportEntry("react", "Children", "C"),
                new ImportEntry("./m", ImportEntry.NAMESPACE, "ns")), module.getImportEntries());
        assertEquals(List.of("react", "./m", "./side"), new ArrayList<>(module.getRequestedModules()));
        assertTrue(module.isImported("C", "react"));
        assertFalse(module.isImported("Children", "react"));
        ScopeId root = unit.getProgram().getScopeId();
        for (String name : List.of("React", "C", "ns")) {
            assertTrue(symbol(unit, root, name).flags.isImport(), name);
        }
    }

    @Test
    void testReferenceFlags() {
        CompilationUnit unit = SemanticBuilder.parse("let n = 0; n = 1; n += 2; n++; n;");
        List<Reference> refs = references(unit);
        assertEquals(4, refs.size());
        assertEquals(ReferenceFlags.WRITE, refs.get(0).flags);
        assertEquals(ReferenceFlags.READ_WRITE, refs.get(1).flags);
        assertEquals(ReferenceFlags.READ_WRITE, refs.get(2).flags);
        assertEquals(ReferenceFlags.READ, refs.get(3).flags);
        Symbol n = symbol(unit, unit.getProgram().getScopeId(), "n");
        assertEquals(4, n.getReferences().size());
    }

    @Test
    void testUnresolvedGlobals() {
        CompilationUnit unit = SemanticBuilder.parse("console.log(x, y);\nlet y;");
        List<Reference> unresolved = unit.getSymbols().getUnresolvedReferences();
        assertEquals(List.of("console", "x"), unresolved.stream().map(r -> r.name).toList());
        assertTrue(unit.getSymbols().isUnresolvedGlobal("console"));
        assertFalse(unit.getSymbols().isUnresolvedGlobal("log"));
    }

    @Test
    void testAlreadyBound() {
        CompilationUnit unit = SemanticBuilder.parse("let a;");
        assertThrows(IllegalStateException.class, () -> SemanticBuilder.build(unit.getSource(), unit.getProgram()));
    }

}
