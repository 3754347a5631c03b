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

import io.jsweave.ast.Span;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolTableTest {

    @Test
    void testScopeTree() {
        SymbolTable table = new SymbolTable();
        ScopeId root = table.createScope(null, ScopeKind.PROGRAM);
        ScopeId fn = table.createScope(root, ScopeKind.FUNCTION);
        ScopeId block = table.createScope(fn, ScopeKind.BLOCK);
        assertEquals(root, table.getRootScopeId());
        assertTrue(table.getScope(root).isRoot());
        assertEquals(List.of(fn), table.getScope(root).getChildren());
        assertEquals(List.of(block, fn, root), table.getAncestors(block));
        assertTrue(table.isDescendant(block, root));
        assertTrue(table.isDescendant(block, block));
        assertFalse(table.isDescendant(root, fn));
        assertEquals(fn, table.getVarScopeId(block));
        assertEquals(3, table.getScopeCount());
        assertThrows(IllegalStateException.class, () -> table.createScope(null, ScopeKind.PROGRAM));
        assertThrows(IllegalArgumentException.class, () -> table.getScope(new ScopeId(9)));
    }

    @Test
    void testFindBinding() {
        SymbolTable table = new SymbolTable();
        ScopeId root = table.createScope(null, ScopeKind.PROGRAM);
        ScopeId inner = table.createScope(root, ScopeKind.BLOCK);
        SymbolId outerA = table.declare(root, "a", SymbolFlags.FUNCTION_SCOPED_VARIABLE, new Span(0, 1));
        assertEquals(outerA, table.findBinding(inner, "a").orElseThrow());
        SymbolId innerA = table.declare(inner, "a", SymbolFlags.BLOCK_SCOPED_VARIABLE, null);
        assertEquals(innerA, table.findBinding(inner, "a").orElseThrow());
        assertEquals(outerA, table.findBinding(root, "a").orElseThrow());
        assertTrue(table.findBinding(inner, "b").isEmpty());
        assertEquals(Span.EMPTY, table.getSymbol(innerA).span);
        assertEquals(inner, table.getSymbol(innerA).scopeId);
    }

    @Test
    void testReferences() {
        SymbolTable table = new SymbolTable();
        ScopeId root = table.createScope(null, ScopeKind.PROGRAM);
        SymbolId x = table.declare(root, "x", SymbolFlags.FUNCTION_SCOPED_VARIABLE, null);
        ReferenceId bound = table.createReference("x", root, ReferenceFlags.READ, x);
        ReferenceId pending = table.createReference("x", root, ReferenceFlags.WRITE, null);
        ReferenceId global = table.createReference("console", root, ReferenceFlags.READ, null);
        assertTrue(table.getReference(bound).isResolved());
        assertEquals(2, table.getUnresolvedReferences().size());
        table.resolve(pending, x);
        assertEquals(x, table.getReference(pending).getSymbolId());
        assertThrows(IllegalStateException.class, () -> table.resolve(pending, x));
        assertEquals(List.of(bound, pending), table.getSymbol(x).getReferences());
        assertEquals(2, table.getResolvedReferences(x).size());
        assertEquals("console", table.getUnresolvedReferences().get(0).name);
        assertFalse(table.getReference(global).isResolved());
    }

    @Test
    void testNameTaken() {
        SymbolTable table = new SymbolTable();
        ScopeId root = table.createScope(null, ScopeKind.PROGRAM);
        ScopeId fn = table.createScope(root, ScopeKind.FUNCTION);
        table.declare(root, "visible", SymbolFlags.FUNCTION_SCOPED_VARIABLE, null);
        table.declare(fn, "nested", SymbolFlags.BLOCK_SCOPED_VARIABLE, null);
        table.createReference("global", fn, ReferenceFlags.READ, null);
        assertTrue(table.isNameTaken(fn, "visible"));
        assertTrue(table.isNameTaken(root, "nested"));
        assertTrue(table.isNameTaken(root, "global"));
        assertTrue(table.isUnresolvedGlobal("global"));
        assertFalse(table.isNameTaken(root, "free"));
    }

    @Test
    void testGenerateUniqueName() {
        SymbolTable table = new SymbolTable();
        ScopeId root = table.createScope(null, ScopeKind.PROGRAM);
        assertEquals("tmp", table.generateUniqueName(root, "tmp"));
        table.declare(root, "tmp", SymbolFlags.FUNCTION_SCOPED_VARIABLE, null);
        assertEquals("tmp2", table.generateUniqueName(root, "tmp"));
        table.declare(root, "tmp2", SymbolFlags.FUNCTION_SCOPED_VARIABLE, null);
        table.createReference("tmp3", root, ReferenceFlags.READ, null);
        assertEquals("tmp4", table.generateUniqueName(root, "tmp"));
    }

}
