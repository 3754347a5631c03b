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
package io.jsweave.traverse;

import io.jsweave.ast.*;
import io.jsweave.codegen.Codegen;
import io.jsweave.semantic.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundIdentifierTest {

    /**
     * Declares a fresh binding at program exit and appends {@code let name = 0; name;}.
     */
    static class Declaring implements Visitor {

        final String candidate;
        final List<IdentifierReference> minted = new ArrayList<>();
        BoundIdentifier bound;

        Declaring(String candidate) {
            this.candidate = candidate;
        }

        @Override
        public boolean isReadOnly() {
            return false;
        }

        @Override
        public void exitProgram(Program node, TraverseCtx ctx) {
            bound = ctx.newBindingInCurrentScope(candidate, SymbolFlags.BLOCK_SCOPED_VARIABLE);
            node.body.add(ctx.ast().variableDeclaration(VariableDeclaration.Kind.LET, bound.createBindingPattern(),
                    ctx.ast().numericLiteral(0)));
            IdentifierReference read = bound.createReadReference(ctx);
            minted.add(read);
            minted.add(bound.createWriteReference(ctx));
            minted.add(bound.createReadWriteReference(ctx));
            node.body.add(ctx.ast().expressionStatement(read));
        }

    }

    private static Declaring declare(CompilationUnit unit, String candidate) {
        Declaring visitor = new Declaring(candidate);
        TraverseResult result = Traverser.traverse(unit, visitor);
        assertTrue(result.isClean(), result.toString());
        return visitor;
    }

    @Test
    void testReferencesShareSymbol() {
        CompilationUnit unit = SemanticBuilder.parse("let x = 1; x;");
        Declaring visitor = declare(unit, "x");
        BoundIdentifier bound = visitor.bound;
        assertEquals("x2", bound.name());
        SymbolTable table = unit.getSymbols();
        Symbol symbol = table.getSymbol(bound.symbolId());
        assertEquals("x2", symbol.name);
        assertEquals(unit.getProgram().getScopeId(), symbol.scopeId);
        List<ReferenceFlags> flags = new ArrayList<>();
        for (IdentifierReference ref : visitor.minted) {
            assertEquals("x2", ref.name);
            Reference reference = table.getReference(ref.referenceId);
            assertEquals(bound.symbolId(), reference.getSymbolId());
            flags.add(reference.flags);
        }
        assertEquals(List.of(ReferenceFlags.READ, ReferenceFlags.WRITE, ReferenceFlags.READ_WRITE), flags);
        assertEquals(3, symbol.getReferences().size());
        assertEquals("let x = 1;\nx;\nlet x2 = 0;\nx2;", Codegen.generate(unit.getProgram()));
    }

    @Test
    void testBindingIdentifierCarriesSymbol() {
        CompilationUnit unit = SemanticBuilder.parse("a;");
        Declaring visitor = declare(unit, "tmp");
        assertEquals("tmp", visitor.bound.name());
        VariableDeclaration decl = (VariableDeclaration) unit.getProgram().body.get(1);
        BindingIdentifier id = (BindingIdentifier) decl.declarations.get(0).id;
        assertEquals(visitor.bound.symbolId(), id.symbolId);
        assertEquals(visitor.bound, BoundIdentifier.of(id));
    }

    @Test
    void testAvoidsGlobalsAndNestedBindings() {
        CompilationUnit unit = SemanticBuilder.parse("console.log(1); function f() { let console2; }");
        assertEquals("console3", declare(unit, "console").bound.name());
    }

    @Test
    void testRejectsUnbound() {
        assertThrows(IllegalArgumentException.class, () -> BoundIdentifier.of(new BindingIdentifier(Span.EMPTY, "a")));
        assertThrows(IllegalArgumentException.class, () -> new BoundIdentifier("a", null));
    }

}
