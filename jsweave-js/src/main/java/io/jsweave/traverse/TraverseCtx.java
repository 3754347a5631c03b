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

import io.jsweave.ast.AstBuilder;
import io.jsweave.ast.IdentifierReference;
import io.jsweave.ast.Span;
import io.jsweave.common.Source;
import io.jsweave.diagnostics.Diagnostic;
import io.jsweave.semantic.CompilationUnit;
import io.jsweave.semantic.ModuleRecord;
import io.jsweave.semantic.ReferenceFlags;
import io.jsweave.semantic.ReferenceId;
import io.jsweave.semantic.ScopeId;
import io.jsweave.semantic.ScopeKind;
import io.jsweave.semantic.SymbolFlags;
import io.jsweave.semantic.SymbolId;
import io.jsweave.semantic.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * What a visitor can see and do at a hook: the ancestry, the scope stack, the unit's
 * semantic tables, the diagnostic sink and hygienic name generation. One context exists per
 * walk and is not shared between threads.
 */
public class TraverseCtx {

    static final Logger logger = LoggerFactory.getLogger(TraverseCtx.class);

    private final CompilationUnit unit;
    private final Ancestry ancestry = new Ancestry();
    private final List<ScopeId> scopeStack = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    TraverseCtx(CompilationUnit unit) {
        this.unit = unit;
    }

    // ========== position ==========

    public Ancestry ancestry() {
        return ancestry;
    }

    /**
     * @return the nearest ancestor entry, or null at the root
     */
    public Ancestor parent() {
        return ancestry.parent();
    }

    /**
     * @return scope of the innermost scope owning node being walked, or null before the
     * program scope exists
     */
    public ScopeId currentScopeId() {
        return scopeStack.isEmpty() ? null : scopeStack.get(scopeStack.size() - 1);
    }

    /**
     * @return copy of the scope stack, innermost last
     */
    public List<ScopeId> scopeStack() {
        return List.copyOf(scopeStack);
    }

    void pushScope(ScopeId scopeId) {
        scopeStack.add(scopeId);
    }

    void popScope(ScopeId expected) {
        if (scopeStack.isEmpty()) {
            throw new TraversalException("scope stack underflow, expected " + expected);
        }
        ScopeId popped = scopeStack.remove(scopeStack.size() - 1);
        if (!popped.equals(expected)) {
            throw new TraversalException("scope stack out of order, expected " + expected + " but was " + popped);
        }
    }

    // ========== unit ==========

    public CompilationUnit unit() {
        return unit;
    }

    public Source source() {
        return unit.getSource();
    }

    public SymbolTable symbols() {
        return unit.getSymbols();
    }

    public ModuleRecord module() {
        return unit.getModule();
    }

    public AstBuilder ast() {
        return AstBuilder.INSTANCE;
    }

    // ========== diagnostics ==========

    public void report(Diagnostic diagnostic) {
        if (logger.isTraceEnabled()) {
            logger.trace("{}: {}", unit.getName(), diagnostic);
        }
        diagnostics.add(diagnostic);
    }

    List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    // ========== hygiene ==========

    /**
     * Declares a symbol in {@code scopeId} named {@code candidate}, or {@code candidate2},
     * {@code candidate3} and so on when the name is visible there, bound in a nested scope or
     * used as a global.
     */
    public BoundIdentifier newBinding(String candidate, ScopeId scopeId, SymbolFlags flags) {
        SymbolTable symbols = symbols();
        String name = symbols.generateUniqueName(scopeId, candidate);
        SymbolId symbolId = symbols.declare(scopeId, name, flags, Span.EMPTY);
        logger.debug("{}: new binding {} in scope {}", unit.getName(), name, scopeId);
        return new BoundIdentifier(name, symbolId);
    }

    public BoundIdentifier newBindingInCurrentScope(String candidate, SymbolFlags flags) {
        ScopeId scopeId = currentScopeId();
        if (scopeId == null) {
            throw new IllegalStateException("no current scope");
        }
        return newBinding(candidate, scopeId, flags);
    }

    public ScopeId createChildScope(ScopeId parentId, ScopeKind kind) {
        return symbols().createScope(parentId, kind);
    }

    public Optional<SymbolId> findBinding(String name) {
        ScopeId scopeId = currentScopeId();
        return scopeId == null ? Optional.empty() : symbols().findBinding(scopeId, name);
    }

    /**
     * Mints an identifier reference registered in the symbol table, already resolved to
     * {@code symbolId}.
     */
    public IdentifierReference createBoundReference(Span span, String name, SymbolId symbolId, ReferenceFlags flags) {
        return createReference(span, name, symbolId, flags);
    }

    /**
     * @param symbolId null for an unresolved reference
     */
    public IdentifierReference createReference(Span span, String name, SymbolId symbolId, ReferenceFlags flags) {
        ScopeId scopeId = currentScopeId();
        if (scopeId == null) {
            scopeId = symbols().getRootScopeId();
        }
        ReferenceId referenceId = symbols().createReference(name, scopeId, flags, symbolId);
        return new IdentifierReference(span == null ? Span.EMPTY : span, name, referenceId);
    }

}
