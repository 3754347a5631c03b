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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flat, index-addressed store of scopes, symbols and references. A scope is always created
 * after its parent, so a parent id is strictly smaller than the child id and parent chains
 * cannot loop.
 * <p>
 * The table does not enforce redeclaration rules, callers query first.
 */
public class SymbolTable {

    private final List<Scope> scopes = new ArrayList<>();
    private final List<Symbol> symbols = new ArrayList<>();
    private final List<Reference> references = new ArrayList<>();

    private ScopeId rootScopeId;

    // ========== Scopes ==========

    public ScopeId createScope(ScopeId parentId, ScopeKind kind) {
        if (parentId == null) {
            if (rootScopeId != null) {
                throw new IllegalStateException("root scope already exists: " + rootScopeId);
            }
        } else {
            getScope(parentId);
        }
        ScopeId id = new ScopeId(scopes.size());
        scopes.add(new Scope(id, parentId, kind));
        if (parentId == null) {
            rootScopeId = id;
        } else {
            scopes.get(parentId.index()).children.add(id);
        }
        return id;
    }

    public ScopeId getRootScopeId() {
        return rootScopeId;
    }

    public Scope getScope(ScopeId id) {
        if (id == null || id.index() >= scopes.size()) {
            throw new IllegalArgumentException("unknown scope: " + id);
        }
        return scopes.get(id.index());
    }

    public int getScopeCount() {
        return scopes.size();
    }

    public Map<String, SymbolId> getBindings(ScopeId scopeId) {
        return getScope(scopeId).getBindings();
    }

    /**
     * @return the scope and its ancestors, nearest first
     */
    public List<ScopeId> getAncestors(ScopeId scopeId) {
        List<ScopeId> list = new ArrayList<>();
        ScopeId id = scopeId;
        while (id != null) {
            list.add(id);
            id = getScope(id).parentId;
        }
        return list;
    }

    public boolean isDescendant(ScopeId scopeId, ScopeId ancestorId) {
        ScopeId id = scopeId;
        while (id != null) {
            if (id.equals(ancestorId)) {
                return true;
            }
            id = getScope(id).parentId;
        }
        return false;
    }

    /**
     * @return the nearest scope, starting at this one, that holds {@code var} bindings
     */
    public ScopeId getVarScopeId(ScopeId scopeId) {
        ScopeId id = scopeId;
        while (true) {
            Scope scope = getScope(id);
            if (scope.kind.isVarScope() || scope.parentId == null) {
                return id;
            }
            id = scope.parentId;
        }
    }

    // ========== Symbols ==========

    public SymbolId declare(ScopeId scopeId, String name, SymbolFlags flags, Span span) {
        Scope scope = getScope(scopeId);
        SymbolId id = new SymbolId(symbols.size());
        symbols.add(new Symbol(id, name, scopeId, flags, span == null ? Span.EMPTY : span));
        scope.bindings.put(name, id);
        return id;
    }

    public Symbol getSymbol(SymbolId id) {
        if (id == null || id.index() >= symbols.size()) {
            throw new IllegalArgumentException("unknown symbol: " + id);
        }
        return symbols.get(id.index());
    }

    public int getSymbolCount() {
        return symbols.size();
    }

    /**
     * Walks the scope chain outward from {@code scopeId}.
     */
    public Optional<SymbolId> findBinding(ScopeId scopeId, String name) {
        ScopeId id = scopeId;
        while (id != null) {
            Scope scope = getScope(id);
            SymbolId found = scope.bindings.get(name);
            if (found != null) {
                return Optional.of(found);
            }
            id = scope.parentId;
        }
        return Optional.empty();
    }

    // ========== References ==========

    public ReferenceId createReference(String name, ScopeId scopeId, ReferenceFlags flags, SymbolId symbolId) {
        getScope(scopeId);
        ReferenceId id = new ReferenceId(references.size());
        references.add(new Reference(id, name, scopeId, flags, symbolId));
        if (symbolId != null) {
            getSymbol(symbolId).references.add(id);
        }
        return id;
    }

    public Reference getReference(ReferenceId id) {
        if (id == null || id.index() >= references.size()) {
            throw new IllegalArgumentException("unknown reference: " + id);
        }
        return references.get(id.index());
    }

    public int getReferenceCount() {
        return references.size();
    }

    public void resolve(ReferenceId referenceId, SymbolId symbolId) {
        Reference reference = getReference(referenceId);
        if (reference.symbolId != null) {
            throw new IllegalStateException("reference already resolved: " + reference);
        }
        reference.symbolId = symbolId;
        getSymbol(symbolId).references.add(referenceId);
    }

    public List<Reference> getUnresolvedReferences() {
        List<Reference> list = new ArrayList<>();
        for (Reference reference : references) {
            if (reference.symbolId == null) {
                list.add(reference);
            }
        }
        return list;
    }

    public List<Reference> getResolvedReferences(SymbolId symbolId) {
        List<Reference> list = new ArrayList<>();
        for (ReferenceId id : getSymbol(symbolId).references) {
            list.add(references.get(id.index()));
        }
        return Collections.unmodifiableList(list);
    }

    // ========== Name hygiene ==========

    /**
     * A name is taken at a scope when it is visible there, declared anywhere beneath it, or
     * used as an unresolved global. Any of these would capture or be captured by a new
     * binding of that name.
     */
    public boolean isNameTaken(ScopeId scopeId, String name) {
        return findBinding(scopeId, name).isPresent()
                || isBoundInDescendant(scopeId, name)
                || isUnresolvedGlobal(name);
    }

    public boolean isUnresolvedGlobal(String name) {
        for (Reference reference : references) {
            if (reference.symbolId == null && reference.name.equals(name)) {
                return true;
            }
        }
        return false;
    }

    private boolean isBoundInDescendant(ScopeId scopeId, String name) {
        for (ScopeId child : getScope(scopeId).children) {
            if (getScope(child).bindings.containsKey(name) || isBoundInDescendant(child, name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return {@code candidate} if free at the scope, else the first free of
     * {@code candidate2}, {@code candidate3}, and so on
     */
    public String generateUniqueName(ScopeId scopeId, String candidate) {
        if (!isNameTaken(scopeId, candidate)) {
            return candidate;
        }
        int i = 2;
        while (isNameTaken(scopeId, candidate + i)) {
            i++;
        }
        return candidate + i;
    }

    @Override
    public String toString() {
        return "scopes: " + scopes.size() + ", symbols: " + symbols.size() + ", references: " + references.size();
    }

}
