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
import io.jsweave.common.Source;
import io.jsweave.parser.JsParser;
import io.jsweave.traverse.Ancestor;
import io.jsweave.traverse.Slot;
import io.jsweave.traverse.TraverseCtx;
import io.jsweave.traverse.TraverseResult;
import io.jsweave.traverse.Traverser;
import io.jsweave.traverse.Visitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Binder: builds the scope tree, symbols, references and module record of a freshly parsed
 * program. Runs as a visitor on the ordinary {@link Traverser}. Scope ids are assigned on
 * enter so the binder keeps its own scope stack, and references are resolved once the
 * whole program is seen, which gives {@code var} and function hoisting for free.
 */
public class SemanticBuilder implements Visitor {

    static final Logger logger = LoggerFactory.getLogger(SemanticBuilder.class);

    private final SymbolTable symbols;
    private final ModuleRecord module;
    private final List<ScopeId> scopes = new ArrayList<>();
    private final List<IdentifierReference> pending = new ArrayList<>();

    private SemanticBuilder(SymbolTable symbols, ModuleRecord module) {
        this.symbols = symbols;
        this.module = module;
    }

    public static CompilationUnit parse(String text) {
        return parse(Source.of(text));
    }

    public static CompilationUnit parse(Source source) {
        return build(source, JsParser.parse(source));
    }

    public static CompilationUnit build(Source source, Program program) {
        if (program.getScopeId() != null) {
            throw new IllegalStateException("program is already bound: " + source.getName());
        }
        SymbolTable symbols = new SymbolTable();
        ModuleRecord module = new ModuleRecord();
        CompilationUnit unit = new CompilationUnit(source, program, symbols, module);
        TraverseResult result = Traverser.traverse(unit, new SemanticBuilder(symbols, module));
        if (!result.isClean()) {
            String reason = result.isAborted() ? result.abortReason() : result.failures().get(0).toString();
            throw new IllegalStateException("binding failed for " + source.getName() + ": " + reason);
        }
        logger.debug("bound {}: {}", source.getName(), symbols);
        return unit;
    }

    @Override
    public boolean isReadOnly() {
        return false;
    }

    private ScopeId current() {
        return scopes.get(scopes.size() - 1);
    }

    private ScopeId enterScope(ScopeOwner owner, ScopeKind kind) {
        ScopeId scopeId = symbols.createScope(scopes.isEmpty() ? null : current(), kind);
        owner.setScopeId(scopeId);
        scopes.add(scopeId);
        return scopeId;
    }

    private void exitScope() {
        scopes.remove(scopes.size() - 1);
    }

    // ========== scopes ==========

    @Override
    public void enterProgram(Program node, TraverseCtx ctx) {
        enterScope(node, ScopeKind.PROGRAM);
    }

    @Override
    public void exitProgram(Program node, TraverseCtx ctx) {
        exitScope();
        int unresolved = 0;
        for (IdentifierReference ref : pending) {
            Reference reference = symbols.getReference(ref.referenceId);
            SymbolId symbolId = symbols.findBinding(reference.scopeId, reference.name).orElse(null);
            if (symbolId == null) {
                unresolved++;
            } else {
                symbols.resolve(reference.id, symbolId);
            }
        }
        if (logger.isTraceEnabled()) {
            logger.trace("resolved {} of {} references", pending.size() - unresolved, pending.size());
        }
        pending.clear();
    }

    @Override
    public void enterFunction(FunctionNode node, TraverseCtx ctx) {
        if (node.isDeclaration() && node.id != null) {
            declareHoisted(node.id, SymbolFlags.FUNCTION);
        }
        ScopeId scopeId = enterScope(node, ScopeKind.FUNCTION);
        if (!node.isDeclaration() && node.id != null) {
            // a named function expression sees its own name
            declare(node.id, scopeId, SymbolFlags.FUNCTION);
        }
    }

    @Override
    public void exitFunction(FunctionNode node, TraverseCtx ctx) {
        exitScope();
    }

    @Override
    public void enterArrowFunctionExpression(ArrowFunctionExpression node, TraverseCtx ctx) {
        enterScope(node, ScopeKind.ARROW);
    }

    @Override
    public void exitArrowFunctionExpression(ArrowFunctionExpression node, TraverseCtx ctx) {
        exitScope();
    }

    @Override
    public void enterBlockStatement(BlockStatement node, TraverseCtx ctx) {
        enterScope(node, ScopeKind.BLOCK);
    }

    @Override
    public void exitBlockStatement(BlockStatement node, TraverseCtx ctx) {
        exitScope();
    }

    // ========== declarations ==========

    @Override
    public void enterBindingIdentifier(BindingIdentifier node, TraverseCtx ctx) {
        if (node.symbolId != null) {
            return;
        }
        for (Ancestor ancestor : ctx.ancestry().nearestFirst()) {
            switch (ancestor.kind()) {
                case FORMAL_PARAMETERS:
                    declare(node, current(), SymbolFlags.PARAMETER.or(SymbolFlags.FUNCTION_SCOPED_VARIABLE));
                    return;
                case VARIABLE_DECLARATION:
                    VariableDeclaration decl = (VariableDeclaration) ancestor.node();
                    switch (decl.declarationKind) {
                        case VAR -> declareHoisted(node, SymbolFlags.FUNCTION_SCOPED_VARIABLE);
                        case LET -> declare(node, current(), SymbolFlags.BLOCK_SCOPED_VARIABLE);
                        case CONST -> declare(node, current(), SymbolFlags.BLOCK_SCOPED_VARIABLE.or(SymbolFlags.CONST_VARIABLE));
                    }
                    return;
                case IMPORT_SPECIFIER:
                case IMPORT_DEFAULT_SPECIFIER:
                case IMPORT_NAMESPACE_SPECIFIER:
                    declare(node, symbols.getRootScopeId(), SymbolFlags.IMPORT);
                    return;
                case FUNCTION:
                    return;
                default:
                    // inside a pattern, keep looking for the declaring construct
            }
        }
        logger.warn("binding {} outside of a declaration at {}", node.name, node.span);
    }

    private void declare(BindingIdentifier node, ScopeId scopeId, SymbolFlags flags) {
        node.symbolId = symbols.declare(scopeId, node.name, flags, node.span);
    }

    private void declareHoisted(BindingIdentifier node, SymbolFlags flags) {
        ScopeId varScope = symbols.getVarScopeId(current());
        SymbolId existing = symbols.getScope(varScope).getBinding(node.name);
        if (existing != null && flags.isVariable() && symbols.getSymbol(existing).flags.isVariable()) {
            // var redeclaration shares the symbol
            node.symbolId = existing;
        } else {
            declare(node, varScope, flags);
        }
    }

    // ========== references ==========

    @Override
    public void enterIdentifierReference(IdentifierReference node, TraverseCtx ctx) {
        if (node.referenceId != null) {
            return;
        }
        ReferenceFlags flags = ReferenceFlags.READ;
        Ancestor parent = ctx.parent();
        if (parent != null && parent.slot() == Slot.ASSIGNMENT_LEFT) {
            flags = ((AssignmentExpression) parent.node()).isCompound() ? ReferenceFlags.READ_WRITE : ReferenceFlags.WRITE;
        } else if (parent != null && parent.slot() == Slot.UPDATE_ARGUMENT) {
            flags = ReferenceFlags.READ_WRITE;
        }
        node.referenceId = symbols.createReference(node.name, current(), flags, null);
        pending.add(node);
    }

    // ========== module ==========

    @Override
    public void enterImportDeclaration(ImportDeclaration node, TraverseCtx ctx) {
        String from = node.source.value;
        module.addRequestedModule(from);
        for (ImportDeclarationSpecifier specifier : node.specifiers) {
            if (specifier instanceof ImportSpecifier named) {
                module.addImportEntry(new ImportEntry(from, named.imported, named.local.name));
            } else if (specifier instanceof ImportDefaultSpecifier def) {
                module.addImportEntry(new ImportEntry(from, ImportEntry.DEFAULT, def.local.name));
            } else if (specifier instanceof ImportNamespaceSpecifier ns) {
                module.addImportEntry(new ImportEntry(from, ImportEntry.NAMESPACE, ns.local.name));
            }
        }
    }

}
