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
import io.jsweave.semantic.ReferenceFlags;
import io.jsweave.semantic.ScopeId;
import io.jsweave.semantic.ScopeKind;
import io.jsweave.semantic.SymbolId;
import io.jsweave.traverse.Ancestor;
import io.jsweave.traverse.Slot;
import io.jsweave.traverse.TraverseCtx;
import io.jsweave.traverse.Visitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Lowers {@code async} functions to generators driven by a runtime helper:
 * <pre>
 * async function f(a) { return await g(a); }
 * // becomes
 * function f(a) { return babelHelpers.asyncToGenerator(this, null, function* () { return yield g(a); }); }
 * </pre>
 * Arrows keep their shape, {@code async (x) => await x} becomes
 * {@code (x) => babelHelpers.asyncToGenerator(this, null, function* () { return yield x; })}.
 * Async generators and top level {@code await} are left alone.
 */
public class AsyncToGenerator implements Visitor {

    static final Logger logger = LoggerFactory.getLogger(AsyncToGenerator.class);

    /**
     * Slots that accept any assignment expression. Anywhere else {@code yield} binds looser
     * than the {@code await} it replaces and gets parenthesized.
     */
    private static final Set<Slot> YIELD_SAFE = EnumSet.of(
            Slot.EXPRESSION_STATEMENT_EXPRESSION, Slot.VARIABLE_DECLARATOR_INIT, Slot.RETURN_ARGUMENT,
            Slot.IF_TEST, Slot.THROW_ARGUMENT, Slot.ASSIGNMENT_PATTERN_RIGHT, Slot.ARRAY_ELEMENTS,
            Slot.OBJECT_PROPERTY_VALUE, Slot.SPREAD_ARGUMENT, Slot.CALL_ARGUMENTS, Slot.NEW_ARGUMENTS,
            Slot.CONDITIONAL_CONSEQUENT, Slot.CONDITIONAL_ALTERNATE, Slot.ASSIGNMENT_RIGHT,
            Slot.SEQUENCE_EXPRESSIONS, Slot.PARENTHESIZED_EXPRESSION, Slot.AWAIT_ARGUMENT, Slot.YIELD_ARGUMENT,
            Slot.JSX_EXPRESSION_CONTAINER_EXPRESSION, Slot.JSX_SPREAD_ATTRIBUTE_ARGUMENT);

    private final TransformOptions options;

    public AsyncToGenerator() {
        this(TransformOptions.DEFAULT);
    }

    public AsyncToGenerator(TransformOptions options) {
        this.options = options;
    }

    @Override
    public String name() {
        return "async-to-generator";
    }

    @Override
    public boolean isReadOnly() {
        return false;
    }

    @Override
    public Expression exitExpression(Expression node, TraverseCtx ctx) {
        if (!(node instanceof AwaitExpression expr) || !isInAsyncFunction(ctx)) {
            return node;
        }
        YieldExpression lowered = new YieldExpression(expr.span, false, expr.argument);
        Ancestor parent = ctx.parent();
        if (parent != null && !YIELD_SAFE.contains(parent.slot())) {
            return ctx.ast().parenthesized(lowered);
        }
        return lowered;
    }

    private static boolean isInAsyncFunction(TraverseCtx ctx) {
        AstNode function = ctx.ancestry().findNearestFunction();
        if (function instanceof FunctionNode fn) {
            return fn.async && !fn.generator;
        }
        return function instanceof ArrowFunctionExpression arrow && arrow.async;
    }

    @Override
    public void exitFunction(FunctionNode node, TraverseCtx ctx) {
        if (!node.async || node.generator) {
            return;
        }
        FunctionNode generator = generator(node.getScopeId(), node.body, ctx);
        node.body = ctx.ast().functionBody(List.of(ctx.ast().returnStatement(helperCall(node.getScopeId(), generator, ctx))));
        node.async = false;
        if (logger.isDebugEnabled()) {
            logger.debug("{}: lowered async function {}", ctx.unit().getName(), node.id == null ? "(anonymous)" : node.id.name);
        }
    }

    @Override
    public void exitArrowFunctionExpression(ArrowFunctionExpression node, TraverseCtx ctx) {
        if (!node.async) {
            return;
        }
        FunctionBody body = node.body;
        Expression expression = node.getExpression();
        if (expression != null) {
            body = ctx.ast().functionBody(List.of(ctx.ast().returnStatement(expression)));
        }
        FunctionNode generator = generator(node.getScopeId(), body, ctx);
        node.body = ctx.ast().functionBody(List.of(ctx.ast().expressionStatement(helperCall(node.getScopeId(), generator, ctx))));
        node.expression = true;
        node.async = false;
        logger.debug("{}: lowered async arrow", ctx.unit().getName());
    }

    /**
     * The body moves into a parameterless {@code function* ()} with a fresh scope below the
     * owner's.
     */
    private static FunctionNode generator(ScopeId ownerScopeId, FunctionBody body, TraverseCtx ctx) {
        FunctionNode generator = ctx.ast().functionExpression(null, false, true, ctx.ast().formalParameters(List.of()), body);
        ScopeId parent = ownerScopeId == null ? ctx.currentScopeId() : ownerScopeId;
        generator.setScopeId(ctx.createChildScope(parent, ScopeKind.FUNCTION));
        return generator;
    }

    private static Optional<ScopeId> lookupScope(ScopeId ownerScopeId, TraverseCtx ctx) {
        ScopeId scopeId = ownerScopeId == null ? ctx.currentScopeId() : ownerScopeId;
        if (scopeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ctx.symbols().getScope(scopeId).parentId);
    }

    private CallExpression helperCall(ScopeId ownerScopeId, FunctionNode generator, TraverseCtx ctx) {
        List<Argument> arguments = List.of(ctx.ast().thisExpression(), ctx.ast().nullLiteral(), generator);
        return ctx.ast().call(helperCallee(ownerScopeId, ctx), arguments);
    }

    /**
     * {@code babelHelpers.asyncToGenerator}, the object bound to a declaration visible from
     * outside the lowered function when there is one and a global otherwise. The function's
     * own bindings now live in the generator body and are out of reach.
     */
    private Expression helperCallee(ScopeId ownerScopeId, TraverseCtx ctx) {
        String name = options.getHelperObject();
        SymbolId symbolId = lookupScope(ownerScopeId, ctx)
                .flatMap(scopeId -> ctx.symbols().findBinding(scopeId, name))
                .orElse(null);
        IdentifierReference object = ctx.createReference(Span.EMPTY, name, symbolId, ReferenceFlags.READ);
        return ctx.ast().staticMember(object, options.getHelperMethod());
    }

}
