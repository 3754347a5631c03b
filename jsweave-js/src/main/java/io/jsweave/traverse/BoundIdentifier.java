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

import io.jsweave.ast.AssignmentTarget;
import io.jsweave.ast.BindingIdentifier;
import io.jsweave.ast.BindingPattern;
import io.jsweave.ast.Expression;
import io.jsweave.ast.IdentifierReference;
import io.jsweave.ast.Span;
import io.jsweave.semantic.ReferenceFlags;
import io.jsweave.semantic.SymbolId;

/**
 * Handle to a declared symbol, used to mint its binding site and any number of references
 * to it. Every minted reference is registered in the symbol table already resolved to
 * {@link #symbolId()} and carries exactly {@link #name()}, so generated code cannot be
 * captured by, or capture, user bindings.
 * <p>
 * Obtain one from {@link TraverseCtx#newBinding} so the name is hygienic, or from
 * {@link #of(BindingIdentifier)} for a binding the binder already resolved.
 */
public record BoundIdentifier(String name, SymbolId symbolId) {

    public BoundIdentifier {
        if (name == null || symbolId == null) {
            throw new IllegalArgumentException("name and symbol id are required");
        }
    }

    public static BoundIdentifier of(BindingIdentifier binding) {
        if (binding.symbolId == null) {
            throw new IllegalArgumentException("binding is not bound: " + binding.name);
        }
        return new BoundIdentifier(binding.name, binding.symbolId);
    }

    // ========== binding site ==========

    public BindingIdentifier createBindingIdentifier() {
        return createBindingIdentifier(Span.EMPTY);
    }

    public BindingIdentifier createBindingIdentifier(Span span) {
        return new BindingIdentifier(span, name, symbolId);
    }

    public BindingPattern createBindingPattern() {
        return createBindingIdentifier(Span.EMPTY);
    }

    public BindingPattern createBindingPattern(Span span) {
        return createBindingIdentifier(span);
    }

    // ========== read ==========

    public IdentifierReference createReadReference(TraverseCtx ctx) {
        return createReference(ctx, Span.EMPTY, ReferenceFlags.READ);
    }

    public IdentifierReference createReadReference(TraverseCtx ctx, Span span) {
        return createReference(ctx, span, ReferenceFlags.READ);
    }

    public Expression createReadExpression(TraverseCtx ctx) {
        return createReference(ctx, Span.EMPTY, ReferenceFlags.READ);
    }

    public Expression createReadExpression(TraverseCtx ctx, Span span) {
        return createReference(ctx, span, ReferenceFlags.READ);
    }

    // ========== write ==========

    public IdentifierReference createWriteReference(TraverseCtx ctx) {
        return createReference(ctx, Span.EMPTY, ReferenceFlags.WRITE);
    }

    public IdentifierReference createWriteReference(TraverseCtx ctx, Span span) {
        return createReference(ctx, span, ReferenceFlags.WRITE);
    }

    public Expression createWriteExpression(TraverseCtx ctx) {
        return createReference(ctx, Span.EMPTY, ReferenceFlags.WRITE);
    }

    public Expression createWriteExpression(TraverseCtx ctx, Span span) {
        return createReference(ctx, span, ReferenceFlags.WRITE);
    }

    public AssignmentTarget createWriteTarget(TraverseCtx ctx) {
        return createReference(ctx, Span.EMPTY, ReferenceFlags.WRITE);
    }

    public AssignmentTarget createWriteTarget(TraverseCtx ctx, Span span) {
        return createReference(ctx, span, ReferenceFlags.WRITE);
    }

    // ========== read write ==========

    public IdentifierReference createReadWriteReference(TraverseCtx ctx) {
        return createReference(ctx, Span.EMPTY, ReferenceFlags.READ_WRITE);
    }

    public IdentifierReference createReadWriteReference(TraverseCtx ctx, Span span) {
        return createReference(ctx, span, ReferenceFlags.READ_WRITE);
    }

    public Expression createReadWriteExpression(TraverseCtx ctx) {
        return createReference(ctx, Span.EMPTY, ReferenceFlags.READ_WRITE);
    }

    public Expression createReadWriteExpression(TraverseCtx ctx, Span span) {
        return createReference(ctx, span, ReferenceFlags.READ_WRITE);
    }

    public AssignmentTarget createReadWriteTarget(TraverseCtx ctx) {
        return createReference(ctx, Span.EMPTY, ReferenceFlags.READ_WRITE);
    }

    public AssignmentTarget createReadWriteTarget(TraverseCtx ctx, Span span) {
        return createReference(ctx, span, ReferenceFlags.READ_WRITE);
    }

    // ========== explicit flags ==========

    public IdentifierReference createReference(TraverseCtx ctx, ReferenceFlags flags) {
        return createReference(ctx, Span.EMPTY, flags);
    }

    public IdentifierReference createReference(TraverseCtx ctx, Span span, ReferenceFlags flags) {
        return ctx.createBoundReference(span, name, symbolId, flags);
    }

    public Expression createExpression(TraverseCtx ctx, ReferenceFlags flags) {
        return createReference(ctx, Span.EMPTY, flags);
    }

    public Expression createExpression(TraverseCtx ctx, Span span, ReferenceFlags flags) {
        return createReference(ctx, span, flags);
    }

    public AssignmentTarget createTarget(TraverseCtx ctx, ReferenceFlags flags) {
        return createReference(ctx, Span.EMPTY, flags);
    }

    public AssignmentTarget createTarget(TraverseCtx ctx, Span span, ReferenceFlags flags) {
        return createReference(ctx, span, flags);
    }

}
