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
package io.jsweave.lint;

import io.jsweave.diagnostics.Diagnostic;
import io.jsweave.traverse.TraverseCtx;
import io.jsweave.traverse.Visitor;

/**
 * A read-only visitor that reports {@link Diagnostic}s. Rule instances hold only their
 * configuration, so one instance may lint many units at once.
 */
public interface LintRule extends Visitor {

    /**
     * @return rule name within its plugin, such as {@code jsx-key}
     */
    @Override
    String name();

    /**
     * @return plugin name, such as {@code react}
     */
    String plugin();

    default String code() {
        return plugin() + "(" + name() + ")";
    }

    @Override
    default boolean isReadOnly() {
        return true;
    }

    default void report(TraverseCtx ctx, Diagnostic diagnostic) {
        ctx.report(diagnostic.withCode(code()));
    }

}
