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

import io.jsweave.codegen.Codegen;
import io.jsweave.common.Source;
import io.jsweave.semantic.CompilationUnit;
import io.jsweave.semantic.SemanticBuilder;
import io.jsweave.traverse.TraverseResult;
import io.jsweave.traverse.Traverser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the lowering passes on a unit in place and prints the result. The walk holds the
 * unit's write lock, so no other pass sees a half rewritten tree.
 */
public class Transformer {

    static final Logger logger = LoggerFactory.getLogger(Transformer.class);

    private final TransformOptions options;

    public Transformer() {
        this(TransformOptions.DEFAULT);
    }

    public Transformer(TransformOptions options) {
        this.options = options;
    }

    public TransformResult transform(CompilationUnit unit) {
        TraverseResult result = Traverser.traverse(unit, new AsyncToGenerator(options));
        String code;
        unit.readLock().lock();
        try {
            code = Codegen.generate(unit.getProgram());
        } finally {
            unit.readLock().unlock();
        }
        if (!result.isClean()) {
            logger.warn("{}: transform finished with {} failure(s), aborted: {}", unit.getName(),
                    result.failures().size(), result.isAborted());
        }
        return new TransformResult(unit.getName(), code, result.failures(), result.abortReason());
    }

    /**
     * Parses and binds {@code text}, then transforms it.
     */
    public TransformResult transform(Source source) {
        return transform(SemanticBuilder.parse(source));
    }

    public TransformResult transform(String text) {
        return transform(Source.of(text));
    }

}
