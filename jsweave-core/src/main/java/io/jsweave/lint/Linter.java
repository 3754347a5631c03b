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
import io.jsweave.lint.rules.JsxKey;
import io.jsweave.lint.rules.MediaHasCaption;
import io.jsweave.semantic.CompilationUnit;
import io.jsweave.traverse.TraverseResult;
import io.jsweave.traverse.Traverser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs a set of rules over compilation units, one read-only walk per unit with every rule
 * attached.
 */
public class Linter {

    static final Logger logger = LoggerFactory.getLogger(Linter.class);

    private static final Comparator<Diagnostic> BY_POSITION = Comparator.comparingInt(d -> d.primarySpan().start());

    private final List<LintRule> rules;

    public Linter(List<? extends LintRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static Linter fromConfig(LintConfig config) {
        List<LintRule> rules = new ArrayList<>();
        LintRule jsxKey = new JsxKey();
        if (config.isEnabled(jsxKey.name())) {
            rules.add(jsxKey);
        }
        LintRule media = MediaHasCaption.fromOptions(config.getOptions(MediaHasCaption.NAME), config.getSettings());
        if (config.isEnabled(media.name())) {
            rules.add(media);
        }
        logger.debug("rules enabled: {}", rules.stream().map(LintRule::code).toList());
        return new Linter(rules);
    }

    public static Linter defaults() {
        return fromConfig(LintConfig.DEFAULT);
    }

    public List<LintRule> getRules() {
        return rules;
    }

    public LintResult lint(CompilationUnit unit) {
        TraverseResult result = Traverser.traverse(unit, rules);
        List<Diagnostic> diagnostics = new ArrayList<>(result.diagnostics());
        diagnostics.sort(BY_POSITION);
        if (logger.isDebugEnabled()) {
            logger.debug("{}: {} diagnostic(s)", unit.getName(), diagnostics.size());
        }
        return new LintResult(unit.getName(), diagnostics, result.failures(), result.abortReason());
    }

    /**
     * Lints independent units on a pool of {@code threads} workers. Each unit gets its own
     * walk and diagnostic sink, results come back in input order.
     */
    public List<LintResult> lintAll(List<CompilationUnit> units, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1: " + threads);
        }
        if (threads == 1 || units.size() < 2) {
            List<LintResult> results = new ArrayList<>(units.size());
            for (CompilationUnit unit : units) {
                results.add(lint(unit));
            }
            return results;
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, units.size()));
        try {
            List<Future<LintResult>> futures = new ArrayList<>(units.size());
            for (CompilationUnit unit : units) {
                futures.add(executor.submit(() -> lint(unit)));
            }
            List<LintResult> results = new ArrayList<>(units.size());
            for (Future<LintResult> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("lint interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("lint failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

}
