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

import io.jsweave.ast.JsxElement;
import io.jsweave.common.Source;
import io.jsweave.diagnostics.Diagnostic;
import io.jsweave.lint.rules.JsxKey;
import io.jsweave.lint.rules.MediaHasCaption;
import io.jsweave.semantic.CompilationUnit;
import io.jsweave.semantic.SemanticBuilder;
import io.jsweave.traverse.TraverseCtx;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinterTest {

    private static CompilationUnit unit(String name, String text) {
        return SemanticBuilder.parse(Source.of(name, text));
    }

    @Test
    void testDefaults() {
        Linter linter = Linter.defaults();
        assertEquals(List.of("react(jsx-key)", "jsx-a11y(media-has-caption)"),
                linter.getRules().stream().map(LintRule::code).toList());
    }

    @Test
    void testDiagnosticsSortedByPosition() {
        // the media rule reports the outer element on enter, before the key rule reaches the inner array
        String text = "<video>{[<li />]}</video>;";
        LintResult result = Linter.defaults().lint(unit("App.jsx", text));
        assertEquals("App.jsx", result.name());
        List<Diagnostic> diagnostics = result.diagnostics();
        assertEquals(2, diagnostics.size());
        assertEquals("jsx-a11y(media-has-caption)", diagnostics.get(0).code());
        assertEquals("react(jsx-key)", diagnostics.get(1).code());
        assertTrue(diagnostics.get(0).primarySpan().start() < diagnostics.get(1).primarySpan().start());
        assertFalse(result.isClean());
        assertEquals("warning[react(jsx-key)]: Missing \"key\" prop for element in array. at App.jsx:1:10",
                diagnostics.get(1).toDisplayString(Source.of("App.jsx", text)));
    }

    @Test
    void testDisabledRule() {
        LintConfig config = LintConfig.fromJson("{\"rules\": {\"jsx-key\": \"off\", \"media-has-caption\": \"off\"}}");
        Linter linter = Linter.fromConfig(config);
        assertTrue(linter.getRules().isEmpty());
        assertTrue(linter.lint(unit("a.jsx", "[<audio />];")).isClean());
    }

    @Test
    void testFailingRuleIsolated() {
        LintRule broken = new LintRule() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public String plugin() {
                return "test";
            }

            @Override
            public void enterJsxElement(JsxElement node, TraverseCtx ctx) {
                throw new IllegalStateException("broken rule");
            }
        };
        Linter linter = new Linter(List.of(broken, new JsxKey()));
        LintResult result = linter.lint(unit("a.jsx", "[<App />];"));
        assertEquals(1, result.failures().size());
        assertEquals("broken", result.failures().get(0).visitor());
        assertEquals(1, result.diagnostics().size());
        assertFalse(result.isAborted());
    }

    @Test
    void testLintAllKeepsOrder() {
        List<CompilationUnit> units = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            StringBuilder sb = new StringBuilder();
            for (int j = 0; j < i; j++) {
                sb.append("[<App />];\n");
            }
            units.add(unit("unit" + i + ".jsx", sb.toString()));
        }
        Linter linter = new Linter(List.of(new JsxKey(), new MediaHasCaption()));
        List<LintResult> parallel = linter.lintAll(units, 4);
        List<LintResult> sequential = linter.lintAll(units, 1);
        assertEquals(20, parallel.size());
        for (int i = 0; i < 20; i++) {
            assertEquals("unit" + i + ".jsx", parallel.get(i).name());
            assertEquals(i, parallel.get(i).diagnostics().size());
            assertEquals(sequential.get(i).diagnostics(), parallel.get(i).diagnostics());
        }
        assertThrows(IllegalArgumentException.class, () -> linter.lintAll(units, 0));
        assertEquals(List.of(), linter.lintAll(List.of(), 4));
    }

}
