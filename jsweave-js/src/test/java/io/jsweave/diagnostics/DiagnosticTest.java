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
package io.jsweave.diagnostics;

import io.jsweave.ast.Span;
import io.jsweave.common.Source;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    @Test
    void testBuilders() {
        Diagnostic d = Diagnostic.warn("Missing key")
                .withLabel(new Span(4, 8), "first")
                .withLabel(new Span(0, 2))
                .withHelp("add one")
                .withCode("react(jsx-key)");
        assertEquals(Severity.WARNING, d.severity());
        assertEquals(new Span(4, 8), d.primarySpan());
        assertEquals(2, d.labels().size());
        assertEquals("first", d.labels().get(0).label());
        assertNull(d.labels().get(1).label());
        assertEquals("add one", d.help());
        assertEquals(Severity.ERROR, d.withSeverity(Severity.ERROR).severity());
        assertEquals(Span.EMPTY, Diagnostic.error("x").primarySpan());
        assertThrows(IllegalArgumentException.class, () -> Diagnostic.warn(null));
    }

    @Test
    void testDisplay() {
        Source source = Source.of("App.jsx", "let a;\n  <audio />;");
        Diagnostic d = Diagnostic.warn("Missing caption").withCode("jsx-a11y(media-has-caption)").withLabel(new Span(9, 19));
        assertEquals("warning[jsx-a11y(media-has-caption)]: Missing caption at App.jsx:2:3", d.toDisplayString(source));
        assertEquals("error: bad", Diagnostic.error("bad").toDisplayString(source));
    }

}
