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

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable finding produced by an analysis pass. Built fluently, every {@code with}
 * method returns a new instance:
 * <pre>
 * Diagnostic.warn("Missing \"key\" prop for element in array.").withLabel(span)
 * </pre>
 * The first label is the primary span.
 */
public record Diagnostic(String code, String message, Severity severity, List<LabeledSpan> labels, String help) {

    public Diagnostic {
        if (message == null) {
            throw new IllegalArgumentException("message is required");
        }
        severity = severity == null ? Severity.WARNING : severity;
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public static Diagnostic warn(String message) {
        return new Diagnostic(null, message, Severity.WARNING, List.of(), null);
    }

    public static Diagnostic error(String message) {
        return new Diagnostic(null, message, Severity.ERROR, List.of(), null);
    }

    public Diagnostic withCode(String code) {
        return new Diagnostic(code, message, severity, labels, help);
    }

    public Diagnostic withSeverity(Severity severity) {
        return new Diagnostic(code, message, severity, labels, help);
    }

    public Diagnostic withLabel(Span span) {
        return withLabel(span, null);
    }

    public Diagnostic withLabel(Span span, String label) {
        List<LabeledSpan> list = new ArrayList<>(labels);
        list.add(new LabeledSpan(span, label));
        return new Diagnostic(code, message, severity, list, help);
    }

    public Diagnostic withHelp(String help) {
        return new Diagnostic(code, message, severity, labels, help);
    }

    public Span primarySpan() {
        return labels.isEmpty() ? Span.EMPTY : labels.get(0).span();
    }

    /**
     * One line summary such as {@code warning[react(jsx-key)]: message at App.jsx:3:7}.
     */
    public String toDisplayString(Source source) {
        StringBuilder sb = new StringBuilder();
        sb.append(severity.display());
        if (code != null) {
            sb.append('[').append(code).append(']');
        }
        sb.append(": ").append(message);
        if (source != null && !labels.isEmpty()) {
            sb.append(" at ").append(source.getName()).append(':').append(source.getPositionDisplay(primarySpan().start()));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toDisplayString(null) + " " + primarySpan();
    }

}
