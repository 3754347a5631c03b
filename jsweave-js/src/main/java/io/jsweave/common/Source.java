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
package io.jsweave.common;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Source text of one compilation unit. Offsets used by spans are char offsets into
 * {@link #getText()}.
 */
public class Source {

    public static final String INLINE = "(inline)";

    private final String name;
    private final String text;

    private String[] lines;
    private int[] lineStarts;

    public static Source of(String text) {
        return new Source(INLINE, text);
    }

    public static Source of(String name, String text) {
        return new Source(name, text);
    }

    public static Source of(Path path) {
        try {
            return new Source(path.toString(), Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Source(String name, String text) {
        this.name = name == null ? INLINE : name;
        this.text = text == null ? "" : text;
    }

    public String getName() {
        return name;
    }

    public String getText() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public String getLine(int index) {
        if (lines == null) {
            lines = text.split("\\r?\\n", -1);
        }
        if (index < 0 || index >= lines.length) {
            return "";
        }
        return lines[index];
    }

    /**
     * @return zero-based line of the char offset
     */
    public int lineOf(int offset) {
        int[] starts = getLineStarts();
        int found = Arrays.binarySearch(starts, offset);
        return found >= 0 ? found : -found - 2;
    }

    /**
     * @return zero-based column of the char offset
     */
    public int columnOf(int offset) {
        return offset - getLineStarts()[lineOf(offset)];
    }

    public String getPositionDisplay(int offset) {
        return (lineOf(offset) + 1) + ":" + (columnOf(offset) + 1);
    }

    public String substring(int start, int end) {
        int from = Math.max(0, Math.min(start, text.length()));
        int to = Math.max(from, Math.min(end, text.length()));
        return text.substring(from, to);
    }

    private int[] getLineStarts() {
        if (lineStarts == null) {
            int count = 1;
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    count++;
                }
            }
            int[] starts = new int[count];
            int line = 1;
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    starts[line++] = i + 1;
                }
            }
            lineStarts = starts;
        }
        return lineStarts;
    }

    @Override
    public String toString() {
        return name;
    }

}
