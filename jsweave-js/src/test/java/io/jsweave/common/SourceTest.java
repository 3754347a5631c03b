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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceTest {

    @Test
    void testPositions() {
        Source source = Source.of("ab\ncd\n\nef");
        assertEquals(Source.INLINE, source.getName());
        assertEquals(0, source.lineOf(0));
        assertEquals(0, source.lineOf(2));
        assertEquals(1, source.lineOf(3));
        assertEquals(2, source.lineOf(6));
        assertEquals(3, source.lineOf(7));
        assertEquals(1, source.columnOf(4));
        assertEquals("2:2", source.getPositionDisplay(4));
        assertEquals("cd", source.getLine(1));
        assertEquals("", source.getLine(9));
    }

    @Test
    void testSubstringClamps() {
        Source source = Source.of("hello");
        assertEquals("ell", source.substring(1, 4));
        assertEquals("lo", source.substring(3, 99));
        assertEquals("", source.substring(7, 2));
    }

}
