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
package io.jsweave.semantic;

/**
 * How a reference uses its symbol. {@link #READ_WRITE} is the combination of both bits, as
 * for the target of {@code a += 1}.
 */
public record ReferenceFlags(int bits) {

    private static final int READ_BIT = 1;
    private static final int WRITE_BIT = 2;

    public static final ReferenceFlags NONE = new ReferenceFlags(0);
    public static final ReferenceFlags READ = new ReferenceFlags(READ_BIT);
    public static final ReferenceFlags WRITE = new ReferenceFlags(WRITE_BIT);
    public static final ReferenceFlags READ_WRITE = new ReferenceFlags(READ_BIT | WRITE_BIT);

    public ReferenceFlags or(ReferenceFlags other) {
        return new ReferenceFlags(bits | other.bits);
    }

    public boolean isRead() {
        return (bits & READ_BIT) != 0;
    }

    public boolean isWrite() {
        return (bits & WRITE_BIT) != 0;
    }

    public boolean isReadWrite() {
        return isRead() && isWrite();
    }

    @Override
    public String toString() {
        if (isReadWrite()) {
            return "ReadWrite";
        }
        if (isRead()) {
            return "Read";
        }
        return isWrite() ? "Write" : "None";
    }

}
