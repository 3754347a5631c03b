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
 * Declaration kind bits of a symbol.
 */
public record SymbolFlags(int bits) {

    public static final SymbolFlags NONE = new SymbolFlags(0);
    public static final SymbolFlags FUNCTION_SCOPED_VARIABLE = new SymbolFlags(1);
    public static final SymbolFlags BLOCK_SCOPED_VARIABLE = new SymbolFlags(1 << 1);
    public static final SymbolFlags CONST_VARIABLE = new SymbolFlags(1 << 2);
    public static final SymbolFlags FUNCTION = new SymbolFlags(1 << 3);
    public static final SymbolFlags IMPORT = new SymbolFlags(1 << 4);
    public static final SymbolFlags PARAMETER = new SymbolFlags(1 << 5);

    public SymbolFlags or(SymbolFlags other) {
        return new SymbolFlags(bits | other.bits);
    }

    public boolean contains(SymbolFlags other) {
        return (bits & other.bits) == other.bits && other.bits != 0;
    }

    public boolean isVariable() {
        return (bits & (FUNCTION_SCOPED_VARIABLE.bits | BLOCK_SCOPED_VARIABLE.bits | CONST_VARIABLE.bits)) != 0;
    }

    public boolean isFunction() {
        return contains(FUNCTION);
    }

    public boolean isImport() {
        return contains(IMPORT);
    }

}
