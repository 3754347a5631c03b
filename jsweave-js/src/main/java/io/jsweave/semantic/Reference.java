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
 * A use site of a name. The symbol id is absent while the reference is unresolved, which
 * for a finished table means the name is a global.
 */
public class Reference {

    public final ReferenceId id;
    public final String name;
    public final ScopeId scopeId;
    public final ReferenceFlags flags;

    SymbolId symbolId;

    Reference(ReferenceId id, String name, ScopeId scopeId, ReferenceFlags flags, SymbolId symbolId) {
        this.id = id;
        this.name = name;
        this.scopeId = scopeId;
        this.flags = flags;
        this.symbolId = symbolId;
    }

    public SymbolId getSymbolId() {
        return symbolId;
    }

    public boolean isResolved() {
        return symbolId != null;
    }

    @Override
    public String toString() {
        return name + "(" + flags + ")" + (symbolId == null ? " unresolved" : " -> " + symbolId);
    }

}
