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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Scope {

    public final ScopeId id;
    public final ScopeId parentId;
    public final ScopeKind kind;

    final Map<String, SymbolId> bindings = new LinkedHashMap<>();
    final List<ScopeId> children = new ArrayList<>();

    Scope(ScopeId id, ScopeId parentId, ScopeKind kind) {
        this.id = id;
        this.parentId = parentId;
        this.kind = kind;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public SymbolId getBinding(String name) {
        return bindings.get(name);
    }

    public Map<String, SymbolId> getBindings() {
        return Collections.unmodifiableMap(bindings);
    }

    public List<ScopeId> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toString() {
        return kind + "#" + id.index() + bindings.keySet();
    }

}
