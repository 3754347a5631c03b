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
package io.jsweave.traverse;

import io.jsweave.ast.AstNode;
import io.jsweave.ast.NodeKind;

/**
 * One ancestry entry: the parent node and the slot the walk descended through.
 * {@code index} is the position in a list slot, and -1 for single slots.
 */
public record Ancestor(AstNode node, Slot slot, int index) {

    public Ancestor {
        if (node == null || slot == null) {
            throw new IllegalArgumentException("node and slot are required");
        }
        if (slot.list != (index >= 0)) {
            throw new IllegalArgumentException("index " + index + " does not fit slot " + slot);
        }
    }

    public NodeKind kind() {
        return node.kind();
    }

    public boolean is(NodeKind kind) {
        return node.kind() == kind;
    }

    @Override
    public String toString() {
        return node.kind() + "." + slot + (index >= 0 ? "[" + index + "]" : "");
    }

}
