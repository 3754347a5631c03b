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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ancestor stack of the walk. Visitors get a read-only view, only the {@link Traverser}
 * pushes and pops.
 */
public class Ancestry {

    private final List<Ancestor> stack = new ArrayList<>();

    void push(Ancestor ancestor) {
        stack.add(ancestor);
    }

    Ancestor pop() {
        if (stack.isEmpty()) {
            throw new TraversalException("ancestor stack underflow");
        }
        return stack.remove(stack.size() - 1);
    }

    public int depth() {
        return stack.size();
    }

    /**
     * @return the nearest entry, or null at the root
     */
    public Ancestor parent() {
        return stack.isEmpty() ? null : stack.get(stack.size() - 1);
    }

    /**
     * @param level 0 for the parent, 1 for the grandparent and so on
     * @return the entry, or null when the walk is not that deep
     */
    public Ancestor get(int level) {
        int index = stack.size() - 1 - level;
        return index < 0 ? null : stack.get(index);
    }

    /**
     * @return entries nearest first
     */
    public List<Ancestor> nearestFirst() {
        List<Ancestor> reversed = new ArrayList<>(stack);
        Collections.reverse(reversed);
        return Collections.unmodifiableList(reversed);
    }

    /**
     * @return immutable copy, root first
     */
    public List<Ancestor> snapshot() {
        return List.copyOf(stack);
    }

    public Ancestor findNearest(NodeKind... kinds) {
        for (int i = stack.size() - 1; i >= 0; i--) {
            Ancestor ancestor = stack.get(i);
            if (ancestor.kind().oneOf(kinds)) {
                return ancestor;
            }
        }
        return null;
    }

    /**
     * @return the nearest enclosing function or arrow, or null at top level
     */
    public AstNode findNearestFunction() {
        for (int i = stack.size() - 1; i >= 0; i--) {
            AstNode node = stack.get(i).node();
            if (node.kind().functionLike) {
                return node;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return stack.toString();
    }

}
