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
package io.jsweave.ast;

import io.jsweave.semantic.ScopeId;

import java.util.ArrayList;
import java.util.List;

public class BlockStatement extends BaseNode implements Statement, ScopeOwner {

    public final List<Statement> body;

    private ScopeId scopeId;

    public BlockStatement(Span span, List<Statement> body) {
        super(span);
        this.body = new ArrayList<>(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BLOCK_STATEMENT;
    }

    @Override
    public ScopeId getScopeId() {
        return scopeId;
    }

    @Override
    public void setScopeId(ScopeId scopeId) {
        this.scopeId = scopeId;
    }

}
