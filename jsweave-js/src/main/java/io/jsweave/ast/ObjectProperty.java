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

/**
 * {@code key: value}, shorthand {@code {key}} or method shorthand {@code key() {}}, where the
 * value is then a {@link FunctionNode}.
 */
public class ObjectProperty extends BaseNode implements ObjectPropertyKind {

    public PropertyKey key;
    public Expression value;
    public boolean shorthand;
    public boolean method;
    public boolean computed;

    public ObjectProperty(Span span, PropertyKey key, Expression value, boolean shorthand, boolean method, boolean computed) {
        super(span);
        this.key = key;
        this.value = value;
        this.shorthand = shorthand;
        this.method = method;
        this.computed = computed;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OBJECT_PROPERTY;
    }

}
