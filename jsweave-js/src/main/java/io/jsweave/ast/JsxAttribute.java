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
 * {@code name="value"}, {@code name={expr}} or a bare {@code name} (null value).
 */
public class JsxAttribute extends BaseNode implements JsxAttributeItem {

    public JsxAttributeName name;
    public JsxAttributeValue value;

    public JsxAttribute(Span span, JsxAttributeName name, JsxAttributeValue value) {
        super(span);
        this.name = name;
        this.value = value;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.JSX_ATTRIBUTE;
    }

    public boolean isIdentifier(String text) {
        return name instanceof JsxIdentifier ident && ident.name.equals(text);
    }

    /**
     * @return the literal string value for {@code name="value"}, else null
     */
    public String getStringValue() {
        return value instanceof StringLiteral sl ? sl.value : null;
    }

}
