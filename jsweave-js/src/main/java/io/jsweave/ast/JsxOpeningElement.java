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

import java.util.ArrayList;
import java.util.List;

public class JsxOpeningElement extends BaseNode {

    public JsxElementName name;
    public final List<JsxAttributeItem> attributes;
    public boolean selfClosing;

    public JsxOpeningElement(Span span, JsxElementName name, List<JsxAttributeItem> attributes, boolean selfClosing) {
        super(span);
        this.name = name;
        this.attributes = new ArrayList<>(attributes);
        this.selfClosing = selfClosing;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.JSX_OPENING_ELEMENT;
    }

    /**
     * @return the first plain attribute with this name, else null
     */
    public JsxAttribute getAttribute(String name) {
        for (JsxAttributeItem item : attributes) {
            if (item instanceof JsxAttribute attr && attr.isIdentifier(name)) {
                return attr;
            }
        }
        return null;
    }

    /**
     * @return the tag name for simple identifiers ({@code div}, {@code App}), else null
     */
    public String getIdentifierName() {
        return name instanceof JsxIdentifier ident ? ident.name : null;
    }

}
