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
package io.jsweave.lint;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Settings shared by every rule, as opposed to per-rule options. Only the {@code jsx-a11y}
 * section is understood.
 */
public class LintSettings {

    public static final LintSettings DEFAULT = new LintSettings(null, Map.of());

    private final String polymorphicPropName;
    private final Map<String, String> components;

    public LintSettings(String polymorphicPropName, Map<String, String> components) {
        this.polymorphicPropName = polymorphicPropName;
        this.components = components == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(components));
    }

    /**
     * Reads {@code {"jsx-a11y": {"polymorphicPropName": "as", "components": {"Audio": "audio"}}}}.
     * Values of the wrong type are skipped.
     */
    static LintSettings fromMap(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return DEFAULT;
        }
        Object a11y = map.get("jsx-a11y");
        if (!(a11y instanceof Map<?, ?> a11yMap)) {
            return DEFAULT;
        }
        String polymorphic = a11yMap.get("polymorphicPropName") instanceof String s ? s : null;
        Map<String, String> components = new HashMap<>();
        if (a11yMap.get("components") instanceof Map<?, ?> componentMap) {
            componentMap.forEach((k, v) -> {
                if (k instanceof String key && v instanceof String target) {
                    components.put(key, target);
                }
            });
        }
        return new LintSettings(polymorphic, components);
    }

    /**
     * @return prop that overrides a tag's identity, such as {@code as}, or null
     */
    public String getPolymorphicPropName() {
        return polymorphicPropName;
    }

    public Map<String, String> getComponents() {
        return components;
    }

    public String mapComponent(String name) {
        return components.getOrDefault(name, name);
    }

    @Override
    public String toString() {
        return "polymorphicPropName: " + polymorphicPropName + ", components: " + components;
    }

}
