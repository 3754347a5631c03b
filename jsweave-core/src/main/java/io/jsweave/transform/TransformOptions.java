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
package io.jsweave.transform;

import net.minidev.json.JSONValue;
import net.minidev.json.parser.ParseException;

import java.util.Map;

/**
 * Names of the runtime helper the lowering calls, {@code babelHelpers.asyncToGenerator} by
 * default.
 */
public class TransformOptions {

    public static final String DEFAULT_HELPER_OBJECT = "babelHelpers";
    public static final String DEFAULT_HELPER_METHOD = "asyncToGenerator";

    public static final TransformOptions DEFAULT = new TransformOptions(DEFAULT_HELPER_OBJECT, DEFAULT_HELPER_METHOD);

    private final String helperObject;
    private final String helperMethod;

    public TransformOptions(String helperObject, String helperMethod) {
        this.helperObject = helperObject;
        this.helperMethod = helperMethod;
    }

    /**
     * Reads {@code {"helperObject": "...", "helperMethod": "..."}}, keeping the default for a
     * missing or non-string value.
     */
    public static TransformOptions fromJson(String json) {
        Object parsed;
        try {
            parsed = JSONValue.parseWithException(json);
        } catch (ParseException e) {
            throw new IllegalArgumentException("invalid transform options: " + e.getMessage(), e);
        }
        if (!(parsed instanceof Map<?, ?> map)) {
            return DEFAULT;
        }
        String object = map.get("helperObject") instanceof String o && !o.isEmpty() ? o : DEFAULT_HELPER_OBJECT;
        String method = map.get("helperMethod") instanceof String m && !m.isEmpty() ? m : DEFAULT_HELPER_METHOD;
        return new TransformOptions(object, method);
    }

    public String getHelperObject() {
        return helperObject;
    }

    public String getHelperMethod() {
        return helperMethod;
    }

    @Override
    public String toString() {
        return helperObject + "." + helperMethod;
    }

}
