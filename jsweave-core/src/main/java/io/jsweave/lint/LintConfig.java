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

import net.minidev.json.JSONValue;
import net.minidev.json.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loosely typed lint configuration:
 * <pre>
 * {
 *   "rules": {
 *     "jsx-key": "warn",
 *     "media-has-caption": ["warn", {"audio": ["Audio"]}],
 *     "some-rule": "off"
 *   },
 *   "settings": {"jsx-a11y": {"polymorphicPropName": "as"}}
 * }
 * </pre>
 * A rule entry is a severity, an options object, or an array mixing both. Unknown keys and
 * wrong-typed values are ignored and the defaults kept.
 */
public class LintConfig {

    static final Logger logger = LoggerFactory.getLogger(LintConfig.class);

    public static final LintConfig DEFAULT = new LintConfig(Map.of(), Map.of(), LintSettings.DEFAULT);

    private final Map<String, Map<String, Object>> ruleOptions;
    private final Map<String, Boolean> ruleEnabled;
    private final LintSettings settings;

    private LintConfig(Map<String, Map<String, Object>> ruleOptions, Map<String, Boolean> ruleEnabled, LintSettings settings) {
        this.ruleOptions = ruleOptions;
        this.ruleEnabled = ruleEnabled;
        this.settings = settings;
    }

    /**
     * @throws IllegalArgumentException if the text is not JSON at all
     */
    @SuppressWarnings("unchecked")
    public static LintConfig fromJson(String json) {
        Object parsed;
        try {
            parsed = JSONValue.parseWithException(json);
        } catch (ParseException e) {
            throw new IllegalArgumentException("invalid lint config: " + e.getMessage(), e);
        }
        if (!(parsed instanceof Map)) {
            logger.warn("lint config is not an object, using defaults: {}", json);
            return DEFAULT;
        }
        return fromMap((Map<String, Object>) parsed);
    }

    public static LintConfig fromMap(Map<String, Object> map) {
        Map<String, Map<String, Object>> options = new LinkedHashMap<>();
        Map<String, Boolean> enabled = new LinkedHashMap<>();
        if (map.get("rules") instanceof Map<?, ?> rules) {
            rules.forEach((k, v) -> {
                if (!(k instanceof String name)) {
                    return;
                }
                Boolean on = null;
                Map<String, Object> ruleOptions = null;
                if (v instanceof List<?> list) {
                    for (Object item : list) {
                        if (on == null) {
                            on = toEnabled(item);
                        }
                        if (ruleOptions == null) {
                            ruleOptions = toOptions(item);
                        }
                    }
                } else {
                    on = toEnabled(v);
                    ruleOptions = toOptions(v);
                }
                if (on != null) {
                    enabled.put(name, on);
                }
                if (ruleOptions != null) {
                    options.put(name, ruleOptions);
                }
            });
        }
        LintSettings settings = LintSettings.fromMap(map.get("settings"));
        return new LintConfig(options, enabled, settings);
    }

    private static Boolean toEnabled(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return switch (s) {
                case "off", "allow" -> false;
                case "warn", "error", "deny", "on" -> true;
                default -> null;
            };
        }
        if (value instanceof Number n) {
            return n.intValue() != 0;
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> toOptions(Object value) {
        if (value instanceof Map<?, ?> map) {
            return Collections.unmodifiableMap(new LinkedHashMap<>((Map<String, Object>) map));
        }
        return null;
    }

    public boolean isEnabled(String ruleName) {
        return ruleEnabled.getOrDefault(ruleName, true);
    }

    /**
     * @return options object of the rule, empty when absent or malformed
     */
    public Map<String, Object> getOptions(String ruleName) {
        return ruleOptions.getOrDefault(ruleName, Map.of());
    }

    public LintSettings getSettings() {
        return settings;
    }

    @Override
    public String toString() {
        return "enabled: " + ruleEnabled + ", options: " + ruleOptions + ", settings: " + settings;
    }

}
