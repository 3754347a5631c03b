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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LintConfigTest {

    @Test
    void testSeverities() {
        LintConfig config = LintConfig.fromJson("""
                {"rules": {"a": "off", "b": "error", "c": false, "d": 0, "e": 2, "f": "allow", "g": "deny", "h": "bogus"}}
                """);
        assertFalse(config.isEnabled("a"));
        assertTrue(config.isEnabled("b"));
        assertFalse(config.isEnabled("c"));
        assertFalse(config.isEnabled("d"));
        assertTrue(config.isEnabled("e"));
        assertFalse(config.isEnabled("f"));
        assertTrue(config.isEnabled("g"));
        assertTrue(config.isEnabled("h"));
        assertTrue(config.isEnabled("unknown"));
    }

    @Test
    void testOptions() {
        LintConfig config = LintConfig.fromJson("""
                {"rules": {
                  "media-has-caption": ["off", {"audio": ["Audio"]}],
                  "other": {"x": 1}
                }}
                """);
        assertFalse(config.isEnabled("media-has-caption"));
        assertEquals(List.of("Audio"), config.getOptions("media-has-caption").get("audio"));
        assertTrue(config.isEnabled("other"));
        assertEquals(1, config.getOptions("other").get("x"));
        assertEquals(Map.of(), config.getOptions("missing"));
    }

    @Test
    void testSettings() {
        LintConfig config = LintConfig.fromJson("""
                {"settings": {"jsx-a11y": {"polymorphicPropName": "as", "components": {"Audio": "audio", "Bad": 1}}}}
                """);
        LintSettings settings = config.getSettings();
        assertEquals("as", settings.getPolymorphicPropName());
        assertEquals(Map.of("Audio", "audio"), settings.getComponents());
        assertEquals("audio", settings.mapComponent("Audio"));
        assertEquals("Other", settings.mapComponent("Other"));
    }

    @Test
    void testTolerance() {
        assertSame(LintConfig.DEFAULT, LintConfig.fromJson("[1, 2]"));
        LintConfig config = LintConfig.fromJson("{\"rules\": 5, \"settings\": {\"jsx-a11y\": []}}");
        assertTrue(config.isEnabled("jsx-key"));
        assertSame(LintSettings.DEFAULT, config.getSettings());
        assertNull(config.getSettings().getPolymorphicPropName());
        assertThrows(IllegalArgumentException.class, () -> LintConfig.fromJson("{\"rules\": "));
    }

}
