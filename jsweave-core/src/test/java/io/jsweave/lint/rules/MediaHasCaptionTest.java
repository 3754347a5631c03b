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
package io.jsweave.lint.rules;

import io.jsweave.ast.Span;
import io.jsweave.diagnostics.Diagnostic;
import io.jsweave.lint.LintConfig;
import io.jsweave.lint.LintResult;
import io.jsweave.lint.LintRule;
import io.jsweave.lint.LintSettings;
import io.jsweave.lint.Linter;
import io.jsweave.semantic.SemanticBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MediaHasCaptionTest {

    static final MediaHasCaption DEFAULT = new MediaHasCaption();

    static final MediaHasCaption CONFIGURED = new MediaHasCaption(
            List.of("Audio"), List.of("Video"), List.of("Track"), LintSettings.DEFAULT);

    static final MediaHasCaption WITH_SETTINGS = new MediaHasCaption(List.of(), List.of(), List.of(),
            new LintSettings("as", Map.of("Audio", "audio", "Video", "video", "Track", "track")));

    private static List<Diagnostic> lint(String text, LintRule rule) {
        LintResult result = new Linter(List.of(rule)).lint(SemanticBuilder.parse(text));
        assertTrue(result.failures().isEmpty(), result.failures().toString());
        return result.diagnostics();
    }

    private static void pass(String text, LintRule rule) {
        assertEquals(List.of(), lint(text, rule), text);
    }

    private static void fail(String text, LintRule rule) {
        List<Diagnostic> diagnostics = lint(text, rule);
        assertEquals(1, diagnostics.size(), text);
        Diagnostic d = diagnostics.get(0);
        assertEquals("jsx-a11y(media-has-caption)", d.code());
        assertEquals(MediaHasCaption.MESSAGE, d.message());
        assertEquals(MediaHasCaption.HELP, d.help());
    }

    @Test
    void testDefaults() {
        pass("<div />;", DEFAULT);
        pass("<MyDiv />;", DEFAULT);
        pass("<audio><track kind='captions' /></audio>", DEFAULT);
        pass("<audio><track kind='Captions' /></audio>", DEFAULT);
        pass("<audio><track kind='Captions' /><track kind='subtitles' /></audio>", DEFAULT);
        pass("<video><track kind='captions' /></video>", DEFAULT);
        pass("<video><track kind='Captions' /><track kind='subtitles' /></video>", DEFAULT);
        pass("<audio muted={true}></audio>", DEFAULT);
        pass("<video muted={true}></video>", DEFAULT);
        pass("<video muted></video>", DEFAULT);
        pass("<video muted=\"true\"></video>", DEFAULT);
        fail("<audio><track /></audio>", DEFAULT);
        fail("<audio><track kind='subtitles' /></audio>", DEFAULT);
        fail("<audio />", DEFAULT);
        fail("<video><track /></video>", DEFAULT);
        fail("<video><track kind='subtitles' /></video>", DEFAULT);
        fail("<video />", DEFAULT);
        fail("<audio>Foo</audio>", DEFAULT);
        fail("<video>Foo</video>", DEFAULT);
        fail("<video muted={false}></video>", DEFAULT);
        fail("<Audio muted={false}></Audio>", CONFIGURED);
    }

    @Test
    void testConfiguredNames() {
        pass("<Audio><track kind='captions' /></Audio>", CONFIGURED);
        pass("<audio><Track kind='captions' /></audio>", CONFIGURED);
        pass("<Video><Track kind='captions' /></Video>", CONFIGURED);
        pass("<Video muted></Video>", CONFIGURED);
        pass("<Audio muted={true}></Audio>", CONFIGURED);
        fail("<Audio />", CONFIGURED);
        fail("<Video />", CONFIGURED);
        fail("<audio><Track /></audio>", CONFIGURED);
        fail("<Video><Track kind='subtitles' /></Video>", CONFIGURED);
        pass("<Audio />", DEFAULT);
    }

    @Test
    void testSettings() {
        pass("<Audio><track kind='captions' /></Audio>", WITH_SETTINGS);
        pass("<video><Track kind='captions' /></video>", WITH_SETTINGS);
        pass("<Audio muted></Audio>", WITH_SETTINGS);
        pass("<Box as='audio' muted={true}></Box>", WITH_SETTINGS);
        pass("<Box as='audio'><track kind='captions' /></Box>", WITH_SETTINGS);
        fail("<Audio muted={false}></Audio>", WITH_SETTINGS);
        fail("<Video />", WITH_SETTINGS);
        fail("<Box as='audio'><Track kind='subtitles' /></Box>", WITH_SETTINGS);
        fail("<Box as='video' />", WITH_SETTINGS);
        pass("<Box as='audio' />", DEFAULT);
    }

    @Test
    void testSpans() {
        assertEquals(new Span(0, 9), lint("<audio />", DEFAULT).get(0).primarySpan());
        assertEquals(new Span(0, 7), lint("<audio></audio>", DEFAULT).get(0).primarySpan());
        assertEquals(new Span(0, 18), lint("<audio>Foo</audio>", DEFAULT).get(0).primarySpan());
    }

    @Test
    void testFromConfig() {
        LintConfig config = LintConfig.fromJson("""
                {
                  "rules": {
                    "jsx-key": "off",
                    "media-has-caption": ["error", {"audio": ["Audio", 7], "video": "Video", "track": ["Track"]}]
                  },
                  "settings": {"jsx-a11y": {"polymorphicPropName": "as", "components": {"Player": "video"}}}
                }
                """);
        MediaHasCaption rule = MediaHasCaption.fromOptions(config.getOptions(MediaHasCaption.NAME), config.getSettings());
        assertEquals(Set.of("audio", "Audio"), rule.getAudio());
        assertEquals(Set.of("video"), rule.getVideo());
        assertEquals(Set.of("track", "Track"), rule.getTrack());
        Linter linter = Linter.fromConfig(config);
        assertEquals(1, linter.getRules().size());
        LintResult result = linter.lint(SemanticBuilder.parse("<Player><Track kind='captions' /></Player>;\n<Player />;"));
        assertEquals(1, result.diagnostics().size());
        assertEquals(new Span(44, 54), result.diagnostics().get(0).primarySpan());
    }

}
