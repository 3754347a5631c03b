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

import io.jsweave.ast.BooleanLiteral;
import io.jsweave.ast.JsxAttribute;
import io.jsweave.ast.JsxAttributeItem;
import io.jsweave.ast.JsxChild;
import io.jsweave.ast.JsxElement;
import io.jsweave.ast.JsxExpressionContainer;
import io.jsweave.ast.JsxIdentifier;
import io.jsweave.ast.JsxOpeningElement;
import io.jsweave.ast.Span;
import io.jsweave.ast.StringLiteral;
import io.jsweave.diagnostics.Diagnostic;
import io.jsweave.lint.LintRule;
import io.jsweave.lint.LintSettings;
import io.jsweave.traverse.TraverseCtx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code jsx-a11y(media-has-caption)}: an {@code <audio>} or {@code <video>} that is not
 * muted needs a {@code <track kind="captions">} child.
 * <p>
 * Options {@code audio}, {@code video} and {@code track} add tag names to each class, and the
 * shared {@link LintSettings} can map custom components and name a polymorphic prop.
 */
public class MediaHasCaption implements LintRule {

    static final Logger logger = LoggerFactory.getLogger(MediaHasCaption.class);

    public static final String NAME = "media-has-caption";

    static final String MESSAGE = "Missing <track> element with captions inside <audio> or <video> element";
    static final String HELP = "Media elements such as <audio> and <video> must have a <track> for captions.";

    private final Set<String> audio;
    private final Set<String> video;
    private final Set<String> track;
    private final LintSettings settings;

    public MediaHasCaption() {
        this(List.of(), List.of(), List.of(), LintSettings.DEFAULT);
    }

    /**
     * @param audio names added to {@code audio}
     * @param video names added to {@code video}
     * @param track names added to {@code track}
     */
    public MediaHasCaption(Collection<String> audio, Collection<String> video, Collection<String> track, LintSettings settings) {
        this.audio = extend("audio", audio);
        this.video = extend("video", video);
        this.track = extend("track", track);
        this.settings = settings == null ? LintSettings.DEFAULT : settings;
    }

    private static Set<String> extend(String name, Collection<String> extra) {
        Set<String> set = new LinkedHashSet<>();
        set.add(name);
        set.addAll(extra);
        return Collections.unmodifiableSet(set);
    }

    public static MediaHasCaption fromOptions(Map<String, Object> options, LintSettings settings) {
        return new MediaHasCaption(strings(options, "audio"), strings(options, "video"), strings(options, "track"), settings);
    }

    private static List<String> strings(Map<String, Object> options, String key) {
        Object value = options.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            logger.warn("ignoring {}.{}, not an array: {}", NAME, key, value);
            return List.of();
        }
        return list.stream().filter(String.class::isInstance).map(String.class::cast).toList();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String plugin() {
        return "jsx-a11y";
    }

    Set<String> getAudio() {
        return audio;
    }

    Set<String> getVideo() {
        return video;
    }

    Set<String> getTrack() {
        return track;
    }

    @Override
    public void enterJsxElement(JsxElement node, TraverseCtx ctx) {
        JsxOpeningElement opening = node.openingElement;
        String name = getElementName(opening);
        if (!audio.contains(name) && !video.contains(name)) {
            return;
        }
        if (isMuted(opening)) {
            return;
        }
        if (node.children.isEmpty()) {
            report(ctx, diagnostic(opening.getSpan()));
            return;
        }
        for (JsxChild child : node.children) {
            if (child instanceof JsxElement element && isCaptionTrack(element.openingElement)) {
                return;
            }
        }
        report(ctx, diagnostic(node.getSpan()));
    }

    private static Diagnostic diagnostic(Span span) {
        return Diagnostic.warn(MESSAGE).withLabel(span).withHelp(HELP);
    }

    /**
     * Effective tag name: the polymorphic prop's string value when configured and present,
     * else the plain tag name, then mapped through the component table. Empty for member and
     * namespaced tags.
     */
    String getElementName(JsxOpeningElement opening) {
        if (!(opening.name instanceof JsxIdentifier ident)) {
            return "";
        }
        String name = ident.name;
        String polymorphic = settings.getPolymorphicPropName();
        if (polymorphic != null) {
            JsxAttribute attr = opening.getAttribute(polymorphic);
            if (attr != null && attr.getStringValue() != null) {
                name = attr.getStringValue();
            }
        }
        return settings.mapComponent(name);
    }

    private static boolean isMuted(JsxOpeningElement opening) {
        for (JsxAttributeItem item : opening.attributes) {
            if (item instanceof JsxAttribute attr && attr.isIdentifier("muted")) {
                if (attr.value == null) {
                    return true;
                }
                if (attr.value instanceof JsxExpressionContainer container
                        && container.expression instanceof BooleanLiteral bool && bool.value) {
                    return true;
                }
                if (attr.value instanceof StringLiteral sl && "true".equals(sl.value)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean isCaptionTrack(JsxOpeningElement opening) {
        if (!track.contains(getElementName(opening))) {
            return false;
        }
        for (JsxAttributeItem item : opening.attributes) {
            if (item instanceof JsxAttribute attr && attr.isIdentifier("kind")) {
                String kind = attr.getStringValue();
                if (kind != null && kind.equalsIgnoreCase("captions")) {
                    return true;
                }
            }
        }
        return false;
    }

}
