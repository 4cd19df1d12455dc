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
package io.skinshortcuts.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites property names to a slot variant, so that one definition written
 * against {@code widgetArt} can serve {@code widgetArt.2}.
 * <p>
 * In a condition only the name in front of an {@code =} or {@code ~} operator is
 * rewritten, values are left alone. Text inside a {@code {NOSUFFIX:...}} marker
 * is never touched. Inside a marker {@code \} and {@code }} are escaped with a
 * backslash.
 */
public class SuffixTransform {

    public static final Set<String> NO_SUFFIX_PROPERTIES = Set.of("index", "name", "menu", "default", "id", "idprefix");

    static final Set<String> NO_SUFFIX_CONDITION_PROPERTIES = Set.of("index", "name", "menu", "default", "id", "idprefix", "suffix");

    public static final String NO_SUFFIX_PREFIX = "{NOSUFFIX:";

    private static final Pattern PLACEHOLDER = Pattern.compile("__NOSUFFIX_(\\d+)__");
    private static final Pattern PROPERTY_NAME = Pattern.compile("(^|[+|\\[!])(\\s*)([a-zA-Z_][a-zA-Z0-9_.]*)(\\s*)([=~])");
    private static final Pattern PROPERTY_REF = Pattern.compile("\\$PROPERTY\\[([^\\]]+)\\]");

    private SuffixTransform() {
        // only static methods
    }

    public static String toCondition(String condition, String suffix) {
        if (condition == null || condition.isEmpty() || suffix == null || suffix.isEmpty()) {
            return condition;
        }
        List<String> preserved = new ArrayList<>();
        String masked = replaceMarkers(condition, marker -> {
            preserved.add(marker);
            return "__NOSUFFIX_" + (preserved.size() - 1) + "__";
        });
        String transformed = renameProperties(masked, suffix);
        if (preserved.isEmpty()) {
            return transformed;
        }
        Matcher placeholder = PLACEHOLDER.matcher(transformed);
        StringBuilder restored = new StringBuilder();
        while (placeholder.find()) {
            int index = Integer.parseInt(placeholder.group(1));
            placeholder.appendReplacement(restored, Matcher.quoteReplacement(preserved.get(index)));
        }
        placeholder.appendTail(restored);
        return restored.toString();
    }

    private static String renameProperties(String condition, String suffix) {
        Matcher matcher = PROPERTY_NAME.matcher(condition);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(3);
            String replacement;
            if (NO_SUFFIX_CONDITION_PROPERTIES.contains(name) || name.startsWith("__NOSUFFIX_")) {
                replacement = matcher.group();
            } else {
                replacement = matcher.group(1) + matcher.group(2) + name + suffix + matcher.group(4) + matcher.group(5);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Suffix for the source name of an indirect property. Built-in names are kept,
     * a source made of {@code $PROPERTY[...]} references has only its last
     * referenced name suffixed.
     */
    public static String toSource(String source, String suffix) {
        if (source == null || source.isEmpty() || suffix == null || suffix.isEmpty()) {
            return source;
        }
        if (NO_SUFFIX_PROPERTIES.contains(source)) {
            return source;
        }
        Matcher matcher = PROPERTY_REF.matcher(source);
        int start = -1;
        int end = -1;
        String name = null;
        while (matcher.find()) {
            start = matcher.start(1);
            end = matcher.end(1);
            name = matcher.group(1);
        }
        if (name == null) {
            return source + suffix;
        }
        if (NO_SUFFIX_PROPERTIES.contains(name)) {
            return source;
        }
        return source.substring(0, start) + name + suffix + source.substring(end);
    }

    public static String wrapNoSuffix(String expansion) {
        return NO_SUFFIX_PREFIX + expansion.replace("\\", "\\\\").replace("}", "\\}") + "}";
    }

    /**
     * Removes the markers and keeps their content, done right before evaluation.
     */
    public static String stripMarkers(String condition) {
        if (condition == null || !condition.contains(NO_SUFFIX_PREFIX)) {
            return condition;
        }
        return replaceMarkers(condition, SuffixTransform::markerContent);
    }

    private static String replaceMarkers(String condition, Function<String, String> replacement) {
        StringBuilder sb = new StringBuilder();
        int pos = 0;
        int start = condition.indexOf(NO_SUFFIX_PREFIX);
        while (start != -1) {
            int end = markerEnd(condition, start + NO_SUFFIX_PREFIX.length());
            if (end == -1) {
                // unterminated, left as plain text
                break;
            }
            sb.append(condition, pos, start);
            sb.append(replacement.apply(condition.substring(start, end + 1)));
            pos = end + 1;
            start = condition.indexOf(NO_SUFFIX_PREFIX, pos);
        }
        sb.append(condition, pos, condition.length());
        return sb.toString();
    }

    private static int markerEnd(String s, int from) {
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '}') {
                return i;
            }
        }
        return -1;
    }

    private static String markerContent(String marker) {
        String escaped = marker.substring(NO_SUFFIX_PREFIX.length(), marker.length() - 1);
        StringBuilder sb = new StringBuilder(escaped.length());
        for (int i = 0; i < escaped.length(); i++) {
            char c = escaped.charAt(i);
            if (c == '\\' && i + 1 < escaped.length()) {
                c = escaped.charAt(++i);
            }
            sb.append(c);
        }
        return sb.toString();
    }

}
