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

import io.skinshortcuts.common.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the menu condition language.
 * <p>
 * Supports:
 * <ul>
 *   <li>{@code name=value} - equality, a missing property reads as empty</li>
 *   <li>{@code name~value} - substring match</li>
 *   <li>{@code name} - true if the property is not empty</li>
 *   <li>{@code a + b} - and, {@code a | b} - or</li>
 *   <li>{@code !atom} and {@code ![group]} - negation</li>
 *   <li>{@code [ ... ]} - grouping</li>
 *   <li>{@code name=a | b | c} - compact or, the name and operator cascade onto bare values</li>
 * </ul>
 * <p>
 * And is split before or, and negation binds to the adjacent atom or group only,
 * so {@code !a=1 + b=2} reads as {@code (!a=1) + (b=2)}.
 */
public class ConditionParser {

    private static final Pattern QUALIFIED_ATOM = Pattern.compile("^(!?)([a-zA-Z_][a-zA-Z0-9_.]*)([=~])(.*)$", Pattern.DOTALL);

    private ConditionParser() {
        // only static methods
    }

    public static Condition parse(String condition) {
        if (condition == null || condition.isBlank()) {
            throw new ConditionException(condition, "empty condition");
        }
        // parsing the raw text first reports structural errors against what the author wrote
        Condition parsed = parseExpression(condition, condition);
        if (condition.indexOf('|') != -1) {
            parsed = parseExpression(expandCompactOr(condition), condition);
        }
        return parsed;
    }

    /**
     * Expands compact or syntax, {@code widgetType=movies | episodes} becomes
     * {@code widgetType=movies | widgetType=episodes}. The property cascades from
     * the most recent fully qualified atom in the chain.
     */
    public static String expandCompactOr(String condition) {
        if (condition == null || condition.isEmpty()) {
            return condition;
        }
        List<String> result = new ArrayList<>();
        for (String part : split(condition, '+', condition)) {
            part = part.trim();
            if (part.isEmpty()) {
                continue;
            }
            boolean negated = part.charAt(0) == '!';
            if (negated) {
                part = part.substring(1).trim();
            }
            String expanded;
            if (isWrapped(part)) {
                expanded = "[" + expandCompactOr(part.substring(1, part.length() - 1).trim()) + "]";
            } else {
                expanded = expandOrSegment(part);
            }
            result.add(negated ? "!" + expanded : expanded);
        }
        return StringUtils.join(result, " + ");
    }

    private static String expandOrSegment(String segment) {
        List<String> parts = split(segment, '|', segment);
        if (parts.size() <= 1) {
            return segment;
        }
        List<String> result = new ArrayList<>(parts.size());
        String property = null;
        String operator = null;
        for (String part : parts) {
            part = part.trim();
            if (part.isEmpty()) {
                continue;
            }
            boolean negated = part.charAt(0) == '!';
            String group = negated ? part.substring(1).trim() : part;
            if (isWrapped(group)) {
                String inner = expandCompactOr(group.substring(1, group.length() - 1).trim());
                result.add((negated ? "![" : "[") + inner + "]");
                continue;
            }
            Matcher matcher = QUALIFIED_ATOM.matcher(part);
            if (matcher.matches()) {
                property = matcher.group(2);
                operator = matcher.group(3);
                result.add(part);
            } else if (property != null) {
                result.add(property + operator + part);
            } else {
                result.add(part);
            }
        }
        return StringUtils.join(result, " | ");
    }

    private static Condition parseExpression(String text, String source) {
        String c = text.trim();
        if (c.isEmpty()) {
            throw new ConditionException(source, "missing operand");
        }
        if (isWrapped(c)) {
            return parseExpression(c.substring(1, c.length() - 1), source);
        }
        List<String> andParts = split(c, '+', source);
        if (andParts.size() > 1) {
            List<Condition> children = new ArrayList<>(andParts.size());
            for (String part : andParts) {
                children.add(parseExpression(part, source));
            }
            return Condition.and(children);
        }
        List<String> orParts = split(c, '|', source);
        if (orParts.size() > 1) {
            List<Condition> children = new ArrayList<>(orParts.size());
            for (String part : orParts) {
                children.add(parseExpression(part, source));
            }
            return Condition.or(children);
        }
        return parseAtom(c, source);
    }

    private static Condition parseAtom(String text, String source) {
        String c = text.trim();
        if (c.isEmpty()) {
            throw new ConditionException(source, "missing operand");
        }
        if (c.charAt(0) == '!') {
            String inner = c.substring(1).trim();
            if (inner.isEmpty()) {
                throw new ConditionException(source, "nothing to negate");
            }
            if (isWrapped(inner)) {
                return Condition.not(parseExpression(inner.substring(1, inner.length() - 1), source));
            }
            return Condition.not(parseAtom(inner, source));
        }
        if (isWrapped(c)) {
            return parseExpression(c.substring(1, c.length() - 1), source);
        }
        int pos = c.indexOf('=');
        if (pos != -1) {
            return Condition.equalTo(propertyName(c, pos, source), c.substring(pos + 1).trim());
        }
        pos = c.indexOf('~');
        if (pos != -1) {
            return Condition.contains(propertyName(c, pos, source), c.substring(pos + 1).trim());
        }
        return Condition.present(c);
    }

    private static String propertyName(String atom, int operatorPos, String source) {
        String name = atom.substring(0, operatorPos).trim();
        if (name.isEmpty()) {
            throw new ConditionException(source, "missing property name");
        }
        return name;
    }

    /**
     * True only if the opening bracket at the start is closed by the last character,
     * {@code [a] + [b]} starts and ends with brackets but is not wrapped.
     */
    static boolean isWrapped(String text) {
        int length = text.length();
        if (length < 2 || text.charAt(0) != '[' || text.charAt(length - 1) != ']') {
            return false;
        }
        int depth = 0;
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth == 0 && i < length - 1) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    /**
     * Splits on the delimiter at bracket depth zero. Empty parts are kept so that
     * a dangling operator can be reported by the caller.
     */
    static List<String> split(String text, char delimiter, String source) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth < 0) {
                    throw new ConditionException(source, "unbalanced brackets");
                }
            } else if (c == delimiter && depth == 0) {
                parts.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (depth != 0) {
            throw new ConditionException(source, "unbalanced brackets");
        }
        parts.add(current.toString());
        return parts;
    }

}
