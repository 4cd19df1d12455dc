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
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Parsed form of a condition. Leaf nodes compare one property of the snapshot,
 * the others combine their children.
 */
public class Condition {

    public enum Type {
        AND,
        OR,
        NOT,
        EQUALS,
        CONTAINS,
        PRESENT
    }

    public final Type type;
    public final String property;
    public final String value;
    private final List<Condition> children;

    private Condition(Type type, String property, String value, List<Condition> children) {
        this.type = type;
        this.property = property;
        this.value = value;
        this.children = children;
    }

    static Condition and(List<Condition> children) {
        return new Condition(Type.AND, null, null, Collections.unmodifiableList(new ArrayList<>(children)));
    }

    static Condition or(List<Condition> children) {
        return new Condition(Type.OR, null, null, Collections.unmodifiableList(new ArrayList<>(children)));
    }

    static Condition not(Condition child) {
        return new Condition(Type.NOT, null, null, List.of(child));
    }

    static Condition equalTo(String property, String value) {
        return new Condition(Type.EQUALS, property, value, List.of());
    }

    static Condition contains(String property, String value) {
        return new Condition(Type.CONTAINS, property, value, List.of());
    }

    static Condition present(String property) {
        return new Condition(Type.PRESENT, property, null, List.of());
    }

    public List<Condition> getChildren() {
        return children;
    }

    public boolean evaluate(Map<String, String> properties) {
        switch (type) {
            case AND:
                for (Condition child : children) {
                    if (!child.evaluate(properties)) {
                        return false;
                    }
                }
                return true;
            case OR:
                for (Condition child : children) {
                    if (child.evaluate(properties)) {
                        return true;
                    }
                }
                return false;
            case NOT:
                return !children.get(0).evaluate(properties);
            case EQUALS:
                return actual(properties).equals(value);
            case CONTAINS:
                return actual(properties).contains(value);
            default: // PRESENT
                return !actual(properties).isEmpty();
        }
    }

    private String actual(Map<String, String> properties) {
        String actual = properties.get(property);
        return actual == null ? "" : actual;
    }

    @Override
    public String toString() {
        return switch (type) {
            case AND -> join(" + ");
            case OR -> join(" | ");
            case NOT -> {
                Condition child = children.get(0);
                boolean group = child.type == Type.AND || child.type == Type.OR;
                yield group ? "![" + child + "]" : "!" + child;
            }
            case EQUALS -> property + "=" + value;
            case CONTAINS -> property + "~" + value;
            case PRESENT -> property;
        };
    }

    private String join(String delimiter) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < children.size(); i++) {
            Condition child = children.get(i);
            if (i > 0) {
                sb.append(delimiter);
            }
            boolean group = child.type == Type.AND || child.type == Type.OR;
            if (group) {
                sb.append('[').append(child).append(']');
            } else {
                sb.append(child);
            }
        }
        return sb.toString();
    }

}
