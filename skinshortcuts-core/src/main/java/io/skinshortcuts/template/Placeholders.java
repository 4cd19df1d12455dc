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
package io.skinshortcuts.template;

import io.skinshortcuts.model.MenuItem;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Placeholders {

    private static final Pattern PROPERTY_REF = Pattern.compile("\\$PROPERTY\\[([^\\]]+)\\]");

    private Placeholders() {
        // only static methods
    }

    /**
     * Replaces every {@code $PROPERTY[name]} with the context value, else the
     * item's own property, else nothing.
     */
    public static String substitute(String text, Map<String, String> context, MenuItem item) {
        if (text == null || !text.contains("$PROPERTY[")) {
            return text;
        }
        Matcher matcher = PROPERTY_REF.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(lookup(matcher.group(1), context, item)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    static String lookup(String name, Map<String, String> context, MenuItem item) {
        String value = context.get(name);
        if (value != null) {
            return value;
        }
        return item.properties().getOrDefault(name, "");
    }

}
