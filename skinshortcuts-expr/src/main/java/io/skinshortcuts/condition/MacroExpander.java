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

import io.skinshortcuts.common.Diagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code $EXP[name]} references, recursively. The expansion is
 * substituted as written, without grouping. An unknown name, a
 * reference back into a macro still being expanded, or nesting beyond
 * {@link #MAX_DEPTH} leaves the reference as it is.
 */
public class MacroExpander {

    static final Logger logger = LoggerFactory.getLogger(MacroExpander.class);

    public static final int MAX_DEPTH = 16;

    private static final Pattern EXP_REF = Pattern.compile("\\$EXP\\[([^\\]]+)\\]");

    private final Function<String, Macro> lookup;
    private final Diagnostics diagnostics;

    public MacroExpander(Function<String, Macro> lookup, Diagnostics diagnostics) {
        this.lookup = lookup;
        this.diagnostics = diagnostics;
    }

    public String expand(String condition) {
        if (condition == null || !condition.contains("$EXP[")) {
            return condition;
        }
        return expand(condition, new ArrayDeque<>());
    }

    private String expand(String condition, Deque<String> chain) {
        Matcher matcher = EXP_REF.matcher(condition);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replace(name, matcher.group(), chain)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private String replace(String name, String reference, Deque<String> chain) {
        Macro macro = lookup.apply(name);
        if (macro == null) {
            logger.debug("unknown expression: {}", name);
            return reference;
        }
        if (chain.contains(name)) {
            report("expression cycle: " + String.join(" -> ", chain) + " -> " + name);
            return reference;
        }
        if (chain.size() >= MAX_DEPTH) {
            report("expression nesting deeper than " + MAX_DEPTH + " at: " + name);
            return reference;
        }
        chain.addLast(name);
        String expanded = expand(macro.value() == null ? "" : macro.value(), chain);
        chain.removeLast();
        if (macro.noSuffix()) {
            // markers do not nest
            return SuffixTransform.wrapNoSuffix(SuffixTransform.stripMarkers(expanded));
        }
        return expanded;
    }

    private void report(String message) {
        if (diagnostics != null) {
            diagnostics.add("expression", message);
        } else {
            logger.warn(message);
        }
    }

}
