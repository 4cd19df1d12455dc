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

import io.skinshortcuts.common.Diagnostics;
import io.skinshortcuts.condition.Conditions;
import io.skinshortcuts.condition.MacroExpander;
import io.skinshortcuts.condition.SuffixTransform;
import io.skinshortcuts.model.MenuItem;
import io.skinshortcuts.model.TemplateSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Evaluates schema conditions: {@code $EXP[...]} expansion against the schema
 * expressions, the slot suffix rewrite and finally evaluation with the
 * no-suffix markers removed.
 */
public class TemplateConditions {

    static final Logger logger = LoggerFactory.getLogger(TemplateConditions.class);

    private final MacroExpander expander;
    private final Diagnostics diagnostics;

    public TemplateConditions(TemplateSchema schema, Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
        expander = new MacroExpander(schema::getExpression, diagnostics);
    }

    public String expand(String condition) {
        return expander.expand(condition);
    }

    /**
     * Expands expressions then rewrites property names for the suffix.
     */
    public String prepare(String condition, String suffix) {
        return SuffixTransform.toCondition(expand(condition), suffix);
    }

    public boolean test(String condition, Map<String, String> properties) {
        if (condition == null || condition.isBlank()) {
            return true;
        }
        String prepared = SuffixTransform.stripMarkers(expand(condition));
        boolean result = Conditions.evaluate(prepared, properties, diagnostics);
        if (!result && logger.isTraceEnabled()) {
            logger.trace("condition failed: {}", prepared);
        }
        return result;
    }

    /**
     * Evaluates against the item properties overlaid with the context built
     * so far.
     */
    public boolean test(String condition, MenuItem item, Map<String, String> context) {
        if (condition == null || condition.isBlank()) {
            return true;
        }
        Map<String, String> merged = new HashMap<>(item.properties());
        merged.putAll(context);
        return test(condition, merged);
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

}
