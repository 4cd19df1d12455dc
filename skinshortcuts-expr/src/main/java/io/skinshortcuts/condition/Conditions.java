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

import java.util.Map;

/**
 * Entry point for evaluating conditions against a property snapshot.
 * Evaluation never throws: a malformed condition evaluates to false.
 */
public class Conditions {

    static final Logger logger = LoggerFactory.getLogger(Conditions.class);

    private Conditions() {
        // only static methods
    }

    public static boolean evaluate(String condition, Map<String, String> properties) {
        return evaluate(condition, properties, null);
    }

    /**
     * @param condition   the condition, blank means always true
     * @param properties  values to test, a missing key reads as empty
     * @param diagnostics where to report malformed conditions, may be null
     */
    public static boolean evaluate(String condition, Map<String, String> properties, Diagnostics diagnostics) {
        if (condition == null || condition.isBlank()) {
            return true;
        }
        try {
            return ConditionParser.parse(condition).evaluate(properties);
        } catch (ConditionException e) {
            if (diagnostics != null) {
                diagnostics.add("condition", e.getMessage());
            } else {
                logger.warn("condition evaluated as false: {}", e.getMessage());
            }
            return false;
        }
    }

    public static boolean isValid(String condition) {
        if (condition == null || condition.isBlank()) {
            return true;
        }
        try {
            ConditionParser.parse(condition);
            return true;
        } catch (ConditionException e) {
            return false;
        }
    }

}
