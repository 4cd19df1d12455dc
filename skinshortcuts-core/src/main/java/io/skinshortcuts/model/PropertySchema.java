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
package io.skinshortcuts.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class PropertySchema {

    public static final PropertySchema EMPTY = new PropertySchema(List.of());

    private final Map<String, PropertyFallback> fallbacks;

    public PropertySchema(List<PropertyFallback> list) {
        Map<String, PropertyFallback> map = new LinkedHashMap<>();
        for (PropertyFallback fallback : list) {
            map.put(fallback.property(), fallback);
        }
        fallbacks = Collections.unmodifiableMap(map);
    }

    public Map<String, PropertyFallback> getFallbacks() {
        return fallbacks;
    }

    public PropertyFallback getFallback(String property) {
        return fallbacks.get(property);
    }

    public boolean isEmpty() {
        return fallbacks.isEmpty();
    }

}
