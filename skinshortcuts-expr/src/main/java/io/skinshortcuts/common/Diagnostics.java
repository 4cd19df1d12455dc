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
package io.skinshortcuts.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects diagnostics for one build pass. The same problem tends to repeat
 * for every menu entry, so identical diagnostics are only logged and kept once.
 */
public class Diagnostics {

    static final Logger logger = LoggerFactory.getLogger(Diagnostics.class);

    private final Set<Diagnostic> seen = new LinkedHashSet<>();

    public void add(String source, String message) {
        Diagnostic diagnostic = new Diagnostic(source, message);
        if (seen.add(diagnostic)) {
            logger.warn("{}", diagnostic);
        }
    }

    public boolean isEmpty() {
        return seen.isEmpty();
    }

    public int size() {
        return seen.size();
    }

    public List<Diagnostic> getAll() {
        return Collections.unmodifiableList(new ArrayList<>(seen));
    }

    @Override
    public String toString() {
        return seen.toString();
    }

}
