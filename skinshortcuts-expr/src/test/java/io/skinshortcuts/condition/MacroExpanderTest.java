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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MacroExpanderTest {

    Map<String, Macro> macros;
    Diagnostics diagnostics;
    MacroExpander expander;

    void macro(String name, String value) {
        macros.put(name, new Macro(name, value, false));
    }

    @BeforeEach
    void beforeEach() {
        macros = new HashMap<>();
        diagnostics = new Diagnostics();
        expander = new MacroExpander(macros::get, diagnostics);
        macro("isMovie", "widgetType=movies");
        macro("art", "$EXP[isMovie] + widgetArt=Poster");
        macro("loopA", "$EXP[loopB]");
        macro("loopB", "$EXP[loopA]");
        macros.put("fixed", new Macro("fixed", "widgetType=movies", true));
    }

    @Test
    void testSimple() {
        assertEquals("widgetType=movies", expander.expand("$EXP[isMovie]"));
        assertEquals("a=1 + widgetType=movies", expander.expand("a=1 + $EXP[isMovie]"));
        assertEquals("a=1", expander.expand("a=1"));
        assertNull(expander.expand(null));
    }

    @Test
    void testNestedIsSubstitutedAsWritten() {
        assertEquals("widgetType=movies + widgetArt=Poster", expander.expand("$EXP[art]"));
        assertEquals("widgetType=movies + widgetArt=Poster | x=1", expander.expand("$EXP[art] | x=1"));
    }

    @Test
    void testExpansionBindsLikeInlineText() {
        macro("both", "x=1 + y=1");
        Map<String, String> props = Map.of("x", "0", "y", "0", "c", "1");
        // x=1 + [y=1 | c=1]
        assertFalse(Conditions.evaluate(expander.expand("$EXP[both] | c=1"), props));
        assertEquals(Conditions.evaluate("x=1 + y=1 | c=1", props),
                Conditions.evaluate(expander.expand("$EXP[both] | c=1"), props));
        assertTrue(Conditions.evaluate(expander.expand("$EXP[both] | c=1"), Map.of("x", "1", "c", "1")));
    }

    @Test
    void testUnknownIsLeftAsIs() {
        assertEquals("$EXP[nope] + a=1", expander.expand("$EXP[nope] + a=1"));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void testCycleIsReported() {
        assertEquals("$EXP[loopA]", expander.expand("$EXP[loopA]"));
        assertEquals(1, diagnostics.size());
        assertTrue(diagnostics.getAll().get(0).message().contains("loopA -> loopB -> loopA"));
    }

    @Test
    void testDepthLimit() {
        for (int i = 0; i < 20; i++) {
            macro("m" + i, "$EXP[m" + (i + 1) + "]");
        }
        macro("m20", "a=1");
        String result = expander.expand("$EXP[m0]");
        assertTrue(result.contains("$EXP[m" + MacroExpander.MAX_DEPTH + "]"));
        assertFalse(diagnostics.isEmpty());
    }

    @Test
    void testNoSuffixSurvivesTransform() {
        String expanded = expander.expand("$EXP[fixed] + widgetArt=Poster");
        assertEquals("{NOSUFFIX:widgetType=movies} + widgetArt=Poster", expanded);
        String transformed = SuffixTransform.toCondition(expanded, ".2");
        assertEquals("widgetType=movies + widgetArt.2=Poster", SuffixTransform.stripMarkers(transformed));
    }

    @Test
    void testNoSuffixMarkersDoNotNest() {
        macros.put("outer", new Macro("outer", "$EXP[fixed] + a=1", true));
        assertEquals("{NOSUFFIX:widgetType=movies + a=1}", expander.expand("$EXP[outer]"));
    }

    @Test
    void testEmptyNoSuffixMacro() {
        macros.put("blank", new Macro("blank", "", true));
        String expanded = expander.expand("$EXP[blank]");
        assertEquals("{NOSUFFIX:}", expanded);
        assertEquals("", SuffixTransform.stripMarkers(SuffixTransform.toCondition(expanded, ".2")));
        assertTrue(Conditions.evaluate(SuffixTransform.stripMarkers(expanded), Map.of()));
    }

}
