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
package io.skinshortcuts.loader;

import io.skinshortcuts.model.FallbackRule;
import io.skinshortcuts.model.PropertyFallback;
import io.skinshortcuts.model.PropertySchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PropertyLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testParseFallbacks() {
        PropertySchema schema = PropertyLoader.parse("""
                <properties>
                    <fallbacks>
                        <fallback property="widgetArt">
                            <when condition="widgetType=movies">Poster</when>
                            <when condition="widgetType=albums">Square</when>
                            <default>Landscape</default>
                        </fallback>
                        <fallback property="widgetStyle">
                            <default>list</default>
                        </fallback>
                    </fallbacks>
                </properties>
                """);
        assertEquals(2, schema.getFallbacks().size());
        PropertyFallback art = schema.getFallback("widgetArt");
        assertEquals(List.of(
                new FallbackRule("widgetType=movies", "Poster"),
                new FallbackRule("widgetType=albums", "Square"),
                new FallbackRule("", "Landscape")), art.rules());
        assertTrue(art.rules().get(2).isDefault());
        assertEquals(List.of("widgetArt", "widgetStyle"), List.copyOf(schema.getFallbacks().keySet()));
    }

    @Test
    void testMissingFileIsEmpty() {
        PropertySchema schema = PropertyLoader.load(tempDir.resolve("properties.xml"));
        assertTrue(schema.isEmpty());
    }

    @Test
    void testMissingProperty() {
        PropertyConfigException e = assertThrows(PropertyConfigException.class,
                () -> PropertyLoader.parse("<properties><fallbacks><fallback/></fallbacks></properties>"));
        assertTrue(e.getMessage().contains("'property'"));
    }

    @Test
    void testWrongRoot() {
        assertThrows(PropertyConfigException.class, () -> PropertyLoader.parse("<templates/>"));
    }

}
