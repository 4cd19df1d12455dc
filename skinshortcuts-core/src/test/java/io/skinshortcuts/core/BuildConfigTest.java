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
package io.skinshortcuts.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BuildConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        BuildConfig config = BuildConfig.parse("{}");
        assertEquals("templates.xml", config.getTemplates());
        assertEquals("properties.xml", config.getProperties());
        assertEquals("menus.json", config.getMenus());
        assertEquals("script-skinshortcuts-includes.xml", config.getOutput());
        assertEquals("9000", config.getContainer());
        assertTrue(config.isPretty());
        assertNull(config.getLogLevel());
    }

    @Test
    void testParseFullConfig() {
        String json = """
            {
              "templates": "shortcuts/templates.xml",
              "properties": "shortcuts/properties.xml",
              "menus": "shortcuts/menus.json",
              "output": "16x9/script-skinshortcuts-includes.xml",
              "container": "9100",
              "pretty": false,
              "logLevel": "debug"
            }
            """;
        BuildConfig config = BuildConfig.parse(json);
        assertEquals("shortcuts/templates.xml", config.getTemplates());
        assertEquals("shortcuts/properties.xml", config.getProperties());
        assertEquals("shortcuts/menus.json", config.getMenus());
        assertEquals("16x9/script-skinshortcuts-includes.xml", config.getOutput());
        assertEquals("9100", config.getContainer());
        assertFalse(config.isPretty());
        assertEquals("debug", config.getLogLevel());
    }

    @Test
    void testNumericContainer() {
        assertEquals("50", BuildConfig.parse("{ \"container\": 50 }").getContainer());
    }

    @Test
    void testInvalid() {
        assertThrows(RuntimeException.class, () -> BuildConfig.parse("[\"templates.xml\"]"));
    }

    @Test
    void testLoadFromFile() throws Exception {
        Path path = tempDir.resolve("skinshortcuts.json");
        Files.writeString(path, "{ \"menus\": \"data/menus.json\" }");
        assertEquals("data/menus.json", BuildConfig.load(path).getMenus());
        assertThrows(RuntimeException.class, () -> BuildConfig.load(tempDir.resolve("missing.json")));
    }

}
