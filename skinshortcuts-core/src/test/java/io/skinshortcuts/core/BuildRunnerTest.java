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

import io.skinshortcuts.common.Xml;
import io.skinshortcuts.loader.SchemaException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BuildRunnerTest {

    static final Path SKIN = Path.of("src/test/resources/skin");

    @TempDir
    Path tempDir;

    static void copySkin(Path target) throws Exception {
        for (String name : List.of("templates.xml", "properties.xml", "menus.json")) {
            Files.copy(SKIN.resolve(name), target.resolve(name));
        }
    }

    private static List<String> ids(Element include) {
        return Xml.getChildElements(include, "control").stream().map(e -> e.getAttribute("id")).toList();
    }

    @Test
    void testBuildSkin() throws Exception {
        copySkin(tempDir);
        BuildResult result = BuildRunner.run(new BuildConfig(), tempDir);
        assertEquals(tempDir.resolve("script-skinshortcuts-includes.xml"), result.output());
        assertEquals(1, result.templates());
        assertEquals(1, result.menus());
        assertFalse(result.hasDiagnostics());
        Document doc = Xml.toXmlDoc(Files.readString(result.output()));
        Element root = doc.getDocumentElement();
        List<Element> variables = Xml.getChildElements(root, "variable");
        assertEquals(List.of("WidgetArt-8011", "WidgetArt-8021"),
                variables.stream().map(e -> e.getAttribute("name")).toList());
        assertEquals("stretch", Xml.getText(variables.get(0)));
        assertEquals("keep", Xml.getText(variables.get(1)));
        List<Element> includes = Xml.getChildElements(root, "include");
        assertEquals(2, includes.size());
        assertEquals("skinshortcuts-template-widget1", includes.get(0).getAttribute("name"));
        assertEquals(List.of("8011", "8012"), ids(includes.get(0)));
        assertEquals(List.of("8021"), ids(includes.get(1)));
        Element movies = Xml.getChildElement(includes.get(0), "control");
        assertEquals("String.IsEqual(Container(9000).ListItem.Property(name),movies)",
                Xml.getText(Xml.getChildElement(movies, "visible")));
        Element content = Xml.getChildElement(movies, "content");
        assertEquals("videos", content.getAttribute("target"));
        assertEquals("videodb://movies/titles/", Xml.getText(content));
        assertEquals("Recently added", Xml.getText(Xml.getChildElement(Xml.getChildElement(movies, "control"), "label")));
        Element music = Xml.getChildElements(includes.get(0), "control").get(1);
        assertEquals("scale", Xml.getText(Xml.getChildElement(music, "aspectratio")));
        assertNull(Xml.getChildElement(music, "control"));
        Element slot2 = Xml.getChildElement(includes.get(1), "control");
        assertEquals("music", Xml.getChildElement(slot2, "content").getAttribute("target"));
        assertEquals("musicdb://albums/", Xml.getText(Xml.getChildElement(slot2, "content")));
        assertEquals("keep", Xml.getText(Xml.getChildElement(slot2, "aspectratio")));
    }

    @Test
    void testRelativePathsFromConfig() throws Exception {
        Path shortcuts = Files.createDirectories(tempDir.resolve("shortcuts"));
        copySkin(shortcuts);
        BuildConfig config = BuildConfig.parse("""
                {
                  "templates": "shortcuts/templates.xml",
                  "properties": "shortcuts/properties.xml",
                  "menus": "shortcuts/menus.json",
                  "output": "16x9/includes.xml",
                  "container": "50",
                  "pretty": false
                }
                """);
        BuildResult result = BuildRunner.run(config, tempDir);
        String text = Files.readString(tempDir.resolve("16x9/includes.xml"));
        assertEquals(tempDir.resolve("16x9/includes.xml"), result.output());
        assertTrue(text.contains("Container(50)"));
    }

    @Test
    void testMissingTemplates() {
        assertThrows(SchemaException.class, () -> BuildRunner.run(new BuildConfig(), tempDir));
    }

}
