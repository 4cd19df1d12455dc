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
import io.skinshortcuts.loader.PropertyLoader;
import io.skinshortcuts.loader.TemplateLoader;
import io.skinshortcuts.model.Menu;
import io.skinshortcuts.model.MenuItem;
import io.skinshortcuts.model.PropertySchema;
import io.skinshortcuts.model.Template;
import io.skinshortcuts.model.TemplateSchema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextResolverTest {

    Diagnostics diagnostics = new Diagnostics();

    private Map<String, String> resolve(String xml, PropertySchema properties, MenuItem item) {
        return resolve(xml, properties, new Menu("mainmenu", List.of(item)), item, 1);
    }

    private Map<String, String> resolve(String xml, PropertySchema properties, Menu menu, MenuItem item, int index) {
        TemplateSchema schema = TemplateLoader.parse(xml);
        ContextResolver resolver = new ContextResolver(schema, properties, new TemplateConditions(schema, diagnostics));
        Template template = schema.getTemplates().get(0);
        return resolver.buildContext(template, template.getOutputs().get(0), item, index, menu);
    }

    private Map<String, String> resolve(String xml, MenuItem item) {
        return resolve(xml, PropertySchema.EMPTY, item);
    }

    @Test
    void testBuiltinsAndDefaults() {
        String xml = """
                <templates>
                    <template include="widget">
                        <output include="widget2" idprefix="802" suffix=".2"/>
                    </template>
                </templates>
                """;
        MenuItem item = new MenuItem("movies", Map.of("widgetArt", "Poster", "index", "99"));
        Menu menu = new Menu("mainmenu", Map.of("widgetArt", "Landscape", "widgetStyle", "list"), List.of(item));
        Map<String, String> context = resolve(xml, PropertySchema.EMPTY, menu, item, 3);
        assertEquals("Poster", context.get("widgetArt"));
        assertEquals("list", context.get("widgetStyle"));
        assertEquals("3", context.get("index"));
        assertEquals("movies", context.get("name"));
        assertEquals("mainmenu", context.get("menu"));
        assertEquals("802", context.get("idprefix"));
        assertEquals("8023", context.get("id"));
        assertEquals(".2", context.get("suffix"));
    }

    @Test
    void testIdWithoutPrefix() {
        Map<String, String> context = resolve("<templates><template include=\"w\"/></templates>", new MenuItem("a", Map.of()));
        assertEquals("1", context.get("id"));
        assertEquals("", context.get("idprefix"));
        assertEquals("", context.get("suffix"));
    }

    @Test
    void testSuffixedOutputResolvesOnlyItsSlot() {
        String xml = """
                <templates>
                    <presets>
                        <preset name="Art">
                            <values condition="widgetArt=Poster" aspect="stretch"/>
                        </preset>
                    </presets>
                    <template include="widget">
                        <condition>widgetType=movies</condition>
                        <output include="widget2" idprefix="802" suffix=".2"/>
                        <preset name="Art"/>
                    </template>
                </templates>
                """;
        MenuItem item = new MenuItem("movies", Map.of(
                "widgetType", "tvshows", "widgetArt", "Landscape",
                "widgetType.2", "movies", "widgetArt.2", "Poster"));
        TemplateSchema schema = TemplateLoader.parse(xml);
        TemplateConditions conditions = new TemplateConditions(schema, diagnostics);
        Template template = schema.getTemplates().get(0);
        String gate = conditions.prepare(template.getConditions().get(0), ".2");
        assertEquals("widgetType.2=movies", gate);
        assertTrue(conditions.test(gate, item.properties()));
        Map<String, String> context = new ContextResolver(schema, PropertySchema.EMPTY, conditions)
                .buildContext(template, template.getOutputs().get(0), item, 1, new Menu("mainmenu", List.of(item)));
        assertEquals("stretch", context.get("aspect"));
        assertEquals("tvshows", context.get("widgetType"));
        assertEquals("Landscape", context.get("widgetArt"));
        assertEquals("movies", context.get("widgetType.2"));
        assertEquals("Poster", context.get("widgetArt.2"));
    }

    @Test
    void testItemPropertyWinsOverPresetAndFallback() {
        String xml = """
                <templates>
                    <presets>
                        <preset name="Art">
                            <values aspect="stretch" height="500"/>
                        </preset>
                    </presets>
                    <template include="widget">
                        <preset name="Art"/>
                    </template>
                </templates>
                """;
        PropertySchema properties = PropertyLoader.parse("""
                <properties>
                    <fallbacks>
                        <fallback property="aspect">
                            <default>scale</default>
                        </fallback>
                    </fallbacks>
                </properties>
                """);
        Map<String, String> context = resolve(xml, properties, new MenuItem("a", Map.of("aspect", "keep")));
        assertEquals("keep", context.get("aspect"));
        assertEquals("500", context.get("height"));
    }

    @Test
    void testPresetFirstMatchingRow() {
        String xml = """
                <templates>
                    <presets>
                        <preset name="Rows">
                            <values condition="widgetArt=Square" pick="A"/>
                            <values condition="widgetArt=Poster" pick="B"/>
                            <values pick="C" extra="C"/>
                        </preset>
                    </presets>
                    <template include="widget">
                        <preset name="Rows"/>
                    </template>
                </templates>
                """;
        Map<String, String> context = resolve(xml, new MenuItem("a", Map.of("widgetArt", "Poster")));
        assertEquals("B", context.get("pick"));
        assertFalse(context.containsKey("extra"));
        context = resolve(xml, new MenuItem("a", Map.of("widgetArt", "Landscape")));
        assertEquals("C", context.get("pick"));
    }

    @Test
    void testPresetReferenceCondition() {
        String xml = """
                <templates>
                    <presets>
                        <preset name="Art">
                            <values aspect="stretch"/>
                        </preset>
                    </presets>
                    <template include="widget">
                        <preset name="Art" suffix=".2" condition="widgetArt=Poster"/>
                        <preset name="Nope"/>
                    </template>
                </templates>
                """;
        assertFalse(resolve(xml, new MenuItem("a", Map.of("widgetArt", "Poster"))).containsKey("aspect"));
        assertEquals("stretch", resolve(xml, new MenuItem("a", Map.of("widgetArt.2", "Poster"))).get("aspect"));
    }

    @Test
    void testTemplatePropertiesFirstMatchWins() {
        String xml = """
                <templates>
                    <template include="widget">
                        <output include="widget2" suffix=".2"/>
                        <property name="kind" value="video" condition="widgetType=movies"/>
                        <property name="kind" value="other"/>
                        <property name="path" from="widgetPath"/>
                        <property name="item" from="name"/>
                        <property name="title" value="$PROPERTY[name]: $PROPERTY[widgetLabel]"/>
                        <property name="widgetType" value="replaced"/>
                    </template>
                </templates>
                """;
        MenuItem item = new MenuItem("movies", Map.of(
                "widgetType", "movies", "widgetType.2", "episodes",
                "widgetPath", "one", "widgetPath.2", "two", "widgetLabel", "Recent"));
        Map<String, String> context = resolve(xml, item);
        assertEquals("other", context.get("kind"));
        assertEquals("two", context.get("path"));
        assertEquals("movies", context.get("item"));
        assertEquals("movies: Recent", context.get("title"));
        assertEquals("replaced", context.get("widgetType"));
        item = new MenuItem("movies", Map.of("widgetType.2", "movies"));
        assertEquals("video", resolve(xml, item).get("kind"));
    }

    @Test
    void testVarsFirstMatchingValue() {
        String xml = """
                <templates>
                    <template include="widget">
                        <var name="sortby">
                            <value condition="widgetType=episodes">episode</value>
                            <value condition="widgetType=movies">year</value>
                            <value>title</value>
                        </var>
                        <var name="never">
                            <value condition="widgetType=none">x</value>
                        </var>
                    </template>
                </templates>
                """;
        Map<String, String> context = resolve(xml, new MenuItem("a", Map.of("widgetType", "movies")));
        assertEquals("year", context.get("sortby"));
        assertFalse(context.containsKey("never"));
        assertEquals("title", resolve(xml, new MenuItem("a", Map.of())).get("sortby"));
    }

    @Test
    void testPropertyGroupOnlyFillsAbsent() {
        String xml = """
                <templates>
                    <propertyGroups>
                        <propertyGroup name="Base">
                            <property name="content" from="widgetPath"/>
                            <property name="target" value="videos" condition="widgetType=movies"/>
                            <property name="target" value="music"/>
                            <property name="kept" value="group"/>
                            <var name="sortby">
                                <value condition="widgetType=episodes">episode</value>
                                <value>title</value>
                            </var>
                        </propertyGroup>
                    </propertyGroups>
                    <template include="widget">
                        <property name="kept" value="template"/>
                        <propertyGroup name="Base" suffix=".2"/>
                    </template>
                </templates>
                """;
        MenuItem item = new MenuItem("a", Map.of(
                "widgetPath", "one", "widgetPath.2", "two",
                "widgetType", "episodes", "widgetType.2", "movies"));
        Map<String, String> context = resolve(xml, item);
        assertEquals("two", context.get("content"));
        assertEquals("videos", context.get("target"));
        assertEquals("template", context.get("kept"));
        assertEquals("title", context.get("sortby"));
    }

    @Test
    void testPresetGroupChildren() {
        String xml = """
                <templates>
                    <presets>
                        <preset name="Poster">
                            <values condition="widgetArt=Poster" aspect="stretch" height="500"/>
                        </preset>
                    </presets>
                    <presetGroups>
                        <presetGroup name="Layout">
                            <values condition="widgetType=music" layout="grid"/>
                            <preset name="Poster"/>
                            <values layout="list" aspect="scale"/>
                        </presetGroup>
                    </presetGroups>
                    <template include="widget">
                        <presetGroup name="Layout"/>
                    </template>
                </templates>
                """;
        Map<String, String> context = resolve(xml, new MenuItem("a", Map.of("widgetType", "movies", "widgetArt", "Poster")));
        assertEquals("stretch", context.get("aspect"));
        assertEquals("500", context.get("height"));
        assertFalse(context.containsKey("layout"));
        context = resolve(xml, new MenuItem("a", Map.of("widgetType", "movies", "widgetArt", "Landscape")));
        assertEquals("list", context.get("layout"));
        assertEquals("scale", context.get("aspect"));
        context = resolve(xml, new MenuItem("a", Map.of("widgetType", "music")));
        assertEquals("grid", context.get("layout"));
        assertFalse(context.containsKey("aspect"));
    }

    @Test
    void testFallbacksPerSuffix() {
        PropertySchema properties = PropertyLoader.parse("""
                <properties>
                    <fallbacks>
                        <fallback property="widgetArt">
                            <when condition="widgetType=movies">Poster</when>
                            <default>Landscape</default>
                        </fallback>
                    </fallbacks>
                </properties>
                """);
        String xml = "<templates><template include=\"w\"/></templates>";
        MenuItem item = new MenuItem("a", Map.of("widgetType", "movies", "widgetType.2", "albums"));
        Map<String, String> context = resolve(xml, properties, item);
        assertEquals("Poster", context.get("widgetArt"));
        assertEquals("Landscape", context.get("widgetArt.2"));
        assertFalse(context.containsKey("widgetArt.3"));
        item = new MenuItem("a", Map.of("widgetType", "movies", "widgetArt", "Square"));
        assertEquals("Square", resolve(xml, properties, item).get("widgetArt"));
    }

    @Test
    void testNoSuffixExpression() {
        String xml = """
                <templates>
                    <expressions>
                        <expression name="Wide" nosuffix="true">widgetStyle=wide</expression>
                        <expression name="Movies">widgetType=movies</expression>
                    </expressions>
                    <template include="widget">
                        <output include="widget2" suffix=".2"/>
                        <property name="a" value="yes" condition="$EXP[Wide]"/>
                        <property name="b" value="yes" condition="$EXP[Movies]"/>
                    </template>
                </templates>
                """;
        MenuItem item = new MenuItem("a", Map.of("widgetStyle", "wide", "widgetType", "movies", "widgetType.2", "tvshows"));
        Map<String, String> context = resolve(xml, item);
        assertEquals("yes", context.get("a"));
        assertFalse(context.containsKey("b"));
    }

    @Test
    void testMalformedConditionSkipsDeclaration() {
        String xml = """
                <templates>
                    <template include="widget">
                        <property name="x" value="1" condition="[widgetType=movies"/>
                        <property name="y" value="2"/>
                    </template>
                </templates>
                """;
        Map<String, String> context = resolve(xml, new MenuItem("a", Map.of("widgetType", "movies")));
        assertFalse(context.containsKey("x"));
        assertEquals("2", context.get("y"));
        assertEquals(1, diagnostics.size());
        assertEquals("condition", diagnostics.getAll().get(0).source());
    }

    @Test
    void testContextIsNotShared() {
        String xml = "<templates><template include=\"w\"/></templates>";
        MenuItem item = new MenuItem("a", Map.of("x", "1"));
        Map<String, String> first = resolve(xml, item);
        first.put("x", "changed");
        assertEquals("1", resolve(xml, item).get("x"));
        assertEquals("1", item.properties().get("x"));
    }

}
