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

import io.skinshortcuts.condition.Macro;
import io.skinshortcuts.model.Preset;
import io.skinshortcuts.model.PresetGroup;
import io.skinshortcuts.model.PropertyGroup;
import io.skinshortcuts.model.Reference;
import io.skinshortcuts.model.Template;
import io.skinshortcuts.model.TemplateOutput;
import io.skinshortcuts.model.TemplateProperty;
import io.skinshortcuts.model.TemplateSchema;
import io.skinshortcuts.model.VariableDefinition;
import io.skinshortcuts.model.VariableGroup;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TemplateLoaderTest {

    @TempDir
    Path tempDir;

    static final String XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <templates>
                <expressions>
                    <expression name="IsVideo">widgetType=movies | tvshows</expression>
                    <expression name="IsMain" nosuffix="true">menu=mainmenu</expression>
                </expressions>
                <includes>
                    <include name="Label">
                        <control type="label"/>
                    </include>
                </includes>
                <presets>
                    <preset name="Art">
                        <values condition="widgetArt=Poster" aspect="stretch" height="500"/>
                        <values aspect="scale"/>
                    </preset>
                </presets>
                <presetGroups>
                    <presetGroup name="Layout">
                        <preset name="Art" condition="$EXP[IsVideo]"/>
                        <values layout="list"/>
                    </presetGroup>
                </presetGroups>
                <propertyGroups>
                    <propertyGroup name="Base">
                        <property name="content" from="widgetPath"/>
                        <var name="sortby">
                            <value condition="widgetType=episodes">episode</value>
                            <value>title</value>
                        </var>
                    </propertyGroup>
                </propertyGroups>
                <variables>
                    <variable name="ArtVar" output="ArtVar-$PROPERTY[id]" condition="widgetArt">
                        <value>$PROPERTY[aspect]</value>
                    </variable>
                </variables>
                <variableGroups>
                    <variableGroup name="Vars">
                        <group name="Other" suffix=".2"/>
                        <variable name="ArtVar" condition="widgetArt=Poster"/>
                    </variableGroup>
                </variableGroups>
                <template include="widget" idprefix="80" templateonly="Auto">
                    <condition>$EXP[IsVideo]</condition>
                    <condition>widgetPath</condition>
                    <output include="widget1" idprefix="801"/>
                    <output include="widget2" idprefix="802" suffix=".2"/>
                    <property name="left" value="245"/>
                    <property name="top">30</property>
                    <property name="path" from="widgetPath" condition="widgetPath"/>
                    <var name="style">
                        <value>plain</value>
                    </var>
                    <propertyGroup name="Base" suffix=".2"/>
                    <preset name="Art" condition="widgetArt"/>
                    <presetGroup name="Layout"/>
                    <variableGroup name="Vars"/>
                    <controls>
                        <control type="list" id="$PROPERTY[id]"/>
                    </controls>
                    <variables>
                        <variable name="Inline">
                            <value>x</value>
                        </variable>
                    </variables>
                </template>
                <template include="plain"/>
            </templates>
            """;

    @Test
    void testParseReusableParts() {
        TemplateSchema schema = TemplateLoader.parse(XML);
        assertEquals(new Macro("IsVideo", "widgetType=movies | tvshows", false), schema.getExpression("IsVideo"));
        assertTrue(schema.getExpression("IsMain").noSuffix());
        assertEquals("include", schema.getInclude("Label").controls().getTagName());
        Preset preset = schema.getPreset("Art");
        assertEquals(2, preset.rows().size());
        assertEquals("widgetArt=Poster", preset.rows().get(0).condition());
        assertEquals(Map.of("aspect", "stretch", "height", "500"), preset.rows().get(0).values());
        assertEquals("", preset.rows().get(1).condition());
        PresetGroup group = schema.getPresetGroup("Layout");
        assertEquals(2, group.children().size());
        assertTrue(group.children().get(0).isPresetReference());
        assertEquals("$EXP[IsVideo]", group.children().get(0).condition());
        assertEquals(Map.of("layout", "list"), group.children().get(1).values());
        PropertyGroup base = schema.getPropertyGroup("Base");
        assertEquals(TemplateProperty.from("content", "widgetPath"), base.properties().get(0));
        assertEquals("sortby", base.vars().get(0).name());
        assertEquals(2, base.vars().get(0).values().size());
        VariableDefinition variable = schema.getVariableDefinition("ArtVar");
        assertEquals("ArtVar-$PROPERTY[id]", variable.output());
        assertEquals("widgetArt", variable.condition());
        assertEquals("variable", variable.content().getTagName());
        VariableGroup vars = schema.getVariableGroup("Vars");
        assertEquals(List.of(new Reference("Other", ".2", "")), vars.groupRefs());
        assertEquals("widgetArt=Poster", vars.references().get(0).condition());
        assertNull(schema.getPreset("Nope"));
    }

    @Test
    void testParseTemplate() {
        TemplateSchema schema = TemplateLoader.parse(XML);
        assertEquals(2, schema.getTemplates().size());
        Template template = schema.getTemplates().get(0);
        assertEquals("widget", template.getInclude());
        assertEquals("80", template.getIdPrefix());
        assertEquals(Template.TEMPLATE_ONLY_AUTO, template.getTemplateOnly());
        assertEquals(List.of("$EXP[IsVideo]", "widgetPath"), template.getConditions());
        assertEquals(List.of(new TemplateOutput("widget1", "801", ""), new TemplateOutput("widget2", "802", ".2")), template.getOutputs());
        assertEquals(TemplateProperty.literal("left", "245"), template.getProperties().get(0));
        assertEquals(TemplateProperty.literal("top", "30"), template.getProperties().get(1));
        assertEquals(TemplateProperty.from("path", "widgetPath").when("widgetPath"), template.getProperties().get(2));
        assertEquals("style", template.getVars().get(0).name());
        assertEquals(List.of(new Reference("Base", ".2", "")), template.getPropertyGroupRefs());
        assertEquals(List.of(new Reference("Art", "", "widgetArt")), template.getPresetRefs());
        assertEquals(List.of(new Reference("Layout")), template.getPresetGroupRefs());
        assertEquals(List.of(new Reference("Vars")), template.getVariableGroupRefs());
        assertEquals("controls", template.getControls().getTagName());
        assertEquals("Inline", template.getVariables().get(0).name());
    }

    @Test
    void testImplicitOutput() {
        Template template = TemplateLoader.parse(XML).getTemplates().get(1);
        assertEquals(List.of(new TemplateOutput("plain", "", "")), template.getOutputs());
        assertNull(template.getControls());
    }

    @Test
    void testMissingName() {
        TemplateConfigException e = assertThrows(TemplateConfigException.class,
                () -> TemplateLoader.parse("<templates><presets><preset/></presets></templates>"));
        assertTrue(e.getMessage().contains("<preset> is missing the 'name' attribute"));
    }

    @Test
    void testWrongRoot() {
        TemplateConfigException e = assertThrows(TemplateConfigException.class,
                () -> TemplateLoader.parse("<menus/>"));
        assertTrue(e.getMessage().contains("root element must be <templates>"));
    }

    @Test
    void testMalformedReportsLine() {
        TemplateConfigException e = assertThrows(TemplateConfigException.class,
                () -> TemplateLoader.parse("<templates>\n<template include='a'>\n</templates>"));
        assertTrue(e.getLine() > 0);
        assertTrue(e.getMessage().startsWith("templates.xml:" + e.getLine()));
    }

    @Test
    void testLoadFile() throws Exception {
        Path path = tempDir.resolve("templates.xml");
        Files.writeString(path, XML);
        TemplateSchema schema = TemplateLoader.load(path);
        assertEquals(2, schema.getTemplates().size());
        Path missing = tempDir.resolve("missing.xml");
        SchemaException e = assertThrows(SchemaException.class, () -> TemplateLoader.load(missing));
        assertEquals(missing.toString(), e.getFile());
    }

}
