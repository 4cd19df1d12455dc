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

import io.skinshortcuts.common.Xml;
import io.skinshortcuts.condition.Macro;
import io.skinshortcuts.model.IncludeDefinition;
import io.skinshortcuts.model.Preset;
import io.skinshortcuts.model.PresetGroup;
import io.skinshortcuts.model.PresetGroupChild;
import io.skinshortcuts.model.PresetRow;
import io.skinshortcuts.model.PropertyGroup;
import io.skinshortcuts.model.Reference;
import io.skinshortcuts.model.Template;
import io.skinshortcuts.model.TemplateOutput;
import io.skinshortcuts.model.TemplateProperty;
import io.skinshortcuts.model.TemplateSchema;
import io.skinshortcuts.model.TemplateVar;
import io.skinshortcuts.model.VariableDefinition;
import io.skinshortcuts.model.VariableGroup;
import io.skinshortcuts.model.VariableReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads templates.xml.
 */
public class TemplateLoader {

    static final Logger logger = LoggerFactory.getLogger(TemplateLoader.class);

    public static final String ROOT = "templates";

    private final String file;

    private TemplateLoader(String file) {
        this.file = file;
    }

    public static TemplateSchema load(Path path) {
        Element root = XmlSource.read(path, ROOT, TemplateConfigException::new);
        TemplateSchema schema = new TemplateLoader(path.toString()).parse(root);
        logger.debug("loaded {} templates from {}", schema.getTemplates().size(), path);
        return schema;
    }

    public static TemplateSchema parse(String xml) {
        return parse("templates.xml", xml);
    }

    public static TemplateSchema parse(String file, String xml) {
        Element root = XmlSource.parse(file, xml, ROOT, TemplateConfigException::new);
        return new TemplateLoader(file).parse(root);
    }

    private TemplateSchema parse(Element root) {
        TemplateSchema.Builder builder = TemplateSchema.builder();
        for (Element child : Xml.getChildElements(root)) {
            switch (child.getTagName()) {
                case "expressions" -> {
                    for (Element e : Xml.getChildElements(child, "expression")) {
                        builder.expression(new Macro(required(e, "name"), Xml.getText(e), Xml.getBoolean(e, "nosuffix")));
                    }
                }
                case "includes" -> {
                    for (Element e : Xml.getChildElements(child, "include")) {
                        builder.include(new IncludeDefinition(required(e, "name"), e));
                    }
                }
                case "presets" -> {
                    for (Element e : Xml.getChildElements(child, "preset")) {
                        builder.preset(parsePreset(e));
                    }
                }
                case "presetGroups" -> {
                    for (Element e : Xml.getChildElements(child, "presetGroup")) {
                        builder.presetGroup(parsePresetGroup(e));
                    }
                }
                case "propertyGroups" -> {
                    for (Element e : Xml.getChildElements(child, "propertyGroup")) {
                        builder.propertyGroup(parsePropertyGroup(e));
                    }
                }
                case "variables" -> {
                    for (Element e : Xml.getChildElements(child, "variable")) {
                        builder.variableDefinition(parseVariable(e));
                    }
                }
                case "variableGroups" -> {
                    for (Element e : Xml.getChildElements(child, "variableGroup")) {
                        builder.variableGroup(parseVariableGroup(e));
                    }
                }
                case "template" -> builder.template(parseTemplate(child));
                default -> logger.debug("ignoring <{}> in {}", child.getTagName(), file);
            }
        }
        return builder.build();
    }

    private Template parseTemplate(Element e) {
        Template.Builder builder = Template.builder(required(e, "include"))
                .idPrefix(Xml.getAttribute(e, "idprefix"))
                .templateOnly(Xml.getAttribute(e, "templateonly").toLowerCase());
        for (Element child : Xml.getChildElements(e)) {
            switch (child.getTagName()) {
                case "condition" -> {
                    String condition = Xml.getText(child);
                    if (!condition.isEmpty()) {
                        builder.condition(condition);
                    }
                }
                case "output" -> builder.output(new TemplateOutput(
                        required(child, "include"),
                        Xml.getAttribute(child, "idprefix"),
                        Xml.getAttribute(child, "suffix")));
                case "property" -> builder.property(parseProperty(child));
                case "var" -> builder.var(parseVar(child));
                case "propertyGroup" -> builder.propertyGroup(parseReference(child));
                case "preset" -> builder.preset(parseReference(child));
                case "presetGroup" -> builder.presetGroup(parseReference(child));
                case "variableGroup" -> builder.variableGroup(parseReference(child));
                case "controls" -> builder.controls(child);
                case "variables" -> {
                    for (Element v : Xml.getChildElements(child, "variable")) {
                        builder.variable(parseVariable(v));
                    }
                }
                default -> logger.debug("ignoring <{}> in template {}", child.getTagName(), Xml.getAttribute(e, "include"));
            }
        }
        return builder.build();
    }

    private TemplateProperty parseProperty(Element e) {
        String value = e.hasAttribute("value") ? e.getAttribute("value") : Xml.getText(e);
        return new TemplateProperty(required(e, "name"), value, Xml.getAttribute(e, "from"), Xml.getAttribute(e, "condition"));
    }

    private TemplateVar parseVar(Element e) {
        List<TemplateVar.Value> values = new ArrayList<>();
        for (Element v : Xml.getChildElements(e, "value")) {
            values.add(new TemplateVar.Value(Xml.getAttribute(v, "condition"), Xml.getText(v)));
        }
        return new TemplateVar(required(e, "name"), values);
    }

    private Reference parseReference(Element e) {
        return new Reference(required(e, "name"), Xml.getAttribute(e, "suffix"), Xml.getAttribute(e, "condition"));
    }

    private Preset parsePreset(Element e) {
        List<PresetRow> rows = new ArrayList<>();
        for (Element v : Xml.getChildElements(e, "values")) {
            rows.add(new PresetRow(Xml.getAttribute(v, "condition"), valueAttributes(v)));
        }
        return new Preset(required(e, "name"), rows);
    }

    private PresetGroup parsePresetGroup(Element e) {
        List<PresetGroupChild> children = new ArrayList<>();
        for (Element child : Xml.getChildElements(e)) {
            String condition = Xml.getAttribute(child, "condition");
            switch (child.getTagName()) {
                case "preset" -> children.add(new PresetGroupChild(condition, required(child, "name"), null));
                case "values" -> children.add(new PresetGroupChild(condition, null, valueAttributes(child)));
                default -> logger.debug("ignoring <{}> in preset group {}", child.getTagName(), Xml.getAttribute(e, "name"));
            }
        }
        return new PresetGroup(required(e, "name"), children);
    }

    private PropertyGroup parsePropertyGroup(Element e) {
        List<TemplateProperty> properties = new ArrayList<>();
        List<TemplateVar> vars = new ArrayList<>();
        for (Element child : Xml.getChildElements(e)) {
            if ("property".equals(child.getTagName())) {
                properties.add(parseProperty(child));
            } else if ("var".equals(child.getTagName())) {
                vars.add(parseVar(child));
            }
        }
        return new PropertyGroup(required(e, "name"), properties, vars);
    }

    private VariableDefinition parseVariable(Element e) {
        return new VariableDefinition(required(e, "name"), Xml.getAttribute(e, "condition"), Xml.getAttribute(e, "output"), e);
    }

    private VariableGroup parseVariableGroup(Element e) {
        List<VariableReference> references = new ArrayList<>();
        List<Reference> groups = new ArrayList<>();
        for (Element child : Xml.getChildElements(e)) {
            if ("variable".equals(child.getTagName())) {
                references.add(new VariableReference(required(child, "name"), Xml.getAttribute(child, "condition")));
            } else if ("group".equals(child.getTagName())) {
                groups.add(parseReference(child));
            }
        }
        return new VariableGroup(required(e, "name"), references, groups);
    }

    private static Map<String, String> valueAttributes(Element e) {
        Map<String, String> values = new LinkedHashMap<>();
        NamedNodeMap attributes = e.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            if (!"condition".equals(attr.getName())) {
                values.put(attr.getName(), attr.getValue());
            }
        }
        return values;
    }

    private String required(Element e, String name) {
        String value = Xml.getAttribute(e, name);
        if (value.isEmpty()) {
            throw new TemplateConfigException(file, "<" + e.getTagName() + "> is missing the '" + name + "' attribute");
        }
        return value;
    }

}
