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
import io.skinshortcuts.common.Xml;
import io.skinshortcuts.model.Menu;
import io.skinshortcuts.model.MenuItem;
import io.skinshortcuts.model.PropertySchema;
import io.skinshortcuts.model.Reference;
import io.skinshortcuts.model.Template;
import io.skinshortcuts.model.TemplateOutput;
import io.skinshortcuts.model.TemplateSchema;
import io.skinshortcuts.model.VariableDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs a build pass: every template output is applied to every enabled menu
 * item and the results are collected into one {@code <includes>} document,
 * variables first.
 */
public class IncludesBuilder {

    static final Logger logger = LoggerFactory.getLogger(IncludesBuilder.class);

    public static final String INCLUDE_PREFIX = "skinshortcuts-template-";
    public static final String EMPTY_DESCRIPTION = "Automatically generated - no menu items matched this template";

    private static final Pattern ASSIGNED_REF = Pattern.compile("\\$INCLUDE\\[" + INCLUDE_PREFIX + "([^\\]]+)\\]");

    private final TemplateSchema schema;
    private final PropertySchema propertySchema;
    private final List<Menu> menus;
    private final String container;
    private final Diagnostics diagnostics = new Diagnostics();
    private final Set<String> assigned;

    public IncludesBuilder(TemplateSchema schema, PropertySchema propertySchema, List<Menu> menus, String container) {
        this.schema = schema;
        this.propertySchema = propertySchema;
        this.menus = menus;
        this.container = container;
        assigned = Collections.unmodifiableSet(collectAssigned(menus));
    }

    private static Set<String> collectAssigned(List<Menu> menus) {
        Set<String> names = new LinkedHashSet<>();
        for (Menu menu : menus) {
            for (MenuItem item : menu.items()) {
                for (String value : item.properties().values()) {
                    if (value == null || value.isEmpty()) {
                        continue;
                    }
                    Matcher matcher = ASSIGNED_REF.matcher(value);
                    while (matcher.find()) {
                        names.add(INCLUDE_PREFIX + matcher.group(1));
                    }
                }
            }
        }
        return names;
    }

    public Document build() {
        Document doc = Xml.newDocument();
        doc.setXmlStandalone(true);
        Element root = doc.createElement("includes");
        doc.appendChild(root);
        TemplateConditions conditions = new TemplateConditions(schema, diagnostics);
        ContextResolver resolver = new ContextResolver(schema, propertySchema, conditions);
        ControlExpander controls = new ControlExpander(doc, schema, conditions, container);
        VariableExpander variables = new VariableExpander(doc, schema, conditions);
        Map<String, Element> includes = new LinkedHashMap<>();
        Map<String, String> templateOnly = new HashMap<>();
        List<Element> variableList = new ArrayList<>();
        for (Template template : schema.getTemplates()) {
            for (TemplateOutput output : template.getOutputs()) {
                String includeName = INCLUDE_PREFIX + output.include();
                if (!template.getTemplateOnly().isEmpty()) {
                    templateOnly.put(includeName, template.getTemplateOnly());
                }
                Element include = includes.computeIfAbsent(includeName, k -> {
                    Element e = doc.createElement("include");
                    e.setAttribute("name", k);
                    return e;
                });
                buildOutput(template, output, include, variableList, conditions, resolver, controls, variables);
            }
        }
        variableList.forEach(root::appendChild);
        includes.forEach((name, include) -> {
            String setting = templateOnly.getOrDefault(name, "");
            if (Template.TEMPLATE_ONLY_NEVER.equals(setting)) {
                logger.debug("template only, not generated: {}", name);
                return;
            }
            if (Template.TEMPLATE_ONLY_AUTO.equals(setting) && !assigned.contains(name)) {
                logger.debug("template not assigned to any item, not generated: {}", name);
                return;
            }
            if (!include.hasChildNodes()) {
                Element description = doc.createElement("description");
                description.setTextContent(EMPTY_DESCRIPTION);
                include.appendChild(description);
            }
            root.appendChild(include);
        });
        if (!diagnostics.isEmpty()) {
            logger.info("build finished with {} diagnostics", diagnostics.size());
        }
        return doc;
    }

    private void buildOutput(Template template, TemplateOutput output, Element include, List<Element> variableList,
                             TemplateConditions conditions, ContextResolver resolver,
                             ControlExpander controls, VariableExpander variables) {
        for (Menu menu : menus) {
            int index = 0;
            for (MenuItem item : menu.items()) {
                index++;
                if (item.disabled()) {
                    continue;
                }
                if (!matches(template, output, item, conditions)) {
                    continue;
                }
                Map<String, String> context = resolver.buildContext(template, output, item, index, menu);
                controls.expandOutput(template.getControls(), context, item).ifPresent(expanded -> {
                    while (expanded.hasChildNodes()) {
                        Node child = expanded.getFirstChild();
                        include.appendChild(child);
                    }
                });
                for (VariableDefinition definition : template.getVariables()) {
                    variables.expandVariable(definition, context, item).ifPresent(variableList::add);
                }
                for (Reference ref : template.getVariableGroupRefs()) {
                    variableList.addAll(variables.expandGroup(ref, ref.effectiveSuffix(output.suffix()), context, item));
                }
            }
        }
    }

    /**
     * Template conditions see only the item's own properties.
     */
    private static boolean matches(Template template, TemplateOutput output, MenuItem item, TemplateConditions conditions) {
        for (String condition : template.getConditions()) {
            if (!conditions.test(conditions.prepare(condition, output.suffix()), item.properties())) {
                logger.debug("{} skipped for {}: {}", template, item.name(), condition);
                return false;
            }
        }
        return true;
    }

    public void write(Path path, boolean pretty) {
        Document doc = build();
        String xml = Xml.toString(doc, pretty, true);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, xml, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("failed to write " + path + ": " + e.getMessage(), e);
        }
        logger.info("wrote {}", path);
    }

    public Set<String> getAssigned() {
        return assigned;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

}
