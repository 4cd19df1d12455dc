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

import io.skinshortcuts.condition.Macro;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything loaded from templates.xml, with by-name lookup of the
 * reusable parts. Unknown names resolve to null.
 */
public class TemplateSchema {

    private final Map<String, Macro> expressions;
    private final Map<String, IncludeDefinition> includes;
    private final Map<String, Preset> presets;
    private final Map<String, PresetGroup> presetGroups;
    private final Map<String, PropertyGroup> propertyGroups;
    private final Map<String, VariableDefinition> variableDefinitions;
    private final Map<String, VariableGroup> variableGroups;
    private final List<Template> templates;

    private TemplateSchema(Builder builder) {
        expressions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.expressions));
        includes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.includes));
        presets = Collections.unmodifiableMap(new LinkedHashMap<>(builder.presets));
        presetGroups = Collections.unmodifiableMap(new LinkedHashMap<>(builder.presetGroups));
        propertyGroups = Collections.unmodifiableMap(new LinkedHashMap<>(builder.propertyGroups));
        variableDefinitions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variableDefinitions));
        variableGroups = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variableGroups));
        templates = List.copyOf(builder.templates);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Macro getExpression(String name) {
        return expressions.get(name);
    }

    public IncludeDefinition getInclude(String name) {
        return includes.get(name);
    }

    public Preset getPreset(String name) {
        return presets.get(name);
    }

    public PresetGroup getPresetGroup(String name) {
        return presetGroups.get(name);
    }

    public PropertyGroup getPropertyGroup(String name) {
        return propertyGroups.get(name);
    }

    public VariableDefinition getVariableDefinition(String name) {
        return variableDefinitions.get(name);
    }

    public VariableGroup getVariableGroup(String name) {
        return variableGroups.get(name);
    }

    public List<Template> getTemplates() {
        return templates;
    }

    public Map<String, Macro> getExpressions() {
        return expressions;
    }

    public static class Builder {

        // later definitions of a name replace earlier ones
        private final Map<String, Macro> expressions = new LinkedHashMap<>();
        private final Map<String, IncludeDefinition> includes = new LinkedHashMap<>();
        private final Map<String, Preset> presets = new LinkedHashMap<>();
        private final Map<String, PresetGroup> presetGroups = new LinkedHashMap<>();
        private final Map<String, PropertyGroup> propertyGroups = new LinkedHashMap<>();
        private final Map<String, VariableDefinition> variableDefinitions = new LinkedHashMap<>();
        private final Map<String, VariableGroup> variableGroups = new LinkedHashMap<>();
        private final List<Template> templates = new ArrayList<>();

        private Builder() {
        }

        public Builder expression(Macro value) {
            expressions.put(value.name(), value);
            return this;
        }

        public Builder include(IncludeDefinition value) {
            includes.put(value.name(), value);
            return this;
        }

        public Builder preset(Preset value) {
            presets.put(value.name(), value);
            return this;
        }

        public Builder presetGroup(PresetGroup value) {
            presetGroups.put(value.name(), value);
            return this;
        }

        public Builder propertyGroup(PropertyGroup value) {
            propertyGroups.put(value.name(), value);
            return this;
        }

        public Builder variableDefinition(VariableDefinition value) {
            variableDefinitions.put(value.name(), value);
            return this;
        }

        public Builder variableGroup(VariableGroup value) {
            variableGroups.put(value.name(), value);
            return this;
        }

        public Builder template(Template value) {
            templates.add(value);
            return this;
        }

        public TemplateSchema build() {
            return new TemplateSchema(this);
        }

    }

}
