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

import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code <template>} of templates.xml: gating conditions, the includes it
 * generates and the declarations that build the property context of every
 * menu item it is applied to.
 */
public class Template {

    public static final String TEMPLATE_ONLY_NEVER = "true";
    public static final String TEMPLATE_ONLY_AUTO = "auto";

    private final String include;
    private final String idPrefix;
    private final String templateOnly;
    private final List<String> conditions;
    private final List<TemplateOutput> outputs;
    private final List<TemplateProperty> properties;
    private final List<TemplateVar> vars;
    private final List<Reference> propertyGroupRefs;
    private final List<Reference> presetRefs;
    private final List<Reference> presetGroupRefs;
    private final Element controls;
    private final List<VariableDefinition> variables;
    private final List<Reference> variableGroupRefs;

    private Template(Builder builder) {
        include = builder.include;
        idPrefix = builder.idPrefix;
        templateOnly = builder.templateOnly;
        conditions = List.copyOf(builder.conditions);
        outputs = List.copyOf(builder.outputs);
        properties = List.copyOf(builder.properties);
        vars = List.copyOf(builder.vars);
        propertyGroupRefs = List.copyOf(builder.propertyGroupRefs);
        presetRefs = List.copyOf(builder.presetRefs);
        presetGroupRefs = List.copyOf(builder.presetGroupRefs);
        controls = builder.controls;
        variables = List.copyOf(builder.variables);
        variableGroupRefs = List.copyOf(builder.variableGroupRefs);
    }

    public static Builder builder(String include) {
        return new Builder(include);
    }

    /**
     * The declared outputs, or a single one made of the template's own
     * include and id prefix with no suffix.
     */
    public List<TemplateOutput> getOutputs() {
        if (outputs.isEmpty()) {
            return List.of(new TemplateOutput(include, idPrefix, ""));
        }
        return outputs;
    }

    public String getInclude() {
        return include;
    }

    public String getIdPrefix() {
        return idPrefix;
    }

    public String getTemplateOnly() {
        return templateOnly;
    }

    public List<String> getConditions() {
        return conditions;
    }

    public List<TemplateProperty> getProperties() {
        return properties;
    }

    public List<TemplateVar> getVars() {
        return vars;
    }

    public List<Reference> getPropertyGroupRefs() {
        return propertyGroupRefs;
    }

    public List<Reference> getPresetRefs() {
        return presetRefs;
    }

    public List<Reference> getPresetGroupRefs() {
        return presetGroupRefs;
    }

    public Element getControls() {
        return controls;
    }

    public List<VariableDefinition> getVariables() {
        return variables;
    }

    public List<Reference> getVariableGroupRefs() {
        return variableGroupRefs;
    }

    @Override
    public String toString() {
        return "template:" + include;
    }

    public static class Builder {

        private final String include;
        private String idPrefix = "";
        private String templateOnly = "";
        private final List<String> conditions = new ArrayList<>();
        private final List<TemplateOutput> outputs = new ArrayList<>();
        private final List<TemplateProperty> properties = new ArrayList<>();
        private final List<TemplateVar> vars = new ArrayList<>();
        private final List<Reference> propertyGroupRefs = new ArrayList<>();
        private final List<Reference> presetRefs = new ArrayList<>();
        private final List<Reference> presetGroupRefs = new ArrayList<>();
        private Element controls;
        private final List<VariableDefinition> variables = new ArrayList<>();
        private final List<Reference> variableGroupRefs = new ArrayList<>();

        private Builder(String include) {
            this.include = include;
        }

        public Builder idPrefix(String value) {
            idPrefix = value == null ? "" : value;
            return this;
        }

        public Builder templateOnly(String value) {
            templateOnly = value == null ? "" : value;
            return this;
        }

        public Builder condition(String value) {
            conditions.add(value);
            return this;
        }

        public Builder output(TemplateOutput value) {
            outputs.add(value);
            return this;
        }

        public Builder property(TemplateProperty value) {
            properties.add(value);
            return this;
        }

        public Builder var(TemplateVar value) {
            vars.add(value);
            return this;
        }

        public Builder propertyGroup(Reference value) {
            propertyGroupRefs.add(value);
            return this;
        }

        public Builder preset(Reference value) {
            presetRefs.add(value);
            return this;
        }

        public Builder presetGroup(Reference value) {
            presetGroupRefs.add(value);
            return this;
        }

        public Builder controls(Element value) {
            controls = value;
            return this;
        }

        public Builder variable(VariableDefinition value) {
            variables.add(value);
            return this;
        }

        public Builder variableGroup(Reference value) {
            variableGroupRefs.add(value);
            return this;
        }

        public Template build() {
            return new Template(this);
        }

    }

}
