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

import io.skinshortcuts.common.StringUtils;
import io.skinshortcuts.condition.SuffixTransform;
import io.skinshortcuts.model.FallbackRule;
import io.skinshortcuts.model.Menu;
import io.skinshortcuts.model.MenuItem;
import io.skinshortcuts.model.Preset;
import io.skinshortcuts.model.PresetGroup;
import io.skinshortcuts.model.PresetGroupChild;
import io.skinshortcuts.model.PresetRow;
import io.skinshortcuts.model.PropertyFallback;
import io.skinshortcuts.model.PropertyGroup;
import io.skinshortcuts.model.PropertySchema;
import io.skinshortcuts.model.Reference;
import io.skinshortcuts.model.Template;
import io.skinshortcuts.model.TemplateOutput;
import io.skinshortcuts.model.TemplateProperty;
import io.skinshortcuts.model.TemplateSchema;
import io.skinshortcuts.model.TemplateVar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Builds the property context of one menu item for one template output.
 * <p>
 * Steps run in a fixed order: menu defaults and item properties, built-ins,
 * fallbacks, template properties, template vars, presets, preset groups and
 * property groups. Template properties and vars overwrite, every other step
 * only fills keys that are still absent.
 */
public class ContextResolver {

    static final Logger logger = LoggerFactory.getLogger(ContextResolver.class);

    private final TemplateSchema schema;
    private final PropertySchema propertySchema;
    private final TemplateConditions conditions;

    public ContextResolver(TemplateSchema schema, PropertySchema propertySchema, TemplateConditions conditions) {
        this.schema = schema;
        this.propertySchema = propertySchema == null ? PropertySchema.EMPTY : propertySchema;
        this.conditions = conditions;
    }

    /**
     * @param index 1-based position of the item in its menu
     * @return a new map owned by the caller
     */
    public Map<String, String> buildContext(Template template, TemplateOutput output, MenuItem item, int index, Menu menu) {
        String suffix = output.suffix();
        Map<String, String> context = new LinkedHashMap<>(menu.defaults());
        context.putAll(item.properties());
        context.put("index", String.valueOf(index));
        context.put("name", item.name());
        context.put("menu", menu.name());
        context.put("idprefix", output.idPrefix());
        context.put("id", output.idPrefix().isEmpty() ? String.valueOf(index) : output.idPrefix() + index);
        context.put("suffix", suffix);
        applyFallbacks(item, context);
        Set<String> resolved = new HashSet<>();
        for (TemplateProperty property : template.getProperties()) {
            if (resolved.contains(property.name())) {
                continue;
            }
            String value = resolveProperty(property, item, context, suffix);
            if (value != null) {
                context.put(property.name(), value);
                resolved.add(property.name());
            }
        }
        for (TemplateVar var : template.getVars()) {
            String value = resolveVar(var, item, context, suffix);
            if (value != null) {
                context.put(var.name(), value);
            }
        }
        for (Reference ref : template.getPresetRefs()) {
            String effective = ref.effectiveSuffix(suffix);
            if (!applies(ref, effective, item, context)) {
                continue;
            }
            Preset preset = schema.getPreset(ref.name());
            if (preset == null) {
                logger.debug("unknown preset: {}", ref.name());
                continue;
            }
            Map<String, String> values = presetValues(preset, item, context, effective);
            if (values != null) {
                putAbsent(context, values);
            }
        }
        for (Reference ref : template.getPresetGroupRefs()) {
            String effective = ref.effectiveSuffix(suffix);
            if (!applies(ref, effective, item, context)) {
                continue;
            }
            PresetGroup group = schema.getPresetGroup(ref.name());
            if (group == null) {
                logger.debug("unknown preset group: {}", ref.name());
                continue;
            }
            applyPresetGroup(group, item, context, effective);
        }
        for (Reference ref : template.getPropertyGroupRefs()) {
            String effective = ref.effectiveSuffix(suffix);
            if (!applies(ref, effective, item, context)) {
                continue;
            }
            PropertyGroup group = schema.getPropertyGroup(ref.name());
            if (group == null) {
                logger.debug("unknown property group: {}", ref.name());
                continue;
            }
            applyPropertyGroup(group, item, context, effective);
        }
        return context;
    }

    private boolean applies(Reference ref, String suffix, MenuItem item, Map<String, String> context) {
        if (ref.condition().isEmpty()) {
            return true;
        }
        return conditions.test(conditions.prepare(ref.condition(), suffix), item, context);
    }

    private void applyFallbacks(MenuItem item, Map<String, String> context) {
        if (propertySchema.isEmpty()) {
            return;
        }
        Set<String> suffixes = new LinkedHashSet<>();
        suffixes.add("");
        for (String name : item.properties().keySet()) {
            if (StringUtils.hasNumericSuffix(name)) {
                suffixes.add(StringUtils.numericSuffix(name));
            }
        }
        for (PropertyFallback fallback : propertySchema.getFallbacks().values()) {
            for (String suffix : suffixes) {
                String name = fallback.property() + suffix;
                if (context.containsKey(name) || item.properties().containsKey(name)) {
                    continue;
                }
                for (FallbackRule rule : fallback.rules()) {
                    if (rule.isDefault() || conditions.test(conditions.prepare(rule.condition(), suffix), item, context)) {
                        context.put(name, rule.value());
                        break;
                    }
                }
            }
        }
    }

    /**
     * @return the value, or null when the declaration's condition does not hold
     */
    String resolveProperty(TemplateProperty property, MenuItem item, Map<String, String> context, String suffix) {
        if (!property.condition().isEmpty()) {
            String condition = conditions.prepare(property.condition(), suffix);
            if (!conditions.test(condition, item, context)) {
                return null;
            }
        }
        if (!property.from().isEmpty()) {
            return fromSource(SuffixTransform.toSource(property.from(), suffix), item, context);
        }
        return Placeholders.substitute(property.value(), context, item);
    }

    private static String fromSource(String source, MenuItem item, Map<String, String> context) {
        if (SuffixTransform.NO_SUFFIX_PROPERTIES.contains(source)) {
            return context.getOrDefault(source, "");
        }
        if (source.contains("$PROPERTY[")) {
            return Placeholders.substitute(source, context, item);
        }
        return Placeholders.lookup(source, context, item);
    }

    String resolveVar(TemplateVar var, MenuItem item, Map<String, String> context, String suffix) {
        for (TemplateVar.Value value : var.values()) {
            if (value.condition().isEmpty()) {
                return value.value();
            }
            if (conditions.test(conditions.prepare(value.condition(), suffix), item, context)) {
                return value.value();
            }
        }
        return null;
    }

    private Map<String, String> presetValues(Preset preset, MenuItem item, Map<String, String> context, String suffix) {
        for (PresetRow row : preset.rows()) {
            if (row.condition().isEmpty()
                    || conditions.test(conditions.prepare(row.condition(), suffix), item, context)) {
                return row.values();
            }
        }
        return null;
    }

    private void applyPresetGroup(PresetGroup group, MenuItem item, Map<String, String> context, String suffix) {
        for (PresetGroupChild child : group.children()) {
            if (!child.condition().isEmpty()
                    && !conditions.test(conditions.prepare(child.condition(), suffix), item, context)) {
                continue;
            }
            if (child.isPresetReference()) {
                Preset preset = schema.getPreset(child.presetName());
                if (preset == null) {
                    logger.debug("unknown preset in group {}: {}", group.name(), child.presetName());
                    continue;
                }
                Map<String, String> values = presetValues(preset, item, context, suffix);
                if (values != null && !values.isEmpty()) {
                    putAbsent(context, values);
                    return;
                }
            } else if (!child.values().isEmpty()) {
                putAbsent(context, child.values());
                return;
            }
        }
    }

    private void applyPropertyGroup(PropertyGroup group, MenuItem item, Map<String, String> context, String suffix) {
        for (TemplateProperty property : group.properties()) {
            if (context.containsKey(property.name())) {
                continue;
            }
            String value = resolveProperty(property, item, context, suffix);
            if (value != null) {
                context.put(property.name(), value);
            }
        }
        for (TemplateVar var : group.vars()) {
            if (context.containsKey(var.name())) {
                continue;
            }
            String value = resolveVar(var, item, context, suffix);
            if (value != null) {
                context.put(var.name(), value);
            }
        }
    }

    private static void putAbsent(Map<String, String> context, Map<String, String> values) {
        values.forEach(context::putIfAbsent);
    }

}
