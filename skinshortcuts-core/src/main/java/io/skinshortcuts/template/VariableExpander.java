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

import io.skinshortcuts.model.MenuItem;
import io.skinshortcuts.model.Reference;
import io.skinshortcuts.model.TemplateSchema;
import io.skinshortcuts.model.VariableDefinition;
import io.skinshortcuts.model.VariableGroup;
import io.skinshortcuts.model.VariableReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds {@code <variable>} elements for one menu item, from inline
 * definitions or through variable groups.
 */
public class VariableExpander {

    static final Logger logger = LoggerFactory.getLogger(VariableExpander.class);

    private final Document doc;
    private final TemplateSchema schema;
    private final TemplateConditions conditions;

    public VariableExpander(Document doc, TemplateSchema schema, TemplateConditions conditions) {
        this.doc = doc;
        this.schema = schema;
        this.conditions = conditions;
    }

    /**
     * The definition's own condition is not rewritten for any suffix.
     */
    public Optional<Element> expandVariable(VariableDefinition definition, Map<String, String> context, MenuItem item) {
        if (!definition.condition().isEmpty() && !conditions.test(definition.condition(), item, context)) {
            return Optional.empty();
        }
        if (definition.content() == null) {
            return Optional.empty();
        }
        Element source = definition.content();
        String pattern;
        if (!definition.output().isEmpty()) {
            pattern = definition.output();
        } else if (source.hasAttribute("name")) {
            pattern = source.getAttribute("name");
        } else {
            pattern = definition.name();
        }
        Element variable = (Element) copy(source, context, item);
        variable.removeAttribute("condition");
        variable.removeAttribute("output");
        variable.setAttribute("name", Placeholders.substitute(pattern, context, item));
        return Optional.of(variable);
    }

    /**
     * The reference's own condition is tested as written, the conditions of the
     * variables listed in the group get the suffix.
     *
     * @param suffix the slot suffix in effect for the reference
     */
    public List<Element> expandGroup(Reference ref, String suffix, Map<String, String> context, MenuItem item) {
        List<Element> variables = new ArrayList<>();
        expandGroup(ref, suffix, context, item, new ArrayDeque<>(), variables);
        return variables;
    }

    private void expandGroup(Reference ref, String suffix, Map<String, String> context, MenuItem item,
                             Deque<String> chain, List<Element> variables) {
        if (!ref.condition().isEmpty() && !conditions.test(ref.condition(), item, context)) {
            return;
        }
        VariableGroup group = schema.getVariableGroup(ref.name());
        if (group == null) {
            logger.debug("unknown variable group: {}", ref.name());
            return;
        }
        if (chain.contains(group.name())) {
            conditions.getDiagnostics().add("variableGroup",
                    "variable group cycle: " + String.join(" -> ", chain) + " -> " + group.name());
            return;
        }
        chain.addLast(group.name());
        for (Reference nested : group.groupRefs()) {
            expandGroup(nested, nested.effectiveSuffix(suffix), context, item, chain, variables);
        }
        chain.removeLast();
        for (VariableReference var : group.references()) {
            if (!var.condition().isEmpty() && !conditions.test(conditions.prepare(var.condition(), suffix), item, context)) {
                continue;
            }
            VariableDefinition definition = schema.getVariableDefinition(var.name());
            if (definition == null) {
                logger.debug("unknown variable in group {}: {}", group.name(), var.name());
                continue;
            }
            expandVariable(definition, context, item).ifPresent(variables::add);
        }
    }

    private Node copy(Node node, Map<String, String> context, MenuItem item) {
        switch (node.getNodeType()) {
            case Node.ELEMENT_NODE:
                Element source = (Element) node;
                Element element = doc.createElement(source.getTagName());
                NamedNodeMap attributes = source.getAttributes();
                for (int i = 0; i < attributes.getLength(); i++) {
                    Attr attr = (Attr) attributes.item(i);
                    element.setAttribute(attr.getName(), Placeholders.substitute(attr.getValue(), context, item));
                }
                NodeList children = source.getChildNodes();
                for (int i = 0; i < children.getLength(); i++) {
                    element.appendChild(copy(children.item(i), context, item));
                }
                return element;
            case Node.TEXT_NODE:
            case Node.CDATA_SECTION_NODE:
                return doc.createTextNode(Placeholders.substitute(node.getNodeValue(), context, item));
            default:
                return doc.importNode(node, true);
        }
    }

}
