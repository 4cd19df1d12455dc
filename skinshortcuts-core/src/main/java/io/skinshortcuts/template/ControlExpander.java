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

import io.skinshortcuts.common.Xml;
import io.skinshortcuts.model.IncludeDefinition;
import io.skinshortcuts.model.MenuItem;
import io.skinshortcuts.model.TemplateSchema;
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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands a controls fragment for one menu item into nodes of the target
 * document. The source fragment is never modified: every node is rebuilt and
 * a directive either yields its replacement nodes or nothing.
 * <ul>
 * <li>{@code $PROPERTY[name]} in text and attributes is replaced</li>
 * <li>{@code $INCLUDE[name]} in text becomes {@code <include>name</include>}</li>
 * <li>{@code <skinshortcuts>visibility</skinshortcuts>} becomes a
 * {@code <visible>} test on the item name</li>
 * <li>{@code <skinshortcuts include="name" condition=".." wrap="true"/>}
 * inlines the named include, or drops the node</li>
 * </ul>
 */
public class ControlExpander {

    static final Logger logger = LoggerFactory.getLogger(ControlExpander.class);

    public static final String DIRECTIVE = "skinshortcuts";

    private static final Pattern INCLUDE_REF = Pattern.compile("\\$INCLUDE\\[([^\\]]+)\\]");

    private final Document doc;
    private final TemplateSchema schema;
    private final TemplateConditions conditions;
    private final String container;

    // include names currently being inlined
    private final Deque<String> includeChain = new ArrayDeque<>();

    public ControlExpander(Document doc, TemplateSchema schema, TemplateConditions conditions, String container) {
        this.doc = doc;
        this.schema = schema;
        this.conditions = conditions;
        this.container = container;
    }

    /**
     * @return a copy of the fragment element holding the expanded children,
     * empty if there is no fragment
     */
    public Optional<Element> expandOutput(Element fragment, Map<String, String> context, MenuItem item) {
        if (fragment == null) {
            return Optional.empty();
        }
        Element result = doc.createElement(fragment.getTagName());
        for (Node node : expandChildren(fragment, context, item)) {
            result.appendChild(node);
        }
        return Optional.of(result);
    }

    private List<Node> expandChildren(Node parent, Map<String, String> context, MenuItem item) {
        List<Node> nodes = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            nodes.addAll(expand(children.item(i), context, item));
        }
        return nodes;
    }

    private List<Node> expand(Node node, Map<String, String> context, MenuItem item) {
        switch (node.getNodeType()) {
            case Node.ELEMENT_NODE:
                Element element = (Element) node;
                if (DIRECTIVE.equals(element.getTagName())) {
                    return expandDirective(element, context, item);
                }
                return List.of(copyElement(element, element.getTagName(), context, item));
            case Node.TEXT_NODE:
            case Node.CDATA_SECTION_NODE:
                return expandText(Placeholders.substitute(node.getNodeValue(), context, item));
            case Node.COMMENT_NODE:
                return List.of();
            default:
                return List.of(doc.importNode(node, true));
        }
    }

    private List<Node> expandDirective(Element element, Map<String, String> context, MenuItem item) {
        if ("visibility".equals(Xml.getText(element))) {
            Element visible = doc.createElement("visible");
            visible.setTextContent("String.IsEqual(Container(" + container + ").ListItem.Property(name)," + item.name() + ")");
            return List.of(visible);
        }
        String name = Xml.getAttribute(element, "include");
        if (name.isEmpty()) {
            return List.of(copyElement(element, element.getTagName(), context, item));
        }
        String condition = Xml.getAttribute(element, "condition");
        if (!condition.isEmpty() && !conditions.test(condition, item, context)) {
            logger.debug("include {} skipped for {}, condition failed: {}", name, item.name(), condition);
            return List.of();
        }
        IncludeDefinition include = schema.getInclude(name);
        if (include == null || include.controls() == null) {
            conditions.getDiagnostics().add("include", "unknown include: " + name);
            return List.of();
        }
        if (includeChain.contains(name)) {
            conditions.getDiagnostics().add("include",
                    "include cycle: " + String.join(" -> ", includeChain) + " -> " + name);
            return List.of();
        }
        includeChain.addLast(name);
        List<Node> expanded;
        try {
            expanded = expandChildren(include.controls(), context, item);
        } finally {
            includeChain.removeLast();
        }
        if ("true".equalsIgnoreCase(Xml.getAttribute(element, "wrap"))) {
            Element wrapper = doc.createElement("include");
            wrapper.setAttribute("name", name);
            expanded.forEach(wrapper::appendChild);
            return List.of(wrapper);
        }
        return expanded;
    }

    private Element copyElement(Element source, String tag, Map<String, String> context, MenuItem item) {
        Element copy = doc.createElement(tag);
        NamedNodeMap attributes = source.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            copy.setAttribute(attr.getName(), Placeholders.substitute(attr.getValue(), context, item));
        }
        for (Node child : expandChildren(source, context, item)) {
            copy.appendChild(child);
        }
        return copy;
    }

    private List<Node> expandText(String text) {
        if (!text.contains("$INCLUDE[")) {
            return List.of(doc.createTextNode(text));
        }
        List<Node> nodes = new ArrayList<>();
        Matcher matcher = INCLUDE_REF.matcher(text);
        int pos = 0;
        while (matcher.find()) {
            if (matcher.start() > pos) {
                nodes.add(doc.createTextNode(text.substring(pos, matcher.start())));
            }
            Element include = doc.createElement("include");
            include.setTextContent(matcher.group(1));
            nodes.add(include);
            pos = matcher.end();
        }
        if (pos < text.length()) {
            nodes.add(doc.createTextNode(text.substring(pos)));
        }
        return nodes;
    }

}
