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
import io.skinshortcuts.model.FallbackRule;
import io.skinshortcuts.model.PropertyFallback;
import io.skinshortcuts.model.PropertySchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the fallback rules of properties.xml. A skin without the file has no
 * fallbacks.
 */
public class PropertyLoader {

    static final Logger logger = LoggerFactory.getLogger(PropertyLoader.class);

    public static final String ROOT = "properties";

    private PropertyLoader() {
        // only static methods
    }

    public static PropertySchema load(Path path) {
        if (!Files.exists(path)) {
            logger.debug("no property schema at {}", path);
            return PropertySchema.EMPTY;
        }
        Element root = XmlSource.read(path, ROOT, PropertyConfigException::new);
        return parse(path.toString(), root);
    }

    public static PropertySchema parse(String xml) {
        return parse("properties.xml", XmlSource.parse("properties.xml", xml, ROOT, PropertyConfigException::new));
    }

    private static PropertySchema parse(String file, Element root) {
        List<PropertyFallback> fallbacks = new ArrayList<>();
        for (Element group : Xml.getChildElements(root, "fallbacks")) {
            for (Element e : Xml.getChildElements(group, "fallback")) {
                String property = Xml.getAttribute(e, "property");
                if (property.isEmpty()) {
                    throw new PropertyConfigException(file, "<fallback> is missing the 'property' attribute");
                }
                List<FallbackRule> rules = new ArrayList<>();
                for (Element child : Xml.getChildElements(e)) {
                    if ("when".equals(child.getTagName())) {
                        rules.add(new FallbackRule(Xml.getAttribute(child, "condition"), Xml.getText(child)));
                    } else if ("default".equals(child.getTagName())) {
                        rules.add(new FallbackRule("", Xml.getText(child)));
                    }
                }
                fallbacks.add(new PropertyFallback(property, rules));
            }
        }
        return new PropertySchema(fallbacks);
    }

}
