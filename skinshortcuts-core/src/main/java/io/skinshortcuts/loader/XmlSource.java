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
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a schema file into a DOM, reporting failures as the exception type of
 * the calling loader.
 */
class XmlSource {

    interface ErrorFactory {

        SchemaException create(String file, String message, int line, Throwable cause);

    }

    private XmlSource() {
        // only static methods
    }

    static Element read(Path path, String rootName, ErrorFactory errors) {
        String file = path.toString();
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw errors.create(file, "failed to read file: " + e.getMessage(), -1, e);
        }
        return parse(file, text, rootName, errors);
    }

    static Element parse(String file, String text, String rootName, ErrorFactory errors) {
        Document doc;
        try {
            doc = Xml.toXmlDoc(text);
        } catch (RuntimeException e) {
            if (e.getCause() instanceof SAXParseException spe) {
                throw errors.create(file, "xml parse error: " + spe.getMessage(), spe.getLineNumber(), e);
            }
            throw errors.create(file, "xml parse error: " + e.getMessage(), -1, e);
        }
        Element root = doc.getDocumentElement();
        if (!rootName.equals(root.getTagName())) {
            throw errors.create(file, "root element must be <" + rootName + ">, got <" + root.getTagName() + ">", -1, null);
        }
        return root;
    }

}
