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

import io.skinshortcuts.common.Json;
import io.skinshortcuts.model.Menu;
import io.skinshortcuts.model.MenuItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads menus and their items from JSON:
 * <pre>
 * { "menus": [ { "name": "mainmenu", "defaults": {}, "items": [
 *     { "name": "movies", "label": "Movies", "disabled": false, "properties": {} } ] } ] }
 * </pre>
 */
public class MenuLoader {

    static final Logger logger = LoggerFactory.getLogger(MenuLoader.class);

    private MenuLoader() {
        // only static methods
    }

    public static List<Menu> load(Path path) {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MenuConfigException(path.toString(), "failed to read file: " + e.getMessage(), e);
        }
        List<Menu> menus = parse(path.toString(), text);
        logger.debug("loaded {} menus from {}", menus.size(), path);
        return menus;
    }

    public static List<Menu> parse(String json) {
        return parse("menus.json", json);
    }

    @SuppressWarnings("unchecked")
    public static List<Menu> parse(String file, String json) {
        Json doc;
        try {
            doc = Json.of(json);
        } catch (RuntimeException e) {
            throw new MenuConfigException(file, e.getMessage(), e);
        }
        if (!doc.isObject()) {
            throw new MenuConfigException(file, "expected a json object");
        }
        Object list = doc.get("menus", null);
        if (!(list instanceof List)) {
            throw new MenuConfigException(file, "'menus' must be an array");
        }
        List<Menu> menus = new ArrayList<>();
        for (Object o : (List<Object>) list) {
            if (!(o instanceof Map)) {
                throw new MenuConfigException(file, "menu must be an object: " + o);
            }
            menus.add(toMenu(file, (Map<String, Object>) o));
        }
        return menus;
    }

    @SuppressWarnings("unchecked")
    private static Menu toMenu(String file, Map<String, Object> map) {
        String name = toString(map.get("name"));
        if (name.isEmpty()) {
            throw new MenuConfigException(file, "menu is missing 'name'");
        }
        List<MenuItem> items = new ArrayList<>();
        Object list = map.get("items");
        if (list instanceof List) {
            for (Object o : (List<Object>) list) {
                if (!(o instanceof Map)) {
                    throw new MenuConfigException(file, "item of menu '" + name + "' must be an object");
                }
                items.add(toItem(file, name, (Map<String, Object>) o));
            }
        }
        return new Menu(name, toProperties(file, map.get("defaults")), items);
    }

    private static MenuItem toItem(String file, String menu, Map<String, Object> map) {
        String name = toString(map.get("name"));
        if (name.isEmpty()) {
            throw new MenuConfigException(file, "item of menu '" + menu + "' is missing 'name'");
        }
        Object label = map.get("label");
        boolean disabled = Boolean.parseBoolean(toString(map.get("disabled")));
        return new MenuItem(name, label == null ? name : toString(label), toProperties(file, map.get("properties")), disabled);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> toProperties(String file, Object o) {
        Map<String, String> properties = new LinkedHashMap<>();
        if (o == null) {
            return properties;
        }
        if (!(o instanceof Map)) {
            throw new MenuConfigException(file, "properties must be an object: " + o);
        }
        ((Map<String, Object>) o).forEach((k, v) -> properties.put(k, v == null ? "" : v.toString()));
        return properties;
    }

    private static String toString(Object o) {
        return o == null ? "" : o.toString().trim();
    }

}
