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
package io.skinshortcuts.core;

import io.skinshortcuts.common.Json;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Build settings loaded from skinshortcuts.json, all keys optional.
 * <pre>
 * {
 *   "templates": "shortcuts/templates.xml",
 *   "properties": "shortcuts/properties.xml",
 *   "menus": "shortcuts/menus.json",
 *   "output": "16x9/script-skinshortcuts-includes.xml",
 *   "container": "9000",
 *   "pretty": true,
 *   "logLevel": "info"
 * }
 * </pre>
 * Relative paths resolve against the directory the build runs in.
 */
public class BuildConfig {

    public static final String DEFAULT_CONFIG_FILE = "skinshortcuts.json";
    public static final String DEFAULT_TEMPLATES = "templates.xml";
    public static final String DEFAULT_PROPERTIES = "properties.xml";
    public static final String DEFAULT_MENUS = "menus.json";
    public static final String DEFAULT_OUTPUT = "script-skinshortcuts-includes.xml";
    public static final String DEFAULT_CONTAINER = "9000";

    private String templates = DEFAULT_TEMPLATES;
    private String properties = DEFAULT_PROPERTIES;
    private String menus = DEFAULT_MENUS;
    private String output = DEFAULT_OUTPUT;
    private String container = DEFAULT_CONTAINER;
    private boolean pretty = true;
    private String logLevel;

    public static BuildConfig load(Path configPath) {
        try {
            String content = Files.readString(configPath);
            return parse(content);
        } catch (Exception e) {
            throw new RuntimeException("failed to load config from: " + configPath, e);
        }
    }

    public static BuildConfig parse(String json) {
        Json j = Json.of(json);
        if (!j.isObject()) {
            throw new RuntimeException("invalid config: expected json object");
        }
        BuildConfig config = new BuildConfig();
        j.<String>getOptional("templates").ifPresent(config::setTemplates);
        j.<String>getOptional("properties").ifPresent(config::setProperties);
        j.<String>getOptional("menus").ifPresent(config::setMenus);
        j.<String>getOptional("output").ifPresent(config::setOutput);
        // a number is accepted for the container id
        j.getOptional("container").map(Object::toString).ifPresent(config::setContainer);
        j.<Boolean>getOptional("pretty").ifPresent(config::setPretty);
        j.<String>getOptional("logLevel").ifPresent(config::setLogLevel);
        return config;
    }

    public String getTemplates() {
        return templates;
    }

    public void setTemplates(String templates) {
        this.templates = templates;
    }

    public String getProperties() {
        return properties;
    }

    public void setProperties(String properties) {
        this.properties = properties;
    }

    public String getMenus() {
        return menus;
    }

    public void setMenus(String menus) {
        this.menus = menus;
    }

    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }

    public String getContainer() {
        return container;
    }

    public void setContainer(String container) {
        this.container = container;
    }

    public boolean isPretty() {
        return pretty;
    }

    public void setPretty(boolean pretty) {
        this.pretty = pretty;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public void setLogLevel(String logLevel) {
        this.logLevel = logLevel;
    }

}
