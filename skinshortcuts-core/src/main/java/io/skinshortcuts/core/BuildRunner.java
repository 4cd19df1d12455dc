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

import io.skinshortcuts.loader.MenuLoader;
import io.skinshortcuts.loader.PropertyLoader;
import io.skinshortcuts.loader.TemplateLoader;
import io.skinshortcuts.model.Menu;
import io.skinshortcuts.model.PropertySchema;
import io.skinshortcuts.model.TemplateSchema;
import io.skinshortcuts.template.IncludesBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Loads the schema files and menus named by a {@link BuildConfig} and writes
 * the generated includes file.
 */
public class BuildRunner {

    static final Logger logger = LoggerFactory.getLogger(BuildRunner.class);

    private BuildRunner() {
        // only static methods
    }

    /**
     * @param workingDir base for relative paths of the config
     * @throws io.skinshortcuts.loader.SchemaException if a file cannot be loaded
     */
    public static BuildResult run(BuildConfig config, Path workingDir) {
        if (config.getLogLevel() != null) {
            Globals.setLogLevel(config.getLogLevel());
        }
        Path templatesPath = workingDir.resolve(config.getTemplates());
        Path propertiesPath = workingDir.resolve(config.getProperties());
        Path menusPath = workingDir.resolve(config.getMenus());
        Path outputPath = workingDir.resolve(config.getOutput());
        TemplateSchema schema = TemplateLoader.load(templatesPath);
        PropertySchema properties = PropertyLoader.load(propertiesPath);
        List<Menu> menus = MenuLoader.load(menusPath);
        logger.info("building {} templates for {} menus", schema.getTemplates().size(), menus.size());
        IncludesBuilder builder = new IncludesBuilder(schema, properties, menus, config.getContainer());
        builder.write(outputPath, config.isPretty());
        return new BuildResult(outputPath, schema.getTemplates().size(), menus.size(), builder.getDiagnostics().getAll());
    }

}
