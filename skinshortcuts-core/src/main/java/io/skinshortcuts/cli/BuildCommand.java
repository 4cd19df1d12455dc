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
package io.skinshortcuts.cli;

import io.skinshortcuts.common.Diagnostic;
import io.skinshortcuts.core.BuildConfig;
import io.skinshortcuts.core.BuildResult;
import io.skinshortcuts.core.BuildRunner;
import io.skinshortcuts.loader.SchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * The 'build' subcommand, generates the includes file of a skin.
 * <p>
 * Usage examples:
 * <pre>
 * # build using skinshortcuts.json of the current directory if present
 * skinshortcuts build
 *
 * # build from another directory, writing elsewhere
 * skinshortcuts build -w /path/to/skin/shortcuts -o ../16x9/script-skinshortcuts-includes.xml
 * </pre>
 */
@Command(
        name = "build",
        mixinStandardHelpOptions = true,
        description = "Build the includes file from templates and menus"
)
public class BuildCommand implements Callable<Integer> {

    static final Logger logger = LoggerFactory.getLogger(BuildCommand.class);

    @Option(
            names = {"-t", "--templates"},
            description = "Template schema file (default: templates.xml)"
    )
    String templates;

    @Option(
            names = {"-p", "--properties"},
            description = "Property schema file with fallbacks (default: properties.xml)"
    )
    String properties;

    @Option(
            names = {"-m", "--menus"},
            description = "Menus file (default: menus.json)"
    )
    String menus;

    @Option(
            names = {"-o", "--output"},
            description = "Output includes file (default: script-skinshortcuts-includes.xml)"
    )
    String output;

    @Option(
            names = {"-c", "--container"},
            description = "Id of the menu container used in visibility conditions (default: 9000)"
    )
    String container;

    @Option(
            names = {"-w", "--workdir"},
            description = "Working directory for relative path resolution (default: current directory)"
    )
    String workingDir;

    @Option(
            names = {"--config"},
            description = "Path to build config file (default: skinshortcuts.json)"
    )
    String configFile;

    @Option(
            names = {"--compact"},
            description = "Write the output without indentation"
    )
    boolean compact;

    @Option(
            names = {"-l", "--log-level"},
            description = "Log level: trace, debug, info, warn, error"
    )
    String logLevel;

    @Override
    public Integer call() {
        Path workDir = workingDir == null ? Path.of("") : Path.of(workingDir);
        BuildConfig config;
        try {
            config = loadConfig(workDir);
        } catch (Exception e) {
            Console.println(Console.fail("invalid build config: " + e.getMessage()));
            return 1;
        }
        applyOptions(config);
        BuildResult result;
        try {
            result = BuildRunner.run(config, workDir);
        } catch (SchemaException e) {
            Console.println(Console.fail(e.getMessage()));
            return 1;
        } catch (Exception e) {
            logger.error("build failed", e);
            Console.println(Console.fail("build failed: " + e.getMessage()));
            return 1;
        }
        for (Diagnostic diagnostic : result.diagnostics()) {
            Console.println(Console.warn(diagnostic.toString()));
        }
        Console.println(Console.pass("built " + result.templates() + " templates for "
                + result.menus() + " menus: " + result.output()));
        return 0;
    }

    BuildConfig loadConfig(Path workDir) {
        Path path = workDir.resolve(configFile != null ? configFile : BuildConfig.DEFAULT_CONFIG_FILE);
        if (Files.exists(path)) {
            Console.println(Console.info("using config: " + path));
            return BuildConfig.load(path);
        }
        if (configFile != null) {
            throw new RuntimeException("file not found: " + path);
        }
        return new BuildConfig();
    }

    void applyOptions(BuildConfig config) {
        if (templates != null) {
            config.setTemplates(templates);
        }
        if (properties != null) {
            config.setProperties(properties);
        }
        if (menus != null) {
            config.setMenus(menus);
        }
        if (output != null) {
            config.setOutput(output);
        }
        if (container != null) {
            config.setContainer(container);
        }
        if (compact) {
            config.setPretty(false);
        }
        if (logLevel != null) {
            config.setLogLevel(logLevel);
        }
    }

}
