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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.Properties;

public final class Globals {

    static final Logger logger = LoggerFactory.getLogger(Globals.class);

    /**
     * Loaded from skinshortcuts-meta.properties, written at build time.
     */
    public static final String VERSION;

    public static final String ROOT_LOGGER = "io.skinshortcuts";

    static {
        VERSION = loadVersion();
    }

    private static String loadVersion() {
        try (InputStream is = Globals.class.getResourceAsStream("/skinshortcuts-meta.properties")) {
            if (is != null) {
                Properties props = new Properties();
                props.load(is);
                return props.getProperty("skinshortcuts.version", "(unknown)");
            }
        } catch (Exception e) {
            logger.debug("failed to read version: {}", e.getMessage());
        }
        return "(unknown)";
    }

    /**
     * Sets the level of the application loggers when Logback is the SLF4J
     * binding, reflection keeps the compile-time dependency on the API only.
     *
     * @param level trace, debug, info, warn or error
     * @return false if the level could not be applied
     */
    public static boolean setLogLevel(String level) {
        if (level == null || level.isEmpty()) {
            return false;
        }
        try {
            Object factory = LoggerFactory.getILoggerFactory();
            if (!factory.getClass().getName().equals("ch.qos.logback.classic.LoggerContext")) {
                logger.debug("log level not supported: not using logback");
                return false;
            }
            Object target = factory.getClass()
                    .getMethod("getLogger", String.class)
                    .invoke(factory, ROOT_LOGGER);
            Class<?> levelClass = Class.forName("ch.qos.logback.classic.Level");
            Object levelValue = levelClass
                    .getMethod("toLevel", String.class)
                    .invoke(null, level.toUpperCase());
            target.getClass()
                    .getMethod("setLevel", levelClass)
                    .invoke(target, levelValue);
            return true;
        } catch (Exception e) {
            logger.debug("failed to set log level: {}", e.getMessage());
            return false;
        }
    }

    private Globals() {
        // utility class
    }

}
