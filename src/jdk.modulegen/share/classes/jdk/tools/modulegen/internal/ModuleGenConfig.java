/*
 * Copyright (c) 2016, Oracle and/or its affiliates. All rights reserved.
 * DO NOT ALTER OR REMOVE COPYRIGHT NOTICES OR THIS FILE HEADER.
 *
 * This code is free software; you can redistribute it and/or modify it
 * under the terms of the GNU General Public License version 2 only, as
 * published by the Free Software Foundation.  Oracle designates this
 * particular file as subject to the "Classpath" exception as provided
 * by Oracle in the LICENSE file that accompanied this code.
 *
 * This code is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE.  See the GNU General Public License
 * version 2 for more details (a copy is included in the LICENSE file that
 * accompanied this code).
 *
 * You should have received a copy of the GNU General Public License version
 * 2 along with this work; if not, write to the Free Software Foundation,
 * Inc., 51 Franklin St, Fifth Floor, Boston, MA 02110-1301 USA.
 *
 * Please contact Oracle, 500 Oracle Parkway, Redwood Shores, CA 94065 USA
 * or visit www.oracle.com if you need additional information or have any
 * questions.
 */
package jdk.tools.modulegen.internal;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.Properties;

/**
 * Settings of the module builder.
 *
 * The settings are read from {@code defaults.properties} next to the message
 * bundle, then from the properties given by the caller and finally from the
 * system properties of the same name.
 */
public final class ModuleGenConfig {

    public static final String VERBOSE = "modulegen.verbose";
    public static final String MODULES_DIR = "modulegen.modules.dir";
    public static final String DESCRIPTOR_SUFFIX = "modulegen.descriptor.suffix";
    public static final String JAVAC = "modulegen.javac";

    private static final String DEFAULTS = "/jdk/tools/modulegen/resources/defaults.properties";

    private final Properties props;

    private ModuleGenConfig(Properties props) {
        this.props = props;
    }

    public static ModuleGenConfig load() {
        return load(new Properties());
    }

    public static ModuleGenConfig load(Properties overrides) {
        Properties props = new Properties();
        try (InputStream in = ModuleGenConfig.class.getResourceAsStream(DEFAULTS)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        props.putAll(overrides);
        for (String key : new String[] { VERBOSE, MODULES_DIR, DESCRIPTOR_SUFFIX, JAVAC }) {
            String value = System.getProperty(key);
            if (value != null) {
                props.setProperty(key, value);
            }
        }
        return new ModuleGenConfig(props);
    }

    String getProperty(String key, String defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty())
            return defaultValue;
        else
            return value.trim();
    }

    public boolean verbose() {
        return Boolean.parseBoolean(getProperty(VERBOSE, "false"));
    }

    /**
     * Returns the name of the directory, relative to the output root of a
     * suite, in which modules are staged and their jars written.
     */
    public String modulesDir() {
        return getProperty(MODULES_DIR, "modules");
    }

    /**
     * Returns the suffix appended to the staging directory of a module to
     * form the path of its persisted descriptor.
     */
    public String descriptorSuffix() {
        return getProperty(DESCRIPTOR_SUFFIX, ".pickled");
    }

    /**
     * Returns the compiler to use instead of the platform's {@code javac}.
     */
    public Optional<Path> javac() {
        return Optional.ofNullable(getProperty(JAVAC, null)).map(Paths::get);
    }
}
