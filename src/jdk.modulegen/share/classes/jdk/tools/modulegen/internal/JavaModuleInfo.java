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

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

import jdk.tools.modulegen.ModuleConfigurationException;
import jdk.tools.modulegen.spi.JarDistribution;
import jdk.tools.modulegen.spi.Suite.ModuleDepsMode;

/**
 * The name of the module derived from a distribution, the directory in which
 * the class files (including {@code module-info.class}) of the module are
 * staged and the path of the jar file containing the built module.
 */
public final class JavaModuleInfo {
    private final String name;
    private final Path moduleDir;
    private final Path moduleJar;

    JavaModuleInfo(String name, Path moduleDir, Path moduleJar) {
        this.name = name;
        this.moduleDir = moduleDir;
        this.moduleJar = moduleJar;
    }

    public String name() {
        return name;
    }

    public Path moduleDir() {
        return moduleDir;
    }

    public Path moduleJar() {
        return moduleJar;
    }

    /**
     * Gets the layout of the module derived from {@code dist}.
     *
     * @param fatalIfNotModule specifies whether to fail if {@code dist}
     *        does not define a module
     * @return empty if {@code dist} does not define a module
     * @throws ModuleConfigurationException if {@code dist} does not define a
     *         module and {@code fatalIfNotModule} is true, or if the module
     *         name is empty
     */
    public static Optional<JavaModuleInfo> of(JarDistribution dist,
                                              ModuleDependencyCollector collector,
                                              ModuleGenConfig config,
                                              boolean fatalIfNotModule) {
        Optional<String> explicit = dist.moduleName();
        String moduleName;
        if (dist.suite().moduleDepsMode() == ModuleDepsMode.DISTRIBUTION_DEPS) {
            if (!explicit.isPresent()) {
                if (fatalIfNotModule) {
                    throw new ModuleConfigurationException("err.not.a.module", dist.name());
                }
                return Optional.empty();
            }
            moduleName = explicit.get();
        } else {
            if (collector.collectModuleDeps(dist).isEmpty()) {
                if (fatalIfNotModule) {
                    throw new ModuleConfigurationException("err.module.empty", dist.name());
                }
                return Optional.empty();
            }
            moduleName = explicit.orElseGet(() -> deriveModuleName(dist.name()));
        }
        if (moduleName.isEmpty()) {
            throw new ModuleConfigurationException("err.module.name.empty", dist.name());
        }
        Path modulesDir = dist.suite().outputRoot().resolve(config.modulesDir());
        return Optional.of(new JavaModuleInfo(moduleName,
                                              modulesDir.resolve(moduleName),
                                              modulesDir.resolve(moduleName + ".jar")));
    }

    /**
     * Derives a module name from a distribution name, e.g.
     * {@code TRUFFLE_API} becomes {@code truffle.api}.
     */
    static String deriveModuleName(String distName) {
        return distName.replace('_', '.').toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return name + " [" + moduleDir + ", " + moduleJar + "]";
    }
}
