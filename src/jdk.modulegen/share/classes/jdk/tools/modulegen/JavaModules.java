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
package jdk.tools.modulegen;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import jdk.tools.modulegen.internal.JavaModuleInfo;
import jdk.tools.modulegen.internal.ModuleBuildSession;
import jdk.tools.modulegen.internal.ModuleGenConfig;
import jdk.tools.modulegen.internal.ModuleGenLog;
import jdk.tools.modulegen.internal.ProcessTool;
import jdk.tools.modulegen.spi.BuildGraph;
import jdk.tools.modulegen.spi.Dependency;
import jdk.tools.modulegen.spi.ExternalTool;
import jdk.tools.modulegen.spi.JarDistribution;
import jdk.tools.modulegen.spi.Platform;

/**
 * API for building Java modules out of the jar distributions of a build.
 *
 * <p> A {@code JavaModules} instance is a build session. It remembers the
 * module descriptor of every distribution it has built or loaded, so that
 * the modules of dependent distributions are resolved against the same
 * descriptors. Use {@link #invalidate(JarDistribution)} after a distribution
 * has changed.
 *
 * <pre>{@code
 *     JavaModules modules = new JavaModules.Builder(JdkPlatform.ofRuntime(), graph)
 *                                          .build();
 *     Optional<JavaModuleDescriptor> jmd = modules.makeJavaModule(dist);
 * }</pre>
 */
public final class JavaModules {

    private final ModuleBuildSession session;

    private JavaModules(ModuleBuildSession session) {
        this.session = session;
    }

    /**
     * Gets the name of the module defined by {@code dist} and the paths of
     * its staging directory and jar.
     *
     * @return the name, staging directory and jar of the module, empty if
     *         {@code dist} does not define a module and
     *         {@code fatalIfNotModule} is false
     * @throws ModuleConfigurationException if {@code dist} does not define a
     *         module and {@code fatalIfNotModule} is true
     */
    public Optional<ModuleLayout> javaModuleInfo(JarDistribution dist, boolean fatalIfNotModule) {
        return session.javaModuleInfo(dist, fatalIfNotModule).map(ModuleLayout::new);
    }

    /**
     * Gets the Java projects and jar distributions whose content is folded
     * into the module defined by {@code dist}.
     */
    public List<Dependency> moduleDeps(JarDistribution dist) {
        return session.moduleDeps(dist);
    }

    /**
     * Gets the descriptor of the module built from {@code dist} by this or
     * a previous session.
     *
     * @param fatalIfNotCreated specifies whether to fail if the module has
     *        not been built yet
     * @throws DescriptorNotFoundException if the module has not been built
     *         and {@code fatalIfNotCreated} is true
     * @throws IOException if the saved descriptor cannot be read
     */
    public Optional<JavaModuleDescriptor> asJavaModule(JarDistribution dist, boolean fatalIfNotCreated)
        throws IOException
    {
        return session.asJavaModule(dist, fatalIfNotCreated);
    }

    /**
     * Builds the module defined by {@code dist}: derives its descriptor,
     * compiles {@code module-info.java}, writes the module jar and saves
     * the descriptor for later sessions.
     *
     * @return the descriptor, empty if {@code dist} does not define a module
     * @throws ToolFailureException if the compiler fails
     * @throws IOException if an I/O error occurs
     */
    public Optional<JavaModuleDescriptor> makeJavaModule(JarDistribution dist) throws IOException {
        return session.makeJavaModule(dist);
    }

    /**
     * Gets the descriptor of the module defined by {@code dist}, building
     * the module if it has not been built yet.
     */
    public Optional<JavaModuleDescriptor> getOrMakeJavaModule(JarDistribution dist) throws IOException {
        return session.getOrMakeJavaModule(dist);
    }

    public void invalidate(JarDistribution dist) {
        session.invalidate(dist);
    }

    public void clear() {
        session.clear();
    }

    /**
     * The name, staging directory and jar of the module defined by a
     * distribution.
     */
    public static final class ModuleLayout {
        private final JavaModuleInfo info;

        ModuleLayout(JavaModuleInfo info) {
            this.info = info;
        }

        public String name() {
            return info.name();
        }

        public Path moduleDir() {
            return info.moduleDir();
        }

        public Path moduleJar() {
            return info.moduleJar();
        }

        @Override
        public String toString() {
            return info.toString();
        }
    }

    /**
     * A builder of {@code JavaModules} sessions.
     */
    public static final class Builder {
        private final Platform platform;
        private final BuildGraph graph;
        private PrintWriter log;
        private ModuleGenConfig config;
        private ExternalTool compiler;

        public Builder(Platform platform, BuildGraph graph) {
            this.platform = Objects.requireNonNull(platform);
            this.graph = Objects.requireNonNull(graph);
        }

        /**
         * Sets the log of the session. Defaults to {@code System.out}.
         */
        public Builder log(PrintWriter log) {
            this.log = Objects.requireNonNull(log);
            return this;
        }

        /**
         * Sets the settings of the session. Defaults to
         * {@link ModuleGenConfig#load()}.
         */
        public Builder config(ModuleGenConfig config) {
            this.config = Objects.requireNonNull(config);
            return this;
        }

        /**
         * Sets the tool running the compiler. Defaults to running it in a
         * new process.
         */
        public Builder compiler(ExternalTool compiler) {
            this.compiler = Objects.requireNonNull(compiler);
            return this;
        }

        public JavaModules build() {
            ModuleGenConfig cfg = config != null ? config : ModuleGenConfig.load();
            PrintWriter out = log != null ? log : new PrintWriter(System.out, true);
            ExternalTool tool = compiler != null ? compiler : new ProcessTool();
            ModuleGenLog mlog = new ModuleGenLog(out, cfg.verbose());
            return new JavaModules(new ModuleBuildSession(platform, graph, cfg, mlog, tool));
        }
    }
}
