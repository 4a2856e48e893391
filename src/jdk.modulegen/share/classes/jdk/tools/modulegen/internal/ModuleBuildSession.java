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
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jdk.tools.modulegen.DescriptorNotFoundException;
import jdk.tools.modulegen.JavaModuleDescriptor;
import jdk.tools.modulegen.ModuleConfigurationException;
import jdk.tools.modulegen.spi.BuildGraph;
import jdk.tools.modulegen.spi.Dependency;
import jdk.tools.modulegen.spi.ExternalTool;
import jdk.tools.modulegen.spi.JarDistribution;
import jdk.tools.modulegen.spi.Platform;

/**
 * Implementation of {@link jdk.tools.modulegen.JavaModules}.
 *
 * Descriptors are cached per distribution instance. A session is not
 * thread-safe.
 */
public final class ModuleBuildSession {

    private final ModuleGenConfig config;
    private final ModuleDependencyCollector collector;
    private final ModuleDescriptorSynthesizer synthesizer;
    private final ModuleDescriptorStore store;
    private final ModuleAssembler assembler;

    private final Map<JarDistribution, JavaModuleDescriptor> modules = new IdentityHashMap<>();
    private final Set<JarDistribution> inProgress =
        Collections.newSetFromMap(new IdentityHashMap<>());

    public ModuleBuildSession(Platform platform,
                              BuildGraph graph,
                              ModuleGenConfig config,
                              ModuleGenLog log,
                              ExternalTool compiler) {
        this.config = config;
        this.collector = new ModuleDependencyCollector();
        ModuleSupplier supplier = this::getOrMakeJavaModule;
        this.synthesizer = new ModuleDescriptorSynthesizer(platform, collector, config, log, supplier);
        this.store = new ModuleDescriptorStore(platform, graph, collector, config, log, supplier);
        this.assembler = new ModuleAssembler(platform, config, log, compiler, store);
    }

    public Optional<JavaModuleInfo> javaModuleInfo(JarDistribution dist, boolean fatalIfNotModule) {
        return JavaModuleInfo.of(dist, collector, config, fatalIfNotModule);
    }

    public List<Dependency> moduleDeps(JarDistribution dist) {
        return collector.collectModuleDeps(dist);
    }

    /**
     * Returns the descriptor of the module built from {@code dist}, loading
     * it from disk if this session has not seen it yet.
     *
     * @throws ModuleConfigurationException if {@code dist} does not define a
     *         module
     * @throws DescriptorNotFoundException if the module has not been built
     *         and {@code fatalIfNotCreated} is true
     */
    public Optional<JavaModuleDescriptor> asJavaModule(JarDistribution dist, boolean fatalIfNotCreated)
        throws IOException
    {
        JavaModuleDescriptor jmd = modules.get(dist);
        if (jmd != null) {
            return Optional.of(jmd);
        }
        enter(dist);
        try {
            Optional<JavaModuleDescriptor> loaded = store.load(dist, fatalIfNotCreated);
            loaded.ifPresent(m -> modules.put(dist, m));
            return loaded;
        } finally {
            inProgress.remove(dist);
        }
    }

    /**
     * Synthesizes the descriptor of the module defined by {@code dist},
     * builds the module jar and saves the descriptor.
     *
     * @return empty if {@code dist} does not define a module
     */
    public Optional<JavaModuleDescriptor> makeJavaModule(JarDistribution dist) throws IOException {
        Optional<JavaModuleInfo> info = javaModuleInfo(dist, false);
        if (!info.isPresent()) {
            return Optional.empty();
        }
        enter(dist);
        try {
            JavaModuleDescriptor jmd = synthesizer.synthesize(dist, info.get());
            assembler.assemble(jmd, info.get(), collector.collectModuleDeps(dist));
            modules.put(dist, jmd);
            return Optional.of(jmd);
        } finally {
            inProgress.remove(dist);
        }
    }

    /**
     * Returns the descriptor of the module defined by {@code dist}: the one
     * cached by this session, else the saved one, else a newly built one.
     *
     * @return empty if {@code dist} does not define a module
     */
    public Optional<JavaModuleDescriptor> getOrMakeJavaModule(JarDistribution dist) throws IOException {
        JavaModuleDescriptor jmd = modules.get(dist);
        if (jmd != null) {
            return Optional.of(jmd);
        }
        if (!javaModuleInfo(dist, false).isPresent()) {
            return Optional.empty();
        }
        Optional<JavaModuleDescriptor> loaded = asJavaModule(dist, false);
        if (loaded.isPresent()) {
            return loaded;
        }
        return makeJavaModule(dist);
    }

    private void enter(JarDistribution dist) {
        if (!inProgress.add(dist)) {
            throw new ModuleConfigurationException("err.module.cycle", dist.name());
        }
    }

    /**
     * Drops everything this session computed for {@code dist}.
     */
    public void invalidate(JarDistribution dist) {
        modules.remove(dist);
        collector.invalidate(dist);
    }

    public void clear() {
        modules.clear();
        collector.clear();
    }
}
