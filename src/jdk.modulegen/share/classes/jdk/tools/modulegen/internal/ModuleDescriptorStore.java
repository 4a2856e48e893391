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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import jdk.tools.modulegen.DescriptorNotFoundException;
import jdk.tools.modulegen.JavaModuleDescriptor;
import jdk.tools.modulegen.ModuleConfigurationException;
import jdk.tools.modulegen.ModuleGenException;
import jdk.tools.modulegen.spi.BuildGraph;
import jdk.tools.modulegen.spi.JarDistribution;
import jdk.tools.modulegen.spi.Platform;

/**
 * Saves the descriptors of modules derived from distributions next to their
 * staging directories and loads them in later builds.
 */
final class ModuleDescriptorStore {

    private final Platform platform;
    private final BuildGraph graph;
    private final ModuleDependencyCollector collector;
    private final ModuleGenConfig config;
    private final ModuleGenLog log;
    private final ModuleSupplier modules;

    ModuleDescriptorStore(Platform platform,
                          BuildGraph graph,
                          ModuleDependencyCollector collector,
                          ModuleGenConfig config,
                          ModuleGenLog log,
                          ModuleSupplier modules) {
        this.platform = platform;
        this.graph = graph;
        this.collector = collector;
        this.config = config;
        this.log = log;
        this.modules = modules;
    }

    /**
     * Returns the path of the persisted descriptor of the module with the
     * given layout.
     */
    Path descriptorPath(JavaModuleInfo info) {
        Path moduleDir = info.moduleDir();
        return moduleDir.resolveSibling(moduleDir.getFileName() + config.descriptorSuffix());
    }

    /**
     * Saves {@code jmd} if it is derived from a distribution. Otherwise,
     * does nothing.
     *
     * @return the path to which {@code jmd} was saved, empty for a platform
     *         module
     */
    Optional<Path> save(JavaModuleDescriptor jmd) throws IOException {
        if (jmd.isPlatformModule() || !jmd.distribution().isPresent()) {
            return Optional.empty();
        }
        JarDistribution dist = jmd.distribution().get();
        JavaModuleInfo info = JavaModuleInfo.of(dist, collector, config, true).get();
        Path path = descriptorPath(info);
        Files.createDirectories(path.getParent());
        Path tmp = Files.createTempFile(path.getParent(), path.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp);
                 ObjectOutputStream oos = new ObjectOutputStream(new BufferedOutputStream(out))) {
                oos.writeObject(PersistedModuleDescriptor.of(jmd));
            }
            FileUtils.moveAtomically(tmp, path);
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.trace("saved %s to %s%n", jmd, path);
        return Optional.of(path);
    }

    /**
     * Loads the descriptor of the module derived from {@code dist}.
     *
     * @param fatalIfMissing specifies whether to fail if the descriptor has
     *        not been saved yet
     * @return empty if the descriptor has not been saved and
     *         {@code fatalIfMissing} is false
     * @throws DescriptorNotFoundException if the descriptor has not been
     *         saved and {@code fatalIfMissing} is true
     */
    Optional<JavaModuleDescriptor> load(JarDistribution dist, boolean fatalIfMissing)
        throws IOException
    {
        JavaModuleInfo info = JavaModuleInfo.of(dist, collector, config, true).get();
        Path path = descriptorPath(info);
        if (Files.notExists(path)) {
            if (fatalIfMissing) {
                throw new DescriptorNotFoundException(path);
            }
            return Optional.empty();
        }
        PersistedModuleDescriptor pmd;
        try (InputStream in = Files.newInputStream(path);
             ObjectInputStream ois = new ObjectInputStream(new BufferedInputStream(in))) {
            pmd = (PersistedModuleDescriptor) ois.readObject();
        } catch (ClassNotFoundException | ClassCastException e) {
            throw new ModuleGenException(e, "err.descriptor.corrupt", path, e.getMessage());
        }
        if (!dist.name().equals(pmd.distributionName())) {
            throw new ModuleConfigurationException("err.descriptor.other.dist",
                                                   path, pmd.distributionName());
        }
        try {
            JavaModuleDescriptor jmd = pmd.resolve(dist, ref -> resolve(ref, path));
            log.trace("loaded %s from %s%n", jmd, path);
            if (jmd.jarPath().isPresent() && Files.notExists(jmd.jarPath().get())) {
                log.warning("warn.module.jar.missing", jmd.name(), jmd.jarPath().get());
            }
            return Optional.of(jmd);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private JavaModuleDescriptor resolve(String ref, Path path) {
        if (ref.startsWith(PersistedModuleDescriptor.DIST_PREFIX)) {
            String distName = ref.substring(PersistedModuleDescriptor.DIST_PREFIX.length());
            JarDistribution d = graph.distribution(distName)
                .orElseThrow(() -> new ModuleConfigurationException(
                        "err.unknown.distribution", distName, path));
            try {
                return modules.getOrMake(d)
                    .orElseThrow(() -> new ModuleConfigurationException(
                            "err.not.a.module", distName));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return platform.findModule(ref)
            .orElseThrow(() -> new ModuleConfigurationException(
                    "err.unknown.platform.module", ref, path));
    }
}
