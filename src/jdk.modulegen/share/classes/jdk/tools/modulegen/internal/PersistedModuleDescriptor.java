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

import java.io.Serializable;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

import jdk.tools.modulegen.JavaModuleDescriptor;
import jdk.tools.modulegen.spi.JarDistribution;

/**
 * The persisted form of a module descriptor derived from a distribution.
 *
 * References to other modules are replaced by their names: the bare name for
 * a platform module and {@code dist:<distribution>} for a module derived
 * from a distribution.
 */
final class PersistedModuleDescriptor implements Serializable {
    private static final long serialVersionUID = -1520478839465416113L;

    static final String DIST_PREFIX = "dist:";

    private final String name;
    private final TreeMap<String, TreeSet<String>> exports;
    private final TreeMap<String, TreeSet<String>> requires;
    private final TreeMap<String, TreeSet<String>> concealedRequires;
    private final TreeSet<String> uses;
    private final TreeMap<String, ArrayList<String>> provides;
    private final TreeSet<String> packages;
    private final String jarPath;
    private final String dist;
    private final ArrayList<String> modulePath;

    private PersistedModuleDescriptor(JavaModuleDescriptor jmd) {
        this.name = jmd.name();
        this.exports = sorted(jmd.exports());
        this.requires = sorted(jmd.requires());
        this.concealedRequires = sorted(jmd.concealedRequires());
        this.uses = new TreeSet<>(jmd.uses());
        this.provides = new TreeMap<>();
        jmd.provides().forEach((s, p) -> provides.put(s, new ArrayList<>(p)));
        this.packages = new TreeSet<>(jmd.packages());
        this.jarPath = jmd.jarPath().map(Path::toString).orElse(null);
        this.dist = jmd.distribution().map(JarDistribution::name).orElse(null);
        this.modulePath = new ArrayList<>();
        for (JavaModuleDescriptor m : jmd.modulePath()) {
            modulePath.add(m.distribution().isPresent()
                           ? DIST_PREFIX + m.distribution().get().name()
                           : m.name());
        }
    }

    private static TreeMap<String, TreeSet<String>> sorted(Map<String, ? extends Collection<String>> map) {
        TreeMap<String, TreeSet<String>> result = new TreeMap<>();
        map.forEach((k, v) -> result.put(k, new TreeSet<>(v)));
        return result;
    }

    static PersistedModuleDescriptor of(JavaModuleDescriptor jmd) {
        return new PersistedModuleDescriptor(jmd);
    }

    String distributionName() {
        return dist;
    }

    /**
     * Creates the live descriptor of this persisted descriptor.
     *
     * @param distribution the distribution the module is derived from
     * @param resolver     maps each module path reference to a descriptor
     */
    JavaModuleDescriptor resolve(JarDistribution distribution,
                                 Function<String, JavaModuleDescriptor> resolver) {
        List<JavaModuleDescriptor> resolved = new ArrayList<>();
        for (String ref : modulePath) {
            resolved.add(resolver.apply(ref));
        }
        Path jar = jarPath == null ? null : Paths.get(jarPath);
        return new JavaModuleDescriptor.Builder(name)
            .exports(exports)
            .requires(requires)
            .concealedRequires(concealedRequires)
            .uses(uses)
            .provides(provides)
            .packages(packages)
            .jarPath(jar)
            .distribution(distribution)
            .modulePath(resolved)
            .build();
    }
}
