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

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.Consumer;

import jdk.tools.modulegen.ModuleConfigurationException;
import jdk.tools.modulegen.spi.Dependency;
import jdk.tools.modulegen.spi.JarDistribution;
import jdk.tools.modulegen.spi.Suite.ModuleDepsMode;

/**
 * Computes the Java projects and jar distributions whose class files and
 * resources are the content of the module derived from a distribution.
 *
 * The result for each distribution is computed once per collector.
 */
public final class ModuleDependencyCollector {

    private final Map<JarDistribution, List<Dependency>> moduleDeps = new IdentityHashMap<>();

    /**
     * Gets the jar distributions and their constituent Java projects that
     * are folded into the module for {@code dist}.
     *
     * In {@link ModuleDepsMode#DISTRIBUTION_DEPS} mode these are the archived
     * dependencies of {@code dist}. Otherwise they are the transitive
     * dependencies of the {@code moduledeps} roots of {@code dist}, with JDK
     * and JRE libraries pruned.
     *
     * @return an unmodifiable list, empty if {@code dist} declares no
     *         module dependencies
     * @throws ModuleConfigurationException if a root is not a jar
     *         distribution or a reachable dependency is neither a jar
     *         distribution nor a Java project
     */
    public List<Dependency> collectModuleDeps(JarDistribution dist) {
        if (dist.suite().moduleDepsMode() == ModuleDepsMode.DISTRIBUTION_DEPS) {
            return Collections.unmodifiableList(new ArrayList<>(dist.archivedDeps()));
        }
        List<Dependency> deps = moduleDeps.get(dist);
        if (deps == null) {
            deps = Collections.unmodifiableList(walkModuleDeps(dist));
            moduleDeps.put(dist, deps);
        }
        return deps;
    }

    private static List<Dependency> walkModuleDeps(JarDistribution dist) {
        List<? extends Dependency> roots = dist.moduleDeps();
        List<Dependency> result = new ArrayList<>();
        if (roots.isEmpty()) {
            return result;
        }
        for (Dependency root : roots) {
            if (!root.isJarDistribution()) {
                throw new ModuleConfigurationException("err.moduledeps.root.not.jar",
                                                       root.name(), dist.name());
            }
        }
        Set<Dependency> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        walk(roots,
             (src, dst) -> !dst.isJreLibrary() && !dst.isJdkLibrary(),
             dep -> {
                 if (dep == dist) {
                     return;
                 }
                 if (dep.isJavaProject() || dep.isJarDistribution()) {
                     if (seen.add(dep)) {
                         result.add(dep);
                     }
                 } else {
                     throw new ModuleConfigurationException("err.moduledeps.invalid.kind",
                                                            dep.name(), dist.name());
                 }
             });
        return result;
    }

    /**
     * Walks the dependency graph from {@code roots} depth first, visiting
     * each dependency once after all of its dependencies. An edge is only
     * followed if {@code preVisit} accepts it.
     */
    static void walk(List<? extends Dependency> roots,
                     BiPredicate<Dependency, Dependency> preVisit,
                     Consumer<Dependency> visit) {
        Set<Dependency> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Dependency root : roots) {
            walk(root, visited, preVisit, visit);
        }
    }

    private static void walk(Dependency dep, Set<Dependency> visited,
                             BiPredicate<Dependency, Dependency> preVisit,
                             Consumer<Dependency> visit) {
        if (!visited.add(dep)) {
            return;
        }
        for (Dependency d : dep.dependencies()) {
            if (preVisit.test(dep, d)) {
                walk(d, visited, preVisit, visit);
            }
        }
        visit.accept(dep);
    }

    /**
     * Returns the dependencies {@code dist} references on its class path,
     * from which the module path of its module is built.
     */
    public List<Dependency> collectModulePathDeps(JarDistribution dist) {
        List<Dependency> deps = new ArrayList<>();
        for (Dependency d : dist.modulePathDeps()) {
            if (d != dist) {
                deps.add(d);
            }
        }
        return deps;
    }

    /**
     * Drops the module dependencies computed for {@code dist}.
     */
    public void invalidate(JarDistribution dist) {
        moduleDeps.remove(dist);
    }

    public void clear() {
        moduleDeps.clear();
    }
}
