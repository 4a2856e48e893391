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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import jdk.tools.modulegen.JavaModuleDescriptor;
import jdk.tools.modulegen.ModuleConfigurationException;
import jdk.tools.modulegen.ModulePaths;
import jdk.tools.modulegen.ModulePaths.PackageLookup;
import jdk.tools.modulegen.Visibility;
import jdk.tools.modulegen.spi.Dependency;
import jdk.tools.modulegen.spi.JarDistribution;
import jdk.tools.modulegen.spi.JavaProject;
import jdk.tools.modulegen.spi.Library;
import jdk.tools.modulegen.spi.Platform;
import jdk.tools.modulegen.spi.Suite.ModuleDepsMode;

/**
 * Derives the module descriptor of a distribution from the packages its
 * Java projects define, import and export, from the service providers
 * registered in its jars and from the modules it can be resolved against.
 */
final class ModuleDescriptorSynthesizer {

    private final Platform platform;
    private final ModuleDependencyCollector collector;
    private final ModuleGenConfig config;
    private final ModuleGenLog log;
    private final ModuleSupplier modules;

    ModuleDescriptorSynthesizer(Platform platform,
                                ModuleDependencyCollector collector,
                                ModuleGenConfig config,
                                ModuleGenLog log,
                                ModuleSupplier modules) {
        this.platform = platform;
        this.collector = collector;
        this.config = config;
        this.log = log;
        this.modules = modules;
    }

    /**
     * Derives the module descriptor of {@code dist}.
     *
     * @return empty if {@code dist} does not define a module
     */
    Optional<JavaModuleDescriptor> synthesize(JarDistribution dist) throws IOException {
        Optional<JavaModuleInfo> info = JavaModuleInfo.of(dist, collector, config, false);
        if (!info.isPresent()) {
            return Optional.empty();
        }
        return Optional.of(synthesize(dist, info.get()));
    }

    JavaModuleDescriptor synthesize(JarDistribution dist, JavaModuleInfo info) throws IOException {
        String moduleName = info.name();
        log.info("main.building.module", moduleName, dist.name());

        Map<String, Set<String>> exports = new HashMap<>();
        Map<String, Set<String>> requires = new HashMap<>();
        Map<String, Set<String>> concealedRequires = new HashMap<>();
        Set<String> uses = new HashSet<>();
        Map<String, Set<String>> provides = new HashMap<>();

        List<Dependency> moduleDeps = collector.collectModuleDeps(dist);
        List<JavaModuleDescriptor> modulePath = new ArrayList<>();
        if (dist.suite().moduleDepsMode() == ModuleDepsMode.DISTRIBUTION_DEPS) {
            for (Dependency dep : collector.collectModulePathDeps(dist)) {
                if (dep.isJarDistribution()) {
                    JavaModuleDescriptor jmd = modules.getOrMake((JarDistribution) dep)
                        .orElseThrow(() -> new ModuleConfigurationException(
                                "err.dependency.not.module", dist.name(), dep.name()));
                    modulePath.add(jmd);
                    requires.put(jmd.name(),
                                 new HashSet<>(Collections.singleton(platform.transitiveRequiresKeyword())));
                } else if ((dep.isJdkLibrary() || dep.isJreLibrary())
                               && dep instanceof Library
                               && ((Library) dep).isProvidedBy(platform)) {
                    // provided by a platform module
                } else {
                    throw new ModuleConfigurationException("err.dependency.not.module",
                                                           dist.name(), dep.name());
                }
            }
        } else {
            Set<Dependency> folded = Collections.newSetFromMap(new IdentityHashMap<>());
            folded.addAll(moduleDeps);
            for (Dependency dep : collector.collectModulePathDeps(dist)) {
                if (dep.isJarDistribution() && !folded.contains(dep)) {
                    JarDistribution d = (JarDistribution) dep;
                    if (JavaModuleInfo.of(d, collector, config, false).isPresent()) {
                        modules.getOrMake(d).ifPresent(modulePath::add);
                    }
                }
            }
        }

        // append the platform modules
        modulePath.addAll(platform.modules());

        List<JavaProject> javaProjects = moduleDeps.stream()
            .filter(Dependency::isJavaProject)
            .map(JavaProject.class::cast)
            .collect(Collectors.toList());

        // collect the packages in the module first
        Set<String> packages = new HashSet<>();
        javaProjects.forEach(p -> packages.addAll(p.definedPackages()));

        Set<String> usedModules = new TreeSet<>();
        for (JavaProject project : javaProjects) {
            uses.addAll(project.uses());
            for (String mn : project.runtimeDeps()) {
                requires.computeIfAbsent(mn, k -> new HashSet<>(Collections.singleton("static")));
            }

            List<String> imported = Stream.concat(project.importedPackages().stream(),
                                                  project.imports().stream())
                                          .collect(Collectors.toList());
            for (String pn : imported) {
                // A module may upgrade a platform module and thus define
                // packages that it also imports.
                if (packages.contains(pn)) {
                    continue;
                }
                Optional<PackageLookup> lookup = ModulePaths.lookupPackage(modulePath, pn, moduleName);
                if (!lookup.isPresent()) {
                    continue;
                }
                JavaModuleDescriptor depModule = lookup.get().module();
                if (depModule.name().equals(moduleName)) {
                    continue;
                }
                requires.computeIfAbsent(depModule.name(), k -> new HashSet<>());
                if (lookup.get().visibility() == Visibility.CONCEALED) {
                    concealedRequires.computeIfAbsent(depModule.name(), k -> new HashSet<>())
                                     .add(pn);
                }
                usedModules.add(depModule.name());
            }

            // all packages are exported if a project declares no exports
            List<String> declared = project.exports()
                .orElseGet(() -> new ArrayList<>(project.definedPackages()));
            for (String pn : expandPackageInfo(project, declared)) {
                exports.putIfAbsent(pn, new HashSet<>());
            }
        }
        log.trace("%s uses modules: %s%n", moduleName, usedModules);

        List<JarDistribution> jars = new ArrayList<>();
        jars.add(dist);
        moduleDeps.stream()
                  .filter(Dependency::isJarDistribution)
                  .map(JarDistribution.class::cast)
                  .forEach(jars::add);
        for (JarDistribution d : jars) {
            ServiceProviders.scan(d.path(), provides, uses);
        }

        return new JavaModuleDescriptor.Builder(moduleName)
            .exports(exports)
            .requires(requires)
            .uses(uses)
            .provides(provides)
            .packages(packages)
            .concealedRequires(concealedRequires)
            .jarPath(info.moduleJar())
            .distribution(dist)
            .modulePath(modulePath)
            .build();
    }

    /**
     * Converts a list of package names to a unique set of package names,
     * expanding any {@code <package-info>} entry in the list to the set of
     * packages in the project that contain a {@code package-info.java} file.
     */
    static Set<String> expandPackageInfo(JavaProject project, Collection<String> pkgs) {
        Set<String> result = new HashSet<>();
        if (pkgs.contains(JavaProject.PACKAGE_INFO)) {
            pkgs.stream()
                .filter(pn -> !pn.equals(JavaProject.PACKAGE_INFO))
                .forEach(result::add);
            result.addAll(project.packageInfoPackages());
        } else {
            result.addAll(pkgs);
        }
        return result;
    }
}
