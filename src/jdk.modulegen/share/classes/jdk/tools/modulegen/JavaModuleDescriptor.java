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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import static java.util.Objects.*;

import jdk.tools.modulegen.spi.JarDistribution;

/**
 * Describes a Java module. This class closely mirrors
 * {@code java.lang.module.ModuleDescriptor} and adds the information the
 * module builder needs: the concealed packages other modules are reached
 * into, the module jar, the distribution the module is derived from and the
 * module path the module was resolved against.
 */
public final class JavaModuleDescriptor implements Comparable<JavaModuleDescriptor> {

    private final String name;
    private final Map<String, Set<String>> exports;
    private final Map<String, Set<String>> requires;
    private final Map<String, Set<String>> concealedRequires;
    private final Set<String> uses;
    private final Map<String, Set<String>> provides;
    private final Set<String> packages;
    private final Set<String> conceals;
    private final Path jarPath;
    private final JarDistribution distribution;
    private final List<JavaModuleDescriptor> modulePath;
    private final boolean platformModule;

    private JavaModuleDescriptor(Builder builder) {
        this.name = builder.name;
        this.exports = copyOf(builder.exports);
        this.requires = copyOf(builder.requires);
        this.concealedRequires = copyOf(builder.concealedRequires);
        this.uses = Collections.unmodifiableSet(new HashSet<>(builder.uses));
        this.provides = copyOf(builder.provides);
        Set<String> exported = exports.keySet();
        this.packages = builder.packages == null
                ? Collections.unmodifiableSet(new HashSet<>(exported))
                : Collections.unmodifiableSet(new HashSet<>(builder.packages));
        if (!exported.isEmpty() && !packages.containsAll(exported)) {
            Set<String> missing = new HashSet<>(exported);
            missing.removeAll(packages);
            throw new IllegalArgumentException("module " + name
                    + " exports packages it does not define: " + missing);
        }
        Set<String> concealed = new HashSet<>(packages);
        concealed.removeAll(exported);
        this.conceals = Collections.unmodifiableSet(concealed);
        this.jarPath = builder.jarPath;
        this.distribution = builder.distribution;
        this.modulePath = Collections.unmodifiableList(new ArrayList<>(builder.modulePath));
        this.platformModule = builder.platformModule;
    }

    // values keep their insertion order; provider order is significant
    private static Map<String, Set<String>> copyOf(Map<String, ? extends Collection<String>> map) {
        Map<String, Set<String>> copy = new HashMap<>();
        map.forEach((k, v) -> copy.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
        return Collections.unmodifiableMap(copy);
    }

    public String name() {
        return name;
    }

    /**
     * Returns a map from each package exported by this module to the modules
     * it is exported to. An empty set denotes an unqualified export.
     */
    public Map<String, Set<String>> exports() {
        return exports;
    }

    /**
     * Returns a map from each module dependency to its modifiers.
     */
    public Map<String, Set<String>> requires() {
        return requires;
    }

    /**
     * Returns a map from each module dependency to the packages it does not
     * export to this module but that this module accesses anyway.
     */
    public Map<String, Set<String>> concealedRequires() {
        return concealedRequires;
    }

    public Set<String> uses() {
        return uses;
    }

    /**
     * Returns a map from each service provided by this module to its
     * providers, in the order they were declared.
     */
    public Map<String, Set<String>> provides() {
        return provides;
    }

    public Set<String> packages() {
        return packages;
    }

    /**
     * Returns the packages defined by this module that are not exported.
     */
    public Set<String> conceals() {
        return conceals;
    }

    public Optional<Path> jarPath() {
        return Optional.ofNullable(jarPath);
    }

    /**
     * Returns the distribution this module was derived from. Empty for a
     * platform module.
     */
    public Optional<JarDistribution> distribution() {
        return Optional.ofNullable(distribution);
    }

    /**
     * Returns the modules this module was resolved against, in lookup order.
     */
    public List<JavaModuleDescriptor> modulePath() {
        return modulePath;
    }

    /**
     * Returns true if this module is supplied by the platform. Platform
     * modules are never rebuilt nor persisted.
     */
    public boolean isPlatformModule() {
        return platformModule;
    }

    /**
     * Gets this module descriptor expressed as the contents of a
     * {@code module-info.java} file. The comments following the
     * declarations are for human readers only.
     */
    public String asModuleInfo() {
        StringBuilder sb = new StringBuilder();
        sb.append("module ").append(name).append(" {\n");
        new TreeMap<>(requires).forEach((dependency, modifiers) -> {
            sb.append("    requires ");
            if (!modifiers.isEmpty()) {
                sb.append(modifiers.stream().sorted().collect(Collectors.joining(" ")))
                  .append(' ');
            }
            sb.append(dependency).append(";\n");
        });
        new TreeMap<>(exports).forEach((source, targets) -> {
            sb.append("    exports ").append(source);
            if (!targets.isEmpty()) {
                sb.append(" to ")
                  .append(targets.stream().sorted().collect(Collectors.joining(", ")));
            }
            sb.append(";\n");
        });
        uses.stream().sorted()
            .forEach(use -> sb.append("    uses ").append(use).append(";\n"));
        new TreeMap<>(provides).forEach((service, providers) -> {
            if (!providers.isEmpty()) {
                sb.append("    provides ").append(service).append(" with ")
                  .append(String.join(", ", providers)).append(";\n");
            }
        });
        conceals.stream().sorted()
            .forEach(pn -> sb.append("    // conceals: ").append(pn).append('\n'));
        if (jarPath != null) {
            sb.append("    // jarpath: ").append(jarPath).append('\n');
        }
        if (distribution != null) {
            sb.append("    // dist: ").append(distribution.name()).append('\n');
        }
        if (!modulePath.isEmpty()) {
            sb.append("    // modulepath: ")
              .append(modulePath.stream().map(JavaModuleDescriptor::name).sorted()
                                .collect(Collectors.joining(", ")))
              .append('\n');
        }
        new TreeMap<>(concealedRequires).forEach((dependency, pkgs) ->
            pkgs.stream().sorted()
                .forEach(pn -> sb.append("    // concealed-requires: ")
                                 .append(dependency).append('/').append(pn).append('\n')));
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Compares this module descriptor to another by module name.
     *
     * @apiNote This ordering is inconsistent with {@link #equals(Object)
     * equals}: descriptors are equal only if they are the same object, and
     * two distinct descriptors with the same name compare as equal.
     */
    @Override
    public int compareTo(JavaModuleDescriptor that) {
        return this.name.compareTo(that.name);
    }

    @Override
    public String toString() {
        return "module:" + name;
    }

    /**
     * A builder used for building {@link JavaModuleDescriptor} objects.
     */
    public static final class Builder {

        final String name;
        final Map<String, Set<String>> exports = new HashMap<>();
        final Map<String, Set<String>> requires = new HashMap<>();
        final Map<String, Set<String>> concealedRequires = new HashMap<>();
        final Set<String> uses = new HashSet<>();
        final Map<String, Set<String>> provides = new HashMap<>();
        Set<String> packages;
        Path jarPath;
        JarDistribution distribution;
        final List<JavaModuleDescriptor> modulePath = new ArrayList<>();
        boolean platformModule;

        /**
         * Initializes a new builder for a module of the given name.
         */
        public Builder(String name) {
            this.name = name;
        }

        /**
         * Exports the given package to the given modules, or to all modules
         * if none is given.
         */
        public Builder exports(String pn, Collection<String> targets) {
            exports.computeIfAbsent(requireNonNull(pn), k -> new LinkedHashSet<>())
                   .addAll(targets);
            return this;
        }

        public Builder exports(String pn) {
            return exports(pn, Collections.emptySet());
        }

        public Builder exports(Map<String, ? extends Collection<String>> map) {
            map.forEach(this::exports);
            return this;
        }

        public Builder requires(String mn, Collection<String> modifiers) {
            requires.computeIfAbsent(requireNonNull(mn), k -> new LinkedHashSet<>())
                    .addAll(modifiers);
            return this;
        }

        public Builder requires(String mn, String... modifiers) {
            return requires(mn, Arrays.asList(modifiers));
        }

        public Builder requires(Map<String, ? extends Collection<String>> map) {
            map.forEach(this::requires);
            return this;
        }

        public Builder concealedRequires(String mn, Collection<String> pkgs) {
            concealedRequires.computeIfAbsent(requireNonNull(mn), k -> new LinkedHashSet<>())
                             .addAll(pkgs);
            return this;
        }

        public Builder concealedRequires(Map<String, ? extends Collection<String>> map) {
            map.forEach(this::concealedRequires);
            return this;
        }

        public Builder uses(Collection<String> services) {
            uses.addAll(services);
            return this;
        }

        public Builder uses(String service) {
            uses.add(requireNonNull(service));
            return this;
        }

        /**
         * Provides service {@code s} with the given providers, appended in
         * order after the providers already added for {@code s}.
         */
        public Builder provides(String s, Collection<String> providers) {
            provides.computeIfAbsent(requireNonNull(s), k -> new LinkedHashSet<>())
                    .addAll(providers);
            return this;
        }

        public Builder provides(Map<String, ? extends Collection<String>> map) {
            map.forEach(this::provides);
            return this;
        }

        /**
         * Sets the packages of the module. If never called, the packages are
         * the exported packages.
         */
        public Builder packages(Collection<String> pkgs) {
            packages = new HashSet<>(pkgs);
            return this;
        }

        public Builder jarPath(Path path) {
            jarPath = path;
            return this;
        }

        public Builder distribution(JarDistribution dist) {
            distribution = dist;
            return this;
        }

        public Builder modulePath(List<JavaModuleDescriptor> path) {
            modulePath.clear();
            modulePath.addAll(path);
            return this;
        }

        public Builder platformModule(boolean b) {
            platformModule = b;
            return this;
        }

        /**
         * Builds a {@code JavaModuleDescriptor} from the components.
         *
         * @throws IllegalArgumentException if the name is empty or the
         *         exported packages are not all defined by the module
         */
        public JavaModuleDescriptor build() {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("module name cannot be empty");
            }
            return new JavaModuleDescriptor(this);
        }
    }
}
