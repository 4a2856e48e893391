/*
 * Copyright (c) 2016, Oracle and/or its affiliates. All rights reserved.
 * DO NOT ALTER OR REMOVE COPYRIGHT NOTICES OR THIS FILE HEADER.
 *
 * This code is free software; you can redistribute it and/or modify it
 * under the terms of the GNU General Public License version 2 only, as
 * published by the Free Software Foundation.
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

package jdk.tools.modulegen.testlib;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import jdk.tools.modulegen.spi.Dependency;
import jdk.tools.modulegen.spi.JarDistribution;
import jdk.tools.modulegen.spi.Suite;

/**
 * A jar distribution whose attributes are set by the test.
 */
public class TestDistribution implements JarDistribution {
    private final String name;
    private final Suite suite;
    private final Path path;
    private String moduleName;
    private final List<Dependency> deps = new ArrayList<>();
    private final List<Dependency> moduleDeps = new ArrayList<>();
    private final List<Dependency> archivedDeps = new ArrayList<>();
    private final List<Dependency> modulePathDeps = new ArrayList<>();

    public TestDistribution(String name, Suite suite, Path path) {
        this.name = name;
        this.suite = suite;
        this.path = path;
    }

    public TestDistribution withModuleName(String mn) {
        moduleName = mn;
        return this;
    }

    /**
     * Adds to the dependencies of this distribution. The dependencies are
     * also archived in its jar.
     */
    public TestDistribution dependsOn(Dependency... d) {
        deps.addAll(Arrays.asList(d));
        archivedDeps.addAll(Arrays.asList(d));
        return this;
    }

    public TestDistribution withModuleDeps(Dependency... d) {
        moduleDeps.addAll(Arrays.asList(d));
        return this;
    }

    public TestDistribution withModulePathDeps(Dependency... d) {
        modulePathDeps.addAll(Arrays.asList(d));
        return this;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<? extends Dependency> dependencies() {
        return Collections.unmodifiableList(deps);
    }

    @Override
    public Suite suite() {
        return suite;
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public Optional<String> moduleName() {
        return Optional.ofNullable(moduleName);
    }

    @Override
    public List<? extends Dependency> moduleDeps() {
        return Collections.unmodifiableList(moduleDeps);
    }

    @Override
    public List<? extends Dependency> archivedDeps() {
        return Collections.unmodifiableList(archivedDeps);
    }

    @Override
    public List<? extends Dependency> modulePathDeps() {
        return Collections.unmodifiableList(modulePathDeps);
    }

    @Override
    public String toString() {
        return "dist:" + name;
    }
}
