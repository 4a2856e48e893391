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
package jdk.tools.modulegen.spi;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A group of compiled Java classes built by the build tool.
 *
 * The module related attributes of a project are all optional; the default
 * methods return the value used when a project does not declare them.
 */
public interface JavaProject extends Dependency {

    /**
     * Marker in an {@link #exports() exports} list that stands for every
     * package of the project containing a {@code package-info.java} file.
     */
    public static final String PACKAGE_INFO = "<package-info>";

    @Override
    default Kind kind() {
        return Kind.JAVA_PROJECT;
    }

    /**
     * Returns the packages defined by this project.
     */
    Set<String> definedPackages();

    /**
     * Returns the packages imported by the classes of this project,
     * including packages of other projects and of the platform.
     */
    Set<String> importedPackages();

    /**
     * Returns the subset of {@link #definedPackages()} that contain a
     * {@code package-info.java} file.
     */
    default Set<String> packageInfoPackages() {
        return Collections.emptySet();
    }

    /**
     * Returns the packages explicitly exported by this project, if declared.
     * The list may contain {@link #PACKAGE_INFO}. When absent, every package
     * defined by the project is exported.
     */
    default Optional<List<String>> exports() {
        return Optional.empty();
    }

    /**
     * Returns the service types used by this project.
     */
    default Set<String> uses() {
        return Collections.emptySet();
    }

    /**
     * Returns the names of modules only needed by this project at run time.
     */
    default List<String> runtimeDeps() {
        return Collections.emptyList();
    }

    /**
     * Returns packages imported by this project that are not visible in its
     * class files (e.g. accessed reflectively).
     */
    default List<String> imports() {
        return Collections.emptyList();
    }
}
