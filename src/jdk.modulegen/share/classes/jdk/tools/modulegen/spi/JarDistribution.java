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

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A distribution packaged as a jar file by the build tool. A distribution
 * may define a module whose content is the class files and resources of
 * the distribution and of its module dependencies.
 */
public interface JarDistribution extends Dependency {

    @Override
    default Kind kind() {
        return Kind.JAR_DISTRIBUTION;
    }

    /**
     * Returns the suite that owns this distribution.
     */
    Suite suite();

    /**
     * Returns the path to the jar built for this distribution.
     */
    Path path();

    /**
     * Returns the explicit name of the module defined by this distribution,
     * if the distribution declares one.
     */
    default Optional<String> moduleName() {
        return Optional.empty();
    }

    /**
     * Returns the roots of the dependencies whose content is folded into the
     * module defined by this distribution. Each root must be a jar
     * distribution.
     */
    default List<? extends Dependency> moduleDeps() {
        return Collections.emptyList();
    }

    /**
     * Returns the Java projects and distributions whose class files and
     * resources are archived in the jar of this distribution.
     */
    List<? extends Dependency> archivedDeps();

    /**
     * Returns the dependencies that this distribution references on its
     * class path, directly or transitively, excluding itself. The list is
     * in class path order.
     */
    List<? extends Dependency> modulePathDeps();
}
