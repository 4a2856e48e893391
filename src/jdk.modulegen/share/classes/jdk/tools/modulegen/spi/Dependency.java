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

import java.util.List;

/**
 * A node in the dependency graph of the host build tool.
 *
 * The graph itself is owned by the build tool; this interface only exposes
 * what is needed to walk it and to classify its nodes.
 */
public interface Dependency {

    /**
     * The kinds of dependency known to the module builder.
     */
    public enum Kind {
        JAR_DISTRIBUTION,
        JAVA_PROJECT,
        JDK_LIBRARY,
        JRE_LIBRARY,
        LIBRARY,
        NATIVE_PROJECT,
        OTHER
    }

    /**
     * Returns the unique name of this dependency in its build graph.
     */
    String name();

    Kind kind();

    /**
     * Returns the direct dependencies of this dependency, in declaration
     * order.
     *
     * @return a possibly-empty list
     */
    List<? extends Dependency> dependencies();

    default boolean isJarDistribution() {
        return kind() == Kind.JAR_DISTRIBUTION;
    }

    default boolean isJavaProject() {
        return kind() == Kind.JAVA_PROJECT;
    }

    default boolean isJdkLibrary() {
        return kind() == Kind.JDK_LIBRARY;
    }

    default boolean isJreLibrary() {
        return kind() == Kind.JRE_LIBRARY;
    }
}
