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
import java.util.List;
import java.util.Optional;

import jdk.tools.modulegen.JavaModuleDescriptor;

/**
 * The platform (a JDK with a version >= 9) the modules are built for and
 * compiled with.
 */
public interface Platform {

    /**
     * Returns the modules of the platform. Each of them is a
     * {@linkplain JavaModuleDescriptor#isPlatformModule() platform module}.
     */
    List<JavaModuleDescriptor> modules();

    default Optional<JavaModuleDescriptor> findModule(String name) {
        return modules().stream()
                        .filter(m -> m.name().equals(name))
                        .findFirst();
    }

    /**
     * Returns the modifier expressing that a dependence is re-exported to
     * the modules reading the requiring module.
     */
    default String transitiveRequiresKeyword() {
        return "transitive";
    }

    /**
     * Returns the path of the {@code javac} executable of the platform.
     */
    Path javac();
}
