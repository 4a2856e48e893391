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
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import jdk.tools.modulegen.JavaModuleDescriptor;
import jdk.tools.modulegen.spi.Platform;

/**
 * A platform with a small, fixed set of modules.
 */
public class TestPlatform implements Platform {
    private final List<JavaModuleDescriptor> modules;

    public TestPlatform(JavaModuleDescriptor... modules) {
        this.modules = new ArrayList<>(Arrays.asList(modules));
    }

    /**
     * Returns a platform with a {@code java.base} module exporting
     * {@code java.lang} and {@code java.util} and exporting
     * {@code jdk.internal.misc} to {@code jdk.unsupported} only.
     */
    public static TestPlatform basic() {
        JavaModuleDescriptor base = new JavaModuleDescriptor.Builder("java.base")
            .exports("java.lang")
            .exports("java.util")
            .exports("jdk.internal.misc", Arrays.asList("jdk.unsupported"))
            .packages(Arrays.asList("java.lang", "java.util", "jdk.internal.misc", "sun.nio.ch"))
            .platformModule(true)
            .build();
        return new TestPlatform(base);
    }

    @Override
    public List<JavaModuleDescriptor> modules() {
        return modules;
    }

    @Override
    public Path javac() {
        return Paths.get("/jdk/bin/javac");
    }
}
