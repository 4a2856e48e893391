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

import jdk.tools.modulegen.spi.Dependency;
import jdk.tools.modulegen.spi.Library;
import jdk.tools.modulegen.spi.Platform;

public class TestLibrary implements Library {
    private final String name;
    private final Kind kind;
    private final boolean provided;

    public TestLibrary(String name, Kind kind, boolean provided) {
        this.name = name;
        this.kind = kind;
        this.provided = provided;
    }

    public TestLibrary(String name, Kind kind) {
        this(name, kind, false);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Dependency.Kind kind() {
        return kind;
    }

    @Override
    public boolean isProvidedBy(Platform platform) {
        return provided;
    }

    @Override
    public String toString() {
        return "library:" + name;
    }
}
