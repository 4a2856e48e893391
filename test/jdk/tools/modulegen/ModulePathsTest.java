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

/**
 * @test
 * @summary Basic test of package lookups on a module path
 * @run testng jdk.tools.modulegen.ModulePathsTest
 */

package jdk.tools.modulegen;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import jdk.tools.modulegen.ModulePaths.PackageLookup;

import org.testng.annotations.Test;
import static org.testng.Assert.*;

@Test
public class ModulePathsTest {

    private static JavaModuleDescriptor m1 = new JavaModuleDescriptor.Builder("m1")
        .exports("p")
        .exports("q", Arrays.asList("friend"))
        .packages(Arrays.asList("p", "q", "internal"))
        .build();

    private static JavaModuleDescriptor m2 = new JavaModuleDescriptor.Builder("m2")
        .exports("p")
        .exports("r")
        .build();

    public void testFirstMatchWins() {
        PackageLookup l = ModulePaths.lookupPackage(Arrays.asList(m1, m2), "p", "app").get();
        assertEquals(l.module(), m1);
        assertEquals(l.visibility(), Visibility.EXPORTED);

        l = ModulePaths.lookupPackage(Arrays.asList(m2, m1), "p", "app").get();
        assertEquals(l.module(), m2);
    }

    public void testLaterModule() {
        PackageLookup l = ModulePaths.lookupPackage(Arrays.asList(m1, m2), "r", "app").get();
        assertEquals(l.module(), m2);
        assertEquals(l.visibility(), Visibility.EXPORTED);
    }

    public void testQualifiedExport() {
        List<JavaModuleDescriptor> path = Arrays.asList(m1, m2);
        assertEquals(ModulePaths.lookupPackage(path, "q", "friend").get().visibility(),
                     Visibility.EXPORTED);
        assertEquals(ModulePaths.lookupPackage(path, "q", "app").get().visibility(),
                     Visibility.CONCEALED);
        assertEquals(ModulePaths.lookupPackage(path, "q", ModulePaths.UNNAMED_MODULE)
                                .get().visibility(),
                     Visibility.CONCEALED);
    }

    public void testConcealedPackage() {
        PackageLookup l = ModulePaths.lookupPackage(Arrays.asList(m2, m1), "internal", "app").get();
        assertEquals(l.module(), m1);
        assertEquals(l.visibility(), Visibility.CONCEALED);
    }

    public void testNotFound() {
        Optional<PackageLookup> l = ModulePaths.lookupPackage(Arrays.asList(m1, m2), "nowhere", "app");
        assertFalse(l.isPresent());
        assertFalse(ModulePaths.lookupPackage(Collections.emptyList(), "p", "app").isPresent());
    }
}
