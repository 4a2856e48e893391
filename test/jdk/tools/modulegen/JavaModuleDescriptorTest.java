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
 * @summary Basic test for JavaModuleDescriptor and its builder
 * @run testng jdk.tools.modulegen.JavaModuleDescriptorTest
 */

package jdk.tools.modulegen;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;
import static org.testng.Assert.*;

@Test
public class JavaModuleDescriptorTest {

    @DataProvider(name = "invalidnames")
    public Object[][] invalidNames() {
        return new Object[][]{
            { null },
            { ""   },
        };
    }

    @Test(dataProvider = "invalidnames",
          expectedExceptions = IllegalArgumentException.class)
    public void testInvalidName(String mn) {
        new JavaModuleDescriptor.Builder(mn).build();
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testExportOfUndefinedPackage() {
        new JavaModuleDescriptor.Builder("m")
            .exports("p")
            .packages(Arrays.asList("q"))
            .build();
    }

    public void testConceals() {
        JavaModuleDescriptor jmd = new JavaModuleDescriptor.Builder("m")
            .exports("p")
            .exports("q", Arrays.asList("other"))
            .packages(Arrays.asList("p", "q", "r", "s"))
            .build();
        assertEquals(jmd.packages(), Set.of("p", "q", "r", "s"));
        assertEquals(jmd.conceals(), Set.of("r", "s"));
        assertTrue(jmd.exports().get("p").isEmpty());
        assertEquals(jmd.exports().get("q"), Set.of("other"));
    }

    public void testPackagesDefaultToExports() {
        JavaModuleDescriptor jmd = new JavaModuleDescriptor.Builder("m")
            .exports("p")
            .exports("q")
            .build();
        assertEquals(jmd.packages(), Set.of("p", "q"));
        assertTrue(jmd.conceals().isEmpty());
    }

    public void testEmptyModule() {
        JavaModuleDescriptor jmd = new JavaModuleDescriptor.Builder("m").build();
        assertTrue(jmd.packages().isEmpty());
        assertTrue(jmd.requires().isEmpty());
        assertFalse(jmd.jarPath().isPresent());
        assertFalse(jmd.distribution().isPresent());
        assertFalse(jmd.isPlatformModule());
        assertEquals(jmd.asModuleInfo(), "module m {\n}\n");
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testExportsUnmodifiable() {
        JavaModuleDescriptor jmd = new JavaModuleDescriptor.Builder("m").exports("p").build();
        jmd.exports().put("q", Collections.emptySet());
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testTargetsUnmodifiable() {
        JavaModuleDescriptor jmd = new JavaModuleDescriptor.Builder("m").exports("p").build();
        jmd.exports().get("p").add("other");
    }

    public void testProvidersKeepOrder() {
        JavaModuleDescriptor jmd = new JavaModuleDescriptor.Builder("m")
            .provides("p.S", Arrays.asList("p.Z", "p.A"))
            .provides("p.S", Arrays.asList("p.M", "p.A"))
            .build();
        assertEquals(jmd.provides().get("p.S").toArray(), new String[] { "p.Z", "p.A", "p.M" });
    }

    private static JavaModuleDescriptor lib() {
        return new JavaModuleDescriptor.Builder("lib")
            .exports("com.lib")
            .packages(Arrays.asList("com.lib", "com.lib.internal"))
            .build();
    }

    private static JavaModuleDescriptor base() {
        return new JavaModuleDescriptor.Builder("java.base")
            .exports("java.lang")
            .platformModule(true)
            .build();
    }

    public void testAsModuleInfo() {
        JavaModuleDescriptor jmd = new JavaModuleDescriptor.Builder("app")
            .requires("lib")
            .requires("java.base", "transitive", "static")
            .exports("com.app.spi", Arrays.asList("other", "lib"))
            .exports("com.app")
            .uses("com.app.spi.Service")
            .provides("com.app.spi.Service", Arrays.asList("com.app.Impl2", "com.app.Impl1"))
            .packages(Arrays.asList("com.app", "com.app.spi", "com.app.internal"))
            .concealedRequires("lib", Arrays.asList("com.lib.internal"))
            .modulePath(Arrays.asList(lib(), base()))
            .build();

        String expected =
            "module app {\n" +
            "    requires static transitive java.base;\n" +
            "    requires lib;\n" +
            "    exports com.app;\n" +
            "    exports com.app.spi to lib, other;\n" +
            "    uses com.app.spi.Service;\n" +
            "    provides com.app.spi.Service with com.app.Impl2, com.app.Impl1;\n" +
            "    // conceals: com.app.internal\n" +
            "    // modulepath: java.base, lib\n" +
            "    // concealed-requires: lib/com.lib.internal\n" +
            "}\n";
        assertEquals(jmd.asModuleInfo(), expected);
    }

    public void testRenderingIsDeterministic() {
        JavaModuleDescriptor jmd1 = new JavaModuleDescriptor.Builder("app")
            .requires("a").requires("b").requires("c", "static")
            .exports("p1").exports("p2").exports("p3", Arrays.asList("x", "y"))
            .uses("s1").uses("s2")
            .modulePath(Arrays.asList(lib(), base()))
            .build();
        JavaModuleDescriptor jmd2 = new JavaModuleDescriptor.Builder("app")
            .exports("p3", Arrays.asList("y", "x")).exports("p2").exports("p1")
            .requires("c", "static").requires("b").requires("a")
            .uses("s2").uses("s1")
            .modulePath(Arrays.asList(base(), lib()))
            .build();
        assertEquals(jmd1.asModuleInfo(), jmd2.asModuleInfo());
    }

    public void testCompareTo() {
        Set<JavaModuleDescriptor> set = new TreeSet<>(Arrays.asList(lib(), base()));
        assertEquals(set.iterator().next().name(), "java.base");
        assertEquals(lib().toString(), "module:lib");
    }

    public void testCompareToInconsistentWithEquals() {
        JavaModuleDescriptor lib1 = lib();
        JavaModuleDescriptor lib2 = lib();
        assertEquals(lib1.compareTo(lib2), 0);
        assertNotEquals(lib1, lib2);
        assertEquals(lib1, lib1);
    }

    public void testServiceWithoutProvidersNotRendered() {
        JavaModuleDescriptor jmd = new JavaModuleDescriptor.Builder("m")
            .provides("p.S", Collections.emptyList())
            .provides("p.T", Arrays.asList("p.TImpl"))
            .build();
        String mi = jmd.asModuleInfo();
        assertFalse(mi.contains("p.S"), mi);
        assertFalse(mi.contains("with ;"), mi);
        assertTrue(mi.contains("    provides p.T with p.TImpl;\n"), mi);
    }
}
