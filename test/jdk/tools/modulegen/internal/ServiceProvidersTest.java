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
 * @summary Test the parsing of service provider configuration files
 * @run testng jdk.tools.modulegen.internal.ServiceProvidersTest
 */

package jdk.tools.modulegen.internal;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jdk.tools.modulegen.JavaModuleDescriptor;
import jdk.tools.modulegen.ModuleConfigurationException;
import jdk.tools.modulegen.testlib.JarUtils;
import jdk.tools.modulegen.testlib.ScratchDirs;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;
import static org.testng.Assert.*;

@Test
public class ServiceProvidersTest {

    private static InputStream in(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    public void testParse() throws IOException {
        String config = "# providers\n"
                      + "  com.a.Impl   # the default\n"
                      + "\n"
                      + "com.b.Impl\n"
                      + "com.a.Impl\n"
                      + "com.c.Outer$Inner";
        assertEquals(ServiceProviders.parse("cfg", in(config)),
                     List.of("com.a.Impl", "com.b.Impl", "com.c.Outer$Inner"));
    }

    public void testParseEmpty() throws IOException {
        assertTrue(ServiceProviders.parse("cfg", in("")).isEmpty());
        assertTrue(ServiceProviders.parse("cfg", in("# nothing\n\n")).isEmpty());
    }

    @DataProvider(name = "badconfigs")
    public Object[][] badConfigs() {
        return new Object[][]{
            { "com.a Impl",     "err.bad.service.config" },
            { "com.a\tImpl",    "err.bad.service.config" },
            { "1com.Impl",      "err.bad.provider.name"  },
            { "com.a-b.Impl",   "err.bad.provider.name"  },
        };
    }

    @Test(dataProvider = "badconfigs")
    public void testBadConfig(String line, String key) throws IOException {
        try {
            ServiceProviders.parse("cfg", in("com.ok.Impl\n" + line + "\n"));
            fail("ModuleConfigurationException expected");
        } catch (ModuleConfigurationException e) {
            assertEquals(e.key(), key);
            assertTrue(e.getMessage().startsWith("cfg:2:"), e.getMessage());
        }
    }

    public void testScan() throws IOException {
        Path dir = ScratchDirs.create("services");
        try {
            Map<String, String> entries = new LinkedHashMap<>();
            entries.put("p/S.class", "");
            entries.put("p/impl/SImpl.class", "");
            entries.put("META-INF/services/", "");
            entries.put("META-INF/services/p.S", "p.impl.SImpl\np.impl.Other\n");
            entries.put("META-INF/services/q.T", "p.impl.TImpl\n");
            entries.put("META-INF/services/nested/r.U", "p.impl.UImpl\n");
            Path jar = JarUtils.createJarFile(dir.resolve("s.jar"), entries);

            Map<String, Set<String>> provides = new HashMap<>();
            provides.computeIfAbsent("p.S", k -> new LinkedHashSet<>()).add("p.Earlier");
            Set<String> uses = new HashSet<>();
            ServiceProviders.scan(jar, provides, uses);

            assertEquals(provides.keySet(), Set.of("p.S", "q.T"));
            assertEquals(List.copyOf(provides.get("p.S")), List.of("p.Earlier", "p.impl.SImpl", "p.impl.Other"));
            assertEquals(provides.get("q.T"), Set.of("p.impl.TImpl"));
            // q.T is not defined in the jar
            assertEquals(uses, Set.of("p.S"));
        } finally {
            ScratchDirs.delete(dir);
        }
    }

    /**
     * A configuration file without providers is legal and provides nothing.
     */
    public void testScanNoProviders() throws IOException {
        Path dir = ScratchDirs.create("services");
        try {
            Map<String, String> entries = new LinkedHashMap<>();
            entries.put("p/S.class", "");
            entries.put("META-INF/services/p.S", "# no providers\n");
            entries.put("META-INF/services/q.T", "");
            Path jar = JarUtils.createJarFile(dir.resolve("empty.jar"), entries);

            Map<String, Set<String>> provides = new HashMap<>();
            Set<String> uses = new HashSet<>();
            ServiceProviders.scan(jar, provides, uses);

            assertTrue(provides.isEmpty(), provides.toString());
            assertEquals(uses, Set.of("p.S"));

            String mi = new JavaModuleDescriptor.Builder("m")
                .provides(provides)
                .build()
                .asModuleInfo();
            assertFalse(mi.contains("provides"), mi);
        } finally {
            ScratchDirs.delete(dir);
        }
    }

    public void testLineNumberNotGrouped() throws IOException {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 1000; i++) {
            sb.append("# comment\n");
        }
        sb.append("bad name\n");
        try {
            ServiceProviders.parse("cfg", in(sb.toString()));
            fail("ModuleConfigurationException expected");
        } catch (ModuleConfigurationException e) {
            assertTrue(e.getMessage().startsWith("cfg:1001:"), e.getMessage());
        }
    }
}
