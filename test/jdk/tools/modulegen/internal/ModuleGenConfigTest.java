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
 * @summary Test the settings of the module builder
 * @run testng jdk.tools.modulegen.internal.ModuleGenConfigTest
 */

package jdk.tools.modulegen.internal;

import java.nio.file.Paths;
import java.util.Properties;

import org.testng.annotations.Test;
import static org.testng.Assert.*;

@Test
public class ModuleGenConfigTest {

    public void testDefaults() {
        ModuleGenConfig config = ModuleGenConfig.load();
        assertFalse(config.verbose());
        assertEquals(config.modulesDir(), "modules");
        assertEquals(config.descriptorSuffix(), ".pickled");
        assertFalse(config.javac().isPresent());
    }

    public void testOverrides() {
        Properties props = new Properties();
        props.setProperty(ModuleGenConfig.VERBOSE, "true");
        props.setProperty(ModuleGenConfig.MODULES_DIR, " jmods ");
        props.setProperty(ModuleGenConfig.JAVAC, "/opt/jdk/bin/javac");
        props.setProperty(ModuleGenConfig.DESCRIPTOR_SUFFIX, "");
        ModuleGenConfig config = ModuleGenConfig.load(props);
        assertTrue(config.verbose());
        assertEquals(config.modulesDir(), "jmods");
        assertEquals(config.javac().get(), Paths.get("/opt/jdk/bin/javac"));
        // blank values fall back to the default
        assertEquals(config.descriptorSuffix(), ".pickled");
    }

    public void testSystemPropertyWins() {
        Properties props = new Properties();
        props.setProperty(ModuleGenConfig.MODULES_DIR, "jmods");
        String old = System.setProperty(ModuleGenConfig.MODULES_DIR, "sysmods");
        try {
            assertEquals(ModuleGenConfig.load(props).modulesDir(), "sysmods");
        } finally {
            if (old == null) {
                System.clearProperty(ModuleGenConfig.MODULES_DIR);
            } else {
                System.setProperty(ModuleGenConfig.MODULES_DIR, old);
            }
        }
    }
}
