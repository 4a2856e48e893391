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
package jdk.tools.modulegen;

import java.io.IOException;
import java.io.InputStream;
import java.lang.module.ModuleDescriptor;
import java.lang.module.ModuleDescriptor.Exports;
import java.lang.module.ModuleDescriptor.Provides;
import java.lang.module.ModuleDescriptor.Requires;
import java.lang.module.ModuleFinder;
import java.lang.module.ModuleReference;
import java.net.URI;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import jdk.tools.modulegen.spi.Platform;

/**
 * A {@link Platform} backed by the modules of a JDK image.
 */
public final class JdkPlatform implements Platform {

    private final Path javaHome;
    private final List<JavaModuleDescriptor> modules;

    private JdkPlatform(Path javaHome, List<JavaModuleDescriptor> modules) {
        this.javaHome = javaHome;
        this.modules = Collections.unmodifiableList(modules);
    }

    /**
     * Returns the platform of the running JDK.
     */
    public static JdkPlatform ofRuntime() {
        Path javaHome = Paths.get(System.getProperty("java.home"));
        List<JavaModuleDescriptor> modules = ModuleFinder.ofSystem().findAll().stream()
            .map(ModuleReference::descriptor)
            .sorted()
            .map(JdkPlatform::toJavaModuleDescriptor)
            .collect(Collectors.toList());
        return new JdkPlatform(javaHome, modules);
    }

    /**
     * Returns the platform of the JDK image at {@code javaHome}.
     *
     * @throws IOException if the run-time image of {@code javaHome} cannot
     *         be read
     */
    public static JdkPlatform of(Path javaHome) throws IOException {
        Path current = Paths.get(System.getProperty("java.home"));
        if (Files.isSameFile(current, javaHome)) {
            return ofRuntime();
        }
        Map<String, String> env = new HashMap<>();
        env.put("java.home", javaHome.toString());
        List<ModuleDescriptor> descriptors = new ArrayList<>();
        try (FileSystem jrt = FileSystems.newFileSystem(URI.create("jrt:/"), env);
             DirectoryStream<Path> stream = Files.newDirectoryStream(jrt.getPath("/modules"))) {
            for (Path dir : stream) {
                Path mi = dir.resolve("module-info.class");
                if (Files.exists(mi)) {
                    try (InputStream in = Files.newInputStream(mi)) {
                        descriptors.add(ModuleDescriptor.read(in));
                    }
                }
            }
        }
        Collections.sort(descriptors);
        List<JavaModuleDescriptor> modules = new ArrayList<>();
        descriptors.forEach(md -> modules.add(toJavaModuleDescriptor(md)));
        return new JdkPlatform(javaHome, modules);
    }

    static JavaModuleDescriptor toJavaModuleDescriptor(ModuleDescriptor md) {
        JavaModuleDescriptor.Builder builder = new JavaModuleDescriptor.Builder(md.name());
        for (Exports e : md.exports()) {
            builder.exports(e.source(), e.targets());
        }
        for (Requires r : md.requires()) {
            Set<String> modifiers = r.modifiers().stream()
                .map(m -> m.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
            builder.requires(r.name(), modifiers);
        }
        for (Provides p : md.provides()) {
            builder.provides(p.service(), p.providers());
        }
        return builder.uses(md.uses())
                      .packages(md.packages())
                      .platformModule(true)
                      .build();
    }

    public Path javaHome() {
        return javaHome;
    }

    @Override
    public List<JavaModuleDescriptor> modules() {
        return modules;
    }

    @Override
    public Path javac() {
        String exe = System.getProperty("os.name").startsWith("Windows") ? "javac.exe" : "javac";
        return javaHome.resolve("bin").resolve(exe);
    }

    @Override
    public String toString() {
        return "JDK " + javaHome;
    }
}
