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
package jdk.tools.modulegen.internal;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import jdk.tools.modulegen.JavaModuleDescriptor;
import jdk.tools.modulegen.ModuleGenException;
import jdk.tools.modulegen.ToolFailureException;
import jdk.tools.modulegen.spi.Dependency;
import jdk.tools.modulegen.spi.ExternalTool;
import jdk.tools.modulegen.spi.JarDistribution;
import jdk.tools.modulegen.spi.Platform;

/**
 * Builds the jar of a module: stages the content of the module's
 * distributions, compiles {@code module-info.java} against the module path
 * and packs the staging directory.
 */
final class ModuleAssembler {

    static final String MODULE_INFO = "module-info.java";

    private final Platform platform;
    private final ModuleGenConfig config;
    private final ModuleGenLog log;
    private final ExternalTool compiler;
    private final ModuleDescriptorStore store;

    ModuleAssembler(Platform platform,
                    ModuleGenConfig config,
                    ModuleGenLog log,
                    ExternalTool compiler,
                    ModuleDescriptorStore store) {
        this.platform = platform;
        this.config = config;
        this.log = log;
        this.compiler = compiler;
        this.store = store;
    }

    /**
     * Creates the jar of the module described by {@code jmd} and saves
     * {@code jmd}.
     *
     * @param moduleDeps the dependencies folded into the module
     * @throws ToolFailureException if {@code javac} fails
     */
    void assemble(JavaModuleDescriptor jmd, JavaModuleInfo info, List<Dependency> moduleDeps)
        throws IOException
    {
        JarDistribution dist = jmd.distribution()
            .orElseThrow(() -> new IllegalArgumentException(jmd + " is not derived from a distribution"));
        Path moduleDir = info.moduleDir();
        FileUtils.deleteRecursively(moduleDir);
        Files.createDirectories(moduleDir);

        // To compile module-info.java, all classes it references must either
        // be given as source files or already exist as class files in the
        // output directory, so every constituent jar is unpacked there.
        extract(dist.path(), moduleDir);
        for (Dependency dep : moduleDeps) {
            if (dep.isJarDistribution()) {
                extract(((JarDistribution) dep).path(), moduleDir);
            }
        }

        Path moduleInfo = moduleDir.resolve(MODULE_INFO);
        Files.write(moduleInfo, jmd.asModuleInfo().getBytes(StandardCharsets.UTF_8));

        List<String> javacCmd = javacCommand(jmd, moduleDir, moduleInfo);
        log.trace("%s%n", String.join(" ", javacCmd));
        int rc = compiler.run(javacCmd, log.writer());
        if (rc != 0) {
            throw new ToolFailureException(javacCmd, rc);
        }

        createJar(moduleDir, info.moduleJar());
        store.save(jmd);
    }

    /**
     * Returns the command compiling {@code moduleInfo}. Jars of modules
     * replacing a platform module go on the upgrade module path, all others
     * on the module path.
     */
    List<String> javacCommand(JavaModuleDescriptor jmd, Path moduleDir, Path moduleInfo) {
        Set<String> platformModules = platform.modules().stream()
            .map(JavaModuleDescriptor::name)
            .collect(Collectors.toSet());
        List<String> modulePathJars = new ArrayList<>();
        List<String> upgradeModulePathJars = new ArrayList<>();
        for (JavaModuleDescriptor m : jmd.modulePath()) {
            if (!m.jarPath().isPresent()) {
                continue;
            }
            String jar = m.jarPath().get().toString();
            if (platformModules.contains(m.name())) {
                upgradeModulePathJars.add(jar);
            } else {
                modulePathJars.add(jar);
            }
        }

        String javac = config.javac().orElseGet(platform::javac).toString();
        List<String> cmd = new ArrayList<>();
        cmd.add(javac);
        cmd.add("-d");
        cmd.add(moduleDir.toString());
        if (!modulePathJars.isEmpty()) {
            cmd.add("--module-path");
            cmd.add(String.join(File.pathSeparator, modulePathJars));
        }
        if (!upgradeModulePathJars.isEmpty()) {
            cmd.add("--upgrade-module-path");
            cmd.add(String.join(File.pathSeparator, upgradeModulePathJars));
        }
        cmd.add(moduleInfo.toString());
        return cmd;
    }

    /**
     * Unpacks {@code jar} into {@code dir}, replacing existing files.
     */
    static void extract(Path jar, Path dir) throws IOException {
        Path root = dir.toAbsolutePath().normalize();
        try (ZipFile zf = new ZipFile(jar.toFile())) {
            for (ZipEntry ze : Collections.list(zf.entries())) {
                Path target = root.resolve(ze.getName()).normalize();
                if (!target.startsWith(root)) {
                    throw new ModuleGenException("err.bad.zip.entry", ze.getName(), jar);
                }
                if (ze.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    Files.createDirectories(target.getParent());
                    try (InputStream in = zf.getInputStream(ze)) {
                        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                    }
                }
            }
        }
    }

    /**
     * Packs the content of {@code dir} into {@code jar}. The jar is written
     * to a temporary file first and then moved into place.
     */
    static void createJar(Path dir, Path jar) throws IOException {
        Path tmp = jar.resolveSibling(jar.getFileName() + ".tmp");
        List<Path> paths;
        try (Stream<Path> stream = Files.walk(dir)) {
            paths = stream.filter(p -> !p.equals(dir))
                          .sorted()
                          .collect(Collectors.toCollection(ArrayList::new));
        }
        // the manifest must be the first entries of the jar
        Path metaInf = dir.resolve("META-INF");
        Path manifest = metaInf.resolve("MANIFEST.MF");
        if (paths.remove(manifest)) {
            paths.add(0, manifest);
            paths.remove(metaInf);
            paths.add(0, metaInf);
        }
        try {
            try (OutputStream out = Files.newOutputStream(tmp);
                 JarOutputStream jos = new JarOutputStream(out)) {
                for (Path p : paths) {
                    String name = dir.relativize(p).toString().replace(File.separatorChar, '/');
                    if (Files.isDirectory(p)) {
                        jos.putNextEntry(new JarEntry(name + "/"));
                    } else {
                        jos.putNextEntry(new JarEntry(name));
                        Files.copy(p, jos);
                    }
                    jos.closeEntry();
                }
            }
            FileUtils.moveAtomically(tmp, jar);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
