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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import jdk.tools.modulegen.ModuleConfigurationException;

/**
 * Reads the service provider configuration files
 * ({@code META-INF/services/<service>}) of a jar.
 */
final class ServiceProviders {

    static final String METAINF_SERVICES = "META-INF/services/";

    private ServiceProviders() { }

    /**
     * Adds the providers registered in {@code jar} to {@code provides}. A
     * service whose class file is also in {@code jar} is added to
     * {@code uses}: a module is assumed to use the services it defines.
     */
    static void scan(Path jar, Map<String, Set<String>> provides, Set<String> uses)
        throws IOException
    {
        try (ZipFile zf = new ZipFile(jar.toFile())) {
            Set<String> names = new HashSet<>();
            List<ZipEntry> configs = new ArrayList<>();
            for (ZipEntry ze : Collections.list(zf.entries())) {
                String name = ze.getName();
                names.add(name);
                if (!ze.isDirectory()
                        && name.startsWith(METAINF_SERVICES)
                        && name.length() > METAINF_SERVICES.length()
                        && name.indexOf('/', METAINF_SERVICES.length()) < 0) {
                    configs.add(ze);
                }
            }
            for (ZipEntry ze : configs) {
                String service = ze.getName().substring(METAINF_SERVICES.length());
                try (InputStream in = zf.getInputStream(ze)) {
                    List<String> providers = parse(jar + "!/" + ze.getName(), in);
                    if (!providers.isEmpty()) {
                        provides.computeIfAbsent(service, k -> new LinkedHashSet<>())
                                .addAll(providers);
                    }
                }
                String serviceClass = service.replace('.', '/') + ".class";
                if (names.contains(serviceClass)) {
                    uses.add(service);
                }
            }
        }
    }

    /**
     * Parses a provider configuration file, in the format specified by
     * {@link java.util.ServiceLoader}.
     *
     * @return the provider class names, in file order and without duplicates
     */
    static List<String> parse(String fname, InputStream in) throws IOException {
        List<String> names = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(
                new InputStreamReader(in, StandardCharsets.UTF_8))) {
            int lc = 1;
            while ((lc = parseLine(fname, br, lc, names)) >= 0);
        }
        return names;
    }

    // Parse a single line from the given configuration file, adding the name
    // on the line to the names list.
    //
    private static int parseLine(String fname, BufferedReader r, int lc, List<String> names)
        throws IOException
    {
        String ln = r.readLine();
        if (ln == null) {
            return -1;
        }
        int ci = ln.indexOf('#');
        if (ci >= 0) {
            ln = ln.substring(0, ci);
        }
        ln = ln.trim();
        int n = ln.length();
        if (n != 0) {
            if ((ln.indexOf(' ') >= 0) || (ln.indexOf('\t') >= 0)) {
                throw new ModuleConfigurationException("err.bad.service.config", fname, lc, ln);
            }
            int cp = ln.codePointAt(0);
            if (!Character.isJavaIdentifierStart(cp)) {
                throw new ModuleConfigurationException("err.bad.provider.name", fname, lc, ln);
            }
            for (int i = Character.charCount(cp); i < n; i += Character.charCount(cp)) {
                cp = ln.codePointAt(i);
                if (!Character.isJavaIdentifierPart(cp) && (cp != '.')) {
                    throw new ModuleConfigurationException("err.bad.provider.name", fname, lc, ln);
                }
            }
            if (!names.contains(ln)) {
                names.add(ln);
            }
        }
        return lc + 1;
    }
}
