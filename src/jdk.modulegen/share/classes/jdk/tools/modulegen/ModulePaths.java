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

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Lookups of packages on a module path.
 */
public final class ModulePaths {

    /**
     * The name used for the unnamed module when it imports a package.
     */
    public static final String UNNAMED_MODULE = "<unnamed>";

    private ModulePaths() { }

    /**
     * The module defining a package and the visibility of the package to
     * the importer that looked it up.
     */
    public static final class PackageLookup {
        private final JavaModuleDescriptor module;
        private final Visibility visibility;

        PackageLookup(JavaModuleDescriptor module, Visibility visibility) {
            this.module = Objects.requireNonNull(module);
            this.visibility = Objects.requireNonNull(visibility);
        }

        public JavaModuleDescriptor module() {
            return module;
        }

        public Visibility visibility() {
            return visibility;
        }

        @Override
        public String toString() {
            return module.name() + " (" + visibility + ")";
        }
    }

    /**
     * Searches a module path for the module defining a package.
     *
     * The module path is searched in order and the first module defining
     * the package wins; a package defined by more than one module is not
     * reported.
     *
     * @param modulePath the modules to search
     * @param pn         the name of the package to look up
     * @param importer   the name of the module importing the package
     *                   ({@link #UNNAMED_MODULE} for the unnamed module)
     * @return the defining module and the visibility of {@code pn} to
     *         {@code importer}, or an empty {@code Optional} if no module on
     *         the path defines {@code pn}
     */
    public static Optional<PackageLookup> lookupPackage(List<JavaModuleDescriptor> modulePath,
                                                        String pn,
                                                        String importer) {
        for (JavaModuleDescriptor jmd : modulePath) {
            Set<String> targets = jmd.exports().get(pn);
            if (targets != null) {
                if (targets.isEmpty() || targets.contains(importer)) {
                    return Optional.of(new PackageLookup(jmd, Visibility.EXPORTED));
                }
                return Optional.of(new PackageLookup(jmd, Visibility.CONCEALED));
            } else if (jmd.conceals().contains(pn)) {
                return Optional.of(new PackageLookup(jmd, Visibility.CONCEALED));
            }
        }
        return Optional.empty();
    }
}
