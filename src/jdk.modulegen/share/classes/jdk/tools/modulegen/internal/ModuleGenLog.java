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

import java.io.PrintWriter;

/**
 * The log of a module build session.
 */
public final class ModuleGenLog {
    private final PrintWriter log;
    private final boolean verbose;

    public ModuleGenLog(PrintWriter log, boolean verbose) {
        this.log = log;
        this.verbose = verbose;
    }

    public PrintWriter writer() {
        return log;
    }

    public void info(String key, Object... args) {
        log.println(Messages.getMessage(key, args));
        log.flush();
    }

    public void warning(String key, Object... args) {
        log.println(Messages.getMessage("warn.prefix") + " " + Messages.getMessage(key, args));
        log.flush();
    }

    /**
     * Prints a formatted message if the session is verbose.
     */
    public void trace(String fmt, Object... args) {
        if (verbose) {
            log.format(fmt, args);
            log.flush();
        }
    }
}
