/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements. See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership. The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.remsh.cli;

import java.io.PrintStream;
import java.util.logging.Level;

import org.apache.sshd.common.util.GenericUtils;

/**
 * Console reporting helpers of the command line tool
 */
public final class CliLogger {
    public static final String ERROR_PREFIX = "ERROR: ";

    private CliLogger() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * @param  stderr  The error stream
     * @param  message The message to show
     * @return         Always {@code true} so callers can write {@code error = showError(...)}
     */
    public static boolean showError(PrintStream stderr, String message) {
        stderr.append(ERROR_PREFIX).println(message);
        return true;
    }

    public static void showWarning(PrintStream stderr, String message) {
        stderr.append("Warning: ").println(message);
    }

    public static Level resolveLoggingVerbosity(String... args) {
        return resolveLoggingVerbosity(args, GenericUtils.length(args));
    }

    /**
     * Maps {@code -v}/{@code -vv}/{@code -vvv} to increasingly detailed logging levels
     *
     * @param  args     The command line arguments
     * @param  maxIndex Only arguments before this index are examined
     * @return          The resolved verbosity level - {@link Level#WARNING} if none specified
     */
    public static Level resolveLoggingVerbosity(String[] args, int maxIndex) {
        for (int index = 0; index < maxIndex; index++) {
            String argName = args[index];
            if ("-v".equals(argName)) {
                return Level.INFO;
            } else if ("-vv".equals(argName)) {
                return Level.FINE;
            } else if ("-vvv".equals(argName)) {
                return Level.FINEST;
            }
        }

        return Level.WARNING;
    }

    public static boolean isVerbosityOption(String argName) {
        return "-v".equals(argName) || "-vv".equals(argName) || "-vvv".equals(argName);
    }

    public static <T extends Throwable> T printStackTrace(PrintStream out, T reason) {
        if ((reason == null) || (out == null)) {
            return reason;
        }

        reason.printStackTrace(out);
        return reason;
    }
}
