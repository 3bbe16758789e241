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
package org.remsh.common;

import java.io.PrintStream;
import java.util.Objects;

/**
 * User-facing diagnostics written to the local error stream. Debug messages are only shown when debug mode is on;
 * warnings and errors are always shown.
 */
public class Diagnostics {
    public static final String DEBUG_PREFIX = "debug: ";
    public static final String ERROR_PREFIX = "ERROR: ";

    private final PrintStream stderr;
    private final boolean debugEnabled;

    public Diagnostics(PrintStream stderr, boolean debugEnabled) {
        this.stderr = Objects.requireNonNull(stderr, "No error stream");
        this.debugEnabled = debugEnabled;
    }

    public boolean isDebugEnabled() {
        return debugEnabled;
    }

    public PrintStream getErrorStream() {
        return stderr;
    }

    public void debug(String message) {
        if (debugEnabled) {
            print(DEBUG_PREFIX + message);
        }
    }

    public void debug(String message, Throwable t) {
        if (debugEnabled) {
            print(DEBUG_PREFIX + message + ": " + t);
        }
    }

    public void warning(String message) {
        print(message);
    }

    public void error(String message) {
        print(ERROR_PREFIX + message);
    }

    protected void print(String message) {
        synchronized (stderr) {
            stderr.println(message);
            stderr.flush();
        }
    }
}
