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
package org.remsh.terminal;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import org.apache.sshd.common.util.logging.AbstractLoggingBean;

/**
 * Decides whether the process standard input is a terminal by running {@code test -t 0} with that input inherited.
 * The standard output plays no part, it may be redirected to a file or a pipe.
 */
public class ShellInputTerminalDetector extends AbstractLoggingBean {
    public static final String TEST_COMMAND = "test -t 0";
    public static final long TIMEOUT_SECONDS = 5L;

    public ShellInputTerminalDetector() {
        super();
    }

    public boolean isInputTerminal() {
        ProcessBuilder builder = new ProcessBuilder("sh", "-c", TEST_COMMAND)
                .redirectInput(ProcessBuilder.Redirect.INHERIT)
                .redirectErrorStream(true);
        try {
            Process p = builder.start();
            if (!p.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                p.destroyForcibly();
                log.warn("isInputTerminal() {} timed out", TEST_COMMAND);
                return false;
            }
            boolean terminal = p.exitValue() == 0;
            if (log.isDebugEnabled()) {
                log.debug("isInputTerminal() {}", terminal);
            }
            return terminal;
        } catch (IOException e) {
            log.debug("isInputTerminal() failed ({}) to run {}: {}", e.getClass().getSimpleName(), TEST_COMMAND,
                    e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("isInputTerminal() interrupted");
            return false;
        }
    }
}
