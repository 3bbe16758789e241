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
import java.io.InterruptedIOException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.sshd.common.channel.SttySupport;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;

/**
 * Uses {@code stty} on the controlling terminal to save, change and restore its mode
 */
public class SttyTerminalModeController extends AbstractLoggingBean implements TerminalModeController {
    public static final String RAW_MODE_ARGS = "raw -echo";

    public SttyTerminalModeController() {
        super();
    }

    @Override
    public RawModeHandle enterRawMode() throws IOException {
        String saved = stty("-g");
        if (GenericUtils.isEmpty(saved)) {
            throw new IOException("Unable to save the terminal settings");
        }

        stty(RAW_MODE_ARGS);
        if (log.isDebugEnabled()) {
            log.debug("enterRawMode() saved settings: {}", saved);
        }

        AtomicBoolean restored = new AtomicBoolean(false);
        return () -> {
            if (!restored.compareAndSet(false, true)) {
                return;
            }

            try {
                stty(saved);
            } catch (IOException e) {
                log.warn("close() failed ({}) to restore terminal settings: {}",
                        e.getClass().getSimpleName(), e.getMessage());
            }
        };
    }

    protected String stty(String args) throws IOException {
        try {
            return SttySupport.stty(args);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw (IOException) new InterruptedIOException("Interrupted while running stty " + args).initCause(e);
        }
    }
}
