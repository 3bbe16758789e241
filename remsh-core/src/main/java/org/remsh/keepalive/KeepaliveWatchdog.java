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
package org.remsh.keepalive;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.sshd.common.util.ValidateUtils;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.remsh.common.Diagnostics;
import org.remsh.common.FailureKind;
import org.remsh.common.Sleeper;
import org.remsh.transport.RemoteSession;

/**
 * Periodically probes the session. After {@value #MAX_FAILURES} consecutive failed probes the connection is
 * considered dead: the session is closed and the process terminated, since the foreground work may be blocked
 * forever on the dead socket.
 */
public class KeepaliveWatchdog extends AbstractLoggingBean implements Closeable {
    public static final int MAX_FAILURES = 3;

    private final RemoteSession session;
    private final Duration interval;
    private final Diagnostics diagnostics;
    private final ProcessTerminator terminator;
    private final Sleeper sleeper;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private Thread thread;

    public KeepaliveWatchdog(
            RemoteSession session, Duration interval, Diagnostics diagnostics,
            ProcessTerminator terminator, Sleeper sleeper) {
        this.session = Objects.requireNonNull(session, "No session");
        this.interval = Objects.requireNonNull(interval, "No interval");
        ValidateUtils.checkTrue(!interval.isNegative() && !interval.isZero(), "Non-positive interval: %s", interval);
        this.diagnostics = Objects.requireNonNull(diagnostics, "No diagnostics");
        this.terminator = Objects.requireNonNull(terminator, "No terminator");
        this.sleeper = Objects.requireNonNull(sleeper, "No sleeper");
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }

        session.configureKeepalive(true, (int) interval.getSeconds());
        diagnostics.debug("ServerAliveInterval: " + interval.getSeconds() + "s");
        thread = new Thread(this::probeLoop, "remsh-keepalive");
        thread.setDaemon(true);
        thread.start();
    }

    protected void probeLoop() {
        while (running.get()) {
            try {
                sleeper.sleep(interval);
            } catch (InterruptedException e) {
                if (log.isDebugEnabled()) {
                    log.debug("probeLoop() interrupted");
                }
                return;
            }

            if (!running.get()) {
                return;
            }

            if (probe()) {
                consecutiveFailures.set(0);
                diagnostics.debug("Keepalive sent (next in " + interval.getSeconds() + "s)");
                continue;
            }

            int failures = consecutiveFailures.incrementAndGet();
            diagnostics.debug("Keepalive failed (attempt " + failures + "/" + MAX_FAILURES + ")");
            if (failures >= MAX_FAILURES) {
                connectionDead();
                return;
            }
        }
    }

    protected boolean probe() {
        try {
            return session.sendKeepalive();
        } catch (RuntimeException e) {
            log.warn("probe() failed ({}): {}", e.getClass().getSimpleName(), e.getMessage());
            return false;
        }
    }

    protected void connectionDead() {
        running.set(false);
        diagnostics.warning("Connection appears dead after " + MAX_FAILURES + " keepalive failures. Disconnecting.");
        log.warn("connectionDead() {}", FailureKind.KEEPALIVE_EXHAUSTED);
        try {
            session.close();
        } catch (IOException | RuntimeException e) {
            if (log.isDebugEnabled()) {
                log.debug("connectionDead() close failed ({}): {}", e.getClass().getSimpleName(), e.getMessage());
            }
        }
        terminator.terminate(FailureKind.FATAL_EXIT_STATUS);
    }

    @Override
    public void close() {
        Thread t;
        synchronized (this) {
            t = thread;
            thread = null;
        }

        if (running.compareAndSet(true, false) && (t != null) && (t != Thread.currentThread())) {
            t.interrupt();
        }
    }
}
