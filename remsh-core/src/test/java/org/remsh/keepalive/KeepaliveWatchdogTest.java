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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.remsh.common.Diagnostics;
import org.remsh.common.Sleeper;
import org.remsh.util.test.BaseTestSupport;
import org.remsh.util.test.FakeRemoteSession;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
public class KeepaliveWatchdogTest extends BaseTestSupport {
    private static final Duration INTERVAL = Duration.ofSeconds(15L);

    private ByteArrayOutputStream errBytes;
    private Diagnostics diagnostics;

    public KeepaliveWatchdogTest() {
        super();
    }

    @BeforeEach
    void setUp() throws Exception {
        errBytes = new ByteArrayOutputStream();
        diagnostics = new Diagnostics(new PrintStream(errBytes, true, StandardCharsets.UTF_8.name()), true);
    }

    @Test
    void threeConsecutiveFailuresTerminate() throws Exception {
        FakeRemoteSession session = new FakeRemoteSession().withKeepaliveResponder(() -> false);
        CountDownLatch terminated = new CountDownLatch(1);
        AtomicInteger status = new AtomicInteger(-1);
        ProcessTerminator terminator = s -> {
            status.set(s);
            terminated.countDown();
        };

        KeepaliveWatchdog watchdog = new KeepaliveWatchdog(session, INTERVAL, diagnostics, terminator, d -> {
            assertEquals(INTERVAL, d, "sleep interval");
        });
        watchdog.start();
        assertTrue(terminated.await(DEFAULT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS), "Not terminated");

        assertEquals(1, status.get(), "exit status");
        assertEquals(KeepaliveWatchdog.MAX_FAILURES, session.getKeepaliveCount(), "probes");
        assertEquals(1, session.getCloseCount(), "Session not closed");
        assertFalse(watchdog.isRunning(), "Still running");

        String err = errBytes.toString(StandardCharsets.UTF_8.name());
        assertTrue(err.contains("Keepalive failed (attempt 3/3)"), err);
        assertTrue(err.contains("Connection appears dead after 3 keepalive failures. Disconnecting."), err);
    }

    @Test
    void successResetsFailureCount() throws Exception {
        Deque<Boolean> script = new ArrayDeque<>(Arrays.asList(false, false, true, false, false, true, false, false));
        FakeRemoteSession session = new FakeRemoteSession().withKeepaliveResponder(() -> script.pollFirst());
        AtomicInteger terminations = new AtomicInteger();
        CountDownLatch exhausted = new CountDownLatch(1);
        int probes = script.size();
        AtomicInteger sleeps = new AtomicInteger();
        Sleeper sleeper = d -> {
            if (sleeps.incrementAndGet() > probes) {
                exhausted.countDown();
                Thread.sleep(Long.MAX_VALUE);  // until interrupted by close()
            }
        };

        KeepaliveWatchdog watchdog = new KeepaliveWatchdog(
                session, INTERVAL, diagnostics, s -> terminations.incrementAndGet(), sleeper);
        watchdog.start();
        try {
            assertTrue(exhausted.await(DEFAULT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS), "Script not consumed");
            assertEquals(0, terminations.get(), "Terminated although never 3 failures in a row");
            assertEquals(2, watchdog.getConsecutiveFailures(), "failures since last success");
            assertEquals(0, session.getCloseCount(), "Session closed");
        } finally {
            watchdog.close();
        }
        assertFalse(watchdog.isRunning(), "Still running after close");
    }

    @Test
    void startConfiguresTransportKeepalive() throws Exception {
        FakeRemoteSession session = new FakeRemoteSession();
        CountDownLatch slept = new CountDownLatch(1);
        KeepaliveWatchdog watchdog = new KeepaliveWatchdog(session, INTERVAL, diagnostics, s -> {
            throw new AssertionError("Unexpected termination");
        }, d -> {
            slept.countDown();
            Thread.sleep(Long.MAX_VALUE);
        });
        try {
            watchdog.start();
            assertTrue(watchdog.isRunning(), "Not running");
            assertEquals(Boolean.TRUE, session.getKeepaliveWantReply(), "want reply");
            assertEquals(15, session.getKeepaliveInterval(), "interval");
            assertTrue(slept.await(DEFAULT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS), "Probe loop not started");
        } finally {
            watchdog.close();
        }
        assertEquals(0, session.getKeepaliveCount(), "No probe expected before the first interval elapsed");
    }

    @Test
    void nonPositiveIntervalRejected() {
        FakeRemoteSession session = new FakeRemoteSession();
        assertThrows(IllegalArgumentException.class, () -> new KeepaliveWatchdog(
                session, Duration.ZERO, diagnostics, ProcessTerminator.SYSTEM_EXIT, Sleeper.SYSTEM));
    }
}
