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
package org.remsh.supervisor;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.remsh.auth.AuthenticationChain;
import org.remsh.channel.SessionChannelMultiplexer;
import org.remsh.common.Diagnostics;
import org.remsh.common.FailureKind;
import org.remsh.common.RemshException;
import org.remsh.common.Sleeper;
import org.remsh.config.ResolvedConfig;
import org.remsh.forward.TunnelManager;
import org.remsh.keepalive.KeepaliveWatchdog;
import org.remsh.keepalive.ProcessTerminator;
import org.remsh.transport.RemoteSession;
import org.remsh.transport.RemoteTransport;
import org.remsh.trust.TrustStore;

/**
 * Top level connection loop. Each attempt opens a fresh session, verifies the host key, authenticates, starts the
 * keepalive watchdog and the port forwards and then runs the foreground multiplexer. Only connect timeouts and
 * refused connections are retried, with a fixed pause between attempts; every other failure aborts immediately.
 * The session of an attempt is always closed here, on every exit path.
 */
public class ConnectionSupervisor extends AbstractLoggingBean {
    public static final Duration RETRY_PAUSE = Duration.ofSeconds(1L);
    public static final String HOST_KEY_CHECK_DISABLED
            = "Warning: host key checking is disabled - the server identity is NOT verified.";

    private final ResolvedConfig config;
    private final RemoteTransport transport;
    private final TrustStore trustStore;
    private final AuthenticationChain authChain;
    private final MultiplexerFactory multiplexerFactory;
    private final ExecutorService executor;
    private final Diagnostics diagnostics;
    private Sleeper sleeper = Sleeper.SYSTEM;
    private ProcessTerminator terminator = ProcessTerminator.SYSTEM_EXIT;

    /**
     * @param config             The resolved configuration
     * @param transport          The {@link RemoteTransport} used to open sessions
     * @param trustStore         The {@link TrustStore} - ignored if host key checking is disabled
     * @param multiplexerFactory Creates the foreground task of an authenticated session
     * @param executor           Runs pumps and tunnel connections
     * @param diagnostics        User-facing diagnostics
     */
    public ConnectionSupervisor(
            ResolvedConfig config, RemoteTransport transport, TrustStore trustStore,
            MultiplexerFactory multiplexerFactory, ExecutorService executor, Diagnostics diagnostics) {
        this.config = Objects.requireNonNull(config, "No config");
        this.transport = Objects.requireNonNull(transport, "No transport");
        this.trustStore = config.isSkipHostKeyCheck() ? trustStore : Objects.requireNonNull(trustStore, "No trust store");
        this.multiplexerFactory = Objects.requireNonNull(multiplexerFactory, "No multiplexer factory");
        this.executor = Objects.requireNonNull(executor, "No executor");
        this.diagnostics = Objects.requireNonNull(diagnostics, "No diagnostics");
        this.authChain = new AuthenticationChain(config, diagnostics);
    }

    public Sleeper getSleeper() {
        return sleeper;
    }

    public void setSleeper(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "No sleeper");
    }

    public ProcessTerminator getTerminator() {
        return terminator;
    }

    public void setTerminator(ProcessTerminator terminator) {
        this.terminator = Objects.requireNonNull(terminator, "No terminator");
    }

    /**
     * @return                The foreground result - the remote exit status in exec mode, zero for a shell
     * @throws RemshException If a fatal failure occurred or all attempts failed
     */
    public int run() throws RemshException {
        String host = config.getHost();
        int port = config.getPort();
        int attempts = config.getAttemptCount();
        diagnostics.debug("Connecting to " + config.getUsername() + "@" + host + ":" + port + "...");

        RemshException lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            RemoteSession session;
            try {
                session = transport.connect(host, port, config.getUsername(), config.getConnectTimeout());
            } catch (RemshException e) {
                if (!e.isRetryable()) {
                    throw e;
                }

                lastFailure = e;
                reportRetryable(e, attempt, attempts);
                if (attempt < attempts) {
                    pause();
                }
                continue;
            }

            return runAttempt(session);
        }

        String message = "Failed to connect to " + host + ":" + port;
        FailureKind kind = (lastFailure == null) ? FailureKind.CONNECT_TIMEOUT : lastFailure.getKind();
        throw new RemshException(kind, message, lastFailure);
    }

    protected int runAttempt(RemoteSession session) throws RemshException {
        KeepaliveWatchdog watchdog = null;
        TunnelManager tunnels = null;
        try {
            if (config.isSkipHostKeyCheck()) {
                diagnostics.warning(HOST_KEY_CHECK_DISABLED);
            } else {
                trustStore.verify(config.getHost(), config.getPort(), session.getHostKey());
            }

            authChain.authenticate(session);

            int interval = config.getServerAliveInterval();
            if (interval > 0) {
                watchdog = new KeepaliveWatchdog(session, Duration.ofSeconds(interval), diagnostics, terminator, sleeper);
                watchdog.start();
            }

            tunnels = new TunnelManager(session, executor, diagnostics);
            tunnels.start(config.getForwards());

            SessionChannelMultiplexer multiplexer = multiplexerFactory.create(session);
            return multiplexer.run(config.getCommand());
        } catch (IOException | RuntimeException e) {
            throw RemshException.classify(e);
        } finally {
            if (watchdog != null) {
                watchdog.close();
            }
            closeTunnels(tunnels);
            closeSession(session);
        }
    }

    protected void reportRetryable(RemshException e, int attempt, int attempts) {
        String suffix = " (attempt " + attempt + "/" + attempts + ")";
        if (e.getKind() == FailureKind.CONNECTION_REFUSED) {
            diagnostics.debug("Connection refused: " + config.getHost() + ":" + config.getPort() + suffix);
        } else {
            diagnostics.debug("Connection timed out" + suffix);
        }
        if (log.isDebugEnabled()) {
            log.debug("run({}:{}) attempt {}/{} failed: {}",
                    config.getHost(), config.getPort(), attempt, attempts, e.getMessage());
        }
    }

    protected void pause() throws RemshException {
        try {
            sleeper.sleep(RETRY_PAUSE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RemshException.classify(new InterruptedIOException("Interrupted between connection attempts"));
        }
    }

    protected void closeTunnels(TunnelManager tunnels) {
        if (tunnels == null) {
            return;
        }

        try {
            tunnels.close();
        } catch (IOException e) {
            log.warn("closeTunnels({}) failed ({}): {}", config.getHost(), e.getClass().getSimpleName(), e.getMessage());
        }
    }

    protected void closeSession(RemoteSession session) {
        try {
            session.close();
        } catch (IOException e) {
            log.warn("closeSession({}) failed ({}): {}", config.getHost(), e.getClass().getSimpleName(), e.getMessage());
        }
    }
}
