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
package org.remsh.sshd;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.nio.channels.InterruptedByTimeoutException;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.auth.pubkey.UserAuthPublicKeyFactory;
import org.apache.sshd.client.config.hosts.HostConfigEntryResolver;
import org.apache.sshd.client.future.ConnectFuture;
import org.apache.sshd.client.keyverifier.AcceptAllServerKeyVerifier;
import org.apache.sshd.client.session.ClientSession.ClientSessionEvent;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.keyprovider.KeyIdentityProvider;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.remsh.common.FailureKind;
import org.remsh.common.RemshException;
import org.remsh.transport.RemoteSession;
import org.remsh.transport.RemoteTransport;

/**
 * {@link RemoteTransport} on top of an Apache MINA SSHD {@link SshClient}. The client is configured so that it never
 * picks credentials, host configuration or host key decisions on its own - these are all made by the caller.
 */
public class SshdRemoteTransport extends AbstractLoggingBean implements RemoteTransport {
    private final SshClient client;

    public SshdRemoteTransport() {
        this(SshClient.setUpDefaultClient());
    }

    public SshdRemoteTransport(SshClient client) {
        this.client = Objects.requireNonNull(client, "No client");
        setupClient(client);
    }

    public SshClient getClient() {
        return client;
    }

    public static SshClient setupClient(SshClient client) {
        client.setUserAuthFactories(Collections.singletonList(UserAuthPublicKeyFactory.INSTANCE));
        client.setKeyIdentityProvider(KeyIdentityProvider.EMPTY_KEYS_PROVIDER);
        client.setHostConfigEntryResolver(HostConfigEntryResolver.EMPTY);
        // the host key is checked against the known hosts once key exchange completes
        client.setServerKeyVerifier(AcceptAllServerKeyVerifier.INSTANCE);
        client.setAgentFactory(null);
        return client;
    }

    @Override
    public RemoteSession connect(String host, int port, String username, Duration connectTimeout)
            throws RemshException {
        if (!client.isStarted()) {
            client.start();
        }

        long start = System.nanoTime();
        ConnectFuture future;
        try {
            future = client.connect(username, host, port);
            if (!future.await(connectTimeout)) {
                future.cancel();
                throw new RemshException(FailureKind.CONNECT_TIMEOUT,
                        "Connection to " + host + ":" + port + " timed out after " + connectTimeout);
            }
        } catch (RemshException e) {
            throw e;
        } catch (IOException e) {
            throw classifyConnectFailure(host, port, e);
        }

        Throwable failure = future.getException();
        if (failure != null) {
            throw classifyConnectFailure(host, port, failure);
        }

        ClientSession session = future.getSession();
        Duration remaining = connectTimeout.minusNanos(System.nanoTime() - start);
        if (remaining.isNegative() || remaining.isZero()) {
            remaining = Duration.ofMillis(1L);
        }

        Set<ClientSessionEvent> events = session.waitFor(
                EnumSet.of(ClientSessionEvent.WAIT_AUTH, ClientSessionEvent.AUTHED, ClientSessionEvent.CLOSED),
                remaining);
        if (events.contains(ClientSessionEvent.CLOSED)) {
            closeQuietly(session);
            throw new RemshException(FailureKind.PROTOCOL_ERROR,
                    "Connection to " + host + ":" + port + " closed during key exchange");
        }
        if (events.contains(ClientSessionEvent.TIMEOUT)) {
            closeQuietly(session);
            throw new RemshException(FailureKind.CONNECT_TIMEOUT,
                    "Key exchange with " + host + ":" + port + " timed out");
        }

        if (log.isDebugEnabled()) {
            log.debug("connect({}@{}:{}) established: {}", username, host, port, session);
        }
        return new SshdRemoteSession(client, session);
    }

    /**
     * @param  host    Target host
     * @param  port    Target port
     * @param  failure The connect failure
     * @return         A {@link RemshException} whose kind reflects the root cause
     */
    public static RemshException classifyConnectFailure(String host, int port, Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof ConnectException) {
                return new RemshException(FailureKind.CONNECTION_REFUSED,
                        "Connection refused: " + host + ":" + port, failure);
            }
            if ((t instanceof SocketTimeoutException) || (t instanceof InterruptedByTimeoutException)) {
                return new RemshException(FailureKind.CONNECT_TIMEOUT,
                        "Connection to " + host + ":" + port + " timed out", failure);
            }
        }

        return new RemshException(FailureKind.PROTOCOL_ERROR,
                "Failed to connect to " + host + ":" + port + ": " + failure.getMessage(), failure);
    }

    protected void closeQuietly(ClientSession session) {
        try {
            session.close();
        } catch (IOException e) {
            if (log.isDebugEnabled()) {
                log.debug("closeQuietly({}) failed ({}): {}", session, e.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    @Override
    public void close() throws IOException {
        client.close();
    }
}
