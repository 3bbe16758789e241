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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PublicKey;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.sshd.agent.SshAgent;
import org.apache.sshd.agent.unix.UnixAgentFactory;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.channel.ChannelDirectTcpip;
import org.apache.sshd.client.channel.ChannelExec;
import org.apache.sshd.client.channel.ChannelShell;
import org.apache.sshd.client.channel.ClientChannel;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.NamedResource;
import org.apache.sshd.common.PropertyResolverUtils;
import org.apache.sshd.common.SshConstants;
import org.apache.sshd.common.channel.PtyChannelConfiguration;
import org.apache.sshd.common.config.keys.FilePasswordProvider;
import org.apache.sshd.common.config.keys.KeyUtils;
import org.apache.sshd.common.keyprovider.FileKeyPairProvider;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.buffer.Buffer;
import org.apache.sshd.common.util.buffer.ByteArrayBuffer;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.apache.sshd.common.util.net.SshdSocketAddress;
import org.apache.sshd.common.util.security.SecurityUtils;
import org.remsh.transport.AuthResult;
import org.remsh.transport.Credential;
import org.remsh.transport.ExecChannel;
import org.remsh.transport.HostKey;
import org.remsh.transport.RemoteChannel;
import org.remsh.transport.RemoteSession;
import org.remsh.transport.ShellChannel;

/**
 * {@link RemoteSession} backed by a MINA SSHD {@link ClientSession}. The underlying session is thread-safe, so
 * calls from the watchdog, the tunnels and the foreground are not serialized here.
 */
public class SshdRemoteSession extends AbstractLoggingBean implements RemoteSession {
    public static final NamedResource IN_MEMORY_KEY_RESOURCE = NamedResource.ofName("in-memory-key");

    private final SshClient client;
    private final ClientSession session;
    private volatile boolean keepaliveWantReply = true;

    public SshdRemoteSession(SshClient client, ClientSession session) {
        this.client = Objects.requireNonNull(client, "No client");
        this.session = Objects.requireNonNull(session, "No session");
    }

    public ClientSession getClientSession() {
        return session;
    }

    @Override
    public HostKey getHostKey() throws IOException {
        PublicKey key = session.getServerKey();
        if (key == null) {
            throw new IOException("No server key available for " + session);
        }

        Buffer buffer = new ByteArrayBuffer();
        buffer.putRawPublicKey(key);
        return new HostKey(KeyUtils.getKeyType(key), buffer.getCompactData());
    }

    @Override
    public AuthResult authenticate(Credential credential) {
        try {
            if (credential instanceof Credential.InMemoryKey) {
                String data = ((Credential.InMemoryKey) credential).getKeyData();
                return authenticateWithKeys(loadInMemoryKeys(data));
            } else if (credential instanceof Credential.AgentDelegated) {
                return authenticateWithAgent(((Credential.AgentDelegated) credential).getAgentEndpoint());
            } else if (credential instanceof Credential.KeyFilePair) {
                return authenticateWithKeys(loadKeyFile(((Credential.KeyFilePair) credential)));
            } else {
                return AuthResult.failure("Unsupported credential: " + credential);
            }
        } catch (IOException | GeneralSecurityException | RuntimeException e) {
            if (log.isDebugEnabled()) {
                log.debug("authenticate({}) {} failed ({}): {}",
                        session, credential, e.getClass().getSimpleName(), e.getMessage());
            }
            return AuthResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), e);
        }
    }

    protected List<KeyPair> loadInMemoryKeys(String data) throws IOException, GeneralSecurityException {
        Iterable<KeyPair> keys = SecurityUtils.loadKeyPairIdentities(
                session, IN_MEMORY_KEY_RESOURCE,
                new ByteArrayInputStream(data.getBytes(StandardCharsets.UTF_8)), FilePasswordProvider.EMPTY);
        return toList(keys);
    }

    protected List<KeyPair> loadKeyFile(Credential.KeyFilePair credential) {
        FileKeyPairProvider provider = new FileKeyPairProvider(credential.getPrivateKey());
        return toList(provider.loadKeys(session));
    }

    protected AuthResult authenticateWithKeys(List<KeyPair> keys) throws IOException {
        if (GenericUtils.isEmpty(keys)) {
            return AuthResult.failure("No keys loaded");
        }

        for (KeyPair kp : keys) {
            session.addPublicKeyIdentity(kp);
        }

        try {
            return runAuth();
        } finally {
            for (KeyPair kp : keys) {
                session.removePublicKeyIdentity(kp);
            }
        }
    }

    protected AuthResult authenticateWithAgent(String agentEndpoint) throws IOException {
        PropertyResolverUtils.updateProperty(client, SshAgent.SSH_AUTHSOCKET_ENV_NAME, agentEndpoint);
        client.setAgentFactory(new UnixAgentFactory());
        try {
            return runAuth();
        } finally {
            client.setAgentFactory(null);
        }
    }

    protected AuthResult runAuth() throws IOException {
        Duration timeout = SshdTransportProperties.AUTH_TIMEOUT.getRequired(session);
        session.auth().verify(timeout);
        return AuthResult.success();
    }

    @Override
    public ExecChannel openExecChannel(String command) throws IOException {
        ChannelExec channel = session.createExecChannel(command);
        return new SshdExecChannel(openChannel(channel), session);
    }

    @Override
    public ShellChannel openShellChannel(String ptyType, int columns, int rows) throws IOException {
        PtyChannelConfiguration pty = new PtyChannelConfiguration();
        pty.setPtyType(ptyType);
        pty.setPtyColumns(columns);
        pty.setPtyLines(rows);
        ChannelShell channel = session.createShellChannel(pty, null);
        return new SshdShellChannel(openChannel(channel));
    }

    @Override
    public RemoteChannel openTunnelChannel(String remoteHost, int remotePort, String originHost, int originPort)
            throws IOException {
        ChannelDirectTcpip channel = session.createDirectTcpipChannel(
                new SshdSocketAddress(originHost, originPort), new SshdSocketAddress(remoteHost, remotePort));
        return new SshdTunnelChannel(openChannel(channel));
    }

    protected <C extends ClientChannel> C openChannel(C channel) throws IOException {
        Duration timeout = SshdTransportProperties.CHANNEL_OPEN_TIMEOUT.getRequired(session);
        try {
            channel.open().verify(timeout);
        } catch (IOException | RuntimeException e) {
            channel.close(true);
            throw e;
        }
        return channel;
    }

    @Override
    public void configureKeepalive(boolean wantReply, int intervalSeconds) {
        this.keepaliveWantReply = wantReply;
        if (log.isDebugEnabled()) {
            log.debug("configureKeepalive({}) wantReply={}, interval={}s", session, wantReply, intervalSeconds);
        }
    }

    @Override
    public boolean sendKeepalive() {
        if (!session.isOpen()) {
            return false;
        }

        String request = SshdTransportProperties.KEEPALIVE_REQUEST;
        try {
            Buffer buf = session.createBuffer(SshConstants.SSH_MSG_GLOBAL_REQUEST, request.length() + Byte.SIZE);
            buf.putString(request);
            buf.putBoolean(keepaliveWantReply);
            if (keepaliveWantReply) {
                // a null reply means the peer rejected the request, which still proves it is alive
                Duration timeout = SshdTransportProperties.KEEPALIVE_REPLY_TIMEOUT.getRequired(session);
                session.request(request, buf, timeout);
            } else {
                session.writePacket(buf);
            }
            return true;
        } catch (IOException | RuntimeException e) {
            if (log.isDebugEnabled()) {
                log.debug("sendKeepalive({}) failed ({}): {}", session, e.getClass().getSimpleName(), e.getMessage());
            }
            return false;
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() throws IOException {
        session.close();
    }

    private static List<KeyPair> toList(Iterable<KeyPair> keys) {
        List<KeyPair> result = new ArrayList<>();
        if (keys != null) {
            for (KeyPair kp : keys) {
                if (kp != null) {
                    result.add(kp);
                }
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + session + "]";
    }
}
