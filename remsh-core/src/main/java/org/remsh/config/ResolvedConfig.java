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
package org.remsh.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.apache.sshd.common.config.keys.PublicKeyEntry;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.ValidateUtils;

/**
 * The fully resolved (flags + configuration file) settings of one client run. Immutable once built and consumed
 * read-only by every component.
 */
public final class ResolvedConfig {
    public static final int DEFAULT_PORT = 22;
    public static final int DEFAULT_ATTEMPTS = 1;
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofMinutes(2L);
    public static final String KNOWN_HOSTS_FILE_NAME = "known_hosts";

    /** Auto-discovery key file names, in the order they are tried */
    public static final List<String> DEFAULT_IDENTITY_NAMES =
            Collections.unmodifiableList(Arrays.asList("id_ed25519", "id_rsa", "id_ecdsa"));

    private final String host;
    private final int port;
    private final String username;
    private final Path identity;
    private final List<Path> discoveryIdentities;
    private final boolean identitiesOnly;
    private final boolean noAgent;
    private final String agentEndpoint;
    private final Path knownHostsPath;
    private final boolean skipHostKeyCheck;
    private final int serverAliveInterval;
    private final List<ForwardSpec> forwards;
    private final Duration connectTimeout;
    private final int attemptCount;
    private final boolean debug;
    private final String command;
    private final String inMemoryKey;

    private ResolvedConfig(Builder b) {
        this.host = ValidateUtils.checkNotNullAndNotEmpty(b.host, "No host");
        this.port = b.port;
        ValidateUtils.checkTrue((port > 0) && (port <= ForwardSpec.MAX_PORT), "Invalid port: %d", port);
        this.username = ValidateUtils.checkNotNullAndNotEmpty(b.username, "No username");
        this.identity = b.identity;
        this.discoveryIdentities = Collections.unmodifiableList(new ArrayList<>(b.resolveDiscoveryIdentities()));
        this.identitiesOnly = b.identitiesOnly;
        this.noAgent = b.noAgent;
        this.agentEndpoint = GenericUtils.isEmpty(b.agentEndpoint) ? null : b.agentEndpoint;
        this.knownHostsPath = (b.knownHostsPath == null)
                ? PublicKeyEntry.getDefaultKeysFolderPath().resolve(KNOWN_HOSTS_FILE_NAME)
                : b.knownHostsPath;
        this.skipHostKeyCheck = b.skipHostKeyCheck;
        ValidateUtils.checkTrue(b.serverAliveInterval >= 0, "Negative server alive interval: %d", b.serverAliveInterval);
        this.serverAliveInterval = b.serverAliveInterval;
        this.forwards = Collections.unmodifiableList(new ArrayList<>(b.forwards));
        this.connectTimeout = Objects.requireNonNull(b.connectTimeout, "No connect timeout");
        ValidateUtils.checkTrue(b.attemptCount >= 1, "Attempt count must be positive: %d", b.attemptCount);
        this.attemptCount = b.attemptCount;
        this.debug = b.debug;
        this.command = GenericUtils.isEmpty(b.command) ? null : b.command;
        this.inMemoryKey = GenericUtils.isEmpty(b.inMemoryKey) ? null : b.inMemoryKey;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUsername() {
        return username;
    }

    /**
     * @return The explicit identity file ({@code -i} or {@code IdentityFile}) - {@code null} if none
     */
    public Path getIdentity() {
        return identity;
    }

    public List<Path> getDiscoveryIdentities() {
        return discoveryIdentities;
    }

    public boolean isIdentitiesOnly() {
        return identitiesOnly;
    }

    public boolean isNoAgent() {
        return noAgent;
    }

    /**
     * @return The local agent socket - {@code null} if no agent is available
     */
    public String getAgentEndpoint() {
        return agentEndpoint;
    }

    public Path getKnownHostsPath() {
        return knownHostsPath;
    }

    public boolean isSkipHostKeyCheck() {
        return skipHostKeyCheck;
    }

    /**
     * @return Seconds between keepalive probes - zero disables the watchdog
     */
    public int getServerAliveInterval() {
        return serverAliveInterval;
    }

    public List<ForwardSpec> getForwards() {
        return forwards;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public boolean isDebug() {
        return debug;
    }

    /**
     * @return The one-shot remote command - {@code null} for an interactive shell
     */
    public String getCommand() {
        return command;
    }

    /**
     * @return Private key contents fetched from a secret store - {@code null} if none. Never written to disk.
     */
    public String getInMemoryKey() {
        return inMemoryKey;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
               + "[" + username + "@" + host + ":" + port
               + ", identity=" + identity
               + ", identitiesOnly=" + identitiesOnly
               + ", noAgent=" + noAgent
               + ", knownHosts=" + knownHostsPath
               + ", serverAliveInterval=" + serverAliveInterval
               + ", forwards=" + forwards
               + ", connectTimeout=" + connectTimeout
               + ", attempts=" + attemptCount
               + ", command=" + command
               + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host;
        private int port = DEFAULT_PORT;
        private String username;
        private Path identity;
        private List<Path> discoveryIdentities;
        private boolean identitiesOnly;
        private boolean noAgent;
        private String agentEndpoint;
        private Path knownHostsPath;
        private boolean skipHostKeyCheck;
        private int serverAliveInterval;
        private final List<ForwardSpec> forwards = new ArrayList<>();
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private int attemptCount = DEFAULT_ATTEMPTS;
        private boolean debug;
        private String command;
        private String inMemoryKey;

        private Builder() {
            super();
        }

        public Builder host(String value) {
            this.host = value;
            return this;
        }

        public Builder port(int value) {
            this.port = value;
            return this;
        }

        public Builder username(String value) {
            this.username = value;
            return this;
        }

        public Builder identity(Path value) {
            this.identity = value;
            return this;
        }

        public Builder discoveryIdentities(List<Path> value) {
            this.discoveryIdentities = value;
            return this;
        }

        public Builder identitiesOnly(boolean value) {
            this.identitiesOnly = value;
            return this;
        }

        public Builder noAgent(boolean value) {
            this.noAgent = value;
            return this;
        }

        public Builder agentEndpoint(String value) {
            this.agentEndpoint = value;
            return this;
        }

        public Builder knownHostsPath(Path value) {
            this.knownHostsPath = value;
            return this;
        }

        public Builder skipHostKeyCheck(boolean value) {
            this.skipHostKeyCheck = value;
            return this;
        }

        public Builder serverAliveInterval(int value) {
            this.serverAliveInterval = value;
            return this;
        }

        public Builder forward(ForwardSpec value) {
            this.forwards.add(Objects.requireNonNull(value, "No forward"));
            return this;
        }

        public Builder forwards(List<ForwardSpec> values) {
            this.forwards.clear();
            if (values != null) {
                values.forEach(this::forward);
            }
            return this;
        }

        public Builder connectTimeout(Duration value) {
            this.connectTimeout = value;
            return this;
        }

        public Builder attemptCount(int value) {
            this.attemptCount = value;
            return this;
        }

        public Builder debug(boolean value) {
            this.debug = value;
            return this;
        }

        public Builder command(String value) {
            this.command = value;
            return this;
        }

        public Builder inMemoryKey(String value) {
            this.inMemoryKey = value;
            return this;
        }

        private List<Path> resolveDiscoveryIdentities() {
            if (discoveryIdentities != null) {
                return discoveryIdentities;
            }

            Path keysFolder = PublicKeyEntry.getDefaultKeysFolderPath();
            List<Path> paths = new ArrayList<>(DEFAULT_IDENTITY_NAMES.size());
            for (String name : DEFAULT_IDENTITY_NAMES) {
                paths.add(keysFolder.resolve(name));
            }
            return paths;
        }

        public ResolvedConfig build() {
            return new ResolvedConfig(this);
        }
    }
}
