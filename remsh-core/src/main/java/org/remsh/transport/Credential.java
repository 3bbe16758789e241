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
package org.remsh.transport;

import java.nio.file.Path;
import java.util.Objects;

import org.apache.sshd.common.util.ValidateUtils;

/**
 * One credential source tried by the authentication chain. Exactly three variants exist.
 */
public abstract class Credential {
    private Credential() {
        super();
    }

    /**
     * @return A short human readable description used in diagnostics - never the key material itself
     */
    public abstract String getDescription();

    @Override
    public String toString() {
        return getDescription();
    }

    public static InMemoryKey inMemoryKey(String keyData) {
        return new InMemoryKey(keyData);
    }

    public static AgentDelegated agent(String agentEndpoint) {
        return new AgentDelegated(agentEndpoint);
    }

    public static KeyFilePair keyFile(Path privateKey) {
        Objects.requireNonNull(privateKey, "No private key path");
        return new KeyFilePair(privateKey, privateKey.resolveSibling(privateKey.getFileName() + ".pub"));
    }

    /**
     * Private key contents held only in memory
     */
    public static final class InMemoryKey extends Credential {
        private final String keyData;

        InMemoryKey(String keyData) {
            this.keyData = ValidateUtils.checkNotNullAndNotEmpty(keyData, "No key data");
        }

        public String getKeyData() {
            return keyData;
        }

        @Override
        public String getDescription() {
            return "in-memory key";
        }
    }

    /**
     * Signing delegated to a local agent
     */
    public static final class AgentDelegated extends Credential {
        private final String agentEndpoint;

        AgentDelegated(String agentEndpoint) {
            this.agentEndpoint = ValidateUtils.checkNotNullAndNotEmpty(agentEndpoint, "No agent endpoint");
        }

        public String getAgentEndpoint() {
            return agentEndpoint;
        }

        @Override
        public String getDescription() {
            return "ssh-agent";
        }
    }

    /**
     * A private key file and its public counterpart
     */
    public static final class KeyFilePair extends Credential {
        private final Path privateKey;
        private final Path publicKey;

        KeyFilePair(Path privateKey, Path publicKey) {
            this.privateKey = Objects.requireNonNull(privateKey, "No private key path");
            this.publicKey = Objects.requireNonNull(publicKey, "No public key path");
        }

        public Path getPrivateKey() {
            return privateKey;
        }

        public Path getPublicKey() {
            return publicKey;
        }

        @Override
        public String getDescription() {
            return "key file " + privateKey;
        }
    }
}
