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
package org.remsh.auth;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.remsh.common.Diagnostics;
import org.remsh.common.FailureKind;
import org.remsh.common.RemshException;
import org.remsh.config.ResolvedConfig;
import org.remsh.transport.AuthResult;
import org.remsh.transport.Credential;
import org.remsh.transport.RemoteSession;

/**
 * Tries credential sources against one session in a fixed priority order and stops at the first success:
 * <OL>
 * <LI>An in-memory key fetched from a secret store - a failure here is fatal.</LI>
 * <LI>The local agent, unless disabled or {@code IdentitiesOnly} is set - failures fall through.</LI>
 * <LI>Key files - the explicit identity alone, otherwise the auto-discovered defaults.</LI>
 * </OL>
 */
public class AuthenticationChain extends AbstractLoggingBean {
    public static final String IN_MEMORY_KEY_FAILURE = "SSM key auth failed";
    public static final String EXHAUSTED_MESSAGE
            = "No valid authentication method succeeded. Use -i, --ssm-secret-path, or ensure ssh-agent is running.";

    private final ResolvedConfig config;
    private final Diagnostics diagnostics;

    public AuthenticationChain(ResolvedConfig config, Diagnostics diagnostics) {
        this.config = Objects.requireNonNull(config, "No config");
        this.diagnostics = Objects.requireNonNull(diagnostics, "No diagnostics");
    }

    /**
     * @param  session        The session to authenticate
     * @return                The credential that succeeded
     * @throws RemshException {@link FailureKind#AUTH_EXHAUSTED} if nothing worked or the in-memory key was rejected
     */
    public Credential authenticate(RemoteSession session) throws RemshException {
        String inMemoryKey = config.getInMemoryKey();
        if (inMemoryKey != null) {
            Credential credential = Credential.inMemoryKey(inMemoryKey);
            AuthResult result = attempt(session, credential);
            if (result.isSuccess()) {
                return credential;
            }

            String message = IN_MEMORY_KEY_FAILURE + ": " + result.getReason();
            diagnostics.error(message);
            throw new RemshException(FailureKind.AUTH_EXHAUSTED, message, result.getCause()).markReported();
        }

        if (isAgentEnabled()) {
            Credential credential = Credential.agent(config.getAgentEndpoint());
            if (attempt(session, credential).isSuccess()) {
                return credential;
            }
        } else {
            diagnostics.debug("Skipping ssh-agent authentication");
        }

        for (Path candidate : resolveKeyCandidates()) {
            if (!Files.exists(candidate)) {
                if (log.isDebugEnabled()) {
                    log.debug("authenticate({}) skip missing key file {}", config.getHost(), candidate);
                }
                continue;
            }

            Credential credential = Credential.keyFile(candidate);
            if (attempt(session, credential).isSuccess()) {
                return credential;
            }
        }

        diagnostics.error(EXHAUSTED_MESSAGE);
        throw new RemshException(FailureKind.AUTH_EXHAUSTED, EXHAUSTED_MESSAGE).markReported();
    }

    public boolean isAgentEnabled() {
        return !config.isNoAgent()
                && !config.isIdentitiesOnly()
                && GenericUtils.isNotEmpty(config.getAgentEndpoint());
    }

    /**
     * @return The key files to try, in order - existence is checked later
     */
    public List<Path> resolveKeyCandidates() {
        Path explicit = config.getIdentity();
        if (explicit != null) {
            return Collections.singletonList(explicit);
        }
        if (config.isIdentitiesOnly()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(config.getDiscoveryIdentities());
    }

    protected AuthResult attempt(RemoteSession session, Credential credential) {
        diagnostics.debug("Trying " + credential.getDescription());
        AuthResult result = session.authenticate(credential);
        if (result.isSuccess()) {
            diagnostics.debug("Authenticated using " + credential.getDescription());
            log.info("authenticate({}@{}) authenticated using {}",
                    config.getUsername(), config.getHost(), credential.getDescription());
        } else {
            diagnostics.debug(credential.getDescription() + " failed: " + result.getReason());
            if (log.isDebugEnabled()) {
                log.debug("authenticate({}@{}) {} rejected: {}",
                        config.getUsername(), config.getHost(), credential.getDescription(), result.getReason());
            }
        }
        return result;
    }
}
