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
package org.remsh.trust;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.remsh.common.Diagnostics;
import org.remsh.common.FailureKind;
import org.remsh.common.RemshException;
import org.remsh.config.ResolvedConfig;
import org.remsh.transport.HostKey;

/**
 * Trust-on-first-use verification of server host keys against the known-hosts database. Unknown keys are accepted
 * (after confirmation when interactive) and pinned; a changed key is always fatal.
 */
public class TrustStore extends AbstractLoggingBean {
    public static final String CONFIRM_PROMPT = "Are you sure you want to continue connecting? (yes/no) ";

    private final KnownHostsFile knownHosts;
    private final HostKeyPrompt prompt;
    private final Diagnostics diagnostics;
    // a mismatch stays fatal for the lifetime of the process
    private final Set<String> mismatched = ConcurrentHashMap.newKeySet();

    public TrustStore(Path knownHostsPath, HostKeyPrompt prompt, Diagnostics diagnostics) {
        this(new KnownHostsFile(knownHostsPath), prompt, diagnostics);
    }

    public TrustStore(KnownHostsFile knownHosts, HostKeyPrompt prompt, Diagnostics diagnostics) {
        this.knownHosts = Objects.requireNonNull(knownHosts, "No known hosts file");
        this.prompt = Objects.requireNonNull(prompt, "No prompt");
        this.diagnostics = Objects.requireNonNull(diagnostics, "No diagnostics");
    }

    public KnownHostsFile getKnownHosts() {
        return knownHosts;
    }

    /**
     * @param  host The target host
     * @param  port The target port
     * @return      {@code host} for the default port, {@code [host]:port} otherwise
     */
    public static String canonicalHostId(String host, int port) {
        return (port == ResolvedConfig.DEFAULT_PORT) ? host : ("[" + host + "]:" + port);
    }

    /**
     * Compares a live key against the given entries
     *
     * @param  entries The known entries
     * @param  hostId  The canonical host identifier
     * @param  key     The live key
     * @return         The {@link TrustDecision}
     */
    public static TrustDecision check(List<TrustEntry> entries, String hostId, HostKey key) {
        for (TrustEntry e : entries) {
            if (e.isRevoked() && e.isKeyOf(key) && e.isHostMatch(hostId)) {
                return TrustDecision.MISMATCH;
            }
        }

        boolean hostKnown = false;
        for (TrustEntry e : entries) {
            // @cert-authority and other markers do not pin a host key
            if ((e.getMarker() != null) || (!e.isHostMatch(hostId))) {
                continue;
            }
            if (e.isKeyOf(key)) {
                return TrustDecision.MATCH;
            }
            hostKnown = true;
        }
        return hostKnown ? TrustDecision.MISMATCH : TrustDecision.NOTFOUND;
    }

    /**
     * Verifies (and on first use, pins) the host key
     *
     * @param  host           The target host
     * @param  port           The target port
     * @param  key            The key presented by the server
     * @return                {@link TrustDecision#MATCH} or {@link TrustDecision#NOTFOUND} if the key was accepted
     * @throws RemshException {@link FailureKind#TRUST_MISMATCH}, or {@link FailureKind#TRUST_DECLINED} if the key was
     *                        not accepted or an existing known hosts file could not be read
     */
    public TrustDecision verify(String host, int port, HostKey key) throws RemshException {
        String hostId = canonicalHostId(host, port);
        Path file = knownHosts.getPath();
        if (mismatched.contains(hostId)) {
            throw new RemshException(FailureKind.TRUST_MISMATCH, "Host key for '" + hostId + "' has changed");
        }

        List<TrustEntry> entries;
        try {
            entries = knownHosts.load();
        } catch (IOException | RuntimeException e) {
            log.warn("verify({}) failed ({}) to load {}: {}", hostId, e.getClass().getSimpleName(), file, e.getMessage());
            diagnostics.warning("Cannot verify host key for '" + hostId + "': failed to read " + file + ": "
                                + e.getMessage());
            throw new RemshException(FailureKind.TRUST_DECLINED, "Failed to read known hosts file " + file, e)
                    .markReported();
        }

        TrustDecision decision = check(entries, hostId, key);
        switch (decision) {
            case MATCH:
                diagnostics.debug("Host key verified (" + key.getKeyType() + ") [" + file + "]");
                break;
            case NOTFOUND:
                acceptNewKey(hostId, key);
                break;
            case MISMATCH:
                mismatched.add(hostId);
                showMismatchBanner(hostId);
                throw new RemshException(FailureKind.TRUST_MISMATCH, "Host key for '" + hostId + "' has changed");
            default:
                throw new IllegalStateException("Unknown trust decision: " + decision);
        }
        return decision;
    }

    protected void acceptNewKey(String hostId, HostKey key) throws RemshException {
        diagnostics.warning("The authenticity of host '" + hostId + "' can't be established.");
        diagnostics.warning(key.getKeyType() + " key fingerprint is " + fingerprintOf(key) + ".");

        if (prompt.isInteractive()) {
            String answer;
            try {
                answer = prompt.readLine(CONFIRM_PROMPT);
            } catch (IOException e) {
                diagnostics.warning("Connection aborted.");
                throw new RemshException(FailureKind.TRUST_DECLINED, "Failed to read host key confirmation", e);
            }

            if (!isAffirmative(answer)) {
                diagnostics.warning("Connection aborted.");
                throw new RemshException(FailureKind.TRUST_DECLINED, "Host key for '" + hostId + "' not accepted");
            }
        } else {
            diagnostics.warning("Warning: non-interactive session, auto-accepting host key.");
        }

        Path file = knownHosts.getPath();
        try {
            knownHosts.append(TrustEntry.of(hostId, key));
            diagnostics.warning("Warning: permanently added '" + hostId + "' to " + file + ".");
        } catch (IOException e) {
            diagnostics.warning("Warning: could not write known_hosts: " + e.getMessage());
            log.warn("acceptNewKey({}) failed ({}) to save {}: {}",
                    hostId, e.getClass().getSimpleName(), file, e.getMessage());
        }
    }

    protected void showMismatchBanner(String hostId) {
        PrintStream err = diagnostics.getErrorStream();
        synchronized (err) {
            err.println("@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@");
            err.println("@    WARNING: REMOTE HOST IDENTIFICATION HAS CHANGED!     @");
            err.println("@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@@");
            err.println("IT IS POSSIBLE THAT SOMEONE IS DOING SOMETHING NASTY!");
            err.println("Host key for '" + hostId + "' has changed.");
            err.println("If the host key legitimately changed, remove the old entry:");
            err.println("  ssh-keygen -R " + hostId + " -f " + knownHosts.getPath());
            err.flush();
        }
    }

    protected String fingerprintOf(HostKey key) {
        try {
            return key.getFingerprint();
        } catch (Exception e) {
            log.warn("fingerprintOf({}) failed ({}): {}", key.getKeyType(), e.getClass().getSimpleName(), e.getMessage());
            return "(unavailable)";
        }
    }

    public static boolean isAffirmative(String answer) {
        String value = GenericUtils.trimToEmpty(answer).toLowerCase(Locale.ROOT);
        return "yes".equals(value) || "y".equals(value);
    }
}
