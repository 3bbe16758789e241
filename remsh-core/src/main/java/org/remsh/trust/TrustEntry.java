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

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

import org.apache.sshd.client.config.hosts.KnownHostHashValue;
import org.apache.sshd.common.SshConstants;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.ValidateUtils;
import org.remsh.transport.HostKey;

/**
 * A pinned (host pattern, key type, key blob) triple, optionally carrying an OpenSSH {@code @marker} or a hashed host
 * pattern. Equality is exact on all fields.
 */
public final class TrustEntry {
    public static final String REVOKED_MARKER = "revoked";

    private final String marker;
    private final String hostPattern;
    private final KnownHostHashValue hashedHost;
    private final String keyType;
    private final byte[] keyBlob;

    public TrustEntry(String hostPattern, String keyType, byte[] keyBlob) {
        this(null, hostPattern, null, keyType, keyBlob);
    }

    public TrustEntry(String marker, String hostPattern, KnownHostHashValue hashedHost, String keyType, byte[] keyBlob) {
        this.marker = marker;
        this.hostPattern = ValidateUtils.checkNotNullAndNotEmpty(hostPattern, "No host pattern");
        this.hashedHost = hashedHost;
        this.keyType = ValidateUtils.checkNotNullAndNotEmpty(keyType, "No key type");
        this.keyBlob = ValidateUtils.checkNotNullAndNotEmpty(keyBlob, "No key blob").clone();
    }

    public static TrustEntry of(String hostId, HostKey key) {
        return new TrustEntry(hostId, key.getKeyType(), key.getBlob());
    }

    /**
     * @return The {@code @marker} name without the indicator - {@code null} for a plain entry
     */
    public String getMarker() {
        return marker;
    }

    public boolean isRevoked() {
        return REVOKED_MARKER.equals(marker);
    }

    public String getHostPattern() {
        return hostPattern;
    }

    public String getKeyType() {
        return keyType;
    }

    public byte[] getKeyBlob() {
        return keyBlob.clone();
    }

    public boolean isKeyOf(HostKey key) {
        return key.matches(keyType, keyBlob);
    }

    /**
     * @param  hostId The canonical host identifier ({@code host} or {@code [host]:port})
     * @return        {@code true} if one of the comma separated names equals it exactly, or the hashed name is its
     *                hash
     */
    public boolean isHostMatch(String hostId) {
        if (hashedHost != null) {
            // the identifier already is the pattern OpenSSH hashes, so hash it as a default port name
            return hashedHost.isHostMatch(hostId, SshConstants.DEFAULT_PORT);
        }

        for (String name : GenericUtils.split(hostPattern, ',')) {
            if (hostId.equals(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return The persisted form - {@code host keytype base64}
     */
    public String toLine() {
        String line = hostPattern + " " + keyType + " " + Base64.getEncoder().encodeToString(keyBlob);
        return (marker == null) ? line : ("@" + marker + " " + line);
    }

    @Override
    public int hashCode() {
        return Objects.hash(marker, hostPattern, keyType, Arrays.hashCode(keyBlob));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if ((obj == null) || (getClass() != obj.getClass())) {
            return false;
        }

        TrustEntry other = (TrustEntry) obj;
        return Objects.equals(marker, other.marker)
                && hostPattern.equals(other.hostPattern)
                && keyType.equals(other.keyType)
                && Arrays.equals(keyBlob, other.keyBlob);
    }

    @Override
    public String toString() {
        return (marker == null) ? (hostPattern + " " + keyType) : ("@" + marker + " " + hostPattern + " " + keyType);
    }
}
