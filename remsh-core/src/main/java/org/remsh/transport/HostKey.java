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

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

import org.apache.sshd.common.digest.BuiltinDigests;
import org.apache.sshd.common.digest.DigestUtils;
import org.apache.sshd.common.util.ValidateUtils;

/**
 * The public key a server presented during key exchange, as (key type, raw SSH wire blob).
 */
public final class HostKey {
    private final String keyType;
    private final byte[] blob;

    public HostKey(String keyType, byte[] blob) {
        this.keyType = ValidateUtils.checkNotNullAndNotEmpty(keyType, "No key type");
        this.blob = ValidateUtils.checkNotNullAndNotEmpty(blob, "No key blob").clone();
    }

    public String getKeyType() {
        return keyType;
    }

    public byte[] getBlob() {
        return blob.clone();
    }

    public String getEncodedBlob() {
        return Base64.getEncoder().encodeToString(blob);
    }

    /**
     * @return {@code SHA256:} followed by the unpadded base64 of the SHA-256 digest of the blob
     * @throws Exception If the digest is not available
     */
    public String getFingerprint() throws Exception {
        return DigestUtils.getFingerPrint(BuiltinDigests.sha256, blob);
    }

    public boolean matches(String type, byte[] data) {
        return keyType.equals(type) && Arrays.equals(blob, data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyType, Arrays.hashCode(blob));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if ((obj == null) || (getClass() != obj.getClass())) {
            return false;
        }

        HostKey other = (HostKey) obj;
        return matches(other.keyType, other.blob);
    }

    @Override
    public String toString() {
        return keyType + " " + getEncodedBlob();
    }
}
