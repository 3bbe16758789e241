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
package org.remsh.secret;

import java.util.Objects;

/**
 * Region and optional access keys for a {@link SecretFetcher}
 */
public final class SecretStoreCredentials {
    public static final String DEFAULT_REGION = "us-east-1";

    private final String region;
    private final String accessKeyId;
    private final String secretAccessKey;

    public SecretStoreCredentials(String region, String accessKeyId, String secretAccessKey) {
        this.region = Objects.requireNonNull(region, "No region");
        this.accessKeyId = accessKeyId;
        this.secretAccessKey = secretAccessKey;
    }

    public String getRegion() {
        return region;
    }

    /**
     * @return Explicit access key - {@code null} to use the fetcher's default credentials chain
     */
    public String getAccessKeyId() {
        return accessKeyId;
    }

    public String getSecretAccessKey() {
        return secretAccessKey;
    }

    @Override
    public String toString() {
        // never expose the keys
        return getClass().getSimpleName() + "[region=" + region + ", explicitKeys=" + (accessKeyId != null) + "]";
    }
}
