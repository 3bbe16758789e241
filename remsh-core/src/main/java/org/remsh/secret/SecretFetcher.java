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

import java.io.IOException;

/**
 * Fetches private key contents from a remote secret store. The result is only ever kept in memory.
 * Implementations are discovered through {@link java.util.ServiceLoader}.
 */
public interface SecretFetcher {
    /**
     * @param  secretPath  Identifier of the secret
     * @param  credentials Region and access credentials of the store
     * @return             The private key contents
     * @throws IOException If the secret could not be fetched
     */
    String fetch(String secretPath, SecretStoreCredentials credentials) throws IOException;
}
