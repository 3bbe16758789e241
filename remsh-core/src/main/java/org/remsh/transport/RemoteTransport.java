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

import java.io.Closeable;
import java.time.Duration;

import org.remsh.common.RemshException;

/**
 * Entry point into the underlying SSH provider
 */
public interface RemoteTransport extends Closeable {
    /**
     * Opens a fresh connection and completes key exchange
     *
     * @param  host           Target host
     * @param  port           Target port
     * @param  username       Login user
     * @param  connectTimeout Bound on the connect and key exchange phase
     * @return                The new session
     * @throws RemshException {@code CONNECT_TIMEOUT} or {@code CONNECTION_REFUSED} for retryable failures, any other
     *                        kind otherwise
     */
    RemoteSession connect(String host, int port, String username, Duration connectTimeout) throws RemshException;
}
