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

import java.time.Duration;

import org.apache.sshd.common.Property;

/**
 * Tunables of the MINA SSHD transport binding, resolved from the client/session properties
 */
public final class SshdTransportProperties {
    /**
     * Timeout of a single authentication attempt
     */
    public static final Property<Duration> AUTH_TIMEOUT
            = Property.duration("remsh-auth-timeout", Duration.ofMinutes(2));

    /**
     * Timeout for opening an exec, shell or direct-tcpip channel
     */
    public static final Property<Duration> CHANNEL_OPEN_TIMEOUT
            = Property.duration("remsh-channel-open-timeout", Duration.ofSeconds(30));

    /**
     * How long to wait for the exit status once the remote command closed its output streams
     */
    public static final Property<Duration> EXIT_STATUS_TIMEOUT
            = Property.duration("remsh-exit-status-timeout", Duration.ofSeconds(5));

    /**
     * Upper bound on waiting for the reply to a keepalive probe
     */
    public static final Property<Duration> KEEPALIVE_REPLY_TIMEOUT
            = Property.duration("remsh-keepalive-reply-timeout", Duration.ofSeconds(15));

    /**
     * Global request name used for keepalive probes
     */
    public static final String KEEPALIVE_REQUEST = "keepalive@openssh.com";

    private SshdTransportProperties() {
        throw new UnsupportedOperationException("No instance");
    }
}
