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
package org.remsh.common;

/**
 * Classifies why a connection attempt (or the whole run) ended.
 */
public enum FailureKind {
    CONNECT_TIMEOUT(true),
    CONNECTION_REFUSED(true),
    AUTH_EXHAUSTED(false),
    TRUST_MISMATCH(false),
    TRUST_DECLINED(false),
    FORWARD_SPEC_INVALID(false),
    LISTENER_BIND_FAILURE(false),
    KEEPALIVE_EXHAUSTED(false),
    CONFIG_ERROR(false),
    PROTOCOL_ERROR(false);

    /** Process exit status used for every fatal kind */
    public static final int FATAL_EXIT_STATUS = 1;

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * @return {@code true} if the supervisor may consume another connection attempt after this failure
     */
    public boolean isRetryable() {
        return retryable;
    }
}
