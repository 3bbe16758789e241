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

import java.util.Objects;

/**
 * Outcome of a single authentication attempt
 */
public final class AuthResult {
    private static final AuthResult SUCCESS = new AuthResult(true, null, null);

    private final boolean success;
    private final String reason;
    private final Throwable cause;

    private AuthResult(boolean success, String reason, Throwable cause) {
        this.success = success;
        this.reason = reason;
        this.cause = cause;
    }

    public static AuthResult success() {
        return SUCCESS;
    }

    public static AuthResult failure(String reason) {
        return failure(reason, null);
    }

    public static AuthResult failure(String reason, Throwable cause) {
        return new AuthResult(false, Objects.requireNonNull(reason, "No failure reason"), cause);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getReason() {
        return reason;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return success ? "SUCCESS" : ("FAILURE: " + reason);
    }
}
