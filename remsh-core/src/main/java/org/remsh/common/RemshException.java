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

import java.io.IOException;
import java.util.Objects;

/**
 * Represents a classified failure of the client. The {@link FailureKind} decides whether the supervisor retries and
 * which exit status the process reports.
 */
public class RemshException extends IOException {
    private static final long serialVersionUID = 4562170993357541235L;

    private final FailureKind kind;
    private volatile boolean reported;

    public RemshException(FailureKind kind, String message) {
        this(kind, message, null);
    }

    public RemshException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "No failure kind");
    }

    public FailureKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    /**
     * @return {@code true} if the failure was already shown to the user where it happened
     */
    public boolean isReported() {
        return reported;
    }

    public RemshException markReported() {
        this.reported = true;
        return this;
    }

    /**
     * @return The status the process should exit with when this failure reaches the top level
     */
    public int getExitStatus() {
        return FailureKind.FATAL_EXIT_STATUS;
    }

    /**
     * Wraps an arbitrary failure - if it is already a {@link RemshException} then it is returned as-is, otherwise it
     * is classified as a {@link FailureKind#PROTOCOL_ERROR}.
     *
     * @param  t The failure
     * @return   The classified exception
     */
    public static RemshException classify(Throwable t) {
        if (t instanceof RemshException) {
            return (RemshException) t;
        }

        String msg = t.getMessage();
        if (msg == null) {
            msg = t.getClass().getSimpleName();
        }
        return new RemshException(FailureKind.PROTOCOL_ERROR, msg, t);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + kind + "]: " + getMessage();
    }
}
