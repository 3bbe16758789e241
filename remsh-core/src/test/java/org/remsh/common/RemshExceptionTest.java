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

import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.remsh.util.test.BaseTestSupport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
public class RemshExceptionTest extends BaseTestSupport {
    public RemshExceptionTest() {
        super();
    }

    @Test
    void onlyConnectFailuresAreRetryable() {
        for (FailureKind kind : FailureKind.values()) {
            boolean expected = (kind == FailureKind.CONNECT_TIMEOUT) || (kind == FailureKind.CONNECTION_REFUSED);
            assertEquals(expected, kind.isRetryable(), kind.name());
            assertEquals(FailureKind.FATAL_EXIT_STATUS, new RemshException(kind, "x").getExitStatus(), kind.name());
        }
    }

    @Test
    void classifyKeepsRemshExceptions() {
        RemshException e = new RemshException(FailureKind.TRUST_DECLINED, "declined");
        assertSame(e, RemshException.classify(e));
    }

    @Test
    void classifyWrapsOthersAsProtocolErrors() {
        IOException cause = new IOException("broken pipe");
        RemshException e = RemshException.classify(cause);
        assertEquals(FailureKind.PROTOCOL_ERROR, e.getKind());
        assertEquals("broken pipe", e.getMessage());
        assertSame(cause, e.getCause());
        assertFalse(e.isRetryable());

        assertTrue(RemshException.classify(new IllegalStateException()).getMessage().contains("IllegalStateException"));
    }

    @Test
    void reportedMarkSurvivesClassification() {
        RemshException e = new RemshException(FailureKind.AUTH_EXHAUSTED, "no method");
        assertFalse(e.isReported(), "Reported before marking");
        assertSame(e, e.markReported(), "Mark not chained");
        assertTrue(RemshException.classify(e).isReported(), "Mark lost by classification");
    }
}
