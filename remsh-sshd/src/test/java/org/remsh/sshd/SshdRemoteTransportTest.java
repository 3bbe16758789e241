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

import java.io.IOException;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

import org.apache.sshd.common.SshException;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.remsh.common.FailureKind;
import org.remsh.common.RemshException;
import org.remsh.util.test.BaseTestSupport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
public class SshdRemoteTransportTest extends BaseTestSupport {
    public SshdRemoteTransportTest() {
        super();
    }

    @Test
    void wrappedConnectExceptionIsRefused() {
        IOException failure = new IOException("connect failed", new ConnectException("Connection refused"));
        RemshException e = SshdRemoteTransport.classifyConnectFailure("h", 22, failure);
        assertEquals(FailureKind.CONNECTION_REFUSED, e.getKind(), "Mismatched kind");
        assertTrue(e.isRetryable(), "Refused connection not retryable");
        assertSame(failure, e.getCause(), "Mismatched cause");
        assertEquals("Connection refused: h:22", e.getMessage(), "Mismatched message");
    }

    @Test
    void socketTimeoutIsConnectTimeout() {
        RemshException e = SshdRemoteTransport.classifyConnectFailure("h", 2222, new SocketTimeoutException("timeout"));
        assertEquals(FailureKind.CONNECT_TIMEOUT, e.getKind(), "Mismatched kind");
        assertTrue(e.isRetryable(), "Timeout not retryable");
    }

    @Test
    void otherFailureIsProtocolError() {
        RemshException e = SshdRemoteTransport.classifyConnectFailure("h", 22, new SshException("bad banner"));
        assertEquals(FailureKind.PROTOCOL_ERROR, e.getKind(), "Mismatched kind");
        assertFalse(e.isRetryable(), "Protocol error retryable");
    }

    @Test
    void connectToClosedPortIsRefused() throws Exception {
        int port = getFreePort();
        try (SshdRemoteTransport transport = new SshdRemoteTransport()) {
            RemshException e = assertThrows(RemshException.class,
                    () -> transport.connect(TEST_LOCALHOST, port, "remsh", CONNECT_TIMEOUT));
            assertEquals(FailureKind.CONNECTION_REFUSED, e.getKind(), "Mismatched kind: " + e);
        }
    }

    @Test
    void peerClosingBeforeKeyExchangeIsProtocolError() throws Exception {
        try (ServerSocket server = new ServerSocket()) {
            server.bind(new InetSocketAddress(InetAddress.getByName(TEST_LOCALHOST), 0));
            Thread closer = new Thread(() -> {
                try (Socket socket = server.accept()) {
                    socket.getOutputStream().write("HTTP/1.0 400 Bad Request\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
                } catch (IOException e) {
                    System.err.println("closer ended: " + e.getMessage());
                }
            }, "kex-closer");
            closer.setDaemon(true);
            closer.start();

            try (SshdRemoteTransport transport = new SshdRemoteTransport()) {
                RemshException e = assertThrows(RemshException.class,
                        () -> transport.connect(TEST_LOCALHOST, server.getLocalPort(), "remsh", CONNECT_TIMEOUT));
                assertEquals(FailureKind.PROTOCOL_ERROR, e.getKind(), "Mismatched kind: " + e);
                assertFalse(e.isRetryable(), "Protocol error retryable");
            }
        }
    }
}
