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
package org.remsh.forward;

import java.io.IOException;
import java.net.Socket;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.remsh.channel.PumpSupport;
import org.remsh.channel.StreamPump;
import org.remsh.common.Diagnostics;
import org.remsh.config.ForwardSpec;
import org.remsh.transport.RemoteChannel;
import org.remsh.transport.RemoteSession;

/**
 * Bridges one accepted local connection to its remote destination through a dedicated direct-tcpip channel. Both
 * the channel and the socket are closed when either direction reaches end of stream.
 */
public class TunnelConnection extends AbstractLoggingBean implements Runnable {
    private final RemoteSession session;
    private final ForwardSpec spec;
    private final Socket socket;
    private final ExecutorService executor;
    private final Diagnostics diagnostics;

    public TunnelConnection(
            RemoteSession session, ForwardSpec spec, Socket socket, ExecutorService executor, Diagnostics diagnostics) {
        this.session = Objects.requireNonNull(session, "No session");
        this.spec = Objects.requireNonNull(spec, "No forward spec");
        this.socket = Objects.requireNonNull(socket, "No socket");
        this.executor = Objects.requireNonNull(executor, "No executor");
        this.diagnostics = Objects.requireNonNull(diagnostics, "No diagnostics");
    }

    @Override
    public void run() {
        RemoteChannel channel;
        try {
            channel = session.openTunnelChannel(
                    spec.getRemoteHost(), spec.getRemotePort(), TunnelManager.LOCAL_ADDRESS, spec.getLocalPort());
        } catch (IOException | RuntimeException e) {
            diagnostics.debug("Port forward error: Failed to open direct-tcpip channel: " + e.getMessage());
            log.warn("run({}) failed ({}) to open channel: {}", spec, e.getClass().getSimpleName(), e.getMessage());
            closeSocket();
            return;
        }

        try {
            StreamPump outbound = new StreamPump("tunnel-out:" + spec, socket.getInputStream(), channel.getOutputStream());
            StreamPump inbound = new StreamPump("tunnel-in:" + spec, channel.getInputStream(), socket.getOutputStream());
            StreamPump winner = PumpSupport.awaitFirst(executor, outbound, inbound);
            if (log.isDebugEnabled()) {
                log.debug("run({}) connection from {} ended by {}", spec, socket.getRemoteSocketAddress(), winner);
            }
        } catch (IOException | RuntimeException e) {
            diagnostics.debug("Port forward error: " + e.getMessage());
            if (log.isDebugEnabled()) {
                log.debug("run({}) bridge failed ({}): {}", spec, e.getClass().getSimpleName(), e.getMessage());
            }
        } finally {
            closeChannel(channel);
            closeSocket();
        }
    }

    protected void closeChannel(RemoteChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            if (log.isDebugEnabled()) {
                log.debug("closeChannel({}) failed ({}): {}", spec, e.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    protected void closeSocket() {
        try {
            socket.close();
        } catch (IOException e) {
            if (log.isDebugEnabled()) {
                log.debug("closeSocket({}) failed ({}): {}", spec, e.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
