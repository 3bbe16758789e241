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

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.remsh.common.Diagnostics;
import org.remsh.config.ForwardSpec;
import org.remsh.transport.RemoteSession;

/**
 * Listens on the loopback interface for one {@link ForwardSpec} and hands every accepted connection to its own
 * {@link TunnelConnection}. Per-connection failures never end the accept loop.
 */
public class LocalForwarder extends AbstractLoggingBean implements Closeable {
    private final RemoteSession session;
    private final ForwardSpec spec;
    private final ExecutorService executor;
    private final Diagnostics diagnostics;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private ServerSocket serverSocket;
    private Thread acceptThread;

    public LocalForwarder(RemoteSession session, ForwardSpec spec, ExecutorService executor, Diagnostics diagnostics) {
        this.session = Objects.requireNonNull(session, "No session");
        this.spec = Objects.requireNonNull(spec, "No forward spec");
        this.executor = Objects.requireNonNull(executor, "No executor");
        this.diagnostics = Objects.requireNonNull(diagnostics, "No diagnostics");
    }

    public ForwardSpec getSpec() {
        return spec;
    }

    /**
     * @return The actually bound port - {@code -1} if not bound
     */
    public synchronized int getBoundPort() {
        return (serverSocket == null) ? -1 : serverSocket.getLocalPort();
    }

    public boolean isOpen() {
        return !closed.get();
    }

    /**
     * Binds the listener and starts the accept loop
     *
     * @throws IOException If failed to bind
     */
    public synchronized void start() throws IOException {
        InetAddress loopback = InetAddress.getByName(TunnelManager.LOCAL_ADDRESS);
        ServerSocket ss = new ServerSocket();
        try {
            ss.setReuseAddress(true);
            ss.bind(new InetSocketAddress(loopback, spec.getLocalPort()));
        } catch (IOException e) {
            ss.close();
            throw e;
        }

        serverSocket = ss;
        acceptThread = new Thread(this::acceptLoop, "remsh-forward-" + spec.getLocalPort());
        acceptThread.setDaemon(true);
        acceptThread.start();
        diagnostics.debug("Local port forwarding: " + TunnelManager.LOCAL_ADDRESS + ":" + spec.getLocalPort()
                          + " -> " + spec.getRemoteHost() + ":" + spec.getRemotePort());
    }

    protected void acceptLoop() {
        ServerSocket ss;
        synchronized (this) {
            ss = serverSocket;
        }

        while (!closed.get()) {
            Socket socket;
            try {
                socket = ss.accept();
            } catch (IOException e) {
                if (!closed.get()) {
                    diagnostics.warning("Port forward listener error: " + e.getMessage());
                    log.warn("acceptLoop({}) listener failed ({}): {}",
                            spec, e.getClass().getSimpleName(), e.getMessage());
                    closeQuietly();
                }
                return;
            }

            diagnostics.debug("Accepted connection on local port " + spec.getLocalPort());
            try {
                executor.execute(new TunnelConnection(session, spec, socket, executor, diagnostics));
            } catch (RejectedExecutionException e) {
                log.warn("acceptLoop({}) handler rejected: {}", spec, e.getMessage());
                try {
                    socket.close();
                } catch (IOException ce) {
                    e.addSuppressed(ce);
                }
            }
        }
    }

    @Override
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        ServerSocket ss;
        synchronized (this) {
            ss = serverSocket;
        }
        if (ss != null) {
            ss.close();
        }
    }

    protected void closeQuietly() {
        try {
            close();
        } catch (IOException e) {
            if (log.isDebugEnabled()) {
                log.debug("closeQuietly({}) failed ({}): {}", spec, e.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + spec + "]";
    }
}
