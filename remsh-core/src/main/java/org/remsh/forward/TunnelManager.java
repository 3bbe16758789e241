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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.remsh.common.Diagnostics;
import org.remsh.common.FailureKind;
import org.remsh.common.RemshException;
import org.remsh.config.ForwardSpec;
import org.remsh.transport.RemoteSession;

/**
 * Owns the local port forwarding listeners of one session
 */
public class TunnelManager extends AbstractLoggingBean implements Closeable {
    public static final String LOCAL_ADDRESS = "127.0.0.1";

    private final RemoteSession session;
    private final ExecutorService executor;
    private final Diagnostics diagnostics;
    private final List<LocalForwarder> forwarders = new ArrayList<>();

    public TunnelManager(RemoteSession session, ExecutorService executor, Diagnostics diagnostics) {
        this.session = Objects.requireNonNull(session, "No session");
        this.executor = Objects.requireNonNull(executor, "No executor");
        this.diagnostics = Objects.requireNonNull(diagnostics, "No diagnostics");
    }

    public synchronized List<LocalForwarder> getForwarders() {
        return Collections.unmodifiableList(new ArrayList<>(forwarders));
    }

    /**
     * Binds a listener per spec. A bind failure does not prevent the other listeners from starting, but is reported
     * and then raised once all specs were processed.
     *
     * @param  specs          The forwards to start
     * @throws RemshException {@link FailureKind#LISTENER_BIND_FAILURE} if any listener could not be bound
     */
    public void start(List<ForwardSpec> specs) throws RemshException {
        if (GenericUtils.isEmpty(specs)) {
            return;
        }

        List<String> failures = new ArrayList<>();
        for (ForwardSpec spec : specs) {
            LocalForwarder forwarder = new LocalForwarder(session, spec, executor, diagnostics);
            try {
                forwarder.start();
            } catch (IOException e) {
                String message = "Port forward " + spec + ": cannot bind " + LOCAL_ADDRESS + ":" + spec.getLocalPort()
                                 + ": " + e.getMessage();
                diagnostics.error(message);
                log.warn("start({}) bind failed ({}): {}", spec, e.getClass().getSimpleName(), e.getMessage());
                failures.add(message);
                continue;
            }

            synchronized (this) {
                forwarders.add(forwarder);
            }
        }

        if (!failures.isEmpty()) {
            throw new RemshException(FailureKind.LISTENER_BIND_FAILURE, GenericUtils.join(failures, "; ")).markReported();
        }
    }

    @Override
    public void close() throws IOException {
        List<LocalForwarder> toClose;
        synchronized (this) {
            toClose = new ArrayList<>(forwarders);
            forwarders.clear();
        }

        IOException err = null;
        for (LocalForwarder f : toClose) {
            try {
                f.close();
            } catch (IOException e) {
                if (err == null) {
                    err = e;
                } else {
                    err.addSuppressed(e);
                }
            }
        }

        if (err != null) {
            throw err;
        }
    }
}
