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
package org.remsh.config;

import java.util.Objects;

import org.apache.sshd.common.util.GenericUtils;
import org.remsh.common.FailureKind;
import org.remsh.common.RemshException;

/**
 * A local port forwarding request - {@code local_port:remote_host:remote_port}
 */
public final class ForwardSpec {
    public static final int MAX_PORT = 0xFFFF;

    private final int localPort;
    private final String remoteHost;
    private final int remotePort;

    public ForwardSpec(int localPort, String remoteHost, int remotePort) {
        this.localPort = checkPort(localPort, "local");
        this.remoteHost = Objects.requireNonNull(remoteHost, "No remote host");
        this.remotePort = checkPort(remotePort, "remote");
    }

    public int getLocalPort() {
        return localPort;
    }

    public String getRemoteHost() {
        return remoteHost;
    }

    public int getRemotePort() {
        return remotePort;
    }

    /**
     * Parses a forwarding specification
     *
     * @param  spec            The {@code local_port:remote_host:remote_port} value
     * @return                 The parsed {@link ForwardSpec}
     * @throws RemshException  A {@link FailureKind#FORWARD_SPEC_INVALID} failure if the value is malformed
     */
    public static ForwardSpec parse(String spec) throws RemshException {
        if (GenericUtils.isEmpty(GenericUtils.trimToEmpty(spec))) {
            throw invalid(spec, "empty specification");
        }

        String[] parts = spec.split(":", -1);
        if (parts.length != 3) {
            throw invalid(spec, "expected local_port:remote_host:remote_port");
        }

        int local = parsePort(spec, parts[0]);
        String host = parts[1].trim();
        if (host.isEmpty()) {
            throw invalid(spec, "missing remote host");
        }
        int remote = parsePort(spec, parts[2]);
        return new ForwardSpec(local, host, remote);
    }

    private static int parsePort(String spec, String value) throws RemshException {
        int port;
        try {
            port = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw invalid(spec, "bad port number '" + value + "'");
        }

        if ((port <= 0) || (port > MAX_PORT)) {
            throw invalid(spec, "port out of range: " + port);
        }
        return port;
    }

    private static RemshException invalid(String spec, String reason) {
        return new RemshException(FailureKind.FORWARD_SPEC_INVALID,
                "Invalid forward specification '" + spec + "': " + reason);
    }

    private static int checkPort(int port, String which) {
        if ((port <= 0) || (port > MAX_PORT)) {
            throw new IllegalArgumentException("Invalid " + which + " port: " + port);
        }
        return port;
    }

    @Override
    public int hashCode() {
        return Objects.hash(localPort, remoteHost, remotePort);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if ((obj == null) || (getClass() != obj.getClass())) {
            return false;
        }

        ForwardSpec other = (ForwardSpec) obj;
        return (localPort == other.localPort)
                && (remotePort == other.remotePort)
                && remoteHost.equals(other.remoteHost);
    }

    @Override
    public String toString() {
        return localPort + ":" + remoteHost + ":" + remotePort;
    }
}
