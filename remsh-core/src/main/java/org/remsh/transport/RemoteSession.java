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

import java.io.Closeable;
import java.io.IOException;

/**
 * An established (but not necessarily authenticated) connection to a server. Only the connection supervisor closes
 * it; every other component borrows it.
 */
public interface RemoteSession extends Closeable {
    /**
     * @return The key the server presented during key exchange
     * @throws IOException If no key is available
     */
    HostKey getHostKey() throws IOException;

    /**
     * Attempts a single login with the given credential. Failure is reported in the result, not thrown.
     *
     * @param  credential The {@link Credential} to try
     * @return            The attempt outcome
     */
    AuthResult authenticate(Credential credential);

    ExecChannel openExecChannel(String command) throws IOException;

    ShellChannel openShellChannel(String ptyType, int columns, int rows) throws IOException;

    /**
     * Opens a direct-tcpip channel
     *
     * @param  remoteHost  Destination host as seen from the server
     * @param  remotePort  Destination port
     * @param  originHost  Originating address reported to the server
     * @param  originPort  Originating port reported to the server
     * @return             The open channel
     * @throws IOException If the server refused or the open timed out
     */
    RemoteChannel openTunnelChannel(String remoteHost, int remotePort, String originHost, int originPort)
            throws IOException;

    void configureKeepalive(boolean wantReply, int intervalSeconds);

    /**
     * @return {@code true} if the probe was delivered and (when a reply was requested) answered
     */
    boolean sendKeepalive();

    boolean isOpen();
}
