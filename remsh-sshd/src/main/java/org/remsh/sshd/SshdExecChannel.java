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

import java.io.InputStream;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

import org.apache.sshd.client.channel.ChannelExec;
import org.apache.sshd.client.channel.ClientChannelEvent;
import org.apache.sshd.common.PropertyResolver;
import org.remsh.transport.ExecChannel;

public class SshdExecChannel extends SshdChannelAdapter<ChannelExec> implements ExecChannel {
    private final PropertyResolver properties;

    public SshdExecChannel(ChannelExec channel, PropertyResolver properties) {
        super(channel);
        this.properties = properties;
    }

    @Override
    public InputStream getErrorStream() {
        return channel.getInvertedErr();
    }

    /**
     * Waits (bounded) for the server to report the exit status, which may arrive after the output streams end
     */
    @Override
    public Integer getExitStatus() {
        Integer status = channel.getExitStatus();
        if (status != null) {
            return status;
        }

        Duration timeout = SshdTransportProperties.EXIT_STATUS_TIMEOUT.getRequired(properties);
        Set<ClientChannelEvent> events
                = channel.waitFor(EnumSet.of(ClientChannelEvent.EXIT_STATUS, ClientChannelEvent.CLOSED), timeout);
        if (events.contains(ClientChannelEvent.TIMEOUT)) {
            return null;
        }
        return channel.getExitStatus();
    }
}
