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
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

import org.apache.sshd.client.channel.ClientChannel;
import org.remsh.transport.RemoteChannel;

/**
 * Exposes the inverted streams of an opened MINA {@link ClientChannel}
 *
 * @param <C> Type of the wrapped channel
 */
public abstract class SshdChannelAdapter<C extends ClientChannel> implements RemoteChannel {
    protected final C channel;

    protected SshdChannelAdapter(C channel) {
        this.channel = Objects.requireNonNull(channel, "No channel");
    }

    public C getChannel() {
        return channel;
    }

    @Override
    public InputStream getInputStream() {
        return channel.getInvertedOut();
    }

    @Override
    public OutputStream getOutputStream() {
        return channel.getInvertedIn();
    }

    /**
     * Closes gracefully - data already written is sent before the channel is closed
     */
    @Override
    public void close() throws IOException {
        channel.close(false);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + channel + "]";
    }
}
