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
package org.remsh.channel;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;
import java.util.concurrent.Callable;

import org.apache.sshd.common.util.ValidateUtils;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;

/**
 * Copies bytes from one stream to another until end of input, flushing after every write. Byte order is preserved
 * exactly. The result is the number of bytes copied.
 */
public class StreamPump extends AbstractLoggingBean implements Callable<Long> {
    public static final int DEFAULT_BUFFER_SIZE = 4096;
    public static final int INPUT_BUFFER_SIZE = 256;

    private final String name;
    private final InputStream in;
    private final OutputStream out;
    private final int bufferSize;

    public StreamPump(String name, InputStream in, OutputStream out) {
        this(name, in, out, DEFAULT_BUFFER_SIZE);
    }

    public StreamPump(String name, InputStream in, OutputStream out, int bufferSize) {
        this.name = ValidateUtils.checkNotNullAndNotEmpty(name, "No pump name");
        this.in = Objects.requireNonNull(in, "No input");
        this.out = Objects.requireNonNull(out, "No output");
        ValidateUtils.checkTrue(bufferSize > 0, "Invalid buffer size: %d", bufferSize);
        this.bufferSize = bufferSize;
    }

    public String getName() {
        return name;
    }

    @Override
    public Long call() throws IOException {
        byte[] buf = new byte[bufferSize];
        long total = 0L;
        for (int n = in.read(buf); n > 0; n = in.read(buf)) {
            out.write(buf, 0, n);
            out.flush();
            total += n;
        }

        if (log.isTraceEnabled()) {
            log.trace("call({}) end of stream after {} bytes", name, total);
        }
        return total;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
