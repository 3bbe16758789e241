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
package org.remsh.util.test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * An in-memory pipe usable from any pair of threads: reads block until data is written or the pipe is closed
 */
public class ByteQueue {
    private final Deque<byte[]> chunks = new ArrayDeque<>();
    private int offset;
    private boolean closed;

    private final InputStream input = new InputStream() {
        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            int n = read(one, 0, 1);
            return (n <= 0) ? -1 : (one[0] & 0xFF);
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            return ByteQueue.this.read(b, off, len);
        }

        @Override
        public void close() {
            ByteQueue.this.close();
        }
    };

    private final OutputStream output = new OutputStream() {
        @Override
        public void write(int b) throws IOException {
            write(new byte[] { (byte) b }, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            ByteQueue.this.write(b, off, len);
        }

        @Override
        public void close() {
            ByteQueue.this.close();
        }
    };

    public ByteQueue() {
        super();
    }

    public InputStream getInputStream() {
        return input;
    }

    public OutputStream getOutputStream() {
        return output;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized void close() {
        closed = true;
        notifyAll();
    }

    protected synchronized void write(byte[] b, int off, int len) throws IOException {
        if (closed) {
            throw new IOException("Pipe closed");
        }
        if (len > 0) {
            chunks.addLast(Arrays.copyOfRange(b, off, off + len));
            notifyAll();
        }
    }

    protected synchronized int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }

        while (chunks.isEmpty()) {
            if (closed) {
                return -1;
            }
            try {
                wait();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while reading", e);
            }
        }

        byte[] head = chunks.peekFirst();
        int n = Math.min(len, head.length - offset);
        System.arraycopy(head, offset, b, off, n);
        offset += n;
        if (offset >= head.length) {
            chunks.removeFirst();
            offset = 0;
        }
        return n;
    }
}
