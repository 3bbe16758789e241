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
import java.io.InterruptedIOException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;

import org.remsh.common.RemshException;

/**
 * Runs pairs of {@link StreamPump}s where the first one to finish ends the pair
 */
public final class PumpSupport {
    private PumpSupport() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * Starts both pumps on the executor and waits for either of them to finish. The other pump is left running: it
     * is expected to end once the caller closes the streams it is blocked on.
     *
     * @param  executor    The {@link Executor} running the pumps
     * @param  first       First pump
     * @param  second      Second pump
     * @return             The pump that finished first
     * @throws IOException If the first pump to finish failed
     */
    public static StreamPump awaitFirst(Executor executor, StreamPump first, StreamPump second) throws IOException {
        CompletionService<Long> completion = new ExecutorCompletionService<>(executor);
        Future<Long> f1 = completion.submit(first);
        completion.submit(second);

        Future<Long> done;
        try {
            done = completion.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw (IOException) new InterruptedIOException("Interrupted while waiting for pumps").initCause(e);
        }

        StreamPump winner = (done == f1) ? first : second;
        getResult(winner, done);
        return winner;
    }

    /**
     * @param  pump        The pump that produced the future
     * @param  future      A completed (or soon to complete) pump future
     * @return             Number of bytes the pump copied
     * @throws IOException If the pump failed
     */
    public static long getResult(StreamPump pump, Future<Long> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw (IOException) new InterruptedIOException("Interrupted while waiting for " + pump).initCause(e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw RemshException.classify(cause);
        }
    }
}
