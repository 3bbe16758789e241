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
package org.remsh.terminal;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.apache.sshd.common.util.threads.ThreadUtils;

/**
 * Detects terminal resizes by periodically re-reading the size and comparing it with the last one seen. Each
 * registration owns its own scheduler thread, shut down when the registration is closed.
 * <P>
 * With {@link SttyTerminalSizeProvider} every poll starts an {@code sh -c stty} child process, so the default interval
 * is kept at one second. A resize is forwarded at most that late.
 * </P>
 */
public class PollingResizeEventSource extends AbstractLoggingBean implements ResizeEventSource {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1L);

    private final TerminalSizeProvider sizeProvider;
    private final Duration pollInterval;

    public PollingResizeEventSource(TerminalSizeProvider sizeProvider) {
        this(sizeProvider, DEFAULT_POLL_INTERVAL);
    }

    public PollingResizeEventSource(TerminalSizeProvider sizeProvider, Duration pollInterval) {
        this.sizeProvider = Objects.requireNonNull(sizeProvider, "No size provider");
        this.pollInterval = Objects.requireNonNull(pollInterval, "No poll interval");
    }

    @Override
    public Registration register(ResizeListener listener) {
        Objects.requireNonNull(listener, "No listener");
        AtomicReference<TerminalSize> last = new AtomicReference<>(sizeProvider.getSize());
        ScheduledExecutorService scheduler = ThreadUtils.newSingleThreadScheduledExecutor("remsh-resize");
        long millis = pollInterval.toMillis();
        ScheduledFuture<?> task = scheduler.scheduleWithFixedDelay(() -> {
            TerminalSize current = sizeProvider.getSize();
            TerminalSize previous = last.getAndSet(current);
            if (!current.equals(previous)) {
                if (log.isDebugEnabled()) {
                    log.debug("poll() terminal resized from {} to {}", previous, current);
                }
                try {
                    listener.terminalResized(current);
                } catch (RuntimeException e) {
                    log.warn("poll() listener failed ({}): {}", e.getClass().getSimpleName(), e.getMessage());
                }
            }
        }, millis, millis, TimeUnit.MILLISECONDS);

        return () -> {
            task.cancel(false);
            scheduler.shutdownNow();
        };
    }
}
