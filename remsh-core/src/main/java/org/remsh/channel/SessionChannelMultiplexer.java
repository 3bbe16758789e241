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
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.remsh.terminal.RawModeHandle;
import org.remsh.terminal.ResizeEventSource;
import org.remsh.terminal.TerminalModeController;
import org.remsh.terminal.TerminalSize;
import org.remsh.terminal.TerminalSizeProvider;
import org.remsh.transport.ExecChannel;
import org.remsh.transport.RemoteSession;
import org.remsh.transport.ShellChannel;

/**
 * Runs the foreground work of a connection: either a single remote command or an interactive shell, moving bytes
 * between the local streams and one remote channel.
 * <UL>
 * <LI>Exec mode - remote stdout and stderr are drained until both reach end of stream, and the remote exit status
 * becomes the result.</LI>
 * <LI>Shell mode - the local terminal is put into raw mode, a {@value #PTY_TYPE} pseudo-terminal of the local size is
 * requested and local resizes are forwarded. The mode ends as soon as either direction reaches end of stream; the
 * other pump is abandoned and unblocked by closing the channel. Result is zero.</LI>
 * </UL>
 */
public class SessionChannelMultiplexer extends AbstractLoggingBean {
    public static final String PTY_TYPE = "xterm-256color";
    public static final int DEFAULT_EXIT_STATUS = 0;

    private final RemoteSession session;
    private final InputStream stdin;
    private final OutputStream stdout;
    private final OutputStream stderr;
    private final ExecutorService executor;
    private TerminalModeController modeController = TerminalModeController.NONE;
    private TerminalSizeProvider sizeProvider = TerminalSizeProvider.FIXED_DEFAULT;
    private ResizeEventSource resizeSource = ResizeEventSource.NONE;

    public SessionChannelMultiplexer(
            RemoteSession session, InputStream stdin, OutputStream stdout, OutputStream stderr,
            ExecutorService executor) {
        this.session = Objects.requireNonNull(session, "No session");
        this.stdin = Objects.requireNonNull(stdin, "No stdin");
        this.stdout = Objects.requireNonNull(stdout, "No stdout");
        this.stderr = Objects.requireNonNull(stderr, "No stderr");
        this.executor = Objects.requireNonNull(executor, "No executor");
    }

    public TerminalModeController getModeController() {
        return modeController;
    }

    public void setModeController(TerminalModeController modeController) {
        this.modeController = Objects.requireNonNull(modeController, "No mode controller");
    }

    public TerminalSizeProvider getSizeProvider() {
        return sizeProvider;
    }

    public void setSizeProvider(TerminalSizeProvider sizeProvider) {
        this.sizeProvider = Objects.requireNonNull(sizeProvider, "No size provider");
    }

    public ResizeEventSource getResizeSource() {
        return resizeSource;
    }

    public void setResizeSource(ResizeEventSource resizeSource) {
        this.resizeSource = Objects.requireNonNull(resizeSource, "No resize source");
    }

    /**
     * @param  command     The one-shot command - {@code null}/empty for an interactive shell
     * @return             The remote exit status in exec mode, zero in shell mode
     * @throws IOException If the channel could not be opened or a pump failed
     */
    public int run(String command) throws IOException {
        return GenericUtils.isEmpty(command) ? runShell() : runExec(command);
    }

    public int runExec(String command) throws IOException {
        if (log.isDebugEnabled()) {
            log.debug("runExec({})", command);
        }

        try (ExecChannel channel = session.openExecChannel(command)) {
            StreamPump errPump = new StreamPump("exec-stderr", channel.getErrorStream(), stderr);
            Future<Long> errDone = executor.submit(errPump);
            StreamPump outPump = new StreamPump("exec-stdout", channel.getInputStream(), stdout);
            outPump.call();
            PumpSupport.getResult(errPump, errDone);

            Integer status = channel.getExitStatus();
            int exitStatus = (status == null) ? DEFAULT_EXIT_STATUS : status;
            if (log.isDebugEnabled()) {
                log.debug("runExec({}) exit status={}", command, status);
            }
            return exitStatus;
        }
    }

    public int runShell() throws IOException {
        try (RawModeHandle rawMode = modeController.enterRawMode()) {
            TerminalSize size = sizeProvider.getSize();
            if (log.isDebugEnabled()) {
                log.debug("runShell() open {} pty of size {}", PTY_TYPE, size);
            }

            try (ShellChannel channel = session.openShellChannel(PTY_TYPE, size.getColumns(), size.getRows());
                 ResizeEventSource.Registration resizeRegistration = resizeSource.register(s -> resize(channel, s))) {
                StreamPump remoteToLocal = new StreamPump("shell-out", channel.getInputStream(), stdout);
                StreamPump localToRemote = new StreamPump(
                        "shell-in", stdin, channel.getOutputStream(), StreamPump.INPUT_BUFFER_SIZE);
                StreamPump winner = PumpSupport.awaitFirst(executor, remoteToLocal, localToRemote);
                if (log.isDebugEnabled()) {
                    log.debug("runShell() ended by {}", winner);
                }
            }
        }

        return DEFAULT_EXIT_STATUS;
    }

    protected void resize(ShellChannel channel, TerminalSize size) {
        try {
            channel.resize(size.getColumns(), size.getRows());
        } catch (IOException e) {
            log.warn("resize({}) failed ({}): {}", size, e.getClass().getSimpleName(), e.getMessage());
        }
    }
}
