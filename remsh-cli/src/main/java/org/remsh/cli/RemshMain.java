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
package org.remsh.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.io.input.NoCloseInputStream;
import org.apache.sshd.common.util.io.output.NoCloseOutputStream;
import org.apache.sshd.common.util.threads.ThreadUtils;
import org.remsh.channel.SessionChannelMultiplexer;
import org.remsh.common.Diagnostics;
import org.remsh.common.RemshException;
import org.remsh.config.ResolvedConfig;
import org.remsh.secret.SecretFetcher;
import org.remsh.secret.SecretStoreCredentials;
import org.remsh.sshd.SshdRemoteTransport;
import org.remsh.supervisor.ConnectionSupervisor;
import org.remsh.supervisor.MultiplexerFactory;
import org.remsh.terminal.PollingResizeEventSource;
import org.remsh.terminal.RawModeHandle;
import org.remsh.terminal.ShellInputTerminalDetector;
import org.remsh.terminal.SttyTerminalModeController;
import org.remsh.terminal.SttyTerminalSizeProvider;
import org.remsh.terminal.TerminalModeController;
import org.remsh.transport.RemoteTransport;
import org.remsh.trust.HostKeyPrompt;
import org.remsh.trust.TrustStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the {@code remsh} command line tool
 */
public class RemshMain extends RemshCliSupport {
    public static final String VERSION = "0.4.0";
    public static final int USAGE_EXIT_STATUS = 1;

    protected RemshMain() {
        super(); // in case someone wants to extend it
    }

    //////////////////////////////////////////////////////////////////////////

    public static void main(String[] args) {
        int status = run(System.in, System.out, System.err, System.getenv(), args);
        System.exit(status);
    }

    /**
     * Runs the tool and reports the result as a process exit status
     *
     * @param  stdin  Local input
     * @param  stdout Local output
     * @param  stderr Local error output
     * @param  env    The process environment
     * @param  args   The command line arguments
     * @return        The exit status
     */
    public static int run(InputStream stdin, PrintStream stdout, PrintStream stderr, Map<String, String> env, String... args) {
        RemshOptions options = parseCommandLine(stderr, args);
        if (options == null) {
            return USAGE_EXIT_STATUS;
        }
        if (options.isShowVersion()) {
            stdout.println("remsh " + VERSION);
            return 0;
        }
        if (options.isShowHelp()) {
            stdout.println(usage());
            return 0;
        }

        setupLogging(options.getVerbosity(), stdout, stderr, stderr);

        Diagnostics diagnostics = new Diagnostics(stderr, options.isDebug());
        try (RemoteTransport transport = new SshdRemoteTransport()) {
            ResolvedConfig config = resolveConfig(options, resolveHostConfigResolver(options.getConfigFile()), env,
                    fetchInMemoryKey(options, env, diagnostics));
            // only a terminal on the real process input makes the run interactive
            boolean interactive = (stdin == System.in) && new ShellInputTerminalDetector().isInputTerminal();
            return execute(config, transport, interactive, stdin, stdout, stderr, diagnostics);
        } catch (RemshException e) {
            if (!e.isReported()) {
                diagnostics.error(e.getMessage());
            }
            return e.getExitStatus();
        } catch (IOException | RuntimeException e) {
            Logger log = LoggerFactory.getLogger(RemshMain.class);
            log.debug("run({}) failed", options.getHost(), e);
            diagnostics.error(e.getMessage());
            if (options.isDebug()) {
                CliLogger.printStackTrace(stderr, e);
            }
            return RemshException.classify(e).getExitStatus();
        }
    }

    /**
     * @param  config         The resolved settings
     * @param  transport      The SSH provider
     * @param  interactive    Whether the local input is a terminal - enables the host key prompt, raw mode and resize
     *                        forwarding
     * @param  stdin          Local input
     * @param  stdout         Local output
     * @param  stderr         Local error output
     * @param  diagnostics    Message sink
     * @return                The remote exit status
     * @throws RemshException If the session failed
     */
    public static int execute(
            ResolvedConfig config, RemoteTransport transport, boolean interactive,
            InputStream stdin, PrintStream stdout, PrintStream stderr, Diagnostics diagnostics)
            throws RemshException {
        HostKeyPrompt prompt = interactive ? new ConsoleHostKeyPrompt(stdin, stderr) : HostKeyPrompt.NON_INTERACTIVE;
        TrustStore trustStore = config.isSkipHostKeyCheck()
                ? null
                : new TrustStore(config.getKnownHostsPath(), prompt, diagnostics);

        ExecutorService executor = ThreadUtils.newCachedThreadPool("remsh");
        try {
            MultiplexerFactory multiplexerFactory = session -> {
                SessionChannelMultiplexer multiplexer = new SessionChannelMultiplexer(session,
                        new NoCloseInputStream(stdin), new NoCloseOutputStream(stdout), new NoCloseOutputStream(stderr),
                        executor);
                if (interactive) {
                    multiplexer.setModeController(restoreOnExit(new SttyTerminalModeController()));
                    multiplexer.setSizeProvider(SttyTerminalSizeProvider.INSTANCE);
                    multiplexer.setResizeSource(new PollingResizeEventSource(SttyTerminalSizeProvider.INSTANCE));
                }
                return multiplexer;
            };

            ConnectionSupervisor supervisor = new ConnectionSupervisor(
                    config, transport, trustStore, multiplexerFactory, executor, diagnostics);
            return supervisor.run();
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Makes sure the terminal settings are restored even if the process is ended while the terminal is in raw mode
     *
     * @param  delegate The actual controller
     * @return          A controller whose handles are also closed on JVM shutdown
     */
    public static TerminalModeController restoreOnExit(TerminalModeController delegate) {
        return () -> {
            RawModeHandle handle = delegate.enterRawMode();
            Thread hook = new Thread(handle::close, "remsh-restore-terminal");
            Runtime.getRuntime().addShutdownHook(hook);
            return () -> {
                handle.close();
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException e) {
                    // shutdown in progress - the hook runs anyway and the handle restores only once
                    LoggerFactory.getLogger(RemshMain.class).trace("restoreOnExit() {}", e.getMessage());
                }
            };
        };
    }

    public static String fetchInMemoryKey(RemshOptions options, Map<String, String> env, Diagnostics diagnostics)
            throws IOException {
        String secretPath = options.getSsmSecretPath();
        if (GenericUtils.isEmpty(secretPath)) {
            return null;
        }

        SecretStoreCredentials credentials = resolveSecretStoreCredentials(options, env);
        diagnostics.debug("Fetching key from secret store " + secretPath + " (" + credentials.getRegion() + ")");
        SecretFetcher fetcher = loadSecretFetcher(RemshMain.class.getClassLoader());
        return fetcher.fetch(secretPath, credentials);
    }

    public static String usage() {
        return String.join(System.lineSeparator(),
                USAGE,
                "",
                "Options:",
                "  -p, --port PORT               remote port (default 22)",
                "  -l, --login USER              remote user name",
                "  -i, --identity FILE           private key file",
                "  -A, --no-agent                do not use ssh-agent",
                "  -o KEY=VALUE                  ConnectTimeout, ConnectionAttempts, ServerAliveInterval,",
                "                                UserKnownHostsFile, IdentitiesOnly",
                "  -L LOCAL:HOST:REMOTE          forward a local port through the remote host",
                "  -F FILE                       alternative ssh_config file",
                "  --ssm-secret-path PATH        fetch the private key from a secret store",
                "  --aws-region REGION           secret store region",
                "  --aws-access-key-id ID        secret store access key id",
                "  --aws-secret-access-key KEY   secret store secret access key",
                "  --no-known-hosts              disable host key checking (insecure)",
                "  -d, --debug                   show debug messages",
                "  -v, -vv, -vvv                 library logging verbosity",
                "  -V, --version                 show the version",
                "  -h, --help                    show this help");
    }
}
