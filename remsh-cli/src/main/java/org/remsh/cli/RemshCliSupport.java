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
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.apache.sshd.agent.SshAgent;
import org.apache.sshd.client.config.hosts.ConfigFileHostEntryResolver;
import org.apache.sshd.client.config.hosts.DefaultConfigFileHostEntryResolver;
import org.apache.sshd.client.config.hosts.HostConfigEntry;
import org.apache.sshd.client.config.hosts.HostConfigEntryResolver;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.io.PathUtils;
import org.apache.sshd.common.util.io.output.NoCloseOutputStream;
import org.remsh.common.FailureKind;
import org.remsh.common.RemshException;
import org.remsh.config.ForwardSpec;
import org.remsh.config.ResolvedConfig;
import org.remsh.secret.SecretFetcher;
import org.remsh.secret.SecretStoreCredentials;

/**
 * Command line parsing and configuration resolution of the {@code remsh} tool
 */
public abstract class RemshCliSupport {
    public static final String PORT_OPTION = "-p";
    public static final String SERVER_ALIVE_INTERVAL_CONFIG_PROP = "ServerAliveInterval";
    public static final String CONNECT_TIMEOUT_CONFIG_PROP = "ConnectTimeout";
    public static final String CONNECTION_ATTEMPTS_CONFIG_PROP = "ConnectionAttempts";
    public static final String DEFAULT_USER = "root";

    public static final String USAGE = "Usage: remsh [options] [user@]host [command]";

    protected RemshCliSupport() {
        super();
    }

    public static boolean isArgumentedOption(String argName) {
        return PORT_OPTION.equals(argName)
                || "--port".equals(argName)
                || "-l".equals(argName)
                || "--login".equals(argName)
                || "-i".equals(argName)
                || "--identity".equals(argName)
                || "-o".equals(argName)
                || "-L".equals(argName)
                || "-F".equals(argName)
                || "--ssm-secret-path".equals(argName)
                || "--aws-region".equals(argName)
                || "--aws-access-key-id".equals(argName)
                || "--aws-secret-access-key".equals(argName);
    }

    /**
     * Parses the command line. Options are only recognized before the target - everything after it is the remote
     * command.
     *
     * @param  stderr Where errors are reported
     * @param  args   The arguments
     * @return        The parsed options - {@code null} if an error was reported
     */
    // CHECKSTYLE:OFF
    public static RemshOptions parseCommandLine(PrintStream stderr, String... args) {
        RemshOptions options = new RemshOptions();

        String target = null;
        int numArgs = GenericUtils.length(args);
        for (int i = 0; i < numArgs; i++) {
            String argName = args[i];
            if (target != null) {
                options.addCommandArgument(argName);
                continue;
            }

            String argVal = null;
            int eqPos = argName.indexOf('=');
            if (argName.startsWith("--") && (eqPos > 0)) {
                argVal = argName.substring(eqPos + 1);
                argName = argName.substring(0, eqPos);
            } else if (isArgumentedOption(argName)) {
                i++;
                if (i >= numArgs) {
                    CliLogger.showError(stderr, "option requires an argument: " + argName);
                    return null;
                }
                argVal = args[i];
            }

            if (PORT_OPTION.equals(argName) || "--port".equals(argName)) {
                int port = parsePort(argVal);
                if (port <= 0) {
                    CliLogger.showError(stderr, "invalid port '" + argVal + "'");
                    return null;
                }
                options.setPort(port);
            } else if ("-l".equals(argName) || "--login".equals(argName)) {
                options.setLogin(argVal);
            } else if ("-i".equals(argName) || "--identity".equals(argName)) {
                Path idFile = Paths.get(PathUtils.normalizePath(argVal));
                if (!Files.exists(idFile)) {
                    CliLogger.showError(stderr, "key file not found: " + argVal);
                    return null;
                }
                options.setIdentity(idFile);
            } else if ("-A".equals(argName) || "--no-agent".equals(argName)) {
                options.setNoAgent(true);
            } else if ("-o".equals(argName)) {
                if (!parseOption(stderr, options, argVal)) {
                    return null;
                }
            } else if ("-L".equals(argName)) {
                try {
                    options.addForward(ForwardSpec.parse(argVal));
                } catch (RemshException e) {
                    CliLogger.showError(stderr, e.getMessage());
                    return null;
                }
            } else if ("-F".equals(argName)) {
                options.setConfigFile(Paths.get(PathUtils.normalizePath(argVal)));
            } else if ("--ssm-secret-path".equals(argName)) {
                options.setSsmSecretPath(argVal);
            } else if ("--aws-region".equals(argName)) {
                options.setAwsRegion(argVal);
            } else if ("--aws-access-key-id".equals(argName)) {
                options.setAwsAccessKeyId(argVal);
            } else if ("--aws-secret-access-key".equals(argName)) {
                options.setAwsSecretAccessKey(argVal);
            } else if ("--no-known-hosts".equals(argName)) {
                options.setNoKnownHosts(true);
            } else if ("-d".equals(argName) || "--debug".equals(argName)) {
                options.setDebug(true);
            } else if (CliLogger.isVerbosityOption(argName)) {
                options.setVerbosity(CliLogger.resolveLoggingVerbosity(argName));
            } else if ("-V".equals(argName) || "--version".equals(argName)) {
                options.setShowVersion(true);
                return options;
            } else if ("-h".equals(argName) || "--help".equals(argName)) {
                options.setShowHelp(true);
                return options;
            } else if (argName.startsWith("-")) {
                CliLogger.showError(stderr, "unknown option: " + argName);
                return null;
            } else {
                target = argName;
            }
        }

        if ((options.getIdentity() != null) && (options.getSsmSecretPath() != null)) {
            CliLogger.showError(stderr, "--identity and --ssm-secret-path are mutually exclusive.");
            return null;
        }

        if (target == null) {
            CliLogger.showError(stderr, "host required.");
            stderr.println(USAGE);
            return null;
        }

        String host = target;
        int pos = target.indexOf('@');
        if (pos >= 0) {
            options.setLogin(target.substring(0, pos));
            host = target.substring(pos + 1);
        }
        if (GenericUtils.isEmpty(host)) {
            CliLogger.showError(stderr, "host cannot be empty.");
            return null;
        }
        options.setHost(host);
        return options;
    }
    // CHECKSTYLE:ON

    /**
     * Handles a {@code -o Key=Value} option. Unknown keys only produce a warning.
     *
     * @param  stderr  Where errors are reported
     * @param  options The options being built
     * @param  opt     The option text
     * @return         {@code false} if an error was reported
     */
    public static boolean parseOption(PrintStream stderr, RemshOptions options, String opt) {
        int idx = opt.indexOf('=');
        if (idx <= 0) {
            return !CliLogger.showError(stderr, "bad syntax for option: " + opt);
        }

        String optName = opt.substring(0, idx).trim();
        String optValue = opt.substring(idx + 1).trim();
        if (CONNECT_TIMEOUT_CONFIG_PROP.equalsIgnoreCase(optName)) {
            options.setConnectTimeoutSeconds(Math.max(parseInt(optValue, 0), 0));
        } else if (CONNECTION_ATTEMPTS_CONFIG_PROP.equalsIgnoreCase(optName)) {
            options.setConnectionAttempts(Math.max(parseInt(optValue, 1), 1));
        } else if (SERVER_ALIVE_INTERVAL_CONFIG_PROP.equalsIgnoreCase(optName)) {
            options.setServerAliveInterval(Math.max(parseInt(optValue, 0), 0));
        } else if ("UserKnownHostsFile".equalsIgnoreCase(optName)) {
            options.setKnownHostsFile(Paths.get(PathUtils.normalizePath(optValue)));
        } else if (HostConfigEntry.EXCLUSIVE_IDENTITIES_CONFIG_PROP.equalsIgnoreCase(optName)) {
            options.setIdentitiesOnly(parseYesNo(optValue));
        } else {
            CliLogger.showWarning(stderr, "unsupported option '" + optName + "'");
        }
        return true;
    }

    public static HostConfigEntryResolver resolveHostConfigResolver(Path configFile) {
        return (configFile == null)
                ? DefaultConfigFileHostEntryResolver.INSTANCE
                : new ConfigFileHostEntryResolver(configFile);
    }

    /**
     * Combines the command line options with the host configuration file. Command line values win.
     *
     * @param  options     The parsed command line
     * @param  resolver    The host configuration resolver
     * @param  env         The process environment
     * @param  inMemoryKey Key material fetched from a secret store - may be {@code null}
     * @return             The resolved configuration
     * @throws IOException If failed to read the host configuration
     */
    public static ResolvedConfig resolveConfig(
            RemshOptions options, HostConfigEntryResolver resolver, Map<String, String> env, String inMemoryKey)
            throws IOException {
        String alias = options.getHost();
        HostConfigEntry entry = resolver.resolveEffectiveHost(
                alias, Math.max(options.getPort(), 0), null, options.getLogin(), null, null);

        ResolvedConfig.Builder builder = ResolvedConfig.builder();
        String hostName = (entry == null) ? null : entry.getHostName();
        builder.host(GenericUtils.isEmpty(hostName) ? alias : hostName);

        int port = options.getPort();
        if ((port <= 0) && (entry != null)) {
            port = entry.getPort();
        }
        builder.port((port > 0) ? port : ResolvedConfig.DEFAULT_PORT);

        String username = options.getLogin();
        if (GenericUtils.isEmpty(username) && (entry != null)) {
            username = entry.getUsername();
        }
        if (GenericUtils.isEmpty(username)) {
            username = resolveDefaultUser(env);
        }
        builder.username(username);

        Path identity = options.getIdentity();
        if ((identity == null) && (entry != null)) {
            identity = findFirstExisting(entry.getIdentities());
        }
        builder.identity(identity);

        Boolean identitiesOnly = options.getIdentitiesOnly();
        builder.identitiesOnly((identitiesOnly != null) ? identitiesOnly : ((entry != null) && entry.isIdentitiesOnly()));

        Path knownHosts = options.getKnownHostsFile();
        if ((knownHosts == null) && (entry != null)) {
            String value = entry.getProperty("UserKnownHostsFile");
            if (GenericUtils.isNotEmpty(value)) {
                // only the first file of a list is used
                knownHosts = Paths.get(PathUtils.normalizePath(value.trim().split("\\s+")[0]));
            }
        }
        builder.knownHostsPath(knownHosts);

        Integer aliveInterval = options.getServerAliveInterval();
        if ((aliveInterval == null) && (entry != null)) {
            aliveInterval = Math.max(parseInt(entry.getProperty(SERVER_ALIVE_INTERVAL_CONFIG_PROP), 0), 0);
        }
        builder.serverAliveInterval((aliveInterval == null) ? 0 : aliveInterval);

        Integer timeout = options.getConnectTimeoutSeconds();
        if ((timeout != null) && (timeout > 0)) {
            builder.connectTimeout(Duration.ofSeconds(timeout));
        }
        Integer attempts = options.getConnectionAttempts();
        if (attempts != null) {
            builder.attemptCount(attempts);
        }

        return builder.noAgent(options.isNoAgent())
                .agentEndpoint(env.get(SshAgent.SSH_AUTHSOCKET_ENV_NAME))
                .skipHostKeyCheck(options.isNoKnownHosts())
                .forwards(options.getForwards())
                .debug(options.isDebug())
                .command(options.getCommandLine())
                .inMemoryKey(inMemoryKey)
                .build();
    }

    public static String resolveDefaultUser(Map<String, String> env) {
        String user = env.get("USER");
        return GenericUtils.isEmpty(user) ? DEFAULT_USER : user;
    }

    public static SecretStoreCredentials resolveSecretStoreCredentials(RemshOptions options, Map<String, String> env) {
        String region = options.getAwsRegion();
        if (GenericUtils.isEmpty(region)) {
            region = env.get("AWS_REGION");
        }
        if (GenericUtils.isEmpty(region)) {
            region = env.get("AWS_DEFAULT_REGION");
        }
        if (GenericUtils.isEmpty(region)) {
            region = SecretStoreCredentials.DEFAULT_REGION;
        }

        String accessKey = options.getAwsAccessKeyId();
        if (GenericUtils.isEmpty(accessKey)) {
            accessKey = env.get("AWS_ACCESS_KEY_ID");
        }
        String secretKey = options.getAwsSecretAccessKey();
        if (GenericUtils.isEmpty(secretKey)) {
            secretKey = env.get("AWS_SECRET_ACCESS_KEY");
        }
        return new SecretStoreCredentials(region, accessKey, secretKey);
    }

    /**
     * @param  loader         The {@link ClassLoader} to search
     * @return                The first registered {@link SecretFetcher}
     * @throws RemshException {@link FailureKind#CONFIG_ERROR} if none is registered
     */
    public static SecretFetcher loadSecretFetcher(ClassLoader loader) throws RemshException {
        Iterator<SecretFetcher> iter = ServiceLoader.load(SecretFetcher.class, loader).iterator();
        if (!iter.hasNext()) {
            throw new RemshException(FailureKind.CONFIG_ERROR,
                    "No " + SecretFetcher.class.getSimpleName() + " implementation available for --ssm-secret-path");
        }
        return iter.next();
    }

    public static Path findFirstExisting(Collection<String> paths) {
        if (GenericUtils.isEmpty(paths)) {
            return null;
        }

        List<Path> candidates = new ArrayList<>(paths.size());
        for (String p : paths) {
            candidates.add(Paths.get(PathUtils.normalizePath(p)));
        }
        for (Path p : candidates) {
            if (Files.exists(p)) {
                return p;
            }
        }
        return null;
    }

    public static int parsePort(String value) {
        int port = parseInt(value, -1);
        return ((port > 0) && (port <= ForwardSpec.MAX_PORT)) ? port : -1;
    }

    public static int parseInt(String value, int defaultValue) {
        if (GenericUtils.isEmpty(value)) {
            return defaultValue;
        }

        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static boolean parseYesNo(String value) {
        String v = GenericUtils.trimToEmpty(value).toLowerCase(Locale.ROOT);
        return "yes".equals(v) || "true".equals(v);
    }

    public static Handler setupLogging(Level level, PrintStream stdout, PrintStream stderr, OutputStream outputStream) {
        Handler fh = new ConsoleHandler() {
            {
                setOutputStream(outputStream); // override the default (stderr)
            }

            @Override
            protected synchronized void setOutputStream(OutputStream out) throws SecurityException {
                if ((out == stdout) || (out == stderr)) {
                    super.setOutputStream(new NoCloseOutputStream(out));
                } else {
                    super.setOutputStream(out);
                }
            }
        };
        fh.setLevel(Level.FINEST);
        fh.setFormatter(new Formatter() {
            @Override
            public String format(LogRecord record) {
                String message = formatMessage(record);
                String throwable = "";
                Throwable t = record.getThrown();
                if (t != null) {
                    StringWriter sw = new StringWriter();
                    try (PrintWriter pw = new PrintWriter(sw)) {
                        pw.println();
                        t.printStackTrace(pw); // NOPMD
                    }
                    throwable = sw.toString();
                }
                return String.format("%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS: %2$-7.7s: %3$-32.32s: %4$s%5$s%n",
                        new Date(record.getMillis()), record.getLevel().getName(),
                        record.getLoggerName(), message, throwable);
            }
        });

        Logger root = Logger.getLogger("");
        for (Handler handler : root.getHandlers()) {
            root.removeHandler(handler);
        }
        root.addHandler(fh);
        root.setLevel(level);
        return fh;
    }
}
