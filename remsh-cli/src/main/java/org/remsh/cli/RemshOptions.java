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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;

import org.remsh.config.ForwardSpec;

/**
 * The values given on the command line, before the host configuration file is applied
 */
public class RemshOptions {
    private String host;
    private String login;
    private int port = -1;
    private Path identity;
    private boolean noAgent;
    private Integer connectTimeoutSeconds;
    private Integer connectionAttempts;
    private Integer serverAliveInterval;
    private Path knownHostsFile;
    private Boolean identitiesOnly;
    private final List<ForwardSpec> forwards = new ArrayList<>();
    private String ssmSecretPath;
    private String awsRegion;
    private String awsAccessKeyId;
    private String awsSecretAccessKey;
    private boolean noKnownHosts;
    private Path configFile;
    private boolean debug;
    private Level verbosity = Level.WARNING;
    private boolean showVersion;
    private boolean showHelp;
    private final List<String> command = new ArrayList<>();

    public RemshOptions() {
        super();
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public String getLogin() {
        return login;
    }

    public void setLogin(String login) {
        this.login = login;
    }

    /**
     * @return The explicit port - non-positive if not specified
     */
    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public Path getIdentity() {
        return identity;
    }

    public void setIdentity(Path identity) {
        this.identity = identity;
    }

    public boolean isNoAgent() {
        return noAgent;
    }

    public void setNoAgent(boolean noAgent) {
        this.noAgent = noAgent;
    }

    public Integer getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public void setConnectTimeoutSeconds(Integer connectTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    public Integer getConnectionAttempts() {
        return connectionAttempts;
    }

    public void setConnectionAttempts(Integer connectionAttempts) {
        this.connectionAttempts = connectionAttempts;
    }

    public Integer getServerAliveInterval() {
        return serverAliveInterval;
    }

    public void setServerAliveInterval(Integer serverAliveInterval) {
        this.serverAliveInterval = serverAliveInterval;
    }

    public Path getKnownHostsFile() {
        return knownHostsFile;
    }

    public void setKnownHostsFile(Path knownHostsFile) {
        this.knownHostsFile = knownHostsFile;
    }

    public Boolean getIdentitiesOnly() {
        return identitiesOnly;
    }

    public void setIdentitiesOnly(Boolean identitiesOnly) {
        this.identitiesOnly = identitiesOnly;
    }

    public List<ForwardSpec> getForwards() {
        return Collections.unmodifiableList(forwards);
    }

    public void addForward(ForwardSpec spec) {
        forwards.add(spec);
    }

    public String getSsmSecretPath() {
        return ssmSecretPath;
    }

    public void setSsmSecretPath(String ssmSecretPath) {
        this.ssmSecretPath = ssmSecretPath;
    }

    public String getAwsRegion() {
        return awsRegion;
    }

    public void setAwsRegion(String awsRegion) {
        this.awsRegion = awsRegion;
    }

    public String getAwsAccessKeyId() {
        return awsAccessKeyId;
    }

    public void setAwsAccessKeyId(String awsAccessKeyId) {
        this.awsAccessKeyId = awsAccessKeyId;
    }

    public String getAwsSecretAccessKey() {
        return awsSecretAccessKey;
    }

    public void setAwsSecretAccessKey(String awsSecretAccessKey) {
        this.awsSecretAccessKey = awsSecretAccessKey;
    }

    public boolean isNoKnownHosts() {
        return noKnownHosts;
    }

    public void setNoKnownHosts(boolean noKnownHosts) {
        this.noKnownHosts = noKnownHosts;
    }

    public Path getConfigFile() {
        return configFile;
    }

    public void setConfigFile(Path configFile) {
        this.configFile = configFile;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public Level getVerbosity() {
        return verbosity;
    }

    public void setVerbosity(Level verbosity) {
        this.verbosity = verbosity;
    }

    public boolean isShowVersion() {
        return showVersion;
    }

    public void setShowVersion(boolean showVersion) {
        this.showVersion = showVersion;
    }

    public boolean isShowHelp() {
        return showHelp;
    }

    public void setShowHelp(boolean showHelp) {
        this.showHelp = showHelp;
    }

    public List<String> getCommand() {
        return Collections.unmodifiableList(command);
    }

    public void addCommandArgument(String arg) {
        command.add(arg);
    }

    /**
     * @return The command arguments joined with spaces - {@code null} if none given
     */
    public String getCommandLine() {
        return command.isEmpty() ? null : String.join(" ", command);
    }
}
