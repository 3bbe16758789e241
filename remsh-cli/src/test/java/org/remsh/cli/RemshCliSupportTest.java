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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.apache.sshd.client.config.hosts.ConfigFileHostEntryResolver;
import org.apache.sshd.client.config.hosts.HostConfigEntryResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.remsh.common.FailureKind;
import org.remsh.common.RemshException;
import org.remsh.config.ForwardSpec;
import org.remsh.config.ResolvedConfig;
import org.remsh.secret.SecretStoreCredentials;
import org.remsh.util.test.BaseTestSupport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
public class RemshCliSupportTest extends BaseTestSupport {
    private ByteArrayOutputStream errBytes;
    private PrintStream stderr;

    public RemshCliSupportTest() {
        super();
    }

    @BeforeEach
    void setUpStreams() {
        errBytes = new ByteArrayOutputStream();
        stderr = new PrintStream(errBytes, true);
    }

    @Test
    void targetWithUserAndCommand() {
        RemshOptions options = parse("-p", "2222", "alice@example.com", "ls", "-la", "/tmp");
        assertNotNull(options, "Parse failed: " + errors());
        assertEquals("example.com", options.getHost(), "Mismatched host");
        assertEquals("alice", options.getLogin(), "Mismatched login");
        assertEquals(2222, options.getPort(), "Mismatched port");
        assertEquals(Arrays.asList("ls", "-la", "/tmp"), options.getCommand(), "Mismatched command");
        assertEquals("ls -la /tmp", options.getCommandLine(), "Mismatched command line");
    }

    @Test
    void noCommandMeansShell() {
        RemshOptions options = parse("example.com");
        assertNotNull(options, "Parse failed: " + errors());
        assertNull(options.getCommandLine(), "Unexpected command");
        assertTrue(options.getPort() <= 0, "Unexpected explicit port");
    }

    @Test
    void optionsAfterTargetBelongToCommand() {
        RemshOptions options = parse("host", "-p", "1");
        assertNotNull(options, "Parse failed: " + errors());
        assertTrue(options.getPort() <= 0, "Port parsed from command");
        assertEquals("-p 1", options.getCommandLine(), "Mismatched command line");
    }

    @Test
    void longOptionsWithValues() {
        RemshOptions options = parse("--port=2200", "--login", "bob", "--no-agent", "--debug", "host");
        assertNotNull(options, "Parse failed: " + errors());
        assertEquals(2200, options.getPort(), "Mismatched port");
        assertEquals("bob", options.getLogin(), "Mismatched login");
        assertTrue(options.isNoAgent(), "No-agent not set");
        assertTrue(options.isDebug(), "Debug not set");
    }

    @Test
    void invalidPortIsRejected() {
        assertNull(parse("-p", "70000", "host"), "Out of range port accepted");
        assertTrue(errors().contains("invalid port '70000'"), "Missing error: " + errors());
    }

    @Test
    void missingOptionArgument() {
        assertNull(parse("-l"), "Missing argument accepted");
        assertTrue(errors().contains("option requires an argument: -l"), "Missing error: " + errors());
    }

    @Test
    void unknownOption() {
        assertNull(parse("--frobnicate", "host"), "Unknown option accepted");
        assertTrue(errors().contains("unknown option: --frobnicate"), "Missing error: " + errors());
    }

    @Test
    void missingHost() {
        assertNull(parse("-A"), "Missing host accepted");
        String text = errors();
        assertTrue(text.contains("host required."), "Missing error: " + text);
        assertTrue(text.contains(RemshCliSupport.USAGE), "Missing usage: " + text);
    }

    @Test
    void emptyHostAfterUser() {
        assertNull(parse("alice@"), "Empty host accepted");
        assertTrue(errors().contains("host cannot be empty."), "Missing error: " + errors());
    }

    @Test
    void missingIdentityFile() throws Exception {
        Path missing = createTempTestFolder().resolve("no-such-key");
        assertNull(parse("-i", missing.toString(), "host"), "Missing key file accepted");
        assertTrue(errors().contains("key file not found: "), "Missing error: " + errors());
    }

    @Test
    void identityAndSecretPathAreExclusive() throws Exception {
        Path key = Files.write(createTempTestFolder().resolve("id_test"), "key".getBytes(StandardCharsets.UTF_8));
        assertNull(parse("-i", key.toString(), "--ssm-secret-path", "/keys/test", "host"), "Exclusive options accepted");
        assertTrue(errors().contains("mutually exclusive"), "Missing error: " + errors());
    }

    @Test
    void forwardSpecifications() throws Exception {
        RemshOptions options = parse("-L", "8080:db:5432", "-L", "9090:cache:6379", "host");
        assertNotNull(options, "Parse failed: " + errors());
        assertEquals(Arrays.asList(ForwardSpec.parse("8080:db:5432"), ForwardSpec.parse("9090:cache:6379")),
                options.getForwards(), "Mismatched forwards");
    }

    @Test
    void malformedForwardSpecification() {
        assertNull(parse("-L", "8080:db", "host"), "Malformed forward accepted");
        assertTrue(errors().contains("Invalid forward specification '8080:db'"), "Missing error: " + errors());
    }

    @Test
    void supportedConfigOptions() {
        RemshOptions options = parse(
                "-o", "ConnectTimeout=5", "-o", "ConnectionAttempts=0", "-o", "ServerAliveInterval=30",
                "-o", "IdentitiesOnly=yes", "host");
        assertNotNull(options, "Parse failed: " + errors());
        assertEquals(Integer.valueOf(5), options.getConnectTimeoutSeconds(), "Mismatched connect timeout");
        assertEquals(Integer.valueOf(1), options.getConnectionAttempts(), "Attempts not clamped");
        assertEquals(Integer.valueOf(30), options.getServerAliveInterval(), "Mismatched alive interval");
        assertEquals(Boolean.TRUE, options.getIdentitiesOnly(), "Mismatched identities only");
    }

    @Test
    void unsupportedConfigOptionOnlyWarns() {
        RemshOptions options = parse("-o", "Compression=yes", "host");
        assertNotNull(options, "Unsupported option rejected: " + errors());
        assertTrue(errors().contains("unsupported option 'Compression'"), "Missing warning: " + errors());
    }

    @Test
    void badConfigOptionSyntax() {
        assertNull(parse("-o", "Compression", "host"), "Bad syntax accepted");
        assertTrue(errors().contains("bad syntax for option: Compression"), "Missing error: " + errors());
    }

    @Test
    void versionStopsParsing() {
        RemshOptions options = parse("-V", "--frobnicate");
        assertNotNull(options, "Version option rejected");
        assertTrue(options.isShowVersion(), "Version not requested");
    }

    @Test
    void configFileValuesApplied() throws Exception {
        Path folder = createTempTestFolder();
        Path identity = Files.write(folder.resolve("id_box"), "key".getBytes(StandardCharsets.UTF_8));
        Path knownHosts = folder.resolve("box_known_hosts");
        Path configFile = writeConfig(folder,
                "Host box",
                "    HostName 10.0.0.5",
                "    User deploy",
                "    Port 2200",
                "    IdentityFile " + folder.resolve("id_missing"),
                "    IdentityFile " + identity,
                "    UserKnownHostsFile " + knownHosts + " " + folder.resolve("other_known_hosts"),
                "    ServerAliveInterval 15",
                "    IdentitiesOnly yes");

        RemshOptions options = parse("box");
        assertNotNull(options, "Parse failed: " + errors());
        ResolvedConfig config = RemshCliSupport.resolveConfig(
                options, new ConfigFileHostEntryResolver(configFile), Collections.emptyMap(), null);
        assertEquals("10.0.0.5", config.getHost(), "Mismatched host");
        assertEquals(2200, config.getPort(), "Mismatched port");
        assertEquals("deploy", config.getUsername(), "Mismatched user");
        assertEquals(identity, config.getIdentity(), "Mismatched identity");
        assertEquals(knownHosts, config.getKnownHostsPath(), "Mismatched known hosts");
        assertEquals(15, config.getServerAliveInterval(), "Mismatched alive interval");
        assertTrue(config.isIdentitiesOnly(), "Identities only not applied");
    }

    @Test
    void commandLineOverridesConfigFile() throws Exception {
        Path folder = createTempTestFolder();
        Path configFile = writeConfig(folder,
                "Host box",
                "    HostName 10.0.0.5",
                "    User deploy",
                "    Port 2200",
                "    ServerAliveInterval 15");

        RemshOptions options = parse("-p", "2022", "-o", "ServerAliveInterval=0", "admin@box");
        assertNotNull(options, "Parse failed: " + errors());
        ResolvedConfig config = RemshCliSupport.resolveConfig(
                options, new ConfigFileHostEntryResolver(configFile), Collections.emptyMap(), null);
        assertEquals("10.0.0.5", config.getHost(), "Mismatched host");
        assertEquals(2022, config.getPort(), "Mismatched port");
        assertEquals("admin", config.getUsername(), "Mismatched user");
        assertEquals(0, config.getServerAliveInterval(), "Alive interval not overridden");
    }

    @Test
    void defaultsWithoutHostConfiguration() throws Exception {
        RemshOptions options = parse("-A", "-o", "ConnectTimeout=7", "-o", "ConnectionAttempts=3", "box", "uptime");
        assertNotNull(options, "Parse failed: " + errors());

        Map<String, String> env = new HashMap<>();
        env.put("USER", "carol");
        env.put("SSH_AUTH_SOCK", "/tmp/agent.sock");
        ResolvedConfig config = RemshCliSupport.resolveConfig(options, HostConfigEntryResolver.EMPTY, env, "KEY DATA");
        assertEquals("box", config.getHost(), "Mismatched host");
        assertEquals(ResolvedConfig.DEFAULT_PORT, config.getPort(), "Mismatched port");
        assertEquals("carol", config.getUsername(), "Mismatched user");
        assertNull(config.getIdentity(), "Unexpected identity");
        assertTrue(config.isNoAgent(), "No-agent not applied");
        assertEquals("/tmp/agent.sock", config.getAgentEndpoint(), "Mismatched agent endpoint");
        assertEquals(Duration.ofSeconds(7L), config.getConnectTimeout(), "Mismatched connect timeout");
        assertEquals(3, config.getAttemptCount(), "Mismatched attempts");
        assertEquals("uptime", config.getCommand(), "Mismatched command");
        assertEquals("KEY DATA", config.getInMemoryKey(), "Mismatched in-memory key");
        assertFalse(config.isSkipHostKeyCheck(), "Host key check skipped");
    }

    @Test
    void zeroConnectTimeoutKeepsDefault() throws Exception {
        RemshOptions options = parse("-o", "ConnectTimeout=0", "box");
        assertNotNull(options, "Parse failed: " + errors());
        ResolvedConfig config = RemshCliSupport.resolveConfig(
                options, HostConfigEntryResolver.EMPTY, Collections.emptyMap(), null);
        assertEquals(ResolvedConfig.DEFAULT_CONNECT_TIMEOUT, config.getConnectTimeout(), "Mismatched timeout");
        assertEquals(RemshCliSupport.DEFAULT_USER, config.getUsername(), "Mismatched fallback user");
    }

    @Test
    void secretStoreRegionResolution() {
        RemshOptions options = new RemshOptions();
        Map<String, String> env = new HashMap<>();
        assertEquals(SecretStoreCredentials.DEFAULT_REGION,
                RemshCliSupport.resolveSecretStoreCredentials(options, env).getRegion(), "Mismatched default region");

        env.put("AWS_DEFAULT_REGION", "eu-west-1");
        assertEquals("eu-west-1",
                RemshCliSupport.resolveSecretStoreCredentials(options, env).getRegion(), "Mismatched default env region");

        env.put("AWS_REGION", "eu-central-1");
        assertEquals("eu-central-1",
                RemshCliSupport.resolveSecretStoreCredentials(options, env).getRegion(), "Mismatched env region");

        options.setAwsRegion("ap-south-1");
        assertEquals("ap-south-1",
                RemshCliSupport.resolveSecretStoreCredentials(options, env).getRegion(), "Mismatched option region");
    }

    @Test
    void noSecretFetcherRegistered() {
        RemshException e = assertThrows(RemshException.class,
                () -> RemshCliSupport.loadSecretFetcher(getClass().getClassLoader()));
        assertEquals(FailureKind.CONFIG_ERROR, e.getKind(), "Mismatched kind");
    }

    private RemshOptions parse(String... args) {
        return RemshCliSupport.parseCommandLine(stderr, args);
    }

    private String errors() {
        return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private static Path writeConfig(Path folder, String... lines) throws Exception {
        return Files.write(folder.resolve("ssh_config"), Arrays.asList(lines), StandardCharsets.UTF_8);
    }
}
