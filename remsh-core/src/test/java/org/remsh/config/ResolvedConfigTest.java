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
package org.remsh.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.apache.sshd.common.config.keys.PublicKeyEntry;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.remsh.util.test.BaseTestSupport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

@TestMethodOrder(MethodName.class)
public class ResolvedConfigTest extends BaseTestSupport {
    public ResolvedConfigTest() {
        super();
    }

    @Test
    void defaults() {
        ResolvedConfig config = ResolvedConfig.builder().host("example.com").username("alice").build();
        assertEquals(ResolvedConfig.DEFAULT_PORT, config.getPort(), "port");
        assertEquals(ResolvedConfig.DEFAULT_ATTEMPTS, config.getAttemptCount(), "attempts");
        assertEquals(ResolvedConfig.DEFAULT_CONNECT_TIMEOUT, config.getConnectTimeout(), "connect timeout");
        assertEquals(0, config.getServerAliveInterval(), "alive interval");
        assertNull(config.getCommand(), "command");
        assertNull(config.getInMemoryKey(), "in-memory key");
        assertFalse(config.isSkipHostKeyCheck(), "skip host key check");

        Path keysFolder = PublicKeyEntry.getDefaultKeysFolderPath();
        assertEquals(keysFolder.resolve(ResolvedConfig.KNOWN_HOSTS_FILE_NAME), config.getKnownHostsPath(), "known hosts");
        List<Path> expected = Arrays.asList(
                keysFolder.resolve("id_ed25519"), keysFolder.resolve("id_rsa"), keysFolder.resolve("id_ecdsa"));
        assertEquals(expected, config.getDiscoveryIdentities(), "discovery order");
    }

    @Test
    void emptyValuesAreNormalized() {
        ResolvedConfig config = ResolvedConfig.builder()
                .host("h").username("u").command("").agentEndpoint("").inMemoryKey("")
                .build();
        assertNull(config.getCommand(), "command");
        assertNull(config.getAgentEndpoint(), "agent endpoint");
        assertNull(config.getInMemoryKey(), "in-memory key");
    }

    @Test
    void explicitValues() throws Exception {
        Path id = Paths.get("keys", "id_test");
        ResolvedConfig config = ResolvedConfig.builder()
                .host("h").port(2222).username("u")
                .identity(id)
                .forward(ForwardSpec.parse("1000:a:1"))
                .forward(ForwardSpec.parse("2000:b:2"))
                .attemptCount(3)
                .serverAliveInterval(15)
                .command("uptime")
                .build();
        assertEquals(2222, config.getPort());
        assertEquals(id, config.getIdentity());
        assertEquals(2, config.getForwards().size(), "forwards");
        assertEquals(3, config.getAttemptCount());
        assertEquals(15, config.getServerAliveInterval());
        assertEquals("uptime", config.getCommand());
        assertThrows(UnsupportedOperationException.class, () -> config.getForwards().clear());
    }

    @Test
    void invalidValuesRejected() {
        assertThrows(IllegalArgumentException.class, () -> ResolvedConfig.builder().username("u").build(), "no host");
        assertThrows(IllegalArgumentException.class, () -> ResolvedConfig.builder().host("h").build(), "no user");
        assertThrows(IllegalArgumentException.class,
                () -> ResolvedConfig.builder().host("h").username("u").port(0).build(), "port 0");
        assertThrows(IllegalArgumentException.class,
                () -> ResolvedConfig.builder().host("h").username("u").port(70000).build(), "port too big");
        assertThrows(IllegalArgumentException.class,
                () -> ResolvedConfig.builder().host("h").username("u").attemptCount(0).build(), "no attempts");
        assertThrows(IllegalArgumentException.class,
                () -> ResolvedConfig.builder().host("h").username("u").serverAliveInterval(-1).build(), "interval");
    }
}
