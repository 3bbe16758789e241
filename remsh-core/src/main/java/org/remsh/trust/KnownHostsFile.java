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
package org.remsh.trust;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.sshd.client.config.hosts.KnownHostEntry;
import org.apache.sshd.client.config.hosts.KnownHostHashValue;
import org.apache.sshd.common.config.keys.AuthorizedKeyEntry;
import org.apache.sshd.common.config.keys.PublicKeyEntry;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.MapEntryUtils;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;

/**
 * Reads and appends to an OpenSSH known-hosts file. Comments, blank lines and lines that cannot be parsed are skipped
 * on load and never rewritten: a newly pinned key is appended, so everything already in the file stays byte-for-byte
 * intact.
 */
public class KnownHostsFile extends AbstractLoggingBean {
    public static final char COMMENT_CHAR = '#';

    private final Path path;

    public KnownHostsFile(Path path) {
        this.path = Objects.requireNonNull(path, "No known hosts path");
    }

    public Path getPath() {
        return path;
    }

    /**
     * Invalid UTF-8 sequences are replaced rather than rejected, the same way {@link KnownHostEntry} reads the file.
     *
     * @return             The parsed entries - empty if the file does not exist
     * @throws IOException If failed to read an existing file
     */
    public List<TrustEntry> load() throws IOException {
        if (!Files.exists(path)) {
            if (log.isDebugEnabled()) {
                log.debug("load({}) no file", path);
            }
            return new ArrayList<>();
        }

        List<TrustEntry> entries = new ArrayList<>();
        try (InputStream input = Files.newInputStream(path);
             BufferedReader r = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            int lineNumber = 0;
            for (String line = r.readLine(); line != null; line = r.readLine()) {
                lineNumber++;
                TrustEntry entry = parseLine(line);
                if (entry != null) {
                    entries.add(entry);
                } else if (isContentLine(line) && log.isDebugEnabled()) {
                    log.debug("load({}) skip unparsed line #{}", path, lineNumber);
                }
            }
        }
        return entries;
    }

    /**
     * Appends an entry, creating the file and its parent folder if needed
     *
     * @param  entry       The entry to persist
     * @throws IOException If failed to write
     */
    public void append(TrustEntry entry) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if ((parent != null) && (!Files.isDirectory(parent))) {
            Files.createDirectories(parent);
        }

        StringBuilder sb = new StringBuilder();
        if (!endsWithNewLine()) {
            sb.append('\n');
        }
        sb.append(entry.toLine()).append('\n');
        Files.write(path, sb.toString().getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    protected boolean endsWithNewLine() throws IOException {
        if (!Files.exists(path)) {
            return true;
        }

        try (SeekableByteChannel channel = Files.newByteChannel(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size <= 0L) {
                return true;
            }

            ByteBuffer last = ByteBuffer.allocate(1);
            channel.position(size - 1L);
            return (channel.read(last) == 1) && (last.get(0) == '\n');
        }
    }

    /**
     * @param  line A single line
     * @return      The entry - {@code null} for comments, blank or unparseable lines
     */
    public static TrustEntry parseLine(String line) {
        if (!isContentLine(line)) {
            return null;
        }

        KnownHostEntry parsed;
        try {
            parsed = KnownHostEntry.parseKnownHostEntry(line);
        } catch (RuntimeException e) {
            parsed = null;
        }

        AuthorizedKeyEntry key = (parsed == null) ? null : parsed.getKeyEntry();
        if ((key == null) || MapEntryUtils.isNotEmpty(key.getLoginOptions())) {
            // no decoder registered for the key type (e.g. ssh-ed25519 without an EdDSA provider)
            return parseUndecodedLine(line);
        }

        return new TrustEntry(parsed.getMarker(), hostPatternOf(parsed.getConfigLine()), parsed.getHashedEntry(),
                key.getKeyType(), key.getKeyData());
    }

    /**
     * Same grammar as {@link KnownHostEntry#parseKnownHostEntry(String)}, but the key data is only base64 decoded
     * instead of being matched against the registered key decoders.
     *
     * @param  line A non-comment line
     * @return      The entry - {@code null} if the line is malformed
     */
    protected static TrustEntry parseUndecodedLine(String line) {
        String data = GenericUtils.replaceWhitespaceAndTrim(line);
        String marker = null;
        if (data.charAt(0) == KnownHostEntry.MARKER_INDICATOR) {
            int pos = data.indexOf(' ');
            if (pos <= 1) {
                return null;
            }
            marker = data.substring(1, pos);
            data = data.substring(pos + 1).trim();
        }

        int pos = data.indexOf(' ');
        if (pos <= 0) {
            return null;
        }

        String hostPattern = data.substring(0, pos);
        try {
            KnownHostHashValue hashed = (hostPattern.charAt(0) == KnownHostHashValue.HASHED_HOST_DELIMITER)
                    ? KnownHostHashValue.parse(hostPattern)
                    : null;
            PublicKeyEntry key = PublicKeyEntry.parsePublicKeyEntry(data.substring(pos + 1));
            if (key == null) {
                return null;
            }
            return new TrustEntry(marker, hostPattern, hashed, key.getKeyType(), key.getKeyData());
        } catch (RuntimeException e) {
            return null;
        }
    }

    private static String hostPatternOf(String configLine) {
        String data = configLine;
        if (data.charAt(0) == KnownHostEntry.MARKER_INDICATOR) {
            data = data.substring(data.indexOf(' ') + 1).trim();
        }
        return data.substring(0, data.indexOf(' '));
    }

    private static boolean isContentLine(String line) {
        String s = GenericUtils.trimToEmpty(line);
        return GenericUtils.isNotEmpty(s) && (s.charAt(0) != COMMENT_CHAR);
    }
}
