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
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.stream.Stream;

import org.apache.sshd.common.util.logging.LoggingUtils;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Test name, temporary folders and logging set-up shared by all tests
 */
public abstract class JUnitTestSupport {
    public static final String TEMP_SUBFOLDER_NAME = "temp";
    public static final String TEST_CLASSES_FOLDER = "test-classes";
    public static final org.slf4j.event.Level DEFAULT_LOGGING_LEVEL = org.slf4j.event.Level.INFO;

    private String currentTestName;
    private Path targetFolder;
    private Path tempFolder;

    protected JUnitTestSupport() {
        replaceJULLoggers();
    }

    @BeforeAll
    public static void setupRootLoggerLevel() {
        String levelName = System.getProperty("org.remsh.test.root.log.level", DEFAULT_LOGGING_LEVEL.toString());
        org.slf4j.event.Level level = LoggingUtils.slf4jLevelFromName(levelName);
        if (level == null) {
            level = DEFAULT_LOGGING_LEVEL;
        }

        replaceJULLoggers();
        if (isLogbackBound()) {
            LogbackSupport.setRootLevel(level);
        }
    }

    /**
     * Routes {@code java.util.logging} through SLF4J - only when SLF4J itself is not bound to it
     */
    public static void replaceJULLoggers() {
        if (isLogbackBound()) {
            LogbackSupport.installBridge();
        }
    }

    public static boolean isLogbackBound() {
        return LoggerFactory.getILoggerFactory().getClass().getName().startsWith("ch.qos.logback.");
    }

    // isolated so that modules testing without Logback never load its classes
    private static final class LogbackSupport {
        private LogbackSupport() {
            throw new UnsupportedOperationException("No instance");
        }

        static void installBridge() {
            if (!SLF4JBridgeHandler.isInstalled()) {
                SLF4JBridgeHandler.removeHandlersForRootLogger();
                SLF4JBridgeHandler.install();
            }
        }

        static void setRootLevel(org.slf4j.event.Level level) {
            Logger rootLogger = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            ch.qos.logback.classic.Level rawLevel = ch.qos.logback.classic.Level.toLevel(level.toString());
            ((ch.qos.logback.classic.Logger) rootLogger).setLevel(rawLevel);
            rootLogger.info("Using {} logger(s) at level={}", rootLogger.getClass().getName(), rawLevel);
        }
    }

    @BeforeEach
    public void captureTestName(TestInfo info) {
        currentTestName = info.getTestMethod().map(m -> m.getName()).orElse(info.getDisplayName());
    }

    public final String getCurrentTestName() {
        return currentTestName;
    }

    /**
     * @return The Maven {@code target} folder of the module containing the test class
     */
    protected Path detectTargetFolder() {
        synchronized (TEMP_SUBFOLDER_NAME) {
            if (targetFolder == null) {
                targetFolder = Objects.requireNonNull(detectTargetFolder(getClass()), "Failed to detect target folder");
            }
        }

        return targetFolder;
    }

    protected Path getTempTargetFolder() {
        synchronized (TEMP_SUBFOLDER_NAME) {
            if (tempFolder == null) {
                tempFolder = detectTargetFolder().resolve(TEMP_SUBFOLDER_NAME);
            }
        }

        return tempFolder;
    }

    /**
     * Creates an empty folder bearing the class and test names under the target temporary folder
     *
     * @return             The created folder
     * @throws IOException If failed to create or clean it
     */
    protected Path createTempTestFolder() throws IOException {
        Path folder = getTempTargetFolder().resolve(getClass().getSimpleName()).resolve(getCurrentTestName());
        deleteRecursive(folder);
        return assertHierarchyTargetFolderExists(folder);
    }

    public static Path detectTargetFolder(Class<?> anchor) {
        URL url = anchor.getProtectionDomain().getCodeSource().getLocation();
        Path location;
        try {
            location = Paths.get(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Bad code source location: " + url, e);
        }

        for (Path p = location; p != null; p = p.getParent()) {
            Path name = p.getFileName();
            if ((name != null) && "target".equals(name.toString())) {
                return p;
            }
        }

        // not running from a Maven layout
        return TEST_CLASSES_FOLDER.equals(String.valueOf(location.getFileName())) ? location.getParent() : location;
    }

    public static Path assertHierarchyTargetFolderExists(Path folder, LinkOption... options) throws IOException {
        if (Files.exists(folder, options)) {
            assertTrue(Files.isDirectory(folder, options), "Target is an existing file instead of a folder: " + folder);
        } else {
            Files.createDirectories(folder);
        }

        return folder;
    }

    public static void deleteRecursive(Path path) throws IOException {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }

        if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            try (Stream<Path> children = Files.list(path)) {
                for (Path child : (Iterable<Path>) children::iterator) {
                    deleteRecursive(child);
                }
            }
        }
        Files.delete(path);
    }
}
