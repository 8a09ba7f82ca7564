package com.guidestore;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void parsesArguments() throws Exception {
        Path workspace = tempDir.resolve("ws");
        Path logs = tempDir.resolve("logs");
        AppConfig config = new AppConfig.Builder()
            .parseArgs(new String[] {"--workspace", workspace.toString(), "--log-dir=" + logs, "--dev", "--no-watch"})
            .build();

        assertEquals(workspace.toAbsolutePath().normalize(), config.getWorkspacePath());
        assertEquals(logs.toAbsolutePath().normalize().resolve("guide-store.log"), config.getLogPath());
        assertTrue(Files.isDirectory(logs));
        assertTrue(config.isDevMode());
        assertFalse(config.isWatchEnabled());
        assertTrue(config.isRecoverOnStart());
        assertEquals(AppLogger.Level.DEBUG, config.getLogLevel());
    }

    @Test
    void defaultsWithoutArguments() throws Exception {
        AppConfig config = new AppConfig.Builder()
            .logDirectory(tempDir.toString())
            .parseArgs(new String[] {"--no-recover", "--port", "not-a-number"})
            .build();

        assertFalse(config.isDevMode());
        assertTrue(config.isWatchEnabled());
        assertFalse(config.isRecoverOnStart());
        assertEquals(AppLogger.Level.INFO, config.getLogLevel());
        assertEquals(AppConfig.getDefaultWorkspacePath(), config.getWorkspacePath());
        assertTrue(config.getPort() > 0);
    }
}
