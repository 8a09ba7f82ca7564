package com.guidestore;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Process configuration: workspace root, log location, HTTP port and
 * feature flags, resolved from command-line arguments with per-OS defaults.
 */
public class AppConfig {

    private static final String APP_NAME = "Guide-Store";

    private final Path workspacePath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;
    private final boolean watchEnabled;
    private final boolean recoverOnStart;

    private AppConfig(Path workspacePath, Path logPath, int port, boolean devMode,
                      boolean watchEnabled, boolean recoverOnStart) {
        this.workspacePath = workspacePath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
        this.watchEnabled = watchEnabled;
        this.recoverOnStart = recoverOnStart;
    }

    public Path getWorkspacePath() {
        return workspacePath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /** Invalidate cached documents when other processes change the files. */
    public boolean isWatchEnabled() {
        return watchEnabled;
    }

    /** Finish interrupted archive moves before serving requests. */
    public boolean isRecoverOnStart() {
        return recoverOnStart;
    }

    public AppLogger.Level getLogLevel() {
        return devMode ? AppLogger.Level.DEBUG : AppLogger.Level.INFO;
    }

    /**
     * Default workspace root.
     * Windows: %USERPROFILE%\Documents\Guide-Store\workspace
     * macOS: ~/Documents/Guide-Store/workspace
     * Linux: ~/Guide-Store/workspace
     */
    public static Path getDefaultWorkspacePath() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String documents = System.getenv("USERPROFILE");
            if (documents == null) {
                documents = userHome;
            }
            return Paths.get(documents, "Documents", APP_NAME, "workspace");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Documents", APP_NAME, "workspace");
        }
        return Paths.get(userHome, APP_NAME, "workspace");
    }

    /**
     * Windows: %APPDATA%\Guide-Store\logs
     * macOS: ~/Library/Logs/Guide-Store
     * Linux: ~/.local/share/Guide-Store/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        }
        return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
    }

    /**
     * Preferred port if free, otherwise any free port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }
        // Let the server fail with a clear bind error.
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static class Builder {
        private Path workspacePath = null;
        private Path logDirectory = null;
        private int preferredPort = 7070;
        private boolean devMode = false;
        private boolean watchEnabled = true;
        private boolean recoverOnStart = true;

        public Builder workspacePath(String path) {
            if (path != null && !path.isEmpty()) {
                this.workspacePath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder logDirectory(String path) {
            if (path != null && !path.isEmpty()) {
                this.logDirectory = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder watchEnabled(boolean watchEnabled) {
            this.watchEnabled = watchEnabled;
            return this;
        }

        public Builder recoverOnStart(boolean recoverOnStart) {
            this.recoverOnStart = recoverOnStart;
            return this;
        }

        /**
         * Accepts {@code --workspace}, {@code --log-dir}, {@code --port} (each as
         * {@code --x value} or {@code --x=value}) and the flags {@code --dev},
         * {@code --no-watch}, {@code --no-recover}.
         */
        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.startsWith("--workspace=")) {
                    workspacePath(arg.substring("--workspace=".length()));
                } else if ("--workspace".equals(arg) && i + 1 < args.length) {
                    workspacePath(args[++i]);
                } else if (arg.startsWith("--log-dir=")) {
                    logDirectory(arg.substring("--log-dir=".length()));
                } else if ("--log-dir".equals(arg) && i + 1 < args.length) {
                    logDirectory(args[++i]);
                } else if (arg.startsWith("--port=")) {
                    parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    parsePort(args[++i]);
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                } else if ("--no-watch".equals(arg)) {
                    this.watchEnabled = false;
                } else if ("--no-recover".equals(arg)) {
                    this.recoverOnStart = false;
                }
            }
            return this;
        }

        private void parsePort(String value) {
            try {
                this.preferredPort = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                System.err.println("Ignoring invalid --port value: " + value);
            }
        }

        public AppConfig build() throws IOException {
            Path workspace = workspacePath != null ? workspacePath : getDefaultWorkspacePath();
            int port = findAvailablePort(preferredPort);
            Path logDir = logDirectory != null ? logDirectory : getLogDirectory();
            Files.createDirectories(logDir);
            return new AppConfig(workspace, logDir.resolve("guide-store.log"), port, devMode, watchEnabled, recoverOnStart);
        }
    }
}
