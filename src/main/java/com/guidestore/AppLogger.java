package com.guidestore;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Process-wide logger writing {@code [time] [LEVEL] message} lines to an
 * append-mode log file and, optionally, the console.
 *
 * <p>Services log through a {@link Component} handle so they work before
 * {@link #initialize} has run (unit tests): warnings and errors then go to
 * stderr and lower levels are dropped.
 */
public class AppLogger {

    public enum Level {
        DEBUG,
        INFO,
        WARN,
        ERROR
    }

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean consoleEnabled;
    private final Level threshold;

    private static AppLogger instance;

    private AppLogger(Path logFile, boolean consoleEnabled, Level threshold) throws IOException {
        this.consoleOutput = System.out;
        this.consoleEnabled = consoleEnabled;
        this.threshold = threshold;

        FileOutputStream fos = new FileOutputStream(logFile.toFile(), true);
        this.fileOutput = new PrintStream(fos, true, "UTF-8");

        String separator = "=".repeat(60);
        fileOutput.println();
        fileOutput.println(separator);
        fileOutput.println("Guide Store started at " + LocalDateTime.now().format(TIME_FORMAT));
        fileOutput.println(separator);
    }

    public static synchronized void initialize(Path logFile, boolean consoleEnabled, Level threshold) throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, consoleEnabled, threshold);
        }
    }

    public static AppLogger get() {
        return instance;
    }

    public static Component forComponent(String name) {
        return new Component(name);
    }

    public void debug(String message) {
        log(Level.DEBUG, message);
    }

    public void info(String message) {
        log(Level.INFO, message);
    }

    public void warn(String message) {
        log(Level.WARN, message);
    }

    public void error(String message) {
        log(Level.ERROR, message);
    }

    public void error(String message, Throwable t) {
        log(Level.ERROR, message);
        if (t == null) {
            return;
        }
        t.printStackTrace(fileOutput);
        if (consoleEnabled) {
            t.printStackTrace(consoleOutput);
        }
    }

    private void log(Level level, String message) {
        if (level.ordinal() < threshold.ordinal()) {
            return;
        }
        String line = String.format("[%s] [%s] %s", LocalDateTime.now().format(TIME_FORMAT), level, message);
        fileOutput.println(line);
        if (consoleEnabled) {
            consoleOutput.println(line);
        }
    }

    /**
     * Print without a level prefix (startup banner).
     */
    public void console(String message) {
        if (consoleEnabled) {
            consoleOutput.println(message);
        }
        fileOutput.println(message);
    }

    public void close() {
        fileOutput.close();
    }

    /**
     * Named handle that prefixes messages with {@code [name]}.
     */
    public static final class Component {
        private final String prefix;

        private Component(String name) {
            this.prefix = "[" + name + "] ";
        }

        public void debug(String message) {
            AppLogger logger = get();
            if (logger != null) {
                logger.debug(prefix + message);
            }
        }

        public void info(String message) {
            AppLogger logger = get();
            if (logger != null) {
                logger.info(prefix + message);
            }
        }

        public void warn(String message) {
            AppLogger logger = get();
            if (logger != null) {
                logger.warn(prefix + message);
            } else {
                System.err.println("WARN " + prefix + message);
            }
        }

        public void error(String message, Throwable t) {
            AppLogger logger = get();
            if (logger != null) {
                logger.error(prefix + message, t);
            } else {
                System.err.println("ERROR " + prefix + message);
            }
        }
    }
}
