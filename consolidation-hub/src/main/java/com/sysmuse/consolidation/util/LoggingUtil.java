package com.sysmuse.consolidation.util;

import java.io.IOException;
import java.util.Properties;
import java.util.logging.*;

/**
 * Central logging facade for the consolidation pipeline.
 * Wraps java.util.logging behind a small static interface so that every
 * component logs through the same "com.sysmuse.consolidation" logger.
 */
public class LoggingUtil {
    public enum ConsoleOutputMode {
        ALL_TO_OUT,
        ALL_TO_ERR,
        SPLIT_SEVERE_TO_ERR
    }

    public static final String DEFAULT_LOG_FILE = "consolidation.log";

    private static final Logger logger = Logger.getLogger("com.sysmuse.consolidation");
    private static boolean initialized = false;
    private static Level currentLevel = Level.INFO;
    private static boolean consoleLogging = false;
    private static boolean fileLogging = false;
    private static String logFileName = DEFAULT_LOG_FILE;
    private static ConsoleOutputMode consoleOutputMode = ConsoleOutputMode.SPLIT_SEVERE_TO_ERR;

    private static class StdOutHandler extends StreamHandler {
        StdOutHandler(Level level) {
            super(System.out, new SimpleFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            // SEVERE goes to stderr in split mode
            if (consoleOutputMode == ConsoleOutputMode.SPLIT_SEVERE_TO_ERR
                    && record.getLevel().intValue() >= Level.SEVERE.intValue()) {
                return;
            }
            super.publish(record);
            flush();
        }
    }

    private static class StdErrHandler extends StreamHandler {
        StdErrHandler(Level level) {
            super(System.err, new SimpleFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }

    /**
     * Configure where console log messages go. Takes effect on the next initialize.
     */
    public static void setConsoleOutputMode(ConsoleOutputMode mode) {
        consoleOutputMode = mode;
    }

    /**
     * Initialize from properties: logging.level, logging.console, logging.file
     */
    public static void initialize(Properties properties) {
        String level = properties.getProperty("logging.level", "INFO");
        boolean console = Boolean.parseBoolean(properties.getProperty("logging.console", "true"));
        String file = properties.getProperty("logging.file", "");
        initialize(level, console, !file.isEmpty(), file);
    }

    /**
     * Initialize the logging system. Later calls are ignored until {@link #reset()}.
     */
    public static synchronized void initialize(String levelStr, boolean consoleEnabled,
                                               boolean fileEnabled, String fileName) {
        if (initialized) {
            return;
        }

        currentLevel = parseLevel(levelStr);
        clearHandlers();

        if (consoleEnabled) {
            setupConsoleHandlers();
        }

        if (fileEnabled && fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName, true);
                fileHandler.setFormatter(new SimpleFormatter());
                fileHandler.setLevel(currentLevel);
                logger.addHandler(fileHandler);
                fileLogging = true;
                logFileName = fileName;
            } catch (IOException e) {
                fileLogging = false;
                logger.log(Level.SEVERE, "Failed to create log file: " + fileName, e);
            }
        }

        logger.setLevel(currentLevel);
        logger.setUseParentHandlers(false);
        initialized = true;

        debug("Logging initialized: level=" + currentLevel +
                ", console=" + consoleLogging +
                ", file=" + (fileLogging ? logFileName : "disabled"));
    }

    /**
     * Drop all handlers so the next call to initialize starts fresh.
     */
    public static synchronized void reset() {
        clearHandlers();
        consoleLogging = false;
        fileLogging = false;
        initialized = false;
    }

    static Level parseLevel(String levelStr) {
        if (levelStr == null) {
            return Level.INFO;
        }
        switch (levelStr.trim().toUpperCase()) {
            case "SEVERE":
            case "ERROR":
                return Level.SEVERE;
            case "WARNING":
            case "WARN":
                return Level.WARNING;
            case "DEBUG":
                return Level.FINE;
            case "TRACE":
                return Level.FINEST;
            default:
                return Level.INFO;
        }
    }

    private static void clearHandlers() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            handler.close();
        }
    }

    private static void setupConsoleHandlers() {
        switch (consoleOutputMode) {
            case ALL_TO_OUT:
                logger.addHandler(new StdOutHandler(currentLevel));
                break;
            case ALL_TO_ERR:
                logger.addHandler(new StdErrHandler(currentLevel));
                break;
            case SPLIT_SEVERE_TO_ERR:
                logger.addHandler(new StdOutHandler(currentLevel));
                logger.addHandler(new StdErrHandler(Level.SEVERE));
                break;
        }
        consoleLogging = true;
    }

    public static void debug(String message) {
        ensureInitialized();
        logger.fine(message);
    }

    public static void info(String message) {
        ensureInitialized();
        logger.info(message);
    }

    public static void warn(String message) {
        ensureInitialized();
        logger.warning(message);
    }

    public static void warn(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.WARNING, message, t);
    }

    public static void error(String message) {
        ensureInitialized();
        logger.severe(message);
    }

    public static void error(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.SEVERE, message, t);
    }

    public static boolean isDebugEnabled() {
        return currentLevel.intValue() <= Level.FINE.intValue();
    }

    private static void ensureInitialized() {
        if (!initialized) {
            initialize("INFO", true, false, DEFAULT_LOG_FILE);
        }
    }
}
