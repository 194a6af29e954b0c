package com.texformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Configures java.util.logging for the formatter. The classpath {@code /logging.properties} wins;
 * without it a console handler and a {@code texformatter.log} file handler are installed.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final Logger appLogger = Logger.getLogger("com.texformatter");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static final Path LOG_FILE = Paths.get("texformatter.log");
    private static boolean initialized = false;
    private static Level consoleLevel = Level.INFO;

    /**
     * Initializes the logging system, once.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try {
            try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
                if (is != null) {
                    LogManager.getLogManager().readConfiguration(is);
                    initialized = true;
                    return;
                }
            }

            _configureBasicLogging();
            initialized = true;
        } catch (IOException | SecurityException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
        }
    }

    /**
     * Sets up basic logging with console and file handlers.
     */
    private static void _configureBasicLogging() throws IOException {
        // Reset existing handlers
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        // Console handler
        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(consoleLevel);
        consoleHandler.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(consoleHandler);
        // File handler
        rootLogger.addHandler(_newFileHandler());
        rootLogger.setLevel(Level.ALL);
    }

    /**
     * Creates an appending handler for the log file.
     */
    private static FileHandler _newFileHandler() throws IOException {
        FileHandler fileHandler = new FileHandler(LOG_FILE.toString(), true);
        fileHandler.setLevel(Level.ALL);
        fileHandler.setFormatter(new SimpleFormatter());
        return fileHandler;
    }

    /**
     * Sets the level of the console handlers, e.g. {@code FINE} for {@code --verbose}.
     */
    public static synchronized void setConsoleLevel(Level level) {
        consoleLevel = level;
        initialize();
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
        for (Logger logger : new Logger[] {rootLogger, appLogger}) {
            if (logger.getLevel() != null && logger.getLevel().intValue() > level.intValue()) {
                logger.setLevel(level);
            }
        }
    }

    /**
     * Gets a logger for a specific class.
     */
    public static Logger getLogger(Class<?> clazz) {
        initialize();
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Closes every handler of the root logger.
     */
    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.close();
        }
    }
}
