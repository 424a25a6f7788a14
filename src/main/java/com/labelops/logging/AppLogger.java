package com.labelops.logging;

import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides the shared logger configuration for the application.
 */
public final class AppLogger {
    public static final String LOG_FILE_PATTERN = "labelops%g.log";
    static final int LOG_FILE_LIMIT_BYTES = 5 * 1024 * 1024;
    static final int LOG_FILE_GENERATIONS = 5;

    private static final DateTimeFormatter UTC_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private static final Logger LOGGER = createLogger();

    private static FileHandler fileHandler;
    private static Path fileHandlerDirectory;

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    /**
     * Attaches the rotating log file under {@code logDir}. Calling again with another directory
     * replaces the previous file handler.
     */
    public static synchronized void configure(Path logDir) throws IOException {
        Path normalized = logDir.toAbsolutePath().normalize();
        if (normalized.equals(fileHandlerDirectory)) {
            return;
        }
        Files.createDirectories(normalized);
        FileHandler handler = new FileHandler(
            normalized.resolve(LOG_FILE_PATTERN).toString(),
            LOG_FILE_LIMIT_BYTES,
            LOG_FILE_GENERATIONS,
            true
        );
        handler.setEncoding(UTF_8.name());
        handler.setFormatter(new UtcFormatter());
        handler.setLevel(Level.ALL);

        if (fileHandler != null) {
            LOGGER.removeHandler(fileHandler);
            fileHandler.close();
        }
        LOGGER.addHandler(handler);
        fileHandler = handler;
        fileHandlerDirectory = normalized;
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger("com.labelops");
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                return "%s %s%n".formatted(record.getLevel().getName(), formatMessage(record));
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.err, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (UnsupportedEncodingException ex) {
            throw new IllegalStateException("UTF-8 console encoding unsupported", ex);
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(Level.INFO);

        try {
            DatabaseLogHandler dbHandler = new DatabaseLogHandler();
            dbHandler.setLevel(Level.INFO);
            logger.addHandler(dbHandler);
        } catch (IllegalStateException ex) {
            logger.fine("Central logging disabled: " + ex.getMessage());
        } catch (Exception ex) {
            logger.warning("Failed to initialize central logging: " + ex.getMessage());
        }
        return logger;
    }

    static final class UtcFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            StringBuilder line = new StringBuilder()
                .append(UTC_TIMESTAMP.format(Instant.ofEpochMilli(record.getMillis())))
                .append(' ')
                .append(record.getLevel().getName())
                .append(' ')
                .append(record.getLoggerName())
                .append(' ')
                .append(formatMessage(record))
                .append(System.lineSeparator());
            if (record.getThrown() != null) {
                Throwable thrown = record.getThrown();
                line.append(thrown.getClass().getName());
                if (thrown.getMessage() != null) {
                    line.append(": ").append(LogRedactor.redact(thrown.getMessage()));
                }
                line.append(System.lineSeparator());
                for (StackTraceElement element : thrown.getStackTrace()) {
                    line.append("\tat ").append(element).append(System.lineSeparator());
                }
            }
            return line.toString();
        }
    }
}
