package com.tyron.snipj.testFramework;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Test-only logging setup.
 *
 * Controls java.util.logging output via system property:
 * - snipj.test.logLevel=INFO|FINE|FINER|FINEST|WARNING|SEVERE
 */
public final class TestLogging {

    public static final String LEVEL_PROPERTY = "snipj.test.logLevel";

    private static volatile boolean configured;

    private TestLogging() {
    }

    public static synchronized void configureOnce() {
        if (configured) return;
        configured = true;

        Level level = parseLevel(System.getProperty(LEVEL_PROPERTY, "INFO"));
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
            if (h instanceof ConsoleHandler) {
                h.setFormatter(new CompactFormatter());
            }
        }
        root.info("testLogging configured level=" + level.getName());
    }

    /**
     * Records everything {@code loggerName} logs at {@code level} or above until closed.
     * <pre>
     * try (TestLogging.Capture capture = TestLogging.capture(SnippetSession.class.getName(), Level.FINE)) {
     *     ...
     *     assertTrue(capture.contains("cancelled"));
     * }
     * </pre>
     */
    public static Capture capture(String loggerName, Level level) {
        return new Capture(Logger.getLogger(loggerName), level);
    }

    public static final class Capture extends Handler implements AutoCloseable {
        private final Logger logger;
        private final Level previousLevel;
        private final List<LogRecord> records = new ArrayList<>();

        private Capture(Logger logger, Level level) {
            this.logger = logger;
            this.previousLevel = logger.getLevel();
            setLevel(level);
            logger.setLevel(level);
            logger.addHandler(this);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            if (isLoggable(record)) {
                records.add(record);
            }
        }

        public synchronized List<String> messages() {
            List<String> result = new ArrayList<>(records.size());
            for (LogRecord record : records) {
                result.add(record.getMessage());
            }
            return result;
        }

        public boolean contains(String fragment) {
            return messages().stream().anyMatch(message -> message.contains(fragment));
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
            logger.removeHandler(this);
            logger.setLevel(previousLevel);
        }
    }

    private static final class CompactFormatter extends Formatter {

        private static final DateTimeFormatter TS = DateTimeFormatter
                .ofPattern("HH:mm:ss.SSS")
                .withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord record) {
            String name = record.getLoggerName();
            String simple = name == null || name.isBlank() ? "root" : name.substring(name.lastIndexOf('.') + 1);

            StringBuilder out = new StringBuilder(128)
                    .append(TS.format(Instant.ofEpochMilli(record.getMillis()))).append(' ')
                    .append(String.format(Locale.ROOT, "%-7s", record.getLevel().getName())).append(' ')
                    .append(simple).append(" - ")
                    .append(formatMessage(record))
                    .append('\n');

            if (record.getThrown() != null) {
                StringWriter sw = new StringWriter();
                record.getThrown().printStackTrace(new PrintWriter(sw));
                out.append(sw);
            }
            return out.toString();
        }
    }

    private static Level parseLevel(String raw) {
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }
}
