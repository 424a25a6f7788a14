package com.labelops.logging;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

/**
 * Ships log lines to a central PostgreSQL table so several LabelOps daemons can be monitored
 * from one place. Only redacted message text is stored.
 */
public final class DatabaseLogHandler extends Handler {

    static final String URL_PROPERTY = "labelops.logging.jdbc.url";
    static final String USER_PROPERTY = "labelops.logging.jdbc.user";
    static final String PASSWORD_PROPERTY = "labelops.logging.jdbc.password";
    static final String POOL_PROPERTY = "labelops.logging.jdbc.poolSize";
    static final String SOURCE_PROPERTY = "labelops.logging.source";

    private static final String INSERT_SQL = """
        INSERT INTO app_logs (
            logged_at,
            level,
            logger,
            message,
            source,
            host,
            thrown_type,
            thrown_msg
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private final BlockingQueue<LogRecord> pending = new LinkedBlockingQueue<>(1024);
    private final SimpleFormatter messageFormatter = new SimpleFormatter();
    private final HikariDataSource dataSource;
    private final String source;
    private final String hostName;
    private final Thread writer;

    private volatile boolean accepting = true;

    public DatabaseLogHandler() {
        SinkSettings settings = SinkSettings.resolve();
        if (settings.url() == null) {
            throw new IllegalStateException("no JDBC url configured for central logging");
        }
        this.dataSource = openPool(settings);
        this.source = settings.source();
        this.hostName = localHostName();
        this.writer = new Thread(this::writeLoop, "labelops-log-sink");
        this.writer.setDaemon(true);
        this.writer.start();
        setLevel(Level.ALL);
    }

    @Override
    public void publish(LogRecord record) {
        Objects.requireNonNull(record, "record");
        if (!accepting || !isLoggable(record)) {
            return;
        }
        // drop the oldest entry rather than block the caller when the sink falls behind
        while (!pending.offer(record)) {
            pending.poll();
        }
    }

    @Override
    public void flush() {
        // records are written by the sink thread
    }

    @Override
    public void close() {
        accepting = false;
        try {
            writer.join(TimeUnit.SECONDS.toMillis(3));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        dataSource.close();
    }

    private void writeLoop() {
        while (accepting) {
            try {
                LogRecord record = pending.poll(250, TimeUnit.MILLISECONDS);
                if (record != null) {
                    insert(record);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            } catch (SQLException ex) {
                System.err.println("Central log sink write failed: " + ex.getMessage());
            }
        }

        LogRecord remaining;
        while ((remaining = pending.poll()) != null) {
            try {
                insert(remaining);
            } catch (SQLException ex) {
                System.err.println("Central log sink drain failed: " + ex.getMessage());
            }
        }
    }

    private void insert(LogRecord record) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            statement.setTimestamp(1, Timestamp.from(Instant.ofEpochMilli(record.getMillis())));
            statement.setString(2, record.getLevel().getName());
            statement.setString(3, record.getLoggerName());
            statement.setString(4, LogRedactor.redact(messageFormatter.formatMessage(record)));
            statement.setString(5, source);
            statement.setString(6, hostName);
            Throwable thrown = record.getThrown();
            statement.setString(7, thrown == null ? null : thrown.getClass().getName());
            statement.setString(8, thrown == null ? null : LogRedactor.redact(thrown.getMessage()));
            statement.executeUpdate();
        }
    }

    private static HikariDataSource openPool(SinkSettings settings) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(settings.url());
        config.setUsername(settings.user());
        config.setPassword(settings.password());
        config.setMaximumPoolSize(settings.poolSize());
        config.setPoolName("LabelOpsLogSink");
        config.setAutoCommit(true);
        config.setInitializationFailTimeout(-1);
        return new HikariDataSource(config);
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }

    private record SinkSettings(String url, String user, String password, int poolSize, String source) {

        static SinkSettings resolve() {
            Properties file = readClasspathProperties();
            return new SinkSettings(
                lookup(URL_PROPERTY, "LABELOPS_LOGGING_JDBC_URL", file.getProperty("jdbc.url")),
                lookup(USER_PROPERTY, "LABELOPS_LOGGING_JDBC_USER", file.getProperty("jdbc.username")),
                lookup(PASSWORD_PROPERTY, "LABELOPS_LOGGING_JDBC_PASSWORD", file.getProperty("jdbc.password")),
                poolSize(lookup(POOL_PROPERTY, "LABELOPS_LOGGING_JDBC_POOL", file.getProperty("jdbc.poolSize"))),
                Objects.requireNonNullElse(
                    lookup(SOURCE_PROPERTY, "LABELOPS_LOGGING_SOURCE", file.getProperty("source")),
                    "labelops")
            );
        }

        private static Properties readClasspathProperties() {
            Properties props = new Properties();
            try (InputStream stream = DatabaseLogHandler.class
                .getClassLoader()
                .getResourceAsStream("logging-db.properties")) {
                if (stream != null) {
                    props.load(stream);
                }
            } catch (IOException ex) {
                System.err.println("Ignoring unreadable logging-db.properties: " + ex.getMessage());
            }
            return props;
        }

        private static String lookup(String property, String env, String fileValue) {
            for (String candidate : new String[] {System.getProperty(property), System.getenv(env), fileValue}) {
                if (candidate != null && !candidate.isBlank()) {
                    return candidate.trim();
                }
            }
            return null;
        }

        private static int poolSize(String raw) {
            if (raw == null) {
                return 2;
            }
            try {
                return Math.max(1, Integer.parseInt(raw));
            } catch (NumberFormatException ex) {
                return 2;
            }
        }
    }
}
