package io.obscur.storage;

import io.obscur.config.ObscurConfig;
import io.obscur.error.StorageException;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

public final class Database {
    private static final String BUSY_TIMEOUT_MS = "5000";
    private final ObscurConfig config;
    private final String jdbcUrl;

    public Database(ObscurConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public String identity() {
        return config.identity();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    // Per-connection pragmas; every write is fsynced before it returns.
    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("synchronous", "FULL");
        props.setProperty("foreign_keys", "true");
        props.setProperty("busy_timeout", BUSY_TIMEOUT_MS);
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new StorageException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS messages (
                        id TEXT NOT NULL,
                        identity TEXT NOT NULL DEFAULT 'default',
                        conversation_id TEXT NOT NULL,
                        timestamp_ms INTEGER NOT NULL,
                        doc TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(identity, id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS queue (
                        id TEXT NOT NULL,
                        identity TEXT NOT NULL DEFAULT 'default',
                        next_retry_at_ms INTEGER NOT NULL,
                        doc TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(identity, id)
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_conversation ON messages(identity, conversation_id, timestamp_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_timestamp ON messages(identity, timestamp_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_queue_next_retry ON queue(identity, next_retry_at_ms)");
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "2");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new StorageException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new StorageException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new StorageException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
