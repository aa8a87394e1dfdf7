package io.tagkeeper.storage;

import io.tagkeeper.config.TagKeeperConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

public final class Database {
    private final TagKeeperConfig config;
    private final String jdbcUrl;
    private final long busyTimeoutMs;

    public Database(TagKeeperConfig config, long busyTimeoutMs) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.busyTimeoutMs = Math.max(0L, busyTimeoutMs);
    }

    public String namespace() {
        return config.namespace();
    }

    /** Query timeout for statements, in whole seconds (at least one). */
    public int queryTimeoutSeconds() {
        return (int) Math.max(1L, (busyTimeoutMs + 999L) / 1000L);
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", Long.toString(busyTimeoutMs));
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.securityRoot());
            Files.createDirectories(config.reportsRoot());
            Files.createDirectories(config.alertsRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS records (
                        namespace TEXT NOT NULL DEFAULT 'default',
                        subject_kind TEXT NOT NULL,
                        subject_id TEXT NOT NULL,
                        tag TEXT NOT NULL,
                        watermark TEXT NOT NULL,
                        payload TEXT,
                        last_verified_at_ms INTEGER,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(namespace, subject_kind, subject_id)
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_records_namespace_updated ON records(namespace, updated_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
