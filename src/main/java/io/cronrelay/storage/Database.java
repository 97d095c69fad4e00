package io.cronrelay.storage;

import io.cronrelay.config.CronRelayConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private final CronRelayConfig config;
    private final String jdbcUrl;

    public Database(CronRelayConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public CronRelayConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
        }
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS scheduled_jobs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        function_app TEXT NOT NULL,
                        service TEXT NOT NULL,
                        trigger_url TEXT NOT NULL,
                        json_body TEXT,
                        start_date TEXT NOT NULL,
                        frequency TEXT NOT NULL,
                        schedule_config TEXT,
                        triggered_count INTEGER NOT NULL DEFAULT 0,
                        trigger_limit INTEGER,
                        last_triggered_at TEXT,
                        status TEXT NOT NULL DEFAULT 'pending',
                        retry_count INTEGER NOT NULL DEFAULT 0,
                        max_retries INTEGER NOT NULL DEFAULT 0,
                        last_response_code INTEGER,
                        last_response_detail TEXT,
                        error_message TEXT,
                        log_id INTEGER,
                        processed_at TEXT,
                        is_active INTEGER NOT NULL DEFAULT 1
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS execution_log (
                        log_id INTEGER PRIMARY KEY AUTOINCREMENT,
                        root_id INTEGER,
                        parent_id INTEGER,
                        function_app TEXT NOT NULL,
                        service_name TEXT NOT NULL,
                        invocation_id TEXT NOT NULL UNIQUE,
                        status TEXT NOT NULL,
                        trigger_source TEXT,
                        started_at TEXT NOT NULL,
                        ended_at TEXT,
                        duration_ms INTEGER,
                        request TEXT,
                        response TEXT,
                        error_message TEXT,
                        metadata TEXT
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_status_active ON scheduled_jobs(status, is_active)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_log_root ON execution_log(root_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_log_parent ON execution_log(parent_id)");
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
                throw new IllegalStateException("PRAGMA " + pragma + " returned no rows");
            }
            String actual = rs.getString(1);
            if (actual == null || !expected.equalsIgnoreCase(actual.trim())) {
                throw new IllegalStateException("PRAGMA " + pragma + " expected " + expected + " but was " + actual);
            }
        }
    }
}
