package io.harvestmesh.storage;

import io.harvestmesh.config.HarvestMeshConfig;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private final HarvestMeshConfig config;
    private final String jdbcUrl;

    public Database(HarvestMeshConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public HarvestMeshConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        applyAndValidatePragmas();
        initSchema();
    }

    /**
     * Explicit transactions on these connections start with {@code BEGIN IMMEDIATE}, so a
     * claim holds the write lock from its candidate scan to its commit.
     */
    public Connection openConnection() throws SQLException {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        sqlite.setBusyTimeout(HarvestMeshConfig.DEFAULT_BUSY_TIMEOUT_MS);
        sqlite.enforceForeignKeys(true);
        return DriverManager.getConnection(jdbcUrl, sqlite.toProperties());
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS tasks (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        item_id INTEGER NOT NULL UNIQUE,
                        status TEXT NOT NULL DEFAULT 'pending',
                        worker_id TEXT,
                        attempts INTEGER NOT NULL DEFAULT 0,
                        max_attempts INTEGER NOT NULL DEFAULT 5,
                        created_at_ms INTEGER NOT NULL,
                        last_attempt_at_ms INTEGER,
                        completed_at_ms INTEGER,
                        CHECK (status IN ('pending', 'processing', 'completed', 'failed'))
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS proxies (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        proxy TEXT NOT NULL UNIQUE,
                        status TEXT NOT NULL DEFAULT 'available',
                        locked_by TEXT,
                        locked_at_ms INTEGER,
                        uses_count INTEGER NOT NULL DEFAULT 0,
                        blocks_count INTEGER NOT NULL DEFAULT 0,
                        last_used_at_ms INTEGER,
                        created_at_ms INTEGER NOT NULL,
                        CHECK (status IN ('available', 'locked', 'blocked'))
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS workers (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        worker_id TEXT NOT NULL UNIQUE,
                        status TEXT NOT NULL DEFAULT 'active',
                        tasks_processed INTEGER NOT NULL DEFAULT 0,
                        tasks_failed INTEGER NOT NULL DEFAULT 0,
                        started_at_ms INTEGER NOT NULL,
                        last_heartbeat_ms INTEGER NOT NULL,
                        CHECK (status IN ('active', 'stopped'))
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS results (
                        item_id INTEGER PRIMARY KEY,
                        title TEXT,
                        description TEXT,
                        characteristics TEXT,
                        price TEXT,
                        published_at TEXT,
                        seller_name TEXT,
                        seller_profile_url TEXT,
                        location_address TEXT,
                        location_metro TEXT,
                        location_region TEXT,
                        views_total INTEGER,
                        status TEXT NOT NULL,
                        failure_reason TEXT,
                        worker_id TEXT,
                        attempts INTEGER NOT NULL DEFAULT 0,
                        processed_at_ms INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        CHECK (status IN ('success', 'unavailable'))
                    )
                    """);

            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_pending ON tasks(status, created_at_ms) WHERE status='pending'");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_processing ON tasks(status, last_attempt_at_ms) WHERE status='processing'");
            st.execute("CREATE INDEX IF NOT EXISTS idx_proxies_available ON proxies(status, uses_count) WHERE status='available'");
            st.execute("CREATE INDEX IF NOT EXISTS idx_proxies_locked ON proxies(status, locked_at_ms) WHERE status='locked'");
            st.execute("CREATE INDEX IF NOT EXISTS idx_workers_heartbeat ON workers(last_heartbeat_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_results_status_processed ON results(status, processed_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
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
