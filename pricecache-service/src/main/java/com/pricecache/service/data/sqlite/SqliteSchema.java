package com.pricecache.service.data.sqlite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Manages the SQLite schema for the price cache database.
 * Database file: ~/.pricecache/data/price_cache.db
 */
public class SqliteSchema {

    private static final Logger log = LoggerFactory.getLogger(SqliteSchema.class);

    // Current schema version - increment when schema changes
    public static final int CURRENT_VERSION = 1;

    /**
     * Initialize the schema. Creates all tables if they don't exist.
     */
    public static void initialize(Connection conn) throws SQLException {
        int currentVersion = getSchemaVersion(conn);

        if (currentVersion == 0) {
            createAllTables(conn);
            setSchemaVersion(conn, CURRENT_VERSION);
            log.info("Created price cache schema v{}", CURRENT_VERSION);
        } else if (currentVersion > CURRENT_VERSION) {
            throw new SQLException("Database schema v" + currentVersion
                + " is newer than supported v" + CURRENT_VERSION);
        } else {
            log.debug("Price cache schema v{} up to date", currentVersion);
        }
    }

    /**
     * Get the current schema version (0 if none set).
     */
    static int getSchemaVersion(Connection conn) throws SQLException {
        try (ResultSet rs = conn.getMetaData().getTables(null, null, "schema_version", null)) {
            if (!rs.next()) {
                return 0;
            }
        }

        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM schema_version")) {
            if (rs.next()) {
                return rs.getInt(1);
            }
        }
        return 0;
    }

    private static void setSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_version (version, applied_at) VALUES (?, ?)")) {
            stmt.setInt(1, version);
            stmt.setLong(2, System.currentTimeMillis());
            stmt.executeUpdate();
        }
    }

    private static void createAllTables(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS schema_version (
                    version INTEGER PRIMARY KEY,
                    applied_at INTEGER NOT NULL
                )
                """);

            // Daily bars, one row per (symbol, date); dates are ISO text
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS bars (
                    symbol TEXT NOT NULL,
                    date TEXT NOT NULL,
                    open REAL NOT NULL,
                    high REAL NOT NULL,
                    low REAL NOT NULL,
                    close REAL NOT NULL,
                    volume REAL NOT NULL DEFAULT 0,
                    UNIQUE(symbol, date)
                )
                """);

            // Coverage summary per symbol; timestamps are epoch millis
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS symbol_metadata (
                    symbol TEXT PRIMARY KEY,
                    first_date TEXT,
                    last_date TEXT,
                    last_updated INTEGER,
                    last_full_refresh INTEGER,
                    total_bars INTEGER NOT NULL DEFAULT 0,
                    in_universe INTEGER NOT NULL DEFAULT 0,
                    status TEXT NOT NULL DEFAULT 'active'
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS batch_jobs (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    job_type TEXT NOT NULL,
                    status TEXT NOT NULL,
                    started_at INTEGER,
                    completed_at INTEGER,
                    tickers_total INTEGER NOT NULL DEFAULT 0,
                    tickers_processed INTEGER NOT NULL DEFAULT 0,
                    tickers_failed INTEGER NOT NULL DEFAULT 0,
                    error_summary TEXT
                )
                """);

            // At most one running job system-wide
            stmt.execute("""
                CREATE UNIQUE INDEX IF NOT EXISTS idx_batch_jobs_single_running
                ON batch_jobs(status) WHERE status = 'running'
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS universe_constituents (
                    symbol TEXT PRIMARY KEY,
                    company_name TEXT,
                    sector TEXT,
                    added_at INTEGER
                )
                """);

            // Single row describing the cached constituent list
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS universe_list_metadata (
                    id INTEGER PRIMARY KEY CHECK (id = 1),
                    last_refreshed INTEGER,
                    source TEXT,
                    symbol_count INTEGER
                )
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_metadata_updated
                ON symbol_metadata(last_updated)
                """);
        }
    }
}
