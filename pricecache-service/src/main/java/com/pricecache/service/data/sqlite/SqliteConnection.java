package com.pricecache.service.data.sqlite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Manages the SQLite connection for the price cache database, in WAL mode.
 * One database file holds bars, coverage metadata, jobs and the universe list.
 */
public class SqliteConnection {

    private static final Logger log = LoggerFactory.getLogger(SqliteConnection.class);

    private final File dbFile;
    private Connection connection;
    private final Object lock = new Object();

    public SqliteConnection(Path dbPath) {
        this.dbFile = dbPath.toFile();
    }

    /**
     * Get the database file.
     */
    public File getDbFile() {
        return dbFile;
    }

    /**
     * Get or create the SQLite connection.
     * Callers that touch the connection from several threads go through
     * {@link #execute} or {@link #executeInTransaction}, which serialize access.
     */
    public Connection getConnection() throws SQLException {
        Connection conn = connection;
        if (conn != null && !conn.isClosed()) {
            return conn;
        }

        synchronized (lock) {
            if (connection == null || connection.isClosed()) {
                connection = createConnection();
            }
            return connection;
        }
    }

    private Connection createConnection() throws SQLException {
        File parentDir = dbFile.getParentFile();
        if (parentDir != null && !parentDir.exists()) {
            parentDir.mkdirs();
        }

        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbFile.getAbsolutePath());

        try (Statement stmt = conn.createStatement()) {
            // WAL mode for concurrent reads during writes
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA synchronous=NORMAL");
            stmt.execute("PRAGMA busy_timeout=5000");
            // 16MB page cache
            stmt.execute("PRAGMA cache_size=-16384");
        }

        log.debug("Created SQLite connection at {}", dbFile.getAbsolutePath());
        return conn;
    }

    /**
     * Run a function against the connection without opening a transaction.
     */
    public <T> T execute(TransactionFunction<T> function) throws SQLException {
        Connection conn = getConnection();
        synchronized (lock) {
            return function.apply(conn);
        }
    }

    /**
     * Execute a function within a transaction.
     * Automatically commits on success, rolls back on failure.
     */
    public <T> T executeInTransaction(TransactionFunction<T> function) throws SQLException {
        Connection conn = getConnection();
        synchronized (lock) {
            boolean autoCommitOriginal = conn.getAutoCommit();
            if (!autoCommitOriginal) {
                // Already inside a transaction on this thread
                return function.apply(conn);
            }
            try {
                conn.setAutoCommit(false);
                T result = function.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed: {}", rollbackEx.getMessage());
                }
                throw e;
            } finally {
                try {
                    conn.setAutoCommit(true);
                } catch (SQLException e) {
                    log.warn("Could not restore auto-commit: {}", e.getMessage());
                }
            }
        }
    }

    /**
     * Execute a void function within a transaction.
     */
    public void runInTransaction(TransactionConsumer consumer) throws SQLException {
        executeInTransaction(conn -> {
            consumer.accept(conn);
            return null;
        });
    }

    /**
     * Close the connection (call on application shutdown).
     */
    public void close() {
        synchronized (lock) {
            if (connection != null) {
                try {
                    connection.close();
                    log.debug("Closed SQLite connection at {}", dbFile);
                } catch (SQLException e) {
                    log.warn("Error closing connection at {}: {}", dbFile, e.getMessage());
                }
                connection = null;
            }
        }
    }

    /**
     * Functional interface for operations returning a value.
     */
    @FunctionalInterface
    public interface TransactionFunction<T> {
        T apply(Connection connection) throws SQLException;
    }

    /**
     * Functional interface for operations with no return value.
     */
    @FunctionalInterface
    public interface TransactionConsumer {
        void accept(Connection connection) throws SQLException;
    }
}
