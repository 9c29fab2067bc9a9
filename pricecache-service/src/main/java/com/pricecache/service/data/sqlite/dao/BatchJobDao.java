package com.pricecache.service.data.sqlite.dao;

import com.pricecache.core.model.BatchJob;
import com.pricecache.core.model.JobStatus;
import com.pricecache.service.data.sqlite.SqliteConnection;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;

/**
 * DAO for batch job rows.
 * A partial unique index keeps at most one row in the running state.
 */
public class BatchJobDao {

    private final SqliteConnection conn;

    public BatchJobDao(SqliteConnection conn) {
        this.conn = conn;
    }

    /**
     * Insert a new job already in the running state.
     *
     * @return the new job id
     */
    public long createRunning(String jobType, int tickersTotal, Instant startedAt) throws SQLException {
        return conn.executeInTransaction(c -> {
            try (PreparedStatement stmt = c.prepareStatement("""
                    INSERT INTO batch_jobs (job_type, status, started_at, tickers_total)
                    VALUES (?, ?, ?, ?)
                    """)) {
                stmt.setString(1, jobType);
                stmt.setString(2, JobStatus.RUNNING.value());
                stmt.setLong(3, startedAt.toEpochMilli());
                stmt.setInt(4, tickersTotal);
                stmt.executeUpdate();
            }
            try (Statement stmt = c.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
                rs.next();
                return rs.getLong(1);
            }
        });
    }

    public void updateProgress(long id, int processed, int failed) throws SQLException {
        Connection c = conn.getConnection();
        try (PreparedStatement stmt = c.prepareStatement("""
                UPDATE batch_jobs
                SET tickers_processed = MAX(tickers_processed, ?),
                    tickers_failed = MAX(tickers_failed, ?)
                WHERE id = ? AND status = 'running'
                """)) {
            stmt.setInt(1, processed);
            stmt.setInt(2, failed);
            stmt.setLong(3, id);
            stmt.executeUpdate();
        }
    }

    /**
     * Move a running job to a terminal state. No-op if the job already finished.
     */
    public boolean complete(long id, JobStatus status, String errorSummary, Instant completedAt)
            throws SQLException {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        Connection c = conn.getConnection();
        try (PreparedStatement stmt = c.prepareStatement("""
                UPDATE batch_jobs
                SET status = ?, error_summary = ?, completed_at = ?
                WHERE id = ? AND status = 'running'
                """)) {
            stmt.setString(1, status.value());
            stmt.setString(2, errorSummary);
            stmt.setLong(3, completedAt.toEpochMilli());
            stmt.setLong(4, id);
            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Close every running job as failed. Used on startup after an unclean exit.
     */
    public int failRunning(String reason, Instant completedAt) throws SQLException {
        Connection c = conn.getConnection();
        try (PreparedStatement stmt = c.prepareStatement("""
                UPDATE batch_jobs
                SET status = 'failed', error_summary = ?, completed_at = ?
                WHERE status = 'running'
                """)) {
            stmt.setString(1, reason);
            stmt.setLong(2, completedAt.toEpochMilli());
            return stmt.executeUpdate();
        }
    }

    public BatchJob get(long id) throws SQLException {
        Connection c = conn.getConnection();
        try (PreparedStatement stmt = c.prepareStatement("SELECT * FROM batch_jobs WHERE id = ?")) {
            stmt.setLong(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? readJob(rs) : null;
            }
        }
    }

    public BatchJob latest() throws SQLException {
        return queryOne("SELECT * FROM batch_jobs ORDER BY id DESC LIMIT 1");
    }

    private BatchJob queryOne(String sql) throws SQLException {
        Connection c = conn.getConnection();
        try (Statement stmt = c.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? readJob(rs) : null;
        }
    }

    private BatchJob readJob(ResultSet rs) throws SQLException {
        return new BatchJob(
            rs.getLong("id"),
            rs.getString("job_type"),
            JobStatus.fromValue(rs.getString("status")),
            rs.getInt("tickers_total"),
            rs.getInt("tickers_processed"),
            rs.getInt("tickers_failed"),
            SymbolMetadataDao.readInstant(rs, "started_at"),
            SymbolMetadataDao.readInstant(rs, "completed_at"),
            rs.getString("error_summary")
        );
    }
}
