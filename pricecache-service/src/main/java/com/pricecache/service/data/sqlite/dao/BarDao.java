package com.pricecache.service.data.sqlite.dao;

import com.pricecache.core.model.Bar;
import com.pricecache.service.data.sqlite.SqliteConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * DAO for daily OHLCV bars, keyed by (symbol, date).
 */
public class BarDao {

    private static final Logger log = LoggerFactory.getLogger(BarDao.class);

    private final SqliteConnection conn;

    public BarDao(SqliteConnection conn) {
        this.conn = conn;
    }

    /**
     * Upsert bars in a batch. Existing (symbol, date) rows are replaced in place.
     */
    public int insertBatch(List<Bar> bars) throws SQLException {
        if (bars.isEmpty()) {
            return 0;
        }

        return conn.executeInTransaction(c -> {
            String sql = """
                INSERT OR REPLACE INTO bars
                (symbol, date, open, high, low, close, volume)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

            int count = 0;
            try (PreparedStatement stmt = c.prepareStatement(sql)) {
                for (Bar bar : bars) {
                    stmt.setString(1, bar.symbol());
                    stmt.setString(2, bar.date().toString());
                    stmt.setDouble(3, bar.open());
                    stmt.setDouble(4, bar.high());
                    stmt.setDouble(5, bar.low());
                    stmt.setDouble(6, bar.close());
                    stmt.setDouble(7, bar.volume());
                    stmt.addBatch();

                    // Execute in batches of 1000
                    if (++count % 1000 == 0) {
                        stmt.executeBatch();
                    }
                }
                stmt.executeBatch();
            }

            log.debug("Upserted {} bars", bars.size());
            return bars.size();
        });
    }

    /**
     * Query bars for a symbol in [start, end] inclusive, ordered by date.
     */
    public List<Bar> query(String symbol, LocalDate start, LocalDate end) throws SQLException {
        Connection c = conn.getConnection();
        List<Bar> bars = new ArrayList<>();

        String sql = """
            SELECT symbol, date, open, high, low, close, volume
            FROM bars
            WHERE symbol = ? AND date >= ? AND date <= ?
            ORDER BY date
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, symbol);
            stmt.setString(2, start.toString());
            stmt.setString(3, end.toString());

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    bars.add(readBar(rs));
                }
            }
        }

        return bars;
    }

    /**
     * Delete bars for a symbol in [start, end] inclusive.
     */
    public int deleteRange(String symbol, LocalDate start, LocalDate end) throws SQLException {
        Connection c = conn.getConnection();
        try (PreparedStatement stmt = c.prepareStatement(
                "DELETE FROM bars WHERE symbol = ? AND date >= ? AND date <= ?")) {
            stmt.setString(1, symbol);
            stmt.setString(2, start.toString());
            stmt.setString(3, end.toString());
            return stmt.executeUpdate();
        }
    }

    /**
     * Delete every bar for a symbol.
     */
    public int deleteAll(String symbol) throws SQLException {
        Connection c = conn.getConnection();
        try (PreparedStatement stmt = c.prepareStatement("DELETE FROM bars WHERE symbol = ?")) {
            stmt.setString(1, symbol);
            return stmt.executeUpdate();
        }
    }

    /**
     * Count bars for a symbol.
     */
    public long count(String symbol) throws SQLException {
        Connection c = conn.getConnection();
        try (PreparedStatement stmt = c.prepareStatement("SELECT COUNT(*) FROM bars WHERE symbol = ?")) {
            stmt.setString(1, symbol);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        }
    }

    /**
     * Total rows and distinct symbols across the table.
     */
    public long[] totals() throws SQLException {
        Connection c = conn.getConnection();
        try (PreparedStatement stmt = c.prepareStatement(
                "SELECT COUNT(*), COUNT(DISTINCT symbol) FROM bars");
             ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                return new long[]{rs.getLong(1), rs.getLong(2)};
            }
            return new long[]{0, 0};
        }
    }

    private Bar readBar(ResultSet rs) throws SQLException {
        return new Bar(
            rs.getString("symbol"),
            LocalDate.parse(rs.getString("date")),
            rs.getDouble("open"),
            rs.getDouble("high"),
            rs.getDouble("low"),
            rs.getDouble("close"),
            rs.getDouble("volume")
        );
    }
}
