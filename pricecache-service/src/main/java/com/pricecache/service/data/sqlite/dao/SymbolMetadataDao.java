package com.pricecache.service.data.sqlite.dao;

import com.pricecache.core.model.CoverageMetadata;
import com.pricecache.service.data.sqlite.SqliteConnection;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * DAO for per-symbol coverage metadata.
 * Rows with no bars may exist to carry the universe flag; they have null bounds.
 */
public class SymbolMetadataDao {

    private final SqliteConnection conn;

    public SymbolMetadataDao(SqliteConnection conn) {
        this.conn = conn;
    }

    /**
     * Recompute bounds and count from the bars table.
     * Deletes the row when the symbol has no bars left.
     * Universe flag, status and last_full_refresh are preserved.
     *
     * @return the recomputed bar count
     */
    public long recompute(String symbol, Instant now) throws SQLException {
        Connection c = conn.getConnection();

        String sql = """
            INSERT INTO symbol_metadata (symbol, first_date, last_date, last_updated, total_bars)
            SELECT ?, MIN(date), MAX(date), ?, COUNT(*)
            FROM bars WHERE symbol = ?
            ON CONFLICT(symbol) DO UPDATE SET
                first_date = excluded.first_date,
                last_date = excluded.last_date,
                last_updated = excluded.last_updated,
                total_bars = excluded.total_bars
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, symbol);
            stmt.setLong(2, now.toEpochMilli());
            stmt.setString(3, symbol);
            stmt.executeUpdate();
        }

        long total;
        try (PreparedStatement stmt = c.prepareStatement(
                "SELECT total_bars FROM symbol_metadata WHERE symbol = ?")) {
            stmt.setString(1, symbol);
            try (ResultSet rs = stmt.executeQuery()) {
                total = rs.next() ? rs.getLong(1) : 0;
            }
        }

        if (total == 0) {
            delete(symbol);
        }
        return total;
    }

    /**
     * Get metadata for a symbol, or null if no row exists.
     */
    public CoverageMetadata get(String symbol) throws SQLException {
        Connection c = conn.getConnection();
        try (PreparedStatement stmt = c.prepareStatement(
                "SELECT * FROM symbol_metadata WHERE symbol = ?")) {
            stmt.setString(1, symbol);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? readMetadata(rs) : null;
            }
        }
    }

    public void delete(String symbol) throws SQLException {
        Connection c = conn.getConnection();
        try (PreparedStatement stmt = c.prepareStatement("DELETE FROM symbol_metadata WHERE symbol = ?")) {
            stmt.setString(1, symbol);
            stmt.executeUpdate();
        }
    }

    public void setLastFullRefresh(String symbol, Instant when) throws SQLException {
        Connection c = conn.getConnection();
        try (PreparedStatement stmt = c.prepareStatement(
                "UPDATE symbol_metadata SET last_full_refresh = ? WHERE symbol = ?")) {
            stmt.setLong(1, when.toEpochMilli());
            stmt.setString(2, symbol);
            stmt.executeUpdate();
        }
    }

    /**
     * Flag symbols as universe members, creating bare rows for unseen symbols.
     */
    public int markUniverse(Collection<String> symbols) throws SQLException {
        if (symbols.isEmpty()) {
            return 0;
        }
        Connection c = conn.getConnection();
        String sql = """
            INSERT INTO symbol_metadata (symbol, in_universe)
            VALUES (?, 1)
            ON CONFLICT(symbol) DO UPDATE SET in_universe = 1
            """;
        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            for (String symbol : symbols) {
                stmt.setString(1, symbol);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
        return symbols.size();
    }

    /**
     * Clear the universe flag on every row.
     */
    public int clearUniverse() throws SQLException {
        Connection c = conn.getConnection();
        try (Statement stmt = c.createStatement()) {
            return stmt.executeUpdate("UPDATE symbol_metadata SET in_universe = 0 WHERE in_universe = 1");
        }
    }

    /**
     * Symbols with at least one cached bar, alphabetically.
     */
    public List<String> cachedSymbols() throws SQLException {
        return querySymbols("SELECT symbol FROM symbol_metadata WHERE total_bars > 0 ORDER BY symbol");
    }

    /**
     * Metadata of universe members that hold bars.
     */
    public List<CoverageMetadata> universeWithBars() throws SQLException {
        Connection c = conn.getConnection();
        List<CoverageMetadata> result = new ArrayList<>();
        try (PreparedStatement stmt = c.prepareStatement("""
                SELECT * FROM symbol_metadata
                WHERE in_universe = 1 AND total_bars > 0
                ORDER BY symbol
                """);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                result.add(readMetadata(rs));
            }
        }
        return result;
    }

    /**
     * Universe members holding bars whose last store is older than cutoff.
     */
    public List<String> staleUniverseSymbols(Instant cutoff) throws SQLException {
        Connection c = conn.getConnection();
        try (PreparedStatement stmt = c.prepareStatement("""
                SELECT symbol FROM symbol_metadata
                WHERE in_universe = 1 AND total_bars > 0
                  AND (last_updated IS NULL OR last_updated < ?)
                ORDER BY last_updated
                """)) {
            stmt.setLong(1, cutoff.toEpochMilli());
            return readSymbols(stmt);
        }
    }

    /**
     * Symbols whose full refresh or rolling refresh is due, oldest update first.
     */
    public List<String> symbolsNeedingRefresh(Instant fullCutoff, Instant rollingCutoff, int limit)
            throws SQLException {
        Connection c = conn.getConnection();
        try (PreparedStatement stmt = c.prepareStatement("""
                SELECT symbol FROM symbol_metadata
                WHERE total_bars > 0
                  AND ((last_full_refresh IS NULL OR last_full_refresh < ?)
                    OR (last_updated IS NULL OR last_updated < ?))
                ORDER BY last_updated ASC
                LIMIT ?
                """)) {
            stmt.setLong(1, fullCutoff.toEpochMilli());
            stmt.setLong(2, rollingCutoff.toEpochMilli());
            stmt.setInt(3, limit);
            return readSymbols(stmt);
        }
    }

    public long countUniverseWithBars() throws SQLException {
        Connection c = conn.getConnection();
        try (Statement stmt = c.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT COUNT(*) FROM symbol_metadata WHERE in_universe = 1 AND total_bars > 0")) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    private List<String> querySymbols(String sql) throws SQLException {
        Connection c = conn.getConnection();
        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            return readSymbols(stmt);
        }
    }

    private List<String> readSymbols(PreparedStatement stmt) throws SQLException {
        List<String> symbols = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                symbols.add(rs.getString(1));
            }
        }
        return symbols;
    }

    private CoverageMetadata readMetadata(ResultSet rs) throws SQLException {
        String first = rs.getString("first_date");
        String last = rs.getString("last_date");
        return new CoverageMetadata(
            rs.getString("symbol"),
            first != null ? LocalDate.parse(first) : null,
            last != null ? LocalDate.parse(last) : null,
            readInstant(rs, "last_updated"),
            readInstant(rs, "last_full_refresh"),
            rs.getLong("total_bars"),
            rs.getInt("in_universe") == 1,
            rs.getString("status")
        );
    }

    static Instant readInstant(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }
}
