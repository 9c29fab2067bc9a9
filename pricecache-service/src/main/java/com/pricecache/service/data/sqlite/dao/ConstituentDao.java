package com.pricecache.service.data.sqlite.dao;

import com.pricecache.service.data.sqlite.SqliteConnection;
import com.pricecache.service.universe.Constituent;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * DAO for the cached universe constituent list and its single metadata row.
 */
public class ConstituentDao {

    private final SqliteConnection conn;

    public ConstituentDao(SqliteConnection conn) {
        this.conn = conn;
    }

    /**
     * Replace the whole list and stamp the metadata row.
     */
    public void replaceAll(List<Constituent> constituents, String source, Instant now) throws SQLException {
        conn.runInTransaction(c -> {
            try (Statement stmt = c.createStatement()) {
                stmt.executeUpdate("DELETE FROM universe_constituents");
            }

            try (PreparedStatement stmt = c.prepareStatement("""
                    INSERT OR REPLACE INTO universe_constituents (symbol, company_name, sector, added_at)
                    VALUES (?, ?, ?, ?)
                    """)) {
                for (Constituent constituent : constituents) {
                    stmt.setString(1, constituent.symbol());
                    stmt.setString(2, constituent.companyName());
                    stmt.setString(3, constituent.sector());
                    stmt.setLong(4, now.toEpochMilli());
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }

            try (PreparedStatement stmt = c.prepareStatement("""
                    INSERT OR REPLACE INTO universe_list_metadata (id, last_refreshed, source, symbol_count)
                    VALUES (1, ?, ?, ?)
                    """)) {
                stmt.setLong(1, now.toEpochMilli());
                stmt.setString(2, source);
                stmt.setInt(3, constituents.size());
                stmt.executeUpdate();
            }
        });
    }

    /**
     * Cached constituent symbols, alphabetically.
     */
    public List<String> symbols() throws SQLException {
        Connection c = conn.getConnection();
        List<String> symbols = new ArrayList<>();
        try (Statement stmt = c.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT symbol FROM universe_constituents ORDER BY symbol")) {
            while (rs.next()) {
                symbols.add(rs.getString(1));
            }
        }
        return symbols;
    }

    /**
     * Metadata of the cached list, or null if it was never refreshed.
     */
    public ListMetadata getListMetadata() throws SQLException {
        Connection c = conn.getConnection();
        try (Statement stmt = c.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT last_refreshed, source, symbol_count FROM universe_list_metadata WHERE id = 1")) {
            if (!rs.next()) {
                return null;
            }
            return new ListMetadata(
                SymbolMetadataDao.readInstant(rs, "last_refreshed"),
                rs.getString("source"),
                rs.getInt("symbol_count"));
        }
    }

    public record ListMetadata(Instant lastRefreshed, String source, int symbolCount) {}
}
