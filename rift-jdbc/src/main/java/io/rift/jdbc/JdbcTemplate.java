package io.rift.jdbc;

import io.rift.EventStoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JDBC helper for the event stores, purgers and rule loader.
 * Checked {@link SQLException}s are rethrown as {@link EventStoreException}.
 */
public final class JdbcTemplate {

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    @FunctionalInterface
    public interface RowCallback {
        void processRow(ResultSet rs) throws SQLException;
    }

    /** Execute an INSERT, UPDATE or DELETE, return rows affected. */
    public static int update(Connection conn, String sql, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new EventStoreException("Failed to execute update", e);
        }
    }

    /** Execute SELECT, map rows. */
    public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
        List<T> results = new ArrayList<>();
        forEach(conn, sql, rs -> results.add(mapper.map(rs)), params);
        return results;
    }

    /** Execute SELECT, hand each row to {@code callback} without collecting. */
    public static void forEach(Connection conn, String sql, RowCallback callback, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    callback.processRow(rs);
                }
            }
        } catch (SQLException e) {
            throw new EventStoreException("Failed to execute query", e);
        }
    }

    /** Execute a single-column SELECT returning one numeric value. */
    public static long queryForLong(Connection conn, String sql, Object... params) {
        List<Long> values = query(conn, sql, rs -> rs.getLong(1), params);
        return values.isEmpty() ? 0L : values.get(0);
    }

    /**
     * Returns {@code true} if {@code e} reports an integrity constraint
     * violation (SQLState class {@code 23}).
     */
    public static boolean isConstraintViolation(SQLException e) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            String state = current.getSQLState();
            if (state != null && state.startsWith("23")) {
                return true;
            }
        }
        return false;
    }

    private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            Object param = params[i];
            if (param == null) {
                ps.setObject(i + 1, null);
            } else if (param instanceof String s) {
                ps.setString(i + 1, s);
            } else if (param instanceof Integer n) {
                ps.setInt(i + 1, n);
            } else if (param instanceof Long n) {
                ps.setLong(i + 1, n);
            } else if (param instanceof Timestamp ts) {
                ps.setTimestamp(i + 1, ts);
            } else {
                ps.setObject(i + 1, param);
            }
        }
    }

    private JdbcTemplate() {}
}
