package io.huddle.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Connection-per-call helpers shared by the stores. Each call opens, runs one statement and closes.
 */
abstract class SqlSupport {
    protected final Database database;

    protected SqlSupport(Database database) {
        this.database = database;
    }

    protected interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    protected interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    protected int update(String sql, Binder binder, String failure) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException(failure, e);
        }
    }

    protected long insertReturningId(String sql, Binder binder, String failure) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No generated key returned");
                }
                return keys.getLong(1);
            }
        } catch (SQLException e) {
            throw new StorageException(failure, e);
        }
    }

    protected <T> List<T> queryList(String sql, Binder binder, RowMapper<T> mapper, String failure) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            List<T> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapper.map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException(failure, e);
        }
    }

    protected <T> Optional<T> queryOne(String sql, Binder binder, RowMapper<T> mapper, String failure) {
        List<T> rows = queryList(sql, binder, mapper, failure);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    protected static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    protected static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    /**
     * Escapes LIKE wildcards so user search text matches literally; pair with {@code ESCAPE '\'}.
     */
    protected static String likeContains(String raw) {
        String v = raw == null ? "" : raw.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(v.length() + 2).append('%');
        for (int i = 0; i < v.length(); i++) {
            char ch = v.charAt(i);
            if (ch == '%' || ch == '_' || ch == '\\') {
                sb.append('\\');
            }
            sb.append(ch);
        }
        return sb.append('%').toString();
    }
}
