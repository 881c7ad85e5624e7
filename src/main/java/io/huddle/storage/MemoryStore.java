package io.huddle.storage;

import io.huddle.model.MemoryEntry;
import io.huddle.model.MemoryPatch;
import io.huddle.model.MemoryScope;
import io.huddle.model.MemoryStatus;
import io.huddle.util.Jsons;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Project and global knowledge entries. Rows are never deleted; a project entry leaves recall by
 * moving out of {@code active}.
 */
public final class MemoryStore extends SqlSupport {
    public MemoryStore(Database database) {
        super(database);
    }

    public long insert(NewMemory m) {
        if (m.scope() == MemoryScope.GLOBAL) {
            String sql = """
                    INSERT INTO global_memory(memory_type,title,content,tags,created_by,created_at_ms,updated_at_ms)
                    VALUES(?,?,?,?,?,?,?)
                    """;
            return insertReturningId(sql, ps -> {
                ps.setString(1, m.type());
                ps.setString(2, m.title());
                ps.setString(3, m.content());
                ps.setString(4, Jsons.encodeList(m.tags()));
                ps.setString(5, m.createdBy());
                ps.setLong(6, m.nowMs());
                ps.setLong(7, m.nowMs());
            }, "Failed to store global memory");
        }
        String sql = """
                INSERT INTO project_memory(project,memory_type,title,content,status,tags,related_files,created_by,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?)
                """;
        return insertReturningId(sql, ps -> {
            ps.setString(1, m.project());
            ps.setString(2, m.type());
            ps.setString(3, m.title());
            ps.setString(4, m.content());
            ps.setString(5, MemoryStatus.ACTIVE.wireValue());
            ps.setString(6, Jsons.encodeList(m.tags()));
            ps.setString(7, Jsons.encodeList(m.relatedFiles()));
            ps.setString(8, m.createdBy());
            ps.setLong(9, m.nowMs());
            ps.setLong(10, m.nowMs());
        }, "Failed to store project memory for " + m.project());
    }

    /**
     * Filtered select, most recently updated first. Project recall only returns {@code active} rows.
     */
    public List<MemoryEntry> recall(RecallQuery q) {
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(q.scope().table()).append(" WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (q.scope() == MemoryScope.PROJECT) {
            sql.append(" AND project=? AND status=?");
            params.add(q.project());
            params.add(MemoryStatus.ACTIVE.wireValue());
        }
        if (q.type() != null && !q.type().isBlank()) {
            sql.append(" AND memory_type=?");
            params.add(q.type());
        }
        if (q.search() != null && !q.search().isBlank()) {
            sql.append(" AND (LOWER(title) LIKE ? ESCAPE '\\' OR LOWER(content) LIKE ? ESCAPE '\\')");
            String pattern = likeContains(q.search());
            params.add(pattern);
            params.add(pattern);
        }
        sql.append(" ORDER BY updated_at_ms DESC, id DESC LIMIT ?");
        params.add(Math.max(1, q.limit()));
        return queryList(sql.toString(), ps -> {
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
        }, rs -> map(rs, q.scope()), "Failed to recall " + q.scope().table());
    }

    /**
     * Writes only the fields present in {@code patch}; {@code updated_at_ms} always moves.
     *
     * @return false when no row has {@code id}
     */
    public boolean update(MemoryScope scope, long id, MemoryPatch patch, long nowMs) {
        if (scope == MemoryScope.GLOBAL && patch.status() != null) {
            throw new IllegalArgumentException("Global memory entries have no status");
        }
        List<String> assignments = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        assignments.add("updated_at_ms=?");
        params.add(nowMs);
        if (patch.content() != null) {
            assignments.add("content=?");
            params.add(patch.content());
        }
        if (patch.status() != null) {
            assignments.add("status=?");
            params.add(patch.status().wireValue());
        }
        if (patch.title() != null) {
            assignments.add("title=?");
            params.add(patch.title());
        }
        params.add(id);
        String sql = "UPDATE " + scope.table() + " SET " + String.join(",", assignments) + " WHERE id=?";
        return update(sql, ps -> {
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
        }, "Failed to update memory #" + id) > 0;
    }

    public Optional<MemoryEntry> find(MemoryScope scope, long id) {
        return queryOne("SELECT * FROM " + scope.table() + " WHERE id=?",
                ps -> ps.setLong(1, id),
                rs -> map(rs, scope),
                "Failed to read memory #" + id);
    }

    private static MemoryEntry map(ResultSet rs, MemoryScope scope) throws SQLException {
        boolean project = scope == MemoryScope.PROJECT;
        return new MemoryEntry(
                rs.getLong("id"),
                scope,
                project ? rs.getString("project") : null,
                rs.getString("memory_type"),
                rs.getString("title"),
                rs.getString("content"),
                Jsons.decodeList(rs.getString("tags")),
                project ? Jsons.decodeList(rs.getString("related_files")) : List.of(),
                project ? rs.getString("status") : null,
                rs.getString("created_by"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    public record NewMemory(MemoryScope scope, String project, String type, String title, String content,
                            List<String> tags, List<String> relatedFiles, String createdBy, long nowMs) {
    }

    public record RecallQuery(MemoryScope scope, String project, String type, String search, int limit) {
    }
}
