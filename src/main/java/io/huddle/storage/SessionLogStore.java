package io.huddle.storage;

import io.huddle.model.SessionAction;
import io.huddle.model.SessionLogEntry;
import io.huddle.util.Jsons;

import java.util.List;

public final class SessionLogStore extends SqlSupport {
    public SessionLogStore(Database database) {
        super(database);
    }

    public long append(String instanceId, String project, SessionAction action, String summary,
                       List<String> filesModified, long nowMs) {
        String sql = "INSERT INTO session_log(instance_id,project,action,summary,files_modified,created_at_ms) VALUES(?,?,?,?,?,?)";
        return insertReturningId(sql, ps -> {
            ps.setString(1, instanceId);
            ps.setString(2, project == null ? "" : project);
            ps.setString(3, action.wireValue());
            ps.setString(4, summary);
            ps.setString(5, Jsons.encodeList(filesModified));
            ps.setLong(6, nowMs);
        }, "Failed to append session log for " + instanceId);
    }

    public List<SessionLogEntry> recent(long sinceMs, int limit) {
        String sql = """
                SELECT id,instance_id,project,action,summary,files_modified,created_at_ms
                FROM session_log WHERE created_at_ms>? ORDER BY created_at_ms DESC, id DESC LIMIT ?
                """;
        return queryList(sql, ps -> {
            ps.setLong(1, sinceMs);
            ps.setInt(2, Math.max(1, limit));
        }, rs -> new SessionLogEntry(
                rs.getLong("id"),
                rs.getString("instance_id"),
                rs.getString("project"),
                rs.getString("action"),
                rs.getString("summary"),
                Jsons.decodeList(rs.getString("files_modified")),
                rs.getLong("created_at_ms")
        ), "Failed to list session activity");
    }

    public int purgeOlderThan(long cutoffMs) {
        return update("DELETE FROM session_log WHERE created_at_ms<?", ps -> ps.setLong(1, cutoffMs),
                "Failed to purge session log");
    }
}
