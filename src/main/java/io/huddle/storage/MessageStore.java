package io.huddle.storage;

import io.huddle.config.HuddleConfig;
import io.huddle.model.MessageType;
import io.huddle.model.MessageView;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Optional;

/**
 * Append-only message rows. Delivery to a project is a read-time filter on {@code to_target}, not a fan-out.
 */
public final class MessageStore extends SqlSupport {
    private static final String COLUMNS =
            "id,from_instance,from_project,to_target,message_type,subject,body,is_read,created_at_ms,expires_at_ms";

    public MessageStore(Database database) {
        super(database);
    }

    public long insert(NewMessage m) {
        String sql = """
                INSERT INTO messages(from_instance,from_project,to_target,message_type,subject,body,is_read,created_at_ms,expires_at_ms)
                VALUES(?,?,?,?,?,?,0,?,?)
                """;
        return insertReturningId(sql, ps -> {
            ps.setString(1, m.fromInstance());
            setNullableString(ps, 2, m.fromProject());
            ps.setString(3, m.toTarget());
            ps.setString(4, m.type().wireValue());
            ps.setString(5, m.subject());
            setNullableString(ps, 6, m.body());
            ps.setLong(7, m.createdAtMs());
            if (m.expiresAtMs() == null) {
                ps.setNull(8, Types.BIGINT);
            } else {
                ps.setLong(8, m.expiresAtMs());
            }
        }, "Failed to send message to " + m.toTarget());
    }

    /**
     * Messages visible to an instance: addressed to its id, its project, or the broadcast marker.
     */
    public List<MessageView> inbox(String instanceId, String project, boolean includeRead, long nowMs, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM messages"
                + " WHERE to_target IN (?,?,?)"
                + (includeRead ? "" : " AND is_read=0")
                + " AND (expires_at_ms IS NULL OR expires_at_ms>?)"
                + " ORDER BY created_at_ms DESC, id DESC LIMIT ?";
        return queryList(sql, ps -> {
            ps.setString(1, instanceId);
            ps.setString(2, project == null ? "" : project);
            ps.setString(3, HuddleConfig.BROADCAST_TARGET);
            ps.setLong(4, nowMs);
            ps.setInt(5, Math.max(1, limit));
        }, MessageStore::map, "Failed to read inbox for " + instanceId);
    }

    public int countUnread(String instanceId, String project, long nowMs) {
        String sql = """
                SELECT COUNT(1) FROM messages
                WHERE to_target IN (?,?,?) AND is_read=0 AND (expires_at_ms IS NULL OR expires_at_ms>?)
                """;
        return queryOne(sql, ps -> {
            ps.setString(1, instanceId);
            ps.setString(2, project == null ? "" : project);
            ps.setString(3, HuddleConfig.BROADCAST_TARGET);
            ps.setLong(4, nowMs);
        }, rs -> rs.getInt(1), "Failed to count unread messages").orElse(0);
    }

    /**
     * Flips the read flag and returns the full row in one transaction. Reading an already-read message
     * still returns it.
     */
    public Optional<MessageView> markRead(long messageId) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement up = c.prepareStatement("UPDATE messages SET is_read=1 WHERE id=?");
                 PreparedStatement sel = c.prepareStatement("SELECT " + COLUMNS + " FROM messages WHERE id=?")) {
                up.setLong(1, messageId);
                if (up.executeUpdate() == 0) {
                    c.commit();
                    return Optional.empty();
                }
                sel.setLong(1, messageId);
                MessageView view;
                try (ResultSet rs = sel.executeQuery()) {
                    view = rs.next() ? map(rs) : null;
                }
                c.commit();
                return Optional.ofNullable(view);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read message #" + messageId, e);
        }
    }

    public List<MessageView> recent(long sinceMs, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM messages WHERE created_at_ms>? ORDER BY created_at_ms DESC, id DESC LIMIT ?";
        return queryList(sql, ps -> {
            ps.setLong(1, sinceMs);
            ps.setInt(2, Math.max(1, limit));
        }, MessageStore::map, "Failed to list recent messages");
    }

    public int deleteExpired(long nowMs) {
        return update("DELETE FROM messages WHERE expires_at_ms IS NOT NULL AND expires_at_ms<?",
                ps -> ps.setLong(1, nowMs), "Failed to remove expired messages");
    }

    private static MessageView map(ResultSet rs) throws SQLException {
        return new MessageView(
                rs.getLong("id"),
                rs.getString("from_instance"),
                rs.getString("from_project"),
                rs.getString("to_target"),
                rs.getString("message_type"),
                rs.getString("subject"),
                rs.getString("body"),
                rs.getInt("is_read") == 1,
                rs.getLong("created_at_ms"),
                nullableLong(rs, "expires_at_ms")
        );
    }

    public record NewMessage(String fromInstance, String fromProject, String toTarget, MessageType type,
                             String subject, String body, long createdAtMs, Long expiresAtMs) {
    }
}
