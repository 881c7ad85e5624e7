package io.huddle.storage;

import io.huddle.model.InstanceStatus;
import io.huddle.model.InstanceUpdate;
import io.huddle.model.InstanceView;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Presence rows. Liveness is derived from {@code last_heartbeat_ms} by the caller-supplied cutoffs.
 */
public final class InstanceStore extends SqlSupport {
    private static final String COLUMNS =
            "instance_id,project,working_dir,model,status,current_task,started_at_ms,last_heartbeat_ms";

    public InstanceStore(Database database) {
        super(database);
    }

    public void upsert(String instanceId, String project, String workingDir, String model, long nowMs) {
        String sql = """
                INSERT INTO instances(instance_id,project,working_dir,model,status,started_at_ms,last_heartbeat_ms)
                VALUES(?,?,?,?,?,?,?)
                ON CONFLICT(instance_id) DO UPDATE SET last_heartbeat_ms=excluded.last_heartbeat_ms, status=excluded.status
                """;
        update(sql, ps -> {
            ps.setString(1, instanceId);
            ps.setString(2, project);
            setNullableString(ps, 3, workingDir);
            setNullableString(ps, 4, model);
            ps.setString(5, InstanceStatus.ACTIVE.wireValue());
            ps.setLong(6, nowMs);
            ps.setLong(7, nowMs);
        }, "Failed to register instance: " + instanceId);
    }

    /**
     * Applies a heartbeat. Only the columns present in {@code change} are written besides the timestamp.
     *
     * @return false when no presence row exists for {@code instanceId}
     */
    public boolean heartbeat(String instanceId, InstanceUpdate change, long nowMs) {
        InstanceUpdate u = change == null ? InstanceUpdate.heartbeatOnly() : change;
        List<String> assignments = new ArrayList<>();
        assignments.add("last_heartbeat_ms=?");
        if (u.currentTask() != null) {
            assignments.add("current_task=?");
        }
        if (u.status() != null) {
            assignments.add("status=?");
        }
        String sql = "UPDATE instances SET " + String.join(",", assignments) + " WHERE instance_id=?";
        return update(sql, ps -> {
            int i = 1;
            ps.setLong(i++, nowMs);
            if (u.currentTask() != null) {
                ps.setString(i++, u.currentTask());
            }
            if (u.status() != null) {
                ps.setString(i++, u.status().wireValue());
            }
            ps.setString(i, instanceId);
        }, "Failed heartbeat: " + instanceId) == 1;
    }

    public void markBusy(String instanceId, String taskLabel, long nowMs) {
        update("UPDATE instances SET current_task=?,status=?,last_heartbeat_ms=? WHERE instance_id=?", ps -> {
            setNullableString(ps, 1, taskLabel);
            ps.setString(2, InstanceStatus.BUSY.wireValue());
            ps.setLong(3, nowMs);
            ps.setString(4, instanceId);
        }, "Failed to mark instance busy: " + instanceId);
    }

    public void markActive(String instanceId, long nowMs) {
        update("UPDATE instances SET current_task=NULL,status=?,last_heartbeat_ms=? WHERE instance_id=?", ps -> {
            ps.setString(1, InstanceStatus.ACTIVE.wireValue());
            ps.setLong(2, nowMs);
            ps.setString(3, instanceId);
        }, "Failed to reset instance: " + instanceId);
    }

    public boolean delete(String instanceId) {
        return update("DELETE FROM instances WHERE instance_id=?", ps -> ps.setString(1, instanceId),
                "Failed to remove instance: " + instanceId) > 0;
    }

    public Optional<InstanceView> find(String instanceId, long nowMs) {
        return queryOne("SELECT " + COLUMNS + " FROM instances WHERE instance_id=?",
                ps -> ps.setString(1, instanceId),
                rs -> map(rs, nowMs),
                "Failed to read instance: " + instanceId);
    }

    /**
     * Instances whose heartbeat is newer than {@code activeSinceMs}, ordered by project then start time.
     */
    public List<InstanceView> listActive(long activeSinceMs, long nowMs) {
        String sql = "SELECT " + COLUMNS + " FROM instances WHERE last_heartbeat_ms>? ORDER BY project, started_at_ms, instance_id";
        return queryList(sql, ps -> ps.setLong(1, activeSinceMs), rs -> map(rs, nowMs), "Failed to list active instances");
    }

    public int deleteStale(long heartbeatBeforeMs) {
        return update("DELETE FROM instances WHERE last_heartbeat_ms<?", ps -> ps.setLong(1, heartbeatBeforeMs),
                "Failed to remove stale instances");
    }

    private static InstanceView map(ResultSet rs, long nowMs) throws SQLException {
        long heartbeat = rs.getLong("last_heartbeat_ms");
        return new InstanceView(
                rs.getString("instance_id"),
                rs.getString("project"),
                rs.getString("working_dir"),
                rs.getString("model"),
                rs.getString("status"),
                rs.getString("current_task"),
                rs.getLong("started_at_ms"),
                heartbeat,
                Math.max(0L, (nowMs - heartbeat) / 1_000L)
        );
    }
}
