package io.huddle.storage;

import io.huddle.model.TaskStatus;
import io.huddle.model.TaskView;
import io.huddle.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Task queue. The claim is a single conditional UPDATE; SQLite's write lock makes it a compare-and-swap,
 * so of any number of concurrent claimers exactly one sees an affected row.
 */
public final class TaskStore extends SqlSupport {
    private static final String COLUMNS = """
            id,title,description,project,priority,assigned_role,file_scope,depends_on,assigned_instance,
            status,result,created_by,created_at_ms,claimed_at_ms,completed_at_ms""";
    private static final String NOT_TERMINAL = "status NOT IN ('done','failed')";

    public TaskStore(Database database) {
        super(database);
    }

    public long create(NewTask t) {
        String sql = """
                INSERT INTO tasks(title,description,project,priority,assigned_role,file_scope,depends_on,status,created_by,created_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?)
                """;
        return insertReturningId(sql, ps -> {
            ps.setString(1, t.title());
            setNullableString(ps, 2, t.description());
            ps.setString(3, t.project());
            ps.setInt(4, t.priority());
            setNullableString(ps, 5, t.assignedRole());
            ps.setString(6, Jsons.encodeList(t.fileScope()));
            ps.setString(7, Jsons.encodeList(t.dependsOn()));
            ps.setString(8, TaskStatus.PENDING.wireValue());
            ps.setString(9, t.createdBy());
            ps.setLong(10, t.nowMs());
        }, "Failed to create task: " + t.title());
    }

    /**
     * Moves a task from {@code pending} to {@code claimed}, stamping claimant and claim time in the same
     * statement. The row is read back inside the same transaction.
     *
     * @return empty when the task does not exist or is no longer pending
     */
    public Optional<TaskView> claim(long taskId, String instanceId, long nowMs) {
        String claim = "UPDATE tasks SET status=?,assigned_instance=?,claimed_at_ms=? WHERE id=? AND status=?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement up = c.prepareStatement(claim);
                 PreparedStatement sel = c.prepareStatement("SELECT " + COLUMNS + " FROM tasks WHERE id=?")) {
                up.setString(1, TaskStatus.CLAIMED.wireValue());
                up.setString(2, instanceId);
                up.setLong(3, nowMs);
                up.setLong(4, taskId);
                up.setString(5, TaskStatus.PENDING.wireValue());
                if (up.executeUpdate() == 0) {
                    c.commit();
                    return Optional.empty();
                }
                sel.setLong(1, taskId);
                TaskView view;
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
            throw new StorageException("Failed to claim task #" + taskId, e);
        }
    }

    /**
     * Marks a task done. The claimant-scoped update is tried first; when it touches nothing the update is
     * retried by id alone as an administrative override. Terminal tasks are never touched.
     *
     * @return empty when neither path matched a non-terminal task
     */
    public Optional<Completion> complete(long taskId, String callerInstanceId, String result, long nowMs) {
        String asClaimant = "UPDATE tasks SET status=?,result=?,completed_at_ms=? WHERE id=? AND assigned_instance=? AND " + NOT_TERMINAL;
        String asAdmin = "UPDATE tasks SET status=?,result=?,completed_at_ms=? WHERE id=? AND " + NOT_TERMINAL;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement claimant = c.prepareStatement(asClaimant);
                 PreparedStatement admin = c.prepareStatement(asAdmin);
                 PreparedStatement sel = c.prepareStatement("SELECT " + COLUMNS + " FROM tasks WHERE id=?")) {
                boolean override = false;
                int rows = 0;
                if (callerInstanceId != null) {
                    claimant.setString(1, TaskStatus.DONE.wireValue());
                    setNullableString(claimant, 2, result);
                    claimant.setLong(3, nowMs);
                    claimant.setLong(4, taskId);
                    claimant.setString(5, callerInstanceId);
                    rows = claimant.executeUpdate();
                }
                if (rows == 0) {
                    admin.setString(1, TaskStatus.DONE.wireValue());
                    setNullableString(admin, 2, result);
                    admin.setLong(3, nowMs);
                    admin.setLong(4, taskId);
                    rows = admin.executeUpdate();
                    override = true;
                }
                if (rows == 0) {
                    c.commit();
                    return Optional.empty();
                }
                sel.setLong(1, taskId);
                TaskView view;
                try (ResultSet rs = sel.executeQuery()) {
                    view = rs.next() ? map(rs) : null;
                }
                c.commit();
                return view == null ? Optional.empty() : Optional.of(new Completion(view, override));
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to complete task #" + taskId, e);
        }
    }

    /**
     * Marks a task failed by id, with no claimant check. The reason lands in {@code result}.
     *
     * @return false when the task does not exist or is already terminal
     */
    public boolean fail(long taskId, String reason, long nowMs) {
        String sql = "UPDATE tasks SET status=?,result=?,completed_at_ms=? WHERE id=? AND " + NOT_TERMINAL;
        return update(sql, ps -> {
            ps.setString(1, TaskStatus.FAILED.wireValue());
            setNullableString(ps, 2, reason);
            ps.setLong(3, nowMs);
            ps.setLong(4, taskId);
        }, "Failed to fail task #" + taskId) == 1;
    }

    public Optional<TaskView> find(long taskId) {
        return queryOne("SELECT " + COLUMNS + " FROM tasks WHERE id=?",
                ps -> ps.setLong(1, taskId),
                TaskStore::map,
                "Failed to read task #" + taskId);
    }

    /**
     * Lists tasks ordered by priority (high first) and then creation order, which is the order
     * polling agents claim in. {@code availableOnly} restricts to pending tasks and ignores {@code status}.
     */
    public List<TaskView> list(TaskQuery q) {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM tasks WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (q.project() != null && !q.project().isBlank()) {
            sql.append(" AND project=?");
            params.add(q.project());
        }
        if (q.availableOnly()) {
            sql.append(" AND status=?");
            params.add(TaskStatus.PENDING.wireValue());
        } else if (q.status() != null) {
            sql.append(" AND status=?");
            params.add(q.status().wireValue());
        }
        if (q.role() != null && !q.role().isBlank()) {
            sql.append(" AND assigned_role=?");
            params.add(q.role());
        }
        sql.append(" ORDER BY priority DESC, created_at_ms ASC, id ASC");
        return queryList(sql.toString(), ps -> {
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
        }, TaskStore::map, "Failed to list tasks");
    }

    private static TaskView map(ResultSet rs) throws SQLException {
        return new TaskView(
                rs.getLong("id"),
                rs.getString("title"),
                rs.getString("description"),
                rs.getString("project"),
                rs.getInt("priority"),
                rs.getString("assigned_role"),
                Jsons.decodeList(rs.getString("file_scope")),
                Jsons.decodeList(rs.getString("depends_on")),
                rs.getString("assigned_instance"),
                rs.getString("status"),
                rs.getString("result"),
                rs.getString("created_by"),
                rs.getLong("created_at_ms"),
                nullableLong(rs, "claimed_at_ms"),
                nullableLong(rs, "completed_at_ms")
        );
    }

    public record NewTask(String title, String description, String project, int priority, String assignedRole,
                          List<String> fileScope, List<String> dependsOn, String createdBy, long nowMs) {
    }

    public record TaskQuery(String project, TaskStatus status, String role, boolean availableOnly) {
        public static TaskQuery available(String project, String role) {
            return new TaskQuery(project, null, role, true);
        }
    }

    public record Completion(TaskView task, boolean administrativeOverride) {
    }
}
