package io.huddle.storage;

import io.huddle.model.RoleView;
import io.huddle.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

public final class RoleStore extends SqlSupport {
    private static final String UPSERT = """
            INSERT INTO agent_roles(name,description,system_prompt,capabilities,updated_at_ms)
            VALUES(?,?,?,?,?)
            ON CONFLICT(name) DO UPDATE SET
                description=excluded.description,
                system_prompt=excluded.system_prompt,
                capabilities=excluded.capabilities,
                updated_at_ms=excluded.updated_at_ms
            """;

    public RoleStore(Database database) {
        super(database);
    }

    public void upsert(RoleDefinition role, long nowMs) {
        update(UPSERT, ps -> bind(ps, role, nowMs), "Failed to save role: " + role.name());
    }

    /**
     * Upserts every role in one transaction.
     */
    public int upsertAll(List<RoleDefinition> roles, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(UPSERT)) {
                for (RoleDefinition role : roles) {
                    bind(ps, role, nowMs);
                    ps.executeUpdate();
                }
                c.commit();
                return roles.size();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to seed roles", e);
        }
    }

    public Optional<RoleView> find(String name) {
        return queryOne("SELECT name,description,system_prompt,capabilities,updated_at_ms FROM agent_roles WHERE name=?",
                ps -> ps.setString(1, name),
                RoleStore::map,
                "Failed to read role: " + name);
    }

    public List<RoleView> list() {
        return queryList("SELECT name,description,system_prompt,capabilities,updated_at_ms FROM agent_roles ORDER BY name",
                ps -> {
                },
                RoleStore::map,
                "Failed to list roles");
    }

    private static void bind(PreparedStatement ps, RoleDefinition role, long nowMs) throws SQLException {
        ps.setString(1, role.name());
        ps.setString(2, role.description());
        ps.setString(3, role.systemPrompt());
        ps.setString(4, Jsons.encodeList(role.capabilities()));
        ps.setLong(5, nowMs);
    }

    private static RoleView map(ResultSet rs) throws SQLException {
        return new RoleView(
                rs.getString("name"),
                rs.getString("description"),
                rs.getString("system_prompt"),
                Jsons.decodeList(rs.getString("capabilities")),
                rs.getLong("updated_at_ms")
        );
    }

    public record RoleDefinition(String name, String description, String systemPrompt, List<String> capabilities) {
    }
}
