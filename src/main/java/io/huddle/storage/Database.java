package io.huddle.storage;

import io.huddle.config.HuddleConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "huddle.schema.migration.v1";
    private final HuddleConfig config;
    private final String jdbcUrl;

    public Database(HuddleConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        applyAndValidatePragmas();
        initSchema();
    }

    /**
     * Every connection waits on the SQLite write lock instead of failing fast, so concurrent
     * claimers serialize on the conditional update.
     */
    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", Integer.toString(HuddleConfig.BUSY_TIMEOUT_MS));
        props.setProperty("foreign_keys", "true");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Path parent = config.dbFile().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to initialize directories for " + config.dbFile(), e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection()) {
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize SQLite schema at " + config.dbFile(), e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20260301_001_base_schema",
                "Coordination tables: instances, messages, memory, session log, tasks, roles",
                List.of(
                        """
                        CREATE TABLE IF NOT EXISTS instances (
                            instance_id TEXT PRIMARY KEY,
                            project TEXT NOT NULL,
                            working_dir TEXT,
                            model TEXT,
                            status TEXT NOT NULL DEFAULT 'active'
                                CHECK (status IN ('active', 'idle', 'busy', 'shutting_down')),
                            current_task TEXT,
                            started_at_ms INTEGER NOT NULL,
                            last_heartbeat_ms INTEGER NOT NULL
                        )
                        """,
                        """
                        CREATE TABLE IF NOT EXISTS messages (
                            id INTEGER PRIMARY KEY AUTOINCREMENT,
                            from_instance TEXT NOT NULL,
                            from_project TEXT,
                            to_target TEXT NOT NULL,
                            message_type TEXT NOT NULL DEFAULT 'info'
                                CHECK (message_type IN ('info', 'warning', 'blocker', 'request', 'done')),
                            subject TEXT NOT NULL,
                            body TEXT,
                            is_read INTEGER NOT NULL DEFAULT 0,
                            created_at_ms INTEGER NOT NULL,
                            expires_at_ms INTEGER
                        )
                        """,
                        """
                        CREATE TABLE IF NOT EXISTS project_memory (
                            id INTEGER PRIMARY KEY AUTOINCREMENT,
                            project TEXT NOT NULL,
                            memory_type TEXT NOT NULL,
                            title TEXT NOT NULL,
                            content TEXT NOT NULL,
                            status TEXT NOT NULL DEFAULT 'active'
                                CHECK (status IN ('active', 'resolved', 'deprecated', 'superseded')),
                            tags TEXT NOT NULL DEFAULT '[]',
                            related_files TEXT NOT NULL DEFAULT '[]',
                            created_by TEXT NOT NULL DEFAULT 'human',
                            created_at_ms INTEGER NOT NULL,
                            updated_at_ms INTEGER NOT NULL
                        )
                        """,
                        """
                        CREATE TABLE IF NOT EXISTS global_memory (
                            id INTEGER PRIMARY KEY AUTOINCREMENT,
                            memory_type TEXT NOT NULL,
                            title TEXT NOT NULL,
                            content TEXT NOT NULL,
                            tags TEXT NOT NULL DEFAULT '[]',
                            created_by TEXT NOT NULL DEFAULT 'human',
                            created_at_ms INTEGER NOT NULL,
                            updated_at_ms INTEGER NOT NULL
                        )
                        """,
                        """
                        CREATE TABLE IF NOT EXISTS session_log (
                            id INTEGER PRIMARY KEY AUTOINCREMENT,
                            instance_id TEXT NOT NULL,
                            project TEXT NOT NULL,
                            action TEXT NOT NULL,
                            summary TEXT NOT NULL,
                            files_modified TEXT NOT NULL DEFAULT '[]',
                            created_at_ms INTEGER NOT NULL
                        )
                        """,
                        """
                        CREATE TABLE IF NOT EXISTS tasks (
                            id INTEGER PRIMARY KEY AUTOINCREMENT,
                            title TEXT NOT NULL,
                            description TEXT,
                            project TEXT NOT NULL,
                            priority INTEGER NOT NULL DEFAULT 0,
                            assigned_role TEXT,
                            file_scope TEXT NOT NULL DEFAULT '[]',
                            depends_on TEXT NOT NULL DEFAULT '[]',
                            assigned_instance TEXT,
                            status TEXT NOT NULL DEFAULT 'pending'
                                CHECK (status IN ('pending', 'claimed', 'in_progress', 'done', 'failed')),
                            result TEXT,
                            created_by TEXT NOT NULL DEFAULT 'human',
                            created_at_ms INTEGER NOT NULL,
                            claimed_at_ms INTEGER,
                            completed_at_ms INTEGER
                        )
                        """,
                        """
                        CREATE TABLE IF NOT EXISTS agent_roles (
                            name TEXT PRIMARY KEY,
                            description TEXT NOT NULL,
                            system_prompt TEXT NOT NULL,
                            capabilities TEXT NOT NULL DEFAULT '[]',
                            updated_at_ms INTEGER NOT NULL
                        )
                        """,
                        "CREATE INDEX IF NOT EXISTS idx_instances_heartbeat ON instances(last_heartbeat_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_messages_to_unread ON messages(to_target, is_read)",
                        "CREATE INDEX IF NOT EXISTS idx_messages_created ON messages(created_at_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_project_memory_project_type ON project_memory(project, memory_type)",
                        "CREATE INDEX IF NOT EXISTS idx_project_memory_status ON project_memory(status)",
                        "CREATE INDEX IF NOT EXISTS idx_global_memory_type ON global_memory(memory_type)",
                        "CREATE INDEX IF NOT EXISTS idx_session_log_project ON session_log(project, created_at_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_session_log_instance ON session_log(instance_id, created_at_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_tasks_status_priority ON tasks(status, priority, created_at_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_tasks_project_role ON tasks(project, assigned_role)"
                )
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        conn.setAutoCommit(false);
        try {
            try (Statement st = conn.createStatement()) {
                for (String sql : step.sql()) {
                    st.execute(sql);
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
                ps.setString(1, step.version());
                ps.setString(2, step.description());
                ps.setString(3, checksum(step));
                ps.setLong(4, Instant.now().toEpochMilli());
                ps.executeUpdate();
            }
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            validatePragma(st, "journal_mode", "wal");
        } catch (SQLException e) {
            throw new StorageException("Failed to apply SQLite pragmas at " + config.dbFile(), e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new StorageException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new StorageException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<String> appliedMigrations() {
        List<String> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT version FROM schema_migrations WHERE success=1 ORDER BY version");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(rs.getString("version"));
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list schema migrations", e);
        }
    }
}
