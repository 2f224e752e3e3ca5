package io.taskmesh.storage;

import io.taskmesh.config.TaskMeshConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "taskmesh.schema.migration.v1";
    private static final int BUSY_TIMEOUT_MS = 5_000;

    private final TaskMeshConfig config;
    private final String jdbcUrl;

    public Database(TaskMeshConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection c = DriverManager.getConnection(jdbcUrl);
        try (Statement st = c.createStatement()) {
            st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
            st.execute("PRAGMA foreign_keys=ON");
        } catch (SQLException e) {
            c.close();
            throw e;
        }
        return c;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.journalDir());
            Files.createDirectories(config.brokerDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS agents (
                        agent_id TEXT PRIMARY KEY,
                        role TEXT NOT NULL,
                        skill_level TEXT NOT NULL,
                        registered_at_ms INTEGER NOT NULL,
                        last_seen_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS tasks (
                        task_id TEXT PRIMARY KEY,
                        feature_id TEXT,
                        title TEXT NOT NULL,
                        description TEXT NOT NULL DEFAULT '',
                        target_role TEXT NOT NULL,
                        skill_level TEXT NOT NULL,
                        skill_rank INTEGER NOT NULL,
                        complexity TEXT NOT NULL DEFAULT 'MINOR',
                        status TEXT NOT NULL,
                        locked_by TEXT,
                        locked_at_ms INTEGER,
                        lock_epoch INTEGER NOT NULL DEFAULT 0,
                        execution_context TEXT,
                        branch TEXT,
                        notes TEXT,
                        created_by TEXT NOT NULL DEFAULT '',
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        CHECK ((locked_by IS NULL) = (locked_at_ms IS NULL))
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS lock_conflicts (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        event_type TEXT NOT NULL,
                        task_id TEXT NOT NULL,
                        agent_id TEXT,
                        expected_status TEXT,
                        actual_status TEXT,
                        actual_locked_by TEXT,
                        actual_lock_epoch INTEGER,
                        occurred_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_match ON tasks(target_role, status, skill_rank, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_locked_by ON tasks(locked_by, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_locked_at ON tasks(status, locked_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_lock_conflicts_time ON lock_conflicts(occurred_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_lock_conflicts_task_time ON lock_conflicts(task_id, occurred_at_ms)");
        } catch (SQLException e) {
            throw new StoreUnavailableException("schema.init", null, null, e);
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
                "20260301_001_clear_unheld_lock_fields",
                "Clear lock owner and execution context left on tasks that are not held",
                List.of("""
                        UPDATE tasks SET locked_by=NULL,locked_at_ms=NULL,execution_context=NULL
                         WHERE status NOT IN ('LOCKED','TESTING')
                           AND (locked_by IS NOT NULL OR execution_context IS NOT NULL)
                        """)
        ));
        steps.add(new MigrationStep(
                "20260301_002_agent_last_seen_index",
                "Index agents by heartbeat for liveness listings",
                List.of("CREATE INDEX IF NOT EXISTS idx_agents_last_seen ON agents(last_seen_at_ms)")
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
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new StoreUnavailableException("schema.pragmas", null, null, e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        String sql = "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY version";
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms"),
                        rs.getInt("success") == 1
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreUnavailableException("schema.migrations.list", null, null, e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
