package io.taskmesh.storage;

import io.taskmesh.model.AgentRecord;
import io.taskmesh.model.AgentRole;
import io.taskmesh.model.Complexity;
import io.taskmesh.model.NewTask;
import io.taskmesh.model.SkillLevel;
import io.taskmesh.model.TaskRecord;
import io.taskmesh.model.TaskStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQLite-backed entity store for tasks, agents and the lock conflict ledger.
 *
 * <p>Every state change is a single conditional {@code UPDATE}; the affected row count is
 * the only thing that decides whether the caller won. Reads after a lost update are used
 * for classification and the conflict ledger, never for the decision itself.
 */
public final class TaskStore {
    private static final int SQLITE_CONSTRAINT = 19;
    private static final String TASK_COLUMNS = """
            task_id,feature_id,title,description,target_role,skill_level,complexity,status,
            locked_by,locked_at_ms,lock_epoch,execution_context,branch,notes,created_by,created_at_ms,updated_at_ms
            """;

    private final Database database;

    public TaskStore(Database database) {
        this.database = database;
    }

    public TaskRecord insertTask(String taskId, NewTask task, TaskStatus initialStatus, String createdBy, long nowMs) {
        String sql = """
                INSERT INTO tasks(
                    task_id,feature_id,title,description,target_role,skill_level,skill_rank,complexity,status,
                    lock_epoch,branch,created_by,created_at_ms,updated_at_ms
                ) VALUES(?,?,?,?,?,?,?,?,?,0,?,?,?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, taskId);
            ps.setString(2, task.featureId());
            ps.setString(3, task.title().trim());
            ps.setString(4, task.description() == null ? "" : task.description());
            ps.setString(5, task.targetRole().wireName());
            ps.setString(6, task.skillLevel().name());
            ps.setInt(7, task.skillLevel().rank());
            ps.setString(8, task.complexity().name());
            ps.setString(9, initialStatus.name());
            ps.setString(10, task.branch());
            ps.setString(11, createdBy == null ? "" : createdBy);
            ps.setLong(12, nowMs);
            ps.setLong(13, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new IllegalArgumentException("Task already exists: " + taskId, e);
            }
            throw new StoreUnavailableException("task.insert", taskId, createdBy, e);
        }
        return findTask(taskId).orElseThrow(() -> new IllegalStateException("Inserted task vanished: " + taskId));
    }

    public Optional<TaskRecord> findTask(String taskId) {
        try (Connection c = database.openConnection()) {
            return Optional.ofNullable(readTask(c, taskId));
        } catch (SQLException e) {
            throw new StoreUnavailableException("task.find", taskId, null, e);
        }
    }

    public List<TaskRecord> listTasks(TaskStatus status, int limit) {
        int safeLimit = Math.max(1, Math.min(10_000, limit));
        String sql = status == null
                ? "SELECT " + TASK_COLUMNS + " FROM tasks ORDER BY created_at_ms ASC, task_id ASC LIMIT ?"
                : "SELECT " + TASK_COLUMNS + " FROM tasks WHERE status=? ORDER BY created_at_ms ASC, task_id ASC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            if (status != null) {
                ps.setString(idx++, status.name());
            }
            ps.setInt(idx, safeLimit);
            return readTasks(ps);
        } catch (SQLException e) {
            throw new StoreUnavailableException("task.list", null, null, e);
        }
    }

    /**
     * Unlocked tasks of the given role at or below the given level, oldest first. The
     * result is a snapshot; it grants nothing.
     */
    public List<TaskRecord> eligiblePool(AgentRole role, SkillLevel level) {
        String sql = "SELECT " + TASK_COLUMNS + """
                 FROM tasks
                WHERE target_role=? AND status=? AND locked_by IS NULL AND skill_rank<=?
                ORDER BY created_at_ms ASC, task_id ASC
                LIMIT 500
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, role.wireName());
            ps.setString(2, TaskStatus.CREATED.name());
            ps.setInt(3, level.rank());
            return readTasks(ps);
        } catch (SQLException e) {
            throw new StoreUnavailableException("task.pool", null, null, e);
        }
    }

    /**
     * Moves an unheld task from {@code from} into the held state {@code to} with
     * {@code agentId} as owner. Used for {@code CREATED -> LOCKED} and the QA pickup
     * {@code DEV_DONE -> TESTING}.
     */
    public ClaimResult tryClaim(String taskId, String agentId, TaskStatus from, TaskStatus to,
                                String executionContext, long nowMs) {
        if (!to.held() || from.held()) {
            throw new IllegalArgumentException("Claim must move an unheld task into a held state: " + from + " -> " + to);
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE tasks
                       SET status=?,locked_by=?,locked_at_ms=?,lock_epoch=lock_epoch+1,
                           execution_context=?,updated_at_ms=?
                     WHERE task_id=? AND status=? AND locked_by IS NULL
                    """)) {
                ps.setString(1, to.name());
                ps.setString(2, agentId);
                ps.setLong(3, nowMs);
                ps.setString(4, executionContext);
                ps.setLong(5, nowMs);
                ps.setString(6, taskId);
                ps.setString(7, from.name());
                int updated = ps.executeUpdate();
                TaskRecord actual = readTask(c, taskId);
                if (updated == 0) {
                    recordConflict(c, "claim_conflict", taskId, agentId, from, actual, nowMs);
                    c.commit();
                    return ClaimResult.conflict(actual);
                }
                c.commit();
                return ClaimResult.success(actual);
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("task.claim", taskId, agentId, e);
        }
    }

    /**
     * Moves a task from {@code from} to the unheld state {@code to}, clearing the owner. When
     * {@code requireHolder} is set the update only matches rows owned by {@code agentId}.
     */
    public TransitionResult tryTransition(String taskId, String agentId, TaskStatus from, TaskStatus to,
                                          boolean requireHolder, String notes, long nowMs) {
        if (to.held()) {
            throw new IllegalArgumentException("Transition target must be unheld, use tryClaim: " + to);
        }
        String sql = requireHolder
                ? "UPDATE tasks SET status=?,locked_by=NULL,locked_at_ms=NULL,execution_context=NULL,notes=COALESCE(?,notes),updated_at_ms=? WHERE task_id=? AND status=? AND locked_by=?"
                : "UPDATE tasks SET status=?,locked_by=NULL,locked_at_ms=NULL,execution_context=NULL,notes=COALESCE(?,notes),updated_at_ms=? WHERE task_id=? AND status=?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, to.name());
                ps.setString(2, notes);
                ps.setLong(3, nowMs);
                ps.setString(4, taskId);
                ps.setString(5, from.name());
                if (requireHolder) {
                    ps.setString(6, agentId);
                }
                int updated = ps.executeUpdate();
                TaskRecord actual = readTask(c, taskId);
                if (updated == 0) {
                    if (requireHolder) {
                        recordConflict(c, "transition_conflict", taskId, agentId, from, actual, nowMs);
                    }
                    c.commit();
                    return new TransitionResult(false, actual);
                }
                c.commit();
                return new TransitionResult(true, actual);
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("task.transition", taskId, agentId, e);
        }
    }

    /**
     * Administrative release of whatever lock the task carries. Returns empty when the task
     * was not in a held state.
     */
    public Optional<ForcedRelease> forceRelease(String taskId, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE tasks
                       SET status=CASE status WHEN 'LOCKED' THEN 'CREATED' ELSE 'DEV_DONE' END,
                           locked_by=NULL,locked_at_ms=NULL,execution_context=NULL,updated_at_ms=?
                     WHERE task_id=? AND status IN ('LOCKED','TESTING') AND locked_by=?
                    """)) {
                TaskRecord before = readTask(c, taskId);
                if (before == null || !before.status().held()) {
                    c.commit();
                    return Optional.empty();
                }
                ps.setLong(1, nowMs);
                ps.setString(2, taskId);
                ps.setString(3, before.lockedBy());
                if (ps.executeUpdate() == 0) {
                    c.commit();
                    return Optional.empty();
                }
                TaskRecord after = readTask(c, taskId);
                c.commit();
                return Optional.of(new ForcedRelease(taskId, before.lockedBy(), before.status(), after.status()));
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("task.forceRelease", taskId, null, e);
        }
    }

    public List<TaskRecord> staleLocks(long thresholdMs, long nowMs) {
        String sql = "SELECT " + TASK_COLUMNS + """
                 FROM tasks
                WHERE status IN ('LOCKED','TESTING') AND locked_at_ms IS NOT NULL AND locked_at_ms<=?
                ORDER BY locked_at_ms ASC, task_id ASC
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs - Math.max(0L, thresholdMs));
            return readTasks(ps);
        } catch (SQLException e) {
            throw new StoreUnavailableException("task.staleLocks", null, null, e);
        }
    }

    public AgentRecord upsertAgent(String agentId, AgentRole role, SkillLevel level, long nowMs) {
        String sql = """
                INSERT INTO agents(agent_id,role,skill_level,registered_at_ms,last_seen_at_ms) VALUES(?,?,?,?,?)
                ON CONFLICT(agent_id) DO UPDATE SET
                    role=excluded.role,
                    skill_level=excluded.skill_level,
                    last_seen_at_ms=excluded.last_seen_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, agentId);
            ps.setString(2, role.wireName());
            ps.setString(3, level.name());
            ps.setLong(4, nowMs);
            ps.setLong(5, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreUnavailableException("agent.upsert", null, agentId, e);
        }
        return findAgent(agentId).orElseThrow(() -> new IllegalStateException("Registered agent vanished: " + agentId));
    }

    public boolean touchAgent(String agentId, long nowMs) {
        String sql = "UPDATE agents SET last_seen_at_ms=? WHERE agent_id=? AND last_seen_at_ms<=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setString(2, agentId);
            ps.setLong(3, nowMs);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreUnavailableException("agent.touch", null, agentId, e);
        }
    }

    public Optional<AgentRecord> findAgent(String agentId) {
        String sql = "SELECT agent_id,role,skill_level,registered_at_ms,last_seen_at_ms FROM agents WHERE agent_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, agentId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapAgent(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("agent.find", null, agentId, e);
        }
    }

    public List<AgentRecord> listAgents() {
        String sql = "SELECT agent_id,role,skill_level,registered_at_ms,last_seen_at_ms FROM agents ORDER BY agent_id";
        List<AgentRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(mapAgent(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreUnavailableException("agent.list", null, null, e);
        }
    }

    public List<LockConflict> listLockConflicts(int limit, long sinceMs) {
        String sql = """
                SELECT id,event_type,task_id,agent_id,expected_status,actual_status,actual_locked_by,actual_lock_epoch,occurred_at_ms
                  FROM lock_conflicts
                 WHERE occurred_at_ms>=?
                 ORDER BY occurred_at_ms DESC, id DESC
                 LIMIT ?
                """;
        List<LockConflict> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, Math.max(0L, sinceMs));
            ps.setInt(2, Math.max(1, Math.min(5_000, limit)));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long epoch = rs.getLong("actual_lock_epoch");
                    Long actualEpoch = rs.wasNull() ? null : epoch;
                    out.add(new LockConflict(
                            rs.getLong("id"),
                            rs.getString("event_type"),
                            rs.getString("task_id"),
                            rs.getString("agent_id"),
                            rs.getString("expected_status"),
                            rs.getString("actual_status"),
                            rs.getString("actual_locked_by"),
                            actualEpoch,
                            rs.getLong("occurred_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreUnavailableException("conflict.list", null, null, e);
        }
    }

    public LockConflictSummary lockConflictSummary(long sinceMs) {
        String sql = "SELECT event_type, COUNT(*) AS c FROM lock_conflicts WHERE occurred_at_ms>=? GROUP BY event_type ORDER BY event_type";
        Map<String, Integer> byType = new LinkedHashMap<>();
        int total = 0;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, Math.max(0L, sinceMs));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    int count = rs.getInt("c");
                    byType.put(rs.getString("event_type"), count);
                    total += count;
                }
            }
            return new LockConflictSummary(total, byType);
        } catch (SQLException e) {
            throw new StoreUnavailableException("conflict.summary", null, null, e);
        }
    }

    private void recordConflict(Connection c, String eventType, String taskId, String agentId,
                                TaskStatus expectedStatus, TaskRecord actual, long nowMs) throws SQLException {
        String sql = """
                INSERT INTO lock_conflicts(
                    event_type,task_id,agent_id,expected_status,actual_status,actual_locked_by,actual_lock_epoch,occurred_at_ms
                ) VALUES(?,?,?,?,?,?,?,?)
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, eventType);
            ps.setString(2, taskId);
            ps.setString(3, agentId);
            ps.setString(4, expectedStatus.name());
            ps.setString(5, actual == null ? null : actual.status().name());
            ps.setString(6, actual == null ? null : actual.lockedBy());
            if (actual == null) {
                ps.setObject(7, null);
            } else {
                ps.setLong(7, actual.lockEpoch());
            }
            ps.setLong(8, nowMs);
            ps.executeUpdate();
        }
    }

    private static boolean isConstraintViolation(SQLException e) {
        String message = e.getMessage();
        return e.getErrorCode() == SQLITE_CONSTRAINT
                || (message != null && message.contains("SQLITE_CONSTRAINT"));
    }

    private TaskRecord readTask(Connection c, String taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + TASK_COLUMNS + " FROM tasks WHERE task_id=?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapTask(rs) : null;
            }
        }
    }

    private List<TaskRecord> readTasks(PreparedStatement ps) throws SQLException {
        List<TaskRecord> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(mapTask(rs));
            }
        }
        return out;
    }

    private static TaskRecord mapTask(ResultSet rs) throws SQLException {
        long lockedAt = rs.getLong("locked_at_ms");
        Long lockedAtMs = rs.wasNull() ? null : lockedAt;
        return new TaskRecord(
                rs.getString("task_id"),
                rs.getString("feature_id"),
                rs.getString("title"),
                rs.getString("description"),
                AgentRole.fromString(rs.getString("target_role")),
                SkillLevel.fromString(rs.getString("skill_level")),
                Complexity.fromString(rs.getString("complexity")),
                TaskStatus.fromString(rs.getString("status")),
                rs.getString("locked_by"),
                lockedAtMs,
                rs.getLong("lock_epoch"),
                rs.getString("execution_context"),
                rs.getString("branch"),
                rs.getString("notes"),
                rs.getString("created_by"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private static AgentRecord mapAgent(ResultSet rs) throws SQLException {
        return new AgentRecord(
                rs.getString("agent_id"),
                AgentRole.fromString(rs.getString("role")),
                SkillLevel.fromString(rs.getString("skill_level")),
                rs.getLong("registered_at_ms"),
                rs.getLong("last_seen_at_ms")
        );
    }

    public record ClaimResult(boolean won, TaskRecord actual) {
        public static ClaimResult success(TaskRecord task) {
            return new ClaimResult(true, task);
        }

        public static ClaimResult conflict(TaskRecord actual) {
            return new ClaimResult(false, actual);
        }
    }

    public record TransitionResult(boolean applied, TaskRecord actual) {}

    public record ForcedRelease(String taskId, String previousHolder, TaskStatus fromStatus, TaskStatus toStatus) {}

    public record LockConflict(
            long id,
            String eventType,
            String taskId,
            String agentId,
            String expectedStatus,
            String actualStatus,
            String actualLockedBy,
            Long actualLockEpoch,
            long occurredAtMs
    ) {}

    public record LockConflictSummary(int total, Map<String, Integer> byEventType) {}
}
