package io.taskmesh.runtime;

import io.taskmesh.broker.BackingProcess;
import io.taskmesh.broker.ProcessLifecycleBroker;
import io.taskmesh.broker.StartupRateLimiter;
import io.taskmesh.config.CoordinatorSettings;
import io.taskmesh.config.TaskMeshConfig;
import io.taskmesh.coordination.InvalidTransitionException;
import io.taskmesh.coordination.LockGrant;
import io.taskmesh.coordination.LockManager;
import io.taskmesh.coordination.TaskSignal;
import io.taskmesh.coordination.TaskStateMachine;
import io.taskmesh.coordination.WaitCancellation;
import io.taskmesh.coordination.WaitCoordinator;
import io.taskmesh.coordination.WaitOutcome;
import io.taskmesh.journal.JournalReconciler;
import io.taskmesh.journal.RecoveryJournal;
import io.taskmesh.model.AgentRecord;
import io.taskmesh.model.AgentRole;
import io.taskmesh.model.NewTask;
import io.taskmesh.model.SkillLevel;
import io.taskmesh.model.TaskRecord;
import io.taskmesh.model.TaskStatus;
import io.taskmesh.observability.AuditLogger;
import io.taskmesh.storage.Database;
import io.taskmesh.storage.StoreRetry;
import io.taskmesh.storage.TaskStore;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public final class TaskMeshRuntime {
    private static final int DEFAULT_LIST_LIMIT = 1_000;

    private final TaskMeshConfig config;
    private final CoordinatorSettings settings;
    private final Clock clock;
    private final Database database;
    private final TaskStore taskStore;
    private final StoreRetry retry;
    private final TaskSignal signal;
    private final TaskStateMachine stateMachine;
    private final LockManager lockManager;
    private final WaitCoordinator waitCoordinator;
    private final RecoveryJournal journal;
    private final JournalReconciler reconciler;
    private final AuditLogger auditLogger;

    public TaskMeshRuntime(TaskMeshConfig config) {
        this(config, CoordinatorSettings.load(config), Clock.systemUTC(), new TaskSignal());
    }

    public TaskMeshRuntime(TaskMeshConfig config, CoordinatorSettings settings, Clock clock, TaskSignal signal) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.database = new Database(config);
        this.taskStore = new TaskStore(database);
        this.retry = new StoreRetry(settings);
        this.signal = signal;
        this.stateMachine = new TaskStateMachine(settings.reworkTarget());
        this.lockManager = new LockManager(taskStore, stateMachine, clock);
        this.waitCoordinator = new WaitCoordinator(taskStore, retry, signal,
                settings.waitInitialPollMs(), settings.waitMaxPollMs());
        this.journal = new RecoveryJournal(config.journalDir(), clock);
        this.reconciler = new JournalReconciler(journal, taskStore, retry);
        this.auditLogger = new AuditLogger(config.auditFile(), clock);
    }

    public void init() {
        retry.run("database.init", database::init);
    }

    public AgentRecord register(String agentId, String role, String skillLevel) {
        requireId(agentId, "agentId");
        AgentRole parsedRole = AgentRole.fromString(role);
        SkillLevel parsedLevel = SkillLevel.fromString(skillLevel);
        AgentRecord agent = retry.call("agent.register",
                () -> taskStore.upsertAgent(agentId.trim(), parsedRole, parsedLevel, clock.millis()));
        audit("agent.register", agent.agentId(), null, "ok",
                Map.of("role", parsedRole.wireName(), "skill_level", parsedLevel.name()));
        return agent;
    }

    public boolean heartbeat(String agentId) {
        requireId(agentId, "agentId");
        return retry.call("agent.heartbeat", () -> taskStore.touchAgent(agentId, clock.millis()));
    }

    /**
     * Creates a task. It starts in {@code CREATED} only when the creator is a registered
     * privileged agent that did not ask for staging; otherwise in {@code PENDING}.
     */
    public TaskRecord createTask(NewTask task, String creatorId) {
        boolean privileged = roleOf(creatorId).map(AgentRole::privileged).orElse(false);
        TaskStatus initial = privileged && !task.staged() ? TaskStatus.CREATED : TaskStatus.PENDING;
        String taskId = "tsk_" + UUID.randomUUID();
        TaskRecord created = retry.call("task.create",
                () -> taskStore.insertTask(taskId, task, initial, creatorId, clock.millis()));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", initial.name());
        details.put("target_role", task.targetRole().wireName());
        details.put("skill_level", task.skillLevel().name());
        audit("task.create", creatorId, taskId, "ok", details);
        if (initial == TaskStatus.CREATED) {
            signal.publish();
        }
        return created;
    }

    /**
     * Publishes a staged task. Only {@code PENDING -> CREATED}; lock holders cannot use it to
     * release or reject work.
     */
    public TaskRecord promote(String taskId, String actorId) {
        return transition(taskId, actorId, TaskStatus.CREATED, null, TaskStatus.PENDING);
    }

    public WaitOutcome nextTask(String role, String skillLevel, long waitMs) {
        return nextTask(AgentRole.fromString(role), SkillLevel.fromString(skillLevel), waitMs, WaitCancellation.none());
    }

    public WaitOutcome nextTask(AgentRole role, SkillLevel level, long waitMs, WaitCancellation cancellation) {
        long wait = waitMs < 0L ? settings.defaultWaitMs() : waitMs;
        return waitCoordinator.nextTask(role, level, wait, cancellation);
    }

    public LockGrant lock(String taskId, String agentId, String executionContext) {
        LockGrant grant = retry.call("task.lock", () -> lockManager.acquire(taskId, agentId, executionContext));
        Map<String, Object> details = new LinkedHashMap<>();
        if (grant.granted()) {
            details.put("lock_epoch", grant.token().lockEpoch());
        } else {
            details.put("holder", grant.holder());
            details.put("observed_status", grant.observedStatus().name());
        }
        audit("task.lock", agentId, taskId, grant.granted() ? "granted" : "already_locked", details);
        return grant;
    }

    public TaskRecord setStatus(String taskId, String agentId, TaskStatus requested, String notes) {
        return transition(taskId, agentId, requested, notes, null);
    }

    private TaskRecord transition(String taskId, String agentId, TaskStatus requested, String notes,
                                  TaskStatus requiredFrom) {
        requireId(taskId, "taskId");
        requireId(agentId, "agentId");
        TaskRecord current = retry.call("task.find", () -> taskStore.findTask(taskId))
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
        AgentRole actorRole = roleOf(agentId).orElse(null);
        TaskRecord updated;
        try {
            if (requiredFrom != null && current.status() != requiredFrom) {
                throw new InvalidTransitionException(taskId, agentId, current.status(), requested,
                        "only " + requiredFrom + " tasks can be promoted");
            }
            TaskStateMachine.Transition transition = stateMachine.resolve(current, agentId, actorRole, requested);
            updated = retry.call("task.transition", () -> lockManager.apply(current, transition, agentId, notes));
        } catch (RuntimeException e) {
            audit("task.status", agentId, taskId, "rejected",
                    Map.of("from", current.status().name(), "to", requested.name(), "error", e.getClass().getSimpleName()));
            throw e;
        }
        audit("task.status", agentId, taskId, "ok",
                Map.of("from", current.status().name(), "to", updated.status().name()));
        if (updated.status() == TaskStatus.CREATED) {
            signal.publish();
        }
        return updated;
    }

    public Optional<TaskStore.ForcedRelease> forceRelease(String taskId, String actor) {
        requireId(taskId, "taskId");
        Optional<TaskStore.ForcedRelease> released = retry.call("task.forceRelease", () -> lockManager.forceRelease(taskId));
        released.ifPresentOrElse(r -> {
            audit("task.force_release", actor, taskId, "released",
                    Map.of("previous_holder", r.previousHolder(), "from", r.fromStatus().name(), "to", r.toStatus().name()));
            if (r.toStatus() == TaskStatus.CREATED) {
                signal.publish();
            }
        }, () -> audit("task.force_release", actor, taskId, "not_held", Map.of()));
        return released;
    }

    public List<TaskRecord> staleLocks() {
        return staleLocks(settings.staleLockThresholdMs());
    }

    public List<TaskRecord> staleLocks(long thresholdMs) {
        return retry.call("task.staleLocks", () -> lockManager.staleLocks(thresholdMs));
    }

    public Optional<TaskRecord> getTask(String taskId) {
        return retry.call("task.find", () -> taskStore.findTask(taskId));
    }

    public List<TaskRecord> listTasks(TaskStatus status) {
        return retry.call("task.list", () -> taskStore.listTasks(status, DEFAULT_LIST_LIMIT));
    }

    public List<AgentRecord> listAgents() {
        return retry.call("agent.list", taskStore::listAgents);
    }

    public List<TaskStore.LockConflict> lockConflicts(int limit, long sinceMs) {
        return retry.call("conflict.list", () -> taskStore.listLockConflicts(limit, sinceMs));
    }

    public TaskStore.LockConflictSummary lockConflictSummary(long sinceMs) {
        return retry.call("conflict.summary", () -> taskStore.lockConflictSummary(sinceMs));
    }

    public ProcessLifecycleBroker createBroker(BackingProcess backing) {
        return new ProcessLifecycleBroker(
                config.brokerStateFile(),
                config.brokerLockFile(),
                backing,
                new StartupRateLimiter(settings.brokerMaxStartsPerWindow(), settings.brokerStartWindowMs()),
                clock,
                settings.brokerLivenessTimeoutMs()
        );
    }

    public TaskMeshConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public CoordinatorSettings settings() {
        return settings;
    }

    public Clock clock() {
        return clock;
    }

    public RecoveryJournal journal() {
        return journal;
    }

    public JournalReconciler reconciler() {
        return reconciler;
    }

    public TaskSignal signal() {
        return signal;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    private Optional<AgentRole> roleOf(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            return Optional.empty();
        }
        return retry.call("agent.find", () -> taskStore.findAgent(agentId)).map(AgentRecord::role);
    }

    private void audit(String action, String agentId, String taskId, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(action, agentId, taskId, result, details));
    }

    private static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
