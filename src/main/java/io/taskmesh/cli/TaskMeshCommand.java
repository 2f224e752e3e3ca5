package io.taskmesh.cli;

import io.taskmesh.agent.AgentWorker;
import io.taskmesh.agent.ScriptTaskHandler;
import io.taskmesh.broker.CommandBackingProcess;
import io.taskmesh.broker.ProcessLifecycleBroker;
import io.taskmesh.config.TaskMeshConfig;
import io.taskmesh.coordination.CoordinationException;
import io.taskmesh.coordination.LockGrant;
import io.taskmesh.coordination.WaitCancellation;
import io.taskmesh.coordination.WaitOutcome;
import io.taskmesh.journal.JournalReconciler;
import io.taskmesh.model.AgentRole;
import io.taskmesh.model.Complexity;
import io.taskmesh.model.NewTask;
import io.taskmesh.model.SkillLevel;
import io.taskmesh.model.TaskStatus;
import io.taskmesh.observability.AuditLogger;
import io.taskmesh.runtime.TaskMeshRuntime;
import io.taskmesh.storage.Database;
import io.taskmesh.storage.TaskStore;
import io.taskmesh.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "taskmesh",
        mixinStandardHelpOptions = true,
        description = "Coordination CLI for agents sharing a task backlog",
        subcommands = {
                TaskMeshCommand.InitCommand.class,
                TaskMeshCommand.RegisterCommand.class,
                TaskMeshCommand.HeartbeatCommand.class,
                TaskMeshCommand.CreateTaskCommand.class,
                TaskMeshCommand.PromoteCommand.class,
                TaskMeshCommand.NextTaskCommand.class,
                TaskMeshCommand.LockCommand.class,
                TaskMeshCommand.SetStatusCommand.class,
                TaskMeshCommand.ForceReleaseCommand.class,
                TaskMeshCommand.StaleLocksCommand.class,
                TaskMeshCommand.TaskCommand.class,
                TaskMeshCommand.TasksCommand.class,
                TaskMeshCommand.AgentsCommand.class,
                TaskMeshCommand.LockConflictsCommand.class,
                TaskMeshCommand.RecoverCommand.class,
                TaskMeshCommand.WorkerCommand.class,
                TaskMeshCommand.BrokerCommand.class,
                TaskMeshCommand.AuditVerifyCommand.class,
                TaskMeshCommand.SchemaMigrationsCommand.class
        }
)
public final class TaskMeshCommand implements Runnable {
    static final int EXIT_REJECTED = 2;
    static final int EXIT_ALREADY_LOCKED = 3;

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | register | heartbeat | create-task | promote | next-task | lock | set-status | force-release | stale-locks | task | tasks | agents | lock-conflicts | recover | worker | broker | audit-verify | schema-migrations");
    }

    /**
     * Command line with coordination failures mapped to exit codes instead of stack traces.
     */
    public static CommandLine commandLine() {
        CommandLine cli = new CommandLine(new TaskMeshCommand());
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof CoordinationException || ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("error: " + ex.getMessage());
                return EXIT_REJECTED;
            }
            throw ex;
        });
        return cli;
    }

    TaskMeshRuntime runtime() {
        TaskMeshRuntime runtime = new TaskMeshRuntime(TaskMeshConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Override
        public Integer call() {
            TaskMeshRuntime runtime = parent.runtime();
            System.out.println("Initialized TaskMesh at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "register", description = "Register or update an agent identity")
    static final class RegisterCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent identity")
        String agent;

        @Option(names = {"--role"}, required = true, description = "frontend_dev|backend_dev|qa|architect|pm")
        String role;

        @Option(names = {"--level"}, defaultValue = "junior", description = "junior|senior|principal")
        String level;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().register(agent, role, level)));
            return 0;
        }
    }

    @Command(name = "heartbeat", description = "Refresh an agent's last-seen timestamp")
    static final class HeartbeatCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent identity")
        String agent;

        @Override
        public Integer call() {
            boolean updated = parent.runtime().heartbeat(agent);
            System.out.println(Jsons.toJson(Map.of("agentId", agent, "updated", updated)));
            return updated ? 0 : 1;
        }
    }

    @Command(name = "create-task", description = "Create a task (pending unless created by a privileged agent)")
    static final class CreateTaskCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--title"}, required = true, description = "Task title")
        String title;

        @Option(names = {"--description"}, defaultValue = "", description = "Task description")
        String description;

        @Option(names = {"--role"}, required = true, description = "Target role")
        String role;

        @Option(names = {"--level"}, defaultValue = "junior", description = "Required skill level")
        String level;

        @Option(names = {"--complexity"}, defaultValue = "minor", description = "minor|major")
        String complexity;

        @Option(names = {"--feature"}, description = "Owning feature id")
        String feature;

        @Option(names = {"--branch"}, description = "Branch name")
        String branch;

        @Option(names = {"--creator"}, description = "Creating agent identity")
        String creator;

        @Option(names = {"--stage"}, defaultValue = "false", description = "Keep the task pending even for a privileged creator")
        boolean stage;

        @Override
        public Integer call() {
            NewTask task = new NewTask(
                    feature,
                    title,
                    description,
                    AgentRole.fromString(role),
                    SkillLevel.fromString(level),
                    Complexity.fromString(complexity),
                    branch,
                    stage
            );
            System.out.println(Jsons.toJson(parent.runtime().createTask(task, creator)));
            return 0;
        }
    }

    @Command(name = "promote", description = "Move a pending task to created (privileged agents only)")
    static final class PromoteCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--task"}, required = true, description = "Task id")
        String taskId;

        @Option(names = {"--actor"}, required = true, description = "Privileged agent identity")
        String actor;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().promote(taskId, actor)));
            return 0;
        }
    }

    @Command(name = "next-task", description = "Wait for an eligible task; does not lock it")
    static final class NextTaskCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--role"}, required = true, description = "Agent role")
        String role;

        @Option(names = {"--level"}, required = true, description = "Agent skill level")
        String level;

        @Option(names = {"--wait-ms"}, defaultValue = "-1", description = "Wait deadline in ms; negative uses the configured default")
        long waitMs;

        @Override
        public Integer call() {
            WaitOutcome outcome = parent.runtime().nextTask(role, level, waitMs);
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "lock", description = "Acquire the lock on a created task")
    static final class LockCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--task"}, required = true, description = "Task id")
        String taskId;

        @Option(names = {"--agent"}, required = true, description = "Agent identity")
        String agent;

        @Option(names = {"--context"}, description = "Opaque execution context, e.g. a workspace path")
        String context;

        @Override
        public Integer call() {
            LockGrant grant = parent.runtime().lock(taskId, agent, context);
            System.out.println(Jsons.toJson(grant));
            return grant.granted() ? 0 : EXIT_ALREADY_LOCKED;
        }
    }

    @Command(name = "set-status", description = "Request a task state transition")
    static final class SetStatusCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--task"}, required = true, description = "Task id")
        String taskId;

        @Option(names = {"--agent"}, required = true, description = "Agent identity")
        String agent;

        @Option(names = {"--status"}, required = true, description = "Requested status")
        String status;

        @Option(names = {"--notes"}, description = "Notes recorded on the task")
        String notes;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(
                    parent.runtime().setStatus(taskId, agent, TaskStatus.fromString(status), notes)));
            return 0;
        }
    }

    @Command(name = "force-release", description = "Administratively clear a task's lock")
    static final class ForceReleaseCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--task"}, required = true, description = "Task id")
        String taskId;

        @Option(names = {"--actor"}, defaultValue = "admin", description = "Operator identity for the audit log")
        String actor;

        @Override
        public Integer call() {
            Optional<TaskStore.ForcedRelease> released = parent.runtime().forceRelease(taskId, actor);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("taskId", taskId);
            out.put("released", released.isPresent());
            released.ifPresent(r -> out.put("release", r));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "stale-locks", description = "List held tasks older than the stale threshold")
    static final class StaleLocksCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--threshold-ms"}, defaultValue = "-1", description = "Age threshold; negative uses the configured default")
        long thresholdMs;

        @Override
        public Integer call() {
            TaskMeshRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(thresholdMs < 0L ? runtime.staleLocks() : runtime.staleLocks(thresholdMs)));
            return 0;
        }
    }

    @Command(name = "task", description = "Show a task")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            Optional<?> task = parent.runtime().getTask(taskId);
            if (task.isEmpty()) {
                System.err.println("Task not found: " + taskId);
                return 1;
            }
            System.out.println(Jsons.toJson(task.get()));
            return 0;
        }
    }

    @Command(name = "tasks", description = "List tasks")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--status"}, description = "Filter by status")
        String status;

        @Override
        public Integer call() {
            TaskStatus filter = status == null || status.isBlank() ? null : TaskStatus.fromString(status);
            System.out.println(Jsons.toJson(parent.runtime().listTasks(filter)));
            return 0;
        }
    }

    @Command(name = "agents", description = "List registered agents")
    static final class AgentsCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().listAgents()));
            return 0;
        }
    }

    @Command(name = "lock-conflicts", description = "Show recent lost lock races and rejected holder transitions")
    static final class LockConflictsCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Option(names = {"--since-hours"}, defaultValue = "24", description = "Look-back window")
        int sinceHours;

        @Override
        public Integer call() {
            TaskMeshRuntime runtime = parent.runtime();
            long since = runtime.clock().millis() - Duration.ofHours(Math.max(0, sinceHours)).toMillis();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("summary", runtime.lockConflictSummary(since));
            out.put("conflicts", runtime.lockConflicts(limit, since));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "recover", description = "Reconcile an agent's recovery journal against the store")
    static final class RecoverCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent identity")
        String agent;

        @Override
        public Integer call() {
            Optional<JournalReconciler.Resumable> resumable = parent.runtime().reconciler().recover(agent);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("agentId", agent);
            out.put("resumable", resumable.isPresent());
            resumable.ifPresent(r -> out.put("entry", r.entry()));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "worker", description = "Run an agent loop that executes each task with a command")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent identity")
        String agent;

        @Option(names = {"--role"}, required = true, description = "Agent role")
        String role;

        @Option(names = {"--level"}, defaultValue = "junior", description = "Agent skill level")
        String level;

        @Option(names = {"--context"}, description = "Execution context handed to each task")
        String context;

        @Option(names = {"--wait-ms"}, defaultValue = "-1", description = "Per-cycle wait; negative uses the configured default")
        long waitMs;

        @Option(names = {"--max-tasks"}, defaultValue = "0", description = "Stop after this many tasks; 0 runs until stopped")
        int maxTasks;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run a single cycle")
        boolean once;

        @Parameters(arity = "1..*", description = "Command executed per task; task JSON arrives on stdin")
        List<String> command;

        @Override
        public Integer call() {
            TaskMeshRuntime runtime = parent.runtime();
            WaitCancellation cancellation = new WaitCancellation();
            try (AgentWorker worker = new AgentWorker(
                    runtime,
                    agent,
                    AgentRole.fromString(role),
                    SkillLevel.fromString(level),
                    new ScriptTaskHandler("script", new ArrayList<>(command)),
                    context)) {
                worker.register();
                if (once) {
                    System.out.println(Jsons.toJson(worker.runOnce(waitMs, cancellation)));
                    return 0;
                }
                Runtime.getRuntime().addShutdownHook(new Thread(cancellation::cancel, "taskmesh-shutdown-hook"));
                int finished = worker.runLoop(maxTasks, waitMs, cancellation);
                System.out.println(Jsons.toJson(Map.of("agentId", agent, "finished", finished)));
                return 0;
            }
        }
    }

    @Command(
            name = "broker",
            description = "Reference-counted lifecycle of the shared backing process",
            subcommands = {
                    BrokerCommand.AcquireCommand.class,
                    BrokerCommand.ReleaseCommand.class,
                    BrokerCommand.TouchCommand.class,
                    BrokerCommand.ReapCommand.class,
                    BrokerCommand.WatchCommand.class,
                    BrokerCommand.StatusCommand.class
            }
    )
    static final class BrokerCommand implements Runnable {
        @ParentCommand
        TaskMeshCommand parent;

        @Option(names = {"--stop-timeout-ms"}, defaultValue = "5000", description = "Grace period before a forced stop")
        long stopTimeoutMs;

        @Override
        public void run() {
            System.out.println("Use subcommands: acquire | release | touch | reap | watch | status");
        }

        ProcessLifecycleBroker broker(List<String> command) {
            return broker(parent.runtime(), command);
        }

        ProcessLifecycleBroker broker(TaskMeshRuntime runtime, List<String> command) {
            Path logFile = runtime.config().brokerDir().resolve("backing.log");
            CommandBackingProcess backing = new CommandBackingProcess(
                    command, null, logFile, Duration.ofMillis(Math.max(0L, stopTimeoutMs)));
            return runtime.createBroker(backing);
        }

        @Command(name = "acquire", description = "Register interest; starts the process if needed")
        static final class AcquireCommand implements Callable<Integer> {
            @ParentCommand
            BrokerCommand broker;

            @Option(names = {"--client"}, required = true, description = "Client identity")
            String client;

            @Option(names = {"--pid"}, description = "Client OS pid used for liveness checks")
            Long pid;

            @Parameters(arity = "1..*", description = "Backing process command")
            List<String> command;

            @Override
            public Integer call() {
                boolean started = broker.broker(command).acquireInterest(client, pid);
                System.out.println(Jsons.toJson(Map.of("client", client, "started", started)));
                return 0;
            }
        }

        @Command(name = "release", description = "Drop interest; stops the process when the last client leaves")
        static final class ReleaseCommand implements Callable<Integer> {
            @ParentCommand
            BrokerCommand broker;

            @Option(names = {"--client"}, required = true, description = "Client identity")
            String client;

            @Override
            public Integer call() {
                boolean stopped = broker.broker(List.of()).releaseInterest(client);
                System.out.println(Jsons.toJson(Map.of("client", client, "stopped", stopped)));
                return 0;
            }
        }

        @Command(name = "touch", description = "Client heartbeat")
        static final class TouchCommand implements Callable<Integer> {
            @ParentCommand
            BrokerCommand broker;

            @Option(names = {"--client"}, required = true, description = "Client identity")
            String client;

            @Override
            public Integer call() {
                boolean known = broker.broker(List.of()).touch(client);
                System.out.println(Jsons.toJson(Map.of("client", client, "known", known)));
                return known ? 0 : 1;
            }
        }

        @Command(name = "reap", description = "Evict clients whose heartbeat expired or whose process is gone")
        static final class ReapCommand implements Callable<Integer> {
            @ParentCommand
            BrokerCommand broker;

            @Override
            public Integer call() {
                System.out.println(Jsons.toJson(broker.broker(List.of()).reapStale()));
                return 0;
            }
        }

        @Command(name = "watch", description = "Reap stale clients periodically until stopped")
        static final class WatchCommand implements Callable<Integer> {
            @ParentCommand
            BrokerCommand broker;

            @Option(names = {"--duration-ms"}, defaultValue = "0", description = "Stop after this long; 0 runs until the process exits")
            long durationMs;

            @Override
            public Integer call() throws InterruptedException {
                TaskMeshRuntime runtime = broker.parent.runtime();
                CountDownLatch stop = new CountDownLatch(1);
                try (ProcessLifecycleBroker watched = broker.broker(runtime, List.of())) {
                    watched.startReaper(runtime.settings().brokerReapIntervalMs());
                    Runtime.getRuntime().addShutdownHook(new Thread(stop::countDown, "taskmesh-broker-watch-hook"));
                    if (durationMs > 0L) {
                        stop.await(durationMs, TimeUnit.MILLISECONDS);
                    } else {
                        stop.await();
                    }
                    System.out.println(Jsons.toJson(watched.status()));
                }
                return 0;
            }
        }

        @Command(name = "status", description = "Show registered clients and the backing process")
        static final class StatusCommand implements Callable<Integer> {
            @ParentCommand
            BrokerCommand broker;

            @Override
            public Integer call() {
                System.out.println(Jsons.toJson(broker.broker(List.of()).status()));
                return 0;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Override
        public Integer call() {
            AuditLogger.ChainCheck check = parent.runtime().auditLogger().verify();
            System.out.println(Jsons.toJson(check));
            return check.valid() ? 0 : 1;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        TaskMeshCommand parent;

        @Override
        public Integer call() {
            TaskMeshRuntime runtime = parent.runtime();
            List<Database.SchemaMigrationRow> rows = runtime.database().listSchemaMigrations();
            System.out.println(Jsons.toJson(rows));
            return 0;
        }
    }
}
