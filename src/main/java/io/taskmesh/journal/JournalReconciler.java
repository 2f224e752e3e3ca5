package io.taskmesh.journal;

import io.taskmesh.model.TaskRecord;
import io.taskmesh.storage.StoreRetry;
import io.taskmesh.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Checks a journal entry against the store before an agent resumes it. The store is
 * authoritative: an entry is only returned while the task is still held by the same agent
 * under the same lock epoch.
 */
public final class JournalReconciler {
    private static final Logger log = LoggerFactory.getLogger(JournalReconciler.class);

    private final RecoveryJournal journal;
    private final TaskStore store;
    private final StoreRetry retry;

    public JournalReconciler(RecoveryJournal journal, TaskStore store, StoreRetry retry) {
        this.journal = journal;
        this.store = store;
        this.retry = retry;
    }

    public Optional<Resumable> recover(String agentId) {
        Optional<JournalEntry> entry = journal.read(agentId);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        JournalEntry journaled = entry.get();
        Optional<TaskRecord> current = retry.call("journal.reconcile",
                () -> store.findTask(journaled.taskId()));
        String mismatch = mismatch(agentId, journaled, current.orElse(null));
        if (mismatch != null) {
            log.warn("Discarding journal agent={} task={}: {}", agentId, journaled.taskId(), mismatch);
            journal.clear(agentId);
            return Optional.empty();
        }
        log.info("Recovered task={} agent={} status={}", journaled.taskId(), agentId, current.get().status());
        return Optional.of(new Resumable(journaled, current.get()));
    }

    private static String mismatch(String agentId, JournalEntry entry, TaskRecord task) {
        if (task == null) {
            return "task no longer exists";
        }
        if (!task.heldBy(agentId)) {
            return "store shows status=" + task.status() + " holder=" + task.lockedBy();
        }
        if (task.lockEpoch() != entry.lockEpoch()) {
            return "lock epoch moved from " + entry.lockEpoch() + " to " + task.lockEpoch();
        }
        return null;
    }

    /**
     * A journal entry confirmed by the store, with the current task row.
     */
    public record Resumable(JournalEntry entry, TaskRecord task) {
    }
}
