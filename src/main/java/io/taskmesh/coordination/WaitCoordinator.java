package io.taskmesh.coordination;

import io.taskmesh.model.AgentRole;
import io.taskmesh.model.SkillLevel;
import io.taskmesh.model.TaskRecord;
import io.taskmesh.storage.StoreRetry;
import io.taskmesh.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Long-poll for eligible work. Polls the store with exponential backoff between
 * {@code initialPollMs} and {@code maxPollMs}, never sleeping past the deadline, and wakes
 * early on {@link TaskSignal}. It only finds candidates; the caller must still lock.
 */
public final class WaitCoordinator {
    private static final Logger log = LoggerFactory.getLogger(WaitCoordinator.class);

    private final TaskStore store;
    private final StoreRetry retry;
    private final TaskSignal signal;
    private final long initialPollMs;
    private final long maxPollMs;

    public WaitCoordinator(TaskStore store, StoreRetry retry, TaskSignal signal, long initialPollMs, long maxPollMs) {
        this.store = store;
        this.retry = retry;
        this.signal = signal;
        this.initialPollMs = Math.max(1L, initialPollMs);
        this.maxPollMs = Math.max(this.initialPollMs, maxPollMs);
    }

    public WaitOutcome nextTask(AgentRole role, SkillLevel level, long waitMs, WaitCancellation cancellation) {
        if (role == null || level == null) {
            throw new IllegalArgumentException("role and skill level are required");
        }
        WaitCancellation token = cancellation == null ? WaitCancellation.none() : cancellation;
        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, waitMs));
        long pollMs = initialPollMs;
        int polls = 0;
        try (WaitCancellation.Subscription ignored = token.onCancel(signal::wakeAll)) {
            while (true) {
                if (token.isCancelled() || Thread.currentThread().isInterrupted()) {
                    log.debug("nextTask cancelled role={} level={} polls={}", role.wireName(), level, polls);
                    return WaitOutcome.cancelled(elapsedMs(startNanos), polls);
                }
                long seen = signal.version();
                List<TaskRecord> pool = retry.call("task.pool", () -> store.eligiblePool(role, level));
                polls++;
                Optional<TaskRecord> match = TaskMatcher.findEligible(role, level, pool);
                if (match.isPresent()) {
                    return WaitOutcome.matched(match.get(), elapsedMs(startNanos), polls);
                }
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
                if (remainingMs <= 0L) {
                    return WaitOutcome.timeout(elapsedMs(startNanos), polls);
                }
                boolean woken;
                try {
                    woken = signal.awaitChange(seen, Math.min(pollMs, remainingMs));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return WaitOutcome.cancelled(elapsedMs(startNanos), polls);
                }
                pollMs = woken ? initialPollMs : Math.min(maxPollMs, pollMs * 2L);
            }
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
