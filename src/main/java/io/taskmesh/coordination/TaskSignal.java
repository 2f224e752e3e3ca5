package io.taskmesh.coordination;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process wake-up for waiters. Fired whenever a task may have become eligible (created,
 * promoted, released). Only shortens the next poll; other processes still rely on polling.
 */
public final class TaskSignal {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private long version;

    public long version() {
        lock.lock();
        try {
            return version;
        } finally {
            lock.unlock();
        }
    }

    public void publish() {
        lock.lock();
        try {
            version++;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void wakeAll() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks up to {@code timeoutMs} unless the version already moved past {@code seen}.
     * May return early on a wake-up without a version change.
     *
     * @return true when a publish happened after {@code seen}
     */
    public boolean awaitChange(long seen, long timeoutMs) throws InterruptedException {
        lock.lock();
        try {
            if (version == seen && timeoutMs > 0L) {
                changed.awaitNanos(TimeUnit.MILLISECONDS.toNanos(timeoutMs));
            }
            return version != seen;
        } finally {
            lock.unlock();
        }
    }
}
