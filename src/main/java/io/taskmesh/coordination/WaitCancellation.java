package io.taskmesh.coordination;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned cancellation for a blocking {@code nextTask}. Cancelling never touches the
 * store; a cancelled wait simply returns.
 */
public final class WaitCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public static WaitCancellation none() {
        return new WaitCancellation();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable listener : listeners) {
                listener.run();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    Subscription onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get()) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
