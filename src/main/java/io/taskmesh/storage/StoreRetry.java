package io.taskmesh.storage;

import io.taskmesh.config.CoordinatorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Retries store calls that failed with {@link StoreUnavailableException}. Every other
 * exception passes straight through on the first attempt.
 */
public final class StoreRetry {
    private static final Logger log = LoggerFactory.getLogger(StoreRetry.class);

    private final int maxAttempts;
    private final long baseBackoffMs;
    private final long maxBackoffMs;
    private final Sleeper sleeper;

    public StoreRetry(CoordinatorSettings settings) {
        this(settings.storeRetryAttempts(), settings.storeRetryBaseMs(), settings.storeRetryMaxMs(), Thread::sleep);
    }

    StoreRetry(int maxAttempts, long baseBackoffMs, long maxBackoffMs, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseBackoffMs = Math.max(1L, baseBackoffMs);
        this.maxBackoffMs = Math.max(this.baseBackoffMs, maxBackoffMs);
        this.sleeper = sleeper;
    }

    public <T> T call(String operation, Supplier<T> body) {
        StoreUnavailableException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return body.get();
            } catch (StoreUnavailableException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                long backoff = computeBackoffMs(attempt);
                log.warn("{} failed on attempt {}/{}, retrying in {} ms: {}",
                        operation, attempt, maxAttempts, backoff, e.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
        log.error("{} gave up after {} attempts", operation, maxAttempts);
        throw last;
    }

    public void run(String operation, Runnable body) {
        call(operation, () -> {
            body.run();
            return null;
        });
    }

    long computeBackoffMs(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        long jitter = ThreadLocalRandom.current().nextLong(0L, Math.max(1L, baseBackoffMs / 2L) + 1L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
