package io.taskmesh.broker;

import java.util.ArrayList;
import java.util.List;

/**
 * Sliding-window cap on backing process starts. Works on the start history kept in the shared
 * broker state so the limit holds across processes.
 */
public final class StartupRateLimiter {
    private final int maxStarts;
    private final long windowMs;

    public StartupRateLimiter(int maxStarts, long windowMs) {
        if (maxStarts < 1 || windowMs < 1L) {
            throw new IllegalArgumentException("maxStarts and windowMs must be positive");
        }
        this.maxStarts = maxStarts;
        this.windowMs = windowMs;
    }

    /**
     * Returns the history with {@code nowMs} appended.
     *
     * @throws IllegalStateException when the window already holds {@code maxStarts} starts
     */
    public List<Long> admit(List<Long> recentStarts, long nowMs) {
        List<Long> inWindow = prune(recentStarts, nowMs);
        if (inWindow.size() >= maxStarts) {
            throw new IllegalStateException("Backing process start refused: " + inWindow.size()
                    + " starts within " + windowMs + " ms");
        }
        inWindow.add(nowMs);
        return inWindow;
    }

    public List<Long> prune(List<Long> recentStarts, long nowMs) {
        List<Long> out = new ArrayList<>();
        if (recentStarts == null) {
            return out;
        }
        for (Long startedAt : recentStarts) {
            if (startedAt != null && nowMs - startedAt < windowMs) {
                out.add(startedAt);
            }
        }
        return out;
    }
}
