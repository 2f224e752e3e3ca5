package io.taskmesh.broker;

import java.io.IOException;

/**
 * The shared process whose lifetime the broker reference-counts.
 */
public interface BackingProcess {
    ProcessRef start() throws IOException;

    /**
     * True only if {@code ref} still names the process that was started, not a later process
     * that reused its pid.
     */
    boolean isAlive(ProcessRef ref);

    void stop(ProcessRef ref);

    record ProcessRef(long pid, long startedAtMs) {
    }
}
