package io.taskmesh.model;

import java.util.Locale;

public enum TaskStatus {
    PENDING,
    CREATED,
    LOCKED,
    DEV_DONE,
    TESTING,
    QA_DONE,
    COMPLETED;

    /**
     * Held states are the ones in which a task carries a lock owner.
     */
    public boolean held() {
        return this == LOCKED || this == TESTING;
    }

    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Task status must not be blank");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (TaskStatus value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + raw);
    }
}
