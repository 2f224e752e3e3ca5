package io.taskmesh.model;

import java.util.Locale;

/**
 * Ordered skill levels. {@link #rank()} is persisted so the store can filter by
 * "at or below" without decoding names.
 */
public enum SkillLevel {
    JUNIOR(1),
    SENIOR(2),
    PRINCIPAL(3);

    private final int rank;

    SkillLevel(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean canTake(SkillLevel taskLevel) {
        return taskLevel.rank <= rank;
    }

    public static SkillLevel fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Skill level must not be blank");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (SkillLevel value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown skill level: " + raw);
    }
}
