package io.taskmesh.model;

import java.util.Locale;

public enum Complexity {
    MINOR,
    MAJOR;

    public static Complexity fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MINOR;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (Complexity value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown complexity: " + raw);
    }
}
