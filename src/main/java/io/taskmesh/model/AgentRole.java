package io.taskmesh.model;

import java.util.Locale;

public enum AgentRole {
    FRONTEND_DEV("frontend_dev", false),
    BACKEND_DEV("backend_dev", false),
    QA("qa", false),
    ARCHITECT("architect", true),
    PM("pm", true);

    private final String wireName;
    private final boolean privileged;

    AgentRole(String wireName, boolean privileged) {
        this.wireName = wireName;
        this.privileged = privileged;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Privileged roles may stage and promote tasks and close out tested work.
     */
    public boolean privileged() {
        return privileged;
    }

    public static AgentRole fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Role must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (AgentRole value : values()) {
            if (value.wireName.equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + raw);
    }
}
