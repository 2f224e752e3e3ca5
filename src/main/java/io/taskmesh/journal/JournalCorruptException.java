package io.taskmesh.journal;

import io.taskmesh.coordination.CoordinationException;

public final class JournalCorruptException extends CoordinationException {
    public JournalCorruptException(String agentId, String message, Throwable cause) {
        super("Recovery journal for agent " + agentId + " is unusable: " + message, null, agentId, cause);
    }
}
