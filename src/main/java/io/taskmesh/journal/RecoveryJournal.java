package io.taskmesh.journal;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.taskmesh.util.AtomicFiles;
import io.taskmesh.util.FileNames;
import io.taskmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.CharConversionException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Per-agent local record of the task currently held, one JSON file per agent identity.
 *
 * <p>{@link #record} returns only after the entry is on disk, so work started afterwards is
 * always recoverable. This class does not consult the store; use {@link JournalReconciler}
 * to decide whether an entry is still valid.
 */
public final class RecoveryJournal {
    private static final Logger log = LoggerFactory.getLogger(RecoveryJournal.class);

    private final Path dir;
    private final Clock clock;

    public RecoveryJournal(Path dir, Clock clock) {
        this.dir = dir;
        this.clock = clock;
    }

    public void record(JournalEntry entry) {
        if (entry == null || isBlank(entry.agentId()) || isBlank(entry.taskId())) {
            throw new IllegalArgumentException("journal entry requires agentId and taskId");
        }
        Path file = entryFile(entry.agentId());
        try {
            byte[] body = Jsons.mapper().writeValueAsBytes(entry);
            AtomicFiles.writeDurably(file, body);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write recovery journal for agent " + entry.agentId(), e);
        }
        log.info("Journaled task={} agent={} epoch={}", entry.taskId(), entry.agentId(), entry.lockEpoch());
    }

    /**
     * Reads the raw entry. An unreadable or mismatched entry is deleted and reported as
     * absent.
     */
    public Optional<JournalEntry> read(String agentId) {
        Path file = entryFile(agentId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            // Bytes, not a String: bad encodings surface as a parse failure.
            byte[] body = Files.readAllBytes(file);
            JournalEntry entry = Jsons.mapper().readValue(body, JournalEntry.class);
            if (entry == null || isBlank(entry.taskId())) {
                throw new JournalCorruptException(agentId, "entry has no task id", null);
            }
            if (!agentId.equals(entry.agentId())) {
                throw new JournalCorruptException(agentId, "entry belongs to " + entry.agentId(), null);
            }
            return Optional.of(entry);
        } catch (JsonProcessingException e) {
            discardCorrupt(agentId, file, new JournalCorruptException(agentId, "unparsable entry", e));
            return Optional.empty();
        } catch (JournalCorruptException e) {
            discardCorrupt(agentId, file, e);
            return Optional.empty();
        } catch (CharConversionException | CharacterCodingException e) {
            discardCorrupt(agentId, file, new JournalCorruptException(agentId, "undecodable entry", e));
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read recovery journal for agent " + agentId, e);
        }
    }

    public boolean clear(String agentId) {
        try {
            boolean deleted = Files.deleteIfExists(entryFile(agentId));
            if (deleted) {
                log.info("Cleared journal agent={}", agentId);
            }
            return deleted;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear recovery journal for agent " + agentId, e);
        }
    }

    /**
     * Amends the execution context and branch of the live entry, keeping the lock fields.
     */
    public Optional<JournalEntry> update(String agentId, String executionContext, String branch) {
        Optional<JournalEntry> current = read(agentId);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        JournalEntry updated = current.get().withContext(executionContext, branch, clock.millis());
        record(updated);
        return Optional.of(updated);
    }

    public Optional<Duration> lockAge(String agentId) {
        return read(agentId).map(e -> Duration.ofMillis(Math.max(0L, clock.millis() - e.lockedAtMs())));
    }

    public boolean exists(String agentId) {
        return Files.exists(entryFile(agentId));
    }

    Path entryFile(String agentId) {
        return dir.resolve("agent-" + FileNames.safeFragment(agentId) + ".json");
    }

    private void discardCorrupt(String agentId, Path file, JournalCorruptException reason) {
        log.warn("Discarding recovery journal {}: {}", file, reason.getMessage(), reason);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            reason.addSuppressed(e);
            throw new UncheckedIOException("Failed to delete corrupt journal for agent " + agentId, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
