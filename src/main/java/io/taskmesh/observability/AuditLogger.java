package io.taskmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskmesh.util.Hashing;
import io.taskmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only JSON-lines record of coordination decisions. Each row carries the hash of the
 * previous row, so edits and deletions inside the file are detectable with {@link #verify()}.
 *
 * <p>Several processes may append to one file. Each append runs under an exclusive lock on the
 * file and chains onto the last row actually on disk, not onto a hash cached in this instance.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final Map<Path, ReentrantLock> LOCAL_LOCKS = new ConcurrentHashMap<>();
    private static final int TAIL_WINDOW = 4096;

    private final Path auditFile;
    private final Clock clock;

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile.toAbsolutePath().normalize();
        this.clock = clock;
        try {
            Files.createDirectories(this.auditFile.getParent());
            if (!Files.exists(this.auditFile)) {
                try {
                    Files.createFile(this.auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    public void log(AuditEvent event) {
        withFileLock("write", channel -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", Instant.ofEpochMilli(clock.millis()).toString());
            row.put("action", event.action());
            row.put("agent_id", event.agentId());
            row.put("task_id", event.taskId());
            row.put("result", event.result());
            row.put("details", event.details());
            row.put("prev_hash", lastHash(channel));
            String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
            row.put("hash", rowHash);
            byte[] line = (Jsons.toCompactJson(row) + System.lineSeparator()).getBytes(StandardCharsets.UTF_8);
            ByteBuffer buffer = ByteBuffer.wrap(line);
            long position = channel.size();
            while (buffer.hasRemaining()) {
                position += channel.write(buffer, position);
            }
            return rowHash;
        });
    }

    public String currentHash() {
        return withFileLock("read", this::lastHash);
    }

    /**
     * Recomputes every row hash and checks the prev_hash links.
     */
    public ChainCheck verify() {
        List<String> lines = withFileLock("read", AuditLogger::readLines);
        String expectedPrev = "";
        int rows = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            rows++;
            try {
                @SuppressWarnings("unchecked")
                Map<String, Object> row = Jsons.mapper().readValue(line, LinkedHashMap.class);
                Object hash = row.remove("hash");
                if (!expectedPrev.equals(row.get("prev_hash"))) {
                    return new ChainCheck(false, rows, i + 1, "prev_hash does not link");
                }
                String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
                if (!recomputed.equals(hash)) {
                    return new ChainCheck(false, rows, i + 1, "row hash mismatch");
                }
                expectedPrev = recomputed;
            } catch (IOException e) {
                return new ChainCheck(false, rows, i + 1, "unparsable row: " + e.getMessage());
            }
        }
        return new ChainCheck(true, rows, 0, "ok");
    }

    // File locks are held per process, so threads of this JVM also queue on a local lock.
    private <T> T withFileLock(String operation, ChannelWork<T> work) {
        ReentrantLock local = LOCAL_LOCKS.computeIfAbsent(auditFile, p -> new ReentrantLock());
        local.lock();
        try (FileChannel channel = FileChannel.open(auditFile,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            return work.apply(channel);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to " + operation + " audit log " + auditFile, e);
        } finally {
            local.unlock();
        }
    }

    /**
     * Hash of the last non-blank row, read backwards from the end of the file.
     */
    private String lastHash(FileChannel channel) throws IOException {
        long size = channel.size();
        long window = TAIL_WINDOW;
        while (true) {
            int length = (int) Math.min(size, window);
            ByteBuffer buffer = ByteBuffer.allocate(length);
            long position = size - length;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position + buffer.position());
                if (read < 0) {
                    break;
                }
            }
            String tail = new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8).stripTrailing();
            int newline = tail.lastIndexOf('\n');
            if (newline >= 0 || length == size) {
                String last = tail.substring(newline + 1).trim();
                if (last.isEmpty()) {
                    return "";
                }
                try {
                    JsonNode node = Jsons.mapper().readTree(last);
                    return node.path("hash").asText("");
                } catch (IOException e) {
                    log.warn("Audit log {} has an unreadable tail, starting a new chain", auditFile, e);
                    return "";
                }
            }
            window *= 2;
        }
    }

    private static List<String> readLines(FileChannel channel) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(Math.toIntExact(channel.size()));
        while (buffer.hasRemaining()) {
            if (channel.read(buffer, buffer.position()) < 0) {
                break;
            }
        }
        String content = new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8);
        return content.lines().toList();
    }

    @FunctionalInterface
    private interface ChannelWork<T> {
        T apply(FileChannel channel) throws IOException;
    }

    public record AuditEvent(
            String action,
            String agentId,
            String taskId,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String agentId, String taskId, String result, Map<String, Object> details) {
            return new AuditEvent(action, agentId, taskId, result, details == null ? Map.of() : details);
        }
    }

    public record ChainCheck(boolean valid, int rows, int firstBadLine, String reason) {
    }
}
