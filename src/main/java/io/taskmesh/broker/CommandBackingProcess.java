package io.taskmesh.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the backing service as an OS process. Identity is pid plus start instant, so a
 * recycled pid is never mistaken for the process we started.
 */
public final class CommandBackingProcess implements BackingProcess {
    private static final Logger log = LoggerFactory.getLogger(CommandBackingProcess.class);
    private static final long START_INSTANT_TOLERANCE_MS = 1_000L;

    private final List<String> command;
    private final Path workingDir;
    private final Path logFile;
    private final Duration gracefulStopTimeout;

    /**
     * @param command may be empty for a client that only ever releases or reaps; such an
     *                instance refuses to start anything
     */
    public CommandBackingProcess(List<String> command, Path workingDir, Path logFile, Duration gracefulStopTimeout) {
        this.command = command == null ? List.of() : List.copyOf(command);
        this.workingDir = workingDir;
        this.logFile = logFile;
        this.gracefulStopTimeout = gracefulStopTimeout == null ? Duration.ofSeconds(5) : gracefulStopTimeout;
    }

    @Override
    public ProcessRef start() throws IOException {
        if (command.isEmpty()) {
            throw new IllegalStateException("No backing process command configured");
        }
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }
        if (logFile != null) {
            File out = logFile.toFile();
            builder.redirectOutput(ProcessBuilder.Redirect.appendTo(out));
        } else {
            builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        }
        Process process = builder.start();
        long startedAt = process.info().startInstant().map(Instant::toEpochMilli).orElse(System.currentTimeMillis());
        log.info("Started backing process pid={} command={}", process.pid(), command.get(0));
        return new ProcessRef(process.pid(), startedAt);
    }

    @Override
    public boolean isAlive(ProcessRef ref) {
        return matching(ref).isPresent();
    }

    @Override
    public void stop(ProcessRef ref) {
        Optional<ProcessHandle> handle = matching(ref);
        if (handle.isEmpty()) {
            log.info("Backing process pid={} already gone or replaced, nothing to stop", ref.pid());
            return;
        }
        ProcessHandle process = handle.get();
        process.destroy();
        try {
            process.onExit().get(gracefulStopTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Backing process pid={} stopped", ref.pid());
        } catch (TimeoutException e) {
            log.warn("Backing process pid={} ignored termination for {} ms, killing", ref.pid(), gracefulStopTimeout.toMillis());
            process.destroyForcibly();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed waiting for backing process " + ref.pid() + " to exit", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    private static Optional<ProcessHandle> matching(ProcessRef ref) {
        if (ref == null || ref.pid() <= 0L) {
            return Optional.empty();
        }
        return ProcessHandle.of(ref.pid())
                .filter(ProcessHandle::isAlive)
                .filter(h -> h.info().startInstant()
                        .map(i -> Math.abs(i.toEpochMilli() - ref.startedAtMs()) <= START_INSTANT_TOLERANCE_MS)
                        .orElse(true));
    }
}
