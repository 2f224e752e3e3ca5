package io.taskmesh.broker;

import io.taskmesh.util.AtomicFiles;
import io.taskmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference-counted lifetime of the shared backing process.
 *
 * <p>Interest is a set of client identities, so a retried acquire never inflates the count.
 * Every mutation runs under an exclusive lock on {@code lockFile} (plus a JVM-local lock, since
 * file locks are per process) and rewrites {@code stateFile} atomically. Clients that vanish
 * without releasing are evicted at the start of every mutation, by {@link #reapStale()}, and
 * periodically once {@link #startReaper(long)} runs.
 */
public final class ProcessLifecycleBroker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProcessLifecycleBroker.class);
    private static final Map<Path, ReentrantLock> LOCAL_LOCKS = new ConcurrentHashMap<>();

    private final Path stateFile;
    private final Path lockFile;
    private final BackingProcess backing;
    private final StartupRateLimiter rateLimiter;
    private final Clock clock;
    private final long livenessTimeoutMs;
    private final Object reaperGuard = new Object();
    private ScheduledExecutorService reaper;

    public ProcessLifecycleBroker(Path stateFile,
                                  Path lockFile,
                                  BackingProcess backing,
                                  StartupRateLimiter rateLimiter,
                                  Clock clock,
                                  long livenessTimeoutMs) {
        this.stateFile = stateFile.toAbsolutePath().normalize();
        this.lockFile = lockFile.toAbsolutePath().normalize();
        this.backing = backing;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
        this.livenessTimeoutMs = livenessTimeoutMs;
    }

    public boolean acquireInterest(String clientId) {
        return acquireInterest(clientId, null);
    }

    /**
     * Registers {@code clientId} and starts the backing process if it is not running.
     *
     * @return true iff this call started the process
     * @throws IllegalStateException when the start is refused by the rate limiter
     */
    public boolean acquireInterest(String clientId, Long clientPid) {
        requireClient(clientId);
        return mutate(state -> {
            long now = clock.millis();
            evictStale(state, now);
            BrokerState.ClientInterest existing = state.clients().get(clientId);
            long registeredAt = existing == null ? now : existing.registeredAtMs();
            Long pid = clientPid != null ? clientPid : existing == null ? null : existing.pid();
            state.clients().put(clientId, new BrokerState.ClientInterest(pid, registeredAt, now));

            BackingProcess.ProcessRef process = state.process();
            if (process != null && backing.isAlive(process)) {
                log.info("Interest acquired client={} clients={} (already running pid={})",
                        clientId, state.clients().size(), process.pid());
                return new Mutation<>(state, false);
            }
            if (process != null) {
                log.warn("Recorded backing process pid={} is gone, restarting", process.pid());
            }
            List<Long> starts = rateLimiter.admit(state.recentStarts(), now);
            BackingProcess.ProcessRef started;
            try {
                started = backing.start();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to start backing process", e);
            }
            log.info("Interest acquired client={} started backing process pid={}", clientId, started.pid());
            return new Mutation<>(new BrokerState(state.clients(), started, starts), true);
        });
    }

    /**
     * @return true iff this call stopped the backing process
     */
    public boolean releaseInterest(String clientId) {
        requireClient(clientId);
        return mutate(state -> {
            List<String> evicted = evictStale(state, clock.millis());
            if (state.clients().remove(clientId) == null && evicted.isEmpty()) {
                log.info("Release ignored, client={} holds no interest", clientId);
                return new Mutation<>(state, false);
            }
            log.info("Interest released client={} remaining={}", clientId, state.clients().size());
            BrokerState next = stopIfAbandoned(state);
            return new Mutation<>(next, state.process() != null && next.process() == null);
        });
    }

    /**
     * Heartbeat. Returns false when the client holds no interest, e.g. after being reaped.
     */
    public boolean touch(String clientId) {
        requireClient(clientId);
        return mutate(state -> {
            List<String> evicted = evictStale(state, clock.millis());
            BrokerState.ClientInterest existing = state.clients().get(clientId);
            if (existing == null) {
                return new Mutation<>(evicted.isEmpty() ? state : stopIfAbandoned(state), false);
            }
            state.clients().put(clientId, new BrokerState.ClientInterest(
                    existing.pid(), existing.registeredAtMs(), Math.max(existing.lastSeenAtMs(), clock.millis())));
            return new Mutation<>(state, true);
        });
    }

    public ReapOutcome reapStale() {
        return mutate(state -> {
            List<String> evicted = evictStale(state, clock.millis());
            if (evicted.isEmpty()) {
                return new Mutation<>(state, new ReapOutcome(evicted, false));
            }
            BrokerState next = stopIfAbandoned(state);
            boolean stopped = state.process() != null && next.process() == null;
            return new Mutation<>(next, new ReapOutcome(evicted, stopped));
        });
    }

    public BrokerStatus status() {
        return withStateLock(false, state -> {
            BackingProcess.ProcessRef process = state.process();
            boolean running = process != null && backing.isAlive(process);
            return new Mutation<>(state, new BrokerStatus(new TreeSet<>(state.clients().keySet()), process, running));
        });
    }

    public void startReaper(long intervalMs) {
        synchronized (reaperGuard) {
            if (reaper != null) {
                return;
            }
            reaper = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "taskmesh-broker-reaper");
                t.setDaemon(true);
                return t;
            });
            long period = Math.max(100L, intervalMs);
            reaper.scheduleAtFixedRate(this::reapQuietly, period, period, TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public void close() {
        synchronized (reaperGuard) {
            if (reaper != null) {
                reaper.shutdownNow();
                reaper = null;
            }
        }
    }

    // A failing periodic task would cancel the schedule, so failures are logged and the next tick retries.
    private void reapQuietly() {
        try {
            ReapOutcome outcome = reapStale();
            if (!outcome.evicted().isEmpty()) {
                log.info("Reaper evicted {} client(s), stopped={}", outcome.evicted().size(), outcome.stopped());
            }
        } catch (RuntimeException e) {
            log.error("Broker reap failed", e);
        }
    }

    private List<String> evictStale(BrokerState state, long now) {
        List<String> evicted = new ArrayList<>();
        for (Map.Entry<String, BrokerState.ClientInterest> entry : new ArrayList<>(state.clients().entrySet())) {
            BrokerState.ClientInterest interest = entry.getValue();
            boolean expired = now - interest.lastSeenAtMs() > livenessTimeoutMs;
            boolean processGone = interest.pid() != null && !pidAlive(interest.pid());
            if (expired || processGone) {
                state.clients().remove(entry.getKey());
                evicted.add(entry.getKey());
                log.warn("Evicted stale client={} expired={} processGone={}", entry.getKey(), expired, processGone);
            }
        }
        return evicted;
    }

    private BrokerState stopIfAbandoned(BrokerState state) {
        if (!state.clients().isEmpty() || state.process() == null) {
            return state;
        }
        backing.stop(state.process());
        log.info("No clients left, backing process pid={} stopped", state.process().pid());
        return new BrokerState(state.clients(), null, state.recentStarts());
    }

    private <T> T mutate(StateChange<T> change) {
        return withStateLock(true, change);
    }

    private <T> T withStateLock(boolean persist, StateChange<T> change) {
        ReentrantLock local = LOCAL_LOCKS.computeIfAbsent(lockFile, p -> new ReentrantLock());
        local.lock();
        try {
            Files.createDirectories(lockFile.getParent());
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                BrokerState before = readState();
                Mutation<T> result = change.apply(before);
                if (persist) {
                    writeState(result.state());
                }
                return result.value();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Broker state unavailable: " + stateFile, e);
        } finally {
            local.unlock();
        }
    }

    private BrokerState readState() throws IOException {
        if (!Files.exists(stateFile) || Files.size(stateFile) == 0L) {
            return BrokerState.empty();
        }
        return Jsons.mapper().readValue(stateFile.toFile(), BrokerState.class).normalized();
    }

    private void writeState(BrokerState state) throws IOException {
        AtomicFiles.writeDurably(stateFile, Jsons.mapper().writeValueAsBytes(state));
    }

    private static boolean pidAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    private static void requireClient(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("client identity must not be blank");
        }
    }

    @FunctionalInterface
    private interface StateChange<T> {
        Mutation<T> apply(BrokerState state) throws IOException;
    }

    private record Mutation<T>(BrokerState state, T value) {
    }

    public record ReapOutcome(List<String> evicted, boolean stopped) {
    }

    public record BrokerStatus(Set<String> clients, BackingProcess.ProcessRef process, boolean running) {
    }
}
