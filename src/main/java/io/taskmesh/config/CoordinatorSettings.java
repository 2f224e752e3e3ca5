package io.taskmesh.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.taskmesh.model.TaskStatus;
import io.taskmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables shared by every coordination component.
 *
 * <p>Values are read from {@code taskmesh-settings.json} under the data root. Absent or
 * out-of-range fields fall back to the defaults below, so a partial file is always valid.
 */
public record CoordinatorSettings(
        long waitInitialPollMs,
        long waitMaxPollMs,
        long defaultWaitMs,
        long staleLockThresholdMs,
        long executionTimeoutMs,
        TaskStatus reworkTarget,
        int storeRetryAttempts,
        long storeRetryBaseMs,
        long storeRetryMaxMs,
        long brokerLivenessTimeoutMs,
        long brokerReapIntervalMs,
        int brokerMaxStartsPerWindow,
        long brokerStartWindowMs
) {
    public static final long DEFAULT_WAIT_INITIAL_POLL_MS = 250L;
    public static final long DEFAULT_WAIT_MAX_POLL_MS = 2_000L;
    public static final long DEFAULT_WAIT_MS = 180_000L;
    public static final long DEFAULT_STALE_LOCK_THRESHOLD_MS = 30L * 60L * 1_000L;
    public static final long DEFAULT_EXECUTION_TIMEOUT_MS = 600_000L;
    public static final int DEFAULT_STORE_RETRY_ATTEMPTS = 5;
    public static final long DEFAULT_STORE_RETRY_BASE_MS = 50L;
    public static final long DEFAULT_STORE_RETRY_MAX_MS = 2_000L;
    public static final long DEFAULT_BROKER_LIVENESS_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_BROKER_REAP_INTERVAL_MS = 10_000L;
    public static final int DEFAULT_BROKER_MAX_STARTS_PER_WINDOW = 3;
    public static final long DEFAULT_BROKER_START_WINDOW_MS = 5_000L;

    public static CoordinatorSettings defaults() {
        return new CoordinatorSettings(
                DEFAULT_WAIT_INITIAL_POLL_MS,
                DEFAULT_WAIT_MAX_POLL_MS,
                DEFAULT_WAIT_MS,
                DEFAULT_STALE_LOCK_THRESHOLD_MS,
                DEFAULT_EXECUTION_TIMEOUT_MS,
                TaskStatus.CREATED,
                DEFAULT_STORE_RETRY_ATTEMPTS,
                DEFAULT_STORE_RETRY_BASE_MS,
                DEFAULT_STORE_RETRY_MAX_MS,
                DEFAULT_BROKER_LIVENESS_TIMEOUT_MS,
                DEFAULT_BROKER_REAP_INTERVAL_MS,
                DEFAULT_BROKER_MAX_STARTS_PER_WINDOW,
                DEFAULT_BROKER_START_WINDOW_MS
        );
    }

    public static CoordinatorSettings load(TaskMeshConfig config) {
        return load(config.settingsFile());
    }

    public static CoordinatorSettings load(Path file) {
        CoordinatorSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid settings file: " + file, e);
        }
    }

    static CoordinatorSettings fromFile(SettingsFile file, CoordinatorSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long initialPoll = sanitizeLong(file.waitInitialPollMs(), defaults.waitInitialPollMs(), 10L);
        long maxPoll = sanitizeLong(file.waitMaxPollMs(), defaults.waitMaxPollMs(), initialPoll);
        if (maxPoll < initialPoll) {
            maxPoll = initialPoll;
        }
        long retryBase = sanitizeLong(file.storeRetryBaseMs(), defaults.storeRetryBaseMs(), 1L);
        long retryMax = sanitizeLong(file.storeRetryMaxMs(), defaults.storeRetryMaxMs(), retryBase);
        if (retryMax < retryBase) {
            retryMax = retryBase;
        }
        return new CoordinatorSettings(
                initialPoll,
                maxPoll,
                sanitizeLong(file.defaultWaitMs(), defaults.defaultWaitMs(), 0L),
                sanitizeLong(file.staleLockThresholdMs(), defaults.staleLockThresholdMs(), 1_000L),
                sanitizeLong(file.executionTimeoutMs(), defaults.executionTimeoutMs(), 1L),
                sanitizeReworkTarget(file.reworkTarget(), defaults.reworkTarget()),
                sanitizeInt(file.storeRetryAttempts(), defaults.storeRetryAttempts(), 1),
                retryBase,
                retryMax,
                sanitizeLong(file.brokerLivenessTimeoutMs(), defaults.brokerLivenessTimeoutMs(), 100L),
                sanitizeLong(file.brokerReapIntervalMs(), defaults.brokerReapIntervalMs(), 100L),
                sanitizeInt(file.brokerMaxStartsPerWindow(), defaults.brokerMaxStartsPerWindow(), 1),
                sanitizeLong(file.brokerStartWindowMs(), defaults.brokerStartWindowMs(), 1L)
        );
    }

    public CoordinatorSettings withWaitPolling(long initialPollMs, long maxPollMs) {
        return new CoordinatorSettings(
                initialPollMs, maxPollMs, defaultWaitMs, staleLockThresholdMs, executionTimeoutMs, reworkTarget,
                storeRetryAttempts, storeRetryBaseMs, storeRetryMaxMs, brokerLivenessTimeoutMs, brokerReapIntervalMs,
                brokerMaxStartsPerWindow, brokerStartWindowMs
        );
    }

    public CoordinatorSettings withReworkTarget(TaskStatus target) {
        return new CoordinatorSettings(
                waitInitialPollMs, waitMaxPollMs, defaultWaitMs, staleLockThresholdMs, executionTimeoutMs,
                sanitizeReworkTarget(target == null ? null : target.name(), reworkTarget),
                storeRetryAttempts, storeRetryBaseMs, storeRetryMaxMs, brokerLivenessTimeoutMs, brokerReapIntervalMs,
                brokerMaxStartsPerWindow, brokerStartWindowMs
        );
    }

    public CoordinatorSettings withBrokerLiveness(long livenessTimeoutMs, int maxStartsPerWindow, long startWindowMs) {
        return new CoordinatorSettings(
                waitInitialPollMs, waitMaxPollMs, defaultWaitMs, staleLockThresholdMs, executionTimeoutMs, reworkTarget,
                storeRetryAttempts, storeRetryBaseMs, storeRetryMaxMs, livenessTimeoutMs, brokerReapIntervalMs,
                maxStartsPerWindow, startWindowMs
        );
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    // Only CREATED and PENDING are meaningful places to send rejected work.
    private static TaskStatus sanitizeReworkTarget(String raw, TaskStatus fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        TaskStatus parsed;
        try {
            parsed = TaskStatus.fromString(raw);
        } catch (IllegalArgumentException e) {
            return fallback;
        }
        return parsed == TaskStatus.CREATED || parsed == TaskStatus.PENDING ? parsed : fallback;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long waitInitialPollMs,
            Long waitMaxPollMs,
            Long defaultWaitMs,
            Long staleLockThresholdMs,
            Long executionTimeoutMs,
            String reworkTarget,
            Integer storeRetryAttempts,
            Long storeRetryBaseMs,
            Long storeRetryMaxMs,
            Long brokerLivenessTimeoutMs,
            Long brokerReapIntervalMs,
            Integer brokerMaxStartsPerWindow,
            Long brokerStartWindowMs
    ) {
    }
}
