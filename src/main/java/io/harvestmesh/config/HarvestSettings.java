package io.harvestmesh.config;

import io.harvestmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Effective tunables of a HarvestMesh process.
 *
 * <p>Resolution order is defaults, then {@code harvestmesh-settings.json} under the data root,
 * then {@code HARVESTMESH_*} environment variables. CLI flags are applied last by the commands
 * through the {@code with*} copies.
 */
public record HarvestSettings(
        long heartbeatIntervalMs,
        long reaperIntervalMs,
        long staleTaskMs,
        long staleProxyLockMs,
        long deadWorkerMs,
        int maxTaskAttempts,
        int proxyBlockThreshold,
        int workerLanes,
        long noProxyBackoffMs,
        long errorBackoffMs,
        int reaperBatchLimit,
        long processingTimeoutMs,
        String programId
) {
    public static final String ENV_PREFIX = "HARVESTMESH_";

    public static HarvestSettings defaults() {
        return new HarvestSettings(
                HarvestMeshConfig.DEFAULT_HEARTBEAT_INTERVAL_MS,
                HarvestMeshConfig.DEFAULT_REAPER_INTERVAL_MS,
                HarvestMeshConfig.DEFAULT_STALE_TASK_MS,
                HarvestMeshConfig.DEFAULT_STALE_PROXY_LOCK_MS,
                HarvestMeshConfig.DEFAULT_DEAD_WORKER_MS,
                HarvestMeshConfig.DEFAULT_MAX_TASK_ATTEMPTS,
                HarvestMeshConfig.DEFAULT_PROXY_BLOCK_THRESHOLD,
                HarvestMeshConfig.DEFAULT_WORKER_LANES,
                HarvestMeshConfig.DEFAULT_NO_PROXY_BACKOFF_MS,
                HarvestMeshConfig.DEFAULT_ERROR_BACKOFF_MS,
                HarvestMeshConfig.DEFAULT_REAPER_BATCH_LIMIT,
                HarvestMeshConfig.DEFAULT_PROCESSING_TIMEOUT_MS,
                HarvestMeshConfig.DEFAULT_PROGRAM_ID
        );
    }

    public static HarvestSettings load(HarvestMeshConfig config, Map<String, String> env) {
        HarvestSettings fromFile = fromFile(readFile(config.settingsFile()), defaults());
        return fromFile.withEnvironment(env);
    }

    static SettingsFile readFile(Path file) {
        if (file == null || !Files.exists(file)) {
            return null;
        }
        try {
            return Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new IllegalStateException("Invalid settings file: " + file, e);
        }
    }

    static HarvestSettings fromFile(SettingsFile file, HarvestSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long heartbeat = sanitizeLong(file.heartbeatIntervalMs(), defaults.heartbeatIntervalMs(), 100L);
        long deadWorker = sanitizeLong(file.deadWorkerMs(), defaults.deadWorkerMs(), heartbeat);
        if (deadWorker <= heartbeat) {
            deadWorker = heartbeat * 2L;
        }
        long processingTimeout = sanitizeLong(file.processingTimeoutMs(), defaults.processingTimeoutMs(), 1_000L);
        // a live attempt or a heartbeating holder must never look stale to the reaper
        long staleTask = sanitizeLong(file.staleTaskMs(), defaults.staleTaskMs(), 1_000L);
        if (staleTask <= processingTimeout) {
            staleTask = processingTimeout * 2L;
        }
        long staleProxyLock = sanitizeLong(file.staleProxyLockMs(), defaults.staleProxyLockMs(), 1_000L);
        if (staleProxyLock <= heartbeat) {
            staleProxyLock = heartbeat * 2L;
        }
        return new HarvestSettings(
                heartbeat,
                sanitizeLong(file.reaperIntervalMs(), defaults.reaperIntervalMs(), 100L),
                staleTask,
                staleProxyLock,
                deadWorker,
                sanitizeInt(file.maxTaskAttempts(), defaults.maxTaskAttempts(), 1),
                sanitizeInt(file.proxyBlockThreshold(), defaults.proxyBlockThreshold(), 1),
                sanitizeInt(file.workerLanes(), defaults.workerLanes(), 1),
                sanitizeLong(file.noProxyBackoffMs(), defaults.noProxyBackoffMs(), 0L),
                sanitizeLong(file.errorBackoffMs(), defaults.errorBackoffMs(), 0L),
                sanitizeInt(file.reaperBatchLimit(), defaults.reaperBatchLimit(), 1),
                processingTimeout,
                file.programId() == null || file.programId().isBlank() ? defaults.programId() : file.programId().trim()
        );
    }

    public HarvestSettings withEnvironment(Map<String, String> env) {
        if (env == null || env.isEmpty()) {
            return this;
        }
        SettingsFile overrides = new SettingsFile(
                envLong(env, "HEARTBEAT_INTERVAL_MS"),
                envLong(env, "REAPER_INTERVAL_MS"),
                envLong(env, "STALE_TASK_MS"),
                envLong(env, "STALE_PROXY_LOCK_MS"),
                envLong(env, "DEAD_WORKER_MS"),
                envInt(env, "MAX_TASK_ATTEMPTS"),
                envInt(env, "PROXY_BLOCK_THRESHOLD"),
                envInt(env, "WORKER_LANES"),
                envLong(env, "NO_PROXY_BACKOFF_MS"),
                envLong(env, "ERROR_BACKOFF_MS"),
                envInt(env, "REAPER_BATCH_LIMIT"),
                envLong(env, "PROCESSING_TIMEOUT_MS"),
                env.get(ENV_PREFIX + "PROGRAM_ID")
        );
        return fromFile(overrides, this);
    }

    public HarvestSettings withWorkerLanes(int lanes) {
        return new HarvestSettings(heartbeatIntervalMs, reaperIntervalMs, staleTaskMs, staleProxyLockMs, deadWorkerMs,
                maxTaskAttempts, proxyBlockThreshold, Math.max(1, lanes), noProxyBackoffMs, errorBackoffMs,
                reaperBatchLimit, processingTimeoutMs, programId);
    }

    public HarvestSettings withProgramId(String id) {
        String safe = id == null || id.isBlank() ? programId : id.trim();
        return new HarvestSettings(heartbeatIntervalMs, reaperIntervalMs, staleTaskMs, staleProxyLockMs, deadWorkerMs,
                maxTaskAttempts, proxyBlockThreshold, workerLanes, noProxyBackoffMs, errorBackoffMs,
                reaperBatchLimit, processingTimeoutMs, safe);
    }

    private static Long envLong(Map<String, String> env, String key) {
        String raw = env.get(ENV_PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(ENV_PREFIX + key + " must be a number: " + raw, e);
        }
    }

    private static Integer envInt(Map<String, String> env, String key) {
        Long value = envLong(env, key);
        return value == null ? null : Math.toIntExact(value);
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    record SettingsFile(
            Long heartbeatIntervalMs,
            Long reaperIntervalMs,
            Long staleTaskMs,
            Long staleProxyLockMs,
            Long deadWorkerMs,
            Integer maxTaskAttempts,
            Integer proxyBlockThreshold,
            Integer workerLanes,
            Long noProxyBackoffMs,
            Long errorBackoffMs,
            Integer reaperBatchLimit,
            Long processingTimeoutMs,
            String programId
    ) {
    }
}
