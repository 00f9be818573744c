package io.harvestmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class HarvestMeshConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DEFAULT_PROGRAM_ID = "harvestmesh-worker";
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_REAPER_INTERVAL_MS = 60_000L;
    public static final long DEFAULT_STALE_TASK_MS = 600_000L;
    public static final long DEFAULT_STALE_PROXY_LOCK_MS = 300_000L;
    public static final long DEFAULT_DEAD_WORKER_MS = 240_000L;
    public static final int DEFAULT_MAX_TASK_ATTEMPTS = 5;
    public static final int DEFAULT_PROXY_BLOCK_THRESHOLD = 3;
    public static final int DEFAULT_WORKER_LANES = 15;
    public static final long DEFAULT_NO_PROXY_BACKOFF_MS = 30_000L;
    public static final long DEFAULT_ERROR_BACKOFF_MS = 10_000L;
    public static final int DEFAULT_REAPER_BATCH_LIMIT = 500;
    public static final long DEFAULT_PROCESSING_TIMEOUT_MS = 120_000L;
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 10_000;
    public static final int REGISTER_ATTEMPTS = 5;

    private final Path rootDir;

    public HarvestMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static HarvestMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new HarvestMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("harvestmesh.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("events.log");
    }

    public Path settingsFile() {
        return rootDir.resolve("harvestmesh-settings.json");
    }
}
