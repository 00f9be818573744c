package io.harvestmesh.storage;

import io.harvestmesh.config.HarvestMeshConfig;

/**
 * The four record sets of one database, opened together.
 */
public record HarvestStore(
        Database database,
        TaskQueue tasks,
        ProxyPool proxies,
        WorkerRegistry workers,
        ResultStore results,
        StoreStats stats
) {
    public static HarvestStore open(Database database, int proxyBlockThreshold) {
        return open(database, proxyBlockThreshold, HarvestMeshConfig.DEFAULT_MAX_TASK_ATTEMPTS);
    }

    public static HarvestStore open(Database database, int proxyBlockThreshold, int maxTaskAttempts) {
        return new HarvestStore(
                database,
                new TaskQueue(database, maxTaskAttempts),
                new ProxyPool(database, proxyBlockThreshold),
                new WorkerRegistry(database),
                new ResultStore(database),
                new StoreStats(database)
        );
    }
}
