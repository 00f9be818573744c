package io.harvestmesh.model;

public record WorkerView(
        String workerId,
        String status,
        int tasksProcessed,
        int tasksFailed,
        long startedAtMs,
        long lastHeartbeatMs
) {
}
