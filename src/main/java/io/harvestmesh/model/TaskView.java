package io.harvestmesh.model;

public record TaskView(
        long taskId,
        long itemId,
        String status,
        String workerId,
        int attempts,
        int maxAttempts,
        long createdAtMs,
        Long lastAttemptAtMs,
        Long completedAtMs
) {
}
