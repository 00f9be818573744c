package io.harvestmesh.model;

/**
 * A task row leased to one worker. {@code attempts} counts attempts consumed before this lease.
 */
public record TaskLease(
        long taskId,
        long itemId,
        int attempts,
        int maxAttempts,
        String workerId,
        long claimedAtMs
) {
}
