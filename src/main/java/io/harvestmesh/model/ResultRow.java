package io.harvestmesh.model;

public record ResultRow(
        long itemId,
        ListingRecord record,
        ResultStatus status,
        String failureReason,
        String workerId,
        int attempts,
        long processedAtMs,
        long createdAtMs,
        long updatedAtMs
) {
}
