package io.harvestmesh.model;

public record ProxyView(
        long proxyId,
        String proxy,
        String status,
        String lockedBy,
        Long lockedAtMs,
        int usesCount,
        int blocksCount,
        Long lastUsedAtMs
) {
}
