package io.harvestmesh.model;

public record ProxyLease(
        long proxyId,
        String proxy,
        String workerId,
        long lockedAtMs,
        int usesCount,
        int blocksCount
) {
    public ProxyEndpoint endpoint() {
        return ProxyEndpoint.parse(proxy);
    }
}
