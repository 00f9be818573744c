package io.harvestmesh.processing;

import io.harvestmesh.model.ProxyEndpoint;

/**
 * Extraction collaborator. A session is bound to one proxy and may be reused for several
 * tasks until the worker rotates its proxy.
 */
public interface PageProcessor {
    ProcessingSession openSession(ProxyEndpoint proxy) throws Exception;
}
