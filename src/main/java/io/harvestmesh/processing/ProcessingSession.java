package io.harvestmesh.processing;

import io.harvestmesh.model.TaskLease;

public interface ProcessingSession extends AutoCloseable {
    ProcessingOutcome process(TaskLease task) throws Exception;

    @Override
    void close();
}
