package com.flow.sync.service.persistence;

import java.util.Optional;

/**
 * Load/save boundary for workflow documents.
 *
 * Used on actor cold start and by the flush and eviction policy; never
 * consulted while an actor is resident. Implementations throw on I/O
 * failure so the caller can isolate it to the affected workflow.
 */
public interface WorkflowCheckpointRepository {

    Optional<WorkflowCheckpoint> load(String workflowId);

    void save(WorkflowCheckpoint checkpoint);

    boolean delete(String workflowId);
}
