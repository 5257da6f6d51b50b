package com.flow.sync.service.persistence;

import com.flow.sync.service.model.GraphSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Durable copy of a workflow's graphs and the last sequence they include.
 */
public record WorkflowCheckpoint(
        String workflowId,
        long lastSequence,
        List<GraphSnapshot> graphs,
        Instant savedAt
) {

    public WorkflowCheckpoint {
        graphs = List.copyOf(graphs);
    }
}
