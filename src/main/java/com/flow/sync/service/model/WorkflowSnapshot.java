package com.flow.sync.service.model;

import java.util.List;

/**
 * Immutable copy of every graph of a workflow at a given sequence.
 */
public record WorkflowSnapshot(String workflowId, long sequence, List<GraphSnapshot> graphs) {

    public WorkflowSnapshot {
        graphs = List.copyOf(graphs);
    }
}
