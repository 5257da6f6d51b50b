package com.flow.sync.service.model;

/**
 * One graph of a workflow together with the sequence it reflects.
 */
public record GraphState(String workflowId, long sequence, GraphSnapshot graph) {
}
