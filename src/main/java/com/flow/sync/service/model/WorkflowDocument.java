package com.flow.sync.service.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable set of graphs belonging to one workflow.
 *
 * Exactly one graph is the main graph; it always exists and cannot be
 * removed. Not thread-safe: owned by the workflow's actor.
 */
public final class WorkflowDocument {

    public static final String MAIN_GRAPH_ID = "main";
    public static final String MAIN_GRAPH_NAME = "Main";

    private final String workflowId;
    private final Map<String, WorkflowGraph> graphs = new LinkedHashMap<>();

    private WorkflowDocument(String workflowId) {
        this.workflowId = workflowId;
    }

    public static WorkflowDocument create(String workflowId) {
        var document = new WorkflowDocument(workflowId);
        document.putGraph(new WorkflowGraph(MAIN_GRAPH_ID, MAIN_GRAPH_NAME, true));
        return document;
    }

    public static WorkflowDocument fromSnapshots(String workflowId, List<GraphSnapshot> snapshots) {
        var document = new WorkflowDocument(workflowId);
        snapshots.forEach(snapshot -> document.putGraph(WorkflowGraph.fromSnapshot(snapshot)));
        if (!document.graphs.containsKey(MAIN_GRAPH_ID)) {
            document.graphs.put(MAIN_GRAPH_ID, new WorkflowGraph(MAIN_GRAPH_ID, MAIN_GRAPH_NAME, true));
        }
        return document;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public Optional<WorkflowGraph> findGraph(String graphId) {
        return Optional.ofNullable(graphs.get(graphId));
    }

    public boolean hasGraph(String graphId) {
        return graphs.containsKey(graphId);
    }

    public void putGraph(WorkflowGraph graph) {
        graphs.put(graph.getGraphId(), graph);
    }

    public WorkflowGraph removeGraph(String graphId) {
        return graphs.remove(graphId);
    }

    public Collection<WorkflowGraph> getGraphs() {
        return graphs.values();
    }

    public List<GraphSnapshot> snapshotGraphs() {
        return graphs.values().stream()
                .map(WorkflowGraph::snapshot)
                .toList();
    }

    public WorkflowSnapshot snapshot(long sequence) {
        return new WorkflowSnapshot(workflowId, sequence, snapshotGraphs());
    }
}
