package com.flow.sync.service.model;

import java.util.List;

/**
 * Immutable copy of one graph, used for reads and checkpoints.
 */
public record GraphSnapshot(
        String graphId,
        String name,
        boolean main,
        List<WorkflowNode> nodes,
        List<Connection> connections,
        List<NodeGroup> groups,
        CanvasState canvas
) {

    public GraphSnapshot {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        connections = connections == null ? List.of() : List.copyOf(connections);
        groups = groups == null ? List.of() : List.copyOf(groups);
        canvas = canvas == null ? CanvasState.DEFAULT : canvas;
    }
}
