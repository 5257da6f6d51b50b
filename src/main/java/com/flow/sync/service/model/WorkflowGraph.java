package com.flow.sync.service.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable graph owned by a single workflow actor.
 *
 * Not thread-safe. Only the owning actor reads or writes it; everything that
 * leaves the actor is copied through {@link #snapshot()}.
 */
public final class WorkflowGraph {

    private final String graphId;
    private final String name;
    private final boolean main;
    private final Map<String, WorkflowNode> nodes = new LinkedHashMap<>();
    private final Map<String, Connection> connections = new LinkedHashMap<>();
    private final Map<String, NodeGroup> groups = new LinkedHashMap<>();
    private CanvasState canvas = CanvasState.DEFAULT;

    public WorkflowGraph(String graphId, String name, boolean main) {
        this.graphId = graphId;
        this.name = name;
        this.main = main;
    }

    public static WorkflowGraph fromSnapshot(GraphSnapshot snapshot) {
        var graph = new WorkflowGraph(snapshot.graphId(), snapshot.name(), snapshot.main());
        snapshot.nodes().forEach(graph::putNode);
        snapshot.connections().forEach(graph::putConnection);
        snapshot.groups().forEach(graph::putGroup);
        graph.setCanvas(snapshot.canvas());
        return graph;
    }

    public String getGraphId() {
        return graphId;
    }

    public String getName() {
        return name;
    }

    public boolean isMain() {
        return main;
    }

    // ==================== Nodes ====================

    public Optional<WorkflowNode> findNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean hasNode(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public void putNode(WorkflowNode node) {
        nodes.put(node.id(), node);
    }

    public WorkflowNode removeNode(String nodeId) {
        return nodes.remove(nodeId);
    }

    public Collection<WorkflowNode> getNodes() {
        return nodes.values();
    }

    // ==================== Connections ====================

    public Optional<Connection> findConnection(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public boolean hasConnection(String connectionId) {
        return connections.containsKey(connectionId);
    }

    public void putConnection(Connection connection) {
        connections.put(connection.id(), connection);
    }

    public Connection removeConnection(String connectionId) {
        return connections.remove(connectionId);
    }

    public Optional<Connection> findIncoming(Endpoint target) {
        return connections.values().stream()
                .filter(connection -> connection.target().equals(target))
                .findFirst();
    }

    public List<Connection> connectionsTouching(String nodeId) {
        return connections.values().stream()
                .filter(connection -> connection.touches(nodeId))
                .toList();
    }

    public Collection<Connection> getConnections() {
        return connections.values();
    }

    // ==================== Groups ====================

    public Optional<NodeGroup> findGroup(String groupId) {
        return Optional.ofNullable(groups.get(groupId));
    }

    public boolean hasGroup(String groupId) {
        return groups.containsKey(groupId);
    }

    public void putGroup(NodeGroup group) {
        groups.put(group.id(), group);
    }

    public NodeGroup removeGroup(String groupId) {
        return groups.remove(groupId);
    }

    public List<NodeGroup> groupsContaining(String nodeId) {
        return groups.values().stream()
                .filter(group -> group.contains(nodeId))
                .toList();
    }

    public Collection<NodeGroup> getGroups() {
        return groups.values();
    }

    // ==================== View State ====================

    public CanvasState getCanvas() {
        return canvas;
    }

    public void setCanvas(CanvasState canvas) {
        this.canvas = canvas;
    }

    public GraphSnapshot snapshot() {
        return new GraphSnapshot(
                graphId,
                name,
                main,
                new ArrayList<>(nodes.values()),
                new ArrayList<>(connections.values()),
                new ArrayList<>(groups.values()),
                canvas
        );
    }
}
