package com.flow.sync.service.engine;

import com.flow.sync.service.change.ChangePayload;
import com.flow.sync.service.change.PendingChange;
import com.flow.sync.service.exception.EntityNotFoundException;
import com.flow.sync.service.exception.MutationConflictException;
import com.flow.sync.service.exception.MutationValidationException;
import com.flow.sync.service.exception.ReferentialIntegrityException;
import com.flow.sync.service.exception.ValidationError;
import com.flow.sync.service.model.CanvasState;
import com.flow.sync.service.model.Connection;
import com.flow.sync.service.model.Endpoint;
import com.flow.sync.service.model.GraphSnapshot;
import com.flow.sync.service.model.NodeGroup;
import com.flow.sync.service.model.Port;
import com.flow.sync.service.model.PortDirection;
import com.flow.sync.service.model.WorkflowDocument;
import com.flow.sync.service.model.WorkflowGraph;
import com.flow.sync.service.model.WorkflowNode;
import com.flow.sync.service.mutation.GraphMutation;
import com.flow.sync.service.mutation.GraphMutation.AddNode;
import com.flow.sync.service.mutation.GraphMutation.AddNodesBatch;
import com.flow.sync.service.mutation.GraphMutation.ConnectNodes;
import com.flow.sync.service.mutation.GraphMutation.CreateGraph;
import com.flow.sync.service.mutation.GraphMutation.CreateGroup;
import com.flow.sync.service.mutation.GraphMutation.RemoveConnection;
import com.flow.sync.service.mutation.GraphMutation.RemoveGraph;
import com.flow.sync.service.mutation.GraphMutation.RemoveGroup;
import com.flow.sync.service.mutation.GraphMutation.RemoveNode;
import com.flow.sync.service.mutation.GraphMutation.UpdateCanvas;
import com.flow.sync.service.mutation.GraphMutation.UpdateGroup;
import com.flow.sync.service.mutation.GraphMutation.UpdateNodePosition;
import com.flow.sync.service.mutation.GraphMutation.UpdateNodeProperties;
import com.flow.sync.service.mutation.GroupPatch;
import com.flow.sync.service.mutation.GroupSpec;
import com.flow.sync.service.mutation.NodeSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates and applies graph mutations to a workflow document.
 *
 * Every invariant is checked before the document is touched, so a mutation
 * either applies completely or throws and leaves the document unchanged.
 * Stateless; the calling actor guarantees exclusive access to the document.
 */
@Slf4j
@Component
public class MutationApplier implements GraphMutation.Handler {

    private static final String DEFAULT_NODE_TYPE = "custom";

    // ==================== Dispatch ====================

    /**
     * Applies a mutation to the document.
     *
     * @throws com.flow.sync.service.exception.SyncException if any invariant is violated
     */
    public <R> AppliedMutation<R> apply(WorkflowDocument document, GraphMutation<R> mutation) {
        log.debug("Applying {} to {}/{}", mutation.operationName(), document.getWorkflowId(), mutation.graphId());
        return mutation.applyWith(this, document);
    }

    // ==================== Nodes ====================

    @Override
    public AppliedMutation<WorkflowNode> addNode(WorkflowDocument document, AddNode mutation) {
        var graph = requireGraph(document, mutation.graphId());
        requirePresent(mutation.node(), "node", null);
        validateNewNode(graph, mutation.node(), Set.of());

        var node = toNode(mutation.node());
        graph.putNode(node);
        return AppliedMutation.of(node, change(graph, new ChangePayload.NodeAdded(node)));
    }

    @Override
    public AppliedMutation<List<WorkflowNode>> addNodesBatch(WorkflowDocument document, AddNodesBatch mutation) {
        var graph = requireGraph(document, mutation.graphId());
        if (mutation.nodes() == null || mutation.nodes().isEmpty()) {
            throw MutationValidationException.of(null, "nodes", "must contain at least one node");
        }

        var seenIds = new HashSet<String>();
        for (NodeSpec spec : mutation.nodes()) {
            requirePresent(spec, "nodes[]", null);
            validateNewNode(graph, spec, seenIds);
            seenIds.add(spec.id());
        }

        var nodes = new ArrayList<WorkflowNode>();
        var changes = new ArrayList<PendingChange>();
        for (NodeSpec spec : mutation.nodes()) {
            var node = toNode(spec);
            graph.putNode(node);
            nodes.add(node);
            changes.add(change(graph, new ChangePayload.NodeAdded(node)));
        }
        return new AppliedMutation<>(List.copyOf(nodes), changes);
    }

    @Override
    public AppliedMutation<WorkflowNode> removeNode(WorkflowDocument document, RemoveNode mutation) {
        var graph = requireGraph(document, mutation.graphId());
        var node = requireNode(graph, mutation.nodeId());

        var removedConnectionIds = graph.connectionsTouching(node.id()).stream()
                .map(Connection::id)
                .toList();
        var prunedGroups = graph.groupsContaining(node.id());

        removedConnectionIds.forEach(graph::removeConnection);
        prunedGroups.forEach(group -> graph.putGroup(group.withoutNode(node.id())));
        graph.removeNode(node.id());

        var prunedGroupIds = prunedGroups.stream().map(NodeGroup::id).toList();
        return AppliedMutation.of(node, change(graph,
                new ChangePayload.NodeRemoved(node.id(), removedConnectionIds, prunedGroupIds)));
    }

    @Override
    public AppliedMutation<WorkflowNode> updateNodeProperties(WorkflowDocument document,
                                                               UpdateNodeProperties mutation) {
        var graph = requireGraph(document, mutation.graphId());
        var node = requireNode(graph, mutation.nodeId());
        requirePresent(mutation.properties(), "properties", node.id());

        var merged = mergeProperties(node.properties(), mutation.properties());
        var updated = node.withProperties(merged);
        graph.putNode(updated);
        return AppliedMutation.of(updated, change(graph,
                new ChangePayload.NodePropertiesUpdated(node.id(), mutation.properties(), merged)));
    }

    @Override
    public AppliedMutation<WorkflowNode> updateNodePosition(WorkflowDocument document,
                                                             UpdateNodePosition mutation) {
        var graph = requireGraph(document, mutation.graphId());
        var node = requireNode(graph, mutation.nodeId());
        requirePresent(mutation.position(), "position", node.id());
        if (!mutation.position().isFinite()) {
            throw MutationValidationException.of(node.id(), "position", "coordinates must be finite numbers");
        }

        var updated = node.withPosition(mutation.position());
        graph.putNode(updated);
        return AppliedMutation.of(updated, change(graph,
                new ChangePayload.NodeMoved(node.id(), mutation.position())));
    }

    // ==================== Connections ====================

    @Override
    public AppliedMutation<Connection> connectNodes(WorkflowDocument document, ConnectNodes mutation) {
        var graph = requireGraph(document, mutation.graphId());
        validateEndpoints(mutation);

        var connectionId = mutation.connectionId();
        if (graph.hasConnection(connectionId)) {
            throw MutationConflictException.duplicateId("connection", connectionId);
        }

        var sourceNode = graph.findNode(mutation.source().nodeId())
                .orElseThrow(() -> ReferentialIntegrityException.missingEndpoint(
                        connectionId, "source", mutation.source().nodeId()));
        var targetNode = graph.findNode(mutation.target().nodeId())
                .orElseThrow(() -> ReferentialIntegrityException.missingEndpoint(
                        connectionId, "target", mutation.target().nodeId()));

        var sourcePort = requirePort(sourceNode, mutation.source().portId());
        var targetPort = requirePort(targetNode, mutation.target().portId());
        validateDirections(connectionId, sourcePort, targetPort);

        graph.findIncoming(mutation.target()).ifPresent(existing -> {
            throw MutationConflictException.inputPortOccupied(
                    targetNode.id(), targetPort.id(), existing.id());
        });

        var connection = new Connection(connectionId, mutation.source(), mutation.target());
        graph.putConnection(connection);
        return AppliedMutation.of(connection, change(graph, new ChangePayload.ConnectionAdded(connection)));
    }

    @Override
    public AppliedMutation<Connection> removeConnection(WorkflowDocument document, RemoveConnection mutation) {
        var graph = requireGraph(document, mutation.graphId());
        var connection = graph.findConnection(mutation.connectionId())
                .orElseThrow(() -> EntityNotFoundException.connection(graph.getGraphId(), mutation.connectionId()));

        graph.removeConnection(connection.id());
        return AppliedMutation.of(connection, change(graph, new ChangePayload.ConnectionRemoved(connection.id())));
    }

    // ==================== Groups ====================

    @Override
    public AppliedMutation<NodeGroup> createGroup(WorkflowDocument document, CreateGroup mutation) {
        var graph = requireGraph(document, mutation.graphId());
        var spec = mutation.group();
        requirePresent(spec, "group", null);

        var errors = new ArrayList<ValidationError>();
        requireText(spec.id(), "id", errors);
        requireText(spec.title(), "title", errors);
        validateMemberIds(spec.nodeIds(), errors);
        throwIfInvalid(spec.id(), errors);

        if (graph.hasGroup(spec.id())) {
            throw MutationConflictException.duplicateId("group", spec.id());
        }
        requireMembers(graph, spec.id(), spec.nodeIds());

        var group = toGroup(spec);
        graph.putGroup(group);
        return AppliedMutation.of(group, change(graph, new ChangePayload.GroupCreated(group)));
    }

    @Override
    public AppliedMutation<NodeGroup> updateGroup(WorkflowDocument document, UpdateGroup mutation) {
        var graph = requireGraph(document, mutation.graphId());
        var existing = graph.findGroup(mutation.groupId())
                .orElseThrow(() -> EntityNotFoundException.group(graph.getGraphId(), mutation.groupId()));
        var patch = mutation.patch();

        if (patch == null || patch.isEmpty()) {
            throw MutationValidationException.of(existing.id(), "patch", "at least one field must be provided");
        }
        var errors = new ArrayList<ValidationError>();
        if (patch.title() != null && patch.title().isBlank()) {
            errors.add(new ValidationError("title", "must not be blank"));
        }
        validateMemberIds(patch.nodeIds(), errors);
        throwIfInvalid(existing.id(), errors);
        requireMembers(graph, existing.id(), patch.nodeIds());

        var updated = mergeGroup(existing, patch);
        graph.putGroup(updated);
        return AppliedMutation.of(updated, change(graph, new ChangePayload.GroupUpdated(updated)));
    }

    @Override
    public AppliedMutation<NodeGroup> removeGroup(WorkflowDocument document, RemoveGroup mutation) {
        var graph = requireGraph(document, mutation.graphId());
        var group = graph.findGroup(mutation.groupId())
                .orElseThrow(() -> EntityNotFoundException.group(graph.getGraphId(), mutation.groupId()));

        graph.removeGroup(group.id());
        return AppliedMutation.of(group, change(graph, new ChangePayload.GroupRemoved(group.id())));
    }

    // ==================== Graphs ====================

    @Override
    public AppliedMutation<GraphSnapshot> createGraph(WorkflowDocument document, CreateGraph mutation) {
        if (isBlank(mutation.graphId())) {
            throw MutationValidationException.of(null, "graphId", "must not be blank");
        }
        if (document.hasGraph(mutation.graphId())) {
            throw MutationConflictException.duplicateId("graph", mutation.graphId());
        }

        var name = isBlank(mutation.name()) ? mutation.graphId() : mutation.name();
        var graph = new WorkflowGraph(mutation.graphId(), name, false);
        document.putGraph(graph);
        return AppliedMutation.of(graph.snapshot(), change(graph,
                new ChangePayload.GraphCreated(graph.getGraphId(), name)));
    }

    @Override
    public AppliedMutation<GraphSnapshot> removeGraph(WorkflowDocument document, RemoveGraph mutation) {
        var graph = requireGraph(document, mutation.graphId());
        if (graph.isMain()) {
            throw MutationValidationException.of(graph.getGraphId(), "graphId", "the main graph cannot be removed");
        }

        var snapshot = graph.snapshot();
        document.removeGraph(graph.getGraphId());
        return AppliedMutation.of(snapshot, change(graph, new ChangePayload.GraphRemoved(graph.getGraphId())));
    }

    @Override
    public AppliedMutation<CanvasState> updateCanvas(WorkflowDocument document, UpdateCanvas mutation) {
        var graph = requireGraph(document, mutation.graphId());
        requirePresent(mutation.canvas(), "canvas", graph.getGraphId());
        if (!mutation.canvas().isValid()) {
            throw MutationValidationException.of(graph.getGraphId(), "canvas",
                    "offsets must be finite and zoom must be positive");
        }

        graph.setCanvas(mutation.canvas());
        return AppliedMutation.of(mutation.canvas(), change(graph, new ChangePayload.CanvasUpdated(mutation.canvas())));
    }

    // ==================== Validation ====================

    private WorkflowGraph requireGraph(WorkflowDocument document, String graphId) {
        return document.findGraph(graphId)
                .orElseThrow(() -> EntityNotFoundException.graph(document.getWorkflowId(), graphId));
    }

    private WorkflowNode requireNode(WorkflowGraph graph, String nodeId) {
        if (isBlank(nodeId)) {
            throw MutationValidationException.of(null, "nodeId", "must not be blank");
        }
        return graph.findNode(nodeId)
                .orElseThrow(() -> EntityNotFoundException.node(graph.getGraphId(), nodeId));
    }

    private Port requirePort(WorkflowNode node, String portId) {
        return node.findPort(portId)
                .orElseThrow(() -> EntityNotFoundException.port(node.id(), portId));
    }

    private void validateNewNode(WorkflowGraph graph, NodeSpec spec, Set<String> batchIds) {
        var errors = new ArrayList<ValidationError>();
        requireText(spec.id(), "id", errors);
        requireText(spec.title(), "title", errors);
        if (spec.position() == null) {
            errors.add(new ValidationError("position", "is required"));
        } else if (!spec.position().isFinite()) {
            errors.add(new ValidationError("position", "coordinates must be finite numbers"));
        }
        validatePorts(spec.ports(), errors);
        throwIfInvalid(spec.id(), errors);

        if (graph.hasNode(spec.id()) || batchIds.contains(spec.id())) {
            throw MutationConflictException.duplicateId("node", spec.id());
        }
    }

    private void validatePorts(List<Port> ports, List<ValidationError> errors) {
        if (ports == null) return;

        var portIds = new HashSet<String>();
        for (Port port : ports) {
            if (port == null || isBlank(port.id())) {
                errors.add(new ValidationError("ports", "every port needs an id"));
            } else if (!portIds.add(port.id())) {
                errors.add(new ValidationError("ports", "duplicate port id: " + port.id()));
            } else if (port.direction() == null) {
                errors.add(new ValidationError("ports", "port " + port.id() + " needs a direction"));
            }
        }
    }

    private void validateEndpoints(ConnectNodes mutation) {
        var errors = new ArrayList<ValidationError>();
        requireText(mutation.connectionId(), "id", errors);
        validateEndpoint(mutation.source(), "source", errors);
        validateEndpoint(mutation.target(), "target", errors);
        throwIfInvalid(mutation.connectionId(), errors);
    }

    private void validateEndpoint(Endpoint endpoint, String role, List<ValidationError> errors) {
        if (endpoint == null) {
            errors.add(new ValidationError(role, "is required"));
            return;
        }
        requireText(endpoint.nodeId(), role + ".nodeId", errors);
        requireText(endpoint.portId(), role + ".portId", errors);
    }

    private void validateDirections(String connectionId, Port sourcePort, Port targetPort) {
        var errors = new ArrayList<ValidationError>();
        if (sourcePort.direction() != PortDirection.OUTPUT) {
            errors.add(new ValidationError("source.portId", "port " + sourcePort.id() + " is not an output port"));
        }
        if (targetPort.direction() != PortDirection.INPUT) {
            errors.add(new ValidationError("target.portId", "port " + targetPort.id() + " is not an input port"));
        }
        throwIfInvalid(connectionId, errors);
    }

    private void validateMemberIds(List<String> nodeIds, List<ValidationError> errors) {
        if (nodeIds == null) return;
        if (nodeIds.stream().anyMatch(this::isBlank)) {
            errors.add(new ValidationError("nodeIds", "must not contain blank ids"));
        }
    }

    private void requireMembers(WorkflowGraph graph, String groupId, List<String> nodeIds) {
        if (nodeIds == null) return;

        var missing = nodeIds.stream()
                .filter(nodeId -> !graph.hasNode(nodeId))
                .distinct()
                .toList();
        if (!missing.isEmpty()) {
            throw ReferentialIntegrityException.missingMembers(groupId, missing);
        }
    }

    private void requirePresent(Object value, String field, String entityId) {
        if (value == null) {
            throw MutationValidationException.of(entityId, field, "is required");
        }
    }

    private void requireText(String value, String field, List<ValidationError> errors) {
        if (isBlank(value)) {
            errors.add(new ValidationError(field, "must not be blank"));
        }
    }

    private void throwIfInvalid(String entityId, List<ValidationError> errors) {
        if (!errors.isEmpty()) {
            throw new MutationValidationException(entityId, errors);
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // ==================== Construction ====================

    private WorkflowNode toNode(NodeSpec spec) {
        return new WorkflowNode(
                spec.id(),
                spec.templateId(),
                resolveType(spec),
                spec.title(),
                spec.position(),
                mergeProperties(Map.of(), spec.properties() == null ? Map.of() : spec.properties()),
                spec.ports(),
                spec.metadata()
        );
    }

    private NodeGroup toGroup(GroupSpec spec) {
        return new NodeGroup(
                spec.id(),
                spec.title(),
                spec.description() == null ? "" : spec.description(),
                isBlank(spec.color()) ? NodeGroup.DEFAULT_COLOR : spec.color(),
                Boolean.TRUE.equals(spec.collapsed()),
                spec.nodeIds()
        );
    }

    private NodeGroup mergeGroup(NodeGroup existing, GroupPatch patch) {
        return new NodeGroup(
                existing.id(),
                patch.title() != null ? patch.title() : existing.title(),
                patch.description() != null ? patch.description() : existing.description(),
                patch.color() != null ? patch.color() : existing.color(),
                patch.collapsed() != null ? patch.collapsed() : existing.collapsed(),
                patch.nodeIds() != null ? patch.nodeIds() : existing.nodeIds()
        );
    }

    private Map<String, Object> mergeProperties(Map<String, Object> current, Map<String, Object> patch) {
        var merged = new LinkedHashMap<>(current);
        patch.forEach((key, value) -> {
            if (value == null) {
                merged.remove(key);
            } else {
                merged.put(key, value);
            }
        });
        return merged;
    }

    private String resolveType(NodeSpec spec) {
        if (!isBlank(spec.type())) return spec.type();
        return isBlank(spec.templateId()) ? DEFAULT_NODE_TYPE : spec.templateId();
    }

    private PendingChange change(WorkflowGraph graph, ChangePayload payload) {
        return new PendingChange(graph.getGraphId(), payload);
    }
}
