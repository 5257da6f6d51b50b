package com.flow.sync.service.mutation;

import com.flow.sync.service.engine.AppliedMutation;
import com.flow.sync.service.model.CanvasState;
import com.flow.sync.service.model.Connection;
import com.flow.sync.service.model.Endpoint;
import com.flow.sync.service.model.GraphSnapshot;
import com.flow.sync.service.model.NodeGroup;
import com.flow.sync.service.model.Position;
import com.flow.sync.service.model.WorkflowDocument;
import com.flow.sync.service.model.WorkflowNode;

import java.util.List;
import java.util.Map;

/**
 * Sealed interface for graph mutations.
 *
 * Each mutation names the graph it targets and the type of entity it
 * returns once committed.
 *
 * @param <R> the committed entity type
 */
public sealed interface GraphMutation<R> permits
        GraphMutation.AddNode,
        GraphMutation.AddNodesBatch,
        GraphMutation.RemoveNode,
        GraphMutation.ConnectNodes,
        GraphMutation.RemoveConnection,
        GraphMutation.UpdateNodeProperties,
        GraphMutation.UpdateNodePosition,
        GraphMutation.CreateGroup,
        GraphMutation.UpdateGroup,
        GraphMutation.RemoveGroup,
        GraphMutation.CreateGraph,
        GraphMutation.RemoveGraph,
        GraphMutation.UpdateCanvas {

    /**
     * Gets the graph this mutation targets.
     */
    String graphId();

    /**
     * Gets a short operation name used in logs and authorization.
     */
    default String operationName() {
        return getClass().getSimpleName();
    }

    /**
     * Applies this mutation through the handler method for its type.
     */
    AppliedMutation<R> applyWith(Handler handler, WorkflowDocument document);

    /**
     * Typed application of each mutation kind.
     */
    interface Handler {

        AppliedMutation<WorkflowNode> addNode(WorkflowDocument document, AddNode mutation);

        AppliedMutation<List<WorkflowNode>> addNodesBatch(WorkflowDocument document, AddNodesBatch mutation);

        AppliedMutation<WorkflowNode> removeNode(WorkflowDocument document, RemoveNode mutation);

        AppliedMutation<WorkflowNode> updateNodeProperties(WorkflowDocument document, UpdateNodeProperties mutation);

        AppliedMutation<WorkflowNode> updateNodePosition(WorkflowDocument document, UpdateNodePosition mutation);

        AppliedMutation<Connection> connectNodes(WorkflowDocument document, ConnectNodes mutation);

        AppliedMutation<Connection> removeConnection(WorkflowDocument document, RemoveConnection mutation);

        AppliedMutation<NodeGroup> createGroup(WorkflowDocument document, CreateGroup mutation);

        AppliedMutation<NodeGroup> updateGroup(WorkflowDocument document, UpdateGroup mutation);

        AppliedMutation<NodeGroup> removeGroup(WorkflowDocument document, RemoveGroup mutation);

        AppliedMutation<GraphSnapshot> createGraph(WorkflowDocument document, CreateGraph mutation);

        AppliedMutation<GraphSnapshot> removeGraph(WorkflowDocument document, RemoveGraph mutation);

        AppliedMutation<CanvasState> updateCanvas(WorkflowDocument document, UpdateCanvas mutation);
    }

    record AddNode(String graphId, NodeSpec node) implements GraphMutation<WorkflowNode> {
        @Override
        public AppliedMutation<WorkflowNode> applyWith(Handler handler, WorkflowDocument document) {
            return handler.addNode(document, this);
        }
    }

    record AddNodesBatch(String graphId, List<NodeSpec> nodes) implements GraphMutation<List<WorkflowNode>> {
        @Override
        public AppliedMutation<List<WorkflowNode>> applyWith(Handler handler, WorkflowDocument document) {
            return handler.addNodesBatch(document, this);
        }
    }

    record RemoveNode(String graphId, String nodeId) implements GraphMutation<WorkflowNode> {
        @Override
        public AppliedMutation<WorkflowNode> applyWith(Handler handler, WorkflowDocument document) {
            return handler.removeNode(document, this);
        }
    }

    record ConnectNodes(String graphId, String connectionId, Endpoint source, Endpoint target)
            implements GraphMutation<Connection> {
        @Override
        public AppliedMutation<Connection> applyWith(Handler handler, WorkflowDocument document) {
            return handler.connectNodes(document, this);
        }
    }

    record RemoveConnection(String graphId, String connectionId) implements GraphMutation<Connection> {
        @Override
        public AppliedMutation<Connection> applyWith(Handler handler, WorkflowDocument document) {
            return handler.removeConnection(document, this);
        }
    }

    /**
     * Merge of the given keys into the node's properties. A null value removes the key.
     */
    record UpdateNodeProperties(String graphId, String nodeId, Map<String, Object> properties)
            implements GraphMutation<WorkflowNode> {
        @Override
        public AppliedMutation<WorkflowNode> applyWith(Handler handler, WorkflowDocument document) {
            return handler.updateNodeProperties(document, this);
        }
    }

    record UpdateNodePosition(String graphId, String nodeId, Position position)
            implements GraphMutation<WorkflowNode> {
        @Override
        public AppliedMutation<WorkflowNode> applyWith(Handler handler, WorkflowDocument document) {
            return handler.updateNodePosition(document, this);
        }
    }

    record CreateGroup(String graphId, GroupSpec group) implements GraphMutation<NodeGroup> {
        @Override
        public AppliedMutation<NodeGroup> applyWith(Handler handler, WorkflowDocument document) {
            return handler.createGroup(document, this);
        }
    }

    record UpdateGroup(String graphId, String groupId, GroupPatch patch) implements GraphMutation<NodeGroup> {
        @Override
        public AppliedMutation<NodeGroup> applyWith(Handler handler, WorkflowDocument document) {
            return handler.updateGroup(document, this);
        }
    }

    record RemoveGroup(String graphId, String groupId) implements GraphMutation<NodeGroup> {
        @Override
        public AppliedMutation<NodeGroup> applyWith(Handler handler, WorkflowDocument document) {
            return handler.removeGroup(document, this);
        }
    }

    record CreateGraph(String graphId, String name) implements GraphMutation<GraphSnapshot> {
        @Override
        public AppliedMutation<GraphSnapshot> applyWith(Handler handler, WorkflowDocument document) {
            return handler.createGraph(document, this);
        }
    }

    record RemoveGraph(String graphId) implements GraphMutation<GraphSnapshot> {
        @Override
        public AppliedMutation<GraphSnapshot> applyWith(Handler handler, WorkflowDocument document) {
            return handler.removeGraph(document, this);
        }
    }

    record UpdateCanvas(String graphId, CanvasState canvas) implements GraphMutation<CanvasState> {
        @Override
        public AppliedMutation<CanvasState> applyWith(Handler handler, WorkflowDocument document) {
            return handler.updateCanvas(document, this);
        }
    }
}
