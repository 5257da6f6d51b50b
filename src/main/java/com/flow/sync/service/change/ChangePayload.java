package com.flow.sync.service.change;

import com.flow.sync.service.model.CanvasState;
import com.flow.sync.service.model.Connection;
import com.flow.sync.service.model.NodeGroup;
import com.flow.sync.service.model.Position;
import com.flow.sync.service.model.WorkflowNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sealed hierarchy of change payloads.
 *
 * Every payload carries enough state to replay the change onto a replica
 * of the graph without consulting the source document.
 */
public sealed interface ChangePayload permits
        ChangePayload.NodeAdded,
        ChangePayload.NodePropertiesUpdated,
        ChangePayload.NodeMoved,
        ChangePayload.NodeRemoved,
        ChangePayload.ConnectionAdded,
        ChangePayload.ConnectionRemoved,
        ChangePayload.GroupCreated,
        ChangePayload.GroupUpdated,
        ChangePayload.GroupRemoved,
        ChangePayload.GraphCreated,
        ChangePayload.GraphRemoved,
        ChangePayload.CanvasUpdated {

    /**
     * Gets the change type this payload describes.
     */
    ChangeType type();

    record NodeAdded(WorkflowNode node) implements ChangePayload {
        @Override
        public ChangeType type() {
            return ChangeType.NODE_ADDED;
        }
    }

    /**
     * Property merge. {@code patch} is what the caller sent (null values
     * remove a key); {@code properties} is the merged result.
     */
    record NodePropertiesUpdated(
            String nodeId,
            Map<String, Object> patch,
            Map<String, Object> properties
    ) implements ChangePayload {

        public NodePropertiesUpdated {
            patch = Collections.unmodifiableMap(new LinkedHashMap<>(patch));
            properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        }

        @Override
        public ChangeType type() {
            return ChangeType.NODE_UPDATED;
        }
    }

    record NodeMoved(String nodeId, Position position) implements ChangePayload {
        @Override
        public ChangeType type() {
            return ChangeType.NODE_MOVED;
        }
    }

    /**
     * Node removal including its cascade.
     */
    record NodeRemoved(
            String nodeId,
            List<String> removedConnectionIds,
            List<String> prunedGroupIds
    ) implements ChangePayload {

        public NodeRemoved {
            removedConnectionIds = List.copyOf(removedConnectionIds);
            prunedGroupIds = List.copyOf(prunedGroupIds);
        }

        @Override
        public ChangeType type() {
            return ChangeType.NODE_REMOVED;
        }
    }

    record ConnectionAdded(Connection connection) implements ChangePayload {
        @Override
        public ChangeType type() {
            return ChangeType.CONNECTION_ADDED;
        }
    }

    record ConnectionRemoved(String connectionId) implements ChangePayload {
        @Override
        public ChangeType type() {
            return ChangeType.CONNECTION_REMOVED;
        }
    }

    record GroupCreated(NodeGroup group) implements ChangePayload {
        @Override
        public ChangeType type() {
            return ChangeType.GROUP_CREATED;
        }
    }

    /**
     * Group update carrying the resulting group.
     */
    record GroupUpdated(NodeGroup group) implements ChangePayload {
        @Override
        public ChangeType type() {
            return ChangeType.GROUP_UPDATED;
        }
    }

    record GroupRemoved(String groupId) implements ChangePayload {
        @Override
        public ChangeType type() {
            return ChangeType.GROUP_REMOVED;
        }
    }

    record GraphCreated(String graphId, String name) implements ChangePayload {
        @Override
        public ChangeType type() {
            return ChangeType.GRAPH_CREATED;
        }
    }

    record GraphRemoved(String graphId) implements ChangePayload {
        @Override
        public ChangeType type() {
            return ChangeType.GRAPH_REMOVED;
        }
    }

    record CanvasUpdated(CanvasState canvas) implements ChangePayload {
        @Override
        public ChangeType type() {
            return ChangeType.CANVAS_UPDATED;
        }
    }
}
