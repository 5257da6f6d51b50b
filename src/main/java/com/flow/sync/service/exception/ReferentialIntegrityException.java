package com.flow.sync.service.exception;

import java.util.List;
import java.util.Map;

/**
 * Thrown when a connection or group membership references a node that is
 * not in the graph.
 */
public class ReferentialIntegrityException extends SyncException {

    public static final String CODE = "REFERENTIAL_INTEGRITY";

    public ReferentialIntegrityException(String message, String entityId, Map<String, Object> details) {
        super(message, entityId, CODE, details);
    }

    public static ReferentialIntegrityException missingEndpoint(String connectionId, String role, String nodeId) {
        return new ReferentialIntegrityException(
                "Connection " + role + " node does not exist: " + nodeId,
                connectionId,
                Map.of("role", role, "nodeId", nodeId));
    }

    public static ReferentialIntegrityException missingMembers(String groupId, List<String> missingNodeIds) {
        return new ReferentialIntegrityException(
                "Group references nodes that do not exist: " + missingNodeIds,
                groupId,
                Map.of("missingNodeIds", List.copyOf(missingNodeIds)));
    }
}
