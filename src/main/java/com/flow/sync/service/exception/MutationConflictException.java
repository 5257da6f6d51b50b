package com.flow.sync.service.exception;

import java.util.Map;

/**
 * Thrown when a mutation collides with existing state, such as an input port
 * that already has an incoming connection or an ID that is already taken.
 */
public class MutationConflictException extends SyncException {

    public static final String CODE = "CONFLICT";
    public static final String DUPLICATE_ID = "DUPLICATE_ID";

    public MutationConflictException(String message, String entityId, String errorCode, Map<String, Object> details) {
        super(message, entityId, errorCode, details);
    }

    public static MutationConflictException duplicateId(String entityType, String entityId) {
        return new MutationConflictException(
                capitalize(entityType) + " already exists: " + entityId,
                entityId,
                DUPLICATE_ID,
                Map.of("entityType", entityType, "entityId", entityId));
    }

    public static MutationConflictException inputPortOccupied(String nodeId, String portId, String existingConnectionId) {
        return new MutationConflictException(
                "Input port " + nodeId + "." + portId + " already has an incoming connection",
                nodeId,
                CODE,
                Map.of("nodeId", nodeId, "portId", portId, "existingConnectionId", existingConnectionId));
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
