package com.flow.sync.service.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a referenced graph, node, port, connection or group does not exist.
 */
public class EntityNotFoundException extends SyncException {

    public static final String CODE = "NOT_FOUND";

    private final String entityType;

    public EntityNotFoundException(String entityType, String entityId, Map<String, Object> context) {
        super(capitalize(entityType) + " not found: " + entityId, entityId, CODE, details(entityType, entityId, context));
        this.entityType = entityType;
    }

    public static EntityNotFoundException graph(String workflowId, String graphId) {
        return new EntityNotFoundException("graph", graphId, Map.of("workflowId", workflowId));
    }

    public static EntityNotFoundException node(String graphId, String nodeId) {
        return new EntityNotFoundException("node", nodeId, Map.of("graphId", graphId));
    }

    public static EntityNotFoundException port(String nodeId, String portId) {
        return new EntityNotFoundException("port", portId, Map.of("nodeId", nodeId));
    }

    public static EntityNotFoundException connection(String graphId, String connectionId) {
        return new EntityNotFoundException("connection", connectionId, Map.of("graphId", graphId));
    }

    public static EntityNotFoundException group(String graphId, String groupId) {
        return new EntityNotFoundException("group", groupId, Map.of("graphId", graphId));
    }

    public String getEntityType() {
        return entityType;
    }

    private static Map<String, Object> details(String entityType, String entityId, Map<String, Object> context) {
        var details = new LinkedHashMap<String, Object>();
        details.put("entityType", entityType);
        details.put("entityId", entityId);
        details.putAll(context);
        return details;
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
