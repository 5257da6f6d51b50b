package com.flow.sync.service.exception;

import java.util.Map;

/**
 * Thrown when the authorization gate rejects a mutation.
 */
public class MutationForbiddenException extends SyncException {

    public static final String CODE = "FORBIDDEN";

    public MutationForbiddenException(String tenantId, String workflowId, String action) {
        super("Tenant " + tenantId + " may not " + action + " on workflow " + workflowId,
                workflowId, CODE, Map.of("tenantId", tenantId, "action", action));
    }

    private MutationForbiddenException(String message, String workflowId, Map<String, Object> details) {
        super(message, workflowId, CODE, details);
    }

    public static MutationForbiddenException missingTenant(String workflowId, String headerName, String action) {
        return new MutationForbiddenException("Header " + headerName + " is required to " + action
                + " on workflow " + workflowId, workflowId, Map.of("header", headerName, "action", action));
    }
}
