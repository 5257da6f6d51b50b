package com.flow.sync.service.exception;

import java.util.Map;

/**
 * Thrown when a workflow's actor cannot be started, typically because its
 * checkpoint could not be loaded. Other workflows are unaffected.
 */
public class WorkflowUnavailableException extends SyncException {

    public static final String CODE = "WORKFLOW_UNAVAILABLE";

    public WorkflowUnavailableException(String workflowId, String reason, Throwable cause) {
        super("Workflow " + workflowId + " is unavailable: " + reason,
                workflowId, CODE, Map.of("reason", reason), cause);
    }
}
