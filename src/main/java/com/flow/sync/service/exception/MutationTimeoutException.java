package com.flow.sync.service.exception;

import java.util.Map;

/**
 * Thrown when a caller stops waiting for its request. The request may still
 * commit afterwards.
 */
public class MutationTimeoutException extends SyncException {

    public static final String CODE = "MUTATION_TIMEOUT";

    public MutationTimeoutException(String workflowId, long timeoutMs) {
        super("Timed out after " + timeoutMs + "ms waiting for workflow " + workflowId,
                workflowId, CODE, Map.of("timeoutMs", timeoutMs));
    }
}
