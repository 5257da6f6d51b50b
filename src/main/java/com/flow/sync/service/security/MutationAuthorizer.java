package com.flow.sync.service.security;

/**
 * Allow/deny gate consulted before a mutation is accepted.
 */
public interface MutationAuthorizer {

    /**
     * @param tenantId   the calling tenant
     * @param workflowId the workflow to be mutated
     * @param action     the request, as {@code METHOD /path/pattern}
     */
    boolean isAllowed(String tenantId, String workflowId, String action);
}
