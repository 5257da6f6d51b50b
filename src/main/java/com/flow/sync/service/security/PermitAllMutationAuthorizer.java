package com.flow.sync.service.security;

import org.springframework.stereotype.Component;

/**
 * Default gate for deployments where an upstream gateway already
 * authenticates and isolates tenants.
 */
@Component
public class PermitAllMutationAuthorizer implements MutationAuthorizer {

    @Override
    public boolean isAllowed(String tenantId, String workflowId, String action) {
        return true;
    }
}
