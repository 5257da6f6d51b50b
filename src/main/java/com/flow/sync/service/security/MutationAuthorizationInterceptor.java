package com.flow.sync.service.security;

import com.flow.sync.service.config.FlowConfig;
import com.flow.sync.service.exception.MutationForbiddenException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;
import java.util.Set;

/**
 * Consults the {@link MutationAuthorizer} before any mutating request on a
 * workflow reaches a controller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MutationAuthorizationInterceptor implements HandlerInterceptor {

    private static final Set<String> READ_METHODS = Set.of("GET", "HEAD", "OPTIONS");

    private final MutationAuthorizer authorizer;
    private final FlowConfig flowConfig;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (READ_METHODS.contains(request.getMethod())) return true;

        var workflowId = resolveWorkflowId(request);
        if (workflowId == null) return true;

        var action = request.getMethod() + " " + resolvePattern(request);
        var tenantId = resolveTenantId(request, workflowId, action);
        if (!authorizer.isAllowed(tenantId, workflowId, action)) {
            log.warn("Mutation denied: tenant={}, workflow={}, action={}", tenantId, workflowId, action);
            throw new MutationForbiddenException(tenantId, workflowId, action);
        }
        return true;
    }

    private String resolveWorkflowId(HttpServletRequest request) {
        var variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (variables instanceof Map<?, ?> map) {
            var workflowId = map.get("workflowId");
            return workflowId == null ? null : workflowId.toString();
        }
        return null;
    }

    private String resolveTenantId(HttpServletRequest request, String workflowId, String action) {
        var tenant = flowConfig.getTenant();
        var header = request.getHeader(tenant.getHeaderName());
        if (header != null && !header.isBlank()) return header;

        if (tenant.isEnabled()) {
            log.warn("Mutation without {} header: workflow={}, action={}", tenant.getHeaderName(), workflowId, action);
            throw MutationForbiddenException.missingTenant(workflowId, tenant.getHeaderName(), action);
        }
        return tenant.getDefaultTenantId();
    }

    private String resolvePattern(HttpServletRequest request) {
        var pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern != null ? pattern.toString() : request.getRequestURI();
    }
}
