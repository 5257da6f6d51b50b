package com.flow.sync.service.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI document of the REST surface. Live updates are described here
 * because STOMP topics do not appear in the generated paths.
 */
@Configuration
@RequiredArgsConstructor
public class OpenApiConfig {

    private final FlowConfig flowConfig;

    @Value("${spring.application.name:flow-sync-service}")
    private String applicationName;

    @Bean
    public OpenAPI flowSyncServiceOpenAPI() {
        var tenant = flowConfig.getTenant();
        return new OpenAPI()
                .info(new Info()
                        .title(applicationName)
                        .version("1.0.0")
                        .description("Authoritative workflow graph state for collaborative editing. "
                                + "Mutations are serialized per workflow and answer with their change records. "
                                + "Live editors subscribe to /topic/workflows/{workflowId} over STOMP at /ws; "
                                + "clients that fall behind poll /workflows/{workflowId}/updates. "
                                + "Mutations carry the " + tenant.getHeaderName() + " header"
                                + (tenant.isEnabled() ? "." : " or run as tenant '" + tenant.getDefaultTenantId() + "'.")))
                .tags(List.of(
                        new Tag().name("Workflow State").description("Snapshots, graphs and canvas state"),
                        new Tag().name("Webhooks").description("Outbound change events")));
    }
}
