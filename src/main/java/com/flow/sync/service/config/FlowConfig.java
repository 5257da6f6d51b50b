package com.flow.sync.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overall application configuration for Flow Sync Service.
 *
 * Contains feature flags, the tenant header and Neo4j connection settings.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "flow")
public class FlowConfig {

    /**
     * Feature flags for optional capabilities.
     */
    private Features features = new Features();

    /**
     * Tenant configuration for multi-tenancy support.
     */
    private TenantConfig tenant = new TenantConfig();

    /**
     * Neo4j connection settings, used when Neo4j persistence is enabled.
     */
    private Neo4j neo4j = new Neo4j();

    @Getter
    @Setter
    public static class Features {

        /**
         * Store workflow checkpoints in Neo4j instead of memory.
         */
        private boolean neo4jPersistenceEnabled = false;

        /**
         * Push committed change records to live collaborators.
         */
        private boolean liveFanoutEnabled = true;
    }

    @Getter
    @Setter
    public static class TenantConfig {

        /**
         * Require the tenant header on every mutation instead of falling back
         * to the default tenant.
         */
        private boolean enabled = false;

        /**
         * Header name for tenant identification.
         */
        private String headerName = "X-Tenant-Id";

        /**
         * Default tenant ID when not specified.
         */
        private String defaultTenantId = "default";
    }

    @Getter
    @Setter
    public static class Neo4j {

        private String uri = "bolt://localhost:7687";

        private String username = "neo4j";

        private String password = "password";
    }
}
