package com.flow.sync.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for outbound change webhooks.
 *
 * Targets listed here are registered at startup; more can be added at
 * runtime through the webhook endpoints.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "flow.webhooks")
public class WebhookConfig {

    /**
     * Publish committed changes to webhook targets.
     */
    private boolean enabled = false;

    /**
     * Connect and read timeout of a single delivery attempt.
     */
    private int timeoutMs = 10000;

    /**
     * Retries after the first failed attempt.
     */
    private int maxRetries = 3;

    /**
     * Delay before the first retry, doubled on each further retry.
     */
    private long retryDelayMs = 1000;

    /**
     * Delivery thread pool.
     */
    private Executor executor = new Executor();

    /**
     * Targets registered at startup.
     */
    private List<Target> targets = new ArrayList<>();

    @Getter
    @Setter
    public static class Executor {

        private int corePoolSize = 1;

        private int maxPoolSize = 4;

        private int queueCapacity = 1000;
    }

    @Getter
    @Setter
    public static class Target {

        private String id;

        private String url;

        /**
         * Event types to deliver; {@code *} for all, {@code node.*} for a family.
         */
        private List<String> events = new ArrayList<>(List.of("*"));

        /**
         * Extra request headers sent with every delivery.
         */
        private Map<String, String> headers = new LinkedHashMap<>();
    }
}
