package com.flow.sync.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for data retention and eviction.
 *
 * Controls the pending-update log bounds and the idle eviction of actors.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "flow.retention")
public class RetentionConfig {

    /**
     * Pending update log retention settings.
     */
    private PendingUpdatesRetention pendingUpdates = new PendingUpdatesRetention();

    /**
     * Actor residency settings.
     */
    private ActorRetention actor = new ActorRetention();

    @Getter
    @Setter
    public static class PendingUpdatesRetention {

        /**
         * Maximum number of change records retained per workflow.
         */
        private int maxCount = 1000;

        /**
         * TTL for change records in minutes (0 = no age eviction).
         */
        private long ttlMinutes = 10;

        /**
         * Eviction check interval in milliseconds.
         */
        private long evictionIntervalMs = 60000; // 1 minute
    }

    @Getter
    @Setter
    public static class ActorRetention {

        /**
         * Idle time in minutes after which an actor is checkpointed and evicted.
         */
        private long idleTtlMinutes = 30;

        /**
         * Eviction check interval in milliseconds.
         */
        private long evictionIntervalMs = 60000; // 1 minute
    }
}
