package com.flow.sync.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the synchronization actors.
 *
 * Controls mailbox bounds, the shared actor thread pool, caller timeouts,
 * checkpoint flushing, and template validation.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "flow.sync")
public class SyncConfig {

    /**
     * Per-workflow actor settings.
     */
    private Actor actor = new Actor();

    /**
     * Shared executor that drains actor mailboxes.
     */
    private Executor executor = new Executor();

    /**
     * Caller-side timeouts.
     */
    private Timeout timeout = new Timeout();

    /**
     * Checkpoint flushing settings.
     */
    private Persistence persistence = new Persistence();

    /**
     * Template existence check settings.
     */
    private Templates templates = new Templates();

    @Getter
    @Setter
    public static class Actor {

        /**
         * Maximum number of queued requests per workflow.
         */
        private int mailboxCapacity = 1000;

        /**
         * Tasks processed per drain pass before the executor thread is yielded.
         */
        private int drainBatchSize = 64;

        /**
         * Mailbox utilization percentage at which health reports DOWN.
         */
        private int backpressureThreshold = 80;
    }

    @Getter
    @Setter
    public static class Executor {

        private int corePoolSize = 4;

        private int maxPoolSize = 16;

        private int queueCapacity = 10000;
    }

    @Getter
    @Setter
    public static class Timeout {

        /**
         * How long a caller waits for its mutation to commit.
         */
        private long mutationMs = 5000;

        /**
         * How long a caller waits for a cold-start load.
         */
        private long loadMs = 10000;
    }

    @Getter
    @Setter
    public static class Persistence {

        /**
         * Interval between checkpoints of dirty workflows.
         */
        private long flushIntervalMs = 30000;
    }

    @Getter
    @Setter
    public static class Templates {

        /**
         * When false every template ID is accepted.
         */
        private boolean validationEnabled = true;

        /**
         * Template IDs known at startup.
         */
        private List<String> knownIds = new ArrayList<>();
    }
}
