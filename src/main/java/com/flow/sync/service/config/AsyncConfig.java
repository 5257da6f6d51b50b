package com.flow.sync.service.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor configuration for the synchronization actors.
 *
 * All workflow actors share one bounded platform thread pool. An actor
 * occupies a thread only while it drains its mailbox. Webhook deliveries
 * run on a separate pool so slow receivers never hold an actor thread.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final SyncConfig syncConfig;
    private final WebhookConfig webhookConfig;

    // ==================== Executor Beans ====================

    /**
     * Executor that drains actor mailboxes.
     */
    @Bean(name = "actorExecutor")
    public ThreadPoolTaskExecutor actorExecutor() {
        var settings = syncConfig.getExecutor();
        log.info("Initializing actor executor: core={}, max={}, queue={}",
                settings.getCorePoolSize(), settings.getMaxPoolSize(), settings.getQueueCapacity());
        return createPlatformThreadPool("actor-",
                settings.getCorePoolSize(),
                settings.getMaxPoolSize(),
                settings.getQueueCapacity());
    }

    /**
     * Executor that delivers webhook events off the actor threads.
     */
    @Bean(name = "webhookExecutor")
    public ThreadPoolTaskExecutor webhookExecutor() {
        var settings = webhookConfig.getExecutor();
        log.info("Initializing webhook executor: core={}, max={}, queue={}",
                settings.getCorePoolSize(), settings.getMaxPoolSize(), settings.getQueueCapacity());
        return createPlatformThreadPool("webhook-",
                settings.getCorePoolSize(),
                settings.getMaxPoolSize(),
                settings.getQueueCapacity());
    }

    // ==================== Helper Methods ====================

    private ThreadPoolTaskExecutor createPlatformThreadPool(String prefix, int coreSize,
                                                             int maxSize, int queueCapacity) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
