package com.flow.sync.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for Flow Sync Service.
 *
 * Provides custom metrics for mutations, change delivery, actor residency,
 * checkpointing and webhooks.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter mutationsCommitted;
    private final Counter mutationsRejected;
    private final Counter changesAppended;
    private final Counter changesDropped;
    private final Counter logAppendFailures;
    private final Counter fanoutFailures;
    private final Counter actorsLoaded;
    private final Counter actorLoadFailures;
    private final Counter actorsEvicted;
    private final Counter persistenceFailures;
    private final Counter webhookDeliveries;
    private final Counter webhookFailures;

    // Timers
    private final Timer mutationTimer;
    private final Timer persistenceTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        // Initialize counters
        this.mutationsCommitted = Counter.builder("flow.sync.mutations.committed")
                .description("Number of mutations committed")
                .register(registry);

        this.mutationsRejected = Counter.builder("flow.sync.mutations.rejected")
                .description("Number of mutations rejected with a typed error")
                .register(registry);

        this.changesAppended = Counter.builder("flow.sync.changes.appended")
                .description("Number of change records appended to the pending update log")
                .register(registry);

        this.changesDropped = Counter.builder("flow.sync.changes.dropped")
                .description("Number of change records dropped by retention")
                .register(registry);

        this.logAppendFailures = Counter.builder("flow.sync.changes.append.failures")
                .description("Number of change records the pending update log failed to append")
                .register(registry);

        this.fanoutFailures = Counter.builder("flow.sync.fanout.failures")
                .description("Number of failed live deliveries")
                .register(registry);

        this.actorsLoaded = Counter.builder("flow.sync.actors.loaded")
                .description("Number of workflow actors loaded")
                .register(registry);

        this.actorLoadFailures = Counter.builder("flow.sync.actors.load.failures")
                .description("Number of workflow actors that failed to load")
                .register(registry);

        this.actorsEvicted = Counter.builder("flow.sync.actors.evicted")
                .description("Number of idle workflow actors evicted")
                .register(registry);

        this.persistenceFailures = Counter.builder("flow.sync.persistence.failures")
                .description("Number of failed checkpoint saves")
                .register(registry);

        this.webhookDeliveries = Counter.builder("flow.sync.webhooks.delivered")
                .description("Number of webhook events accepted by their target")
                .register(registry);

        this.webhookFailures = Counter.builder("flow.sync.webhooks.failures")
                .description("Number of webhook events dropped after exhausting retries")
                .register(registry);

        // Initialize timers
        this.mutationTimer = Timer.builder("flow.sync.mutation.duration")
                .description("Time from submission to commit of a mutation")
                .register(registry);

        this.persistenceTimer = Timer.builder("flow.sync.persistence.duration")
                .description("Time taken to save a workflow checkpoint")
                .register(registry);
    }

    /**
     * Registers a gauge for store size monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerStoreGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
