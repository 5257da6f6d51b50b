package com.flow.sync.service.api.health;

import com.flow.sync.service.config.SyncConfig;
import com.flow.sync.service.engine.WorkflowActorRegistry;
import com.flow.sync.service.engine.WorkflowSyncActor;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for workflow actors.
 *
 * Reports resident actors and the fullest mailbox; DOWN once any mailbox
 * crosses the backpressure threshold.
 */
@Component
@RequiredArgsConstructor
public class WorkflowActorHealthIndicator implements HealthIndicator {

    private final WorkflowActorRegistry registry;
    private final SyncConfig config;

    @Override
    public Health health() {
        int threshold = config.getActor().getBackpressureThreshold();
        int deepest = 0;
        int maxUtilization = 0;
        String busiest = null;

        for (WorkflowSyncActor actor : registry.residentActors()) {
            int size = actor.mailboxSize();
            int utilization = actor.getMailboxCapacity() == 0
                    ? 0
                    : (int) ((size * 100L) / actor.getMailboxCapacity());
            if (utilization > maxUtilization || busiest == null) {
                maxUtilization = utilization;
                deepest = size;
                busiest = actor.getWorkflowId();
            }
        }

        Health.Builder builder = maxUtilization >= threshold
                ? Health.down()
                : Health.up();

        builder.withDetail("residentActors", registry.count())
                .withDetail("deepestMailbox", deepest)
                .withDetail("maxUtilizationPercent", maxUtilization)
                .withDetail("backpressureThreshold", threshold);
        if (busiest != null) {
            builder.withDetail("busiestWorkflow", busiest);
        }
        return builder.build();
    }
}
