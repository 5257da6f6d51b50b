package com.flow.sync.service.webhook;

import com.flow.sync.service.change.ChangeRecord;
import com.flow.sync.service.config.MetricsConfig;
import com.flow.sync.service.config.WebhookConfig;
import com.flow.sync.service.engine.ChangeRecordListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Posts committed changes to the webhook targets subscribed to them.
 *
 * Delivery runs on its own executor and is best-effort: a receiver that
 * stays down after the configured retries loses the event, and events of
 * one workflow may arrive out of order. Receivers order and deduplicate by
 * {@code sequence}.
 */
@Slf4j
@Component
public class WebhookPublisher implements ChangeRecordListener {

    static final String WEBHOOK_ID_HEADER = "X-Flow-Webhook-Id";
    static final String DELIVERY_ID_HEADER = "X-Flow-Delivery-Id";

    private final WebhookTargetRegistry targetRegistry;
    private final RestClient restClient;
    private final Executor executor;
    private final WebhookConfig webhookConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public WebhookPublisher(WebhookTargetRegistry targetRegistry,
                            @Qualifier("webhookRestClient") RestClient restClient,
                            @Qualifier("webhookExecutor") Executor executor,
                            WebhookConfig webhookConfig,
                            MetricsConfig metricsConfig,
                            Clock clock) {
        this.targetRegistry = targetRegistry;
        this.restClient = restClient;
        this.executor = executor;
        this.webhookConfig = webhookConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        log.info("WebhookPublisher initialized, enabled: {}", webhookConfig.isEnabled());
    }

    @Override
    public void onChange(ChangeRecord record) {
        if (!webhookConfig.isEnabled()) return;

        var event = WebhookEvent.from(record);
        for (WebhookTarget target : targetRegistry.subscribedTo(event.type())) {
            submit(target, event);
        }
    }

    // ==================== Delivery ====================

    private void submit(WebhookTarget target, WebhookEvent event) {
        try {
            executor.execute(() -> deliver(target, event));
        } catch (RejectedExecutionException e) {
            metricsConfig.getWebhookFailures().increment();
            log.warn("Webhook executor rejected {} for {}, event dropped", event.id(), target.id());
        }
    }

    void deliver(WebhookTarget target, WebhookEvent event) {
        var delivery = new WebhookDelivery(target.id(), List.of(event),
                new WebhookDelivery.Metadata("del_" + UUID.randomUUID(), clock.instant()));

        int attempts = webhookConfig.getMaxRetries() + 1;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                post(target, delivery);
                metricsConfig.getWebhookDeliveries().increment();
                log.debug("Delivered {} {} to webhook {} on attempt {}", event.type(), event.id(), target.id(), attempt);
                return;
            } catch (RestClientException e) {
                log.warn("Webhook {} attempt {}/{} for {} failed: {}",
                        target.id(), attempt, attempts, event.id(), e.getMessage());
            }
            if (attempt < attempts && !backOff(attempt)) {
                break;
            }
        }

        metricsConfig.getWebhookFailures().increment();
        log.error("Dropped {} {} for webhook {} at {}", event.type(), event.id(), target.id(), target.url());
    }

    private void post(WebhookTarget target, WebhookDelivery delivery) {
        restClient.post()
                .uri(target.url())
                .contentType(MediaType.APPLICATION_JSON)
                .headers(headers -> {
                    headers.set(WEBHOOK_ID_HEADER, target.id());
                    headers.set(DELIVERY_ID_HEADER, delivery.metadata().deliveryId());
                    target.headers().forEach(headers::set);
                })
                .body(delivery)
                .retrieve()
                .toBodilessEntity();
    }

    private boolean backOff(int attempt) {
        long delay = webhookConfig.getRetryDelayMs() << (attempt - 1);
        if (delay <= 0) return true;
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ==================== Inner Types ====================

    /**
     * Request body of one delivery.
     */
    public record WebhookDelivery(String webhookId, List<WebhookEvent> events, Metadata metadata) {

        public record Metadata(String deliveryId, Instant timestamp) {
        }
    }
}
