package com.flow.sync.service.webhook;

import com.flow.sync.service.config.WebhookConfig;
import com.flow.sync.service.exception.EntityNotFoundException;
import com.flow.sync.service.exception.MutationValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered webhook targets, seeded from configuration.
 *
 * Registrations made at runtime live in memory and are lost on restart.
 */
@Slf4j
@Component
public class WebhookTargetRegistry {

    private final Map<String, WebhookTarget> targets = new ConcurrentHashMap<>();
    private final Clock clock;

    public WebhookTargetRegistry(WebhookConfig webhookConfig, Clock clock) {
        this.clock = clock;
        for (WebhookConfig.Target target : webhookConfig.getTargets()) {
            register(target.getId(), target.getUrl(), target.getEvents(), target.getHeaders());
        }
        log.info("WebhookTargetRegistry initialized with {} configured targets", targets.size());
    }

    /**
     * Registers or replaces a target. A blank id gets a generated one.
     *
     * @throws MutationValidationException if the url is not an http(s) url
     */
    public WebhookTarget register(String id, String url, List<String> events, Map<String, String> headers) {
        if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
            throw MutationValidationException.of(id, "url", "must be an http or https url");
        }
        String targetId = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
        var target = new WebhookTarget(targetId, url, events, headers, clock.instant());

        targets.put(targetId, target);
        log.info("Registered webhook {} -> {} for events {}", targetId, url, target.events());
        return target;
    }

    /**
     * @throws EntityNotFoundException if no target has the id
     */
    public WebhookTarget unregister(String id) {
        var removed = targets.remove(id);
        if (removed == null) {
            throw new EntityNotFoundException("webhook", id, Map.of());
        }
        log.info("Unregistered webhook {}", id);
        return removed;
    }

    public List<WebhookTarget> list() {
        return targets.values().stream()
                .sorted(Comparator.comparing(WebhookTarget::registeredAt).thenComparing(WebhookTarget::id))
                .toList();
    }

    public List<WebhookTarget> subscribedTo(String eventType) {
        return list().stream()
                .filter(target -> target.accepts(eventType))
                .toList();
    }
}
