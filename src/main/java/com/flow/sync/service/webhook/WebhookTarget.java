package com.flow.sync.service.webhook;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Receiver of webhook events.
 *
 * @param id           target identifier, sent as {@code X-Flow-Webhook-Id}
 * @param url          endpoint the events are posted to
 * @param events       subscribed event types; {@code *} matches all, {@code node.*} a family
 * @param headers      extra request headers
 * @param registeredAt registration time
 */
public record WebhookTarget(
        String id,
        String url,
        List<String> events,
        Map<String, String> headers,
        Instant registeredAt
) {

    public static final String ALL_EVENTS = "*";

    public WebhookTarget {
        events = events == null || events.isEmpty() ? List.of(ALL_EVENTS) : List.copyOf(events);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public boolean accepts(String eventType) {
        for (String pattern : events) {
            if (ALL_EVENTS.equals(pattern) || pattern.equals(eventType)) {
                return true;
            }
            if (pattern.endsWith(".*") && eventType.startsWith(pattern.substring(0, pattern.length() - 1))) {
                return true;
            }
        }
        return false;
    }
}
