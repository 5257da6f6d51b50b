package com.flow.sync.service.webhook;

import com.flow.sync.service.change.ChangePayload;
import com.flow.sync.service.change.ChangeRecord;
import com.flow.sync.service.change.ChangeType;

import java.time.Instant;

/**
 * Webhook view of one committed change.
 *
 * The id is derived from workflow and sequence, so receivers can drop
 * redelivered events.
 */
public record WebhookEvent(
        String id,
        String type,
        String workflowId,
        String graphId,
        long sequence,
        Instant timestamp,
        ChangePayload data
) {

    public static WebhookEvent from(ChangeRecord record) {
        return new WebhookEvent(
                record.workflowId() + ":" + record.sequence(),
                eventType(record.opType()),
                record.workflowId(),
                record.graphId(),
                record.sequence(),
                record.timestamp(),
                record.payload());
    }

    /**
     * Maps a change type to its dotted event name, {@code node-added} to {@code node.added}.
     */
    public static String eventType(ChangeType type) {
        return type.getWireName().replace('-', '.');
    }
}
