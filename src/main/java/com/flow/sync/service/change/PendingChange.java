package com.flow.sync.service.change;

import java.time.Instant;

/**
 * A change produced by the mutation applier, before the actor assigns it a sequence.
 */
public record PendingChange(String graphId, ChangePayload payload) {

    public ChangeRecord commit(String workflowId, long sequence, Instant timestamp) {
        return new ChangeRecord(workflowId, graphId, sequence, timestamp, payload.type(), payload);
    }
}
