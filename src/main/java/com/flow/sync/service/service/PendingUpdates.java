package com.flow.sync.service.service;

import com.flow.sync.service.change.ChangeRecord;

import java.util.List;

/**
 * Result of a catch-up poll.
 *
 * @param workflowId     the polled workflow
 * @param updates        retained changes after the caller's cursor, ascending
 * @param latestSequence highest sequence committed so far, the caller's next cursor
 *                       once {@code updates} are applied
 */
public record PendingUpdates(String workflowId, List<ChangeRecord> updates, long latestSequence) {

    public PendingUpdates {
        updates = List.copyOf(updates);
    }
}
