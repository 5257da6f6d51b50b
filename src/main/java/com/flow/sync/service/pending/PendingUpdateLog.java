package com.flow.sync.service.pending;

import com.flow.sync.service.change.ChangeRecord;

import java.util.List;

/**
 * Retained, queryable history of change records for polling clients.
 *
 * Implementations must be thread-safe. Appends for one workflow arrive from
 * that workflow's actor only, in sequence order.
 */
public interface PendingUpdateLog {

    /**
     * Appends a committed change record.
     */
    void append(ChangeRecord record);

    /**
     * Returns retained records with a sequence greater than {@code sinceSequence},
     * in ascending sequence order.
     *
     * @param sinceSequence the last sequence the caller has applied, or null for everything retained
     * @throws com.flow.sync.service.exception.StaleCursorException if retention dropped
     *         records the caller has not seen yet
     */
    List<ChangeRecord> query(String workflowId, Long sinceSequence);

    /**
     * Discards every retained record of the workflow.
     *
     * @return number of records discarded
     */
    int clear(String workflowId);

    /**
     * Gets the highest sequence ever appended for the workflow, or 0.
     */
    long lastSequence(String workflowId);

    /**
     * Forgets all state of a deleted workflow.
     */
    void deleteWorkflow(String workflowId);

    /**
     * Gets the number of records retained across all workflows.
     */
    int count();

    /**
     * Drops records older than the configured TTL.
     *
     * @return number of records dropped
     */
    int evictExpired();
}
