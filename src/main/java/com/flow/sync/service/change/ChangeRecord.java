package com.flow.sync.service.change;

import java.time.Instant;

/**
 * Immutable fact describing one committed change.
 *
 * @param workflowId the workflow the change belongs to
 * @param graphId    the graph the change applies to
 * @param sequence   per-workflow commit counter, the only ordering key
 * @param timestamp  commit wall-clock time, informational only
 * @param opType     kind of change
 * @param payload    data needed to replay the change
 */
public record ChangeRecord(
        String workflowId,
        String graphId,
        long sequence,
        Instant timestamp,
        ChangeType opType,
        ChangePayload payload
) {
}
