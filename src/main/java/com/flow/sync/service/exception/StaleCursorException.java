package com.flow.sync.service.exception;

import java.util.Map;

/**
 * Thrown when a polling cursor points before records that retention has
 * already dropped. The caller must resynchronize from a full state read.
 */
public class StaleCursorException extends SyncException {

    public static final String CODE = "CAPACITY_EXCEEDED";

    private final long sinceSequence;
    private final long droppedThroughSequence;

    public StaleCursorException(String workflowId, long sinceSequence, long droppedThroughSequence) {
        super("Pending updates after sequence " + sinceSequence + " are no longer retained",
                workflowId,
                CODE,
                Map.of("sinceSequence", sinceSequence,
                        "droppedThroughSequence", droppedThroughSequence,
                        "action", "RESYNC_FULL_STATE"));
        this.sinceSequence = sinceSequence;
        this.droppedThroughSequence = droppedThroughSequence;
    }

    public long getSinceSequence() {
        return sinceSequence;
    }

    public long getDroppedThroughSequence() {
        return droppedThroughSequence;
    }
}
