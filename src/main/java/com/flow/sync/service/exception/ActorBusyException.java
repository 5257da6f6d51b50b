package com.flow.sync.service.exception;

import java.util.Map;

/**
 * Thrown when a workflow's mailbox is full.
 */
public class ActorBusyException extends SyncException {

    public static final String CODE = "ACTOR_BUSY";

    public ActorBusyException(String workflowId, int mailboxCapacity) {
        super("Workflow is busy, please retry later", workflowId, CODE,
                Map.of("mailboxCapacity", mailboxCapacity));
    }
}
