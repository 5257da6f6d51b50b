package com.flow.sync.service.engine;

/**
 * Thrown when a request reaches an actor that is being evicted. The
 * registry retries against a freshly loaded actor.
 */
class ActorClosedException extends RuntimeException {

    ActorClosedException(String workflowId) {
        super("Actor for workflow " + workflowId + " is closed");
    }
}
