package com.flow.sync.service.engine;

import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Registry that routes requests to the actor owning a workflow.
 *
 * Actors are created lazily on first reference and may be evicted when
 * idle; callers never hold on to an actor beyond a single request.
 */
public interface WorkflowActorRegistry {

    /**
     * Runs a request against the workflow's actor, loading it if needed and
     * retrying once more if the actor is evicted concurrently.
     *
     * @throws com.flow.sync.service.exception.WorkflowUnavailableException if the
     *         workflow's document cannot be loaded
     */
    <T> CompletableFuture<T> execute(String workflowId, Function<WorkflowSyncActor, CompletableFuture<T>> request);

    /**
     * Closes the workflow's actor and removes its checkpoint and log.
     *
     * @return true if anything was removed
     */
    boolean deleteWorkflow(String workflowId);

    /**
     * Gets the actors currently resident.
     */
    Collection<WorkflowSyncActor> residentActors();

    /**
     * Gets the number of resident actors.
     */
    int count();

    /**
     * Checkpoints every actor with unsaved commits.
     *
     * @return number of checkpoints saved
     */
    int flushDirty();

    /**
     * Checkpoints and evicts actors that have been idle past the TTL.
     *
     * @return number of actors evicted
     */
    int evictIdle();
}
