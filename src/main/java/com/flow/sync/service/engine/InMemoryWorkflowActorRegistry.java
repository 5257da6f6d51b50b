package com.flow.sync.service.engine;

import com.flow.sync.service.change.ChangeRecord;
import com.flow.sync.service.config.MetricsConfig;
import com.flow.sync.service.config.RetentionConfig;
import com.flow.sync.service.config.SyncConfig;
import com.flow.sync.service.exception.StaleCursorException;
import com.flow.sync.service.exception.WorkflowUnavailableException;
import com.flow.sync.service.model.WorkflowDocument;
import com.flow.sync.service.pending.PendingUpdateLog;
import com.flow.sync.service.persistence.WorkflowCheckpoint;
import com.flow.sync.service.persistence.WorkflowCheckpointRepository;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * In-memory implementation of WorkflowActorRegistry.
 *
 * Lookups and inserts go through a ConcurrentHashMap of actor futures, so
 * unrelated workflows never wait on each other. The first caller for a
 * workflow loads its checkpoint outside the map; concurrent callers for the
 * same workflow wait on the same future. A failed load is removed again so
 * the next request retries, and it never affects other workflows.
 */
@Slf4j
@Component
public class InMemoryWorkflowActorRegistry implements WorkflowActorRegistry {

    private static final int MAX_ATTEMPTS = 3;

    private final MutationApplier applier;
    private final ChangeReplayer replayer;
    private final ChangeRecordDispatcher dispatcher;
    private final PendingUpdateLog pendingUpdateLog;
    private final WorkflowCheckpointRepository checkpointRepository;
    private final Executor actorExecutor;
    private final SyncConfig syncConfig;
    private final RetentionConfig retentionConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final Map<String, CompletableFuture<WorkflowSyncActor>> actors = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> gates = new ConcurrentHashMap<>();

    public InMemoryWorkflowActorRegistry(MutationApplier applier,
                                         ChangeReplayer replayer,
                                         ChangeRecordDispatcher dispatcher,
                                         PendingUpdateLog pendingUpdateLog,
                                         WorkflowCheckpointRepository checkpointRepository,
                                         @Qualifier("actorExecutor") Executor actorExecutor,
                                         SyncConfig syncConfig,
                                         RetentionConfig retentionConfig,
                                         MetricsConfig metricsConfig,
                                         Clock clock) {
        this.applier = applier;
        this.replayer = replayer;
        this.dispatcher = dispatcher;
        this.pendingUpdateLog = pendingUpdateLog;
        this.checkpointRepository = checkpointRepository;
        this.actorExecutor = actorExecutor;
        this.syncConfig = syncConfig;
        this.retentionConfig = retentionConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    // ==================== Lifecycle ====================

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "flow.sync.actors.resident",
                "Number of workflow actors in memory",
                this::count
        );
        log.info("InMemoryWorkflowActorRegistry initialized, mailbox capacity: {}, idle TTL: {} minutes",
                syncConfig.getActor().getMailboxCapacity(),
                retentionConfig.getActor().getIdleTtlMinutes());
    }

    @PreDestroy
    void shutdown() {
        int saved = 0;
        for (String workflowId : List.copyOf(actors.keySet())) {
            var future = actors.remove(workflowId);
            var actor = future == null ? null : loadedActor(future);
            if (actor != null && saveFinal(actor)) {
                saved++;
            }
        }
        log.info("InMemoryWorkflowActorRegistry stopped, final checkpoints saved: {}", saved);
    }

    // ==================== WorkflowActorRegistry Interface ====================

    @Override
    public <T> CompletableFuture<T> execute(String workflowId,
                                            Function<WorkflowSyncActor, CompletableFuture<T>> request) {
        for (int attempt = 1; ; attempt++) {
            var actor = acquire(workflowId);
            try {
                return request.apply(actor);
            } catch (ActorClosedException e) {
                if (attempt >= MAX_ATTEMPTS) {
                    throw new WorkflowUnavailableException(workflowId, "actor is being evicted", e);
                }
                log.debug("Actor for workflow {} closed during request, retrying (attempt {})", workflowId, attempt);
            }
        }
    }

    @Override
    public boolean deleteWorkflow(String workflowId) {
        var gate = acquireGate(workflowId);
        try {
            boolean removed = false;

            // Futures still pending belong to loaders queued behind this gate; they load the emptied state.
            var future = actors.get(workflowId);
            if (future != null && future.isDone() && actors.remove(workflowId, future)) {
                var actor = loadedActor(future);
                if (actor != null) {
                    // Queued requests finish before the log is dropped.
                    awaitCheckpoint(workflowId, closeActor(actor));
                    removed = true;
                }
            }

            removed |= checkpointRepository.delete(workflowId);
            removed |= pendingUpdateLog.lastSequence(workflowId) > 0;
            pendingUpdateLog.deleteWorkflow(workflowId);

            log.info("Workflow deleted: {} (existed={})", workflowId, removed);
            return removed;
        } finally {
            releaseGate(workflowId, gate);
        }
    }

    @Override
    public Collection<WorkflowSyncActor> residentActors() {
        return actors.values().stream()
                .map(this::loadedActor)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public int count() {
        return actors.size();
    }

    @Override
    @Scheduled(fixedDelayString = "${flow.sync.persistence.flush-interval-ms:30000}")
    public int flushDirty() {
        int saved = 0;
        for (WorkflowSyncActor actor : residentActors()) {
            if (actor.isDirty() && flush(actor)) {
                saved++;
            }
        }

        if (saved > 0) {
            log.info("Flushed {} dirty workflow checkpoints", saved);
        }
        return saved;
    }

    @Override
    @Scheduled(fixedDelayString = "${flow.retention.actor.eviction-interval-ms:60000}")
    public int evictIdle() {
        long idleTtlMinutes = retentionConfig.getActor().getIdleTtlMinutes();
        if (idleTtlMinutes <= 0) return 0;

        long idleTtlMs = idleTtlMinutes * 60 * 1000;
        int evicted = 0;
        for (Map.Entry<String, CompletableFuture<WorkflowSyncActor>> entry : actors.entrySet()) {
            var actor = loadedActor(entry.getValue());
            if (actor != null && actor.isIdle(idleTtlMs) && evict(entry.getKey(), entry.getValue(), actor)) {
                evicted++;
            }
        }

        if (evicted > 0) {
            log.info("Evicted {} idle workflow actors", evicted);
        }
        return evicted;
    }

    // ==================== Loading ====================

    private WorkflowSyncActor acquire(String workflowId) {
        var future = actors.get(workflowId);
        if (future == null) {
            var created = new CompletableFuture<WorkflowSyncActor>();
            future = actors.putIfAbsent(workflowId, created);
            if (future == null) {
                future = created;
                load(workflowId, created);
            }
        }
        return awaitActor(workflowId, future);
    }

    private void load(String workflowId, CompletableFuture<WorkflowSyncActor> future) {
        var gate = acquireGate(workflowId);
        try {
            // An eviction whose final save failed hands its actor back through this future.
            if (future.isDone()) return;
            var actor = createActor(workflowId);
            metricsConfig.getActorsLoaded().increment();
            future.complete(actor);
        } catch (RuntimeException e) {
            metricsConfig.getActorLoadFailures().increment();
            log.error("Failed to load workflow {}", workflowId, e);
            actors.remove(workflowId, future);
            future.completeExceptionally(e);
        } finally {
            releaseGate(workflowId, gate);
        }
    }

    private WorkflowSyncActor createActor(String workflowId) {
        var checkpoint = checkpointRepository.load(workflowId);
        var document = checkpoint
                .map(saved -> WorkflowDocument.fromSnapshots(workflowId, saved.graphs()))
                .orElseGet(() -> WorkflowDocument.create(workflowId));
        long checkpointSequence = checkpoint.map(WorkflowCheckpoint::lastSequence).orElse(0L);

        long replayedSequence = replayRetained(workflowId, document, checkpointSequence);
        long sequence = Math.max(replayedSequence, pendingUpdateLog.lastSequence(workflowId));

        log.info("Workflow actor loaded: {} (checkpoint={}, sequence={})",
                workflowId, checkpoint.isPresent() ? checkpointSequence : "none", sequence);

        return new WorkflowSyncActor(
                workflowId,
                document,
                sequence,
                checkpointSequence,
                applier,
                dispatcher,
                actorExecutor,
                clock,
                syncConfig.getActor().getMailboxCapacity(),
                syncConfig.getActor().getDrainBatchSize()
        );
    }

    private long replayRetained(String workflowId, WorkflowDocument document, long checkpointSequence) {
        List<ChangeRecord> retained;
        try {
            retained = pendingUpdateLog.query(workflowId, checkpointSequence);
        } catch (StaleCursorException e) {
            // Replaying past the gap could reference entities that were never restored.
            log.error("Pending log of workflow {} no longer covers sequences {}..{} after its checkpoint",
                    workflowId, checkpointSequence + 1, e.getDroppedThroughSequence());
            throw new WorkflowUnavailableException(workflowId,
                    "changes after checkpoint " + checkpointSequence + " are no longer retained", e);
        }
        if (retained.isEmpty()) return checkpointSequence;

        long replayed = replayer.replay(document, retained, checkpointSequence);
        log.info("Replayed changes {}..{} onto checkpoint of workflow {}",
                checkpointSequence + 1, replayed, workflowId);
        return replayed;
    }

    private WorkflowSyncActor awaitActor(String workflowId, CompletableFuture<WorkflowSyncActor> future) {
        try {
            return future.get(syncConfig.getTimeout().getLoadMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new WorkflowUnavailableException(workflowId, "load timed out", e);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            throw new WorkflowUnavailableException(workflowId, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkflowUnavailableException(workflowId, "interrupted while loading", e);
        }
    }

    // ==================== Gates ====================

    /**
     * Serializes loads, evictions and deletes of one workflow. Other workflows
     * are never blocked.
     */
    private CompletableFuture<Void> acquireGate(String workflowId) {
        var gate = new CompletableFuture<Void>();
        while (true) {
            var held = gates.putIfAbsent(workflowId, gate);
            if (held == null) return gate;
            held.exceptionally(e -> null).join();
        }
    }

    private void releaseGate(String workflowId, CompletableFuture<Void> gate) {
        gate.complete(null);
        gates.remove(workflowId, gate);
    }

    // ==================== Flush & Eviction ====================

    private boolean flush(WorkflowSyncActor actor) {
        CompletableFuture<WorkflowCheckpoint> pending;
        try {
            pending = actor.checkpoint();
        } catch (ActorClosedException e) {
            return false;
        } catch (RuntimeException e) {
            log.warn("Skipping checkpoint of workflow {}: {}", actor.getWorkflowId(), e.getMessage());
            return false;
        }

        var checkpoint = awaitCheckpoint(actor.getWorkflowId(), pending);
        if (checkpoint == null || !persist(checkpoint)) return false;

        actor.markPersisted(checkpoint.lastSequence());
        return true;
    }

    private boolean evict(String workflowId, CompletableFuture<WorkflowSyncActor> future, WorkflowSyncActor actor) {
        var gate = new CompletableFuture<Void>();
        if (gates.putIfAbsent(workflowId, gate) != null) return false;

        try {
            if (!actors.remove(workflowId, future)) return false;

            var closing = closeActor(actor);
            var checkpoint = awaitCheckpoint(workflowId, closing);
            if (checkpoint == null || !persist(checkpoint)) {
                reinstate(workflowId, actor, closing);
                return false;
            }

            actor.markPersisted(checkpoint.lastSequence());
            metricsConfig.getActorsEvicted().increment();
            log.info("Evicted idle workflow actor: {} at sequence {}", workflowId, actor.getSequence());
            return true;
        } finally {
            releaseGate(workflowId, gate);
        }
    }

    /**
     * Puts a closed actor's document back into service after its final
     * checkpoint was not saved. A request that arrived during the eviction is
     * waiting on the gate with its own future; it receives the reopened actor.
     */
    private void reinstate(String workflowId, WorkflowSyncActor actor, CompletableFuture<WorkflowCheckpoint> closing) {
        closing.exceptionally(e -> null).join();
        var reopened = actor.reopen();

        actors.compute(workflowId, (id, existing) -> {
            if (existing == null || existing.isCompletedExceptionally()) {
                return CompletableFuture.completedFuture(reopened);
            }
            existing.complete(reopened);
            return existing;
        });
        log.warn("Final checkpoint of workflow {} not saved, keeping it resident at sequence {}",
                workflowId, reopened.getSequence());
    }

    private boolean saveFinal(WorkflowSyncActor actor) {
        var checkpoint = awaitCheckpoint(actor.getWorkflowId(), closeActor(actor));
        if (checkpoint == null || !persist(checkpoint)) return false;

        actor.markPersisted(checkpoint.lastSequence());
        return true;
    }

    private CompletableFuture<WorkflowCheckpoint> closeActor(WorkflowSyncActor actor) {
        try {
            return actor.close();
        } catch (ActorClosedException e) {
            return CompletableFuture.completedFuture(null);
        }
    }

    private WorkflowCheckpoint awaitCheckpoint(String workflowId, CompletableFuture<WorkflowCheckpoint> pending) {
        try {
            return pending.get(syncConfig.getTimeout().getMutationMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | ExecutionException e) {
            metricsConfig.getPersistenceFailures().increment();
            log.error("Could not take checkpoint of workflow {}", workflowId, e);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted taking checkpoint of workflow {}", workflowId);
            return null;
        }
    }

    private boolean persist(WorkflowCheckpoint checkpoint) {
        Timer.Sample sample = Timer.start(metricsConfig.getRegistry());
        try {
            checkpointRepository.save(checkpoint);
            log.debug("Checkpoint saved: {} at sequence {}", checkpoint.workflowId(), checkpoint.lastSequence());
            return true;
        } catch (RuntimeException e) {
            metricsConfig.getPersistenceFailures().increment();
            log.error("Failed to save checkpoint of workflow {} at sequence {}",
                    checkpoint.workflowId(), checkpoint.lastSequence(), e);
            return false;
        } finally {
            sample.stop(metricsConfig.getPersistenceTimer());
        }
    }

    private WorkflowSyncActor loadedActor(CompletableFuture<WorkflowSyncActor> future) {
        if (!future.isDone() || future.isCompletedExceptionally()) return null;
        return future.join();
    }
}
