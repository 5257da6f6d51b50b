package com.flow.sync.service.engine;

import com.flow.sync.service.change.ChangeRecord;
import com.flow.sync.service.change.PendingChange;
import com.flow.sync.service.exception.ActorBusyException;
import com.flow.sync.service.model.WorkflowDocument;
import com.flow.sync.service.mutation.GraphMutation;
import com.flow.sync.service.persistence.WorkflowCheckpoint;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * Single serialization point for one workflow.
 *
 * Requests are queued in a FIFO mailbox and executed one at a time on a
 * shared executor; at most one executor thread drains a given actor at any
 * moment. The actor exclusively owns the workflow document and its sequence
 * counter. A drain pass yields its thread after a fixed number of tasks so a
 * busy workflow cannot starve the others.
 */
@Slf4j
public class WorkflowSyncActor {

    private final String workflowId;
    private final WorkflowDocument document;
    private final MutationApplier applier;
    private final ChangeRecordDispatcher dispatcher;
    private final Executor executor;
    private final Clock clock;
    private final int mailboxCapacity;
    private final int drainBatchSize;

    private final Deque<Task<?>> mailbox = new ArrayDeque<>();
    private boolean draining;
    private boolean closed;

    // Written by the draining thread only.
    private volatile long sequence;
    private volatile long persistedSequence;
    private volatile long lastActivityMs;

    public WorkflowSyncActor(String workflowId,
                             WorkflowDocument document,
                             long initialSequence,
                             long persistedSequence,
                             MutationApplier applier,
                             ChangeRecordDispatcher dispatcher,
                             Executor executor,
                             Clock clock,
                             int mailboxCapacity,
                             int drainBatchSize) {
        this.workflowId = workflowId;
        this.document = document;
        this.sequence = initialSequence;
        this.persistedSequence = persistedSequence;
        this.applier = applier;
        this.dispatcher = dispatcher;
        this.executor = executor;
        this.clock = clock;
        this.mailboxCapacity = mailboxCapacity;
        this.drainBatchSize = Math.max(1, drainBatchSize);
        this.lastActivityMs = clock.millis();
    }

    // ==================== Requests ====================

    /**
     * Enqueues a mutation. The future completes with the committed entity and
     * its change records, or exceptionally with the typed failure; on failure
     * the document is unchanged.
     *
     * @throws ActorBusyException   if the mailbox is full
     * @throws ActorClosedException if the actor has been evicted
     */
    public <R> CompletableFuture<MutationResult<R>> commit(GraphMutation<R> mutation) {
        return enqueue(doc -> applyAndPublish(mutation), false);
    }

    /**
     * Enqueues a read. The function sees the document after every mutation
     * enqueued before it and must not retain references to mutable state.
     */
    public <T> CompletableFuture<T> read(ReadTask<T> task) {
        return enqueue(doc -> task.read(doc, sequence), false);
    }

    /**
     * Enqueues a checkpoint of the current document.
     */
    public CompletableFuture<WorkflowCheckpoint> checkpoint() {
        return enqueue(doc -> takeCheckpoint(), false);
    }

    /**
     * Stops accepting requests and enqueues a final checkpoint behind
     * everything already queued.
     */
    public CompletableFuture<WorkflowCheckpoint> close() {
        return enqueue(doc -> takeCheckpoint(), true);
    }

    /**
     * Creates a live actor over this actor's document once it is closed and
     * drained. Used when the final checkpoint of an eviction could not be saved.
     *
     * @throws IllegalStateException if the actor is still open or has queued work
     */
    WorkflowSyncActor reopen() {
        synchronized (mailbox) {
            if (!closed || !mailbox.isEmpty()) {
                throw new IllegalStateException("Actor of workflow " + workflowId + " is not drained");
            }
        }
        return new WorkflowSyncActor(workflowId, document, sequence, persistedSequence,
                applier, dispatcher, executor, clock, mailboxCapacity, drainBatchSize);
    }

    // ==================== State ====================

    public String getWorkflowId() {
        return workflowId;
    }

    public long getSequence() {
        return sequence;
    }

    public boolean isDirty() {
        return sequence > persistedSequence;
    }

    public void markPersisted(long persisted) {
        if (persisted > persistedSequence) {
            persistedSequence = persisted;
        }
    }

    public long getLastActivityMs() {
        return lastActivityMs;
    }

    public int getMailboxCapacity() {
        return mailboxCapacity;
    }

    public int mailboxSize() {
        synchronized (mailbox) {
            return mailbox.size();
        }
    }

    public boolean isClosed() {
        synchronized (mailbox) {
            return closed;
        }
    }

    /**
     * True when nothing is queued or running and the last request is older than the TTL.
     */
    public boolean isIdle(long idleTtlMs) {
        synchronized (mailbox) {
            return !draining && mailbox.isEmpty()
                    && clock.millis() - lastActivityMs >= idleTtlMs;
        }
    }

    // ==================== Commit ====================

    private <R> MutationResult<R> applyAndPublish(GraphMutation<R> mutation) {
        AppliedMutation<R> applied = applier.apply(document, mutation);
        List<ChangeRecord> records = assignSequences(applied.changes());
        dispatcher.dispatch(records);

        log.debug("Committed {} on {}/{}: sequences {}..{}",
                mutation.operationName(), workflowId, mutation.graphId(),
                records.isEmpty() ? sequence : records.get(0).sequence(), sequence);
        return new MutationResult<>(applied.result(), records);
    }

    private List<ChangeRecord> assignSequences(List<PendingChange> changes) {
        var timestamp = clock.instant();
        var records = new ArrayList<ChangeRecord>(changes.size());
        for (PendingChange change : changes) {
            records.add(change.commit(workflowId, sequence + 1, timestamp));
            sequence++;
        }
        return records;
    }

    private WorkflowCheckpoint takeCheckpoint() {
        return new WorkflowCheckpoint(workflowId, sequence, document.snapshotGraphs(), clock.instant());
    }

    // ==================== Mailbox ====================

    private <T> CompletableFuture<T> enqueue(Function<WorkflowDocument, T> work, boolean closing) {
        var task = new Task<>(work);
        boolean schedule;

        synchronized (mailbox) {
            if (closed) {
                throw new ActorClosedException(workflowId);
            }
            if (!closing && mailbox.size() >= mailboxCapacity) {
                throw new ActorBusyException(workflowId, mailboxCapacity);
            }
            mailbox.addLast(task);
            closed = closing;
            lastActivityMs = clock.millis();
            schedule = !draining;
            draining = true;
        }

        if (schedule) {
            scheduleDrain();
        }
        return task.future;
    }

    private void scheduleDrain() {
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            log.error("Actor executor rejected drain of workflow {}", workflowId, e);
            failQueued();
        }
    }

    private void drain() {
        int processed = 0;
        while (true) {
            Task<?> next;
            synchronized (mailbox) {
                next = mailbox.pollFirst();
                if (next == null) {
                    draining = false;
                    return;
                }
            }

            next.run(document);

            if (++processed >= drainBatchSize) {
                synchronized (mailbox) {
                    if (mailbox.isEmpty()) {
                        draining = false;
                        return;
                    }
                }
                scheduleDrain();
                return;
            }
        }
    }

    private void failQueued() {
        List<Task<?>> failed;
        synchronized (mailbox) {
            failed = new ArrayList<>(mailbox);
            mailbox.clear();
            draining = false;
        }
        var busy = new ActorBusyException(workflowId, mailboxCapacity);
        failed.forEach(task -> task.future.completeExceptionally(busy));
    }

    // ==================== Inner Types ====================

    /**
     * Read executed inside the actor.
     */
    @FunctionalInterface
    public interface ReadTask<T> {
        T read(WorkflowDocument document, long sequence);
    }

    private static final class Task<T> {

        private final Function<WorkflowDocument, T> work;
        private final CompletableFuture<T> future = new CompletableFuture<>();

        Task(Function<WorkflowDocument, T> work) {
            this.work = work;
        }

        void run(WorkflowDocument document) {
            try {
                future.complete(work.apply(document));
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        }
    }
}
