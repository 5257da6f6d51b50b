package com.flow.sync.service.engine;

import com.flow.sync.service.change.ChangeRecord;
import com.flow.sync.service.config.MetricsConfig;
import com.flow.sync.service.config.RetentionConfig;
import com.flow.sync.service.exception.ActorBusyException;
import com.flow.sync.service.exception.MutationConflictException;
import com.flow.sync.service.model.Connection;
import com.flow.sync.service.model.Endpoint;
import com.flow.sync.service.model.Position;
import com.flow.sync.service.model.WorkflowDocument;
import com.flow.sync.service.mutation.GraphMutation;
import com.flow.sync.service.pending.InMemoryPendingUpdateLog;
import com.flow.sync.service.support.ManualExecutor;
import com.flow.sync.service.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;

import static com.flow.sync.service.engine.MutationApplierTest.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Tests for WorkflowSyncActor serialization, sequencing and backpressure.
 */
class WorkflowSyncActorTest {

    private static final String WORKFLOW_ID = "wf-actor";
    private static final String MAIN = WorkflowDocument.MAIN_GRAPH_ID;

    private final MutableClock clock = MutableClock.startingNow();
    private final List<ChangeRecord> delivered = new CopyOnWriteArrayList<>();

    private ExecutorService pool;
    private MetricsConfig metricsConfig;
    private InMemoryPendingUpdateLog pendingUpdateLog;
    private ChangeRecordDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        pendingUpdateLog = new InMemoryPendingUpdateLog(metricsConfig, new RetentionConfig(), clock);
        dispatcher = new ChangeRecordDispatcher(pendingUpdateLog, List.<ChangeRecordListener>of(delivered::add), metricsConfig);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void concurrentCommits_receiveGapFreeSequencesInDeliveryOrder() throws Exception {
        var actor = actor(pool, 1000, 8);
        int threads = 8;
        int perThread = 50;
        var start = new CountDownLatch(1);
        var futures = new CopyOnWriteArrayList<CompletableFuture<?>>();

        var submitters = Executors.newFixedThreadPool(threads);
        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                submitters.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        futures.add(actor.commit(new GraphMutation.AddNode(MAIN, node("n-" + thread + "-" + i))));
                    }
                    return null;
                });
            }
            start.countDown();
            submitters.shutdown();
            assertThat(submitters.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            submitters.shutdownNow();
        }

        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get(10, TimeUnit.SECONDS);

        long total = (long) threads * perThread;
        assertThat(actor.getSequence()).isEqualTo(total);
        assertThat(delivered).extracting(ChangeRecord::sequence)
                .containsExactlyElementsOf(LongStream.rangeClosed(1, total).boxed().toList());
        assertThat(pendingUpdateLog.query(WORKFLOW_ID, 0L)).hasSize((int) total);
    }

    @Test
    void rejectedMutation_consumesNoSequence() throws Exception {
        var actor = actor(pool, 100, 8);

        actor.commit(new GraphMutation.AddNode(MAIN, node("n1"))).get(5, TimeUnit.SECONDS);
        var duplicate = actor.commit(new GraphMutation.AddNode(MAIN, node("n1")));
        actor.commit(new GraphMutation.AddNode(MAIN, node("n2"))).get(5, TimeUnit.SECONDS);

        assertThatThrownBy(() -> duplicate.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(MutationConflictException.class);
        assertThat(delivered).extracting(ChangeRecord::sequence).containsExactly(1L, 2L);
    }

    @Test
    void concurrentRemoveAndConnect_neverLeaveDanglingConnections() throws Exception {
        var actor = actor(pool, 10_000, 4);
        int pairs = 100;
        var seeds = new ArrayList<CompletableFuture<?>>();
        for (int i = 0; i < pairs; i++) {
            seeds.add(actor.commit(new GraphMutation.AddNode(MAIN, node("src-" + i))));
            seeds.add(actor.commit(new GraphMutation.AddNode(MAIN, node("dst-" + i))));
        }
        CompletableFuture.allOf(seeds.toArray(CompletableFuture[]::new)).get(10, TimeUnit.SECONDS);

        var racers = Executors.newFixedThreadPool(2);
        var results = new CopyOnWriteArrayList<CompletableFuture<?>>();
        try {
            racers.submit(() -> {
                for (int i = 0; i < pairs; i++) {
                    results.add(actor.commit(new GraphMutation.ConnectNodes(MAIN, "c-" + i,
                            new Endpoint("src-" + i, "out"), new Endpoint("dst-" + i, "in"))));
                }
            });
            racers.submit(() -> {
                for (int i = 0; i < pairs; i += 2) {
                    results.add(actor.commit(new GraphMutation.RemoveNode(MAIN, "dst-" + i)));
                }
            });
            racers.shutdown();
            assertThat(racers.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            racers.shutdownNow();
        }

        // Either outcome of each race is fine; only the final invariant matters.
        CompletableFuture.allOf(results.stream()
                        .map(future -> future.handle((value, error) -> null))
                        .toArray(CompletableFuture[]::new))
                .get(10, TimeUnit.SECONDS);

        List<Connection> connections = actor.read((document, sequence) -> List.copyOf(
                document.findGraph(MAIN).orElseThrow().getConnections())).get(5, TimeUnit.SECONDS);
        List<String> nodeIds = actor.read((document, sequence) -> document.findGraph(MAIN).orElseThrow()
                .getNodes().stream().map(n -> n.id()).toList()).get(5, TimeUnit.SECONDS);

        assertThat(connections).allSatisfy(connection -> {
            assertThat(nodeIds).contains(connection.source().nodeId());
            assertThat(nodeIds).contains(connection.target().nodeId());
        });
    }

    @Test
    void read_observesEveryMutationEnqueuedBeforeIt() throws Exception {
        var actor = actor(pool, 100, 8);

        actor.commit(new GraphMutation.AddNode(MAIN, node("n1")));
        actor.commit(new GraphMutation.UpdateNodePosition(MAIN, "n1", new Position(7, 9)));
        var position = actor.read((document, sequence) ->
                document.findGraph(MAIN).orElseThrow().findNode("n1").orElseThrow().position());

        assertThat(position.get(5, TimeUnit.SECONDS)).isEqualTo(new Position(7, 9));
    }

    @Test
    void fullMailbox_rejectsWithActorBusy() {
        var executor = new ManualExecutor();
        var actor = actor(executor, 2, 8);

        var first = actor.commit(new GraphMutation.AddNode(MAIN, node("n1")));
        var second = actor.commit(new GraphMutation.AddNode(MAIN, node("n2")));

        assertThatThrownBy(() -> actor.commit(new GraphMutation.AddNode(MAIN, node("n3"))))
                .isInstanceOf(ActorBusyException.class)
                .extracting("errorCode").isEqualTo("ACTOR_BUSY");

        executor.runAll();
        assertThat(first).isCompleted();
        assertThat(second).isCompleted();
        assertThat(actor.getSequence()).isEqualTo(2);
    }

    @Test
    void drainPass_yieldsAfterBatchSize() {
        var executor = new ManualExecutor();
        var actor = actor(executor, 100, 2);
        for (int i = 0; i < 5; i++) {
            actor.commit(new GraphMutation.AddNode(MAIN, node("n" + i)));
        }
        assertThat(executor.pending()).isEqualTo(1);

        executor.runNext();

        assertThat(actor.getSequence()).isEqualTo(2);
        assertThat(executor.pending()).isEqualTo(1);

        executor.runAll();
        assertThat(actor.getSequence()).isEqualTo(5);
        assertThat(actor.mailboxSize()).isZero();
    }

    @Test
    void rejectingExecutor_failsQueuedRequestsAsBusy() {
        Executor rejecting = command -> {
            throw new RejectedExecutionException("saturated");
        };
        var actor = actor(rejecting, 100, 8);

        var future = actor.commit(new GraphMutation.AddNode(MAIN, node("n1")));

        assertThat(future).isCompletedExceptionally();
        assertThatThrownBy(future::join).hasCauseInstanceOf(ActorBusyException.class);
    }

    @Test
    void close_takesFinalCheckpointAndRejectsLaterRequests() throws Exception {
        var actor = actor(pool, 100, 8);
        actor.commit(new GraphMutation.AddNode(MAIN, node("n1")));

        var checkpoint = actor.close().get(5, TimeUnit.SECONDS);

        assertThat(checkpoint.lastSequence()).isEqualTo(1);
        assertThat(checkpoint.graphs()).hasSize(1);
        assertThat(actor.isClosed()).isTrue();
        assertThatThrownBy(() -> actor.commit(new GraphMutation.AddNode(MAIN, node("n2"))))
                .isInstanceOf(ActorClosedException.class);
    }

    @Test
    void dirtyAndIdleTracking() throws Exception {
        var actor = actor(pool, 100, 8);
        assertThat(actor.isDirty()).isFalse();

        actor.commit(new GraphMutation.AddNode(MAIN, node("n1"))).get(5, TimeUnit.SECONDS);
        assertThat(actor.isDirty()).isTrue();
        assertThat(actor.isIdle(60_000)).isFalse();

        actor.markPersisted(1);
        clock.advance(Duration.ofMinutes(2));

        assertThat(actor.isDirty()).isFalse();
        await().atMost(5, TimeUnit.SECONDS).until(() -> actor.isIdle(60_000));
    }

    private WorkflowSyncActor actor(Executor executor, int mailboxCapacity, int drainBatchSize) {
        return new WorkflowSyncActor(
                WORKFLOW_ID,
                WorkflowDocument.create(WORKFLOW_ID),
                0,
                0,
                new MutationApplier(),
                dispatcher,
                executor,
                clock,
                mailboxCapacity,
                drainBatchSize
        );
    }
}
