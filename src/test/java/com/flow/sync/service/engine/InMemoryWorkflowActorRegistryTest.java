package com.flow.sync.service.engine;

import com.flow.sync.service.config.MetricsConfig;
import com.flow.sync.service.config.RetentionConfig;
import com.flow.sync.service.config.SyncConfig;
import com.flow.sync.service.exception.WorkflowUnavailableException;
import com.flow.sync.service.model.WorkflowDocument;
import com.flow.sync.service.model.WorkflowNode;
import com.flow.sync.service.mutation.GraphMutation;
import com.flow.sync.service.pending.InMemoryPendingUpdateLog;
import com.flow.sync.service.persistence.InMemoryWorkflowCheckpointRepository;
import com.flow.sync.service.persistence.WorkflowCheckpoint;
import com.flow.sync.service.persistence.WorkflowCheckpointRepository;
import com.flow.sync.service.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.flow.sync.service.engine.MutationApplierTest.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Tests for InMemoryWorkflowActorRegistry loading, flushing and eviction.
 */
class InMemoryWorkflowActorRegistryTest {

    private static final String MAIN = WorkflowDocument.MAIN_GRAPH_ID;

    private final MutableClock clock = MutableClock.startingNow();
    private final Set<String> brokenWorkflows = ConcurrentHashMap.newKeySet();
    private volatile boolean savesFailing;
    private volatile CountDownLatch deleteEntered;
    private volatile CountDownLatch deleteReleased;

    private ExecutorService pool;
    private MetricsConfig metricsConfig;
    private SyncConfig syncConfig;
    private RetentionConfig retentionConfig;
    private InMemoryPendingUpdateLog pendingUpdateLog;
    private InMemoryWorkflowCheckpointRepository checkpoints;
    private InMemoryWorkflowActorRegistry registry;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        syncConfig = new SyncConfig();
        retentionConfig = new RetentionConfig();
        pendingUpdateLog = new InMemoryPendingUpdateLog(metricsConfig, retentionConfig, clock);
        checkpoints = new InMemoryWorkflowCheckpointRepository(metricsConfig);
        registry = newRegistry();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void concurrentFirstRequests_loadOneActor() throws Exception {
        var futures = new ArrayList<CompletableFuture<Long>>();
        var callers = Executors.newFixedThreadPool(8);
        try {
            var submitted = new ArrayList<Future<CompletableFuture<Long>>>();
            for (int i = 0; i < 16; i++) {
                submitted.add(callers.submit(() -> registry.execute("wf-1", actor -> actor.read((doc, seq) -> seq))));
            }
            for (var future : submitted) {
                futures.add(future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            callers.shutdownNow();
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get(5, TimeUnit.SECONDS);

        assertThat(registry.count()).isEqualTo(1);
        assertThat(metricsConfig.getActorsLoaded().count()).isEqualTo(1.0);
    }

    @Test
    void evictedActor_reloadsFromCheckpointWithSameSequence() throws Exception {
        commit("wf-1", new GraphMutation.AddNode(MAIN, node("n1")));
        clock.advance(Duration.ofMinutes(31));

        await().atMost(5, TimeUnit.SECONDS).until(() -> registry.evictIdle() == 1);

        assertThat(registry.count()).isZero();
        assertThat(metricsConfig.getActorsEvicted().count()).isEqualTo(1.0);
        assertThat(checkpoints.load("wf-1")).get()
                .extracting(WorkflowCheckpoint::lastSequence).isEqualTo(1L);

        assertThat(nodeIds("wf-1")).containsExactly("n1");
        var next = commit("wf-1", new GraphMutation.AddNode(MAIN, node("n2")));
        assertThat(next.firstSequence()).isEqualTo(2L);
    }

    @Test
    void activeActor_isNotEvicted() throws Exception {
        commit("wf-1", new GraphMutation.AddNode(MAIN, node("n1")));
        clock.advance(Duration.ofMinutes(5));

        assertThat(registry.evictIdle()).isZero();
        assertThat(registry.count()).isEqualTo(1);
    }

    @Test
    void coldStart_replaysLogPastCheckpoint() throws Exception {
        commit("wf-1", new GraphMutation.AddNode(MAIN, node("n1")));
        commit("wf-1", new GraphMutation.AddNode(MAIN, node("n2")));
        assertThat(registry.flushDirty()).isEqualTo(1);
        commit("wf-1", new GraphMutation.AddNode(MAIN, node("n3")));
        commit("wf-1", new GraphMutation.RemoveNode(MAIN, "n1"));

        // A fresh registry over the same stores stands in for a restart without a final save.
        var restarted = newRegistry();
        var state = restarted.execute("wf-1", actor -> actor.read((document, sequence) ->
                document.snapshot(sequence))).get(5, TimeUnit.SECONDS);

        assertThat(state.sequence()).isEqualTo(4L);
        assertThat(state.graphs().get(0).nodes()).extracting(WorkflowNode::id).containsExactly("n2", "n3");
    }

    @Test
    void loadFailure_isIsolatedAndRetried() throws Exception {
        brokenWorkflows.add("wf-broken");

        assertThatThrownBy(() -> registry.execute("wf-broken", actor -> actor.read((doc, seq) -> seq)))
                .isInstanceOf(WorkflowUnavailableException.class)
                .extracting("errorCode").isEqualTo("WORKFLOW_UNAVAILABLE");
        assertThat(registry.count()).isZero();

        commit("wf-healthy", new GraphMutation.AddNode(MAIN, node("n1")));
        assertThat(nodeIds("wf-healthy")).containsExactly("n1");

        brokenWorkflows.clear();
        assertThat(nodeIds("wf-broken")).isEmpty();
        assertThat(metricsConfig.getActorLoadFailures().count()).isEqualTo(1.0);
    }

    @Test
    void flushDirty_savesOnlyActorsWithUnsavedCommits() throws Exception {
        commit("wf-a", new GraphMutation.AddNode(MAIN, node("n1")));
        nodeIds("wf-b");

        assertThat(registry.flushDirty()).isEqualTo(1);
        assertThat(registry.flushDirty()).isZero();
        assertThat(checkpoints.load("wf-b")).isEmpty();
    }

    @Test
    void deleteWorkflow_dropsDocumentCheckpointAndLog() throws Exception {
        commit("wf-1", new GraphMutation.AddNode(MAIN, node("n1")));
        registry.flushDirty();

        assertThat(registry.deleteWorkflow("wf-1")).isTrue();

        assertThat(checkpoints.load("wf-1")).isEmpty();
        assertThat(pendingUpdateLog.lastSequence("wf-1")).isZero();
        assertThat(nodeIds("wf-1")).isEmpty();
        assertThat(registry.deleteWorkflow("never-seen")).isFalse();
    }

    @Test
    void evictionWithFailedSave_keepsCommittedChangesResident() throws Exception {
        commit("wf-1", new GraphMutation.AddNode(MAIN, node("n1")));
        savesFailing = true;
        clock.advance(Duration.ofMinutes(31));
        pendingUpdateLog.evictExpired();
        var idleTtlMs = Duration.ofMinutes(30).toMillis();
        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> registry.residentActors().iterator().next().isIdle(idleTtlMs));

        assertThat(registry.evictIdle()).isZero();

        assertThat(registry.count()).isEqualTo(1);
        assertThat(metricsConfig.getActorsEvicted().count()).isZero();
        assertThat(nodeIds("wf-1")).containsExactly("n1");
        var next = commit("wf-1", new GraphMutation.AddNode(MAIN, node("n2")));
        assertThat(next.firstSequence()).isEqualTo(2L);

        savesFailing = false;
        assertThat(registry.flushDirty()).isEqualTo(1);
        assertThat(checkpoints.load("wf-1")).get()
                .extracting(WorkflowCheckpoint::lastSequence).isEqualTo(2L);
    }

    @Test
    void deleteRacingWithRequest_doesNotBringWorkflowBack() throws Exception {
        commit("wf-1", new GraphMutation.AddNode(MAIN, node("n1")));
        registry.flushDirty();
        deleteEntered = new CountDownLatch(1);
        deleteReleased = new CountDownLatch(1);

        var callers = Executors.newFixedThreadPool(2);
        try {
            var deleting = CompletableFuture.supplyAsync(() -> registry.deleteWorkflow("wf-1"), callers);
            assertThat(deleteEntered.await(5, TimeUnit.SECONDS)).isTrue();

            var reading = CompletableFuture.supplyAsync(() -> {
                try {
                    return nodeIds("wf-1");
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, callers);
            await().during(200, TimeUnit.MILLISECONDS).atMost(2, TimeUnit.SECONDS)
                    .until(() -> !reading.isDone());

            deleteReleased.countDown();

            assertThat(deleting.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(reading.get(5, TimeUnit.SECONDS)).isEmpty();
        } finally {
            deleteReleased.countDown();
            callers.shutdownNow();
        }

        assertThat(registry.flushDirty()).isZero();
        assertThat(checkpoints.load("wf-1")).isEmpty();
        assertThat(nodeIds("wf-1")).isEmpty();
    }

    @Test
    void coldStart_withChangesMissingFromLog_isUnavailable() throws Exception {
        retentionConfig.getPendingUpdates().setMaxCount(2);
        commit("wf-1", new GraphMutation.AddNode(MAIN, node("n1")));
        commit("wf-1", new GraphMutation.AddNode(MAIN, node("n2")));
        commit("wf-1", new GraphMutation.AddNode(MAIN, node("n3")));

        var restarted = newRegistry();

        assertThatThrownBy(() -> restarted.execute("wf-1", actor -> actor.read((doc, seq) -> seq)))
                .isInstanceOf(WorkflowUnavailableException.class)
                .hasMessageContaining("no longer retained");
        assertThat(restarted.count()).isZero();
        assertThat(nodeIds("wf-1")).containsExactly("n1", "n2", "n3");
    }

    // ==================== Helpers ====================

    private InMemoryWorkflowActorRegistry newRegistry() {
        var dispatcher = new ChangeRecordDispatcher(pendingUpdateLog, List.of(), metricsConfig);
        return new InMemoryWorkflowActorRegistry(
                new MutationApplier(),
                new ChangeReplayer(),
                dispatcher,
                pendingUpdateLog,
                new FlakyRepository(),
                pool,
                syncConfig,
                retentionConfig,
                metricsConfig,
                clock
        );
    }

    private <R> MutationResult<R> commit(String workflowId, GraphMutation<R> mutation) throws Exception {
        return registry.execute(workflowId, actor -> actor.commit(mutation)).get(5, TimeUnit.SECONDS);
    }

    private List<String> nodeIds(String workflowId) throws Exception {
        return registry.execute(workflowId, actor -> actor.read((document, sequence) ->
                        document.findGraph(MAIN).orElseThrow().getNodes().stream().map(WorkflowNode::id).toList()))
                .get(5, TimeUnit.SECONDS);
    }

    /**
     * Delegates to the in-memory store; can fail loads of broken workflows,
     * reject saves, or hold a delete open.
     */
    private class FlakyRepository implements WorkflowCheckpointRepository {

        @Override
        public Optional<WorkflowCheckpoint> load(String workflowId) {
            if (brokenWorkflows.contains(workflowId)) {
                throw new IllegalStateException("storage offline for " + workflowId);
            }
            return checkpoints.load(workflowId);
        }

        @Override
        public void save(WorkflowCheckpoint checkpoint) {
            if (savesFailing) {
                throw new IllegalStateException("storage rejected checkpoint of " + checkpoint.workflowId());
            }
            checkpoints.save(checkpoint);
        }

        @Override
        public boolean delete(String workflowId) {
            var entered = deleteEntered;
            if (entered != null) {
                entered.countDown();
                try {
                    deleteReleased.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return checkpoints.delete(workflowId);
        }
    }
}
