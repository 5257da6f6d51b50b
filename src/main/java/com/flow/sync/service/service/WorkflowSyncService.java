package com.flow.sync.service.service;

import com.flow.sync.service.catalog.TemplateCatalog;
import com.flow.sync.service.change.ChangeRecord;
import com.flow.sync.service.config.MetricsConfig;
import com.flow.sync.service.config.SyncConfig;
import com.flow.sync.service.engine.MutationResult;
import com.flow.sync.service.engine.WorkflowActorRegistry;
import com.flow.sync.service.engine.WorkflowSyncActor;
import com.flow.sync.service.exception.EntityNotFoundException;
import com.flow.sync.service.exception.MutationTimeoutException;
import com.flow.sync.service.exception.MutationValidationException;
import com.flow.sync.service.exception.SyncException;
import com.flow.sync.service.exception.ValidationError;
import com.flow.sync.service.model.CanvasState;
import com.flow.sync.service.model.Connection;
import com.flow.sync.service.model.Endpoint;
import com.flow.sync.service.model.GraphSnapshot;
import com.flow.sync.service.model.GraphState;
import com.flow.sync.service.model.NodeGroup;
import com.flow.sync.service.model.Position;
import com.flow.sync.service.model.WorkflowDocument;
import com.flow.sync.service.model.WorkflowNode;
import com.flow.sync.service.model.WorkflowSnapshot;
import com.flow.sync.service.mutation.EntityIds;
import com.flow.sync.service.mutation.GraphMutation;
import com.flow.sync.service.mutation.GroupPatch;
import com.flow.sync.service.mutation.GroupSpec;
import com.flow.sync.service.mutation.NodeSpec;
import com.flow.sync.service.pending.PendingUpdateLog;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Entry point for every graph mutation, read and poll.
 *
 * Resolves the workflow's actor, enqueues the request and waits for it up to
 * the configured timeout. {@code graphId} defaults to {@code "main"}.
 * Entities created without a caller-supplied ID get a generated one; only
 * requests with caller-supplied IDs are safe to retry, since a retried add
 * is then rejected as a duplicate instead of inserted twice.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowSyncService {

    private final WorkflowActorRegistry registry;
    private final PendingUpdateLog pendingUpdateLog;
    private final TemplateCatalog templateCatalog;
    private final SyncConfig syncConfig;
    private final MetricsConfig metricsConfig;

    // ==================== Nodes ====================

    public MutationResult<WorkflowNode> addNode(String workflowId, String graphId, NodeSpec node) {
        var spec = node == null ? null : withNodeId(node);
        if (spec != null) {
            verifyTemplates(List.of(spec));
        }
        return commit(workflowId, new GraphMutation.AddNode(resolveGraphId(graphId), spec));
    }

    public MutationResult<List<WorkflowNode>> addNodesBatch(String workflowId, String graphId, List<NodeSpec> nodes) {
        var specs = nodes == null ? null : nodes.stream().map(this::withNodeId).toList();
        if (specs != null) {
            verifyTemplates(specs);
        }
        return commit(workflowId, new GraphMutation.AddNodesBatch(resolveGraphId(graphId), specs));
    }

    public MutationResult<WorkflowNode> removeNode(String workflowId, String graphId, String nodeId) {
        return commit(workflowId, new GraphMutation.RemoveNode(resolveGraphId(graphId), nodeId));
    }

    public MutationResult<WorkflowNode> updateNodeProperties(String workflowId, String graphId, String nodeId,
                                                             Map<String, Object> properties) {
        return commit(workflowId, new GraphMutation.UpdateNodeProperties(resolveGraphId(graphId), nodeId, properties));
    }

    public MutationResult<WorkflowNode> updateNodePosition(String workflowId, String graphId, String nodeId,
                                                           Position position) {
        return commit(workflowId, new GraphMutation.UpdateNodePosition(resolveGraphId(graphId), nodeId, position));
    }

    // ==================== Connections ====================

    public MutationResult<Connection> connectNodes(String workflowId, String graphId, String connectionId,
                                                   Endpoint source, Endpoint target) {
        var id = isBlank(connectionId) ? EntityIds.newConnectionId() : connectionId;
        return commit(workflowId, new GraphMutation.ConnectNodes(resolveGraphId(graphId), id, source, target));
    }

    public MutationResult<Connection> removeConnection(String workflowId, String graphId, String connectionId) {
        return commit(workflowId, new GraphMutation.RemoveConnection(resolveGraphId(graphId), connectionId));
    }

    // ==================== Groups ====================

    public MutationResult<NodeGroup> createNodeGroup(String workflowId, String graphId, GroupSpec group) {
        var spec = group == null || !isBlank(group.id()) ? group : group.withId(EntityIds.newGroupId());
        return commit(workflowId, new GraphMutation.CreateGroup(resolveGraphId(graphId), spec));
    }

    public MutationResult<NodeGroup> updateGroupProperties(String workflowId, String graphId, String groupId,
                                                           GroupPatch patch) {
        return commit(workflowId, new GraphMutation.UpdateGroup(resolveGraphId(graphId), groupId, patch));
    }

    public MutationResult<NodeGroup> removeGroup(String workflowId, String graphId, String groupId) {
        return commit(workflowId, new GraphMutation.RemoveGroup(resolveGraphId(graphId), groupId));
    }

    // ==================== Graphs ====================

    public MutationResult<GraphSnapshot> createGraph(String workflowId, String graphId, String name) {
        return commit(workflowId, new GraphMutation.CreateGraph(graphId, name));
    }

    public MutationResult<GraphSnapshot> removeGraph(String workflowId, String graphId) {
        return commit(workflowId, new GraphMutation.RemoveGraph(graphId));
    }

    public MutationResult<CanvasState> updateCanvasState(String workflowId, String graphId, CanvasState canvas) {
        return commit(workflowId, new GraphMutation.UpdateCanvas(resolveGraphId(graphId), canvas));
    }

    // ==================== Reads ====================

    /**
     * Reads one graph through the actor, so it reflects every mutation
     * enqueued before it.
     */
    public GraphState getGraphState(String workflowId, String graphId) {
        var resolvedGraphId = resolveGraphId(graphId);
        return read(workflowId, (document, sequence) -> document.findGraph(resolvedGraphId)
                .map(graph -> new GraphState(workflowId, sequence, graph.snapshot()))
                .orElseThrow(() -> EntityNotFoundException.graph(workflowId, resolvedGraphId)));
    }

    public WorkflowSnapshot getWorkflowState(String workflowId) {
        return read(workflowId, (document, sequence) -> document.snapshot(sequence));
    }

    // ==================== Polling ====================

    /**
     * Returns retained changes after {@code sinceSequence} in commit order.
     *
     * @throws com.flow.sync.service.exception.StaleCursorException if the caller
     *         fell behind retention and must reload full state
     */
    public PendingUpdates getPendingUpdates(String workflowId, Long sinceSequence) {
        requireWorkflowId(workflowId);
        if (sinceSequence != null && sinceSequence < 0) {
            throw MutationValidationException.of(workflowId, "since", "must not be negative");
        }

        // Read before querying so a commit racing the poll is never skipped by the next cursor.
        long committed = pendingUpdateLog.lastSequence(workflowId);
        List<ChangeRecord> records = pendingUpdateLog.query(workflowId, sinceSequence);
        long latest = records.isEmpty()
                ? committed
                : Math.max(committed, records.get(records.size() - 1).sequence());
        log.debug("Pending updates for {} since {}: {} records (latest={})",
                workflowId, sinceSequence, records.size(), latest);
        return new PendingUpdates(workflowId, records, latest);
    }

    /**
     * Discards the workflow's retained changes. Runs inside the actor so the
     * clear point falls between two commits.
     */
    public int clearPendingUpdates(String workflowId) {
        return read(workflowId, (document, sequence) -> pendingUpdateLog.clear(workflowId));
    }

    public boolean deleteWorkflow(String workflowId) {
        requireWorkflowId(workflowId);
        return registry.deleteWorkflow(workflowId);
    }

    // ==================== Execution ====================

    private <R> MutationResult<R> commit(String workflowId, GraphMutation<R> mutation) {
        requireWorkflowId(workflowId);
        Timer.Sample sample = Timer.start(metricsConfig.getRegistry());
        try {
            MutationResult<R> result = await(workflowId, registry.execute(workflowId, actor -> actor.commit(mutation)));
            metricsConfig.getMutationsCommitted().increment();
            return result;
        } catch (SyncException e) {
            metricsConfig.getMutationsRejected().increment();
            log.warn("Rejected {} on {}/{}: {} [{}]",
                    mutation.operationName(), workflowId, mutation.graphId(), e.getMessage(), e.getErrorCode());
            throw e;
        } finally {
            sample.stop(metricsConfig.getMutationTimer());
        }
    }

    private <T> T read(String workflowId, WorkflowSyncActor.ReadTask<T> task) {
        requireWorkflowId(workflowId);
        Function<WorkflowSyncActor, CompletableFuture<T>> request = actor -> actor.read(task);
        return await(workflowId, registry.execute(workflowId, request));
    }

    private <T> T await(String workflowId, CompletableFuture<T> future) {
        long timeoutMs = syncConfig.getTimeout().getMutationMs();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new MutationTimeoutException(workflowId, timeoutMs);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MutationTimeoutException(workflowId, timeoutMs);
        }
    }

    private RuntimeException unwrap(ExecutionException e) {
        var cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException("Request failed", cause);
    }

    // ==================== Helpers ====================

    private NodeSpec withNodeId(NodeSpec spec) {
        return spec == null || !isBlank(spec.id()) ? spec : spec.withId(EntityIds.newNodeId());
    }

    private void verifyTemplates(List<NodeSpec> specs) {
        var errors = new ArrayList<ValidationError>();
        for (NodeSpec spec : specs) {
            if (spec != null && spec.templateId() != null && !templateCatalog.templateExists(spec.templateId())) {
                errors.add(new ValidationError("templateId", "unknown template: " + spec.templateId()));
            }
        }
        if (!errors.isEmpty()) {
            throw new MutationValidationException(null, errors);
        }
    }

    private void requireWorkflowId(String workflowId) {
        if (isBlank(workflowId)) {
            throw MutationValidationException.of(null, "workflowId", "must not be blank");
        }
    }

    private String resolveGraphId(String graphId) {
        return isBlank(graphId) ? WorkflowDocument.MAIN_GRAPH_ID : graphId;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
