package com.flow.sync.service.engine;

import com.flow.sync.service.change.ChangePayload;
import com.flow.sync.service.change.ChangeRecord;
import com.flow.sync.service.model.WorkflowDocument;
import com.flow.sync.service.model.WorkflowGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rolls a workflow document forward by applying committed change records.
 *
 * Records were validated when they were committed, so replay does not
 * re-check invariants. Used on actor cold start to bring a checkpoint up
 * to date with the retained log, and by any replica that consumes the
 * change stream.
 */
@Slf4j
@Component
public class ChangeReplayer {

    /**
     * Applies the records in order, skipping any at or below {@code afterSequence}.
     *
     * @return the sequence of the last applied record, or {@code afterSequence} if none applied
     */
    public long replay(WorkflowDocument document, List<ChangeRecord> records, long afterSequence) {
        long applied = afterSequence;
        for (ChangeRecord record : records) {
            if (record.sequence() <= applied) continue;
            apply(document, record);
            applied = record.sequence();
        }
        return applied;
    }

    public void apply(WorkflowDocument document, ChangeRecord record) {
        var payload = record.payload();

        if (payload instanceof ChangePayload.GraphCreated p) {
            document.putGraph(new WorkflowGraph(p.graphId(), p.name(), false));
            return;
        }
        if (payload instanceof ChangePayload.GraphRemoved p) {
            document.removeGraph(p.graphId());
            return;
        }

        var graph = document.findGraph(record.graphId()).orElse(null);
        if (graph == null) {
            log.warn("Skipping {} #{} for unknown graph {}/{}",
                    record.opType().getWireName(), record.sequence(), record.workflowId(), record.graphId());
            return;
        }
        applyToGraph(graph, payload);
    }

    // ==================== Graph Changes ====================

    private void applyToGraph(WorkflowGraph graph, ChangePayload payload) {
        if (payload instanceof ChangePayload.NodeAdded p) {
            graph.putNode(p.node());
        } else if (payload instanceof ChangePayload.NodePropertiesUpdated p) {
            graph.findNode(p.nodeId())
                    .ifPresent(node -> graph.putNode(node.withProperties(p.properties())));
        } else if (payload instanceof ChangePayload.NodeMoved p) {
            graph.findNode(p.nodeId())
                    .ifPresent(node -> graph.putNode(node.withPosition(p.position())));
        } else if (payload instanceof ChangePayload.NodeRemoved p) {
            removeNodeWithCascade(graph, p.nodeId());
        } else if (payload instanceof ChangePayload.ConnectionAdded p) {
            graph.putConnection(p.connection());
        } else if (payload instanceof ChangePayload.ConnectionRemoved p) {
            graph.removeConnection(p.connectionId());
        } else if (payload instanceof ChangePayload.GroupCreated p) {
            graph.putGroup(p.group());
        } else if (payload instanceof ChangePayload.GroupUpdated p) {
            graph.putGroup(p.group());
        } else if (payload instanceof ChangePayload.GroupRemoved p) {
            graph.removeGroup(p.groupId());
        } else if (payload instanceof ChangePayload.CanvasUpdated p) {
            graph.setCanvas(p.canvas());
        }
    }

    private void removeNodeWithCascade(WorkflowGraph graph, String nodeId) {
        graph.connectionsTouching(nodeId)
                .forEach(connection -> graph.removeConnection(connection.id()));
        graph.groupsContaining(nodeId)
                .forEach(group -> graph.putGroup(group.withoutNode(nodeId)));
        graph.removeNode(nodeId);
    }
}
