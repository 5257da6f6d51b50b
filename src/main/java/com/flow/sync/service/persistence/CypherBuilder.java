package com.flow.sync.service.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flow.sync.service.model.GraphSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds parameterized Cypher statements for workflow checkpoints.
 *
 * A checkpoint is one {@code (:Workflow)} node with a {@code HAS_GRAPH}
 * relationship to one {@code (:WorkflowGraph)} node per graph. Each graph
 * document is stored as JSON so schema changes do not require migrations.
 */
@Component
@RequiredArgsConstructor
public class CypherBuilder {

    static final String WORKFLOW_LABEL = "Workflow";
    static final String GRAPH_LABEL = "WorkflowGraph";
    static final String GRAPH_RELATIONSHIP = "HAS_GRAPH";

    private final ObjectMapper objectMapper;

    // ==================== Public API ====================

    /**
     * Builds the statements that replace the stored checkpoint of a workflow.
     */
    public List<CypherStatement> buildSave(WorkflowCheckpoint checkpoint) {
        var statements = new ArrayList<CypherStatement>();
        statements.add(buildWorkflowMerge(checkpoint));
        statements.add(buildGraphCleanup(checkpoint.workflowId()));

        var graphs = checkpoint.graphs();
        for (int ordinal = 0; ordinal < graphs.size(); ordinal++) {
            statements.add(buildGraphCreate(checkpoint.workflowId(), graphs.get(ordinal), ordinal));
        }
        return statements;
    }

    /**
     * Builds the query that returns one row per stored graph, in order.
     */
    public CypherStatement buildLoad(String workflowId) {
        return new CypherStatement(
                "MATCH (w:" + WORKFLOW_LABEL + " {workflowId: $workflowId}) " +
                        "OPTIONAL MATCH (w)-[:" + GRAPH_RELATIONSHIP + "]->(g:" + GRAPH_LABEL + ") " +
                        "RETURN w.lastSequence AS lastSequence, w.savedAtMs AS savedAtMs, g.document AS document " +
                        "ORDER BY g.ordinal",
                Map.of("workflowId", workflowId));
    }

    /**
     * Builds the statement that deletes a workflow and its graphs.
     */
    public CypherStatement buildDelete(String workflowId) {
        return new CypherStatement(
                "MATCH (w:" + WORKFLOW_LABEL + " {workflowId: $workflowId}) " +
                        "OPTIONAL MATCH (w)-[:" + GRAPH_RELATIONSHIP + "]->(g:" + GRAPH_LABEL + ") " +
                        "DETACH DELETE g, w " +
                        "RETURN count(w) AS deleted",
                Map.of("workflowId", workflowId));
    }

    public GraphSnapshot readGraph(String document) {
        try {
            return objectMapper.readValue(document, GraphSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored graph document is not readable: " + e.getOriginalMessage(), e);
        }
    }

    // ==================== Statement Building ====================

    private CypherStatement buildWorkflowMerge(WorkflowCheckpoint checkpoint) {
        return new CypherStatement(
                "MERGE (w:" + WORKFLOW_LABEL + " {workflowId: $workflowId}) " +
                        "SET w.lastSequence = $lastSequence, w.savedAtMs = $savedAtMs",
                Map.of(
                        "workflowId", checkpoint.workflowId(),
                        "lastSequence", checkpoint.lastSequence(),
                        "savedAtMs", checkpoint.savedAt().toEpochMilli()));
    }

    private CypherStatement buildGraphCleanup(String workflowId) {
        return new CypherStatement(
                "MATCH (:" + WORKFLOW_LABEL + " {workflowId: $workflowId})-[:" + GRAPH_RELATIONSHIP + "]->(g:" +
                        GRAPH_LABEL + ") DETACH DELETE g",
                Map.of("workflowId", workflowId));
    }

    private CypherStatement buildGraphCreate(String workflowId, GraphSnapshot graph, int ordinal) {
        return new CypherStatement(
                "MATCH (w:" + WORKFLOW_LABEL + " {workflowId: $workflowId}) " +
                        "CREATE (w)-[:" + GRAPH_RELATIONSHIP + "]->(:" + GRAPH_LABEL +
                        " {graphId: $graphId, name: $name, main: $main, ordinal: $ordinal, document: $document})",
                Map.of(
                        "workflowId", workflowId,
                        "graphId", graph.graphId(),
                        "name", graph.name(),
                        "main", graph.main(),
                        "ordinal", ordinal,
                        "document", writeGraph(graph)));
    }

    private String writeGraph(GraphSnapshot graph) {
        try {
            return objectMapper.writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Graph " + graph.graphId() + " cannot be serialized", e);
        }
    }

    // ==================== Inner Types ====================

    public record CypherStatement(String text, Map<String, Object> parameters) {}
}
