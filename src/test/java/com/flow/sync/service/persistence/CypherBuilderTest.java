package com.flow.sync.service.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flow.sync.service.model.CanvasState;
import com.flow.sync.service.model.GraphSnapshot;
import com.flow.sync.service.model.NodeGroup;
import com.flow.sync.service.model.Port;
import com.flow.sync.service.model.Position;
import com.flow.sync.service.model.WorkflowNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CypherBuilderTest {

    private final CypherBuilder cypherBuilder = new CypherBuilder(new ObjectMapper().registerModule(new JavaTimeModule()));

    @Test
    void buildSave_mergesWorkflowThenRecreatesEveryGraph() {
        var checkpoint = new WorkflowCheckpoint("wf-1", 7, List.of(graph("main", true), graph("sub", false)),
                Instant.ofEpochMilli(1_000));

        var statements = cypherBuilder.buildSave(checkpoint);

        assertThat(statements).hasSize(4);
        assertThat(statements.get(0).text()).startsWith("MERGE (w:Workflow");
        assertThat(statements.get(0).parameters())
                .containsEntry("lastSequence", 7L)
                .containsEntry("savedAtMs", 1_000L);
        assertThat(statements.get(1).text()).contains("DETACH DELETE g");
        assertThat(statements.get(3).parameters())
                .containsEntry("graphId", "sub")
                .containsEntry("ordinal", 1)
                .containsEntry("main", false);
    }

    @Test
    void storedGraphDocument_readsBackEqual() {
        var original = graph("main", true);
        var statements = cypherBuilder.buildSave(new WorkflowCheckpoint("wf-1", 1, List.of(original), Instant.EPOCH));

        var document = (String) statements.get(2).parameters().get("document");

        assertThat(cypherBuilder.readGraph(document)).isEqualTo(original);
    }

    @Test
    void buildDelete_returnsDeletedCount() {
        var statement = cypherBuilder.buildDelete("wf-1");

        assertThat(statement.text()).contains("DETACH DELETE g, w").endsWith("count(w) AS deleted");
        assertThat(statement.parameters()).containsEntry("workflowId", "wf-1");
    }

    private GraphSnapshot graph(String graphId, boolean main) {
        var node = new WorkflowNode("n1", "http-request", "http-request", "Fetch", new Position(1.5, 2),
                Map.of("url", "https://example.org", "retries", 3),
                List.of(Port.input("in", "In"), Port.output("out", "Out")),
                Map.of("icon", "globe"));
        var group = new NodeGroup("g1", "Stage", "", NodeGroup.DEFAULT_COLOR, false, List.of("n1"));
        return new GraphSnapshot(graphId, graphId, main, List.of(node), List.of(), List.of(group),
                new CanvasState(0, 0, 1));
    }
}
