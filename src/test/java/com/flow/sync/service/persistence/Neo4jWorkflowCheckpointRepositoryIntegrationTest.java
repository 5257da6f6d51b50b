package com.flow.sync.service.persistence;

import com.flow.sync.service.engine.WorkflowActorRegistry;
import com.flow.sync.service.model.CanvasState;
import com.flow.sync.service.model.Endpoint;
import com.flow.sync.service.model.GraphSnapshot;
import com.flow.sync.service.model.Port;
import com.flow.sync.service.model.Position;
import com.flow.sync.service.model.WorkflowNode;
import com.flow.sync.service.mutation.NodeSpec;
import com.flow.sync.service.service.WorkflowSyncService;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.Neo4jContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Checkpoint persistence against a real Neo4j (Testcontainers).
 *
 * Skipped when Docker is not available.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
@ActiveProfiles("test")
class Neo4jWorkflowCheckpointRepositoryIntegrationTest {

    @Container
    static Neo4jContainer<?> neo4jContainer = new Neo4jContainer<>("neo4j:5.15.0")
            .withoutAuthentication();

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("flow.neo4j.uri", neo4jContainer::getBoltUrl);
        registry.add("flow.neo4j.username", () -> "neo4j");
        registry.add("flow.neo4j.password", () -> "neo4j");
        registry.add("flow.features.neo4j-persistence-enabled", () -> "true");
    }

    @Autowired
    private WorkflowCheckpointRepository repository;

    @Autowired
    private WorkflowSyncService syncService;

    @Autowired
    private WorkflowActorRegistry registry;

    @Test
    @Order(1)
    @DisplayName("1. Neo4j repository is the active checkpoint store")
    void step1_neo4jRepositoryActive() {
        assertThat(repository).isInstanceOf(Neo4jWorkflowCheckpointRepository.class);
    }

    @Test
    @Order(2)
    @DisplayName("2. Save, load and overwrite a checkpoint")
    void step2_saveLoadOverwrite() {
        var main = graph("main", true, List.of(node("a"), node("b")));
        var sub = graph("retry", false, List.of(node("c")));

        repository.save(new WorkflowCheckpoint("neo-wf-1", 3, List.of(main, sub), Instant.now()));

        var loaded = repository.load("neo-wf-1").orElseThrow();
        assertThat(loaded.lastSequence()).isEqualTo(3);
        assertThat(loaded.graphs()).containsExactly(main, sub);

        repository.save(new WorkflowCheckpoint("neo-wf-1", 4, List.of(main), Instant.now()));

        var overwritten = repository.load("neo-wf-1").orElseThrow();
        assertThat(overwritten.lastSequence()).isEqualTo(4);
        assertThat(overwritten.graphs()).containsExactly(main);
    }

    @Test
    @Order(3)
    @DisplayName("3. Delete removes the checkpoint")
    void step3_delete() {
        repository.save(new WorkflowCheckpoint("neo-wf-2", 1,
                List.of(graph("main", true, List.of(node("a")))), Instant.now()));

        assertThat(repository.delete("neo-wf-2")).isTrue();
        assertThat(repository.load("neo-wf-2")).isEmpty();
        assertThat(repository.delete("neo-wf-2")).isFalse();
    }

    @Test
    @Order(4)
    @DisplayName("4. Flushed edits are stored in Neo4j")
    void step4_flushPersistsEdits() {
        var workflowId = "neo-wf-3";
        syncService.addNodesBatch(workflowId, null, List.of(spec("src"), spec("dst")));
        syncService.connectNodes(workflowId, null, "c1", new Endpoint("src", "out"), new Endpoint("dst", "in"));

        registry.flushDirty();

        var stored = repository.load(workflowId).orElseThrow();
        assertThat(stored.lastSequence()).isEqualTo(3);
        assertThat(stored.graphs()).hasSize(1);
        assertThat(stored.graphs().get(0).nodes()).extracting(WorkflowNode::id).containsExactly("src", "dst");
        assertThat(stored.graphs().get(0).connections()).hasSize(1);

        assertThat(syncService.deleteWorkflow(workflowId)).isTrue();
        assertThat(repository.load(workflowId)).isEmpty();
    }

    @Test
    @Order(5)
    @DisplayName("5. First request on a stored workflow loads its checkpoint")
    void step5_coldStartFromCheckpoint() {
        var workflowId = "neo-wf-4";
        repository.save(new WorkflowCheckpoint(workflowId, 9,
                List.of(graph("main", true, List.of(node("restored")))), Instant.now()));

        var state = syncService.getWorkflowState(workflowId);

        assertThat(state.sequence()).isEqualTo(9);
        assertThat(state.graphs().get(0).nodes()).extracting(WorkflowNode::id).containsExactly("restored");

        var added = syncService.addNode(workflowId, null, spec("next"));
        assertThat(added.changes().get(0).sequence()).isEqualTo(10);
    }

    // ==================== Helper Methods ====================

    private GraphSnapshot graph(String graphId, boolean main, List<WorkflowNode> nodes) {
        return new GraphSnapshot(graphId, graphId, main, nodes, List.of(), List.of(), CanvasState.DEFAULT);
    }

    private WorkflowNode node(String id) {
        return new WorkflowNode(id, "logger", "action", id, new Position(10, 20),
                Map.of("level", "info"), List.of(Port.input("in", "In"), Port.output("out", "Out")), Map.of());
    }

    private NodeSpec spec(String id) {
        return new NodeSpec(id, "logger", "action", id, new Position(0, 0),
                Map.of(), List.of(Port.input("in", "In"), Port.output("out", "Out")), Map.of());
    }
}
