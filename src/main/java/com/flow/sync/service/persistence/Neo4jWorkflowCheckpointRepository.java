package com.flow.sync.service.persistence;

import com.flow.sync.service.config.FlowConfig;
import com.flow.sync.service.model.GraphSnapshot;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Neo4j-backed checkpoint store.
 *
 * Saves replace the stored graphs of a workflow in one write transaction.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "flow.features.neo4j-persistence-enabled", havingValue = "true")
public class Neo4jWorkflowCheckpointRepository implements WorkflowCheckpointRepository {

    private final CypherBuilder cypherBuilder;
    private final FlowConfig flowConfig;

    private Driver driver;

    public Neo4jWorkflowCheckpointRepository(CypherBuilder cypherBuilder, FlowConfig flowConfig) {
        this.cypherBuilder = cypherBuilder;
        this.flowConfig = flowConfig;
    }

    @PostConstruct
    void init() {
        var settings = flowConfig.getNeo4j();
        driver = GraphDatabase.driver(settings.getUri(),
                AuthTokens.basic(settings.getUsername(), settings.getPassword()));
        try {
            driver.verifyConnectivity();
            log.info("Connected to Neo4j at {}", settings.getUri());
        } catch (RuntimeException e) {
            // The driver reconnects lazily; each workflow load fails on its own until Neo4j is reachable.
            log.warn("Neo4j at {} is not reachable yet: {}", settings.getUri(), e.getMessage());
        }
    }

    @PreDestroy
    void cleanup() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j driver closed");
        }
    }

    // ==================== WorkflowCheckpointRepository Interface ====================

    @Override
    public Optional<WorkflowCheckpoint> load(String workflowId) {
        var statement = cypherBuilder.buildLoad(workflowId);

        try (Session session = driver.session()) {
            List<Record> rows = session.executeRead(tx ->
                    tx.run(statement.text(), statement.parameters()).list());
            return toCheckpoint(workflowId, rows);
        }
    }

    @Override
    public void save(WorkflowCheckpoint checkpoint) {
        var statements = cypherBuilder.buildSave(checkpoint);

        try (Session session = driver.session()) {
            session.executeWriteWithoutResult(tx ->
                    statements.forEach(statement -> tx.run(statement.text(), statement.parameters())));
        }
        log.debug("Checkpoint written to Neo4j: {} at sequence {} ({} graphs)",
                checkpoint.workflowId(), checkpoint.lastSequence(), checkpoint.graphs().size());
    }

    @Override
    public boolean delete(String workflowId) {
        var statement = cypherBuilder.buildDelete(workflowId);

        try (Session session = driver.session()) {
            long deleted = session.executeWrite(tx ->
                    tx.run(statement.text(), statement.parameters()).single().get("deleted").asLong());
            return deleted > 0;
        }
    }

    // ==================== Private Methods ====================

    private Optional<WorkflowCheckpoint> toCheckpoint(String workflowId, List<Record> rows) {
        if (rows.isEmpty()) return Optional.empty();

        var first = rows.get(0);
        var graphs = new ArrayList<GraphSnapshot>();
        for (Record row : rows) {
            var document = row.get("document");
            if (!document.isNull()) {
                graphs.add(cypherBuilder.readGraph(document.asString()));
            }
        }

        return Optional.of(new WorkflowCheckpoint(
                workflowId,
                first.get("lastSequence").asLong(0),
                graphs,
                Instant.ofEpochMilli(first.get("savedAtMs").asLong(0))
        ));
    }
}
