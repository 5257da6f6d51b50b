package com.flow.sync.service.persistence;

import com.flow.sync.service.config.MetricsConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local checkpoint store, used when Neo4j persistence is disabled.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "flow.features.neo4j-persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryWorkflowCheckpointRepository implements WorkflowCheckpointRepository {

    private final MetricsConfig metricsConfig;

    private final Map<String, WorkflowCheckpoint> checkpoints = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "flow.sync.checkpoints.count",
                "Number of workflow checkpoints held in memory",
                checkpoints::size
        );
        log.info("InMemoryWorkflowCheckpointRepository initialized");
    }

    @Override
    public Optional<WorkflowCheckpoint> load(String workflowId) {
        return Optional.ofNullable(checkpoints.get(workflowId));
    }

    @Override
    public void save(WorkflowCheckpoint checkpoint) {
        checkpoints.merge(checkpoint.workflowId(), checkpoint,
                (current, candidate) -> candidate.lastSequence() >= current.lastSequence() ? candidate : current);
        log.debug("Checkpoint stored: {} at sequence {}", checkpoint.workflowId(), checkpoint.lastSequence());
    }

    @Override
    public boolean delete(String workflowId) {
        return checkpoints.remove(workflowId) != null;
    }
}
