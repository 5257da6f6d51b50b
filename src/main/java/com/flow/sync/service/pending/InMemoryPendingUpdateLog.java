package com.flow.sync.service.pending;

import com.flow.sync.service.change.ChangeRecord;
import com.flow.sync.service.config.MetricsConfig;
import com.flow.sync.service.config.RetentionConfig;
import com.flow.sync.service.exception.StaleCursorException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of PendingUpdateLog.
 *
 * Keeps one bounded deque per workflow, trimmed by count on append and by
 * age on a schedule. Survives actor eviction, so an actor reloaded from an
 * older checkpoint can replay what the log still holds.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryPendingUpdateLog implements PendingUpdateLog {

    private final MetricsConfig metricsConfig;
    private final RetentionConfig retentionConfig;
    private final Clock clock;

    private final Map<String, WorkflowLog> logs = new ConcurrentHashMap<>();

    // ==================== Lifecycle ====================

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "flow.sync.pending.records.count",
                "Number of change records retained for polling",
                this::count
        );
        log.info("InMemoryPendingUpdateLog initialized, max records per workflow: {}, TTL: {} minutes",
                maxCount(), retentionConfig.getPendingUpdates().getTtlMinutes());
    }

    // ==================== PendingUpdateLog Interface ====================

    @Override
    public void append(ChangeRecord record) {
        var workflowLog = logs.computeIfAbsent(record.workflowId(), id -> new WorkflowLog());
        int dropped = workflowLog.append(record, clock.millis(), maxCount());

        metricsConfig.getChangesAppended().increment();
        if (dropped > 0) {
            metricsConfig.getChangesDropped().increment(dropped);
            log.debug("Retention dropped {} records of workflow {}", dropped, record.workflowId());
        }
    }

    @Override
    public List<ChangeRecord> query(String workflowId, Long sinceSequence) {
        var workflowLog = logs.get(workflowId);
        if (workflowLog == null) return List.of();

        return workflowLog.query(workflowId, sinceSequence);
    }

    @Override
    public int clear(String workflowId) {
        var workflowLog = logs.get(workflowId);
        if (workflowLog == null) return 0;

        int cleared = workflowLog.clear();
        log.info("Cleared {} pending updates of workflow {}", cleared, workflowId);
        return cleared;
    }

    @Override
    public long lastSequence(String workflowId) {
        var workflowLog = logs.get(workflowId);
        return workflowLog == null ? 0 : workflowLog.lastSequence();
    }

    @Override
    public void deleteWorkflow(String workflowId) {
        if (logs.remove(workflowId) != null) {
            log.info("Pending update log deleted for workflow {}", workflowId);
        }
    }

    @Override
    public int count() {
        return logs.values().stream()
                .mapToInt(WorkflowLog::size)
                .sum();
    }

    @Override
    @Scheduled(fixedDelayString = "${flow.retention.pending-updates.eviction-interval-ms:60000}")
    public int evictExpired() {
        long ttlMinutes = retentionConfig.getPendingUpdates().getTtlMinutes();
        if (ttlMinutes <= 0) return 0;

        long cutoffMs = clock.millis() - (ttlMinutes * 60 * 1000);
        int evicted = 0;
        for (WorkflowLog workflowLog : logs.values()) {
            evicted += workflowLog.dropOlderThan(cutoffMs);
        }

        if (evicted > 0) {
            metricsConfig.getChangesDropped().increment(evicted);
            log.info("Evicted {} expired pending updates", evicted);
        }
        return evicted;
    }

    private int maxCount() {
        return retentionConfig.getPendingUpdates().getMaxCount();
    }

    // ==================== Inner Types ====================

    private record Entry(ChangeRecord record, long appendedAtMs) {}

    /**
     * Retained records of one workflow. Sequence bookkeeping:
     * {@code droppedThrough} is the highest sequence removed by retention and
     * {@code clearedThrough} the last sequence at the most recent clear.
     */
    private static final class WorkflowLog {

        private final Deque<Entry> entries = new ArrayDeque<>();
        private long lastSequence;
        private long droppedThrough;
        private long clearedThrough;

        synchronized int append(ChangeRecord record, long nowMs, int maxCount) {
            entries.addLast(new Entry(record, nowMs));
            lastSequence = Math.max(lastSequence, record.sequence());

            int dropped = 0;
            while (maxCount > 0 && entries.size() > maxCount) {
                droppedThrough = entries.removeFirst().record().sequence();
                dropped++;
            }
            return dropped;
        }

        synchronized List<ChangeRecord> query(String workflowId, Long sinceSequence) {
            if (sinceSequence != null && isStale(sinceSequence)) {
                throw new StaleCursorException(workflowId, sinceSequence, droppedThrough);
            }
            long since = sinceSequence == null ? Long.MIN_VALUE : sinceSequence;
            return entries.stream()
                    .map(Entry::record)
                    .filter(record -> record.sequence() > since)
                    .toList();
        }

        // A cursor below the last clear point only misses records the caller chose to discard.
        private boolean isStale(long sinceSequence) {
            return sinceSequence < droppedThrough && droppedThrough > clearedThrough;
        }

        synchronized int clear() {
            int cleared = entries.size();
            entries.clear();
            clearedThrough = lastSequence;
            return cleared;
        }

        synchronized int dropOlderThan(long cutoffMs) {
            int dropped = 0;
            while (!entries.isEmpty() && entries.peekFirst().appendedAtMs() < cutoffMs) {
                droppedThrough = entries.removeFirst().record().sequence();
                dropped++;
            }
            return dropped;
        }

        synchronized long lastSequence() {
            return lastSequence;
        }

        synchronized int size() {
            return entries.size();
        }
    }
}
