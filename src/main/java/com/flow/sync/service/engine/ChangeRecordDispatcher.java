package com.flow.sync.service.engine;

import com.flow.sync.service.change.ChangeRecord;
import com.flow.sync.service.config.MetricsConfig;
import com.flow.sync.service.pending.PendingUpdateLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Single ordered stream of committed change records.
 *
 * The pending update log is fed first, then every other listener, so polling
 * and live delivery observe the same order. Failures are logged and counted
 * and never reach the committing actor.
 */
@Slf4j
@Component
public class ChangeRecordDispatcher {

    private final PendingUpdateLog pendingUpdateLog;
    private final List<ChangeRecordListener> listeners;
    private final MetricsConfig metricsConfig;

    public ChangeRecordDispatcher(PendingUpdateLog pendingUpdateLog,
                                  List<ChangeRecordListener> listeners,
                                  MetricsConfig metricsConfig) {
        this.pendingUpdateLog = pendingUpdateLog;
        this.listeners = List.copyOf(listeners);
        this.metricsConfig = metricsConfig;
        log.info("ChangeRecordDispatcher initialized with {} listeners", this.listeners.size());
    }

    public void dispatch(List<ChangeRecord> records) {
        records.forEach(this::dispatch);
    }

    public void dispatch(ChangeRecord record) {
        appendToLog(record);
        listeners.forEach(listener -> notifyListener(listener, record));
    }

    private void appendToLog(ChangeRecord record) {
        try {
            pendingUpdateLog.append(record);
        } catch (RuntimeException e) {
            metricsConfig.getLogAppendFailures().increment();
            log.error("Failed to append change {} #{} to the pending update log",
                    record.workflowId(), record.sequence(), e);
        }
    }

    private void notifyListener(ChangeRecordListener listener, ChangeRecord record) {
        try {
            listener.onChange(record);
        } catch (RuntimeException e) {
            metricsConfig.getFanoutFailures().increment();
            log.error("Listener {} failed on change {} #{}",
                    listener.getClass().getSimpleName(), record.workflowId(), record.sequence(), e);
        }
    }
}
