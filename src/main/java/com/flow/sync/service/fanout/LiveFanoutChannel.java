package com.flow.sync.service.fanout;

import com.flow.sync.service.change.ChangeRecord;
import com.flow.sync.service.config.FlowConfig;
import com.flow.sync.service.config.MetricsConfig;
import com.flow.sync.service.engine.ChangeRecordListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pushes every committed change record to the registered live sinks.
 *
 * One failing sink does not prevent delivery to the others.
 */
@Slf4j
@Component
public class LiveFanoutChannel implements ChangeRecordListener {

    private final List<LiveUpdateSink> sinks;
    private final FlowConfig flowConfig;
    private final MetricsConfig metricsConfig;

    public LiveFanoutChannel(List<LiveUpdateSink> sinks, FlowConfig flowConfig, MetricsConfig metricsConfig) {
        this.sinks = List.copyOf(sinks);
        this.flowConfig = flowConfig;
        this.metricsConfig = metricsConfig;
        log.info("LiveFanoutChannel initialized with {} sinks, enabled: {}",
                this.sinks.size(), flowConfig.getFeatures().isLiveFanoutEnabled());
    }

    @Override
    public void onChange(ChangeRecord record) {
        if (!flowConfig.getFeatures().isLiveFanoutEnabled()) return;

        for (LiveUpdateSink sink : sinks) {
            deliver(sink, record);
        }
    }

    private void deliver(LiveUpdateSink sink, ChangeRecord record) {
        try {
            sink.deliver(record);
        } catch (RuntimeException e) {
            metricsConfig.getFanoutFailures().increment();
            log.warn("Live delivery of {} #{} via {} failed: {}",
                    record.workflowId(), record.sequence(), sink.getClass().getSimpleName(), e.getMessage());
        }
    }
}
