package com.flow.sync.service.fanout;

import com.flow.sync.service.change.ChangePayload;
import com.flow.sync.service.change.ChangeRecord;
import com.flow.sync.service.change.ChangeType;
import com.flow.sync.service.config.FlowConfig;
import com.flow.sync.service.config.MetricsConfig;
import com.flow.sync.service.support.CapturingLiveUpdateSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LiveFanoutChannelTest {

    private FlowConfig flowConfig;
    private MetricsConfig metricsConfig;
    private CapturingLiveUpdateSink first;
    private CapturingLiveUpdateSink second;

    @BeforeEach
    void setUp() {
        flowConfig = new FlowConfig();
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        first = new CapturingLiveUpdateSink();
        second = new CapturingLiveUpdateSink();
    }

    @Test
    void failingSink_doesNotBlockOtherSinks() {
        LiveUpdateSink broken = record -> {
            throw new IllegalStateException("socket closed");
        };
        var channel = new LiveFanoutChannel(List.of(first, broken, second), flowConfig, metricsConfig);

        channel.onChange(record(1));
        channel.onChange(record(2));

        assertThat(first.received("wf-1")).extracting(ChangeRecord::sequence).containsExactly(1L, 2L);
        assertThat(second.received("wf-1")).extracting(ChangeRecord::sequence).containsExactly(1L, 2L);
        assertThat(metricsConfig.getFanoutFailures().count()).isEqualTo(2.0);
    }

    @Test
    void disabledFanout_deliversNothing() {
        flowConfig.getFeatures().setLiveFanoutEnabled(false);
        var channel = new LiveFanoutChannel(List.of(first), flowConfig, metricsConfig);

        channel.onChange(record(1));

        assertThat(first.received("wf-1")).isEmpty();
    }

    private ChangeRecord record(long sequence) {
        return new ChangeRecord("wf-1", "main", sequence, Instant.EPOCH,
                ChangeType.GROUP_REMOVED, new ChangePayload.GroupRemoved("g-" + sequence));
    }
}
