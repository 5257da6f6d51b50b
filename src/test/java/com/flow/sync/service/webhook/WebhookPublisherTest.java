package com.flow.sync.service.webhook;

import com.flow.sync.service.change.ChangePayload;
import com.flow.sync.service.change.ChangeRecord;
import com.flow.sync.service.change.ChangeType;
import com.flow.sync.service.config.MetricsConfig;
import com.flow.sync.service.config.WebhookConfig;
import com.flow.sync.service.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WebhookPublisherTest {

    private MockRestServiceServer server;
    private RestClient restClient;
    private WebhookConfig webhookConfig;
    private MetricsConfig metricsConfig;
    private MutableClock clock;
    private WebhookTargetRegistry targetRegistry;

    @BeforeEach
    void setUp() {
        var builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).ignoreExpectOrder(true).build();
        restClient = builder.build();

        webhookConfig = new WebhookConfig();
        webhookConfig.setEnabled(true);
        webhookConfig.setMaxRetries(2);
        webhookConfig.setRetryDelayMs(0);
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        clock = MutableClock.startingNow();
        targetRegistry = new WebhookTargetRegistry(webhookConfig, clock);
    }

    @Test
    void groupRemoved_postedOnlyToSubscribedTargets() {
        targetRegistry.register("all", "http://hooks.test/all", List.of("*"), Map.of("Authorization", "Bearer t"));
        targetRegistry.register("groups", "http://hooks.test/groups", List.of("group.*"), null);
        targetRegistry.register("nodes", "http://hooks.test/nodes", List.of("node.added"), null);

        server.expect(ExpectedCount.once(), requestTo("http://hooks.test/all"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(WebhookPublisher.WEBHOOK_ID_HEADER, "all"))
                .andExpect(header("Authorization", "Bearer t"))
                .andExpect(jsonPath("$.webhookId").value("all"))
                .andExpect(jsonPath("$.events[0].type").value("group.removed"))
                .andExpect(jsonPath("$.events[0].id").value("wf-1:7"))
                .andExpect(jsonPath("$.events[0].sequence").value(7))
                .andExpect(jsonPath("$.events[0].data.groupId").value("g-7"))
                .andRespond(withSuccess());
        server.expect(ExpectedCount.once(), requestTo("http://hooks.test/groups"))
                .andExpect(header(WebhookPublisher.WEBHOOK_ID_HEADER, "groups"))
                .andRespond(withSuccess());

        publisher(Runnable::run).onChange(groupRemoved(7));

        server.verify();
        assertThat(metricsConfig.getWebhookDeliveries().count()).isEqualTo(2.0);
    }

    @Test
    void receiverDown_retriesThenDropsWithoutThrowing() {
        targetRegistry.register("down", "http://hooks.test/down", null, null);
        server.expect(ExpectedCount.times(3), requestTo("http://hooks.test/down"))
                .andRespond(withServerError());

        assertThatCode(() -> publisher(Runnable::run).onChange(groupRemoved(1))).doesNotThrowAnyException();

        server.verify();
        assertThat(metricsConfig.getWebhookFailures().count()).isEqualTo(1.0);
        assertThat(metricsConfig.getWebhookDeliveries().count()).isZero();
    }

    @Test
    void receiverRecovering_deliveredOnRetry() {
        var builder = RestClient.builder();
        var ordered = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
        targetRegistry.register("flaky", "http://hooks.test/flaky", null, null);
        ordered.expect(ExpectedCount.once(), requestTo("http://hooks.test/flaky")).andRespond(withServerError());
        ordered.expect(ExpectedCount.once(), requestTo("http://hooks.test/flaky")).andRespond(withSuccess());

        publisher(Runnable::run).onChange(groupRemoved(1));

        ordered.verify();
        assertThat(metricsConfig.getWebhookDeliveries().count()).isEqualTo(1.0);
        assertThat(metricsConfig.getWebhookFailures().count()).isZero();
    }

    @Test
    void saturatedExecutor_dropsEventWithoutThrowing() {
        targetRegistry.register("all", "http://hooks.test/all", null, null);
        Executor saturated = task -> {
            throw new RejectedExecutionException("queue full");
        };

        assertThatCode(() -> publisher(saturated).onChange(groupRemoved(1))).doesNotThrowAnyException();

        server.verify();
        assertThat(metricsConfig.getWebhookFailures().count()).isEqualTo(1.0);
    }

    @Test
    void disabledWebhooks_postNothing() {
        webhookConfig.setEnabled(false);
        targetRegistry.register("all", "http://hooks.test/all", null, null);

        publisher(Runnable::run).onChange(groupRemoved(1));

        server.verify();
        assertThat(metricsConfig.getWebhookDeliveries().count()).isZero();
    }

    @Test
    void eventType_usesDottedChangeName() {
        assertThat(WebhookEvent.eventType(ChangeType.NODE_ADDED)).isEqualTo("node.added");
        assertThat(WebhookEvent.eventType(ChangeType.CONNECTION_REMOVED)).isEqualTo("connection.removed");
        assertThat(WebhookEvent.eventType(ChangeType.CANVAS_UPDATED)).isEqualTo("canvas.updated");
    }

    private WebhookPublisher publisher(Executor executor) {
        return new WebhookPublisher(targetRegistry, restClient, executor, webhookConfig, metricsConfig, clock);
    }

    private ChangeRecord groupRemoved(long sequence) {
        return new ChangeRecord("wf-1", "main", sequence, Instant.EPOCH,
                ChangeType.GROUP_REMOVED, new ChangePayload.GroupRemoved("g-" + sequence));
    }
}
