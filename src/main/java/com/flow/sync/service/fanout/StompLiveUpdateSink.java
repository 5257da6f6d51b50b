package com.flow.sync.service.fanout;

import com.flow.sync.service.change.ChangeRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes change records to STOMP subscribers of
 * {@code /topic/workflows/{workflowId}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompLiveUpdateSink implements LiveUpdateSink {

    static final String TOPIC_PREFIX = "/topic/workflows/";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void deliver(ChangeRecord record) {
        messagingTemplate.convertAndSend(TOPIC_PREFIX + record.workflowId(), record);
        log.debug("Published {} #{} to {}{}",
                record.opType().getWireName(), record.sequence(), TOPIC_PREFIX, record.workflowId());
    }
}
