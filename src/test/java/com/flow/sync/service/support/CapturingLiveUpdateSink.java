package com.flow.sync.service.support;

import com.flow.sync.service.change.ChangeRecord;
import com.flow.sync.service.fanout.LiveUpdateSink;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Live sink that records every delivered change per workflow.
 */
public class CapturingLiveUpdateSink implements LiveUpdateSink {

    private final Map<String, List<ChangeRecord>> received = new ConcurrentHashMap<>();

    @Override
    public void deliver(ChangeRecord record) {
        received.computeIfAbsent(record.workflowId(), id -> new CopyOnWriteArrayList<>()).add(record);
    }

    public List<ChangeRecord> received(String workflowId) {
        return List.copyOf(received.getOrDefault(workflowId, List.of()));
    }
}
