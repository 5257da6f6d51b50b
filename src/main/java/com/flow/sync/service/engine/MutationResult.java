package com.flow.sync.service.engine;

import com.flow.sync.service.change.ChangeRecord;

import java.util.List;

/**
 * Committed mutation: the resulting entity and its sequenced change records.
 */
public record MutationResult<R>(R entity, List<ChangeRecord> changes) {

    public MutationResult {
        changes = List.copyOf(changes);
    }

    public long firstSequence() {
        return changes.isEmpty() ? 0 : changes.get(0).sequence();
    }

    public long lastSequence() {
        return changes.isEmpty() ? 0 : changes.get(changes.size() - 1).sequence();
    }
}
