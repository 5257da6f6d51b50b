package com.flow.sync.service.engine;

import com.flow.sync.service.change.PendingChange;

import java.util.List;

/**
 * Outcome of a successfully applied mutation: the committed entity and the
 * changes it produced, in order, not yet sequenced.
 */
public record AppliedMutation<R>(R result, List<PendingChange> changes) {

    public AppliedMutation {
        changes = List.copyOf(changes);
    }

    public static <R> AppliedMutation<R> of(R result, PendingChange change) {
        return new AppliedMutation<>(result, List.of(change));
    }
}
