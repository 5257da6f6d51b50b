package com.flow.sync.service.api.dto;

import com.flow.sync.service.change.ChangeRecord;
import com.flow.sync.service.engine.MutationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Committed entity together with the change records it produced.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MutationResponse<T> {

    private T entity;

    private List<ChangeRecord> changes;

    private long firstSequence;

    private long lastSequence;

    public static <T> MutationResponse<T> from(MutationResult<T> result) {
        return MutationResponse.<T>builder()
                .entity(result.entity())
                .changes(result.changes())
                .firstSequence(result.firstSequence())
                .lastSequence(result.lastSequence())
                .build();
    }
}
