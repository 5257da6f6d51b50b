package com.flow.sync.service.mutation;

import java.util.List;

/**
 * Partial group update. Null fields are left untouched; a non-null
 * {@code nodeIds} replaces the membership set.
 */
public record GroupPatch(
        String title,
        String description,
        String color,
        Boolean collapsed,
        List<String> nodeIds
) {

    public boolean isEmpty() {
        return title == null && description == null && color == null
                && collapsed == null && nodeIds == null;
    }
}
