package com.flow.sync.service.mutation;

import java.util.List;

/**
 * Caller-supplied description of a group to create.
 */
public record GroupSpec(
        String id,
        String title,
        String description,
        String color,
        Boolean collapsed,
        List<String> nodeIds
) {

    public GroupSpec withId(String newId) {
        return new GroupSpec(newId, title, description, color, collapsed, nodeIds);
    }
}
