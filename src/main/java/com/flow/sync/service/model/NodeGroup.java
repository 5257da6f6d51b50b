package com.flow.sync.service.model;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Visual grouping of nodes. Membership is a weak reference: removing a
 * node prunes it from the group.
 */
public record NodeGroup(
        String id,
        String title,
        String description,
        String color,
        boolean collapsed,
        List<String> nodeIds
) {

    public static final String DEFAULT_COLOR = "#3b82f6";

    public NodeGroup {
        nodeIds = nodeIds == null ? List.of() : List.copyOf(new LinkedHashSet<>(nodeIds));
    }

    public boolean contains(String nodeId) {
        return nodeIds.contains(nodeId);
    }

    public NodeGroup withoutNode(String nodeId) {
        return new NodeGroup(id, title, description, color, collapsed,
                nodeIds.stream().filter(member -> !member.equals(nodeId)).toList());
    }
}
