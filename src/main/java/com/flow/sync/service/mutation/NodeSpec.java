package com.flow.sync.service.mutation;

import com.flow.sync.service.model.Port;
import com.flow.sync.service.model.Position;

import java.util.List;
import java.util.Map;

/**
 * Caller-supplied description of a node to add.
 */
public record NodeSpec(
        String id,
        String templateId,
        String type,
        String title,
        Position position,
        Map<String, Object> properties,
        List<Port> ports,
        Map<String, Object> metadata
) {

    public NodeSpec withId(String newId) {
        return new NodeSpec(newId, templateId, type, title, position, properties, ports, metadata);
    }
}
