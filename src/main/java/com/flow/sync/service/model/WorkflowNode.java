package com.flow.sync.service.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable node of a workflow graph.
 *
 * @param id         unique within its graph
 * @param templateId catalog template the node was created from, or null for ad hoc nodes
 * @param type       node kind used by the editor
 * @param title      display title
 * @param position   canvas coordinates
 * @param properties configured values, keyed by property name
 * @param ports      input and output ports
 * @param metadata   free-form rendering hints (subtitle, icon, variant)
 */
public record WorkflowNode(
        String id,
        String templateId,
        String type,
        String title,
        Position position,
        Map<String, Object> properties,
        List<Port> ports,
        Map<String, Object> metadata
) {

    public WorkflowNode {
        properties = copyOf(properties);
        ports = ports == null ? List.of() : List.copyOf(ports);
        metadata = copyOf(metadata);
    }

    public Optional<Port> findPort(String portId) {
        return ports.stream()
                .filter(port -> port.id().equals(portId))
                .findFirst();
    }

    public WorkflowNode withPosition(Position newPosition) {
        return new WorkflowNode(id, templateId, type, title, newPosition, properties, ports, metadata);
    }

    public WorkflowNode withProperties(Map<String, Object> newProperties) {
        return new WorkflowNode(id, templateId, type, title, position, newProperties, ports, metadata);
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
