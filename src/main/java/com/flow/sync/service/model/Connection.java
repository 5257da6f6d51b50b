package com.flow.sync.service.model;

/**
 * Directed edge from an output port to an input port.
 */
public record Connection(String id, Endpoint source, Endpoint target) {

    public boolean touches(String nodeId) {
        return source.nodeId().equals(nodeId) || target.nodeId().equals(nodeId);
    }
}
