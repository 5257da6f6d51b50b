package com.flow.sync.service.model;

/**
 * One end of a connection: a port on a node.
 */
public record Endpoint(String nodeId, String portId) {
}
