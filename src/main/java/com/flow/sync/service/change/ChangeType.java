package com.flow.sync.service.change;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a committed change, with its wire name.
 */
public enum ChangeType {
    NODE_ADDED("node-added"),
    NODE_UPDATED("node-updated"),
    NODE_MOVED("node-moved"),
    NODE_REMOVED("node-removed"),
    CONNECTION_ADDED("connection-added"),
    CONNECTION_REMOVED("connection-removed"),
    GROUP_CREATED("group-created"),
    GROUP_UPDATED("group-updated"),
    GROUP_REMOVED("group-removed"),
    GRAPH_CREATED("graph-created"),
    GRAPH_REMOVED("graph-removed"),
    CANVAS_UPDATED("canvas-updated");

    private final String wireName;

    ChangeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
