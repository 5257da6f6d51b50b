package com.flow.sync.service.mutation;

import java.util.UUID;

/**
 * Generates IDs for entities the caller did not name.
 */
public final class EntityIds {

    private EntityIds() {
    }

    public static String newNodeId() {
        return "node-" + UUID.randomUUID();
    }

    public static String newConnectionId() {
        return "conn-" + UUID.randomUUID();
    }

    public static String newGroupId() {
        return "group-" + UUID.randomUUID();
    }
}
