package com.questrail.designer.internal.ids;

import com.questrail.designer.api.NodeKind;

import java.util.UUID;

/**
 * Production {@link IdGenerator} backed by random UUIDs, prefixed with the node
 * kind so ids stay readable in logs.
 */
public enum RandomIdGenerator implements IdGenerator {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public String nextNodeId(NodeKind kind) {
        return kind.wireName() + "-" + UUID.randomUUID();
    }

    @Override
    public String nextEdgeId() {
        return "edge-" + UUID.randomUUID();
    }
}
