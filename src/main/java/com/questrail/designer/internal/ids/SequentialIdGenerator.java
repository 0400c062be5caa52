package com.questrail.designer.internal.ids;

import com.questrail.designer.api.NodeKind;

/**
 * Deterministic {@link IdGenerator}: {@code signal-1}, {@code block-2},
 * {@code edge-3}, ... with a single counter shared by all kinds.
 *
 * Not thread-safe; the store is single-threaded.
 */
public final class SequentialIdGenerator implements IdGenerator
{
    private long next = 1;

    @Override
    public String nextNodeId(NodeKind kind) {
        return kind.wireName() + "-" + (next++);
    }

    @Override
    public String nextEdgeId() {
        return "edge-" + (next++);
    }
}
