package com.questrail.designer.internal.ids;

import com.questrail.designer.api.NodeKind;

/**
 * Source of node and edge identifiers for the store.
 *
 * Ids only need to be unique within one document. Tests substitute
 * {@link SequentialIdGenerator} for predictable values.
 */
public interface IdGenerator
{
    String nextNodeId(NodeKind kind);

    String nextEdgeId();
}
