package com.questrail.designer.api;

import java.util.Objects;

/**
 * A wire between two nodes of a document.
 *
 * Handles are {@code null} when the endpoint is a signal or protocol node. Two
 * edges are considered duplicates when their {@link #endpoints()} are equal,
 * regardless of id.
 */
public record Edge(String id,
                   String sourceNodeId,
                   String sourceHandle,
                   String targetNodeId,
                   String targetHandle)
{
    public Edge {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceNodeId, "sourceNodeId");
        Objects.requireNonNull(targetNodeId, "targetNodeId");
    }

    public EdgeCandidate endpoints() {
        return new EdgeCandidate(sourceNodeId, sourceHandle, targetNodeId, targetHandle);
    }

    public boolean touches(String nodeId) {
        return sourceNodeId.equals(nodeId) || targetNodeId.equals(nodeId);
    }

    public boolean sameEndpointsAs(EdgeCandidate candidate) {
        return endpoints().equals(candidate);
    }

    /**
     * Returns true if this edge enters {@code nodeId} at {@code handle}.
     */
    public boolean entersAt(String nodeId, String handle) {
        return targetNodeId.equals(nodeId) && Objects.equals(targetHandle, handle);
    }

    /**
     * Returns true if this edge leaves {@code nodeId} at {@code handle}.
     */
    public boolean leavesAt(String nodeId, String handle) {
        return sourceNodeId.equals(nodeId) && Objects.equals(sourceHandle, handle);
    }
}
