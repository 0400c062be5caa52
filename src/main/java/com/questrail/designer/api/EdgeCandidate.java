package com.questrail.designer.api;

import java.util.Objects;
import java.util.Optional;

/**
 * EdgeCandidate
 * -----------------------------------------------------------------------------
 * A proposed connection between two nodes, before it has been admitted into a
 * document and given an edge id.
 *
 * The {@code (sourceNodeId, sourceHandle, targetNodeId, targetHandle)} tuple is
 * the identity used for duplicate detection. Handles name block ports; they are
 * {@code null} for signal and protocol nodes, which expose a single unnamed port.
 */
public record EdgeCandidate(String sourceNodeId,
                            String sourceHandle,
                            String targetNodeId,
                            String targetHandle)
{
    public EdgeCandidate {
        Objects.requireNonNull(sourceNodeId, "sourceNodeId");
        Objects.requireNonNull(targetNodeId, "targetNodeId");
    }

    public static EdgeCandidate of(String sourceNodeId, String targetNodeId) {
        return new EdgeCandidate(sourceNodeId, null, targetNodeId, null);
    }

    public static EdgeCandidate of(String sourceNodeId, String sourceHandle,
                                   String targetNodeId, String targetHandle) {
        return new EdgeCandidate(sourceNodeId, sourceHandle, targetNodeId, targetHandle);
    }

    public Optional<String> sourceHandleName() {
        return Optional.ofNullable(sourceHandle);
    }

    public Optional<String> targetHandleName() {
        return Optional.ofNullable(targetHandle);
    }

    /**
     * Admits this candidate as an edge with the given id.
     */
    public Edge toEdge(String id) {
        return new Edge(id, sourceNodeId, sourceHandle, targetNodeId, targetHandle);
    }
}
