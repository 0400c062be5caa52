package com.questrail.designer.observability;

import com.questrail.designer.api.Edge;
import com.questrail.designer.api.Node;
import com.questrail.designer.internal.events.DiagramAction;
import com.questrail.designer.internal.state.DiagramState;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Record representing a committed transition of a diagram store.
 */
public record DiagramTransitionEvent(
    Instant timestamp,
    DiagramState oldState,
    DiagramState newState,
    DiagramAction action
) {
    /**
     * Returns the ids of nodes present after the transition but not before.
     */
    public Set<String> addedNodeIds() {
        Set<String> ids = nodeIds(newState);
        ids.removeAll(nodeIds(oldState));
        return ids;
    }

    /**
     * Returns the ids of nodes present before the transition but not after.
     */
    public Set<String> removedNodeIds() {
        Set<String> ids = nodeIds(oldState);
        ids.removeAll(nodeIds(newState));
        return ids;
    }

    /**
     * Returns the ids of edges present before the transition but not after,
     * including edges removed by a cascade.
     */
    public Set<String> removedEdgeIds() {
        Set<String> ids = edgeIds(oldState);
        ids.removeAll(edgeIds(newState));
        return ids;
    }

    public boolean isSelectionChange() {
        return !oldState.selection().equals(newState.selection());
    }

    private static Set<String> nodeIds(DiagramState state) {
        Set<String> ids = new LinkedHashSet<>();
        for (Node n : state.document().nodes()) {
            ids.add(n.id());
        }
        return ids;
    }

    private static Set<String> edgeIds(DiagramState state) {
        Set<String> ids = new LinkedHashSet<>();
        for (Edge e : state.document().edges()) {
            ids.add(e.id());
        }
        return ids;
    }
}
