package com.questrail.designer.internal.state;

import com.questrail.designer.api.Document;

import java.util.Objects;
import java.util.Optional;

/**
 * DiagramState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of what a diagram store holds: the committed document and
 * the selected node.
 *
 * <h2>Invariant</h2>
 * A selection always resolves to a node of {@link #document()}. Use
 * {@link #withDocument(Document)} to replace the document; it drops a
 * selection that no longer resolves.
 */
public final class DiagramState
{
    public static final DiagramState EMPTY = new DiagramState(Document.EMPTY, null);

    private final Document document;
    private final String selectedNodeId;

    private DiagramState(Document document, String selectedNodeId) {
        this.document = Objects.requireNonNull(document, "document");
        this.selectedNodeId = selectedNodeId;
    }

    public static DiagramState of(Document document) {
        return new DiagramState(document, null);
    }

    public Document document() {
        return document;
    }

    public Optional<String> selection() {
        return Optional.ofNullable(selectedNodeId);
    }

    // ---------------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------------

    public DiagramState withDocument(Document document) {
        String keep = selectedNodeId != null && document.findNode(selectedNodeId).isPresent()
                ? selectedNodeId
                : null;
        return new DiagramState(document, keep);
    }

    /**
     * @throws IllegalArgumentException if {@code nodeId} is not in the document
     */
    public DiagramState withSelection(String nodeId) {
        if (nodeId != null && document.findNode(nodeId).isEmpty()) {
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        }
        return new DiagramState(document, nodeId);
    }

    public DiagramState withoutSelection() {
        return selectedNodeId == null ? this : new DiagramState(document, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiagramState other)) return false;
        return document.equals(other.document) && Objects.equals(selectedNodeId, other.selectedNodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(document, selectedNodeId);
    }

    @Override
    public String toString() {
        return "DiagramState[nodes=" + document.nodes().size()
                + ", edges=" + document.edges().size()
                + ", selection=" + selectedNodeId + "]";
    }
}
