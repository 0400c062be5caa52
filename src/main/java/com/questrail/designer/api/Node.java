package com.questrail.designer.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Node
 * -----------------------------------------------------------------------------
 * A single element of a control-logic diagram.
 *
 * The node's {@link NodeKind} is not stored separately: it is always the kind
 * of its {@link NodePayload}, so a node can never carry a payload of the wrong
 * kind.
 *
 * @param id       document-unique identifier
 * @param position canvas position (editor concern only)
 * @param payload  kind-specific configuration
 */
public record Node(String id, Position position, NodePayload payload)
{
    public Node {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(payload, "payload");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
    }

    public static Node of(String id, NodePayload payload) {
        return new Node(id, Position.ORIGIN, payload);
    }

    public NodeKind kind() {
        return payload.kind();
    }

    public String label() {
        return payload.label();
    }

    public boolean is(NodeKind kind) {
        return payload.kind() == kind;
    }

    /**
     * Returns the payload narrowed to the given variant, if it is of that type.
     */
    public <P extends NodePayload> Optional<P> payloadAs(Class<P> type) {
        return type.isInstance(payload) ? Optional.of(type.cast(payload)) : Optional.empty();
    }

    public Node withPayload(NodePayload payload) {
        return new Node(id, position, payload);
    }

    public Node withPosition(Position position) {
        return new Node(id, position, payload);
    }
}
