package com.questrail.designer.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Document
 * -----------------------------------------------------------------------------
 * The unit of persistence: a node set and an edge set describing one
 * configuration.
 *
 * <h2>Invariants</h2>
 * A well-formed document satisfies:
 * <ul>
 *   <li>every edge endpoint references an existing node</li>
 *   <li>no two edges share the same endpoint tuple</li>
 *   <li>edges touching a block use only that block's declared port names</li>
 *   <li>canonical signal names are unique (checked by the configuration generator)</li>
 * </ul>
 *
 * This record does not enforce those invariants on construction, because the
 * editor and the parser legitimately hold intermediate values. Well-formedness
 * is checked by {@code DocumentValidator} and enforced by the store on every
 * committed mutation.
 *
 * Lists are defensive copies and preserve insertion order.
 */
public record Document(List<Node> nodes, List<Edge> edges)
{
    public static final Document EMPTY = new Document(List.of(), List.of());

    public Document {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        edges = List.copyOf(Objects.requireNonNull(edges, "edges"));
    }

    public static Document of(List<Node> nodes, List<Edge> edges) {
        return new Document(nodes, edges);
    }

    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty();
    }

    public Optional<Node> findNode(String id) {
        for (Node n : nodes) {
            if (n.id().equals(id)) {
                return Optional.of(n);
            }
        }
        return Optional.empty();
    }

    public Optional<Edge> findEdge(String id) {
        for (Edge e : edges) {
            if (e.id().equals(id)) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    public List<Node> nodesOfKind(NodeKind kind) {
        return nodes.stream().filter(n -> n.is(kind)).collect(Collectors.toList());
    }

    public List<Edge> edgesTouching(String nodeId) {
        return edges.stream().filter(e -> e.touches(nodeId)).collect(Collectors.toList());
    }
}
