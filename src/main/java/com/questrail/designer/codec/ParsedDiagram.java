package com.questrail.designer.codec;

import com.questrail.designer.api.Document;
import com.questrail.designer.api.Edge;
import com.questrail.designer.api.Node;

import java.util.List;
import java.util.Objects;

/**
 * Result of parsing configuration text.
 *
 * @param document    the reconstructed nodes and edges
 * @param diagnostics one message per reference or value the parser dropped;
 *                    empty when the text was fully represented
 */
public record ParsedDiagram(Document document, List<String> diagnostics)
{
    public ParsedDiagram {
        Objects.requireNonNull(document, "document");
        diagnostics = List.copyOf(diagnostics);
    }

    public List<Node> nodes() {
        return document.nodes();
    }

    public List<Edge> edges() {
        return document.edges();
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
