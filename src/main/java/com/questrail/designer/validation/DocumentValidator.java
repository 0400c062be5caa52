package com.questrail.designer.validation;

import com.questrail.designer.api.Document;
import com.questrail.designer.api.Edge;
import com.questrail.designer.api.Node;
import com.questrail.designer.api.NodeKind;
import com.questrail.designer.naming.CanonicalNames;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * DocumentValidator
 * -----------------------------------------------------------------------------
 * Whole-document checks, built from the edge and field rules.
 *
 * <ul>
 *   <li>{@link #validateStructure(Document)} answers "may this document be
 *       committed as a whole?" and is used by the store to gate {@code load}.</li>
 *   <li>{@link #validate(Document)} produces a full report for the operator,
 *       listing every problem rather than stopping at the first.</li>
 * </ul>
 */
public final class DocumentValidator
{
    private final FieldValidator fieldValidator;

    public DocumentValidator() {
        this(new FieldValidator());
    }

    public DocumentValidator(FieldValidator fieldValidator) {
        this.fieldValidator = Objects.requireNonNull(fieldValidator, "fieldValidator");
    }

    /**
     * Summary of a full-document check.
     *
     * @param valid     true when {@code errors} is empty
     * @param nodeCount number of nodes checked
     * @param edgeCount number of edges checked
     * @param errors    every problem found, in document order
     */
    public record Report(boolean valid, int nodeCount, int edgeCount, List<String> errors)
    {
        public Report {
            errors = List.copyOf(errors);
        }
    }

    /**
     * Checks node-id uniqueness, edge-id uniqueness, edge endpoints, declared
     * handles and duplicate endpoint tuples. Returns the first failure found.
     */
    public ValidationResult validateStructure(Document document) {
        Objects.requireNonNull(document, "document");

        Map<String, Node> byId = new HashMap<>();
        for (Node n : document.nodes()) {
            if (byId.put(n.id(), n) != null) {
                return ValidationResult.structural("Duplicate node id: " + n.id());
            }
        }

        Set<String> edgeIds = new HashSet<>();
        Set<Object> tuples = new HashSet<>();
        for (Edge e : document.edges()) {
            if (!edgeIds.add(e.id())) {
                return ValidationResult.structural("Duplicate edge id: " + e.id());
            }
            Node source = byId.get(e.sourceNodeId());
            Node target = byId.get(e.targetNodeId());
            if (source == null || target == null) {
                return ValidationResult.structural(
                        "Edge " + e.id() + " references a missing node");
            }
            ValidationResult handles = ConnectionValidator.checkHandles(source, target, e.endpoints());
            if (handles.isInvalid()) {
                return handles;
            }
            if (!tuples.add(e.endpoints())) {
                return ValidationResult.failure(ValidationResult.ErrorKind.DUPLICATE,
                        ConnectionValidator.ALREADY_EXISTS + ": " + e.id());
            }
        }
        return ValidationResult.ok();
    }

    /**
     * Reports every structural, naming and field problem of {@code document}.
     */
    public Report validate(Document document) {
        Objects.requireNonNull(document, "document");
        List<String> errors = new ArrayList<>();

        if (document.nodes().isEmpty()) {
            errors.add("No blocks in design");
        }

        Map<String, Node> byId = new HashMap<>();
        for (Node n : document.nodes()) {
            if (byId.put(n.id(), n) != null) {
                errors.add("Duplicate node id: " + n.id());
            }
        }

        Set<Object> tuples = new HashSet<>();
        for (Edge e : document.edges()) {
            Node source = byId.get(e.sourceNodeId());
            Node target = byId.get(e.targetNodeId());
            if (source == null || target == null) {
                errors.add("Edge " + e.id() + " references a missing node");
                continue;
            }
            ConnectionValidator.checkHandles(source, target, e.endpoints())
                    .errorMessage()
                    .ifPresent(errors::add);
            if (!tuples.add(e.endpoints())) {
                errors.add(ConnectionValidator.ALREADY_EXISTS + ": " + e.id());
            }
        }

        Map<String, String> signalNames = CanonicalNames.of(document.nodes(), NodeKind.SIGNAL);
        for (String dupe : CanonicalNames.duplicates(signalNames.values())) {
            errors.add("Duplicate signal name: " + dupe);
        }

        for (Node n : document.nodes()) {
            ValidationResult r = fieldValidator.validateFields(n);
            if (r.isInvalid()) {
                errors.add(n.kind() + " '" + n.label() + "': " + r.error());
            }
        }

        return new Report(errors.isEmpty(), document.nodes().size(), document.edges().size(), errors);
    }
}
