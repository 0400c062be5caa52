package com.questrail.designer.validation;

import com.questrail.designer.api.BlockPayload;
import com.questrail.designer.api.Edge;
import com.questrail.designer.api.EdgeCandidate;
import com.questrail.designer.api.Node;
import com.questrail.designer.api.NodeKind;
import com.questrail.designer.api.SignalPayload;
import com.questrail.designer.api.SignalType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ConnectionValidator
 * -----------------------------------------------------------------------------
 * Decides whether a candidate edge may be admitted into a document.
 *
 * <h2>Checks, in order</h2>
 * <ol>
 *   <li>Both endpoints resolve to existing nodes, else {@code "Invalid connection"}
 *       ({@link ValidationResult.ErrorKind#STRUCTURAL}).</li>
 *   <li>No existing edge has the same endpoint tuple, else
 *       {@code "Connection already exists"} ({@link ValidationResult.ErrorKind#DUPLICATE}).</li>
 *   <li>Block endpoints name a declared port of that block
 *       ({@link ValidationResult.ErrorKind#STRUCTURAL}).</li>
 *   <li>The kind-compatibility rule table. The first rule whose source and
 *       target kinds match decides; when no rule matches the edge is admitted.</li>
 * </ol>
 *
 * <h2>Rule table</h2>
 * The default table admits signal→block, block→signal and block→block, and
 * only admits a signal→twilio edge when the signal is {@code bool}. Everything
 * else is admitted by default. Callers that want a stricter editor prepend
 * rules with {@link #withRule(Rule)}; earlier rules take precedence.
 *
 * No cycle detection is performed. Port types are not compared against signal
 * types.
 *
 * Instances are immutable and thread-safe.
 */
public final class ConnectionValidator
{
    public static final String INVALID_CONNECTION = "Invalid connection";
    public static final String ALREADY_EXISTS = "Connection already exists";
    public static final String TWILIO_BOOL_ONLY = "Twilio can only be triggered by bool signals";

    /**
     * One row of the compatibility table.
     *
     * @param sourceKind source kind this row applies to, or {@code null} for any
     * @param targetKind target kind this row applies to, or {@code null} for any
     * @param check      decides admissibility for matching endpoints
     */
    public record Rule(NodeKind sourceKind, NodeKind targetKind, Check check)
    {
        public Rule {
            Objects.requireNonNull(check, "check");
        }

        boolean matches(Node source, Node target) {
            return (sourceKind == null || sourceKind == source.kind())
                    && (targetKind == null || targetKind == target.kind());
        }

        public static Rule admit(NodeKind sourceKind, NodeKind targetKind) {
            return new Rule(sourceKind, targetKind, (s, t, c) -> ValidationResult.ok());
        }

        public static Rule reject(NodeKind sourceKind, NodeKind targetKind, String message) {
            return new Rule(sourceKind, targetKind,
                    (s, t, c) -> ValidationResult.failure(ValidationResult.ErrorKind.INCOMPATIBLE, message));
        }
    }

    @FunctionalInterface
    public interface Check {
        ValidationResult evaluate(Node source, Node target, EdgeCandidate candidate);
    }

    private static final List<Rule> DEFAULT_RULES = List.of(
            Rule.admit(NodeKind.SIGNAL, NodeKind.BLOCK),
            Rule.admit(NodeKind.BLOCK, NodeKind.SIGNAL),
            Rule.admit(NodeKind.BLOCK, NodeKind.BLOCK),
            new Rule(null, NodeKind.TWILIO, ConnectionValidator::checkTwilioTrigger)
    );

    private final List<Rule> rules;

    public ConnectionValidator() {
        this(DEFAULT_RULES);
    }

    private ConnectionValidator(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Returns a validator that consults {@code rule} before the rules of this one.
     */
    public ConnectionValidator withRule(Rule rule) {
        Objects.requireNonNull(rule, "rule");
        List<Rule> combined = new ArrayList<>(rules.size() + 1);
        combined.add(rule);
        combined.addAll(rules);
        return new ConnectionValidator(combined);
    }

    public List<Rule> rules() {
        return rules;
    }

    /**
     * Validates a candidate edge against the given node and edge sets.
     *
     * @param candidate the proposed edge (must not be {@code null})
     * @param nodes     nodes of the document
     * @param edges     edges already admitted
     * @return the validation outcome; never throws for well-formed arguments
     */
    public ValidationResult validate(EdgeCandidate candidate,
                                     Collection<Node> nodes,
                                     Collection<Edge> edges) {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(edges, "edges");

        Optional<Node> source = find(nodes, candidate.sourceNodeId());
        Optional<Node> target = find(nodes, candidate.targetNodeId());
        if (source.isEmpty() || target.isEmpty()) {
            return ValidationResult.structural(INVALID_CONNECTION);
        }

        for (Edge e : edges) {
            if (e.sameEndpointsAs(candidate)) {
                return ValidationResult.failure(ValidationResult.ErrorKind.DUPLICATE, ALREADY_EXISTS);
            }
        }

        ValidationResult handles = checkHandles(source.get(), target.get(), candidate);
        if (handles.isInvalid()) {
            return handles;
        }

        for (Rule rule : rules) {
            if (rule.matches(source.get(), target.get())) {
                return rule.check().evaluate(source.get(), target.get(), candidate);
            }
        }
        return ValidationResult.ok();
    }

    /**
     * Checks that any block endpoint of {@code candidate} names a declared port.
     * Also used by {@link DocumentValidator} for whole-document checks.
     */
    static ValidationResult checkHandles(Node source, Node target, EdgeCandidate candidate) {
        if (source.payload() instanceof BlockPayload block) {
            String handle = candidate.sourceHandle();
            if (handle == null) {
                return ValidationResult.structural(
                        "Output port required when connecting from block '" + source.label() + "'");
            }
            if (!block.hasOutput(handle)) {
                return ValidationResult.structural(
                        "Unknown output port '" + handle + "' on block '" + source.label() + "'");
            }
        }
        if (target.payload() instanceof BlockPayload block) {
            String handle = candidate.targetHandle();
            if (handle == null) {
                return ValidationResult.structural(
                        "Input port required when connecting to block '" + target.label() + "'");
            }
            if (!block.hasInput(handle)) {
                return ValidationResult.structural(
                        "Unknown input port '" + handle + "' on block '" + target.label() + "'");
            }
        }
        return ValidationResult.ok();
    }

    private static ValidationResult checkTwilioTrigger(Node source, Node target, EdgeCandidate candidate) {
        if (source.payload() instanceof SignalPayload signal && signal.signalType() != SignalType.BOOL) {
            return ValidationResult.failure(ValidationResult.ErrorKind.INCOMPATIBLE, TWILIO_BOOL_ONLY);
        }
        return ValidationResult.ok();
    }

    private static Optional<Node> find(Collection<Node> nodes, String id) {
        for (Node n : nodes) {
            if (n.id().equals(id)) {
                return Optional.of(n);
            }
        }
        return Optional.empty();
    }
}
