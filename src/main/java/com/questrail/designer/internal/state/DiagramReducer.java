package com.questrail.designer.internal.state;

import com.questrail.designer.api.BlockPayload;
import com.questrail.designer.api.Document;
import com.questrail.designer.api.Edge;
import com.questrail.designer.api.Node;
import com.questrail.designer.api.NodePayload;
import com.questrail.designer.internal.events.DiagramAction;
import com.questrail.designer.validation.ConnectionValidator;
import com.questrail.designer.validation.DocumentValidator;
import com.questrail.designer.validation.FieldValidator;
import com.questrail.designer.validation.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DiagramReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic transition function for diagram state.
 *
 * <h2>Role in the architecture</h2>
 * Given a prior {@link DiagramState} and one {@link DiagramAction}, the reducer
 * computes either a complete new state or a rejection. It never returns a
 * partially applied state, which is what makes every store mutation atomic.
 * <ul>
 *   <li>No I/O, no clocks, no listeners</li>
 *   <li>Ids come from the action, never from the reducer</li>
 * </ul>
 *
 * <h2>Document invariants maintained</h2>
 * <ul>
 *   <li>Deleting a node removes exactly the edges touching it.</li>
 *   <li>Edges are admitted only through {@link ConnectionValidator}.</li>
 *   <li>A payload change that removes a block port removes the edges attached
 *       to that port in the same transition.</li>
 *   <li>A loaded document must pass {@link DocumentValidator#validateStructure}.</li>
 * </ul>
 */
public final class DiagramReducer
{
    /**
     * Result of applying an action.
     *
     * @param newState the resulting state; the input state when rejected
     * @param outcome  {@link ValidationResult#ok()} when applied, else the reason
     */
    public record Result(DiagramState newState, ValidationResult outcome)
    {
        public Result {
            Objects.requireNonNull(newState, "newState");
            Objects.requireNonNull(outcome, "outcome");
        }

        public boolean applied() {
            return outcome.valid();
        }
    }

    private final ConnectionValidator connectionValidator;
    private final DocumentValidator documentValidator;
    private final FieldValidator fieldValidator;
    private final boolean enforceFieldValidation;

    public DiagramReducer() {
        this(new ConnectionValidator(), new FieldValidator(), false);
    }

    public DiagramReducer(ConnectionValidator connectionValidator,
                          FieldValidator fieldValidator,
                          boolean enforceFieldValidation) {
        this.connectionValidator = Objects.requireNonNull(connectionValidator, "connectionValidator");
        this.fieldValidator = Objects.requireNonNull(fieldValidator, "fieldValidator");
        this.documentValidator = new DocumentValidator(fieldValidator);
        this.enforceFieldValidation = enforceFieldValidation;
    }

    /**
     * Applies a single action to the current state.
     *
     * @param state  the current state (must not be {@code null})
     * @param action the action to apply (must not be {@code null})
     * @return the resulting state and outcome
     */
    public Result apply(DiagramState state, DiagramAction action) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(action, "action");

        if (action instanceof DiagramAction.AddNode a) {
            return onAddNode(state, a);
        }
        if (action instanceof DiagramAction.UpdatePayload a) {
            return onUpdatePayload(state, a);
        }
        if (action instanceof DiagramAction.ChangeBlockType a) {
            return onChangeBlockType(state, a);
        }
        if (action instanceof DiagramAction.MoveNode a) {
            return onMoveNode(state, a);
        }
        if (action instanceof DiagramAction.DeleteNode a) {
            return onDeleteNode(state, a);
        }
        if (action instanceof DiagramAction.Connect a) {
            return onConnect(state, a);
        }
        if (action instanceof DiagramAction.DeleteEdge a) {
            return onDeleteEdge(state, a);
        }
        if (action instanceof DiagramAction.Clear) {
            return applied(DiagramState.EMPTY);
        }
        if (action instanceof DiagramAction.Load a) {
            return onLoad(state, a);
        }
        if (action instanceof DiagramAction.Restore a) {
            return applied(DiagramState.of(a.document()));
        }
        if (action instanceof DiagramAction.Select a) {
            return onSelect(state, a);
        }
        return rejected(state, ValidationResult.structural("Unsupported action: " + action));
    }

    // ---------------------------------------------------------------------
    // Node mutations
    // ---------------------------------------------------------------------

    private Result onAddNode(DiagramState state, DiagramAction.AddNode a) {
        Document doc = state.document();
        Node node = a.node();
        if (doc.findNode(node.id()).isPresent()) {
            return rejected(state, ValidationResult.structural("Duplicate node id: " + node.id()));
        }
        ValidationResult fields = checkFields(node.payload());
        if (fields.isInvalid()) {
            return rejected(state, fields);
        }
        List<Node> nodes = new ArrayList<>(doc.nodes());
        nodes.add(node);
        return applied(state.withDocument(new Document(nodes, doc.edges())));
    }

    private Result onUpdatePayload(DiagramState state, DiagramAction.UpdatePayload a) {
        Node node = state.document().findNode(a.nodeId()).orElse(null);
        if (node == null) {
            return rejected(state, unknownNode(a.nodeId()));
        }

        NodePayload patched;
        try {
            patched = a.patch().apply(node.payload());
        } catch (IllegalArgumentException e) {
            return rejected(state, ValidationResult.structural("Invalid payload update: " + e.getMessage()));
        }
        if (patched == null) {
            return rejected(state, ValidationResult.structural("Invalid payload update: patch returned no payload"));
        }
        return replacePayload(state, node, patched);
    }

    private Result onChangeBlockType(DiagramState state, DiagramAction.ChangeBlockType a) {
        Node node = state.document().findNode(a.nodeId()).orElse(null);
        if (node == null) {
            return rejected(state, unknownNode(a.nodeId()));
        }
        if (!(node.payload() instanceof BlockPayload block)) {
            return rejected(state, ValidationResult.structural("Node " + a.nodeId() + " is not a block"));
        }
        BlockPayload retyped = block.withBlockType(a.blockType())
                .withPorts(a.inputs(), a.outputs())
                .withParams(a.params());
        return replacePayload(state, node, retyped);
    }

    private Result replacePayload(DiagramState state, Node node, NodePayload patched) {
        if (patched.kind() != node.kind()) {
            return rejected(state, ValidationResult.structural(
                    "Payload kind cannot change from " + node.kind() + " to " + patched.kind()));
        }
        ValidationResult fields = checkFields(patched);
        if (fields.isInvalid()) {
            return rejected(state, fields);
        }

        Node updated = node.withPayload(patched);
        Document doc = state.document();
        List<Node> nodes = new ArrayList<>(doc.nodes().size());
        for (Node n : doc.nodes()) {
            nodes.add(n.id().equals(node.id()) ? updated : n);
        }

        // Ports may have been removed; drop edges that lost their handle.
        List<Edge> edges = new ArrayList<>(doc.edges().size());
        for (Edge e : doc.edges()) {
            if (handleStillDeclared(e, updated)) {
                edges.add(e);
            }
        }
        return applied(state.withDocument(new Document(nodes, edges)));
    }

    private Result onMoveNode(DiagramState state, DiagramAction.MoveNode a) {
        Document doc = state.document();
        if (doc.findNode(a.nodeId()).isEmpty()) {
            return rejected(state, unknownNode(a.nodeId()));
        }
        List<Node> nodes = new ArrayList<>(doc.nodes().size());
        for (Node n : doc.nodes()) {
            nodes.add(n.id().equals(a.nodeId()) ? n.withPosition(a.position()) : n);
        }
        return applied(state.withDocument(new Document(nodes, doc.edges())));
    }

    private Result onDeleteNode(DiagramState state, DiagramAction.DeleteNode a) {
        Document doc = state.document();
        if (doc.findNode(a.nodeId()).isEmpty()) {
            return rejected(state, unknownNode(a.nodeId()));
        }
        List<Node> nodes = new ArrayList<>(doc.nodes());
        nodes.removeIf(n -> n.id().equals(a.nodeId()));
        List<Edge> edges = new ArrayList<>(doc.edges());
        edges.removeIf(e -> e.touches(a.nodeId()));
        return applied(state.withDocument(new Document(nodes, edges)));
    }

    // ---------------------------------------------------------------------
    // Edge mutations
    // ---------------------------------------------------------------------

    private Result onConnect(DiagramState state, DiagramAction.Connect a) {
        Document doc = state.document();
        ValidationResult verdict = connectionValidator.validate(a.candidate(), doc.nodes(), doc.edges());
        if (verdict.isInvalid()) {
            return rejected(state, verdict);
        }
        if (doc.findEdge(a.edgeId()).isPresent()) {
            return rejected(state, ValidationResult.structural("Duplicate edge id: " + a.edgeId()));
        }
        List<Edge> edges = new ArrayList<>(doc.edges());
        edges.add(a.candidate().toEdge(a.edgeId()));
        return applied(state.withDocument(new Document(doc.nodes(), edges)));
    }

    private Result onDeleteEdge(DiagramState state, DiagramAction.DeleteEdge a) {
        Document doc = state.document();
        if (doc.findEdge(a.edgeId()).isEmpty()) {
            return rejected(state, ValidationResult.structural("Unknown edge: " + a.edgeId()));
        }
        List<Edge> edges = new ArrayList<>(doc.edges());
        edges.removeIf(e -> e.id().equals(a.edgeId()));
        return applied(state.withDocument(new Document(doc.nodes(), edges)));
    }

    // ---------------------------------------------------------------------
    // Whole-document and selection
    // ---------------------------------------------------------------------

    private Result onLoad(DiagramState state, DiagramAction.Load a) {
        ValidationResult structure = documentValidator.validateStructure(a.document());
        if (structure.isInvalid()) {
            return rejected(state, structure);
        }
        return applied(DiagramState.of(a.document()));
    }

    private Result onSelect(DiagramState state, DiagramAction.Select a) {
        if (a.nodeId() == null) {
            return applied(state.withoutSelection());
        }
        if (state.document().findNode(a.nodeId()).isEmpty()) {
            return rejected(state, unknownNode(a.nodeId()));
        }
        return applied(state.withSelection(a.nodeId()));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private ValidationResult checkFields(NodePayload payload) {
        return enforceFieldValidation ? fieldValidator.validatePayload(payload) : ValidationResult.ok();
    }

    private static boolean handleStillDeclared(Edge e, Node updated) {
        if (!(updated.payload() instanceof BlockPayload block)) {
            return true;
        }
        if (e.sourceNodeId().equals(updated.id()) && !block.hasOutput(e.sourceHandle())) {
            return false;
        }
        return !e.targetNodeId().equals(updated.id()) || block.hasInput(e.targetHandle());
    }

    private static ValidationResult unknownNode(String nodeId) {
        return ValidationResult.structural("Unknown node: " + nodeId);
    }

    private static Result applied(DiagramState state) {
        return new Result(state, ValidationResult.ok());
    }

    private static Result rejected(DiagramState state, ValidationResult outcome) {
        return new Result(state, outcome);
    }
}
