package com.questrail.designer.core;

import com.questrail.designer.api.Document;
import com.questrail.designer.api.Edge;
import com.questrail.designer.api.EdgeCandidate;
import com.questrail.designer.api.Node;
import com.questrail.designer.api.NodeKind;
import com.questrail.designer.api.NodePayload;
import com.questrail.designer.api.Position;
import com.questrail.designer.codec.ConfigGenerationException;
import com.questrail.designer.codec.ConfigGenerator;
import com.questrail.designer.codec.ConfigParseException;
import com.questrail.designer.codec.ConfigParser;
import com.questrail.designer.codec.ParsedDiagram;
import com.questrail.designer.config.DiagramStoreConfig;
import com.questrail.designer.internal.events.DiagramAction;
import com.questrail.designer.internal.state.DiagramHistory;
import com.questrail.designer.internal.state.DiagramReducer;
import com.questrail.designer.internal.state.DiagramState;
import com.questrail.designer.observability.DiagramErrorEvent;
import com.questrail.designer.observability.DiagramObservabilitySink;
import com.questrail.designer.observability.DiagramRejectionEvent;
import com.questrail.designer.observability.DiagramTransitionEvent;
import com.questrail.designer.validation.DocumentValidator;
import com.questrail.designer.validation.FieldValidator;
import com.questrail.designer.validation.ValidationResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * DiagramStore
 * -----------------------------------------------------------------------------
 * Owner of one diagram document and the single entry point for changing it.
 *
 * <h2>Role in the architecture</h2>
 * The store turns each public operation into a {@link DiagramAction}, applies it
 * through the pure {@link DiagramReducer}, and commits the result:
 * <pre>
 *   operation → DiagramAction → DiagramReducer → commit
 *                                                  ├─ DiagramHistory (undo/redo)
 *                                                  ├─ DiagramObservabilitySink
 *                                                  └─ DiagramListener
 * </pre>
 *
 * <h2>Atomicity</h2>
 * Every mutation either commits a complete new state or is rejected with the
 * state untouched. Rejections are returned as {@link MutationResult} values
 * carrying the validator's message; they are not thrown.
 *
 * <h2>Imports</h2>
 * {@link #importText(String)} and {@link #importFile(Path)} parse first and
 * commit through a single {@code load}. Read and parse failures are reported
 * as {@link ValidationResult.ErrorKind#PARSE} rejections and to the
 * observability sink; they are not retried.
 *
 * <h2>Threading</h2>
 * Not thread-safe. A store is meant to be driven from one thread, one
 * operation at a time; listeners run synchronously on that thread.
 */
public final class DiagramStore
{
    private final DiagramStoreConfig config;
    private final DiagramReducer reducer;
    private final FieldValidator fieldValidator;
    private final DocumentValidator documentValidator;
    private final ConfigGenerator generator;
    private final ConfigParser parser;
    private final DiagramImporter importer;
    private final DiagramObservabilitySink sink;
    private final List<DiagramListener> listeners = new CopyOnWriteArrayList<>();

    private DiagramState state = DiagramState.EMPTY;
    private DiagramHistory history;

    public DiagramStore() {
        this(DiagramStoreConfig.defaults());
    }

    public DiagramStore(DiagramStoreConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.fieldValidator = new FieldValidator();
        this.documentValidator = new DocumentValidator(fieldValidator);
        this.reducer = new DiagramReducer(config.connectionValidator(), fieldValidator,
                config.enforceFieldValidation());
        this.generator = new ConfigGenerator(config.generatorSettings());
        this.parser = new ConfigParser(config.generatorSettings());
        this.importer = new DiagramImporter(parser);
        this.sink = config.observabilitySink();
        this.history = DiagramHistory.start(config.historyCapacity(), Document.EMPTY);
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public DiagramState state() {
        return state;
    }

    public Document document() {
        return state.document();
    }

    public List<Node> nodes() {
        return state.document().nodes();
    }

    public List<Edge> edges() {
        return state.document().edges();
    }

    public Optional<Node> selectedNode() {
        return state.selection().flatMap(state.document()::findNode);
    }

    public DiagramStoreConfig config() {
        return config;
    }

    // ---------------------------------------------------------------------
    // Node mutations
    // ---------------------------------------------------------------------

    /**
     * Adds a node of {@code kind} with its default payload.
     */
    public MutationResult addNode(NodeKind kind, Position position) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(position, "position");
        String id = config.idGenerator().nextNodeId(kind);
        return dispatch(new DiagramAction.AddNode(new Node(id, position, NodeDefaults.payloadFor(kind))), id);
    }

    /**
     * Adds a block of {@code blockType} with the catalog's ports and params.
     */
    public MutationResult addBlock(String blockType, Position position) {
        Objects.requireNonNull(blockType, "blockType");
        Objects.requireNonNull(position, "position");
        String id = config.idGenerator().nextNodeId(NodeKind.BLOCK);
        return dispatch(new DiagramAction.AddNode(new Node(id, position, NodeDefaults.block(blockType))), id);
    }

    /**
     * Adds a fully specified node. Its id must not already be in use.
     */
    public MutationResult addNode(Node node) {
        Objects.requireNonNull(node, "node");
        return dispatch(new DiagramAction.AddNode(node), node.id());
    }

    /**
     * Replaces the payload of {@code nodeId} with {@code patch} applied to the
     * current one. The payload kind cannot change. Edges attached to block ports
     * the patch removes are deleted in the same step.
     */
    public MutationResult updatePayload(String nodeId, UnaryOperator<NodePayload> patch) {
        return dispatch(new DiagramAction.UpdatePayload(nodeId, patch), null);
    }

    /**
     * Switches a block to {@code blockType}, re-templating ports and resetting
     * params from {@link BlockCatalog}.
     */
    public MutationResult changeBlockType(String nodeId, String blockType) {
        BlockCatalog.Template t = BlockCatalog.templateFor(blockType);
        return dispatch(new DiagramAction.ChangeBlockType(nodeId, t.blockType(), t.inputs(), t.outputs(),
                t.params()), null);
    }

    public MutationResult moveNode(String nodeId, Position position) {
        return dispatch(new DiagramAction.MoveNode(nodeId, position), null);
    }

    /**
     * Deletes {@code nodeId} and every edge touching it.
     */
    public MutationResult deleteNode(String nodeId) {
        return dispatch(new DiagramAction.DeleteNode(nodeId), null);
    }

    // ---------------------------------------------------------------------
    // Edge mutations
    // ---------------------------------------------------------------------

    /**
     * Admits {@code candidate} if the connection validator accepts it.
     */
    public MutationResult connect(EdgeCandidate candidate) {
        Objects.requireNonNull(candidate, "candidate");
        String id = config.idGenerator().nextEdgeId();
        return dispatch(new DiagramAction.Connect(candidate, id), id);
    }

    public MutationResult deleteEdge(String edgeId) {
        return dispatch(new DiagramAction.DeleteEdge(edgeId), null);
    }

    // ---------------------------------------------------------------------
    // Whole document
    // ---------------------------------------------------------------------

    public MutationResult clear() {
        return dispatch(new DiagramAction.Clear(), null);
    }

    /**
     * Replaces the document. Rejected unless the document is structurally
     * sound: unique ids, resolvable edges, declared handles, no duplicate edges.
     */
    public MutationResult load(Document document) {
        return dispatch(new DiagramAction.Load(document), null);
    }

    public MutationResult load(List<Node> nodes, List<Edge> edges) {
        return load(new Document(nodes, edges));
    }

    // ---------------------------------------------------------------------
    // Selection
    // ---------------------------------------------------------------------

    public MutationResult select(String nodeId) {
        Objects.requireNonNull(nodeId, "nodeId");
        return dispatch(new DiagramAction.Select(nodeId), null);
    }

    public MutationResult clearSelection() {
        return dispatch(new DiagramAction.Select(null), null);
    }

    // ---------------------------------------------------------------------
    // History
    // ---------------------------------------------------------------------

    public boolean canUndo() {
        return history.canUndo();
    }

    public boolean canRedo() {
        return history.canRedo();
    }

    /**
     * Steps back one committed document. Returns false when there is nothing
     * to undo. The selection is cleared.
     */
    public boolean undo() {
        Optional<DiagramHistory> previous = history.undo();
        if (previous.isEmpty()) {
            return false;
        }
        history = previous.get();
        dispatch(new DiagramAction.Restore(history.current()), null);
        return true;
    }

    /**
     * Steps forward one committed document. Returns false when there is
     * nothing to redo. The selection is cleared.
     */
    public boolean redo() {
        Optional<DiagramHistory> next = history.redo();
        if (next.isEmpty()) {
            return false;
        }
        history = next.get();
        dispatch(new DiagramAction.Restore(history.current()), null);
        return true;
    }

    // ---------------------------------------------------------------------
    // Codec
    // ---------------------------------------------------------------------

    /**
     * Generates configuration text for the current document.
     *
     * @throws ConfigGenerationException if two signals share a canonical name
     */
    public String generate() {
        try {
            return generator.generate(state.document());
        } catch (ConfigGenerationException e) {
            sink.onError(new DiagramErrorEvent(config.wallClock().now(), e.getMessage(), e));
            throw e;
        }
    }

    /**
     * Parses {@code text} without changing the store.
     *
     * @throws ConfigParseException if the text is malformed
     */
    public ParsedDiagram parse(String text) {
        return parser.parse(text);
    }

    /**
     * Parses {@code text} and, if that succeeds, replaces the document with the
     * result. On failure the store is unchanged.
     */
    public MutationResult importText(String text) {
        ParsedDiagram parsed;
        try {
            parsed = importer.importText(text);
        } catch (ConfigParseException e) {
            return importFailed("Import failed: " + e.getMessage(), e);
        }
        return commitImport(parsed);
    }

    /**
     * Reads {@code path} as UTF-8 configuration text and imports it. On read or
     * parse failure the store is unchanged.
     */
    public MutationResult importFile(Path path) {
        Objects.requireNonNull(path, "path");
        ParsedDiagram parsed;
        try {
            parsed = importer.importFile(path);
        } catch (IOException e) {
            return importFailed("Import failed: cannot read " + path + ": " + e.getMessage(), e);
        } catch (ConfigParseException e) {
            return importFailed("Import failed: " + e.getMessage(), e);
        }
        return commitImport(parsed);
    }

    private MutationResult commitImport(ParsedDiagram parsed) {
        MutationResult loaded = load(parsed.document());
        return new MutationResult(loaded.outcome(), loaded.state(), null, parsed.diagnostics());
    }

    private MutationResult importFailed(String message, Exception cause) {
        ValidationResult outcome = ValidationResult.failure(ValidationResult.ErrorKind.PARSE, message);
        sink.onError(new DiagramErrorEvent(config.wallClock().now(), message, cause));
        sink.onRejected(new DiagramRejectionEvent(config.wallClock().now(), null, outcome));
        return new MutationResult(outcome, state, null);
    }

    // ---------------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------------

    public ValidationResult validateField(Node node) {
        return fieldValidator.validateFields(node);
    }

    /**
     * Checks a candidate edge against the current document without adding it.
     */
    public ValidationResult validateConnection(EdgeCandidate candidate) {
        Document doc = state.document();
        return config.connectionValidator().validate(candidate, doc.nodes(), doc.edges());
    }

    public DocumentValidator.Report validateDocument() {
        return documentValidator.validate(state.document());
    }

    // ---------------------------------------------------------------------
    // Listeners
    // ---------------------------------------------------------------------

    public DiagramListener.Subscription subscribe(DiagramListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // ---------------------------------------------------------------------
    // Commit path
    // ---------------------------------------------------------------------

    private MutationResult dispatch(DiagramAction action, String createdId) {
        DiagramState before = state;
        DiagramReducer.Result result = reducer.apply(before, action);

        if (!result.applied()) {
            sink.onRejected(new DiagramRejectionEvent(config.wallClock().now(), action, result.outcome()));
            return new MutationResult(result.outcome(), before, null);
        }

        DiagramState after = result.newState();
        state = after;
        if (action.recordsHistory() && !after.document().equals(before.document())) {
            history = history.record(after.document());
        }

        sink.onStateTransition(new DiagramTransitionEvent(config.wallClock().now(), before, after, action));
        for (DiagramListener listener : listeners) {
            try {
                listener.onChange(after);
            } catch (RuntimeException e) {
                sink.onError(new DiagramErrorEvent(config.wallClock().now(),
                        "Diagram listener failed: " + e.getMessage(), e));
            }
        }
        return new MutationResult(ValidationResult.ok(), after, createdId);
    }
}
