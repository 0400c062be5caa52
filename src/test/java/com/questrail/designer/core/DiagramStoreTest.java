package com.questrail.designer.core;

import com.questrail.designer.api.BlockPayload;
import com.questrail.designer.api.DiagramFixtures;
import com.questrail.designer.api.Document;
import com.questrail.designer.api.EdgeCandidate;
import com.questrail.designer.api.NodeKind;
import com.questrail.designer.api.Position;
import com.questrail.designer.api.SignalPayload;
import com.questrail.designer.api.TwilioPayload;
import com.questrail.designer.codec.ConfigGenerationException;
import com.questrail.designer.config.DiagramStoreConfig;
import com.questrail.designer.internal.events.DiagramAction;
import com.questrail.designer.internal.ids.SequentialIdGenerator;
import com.questrail.designer.internal.state.DiagramState;
import com.questrail.designer.internal.time.ManualWallClock;
import com.questrail.designer.observability.DiagramRejectionEvent;
import com.questrail.designer.observability.DiagramTransitionEvent;
import com.questrail.designer.observability.RecordingObservabilitySink;
import com.questrail.designer.validation.ConnectionValidator;
import com.questrail.designer.validation.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DiagramStoreTest
 * -----------------------------------------------------------------------------
 * Store-level behavior: id assignment, commit and rejection paths, undo/redo,
 * imports, listeners and observability.
 *
 * Ids are sequential and time is manual so every assertion is deterministic.
 */
class DiagramStoreTest
{
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private RecordingObservabilitySink sink;
    private ManualWallClock clock;
    private DiagramStore store;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        clock = new ManualWallClock(T0);
        store = newStore(DiagramStoreConfig.builder());
    }

    private DiagramStore newStore(DiagramStoreConfig.Builder builder) {
        return new DiagramStore(builder
                .withObservabilitySink(sink)
                .withIdGenerator(new SequentialIdGenerator())
                .withWallClock(clock)
                .build());
    }

    /**
     * signal-1 wired into input {@code a} of ADD block-2 via edge-3.
     */
    private void buildSignalIntoAdder() {
        assertTrue(store.addNode(NodeKind.SIGNAL, Position.ORIGIN).applied());
        assertTrue(store.addBlock("ADD", Position.of(300, 0)).applied());
        assertTrue(store.connect(EdgeCandidate.of("signal-1", null, "block-2", "a")).applied());
    }

    // ---------------------------------------------------------------------
    // Node and edge mutations
    // ---------------------------------------------------------------------

    @Test
    void addNodeAssignsIdAndDefaultPayload() {
        MutationResult result = store.addNode(NodeKind.SIGNAL, Position.of(10, 20));

        assertTrue(result.applied());
        assertEquals("signal-1", result.created().orElseThrow());
        assertEquals("New Signal", store.nodes().get(0).label());
        assertEquals(Position.of(10, 20), store.nodes().get(0).position());
    }

    @Test
    void addBlockUsesCatalogTemplate() {
        store.addBlock("pid", Position.ORIGIN);

        BlockPayload block = (BlockPayload) store.nodes().get(0).payload();
        assertEquals("New PID", block.label());
        assertEquals("pid", block.blockType());
        assertTrue(block.hasInput("setpoint"));
        assertEquals(Optional.of(1.0), block.param("kp"));
    }

    @Test
    void connectAssignsEdgeId() {
        buildSignalIntoAdder();

        assertEquals(1, store.edges().size());
        assertEquals("edge-3", store.edges().get(0).id());
    }

    @Test
    void duplicateConnectionIsRejectedAndStateUnchanged() {
        buildSignalIntoAdder();
        DiagramState before = store.state();

        MutationResult result = store.connect(EdgeCandidate.of("signal-1", null, "block-2", "a"));

        assertFalse(result.applied());
        assertEquals(ConnectionValidator.ALREADY_EXISTS, result.error().orElseThrow());
        assertTrue(result.created().isEmpty());
        assertSame(before, store.state());
        assertEquals(1, sink.getRejections().size());
    }

    @Test
    void deletingNodeCascadesToItsEdges() {
        buildSignalIntoAdder();

        assertTrue(store.deleteNode("signal-1").applied());

        assertEquals(1, store.nodes().size());
        assertTrue(store.edges().isEmpty());
        DiagramTransitionEvent last = sink.getStateTransitions().get(sink.getStateTransitions().size() - 1);
        assertEquals(Set.of("signal-1"), last.removedNodeIds());
        assertEquals(Set.of("edge-3"), last.removedEdgeIds());
    }

    @Test
    void changingBlockTypeRemovesEdgesOnVanishedPorts() {
        buildSignalIntoAdder();

        assertTrue(store.changeBlockType("block-2", "NOT").applied());

        BlockPayload block = (BlockPayload) store.document().findNode("block-2").orElseThrow().payload();
        assertEquals("NOT", block.blockType());
        assertTrue(block.hasInput("in"));
        assertTrue(store.edges().isEmpty());
    }

    @Test
    void updatePayloadOnUnknownNodeIsRejected() {
        MutationResult result = store.updatePayload("ghost", p -> p.withLabel("x"));
        assertFalse(result.applied());
        assertEquals("Unknown node: ghost", result.error().orElseThrow());
    }

    @Test
    void fieldEnforcementRejectsBadEdits() {
        store = newStore(DiagramStoreConfig.builder().withEnforceFieldValidation(true));
        String id = store.addNode(NodeKind.TWILIO, Position.ORIGIN).created().orElseThrow();

        MutationResult result = store.updatePayload(id, p -> ((TwilioPayload) p).withToNumber("555"));

        assertFalse(result.applied());
        assertEquals(ValidationResult.ErrorKind.FIELD, result.outcome().kind());
        assertEquals("+1234567890", ((TwilioPayload) store.nodes().get(0).payload()).toNumber());
    }

    @Test
    void validateConnectionDoesNotMutate() {
        store.addNode(NodeKind.SIGNAL, Position.ORIGIN);
        store.addNode(NodeKind.TWILIO, Position.ORIGIN);

        ValidationResult verdict = store.validateConnection(EdgeCandidate.of("signal-1", "twilio-2"));

        assertFalse(verdict.valid());
        assertEquals(ConnectionValidator.TWILIO_BOOL_ONLY, verdict.error());
        assertTrue(store.edges().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Selection
    // ---------------------------------------------------------------------

    @Test
    void selectionTracksExistingNodesOnly() {
        store.addNode(NodeKind.SIGNAL, Position.ORIGIN);

        assertTrue(store.select("signal-1").applied());
        assertEquals("signal-1", store.selectedNode().orElseThrow().id());
        assertFalse(store.select("nope").applied());
        assertEquals("signal-1", store.selectedNode().orElseThrow().id());

        store.deleteNode("signal-1");
        assertTrue(store.selectedNode().isEmpty());
    }

    @Test
    void selectionIsNotUndoable() {
        store.addNode(NodeKind.SIGNAL, Position.ORIGIN);
        store.select("signal-1");
        store.clearSelection();

        assertTrue(store.undo());
        assertTrue(store.nodes().isEmpty());
        assertFalse(store.canUndo());
    }

    // ---------------------------------------------------------------------
    // History
    // ---------------------------------------------------------------------

    @Test
    void undoAndRedoRestoreDocuments() {
        buildSignalIntoAdder();
        Document wired = store.document();

        assertTrue(store.undo());
        assertTrue(store.edges().isEmpty());
        assertEquals(2, store.nodes().size());

        assertTrue(store.redo());
        assertEquals(wired, store.document());
        assertFalse(store.canRedo());
    }

    @Test
    void newMutationAfterUndoDropsRedo() {
        store.addNode(NodeKind.SIGNAL, Position.ORIGIN);
        store.addNode(NodeKind.SIGNAL, Position.ORIGIN);
        store.undo();

        store.moveNode("signal-1", Position.of(5, 5));

        assertFalse(store.canRedo());
        assertFalse(store.redo());
    }

    @Test
    void historyIsBoundedByCapacity() {
        store = newStore(DiagramStoreConfig.builder().withHistoryCapacity(2));
        for (int i = 0; i < 3; i++) {
            store.addNode(NodeKind.SIGNAL, Position.ORIGIN);
        }

        assertTrue(store.undo());
        assertTrue(store.undo());
        assertFalse(store.undo());
        assertEquals(1, store.nodes().size());
    }

    @Test
    void rejectedMutationsAreNotRecorded() {
        store.deleteNode("ghost");
        assertFalse(store.canUndo());
    }

    // ---------------------------------------------------------------------
    // Import and generate
    // ---------------------------------------------------------------------

    @Test
    void importTextReplacesDocumentAndReportsDiagnostics() {
        store.addNode(NodeKind.MQTT, Position.ORIGIN);

        MutationResult result = store.importText(String.join("\n",
                "signals:",
                "  - {name: x, type: bool, initial: true}",
                "blocks:",
                "  - {name: inv, type: NOT, inputs: {in: x}, outputs: {out: y}}",
                ""));

        assertTrue(result.applied());
        assertEquals(2, store.nodes().size());
        assertEquals(1, store.edges().size());
        assertEquals(List.of("Block 'inv' output 'out' references unknown signal 'y'; wire dropped"),
                result.diagnostics());
        assertTrue(store.canUndo());
    }

    @Test
    void failedImportLeavesStoreUntouched() {
        buildSignalIntoAdder();
        DiagramState before = store.state();

        MutationResult result = store.importText("signals: [\n  - name: x\n");

        assertFalse(result.applied());
        assertEquals(ValidationResult.ErrorKind.PARSE, result.outcome().kind());
        assertTrue(result.error().orElseThrow().startsWith("Import failed: "));
        assertSame(before, store.state());
        assertEquals(1, sink.getErrors().size());
        DiagramRejectionEvent rejection = sink.getRejections().get(0);
        assertNull(rejection.action());
    }

    @Test
    void blankPortNameImportIsReportedNotThrown() {
        buildSignalIntoAdder();
        DiagramState before = store.state();

        MutationResult result = store.importText(
                "signals:\n  - name: x\n    type: bool\nblocks:\n  - name: b\n    type: AND\n    inputs:\n      \"\": x\n");

        assertFalse(result.applied());
        assertEquals(ValidationResult.ErrorKind.PARSE, result.outcome().kind());
        assertEquals("Import failed: blocks[0].inputs: port name must not be blank", result.error().orElseThrow());
        assertSame(before, store.state());
        assertEquals(1, sink.getErrors().size());
        assertEquals(1, sink.getRejections().size());
    }

    @Test
    void importFileReadsUtf8Text() throws IOException {
        Path file = tempDir.resolve("plant.yaml");
        Files.writeString(file, "signals:\n  - {name: temp_°c, type: float, initial: 21.5}\nblocks: []\n",
                StandardCharsets.UTF_8);

        MutationResult result = store.importFile(file);

        assertTrue(result.applied());
        SignalPayload signal = (SignalPayload) store.nodes().get(0).payload();
        assertEquals("temp_°c", signal.label());
        assertEquals(21.5, signal.initial().asDouble());
    }

    @Test
    void missingFileIsAnImportFailure() {
        buildSignalIntoAdder();
        Document before = store.document();

        MutationResult result = store.importFile(tempDir.resolve("missing.yaml"));

        assertFalse(result.applied());
        assertTrue(result.error().orElseThrow().startsWith("Import failed: cannot read "));
        assertEquals(before, store.document());
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void generateFailureIsReportedAndRethrown() {
        store.load(List.of(DiagramFixtures.floatSignal("a", "Tank Level"),
                DiagramFixtures.floatSignal("b", "tank-level")), List.of());

        ConfigGenerationException e = assertThrows(ConfigGenerationException.class, store::generate);

        assertEquals("Duplicate signal name: tank_level", e.getMessage());
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void clearEmptiesDocument() {
        buildSignalIntoAdder();
        assertTrue(store.clear().applied());
        assertTrue(store.document().isEmpty());
        assertTrue(store.canUndo());
    }

    // ---------------------------------------------------------------------
    // Listeners and observability
    // ---------------------------------------------------------------------

    @Test
    void listenersSeeCommittedStatesUntilClosed() {
        List<DiagramState> seen = new ArrayList<>();
        DiagramListener.Subscription subscription = store.subscribe(seen::add);

        store.addNode(NodeKind.SIGNAL, Position.ORIGIN);
        store.deleteNode("ghost");
        subscription.close();
        store.addNode(NodeKind.SIGNAL, Position.ORIGIN);

        assertEquals(1, seen.size());
        assertEquals(1, seen.get(0).document().nodes().size());
    }

    @Test
    void failingListenerDoesNotUndoCommit() {
        store.subscribe(s -> {
            throw new IllegalStateException("boom");
        });

        assertTrue(store.addNode(NodeKind.SIGNAL, Position.ORIGIN).applied());

        assertEquals(1, store.nodes().size());
        assertEquals("Diagram listener failed: boom", sink.getErrors().get(0).message());
    }

    @Test
    void transitionsCarryClockTimeAndAction() {
        store.addNode(NodeKind.SIGNAL, Position.ORIGIN);
        clock.advance(Duration.ofSeconds(5));
        store.select("signal-1");

        List<DiagramTransitionEvent> transitions = sink.getStateTransitions();
        assertEquals(2, transitions.size());
        assertEquals(T0, transitions.get(0).timestamp());
        assertEquals(Set.of("signal-1"), transitions.get(0).addedNodeIds());
        assertInstanceOf(DiagramAction.AddNode.class, transitions.get(0).action());
        assertEquals(T0.plusSeconds(5), transitions.get(1).timestamp());
        assertTrue(transitions.get(1).isSelectionChange());
    }
}
