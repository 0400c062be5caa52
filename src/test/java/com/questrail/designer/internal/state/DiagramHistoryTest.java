package com.questrail.designer.internal.state;

import com.questrail.designer.api.DiagramFixtures;
import com.questrail.designer.api.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagramHistoryTest
{
    private static Document doc(String signalId) {
        return DiagramFixtures.document(List.of(DiagramFixtures.boolSignal(signalId, signalId)), List.of());
    }

    @Test
    void freshHistoryHasNothingToUndoOrRedo() {
        DiagramHistory history = DiagramHistory.start(5, Document.EMPTY);
        assertFalse(history.canUndo());
        assertFalse(history.canRedo());
        assertTrue(history.undo().isEmpty());
        assertTrue(history.redo().isEmpty());
        assertEquals(Document.EMPTY, history.current());
    }

    @Test
    void undoAndRedoMoveCursor() {
        DiagramHistory history = DiagramHistory.start(5, Document.EMPTY).record(doc("a")).record(doc("b"));

        DiagramHistory back = history.undo().orElseThrow();
        assertEquals(doc("a"), back.current());
        assertTrue(back.canRedo());

        DiagramHistory forward = back.redo().orElseThrow();
        assertEquals(doc("b"), forward.current());
        assertFalse(forward.canRedo());
    }

    @Test
    void recordingAfterUndoDiscardsRedoTail() {
        DiagramHistory history = DiagramHistory.start(5, Document.EMPTY).record(doc("a")).record(doc("b"));

        DiagramHistory branched = history.undo().orElseThrow().record(doc("c"));

        assertFalse(branched.canRedo());
        assertEquals(3, branched.size());
        assertEquals(doc("a"), branched.undo().orElseThrow().current());
    }

    @Test
    void oldestSnapshotsAreDroppedBeyondCapacity() {
        DiagramHistory history = DiagramHistory.start(2, Document.EMPTY);
        for (String id : List.of("a", "b", "c", "d")) {
            history = history.record(doc(id));
        }

        assertEquals(3, history.size());
        DiagramHistory oldest = history.undo().orElseThrow().undo().orElseThrow();
        assertEquals(doc("b"), oldest.current());
        assertFalse(oldest.canUndo());
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> DiagramHistory.start(0, Document.EMPTY));
    }
}
