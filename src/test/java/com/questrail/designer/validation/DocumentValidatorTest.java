package com.questrail.designer.validation;

import com.questrail.designer.api.DiagramFixtures;
import com.questrail.designer.api.Document;
import com.questrail.designer.api.Node;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.questrail.designer.api.DiagramFixtures.edge;
import static org.junit.jupiter.api.Assertions.*;

class DocumentValidatorTest
{
    private final DocumentValidator validator = new DocumentValidator();

    private final Node level = DiagramFixtures.floatSignal("level", "Level");
    private final Node total = DiagramFixtures.floatSignal("total", "Total");
    private final Node add = DiagramFixtures.addBlock("add", "Add");

    // ---------------------------------------------------------------------
    // validateStructure
    // ---------------------------------------------------------------------

    @Test
    void wellFormedDocumentPasses() {
        Document doc = DiagramFixtures.document(List.of(level, total, add), List.of(
                edge("e1", "level", null, "add", "a"),
                edge("e2", "add", "out", "total", null)));
        assertTrue(validator.validateStructure(doc).valid());
    }

    @Test
    void duplicateNodeIdIsStructural() {
        Document doc = DiagramFixtures.document(List.of(level, DiagramFixtures.floatSignal("level", "Other")), List.of());
        ValidationResult r = validator.validateStructure(doc);
        assertEquals(ValidationResult.ErrorKind.STRUCTURAL, r.kind());
        assertEquals("Duplicate node id: level", r.error());
    }

    @Test
    void danglingEdgeIsStructural() {
        Document doc = DiagramFixtures.document(List.of(level), List.of(edge("e1", "level", null, "gone", null)));
        ValidationResult r = validator.validateStructure(doc);
        assertFalse(r.valid());
        assertEquals("Edge e1 references a missing node", r.error());
    }

    @Test
    void undeclaredHandleIsStructural() {
        Document doc = DiagramFixtures.document(List.of(level, add), List.of(edge("e1", "level", null, "add", "z")));
        ValidationResult r = validator.validateStructure(doc);
        assertEquals(ValidationResult.ErrorKind.STRUCTURAL, r.kind());
        assertEquals("Unknown input port 'z' on block 'Add'", r.error());
    }

    @Test
    void duplicateEndpointsAreRejected() {
        Document doc = DiagramFixtures.document(List.of(level, add), List.of(
                edge("e1", "level", null, "add", "a"),
                edge("e2", "level", null, "add", "a")));
        ValidationResult r = validator.validateStructure(doc);
        assertEquals(ValidationResult.ErrorKind.DUPLICATE, r.kind());
        assertEquals("Connection already exists: e2", r.error());
    }

    // ---------------------------------------------------------------------
    // validate (full report)
    // ---------------------------------------------------------------------

    @Test
    void emptyDesignIsReported() {
        DocumentValidator.Report report = validator.validate(Document.EMPTY);
        assertFalse(report.valid());
        assertEquals(List.of("No blocks in design"), report.errors());
    }

    @Test
    void reportCollectsEveryProblem() {
        Node twin = DiagramFixtures.floatSignal("twin", "level");
        Node unnamed = DiagramFixtures.addBlock("b2", "");
        Document doc = DiagramFixtures.document(List.of(level, twin, add, unnamed), List.of(
                edge("e1", "level", null, "add", "a"),
                edge("e2", "level", null, "gone", null)));

        DocumentValidator.Report report = validator.validate(doc);

        assertFalse(report.valid());
        assertEquals(4, report.nodeCount());
        assertEquals(2, report.edgeCount());
        assertEquals(List.of(
                "Edge e2 references a missing node",
                "Duplicate signal name: level",
                "block '': Block label is required"), report.errors());
    }

    @Test
    void validDesignHasNoErrors() {
        Document doc = DiagramFixtures.document(List.of(level, total, add), List.of(
                edge("e1", "level", null, "add", "a"),
                edge("e2", "add", "out", "total", null)));
        DocumentValidator.Report report = validator.validate(doc);
        assertTrue(report.valid());
        assertTrue(report.errors().isEmpty());
    }
}
