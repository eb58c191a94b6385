package com.regnet.io;

import org.junit.Test;

import static com.regnet.io.Tables.edge;
import static com.regnet.io.Tables.node;
import static org.junit.Assert.*;

public class TableNormalizerTest {

    private final TableNormalizer normalizer = new TableNormalizer();

    @Test
    public void testStripsOuterWhitespaceOnly() {
        RawTable nodes = normalizer.normalize(Tables.nodes(
                node("  FT  protein\t", " transcription_factor", "macromolecule ", "\nnucleus")));

        assertEquals("FT  protein", nodes.cell(0, "Nodes"));
        assertEquals("transcription_factor", nodes.cell(0, "Type"));
        assertEquals("macromolecule", nodes.cell(0, "Class"));
        assertEquals("nucleus", nodes.cell(0, "compartmentRef"));
    }

    @Test
    public void testRepairsAndGlyph() {
        RawTable edges = normalizer.normalize(Tables.edges(
                edge("A", "B", "logic_arc", "high", "", "A " + TableNormalizer.AND_MOJIBAKE + " B")));

        assertEquals("A ∧ B", edges.cell(0, "Notes"));
        assertEquals("x∧y", TableNormalizer.repairMojibake("x" + TableNormalizer.AND_MOJIBAKE + "y"));
        assertEquals("plain", TableNormalizer.repairMojibake("plain"));
    }

    @Test
    public void testCollapsesDuplicateEdgesKeepingFirstOccurrence() {
        RawTable edges = normalizer.normalize(Tables.edges(
                edge("A", "B", "positive_influence", "high", "P1", "n"),
                edge("C", "B", "negative_influence", "low", "P2", "m"),
                edge(" A", "B ", "positive_influence", "high", "P1", "n"),
                edge("A", "B", "positive_influence", "medium", "P1", "n")));

        assertEquals(3, edges.size());
        assertEquals("A", edges.cell(0, "source"));
        assertEquals(1, edges.rows().get(0).rowNumber());
        assertEquals("C", edges.cell(1, "source"));
        assertEquals("medium", edges.cell(2, "Confidence"));
    }

    @Test
    public void testNodeRowsAreNotDeduplicated() {
        RawTable nodes = normalizer.normalize(Tables.nodes(
                node("A", "receptor", "macromolecule", "c"),
                node("A", "receptor", "macromolecule", "c")));

        assertEquals(2, nodes.size());
    }

    @Test
    public void testIdempotent() {
        RawTable raw = Tables.edges(
                edge(" A ", "B", "logic arc", "high", "P1, P2", "x " + TableNormalizer.AND_MOJIBAKE + " y"),
                edge("A", "B", "logic arc", "high", "P1, P2", "x ∧ y"),
                edge("B", "C", "positive influence", "low", "", ""));

        RawTable once = normalizer.normalize(raw);
        RawTable twice = normalizer.normalize(once);

        assertEquals(2, once.size());
        assertEquals(once, twice);
    }
}
