package com.regnet.io;

import com.regnet.engine.SchemaException;
import org.junit.Test;

import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class CsvTableLoaderTest {

    private final CsvTableLoader loader = new CsvTableLoader();

    static Path fixture(String name) throws URISyntaxException {
        return Path.of(CsvTableLoaderTest.class.getResource("/flowering/" + name).toURI());
    }

    @Test
    public void testLoadsNodesInInputOrder() throws Exception {
        RawTable nodes = loader.load(NetworkTable.NODES, fixture("nodes.csv"));

        assertEquals(NetworkTable.NODES, nodes.kind());
        assertEquals(6, nodes.size());
        assertEquals("Flowering time", nodes.cell(0, "Nodes"));
        // untouched until normalization
        assertEquals(" FT protein ", nodes.cell(1, "Nodes"));
        assertEquals("FT-FD complex", nodes.cell(3, "Nodes"));
        assertEquals("GA", nodes.cell(5, "Nodes"));
    }

    @Test
    public void testNotesAliasAndQuotedCells() throws Exception {
        RawTable edges = loader.load(NetworkTable.EDGES, fixture("edges.csv"));

        // blank line skipped, duplicates kept until normalization
        assertEquals(7, edges.size());
        assertEquals("FT binds FD", edges.cell(0, "Notes"));
        assertEquals("PMID:123, PMID:456", edges.cell(0, "Papers"));
        assertEquals("", edges.cell(6, "Papers"));
    }

    @Test
    public void testColumnsAreReorderedAndExtrasDropped() throws Exception {
        String csv = "compartmentRef,extra,Class,Type,Nodes\n"
                + "nucleus,x,macromolecule,repressor,SVP\n";
        RawTable nodes = loader.load(NetworkTable.NODES, new StringReader(csv));

        assertEquals(List.of("SVP", "repressor", "macromolecule", "nucleus"), nodes.rows().get(0).cells());
    }

    @Test
    public void testShortRowsArePadded() throws Exception {
        String csv = "source,target,Class,Confidence,Papers,Notes\n"
                + "A,B,logic_arc,high\n";
        RawTable edges = loader.load(NetworkTable.EDGES, new StringReader(csv));

        assertEquals("", edges.cell(0, "Papers"));
        assertEquals("", edges.cell(0, "Notes"));
    }

    @Test
    public void testHeaderWhitespaceAndBomAreIgnored() throws Exception {
        String csv = "\uFEFFNodes , Type,Class,compartmentRef\n"
                + "Heading date,process,biological_activity,compartment_1\n";
        RawTable nodes = loader.load(NetworkTable.NODES, new StringReader(csv));

        assertEquals("Heading date", nodes.cell(0, "Nodes"));
    }

    @Test
    public void testMissingColumnNamesTheColumn() throws Exception {
        String csv = "source,target,Class,Confidence,Papers\nA,B,logic_arc,high,PMID:1\n";
        try {
            loader.load(NetworkTable.EDGES, new StringReader(csv));
            fail("Expected SchemaException");
        } catch (SchemaException e) {
            assertEquals("edges", e.table());
            assertEquals("Notes", e.column());
            assertTrue(e.getMessage().contains("Notes"));
        }
    }

    @Test(expected = SchemaException.class)
    public void testEmptySourceIsRejected() throws Exception {
        loader.load(NetworkTable.NODES, new StringReader(""));
    }
}
