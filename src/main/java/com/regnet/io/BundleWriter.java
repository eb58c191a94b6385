package com.regnet.io;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.regnet.api.NetworkEdge;
import com.regnet.api.NetworkNode;
import com.regnet.api.RegulatoryNetwork;

import lombok.extern.log4j.Log4j2;

/**
 * Persists a validated network as a cleaned bundle: the node table, the edge
 * table and a JSON metadata record. Cells are written with canonical headers
 * and underscore tokens. I/O failures propagate to the caller.
 */
@Log4j2
public final class BundleWriter {
    static final String PAPER_SEPARATOR = ", ";

    private final PipelineConfig.BundleSettings settings;
    private final CsvMapper csvMapper = new CsvMapper();
    private final ObjectMapper jsonMapper = new ObjectMapper();

    public BundleWriter(PipelineConfig.BundleSettings settings) {
        this.settings = settings;
        // quote only cells that contain a separator, quote or line break
        csvMapper.enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
    }

    /**
     * Writes the bundle into {@code outDir}, creating it when needed.
     *
     * @param identifiers label to identifier map, in node order
     * @return the metadata that was written
     */
    public BundleMetadata write(RegulatoryNetwork network, Map<String, String> identifiers, Path outDir)
            throws IOException {
        Files.createDirectories(outDir);

        List<String[]> nodeRows = new ArrayList<>(network.nodeCount());
        for (NetworkNode n : network.nodes())
            nodeRows.add(new String[] { n.label(), n.type().token(), n.nodeClass().token(), n.compartment() });
        writeTable(outDir.resolve(settings.getNodesFile()), NetworkTable.NODES, nodeRows);

        List<String[]> edgeRows = new ArrayList<>(network.edgeCount());
        for (NetworkEdge e : network.edges())
            edgeRows.add(new String[] { e.source(), e.target(), e.edgeClass().token(), e.confidence().token(),
                    String.join(PAPER_SEPARATOR, e.papers()), e.notes() });
        writeTable(outDir.resolve(settings.getEdgesFile()), NetworkTable.EDGES, edgeRows);

        Map<String, String> sample = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : identifiers.entrySet()) {
            if (sample.size() >= settings.getIdMapSampleSize())
                break;
            sample.put(entry.getKey(), entry.getValue());
        }
        BundleMetadata meta = new BundleMetadata(network.nodeCount(), network.edgeCount(), sample);
        Path metaPath = outDir.resolve(settings.getMetadataFile());
        try (Writer w = Files.newBufferedWriter(metaPath, StandardCharsets.UTF_8)) {
            jsonMapper.writerWithDefaultPrettyPrinter().writeValue(w, meta);
        }

        log.info("Bundle written to {} ({} nodes, {} edges)", outDir, meta.nodeCount(), meta.edgeCount());
        return meta;
    }

    private void writeTable(Path path, NetworkTable kind, List<String[]> rows) throws IOException {
        if (rows.isEmpty()) {
            // the CSV generator only emits the header together with the first row
            Files.writeString(path, String.join(",", kind.columns()) + "\n", StandardCharsets.UTF_8);
            return;
        }
        CsvSchema.Builder schema = CsvSchema.builder();
        for (String column : kind.columns())
            schema.addColumn(column);
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
                SequenceWriter seq = csvMapper.writer(schema.build().withHeader()).writeValues(w)) {
            for (String[] row : rows) {
                Map<String, String> record = new LinkedHashMap<>();
                for (int c = 0; c < row.length; c++)
                    record.put(kind.columns().get(c), row[c]);
                seq.write(record);
            }
        }
    }
}
