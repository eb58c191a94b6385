package com.regnet.render;

import com.regnet.api.NetworkNode;
import com.regnet.api.NodeClass;
import com.regnet.api.NodeType;
import com.regnet.api.RegulatoryNetwork;
import com.regnet.io.PipelineConfig;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class IdentifierAssignerTest {

    private static final String LONG_PREFIX = "A".repeat(64);

    private static RegulatoryNetwork network(String... labels) {
        List<NetworkNode> nodes = new ArrayList<>();
        nodes.add(new NetworkNode("Trait", NodeType.PROCESS, NodeClass.BIOLOGICAL_ACTIVITY, "c"));
        for (String label : labels)
            nodes.add(new NetworkNode(label, NodeType.ADAPTER, NodeClass.MACROMOLECULE, "c"));
        return new RegulatoryNetwork(nodes, List.of());
    }

    @Test
    public void testSanitizeReplacesUnsafeCharacters() {
        assertEquals("FT_protein", IdentifierAssigner.sanitize("FT protein", 64));
        assertEquals("FT_FD_complex__nuclear_", IdentifierAssigner.sanitize("FT-FD complex (nuclear)", 64));
        assertEquals("GA___ABA", IdentifierAssigner.sanitize("GA₄; ABA", 64));
        assertEquals("a_b", IdentifierAssigner.sanitize("a∧b", 64));
    }

    @Test
    public void testSanitizeTruncates() {
        String label = LONG_PREFIX + "tail";
        assertEquals(LONG_PREFIX, IdentifierAssigner.sanitize(label, 64));
        assertEquals("AAA", IdentifierAssigner.sanitize(label, 3));
    }

    @Test
    public void testSanitizeIsIdempotent() {
        for (String label : new String[] { "FT protein", "PIF4/5 (active)", LONG_PREFIX + "x y", "", "ok_1" }) {
            String once = IdentifierAssigner.sanitize(label, 64);
            assertEquals(once, IdentifierAssigner.sanitize(once, 64));
        }
    }

    @Test
    public void testIdForAddsPrefix() {
        IdentifierAssigner ids = new IdentifierAssigner(new PipelineConfig.IdentifierSettings());
        assertEquals("n_Flowering_time", ids.idFor("Flowering time"));
        assertEquals(ids.idFor("Flowering time"), ids.idFor("Flowering time"));
    }

    @Test
    public void testAssignFollowsNodeOrder() {
        Map<String, String> ids = new IdentifierAssigner(new PipelineConfig.IdentifierSettings())
                .assign(network("B 1", "A 2"));

        assertEquals(List.of("Trait", "B 1", "A 2"), new ArrayList<>(ids.keySet()));
        assertEquals(List.of("n_Trait", "n_B_1", "n_A_2"), new ArrayList<>(ids.values()));
    }

    @Test
    public void testCollisionsAreKeptByDefault() {
        Map<String, String> ids = new IdentifierAssigner(new PipelineConfig.IdentifierSettings())
                .assign(network(LONG_PREFIX + "one", LONG_PREFIX + "two", "x-y", "x y"));

        assertEquals(ids.get(LONG_PREFIX + "one"), ids.get(LONG_PREFIX + "two"));
        assertEquals("n_x_y", ids.get("x-y"));
        assertEquals("n_x_y", ids.get("x y"));
    }

    @Test
    public void testOptionalDisambiguation() {
        PipelineConfig.IdentifierSettings settings = new PipelineConfig.IdentifierSettings();
        settings.setDisambiguate(true);

        Map<String, String> ids = new IdentifierAssigner(settings)
                .assign(network("x-y", "x y", "x_y_2", "x.y"));

        assertEquals("n_x_y", ids.get("x-y"));
        assertEquals("n_x_y_2", ids.get("x y"));
        assertEquals("n_x_y_2_2", ids.get("x_y_2"));
        assertEquals("n_x_y_3", ids.get("x.y"));
    }
}
