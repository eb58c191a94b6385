package com.regnet.render;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.regnet.api.NetworkNode;
import com.regnet.api.RegulatoryNetwork;
import com.regnet.io.PipelineConfig;

import lombok.extern.log4j.Log4j2;

/**
 * Derives ASCII-safe glyph identifiers from node labels.
 *
 * <p>
 * {@code id = prefix + sanitize(label)}, where sanitizing replaces every
 * character outside {@code [0-9A-Za-z_]} with {@code _} and keeps the first
 * {@code maxLength} characters. The mapping is a pure function of the label,
 * so two labels can share an identifier (for example when they differ only
 * past the truncation point). That is accepted; enabling
 * {@link PipelineConfig.IdentifierSettings#isDisambiguate()} instead suffixes
 * later colliders with {@code _2}, {@code _3}, ... in node order.
 */
@Log4j2
public final class IdentifierAssigner {
    private static final Pattern UNSAFE = Pattern.compile("[^0-9A-Za-z_]");

    private final String prefix;
    private final int maxLength;
    private final boolean disambiguate;

    public IdentifierAssigner(PipelineConfig.IdentifierSettings settings) {
        this.prefix = settings.getPrefix();
        this.maxLength = settings.getMaxLength();
        this.disambiguate = settings.isDisambiguate();
    }

    /** Sanitizes a label. Idempotent. */
    public static String sanitize(String label, int maxLength) {
        String safe = UNSAFE.matcher(label).replaceAll("_");
        return safe.length() > maxLength ? safe.substring(0, maxLength) : safe;
    }

    public String idFor(String label) {
        return prefix + sanitize(label, maxLength);
    }

    /**
     * Maps every node label to its identifier, in node order. Edge endpoints
     * must be looked up in this map so glyphs and arcs agree.
     */
    public Map<String, String> assign(RegulatoryNetwork network) {
        Map<String, String> ids = new LinkedHashMap<>(network.nodeCount() * 2);
        Set<String> issued = new HashSet<>(network.nodeCount() * 2);
        for (NetworkNode n : network.nodes()) {
            String id = idFor(n.label());
            if (disambiguate && !issued.add(id)) {
                String base = id;
                int suffix = 2;
                do {
                    id = base + "_" + suffix++;
                } while (!issued.add(id));
                log.debug("Identifier {} already issued, '{}' gets {}", base, n.label(), id);
            }
            ids.put(n.label(), id);
        }
        return ids;
    }
}
