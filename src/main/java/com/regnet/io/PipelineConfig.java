package com.regnet.io;

import java.io.IOException;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;

/**
 * Tunable constants of the pipeline. Every field has a default, so a JSON
 * override file only needs the keys it changes:
 *
 * <pre>
 * { "layout": { "spacingX": 260 }, "identifiers": { "disambiguate": true } }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PipelineConfig {
    private IdentifierSettings identifiers = new IdentifierSettings();
    private LayoutSettings layout = new LayoutSettings();
    private BundleSettings bundle = new BundleSettings();

    /** Machine identifier scheme for glyphs. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class IdentifierSettings {
        private String prefix = "n_";
        private int maxLength = 64;
        /** Off by default: colliding labels share one identifier. */
        private boolean disambiguate;
    }

    /** Grid placement, in pixels. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class LayoutSettings {
        private int originX = 100, originY = 100;
        private int spacingX = 220, spacingY = 140;
        private int glyphWidth = 150, glyphHeight = 50;
    }

    /** File names of the cleaned bundle. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BundleSettings {
        private String nodesFile = "nodes.cleaned.csv";
        private String edgesFile = "edges.cleaned.csv";
        private String metadataFile = "bundle.meta.json";
        private int idMapSampleSize = 10;
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig();
    }

    /**
     * Reads overrides from a JSON file on top of the defaults.
     *
     * @throws IllegalArgumentException if an override breaks {@link #validate()}
     */
    public static PipelineConfig load(Path path) throws IOException {
        PipelineConfig config = new ObjectMapper().readerForUpdating(defaults()).readValue(path.toFile());
        config.validate();
        return config;
    }

    /**
     * Rejects settings the identifier scheme or the grid cannot honor: glyphs
     * must have a positive size and the pitch must leave a gap between
     * neighbouring glyphs.
     */
    public void validate() {
        require(identifiers.maxLength > 0, "identifiers.maxLength must be positive: " + identifiers.maxLength);
        require(layout.glyphWidth > 0 && layout.glyphHeight > 0,
                "layout glyph size must be positive: " + layout.glyphWidth + "x" + layout.glyphHeight);
        require(layout.spacingX > layout.glyphWidth,
                "layout.spacingX (" + layout.spacingX + ") must exceed glyphWidth (" + layout.glyphWidth + ")");
        require(layout.spacingY > layout.glyphHeight,
                "layout.spacingY (" + layout.spacingY + ") must exceed glyphHeight (" + layout.glyphHeight + ")");
        require(bundle.idMapSampleSize >= 0, "bundle.idMapSampleSize must not be negative: " + bundle.idMapSampleSize);
    }

    private static void require(boolean condition, String message) {
        if (!condition)
            throw new IllegalArgumentException(message);
    }
}
