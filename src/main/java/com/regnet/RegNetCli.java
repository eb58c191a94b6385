package com.regnet;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import com.regnet.api.RegulatoryNetwork;
import com.regnet.engine.NetworkValidationException;
import com.regnet.io.PipelineConfig;

import lombok.extern.log4j.Log4j2;

/**
 * Command-line entry point.
 *
 * <pre>
 * pack   --nodes nodes.csv --edges edges.csv --out bundle_dir [--config cfg.json]
 * render --nodes nodes.csv --edges edges.csv --out network.sbgn [--config cfg.json]
 * </pre>
 */
@Log4j2
public final class RegNetCli {
    static final int OK = 0, INVALID_INPUT = 1, FAILURE = 2, USAGE = 64;

    private RegNetCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length == 0 || !("pack".equals(args[0]) || "render".equals(args[0]))) {
            log.error("Usage: (pack|render) --nodes <csv> --edges <csv> --out <path> [--config <json>]");
            return USAGE;
        }
        if (args.length % 2 == 0) {
            log.error("Dangling argument: {}", args[args.length - 1]);
            return USAGE;
        }
        Map<String, String> flags = new HashMap<>();
        for (int i = 1; i < args.length; i += 2) {
            if (!args[i].startsWith("--")) {
                log.error("Unexpected argument: {}", args[i]);
                return USAGE;
            }
            flags.put(args[i].substring(2), args[i + 1]);
        }
        for (String required : new String[] { "nodes", "edges", "out" }) {
            if (!flags.containsKey(required)) {
                log.error("Missing --{}", required);
                return USAGE;
            }
        }

        try {
            PipelineConfig config = flags.containsKey("config")
                    ? PipelineConfig.load(Path.of(flags.get("config")))
                    : PipelineConfig.defaults();
            SbgnPipeline pipeline = new SbgnPipeline(config);
            RegulatoryNetwork network = pipeline.load(Path.of(flags.get("nodes")), Path.of(flags.get("edges")));
            if ("pack".equals(args[0]))
                pipeline.pack(network, Path.of(flags.get("out")));
            else
                pipeline.renderTo(network, Path.of(flags.get("out")));
            return OK;
        } catch (NetworkValidationException e) {
            log.error("Invalid network: {}", e.getMessage());
            return INVALID_INPUT;
        } catch (Exception e) {
            log.error("Run failed", e);
            return FAILURE;
        }
    }
}
