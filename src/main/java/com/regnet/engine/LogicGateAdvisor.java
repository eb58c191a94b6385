package com.regnet.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.regnet.api.EdgeClass;
import com.regnet.api.NetworkEdge;
import com.regnet.api.RegulatoryNetwork;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reports departures from the edge authoring conventions without rejecting
 * anything.
 *
 * <p>
 * A target fed by {@code logic_arc} edges should receive exactly one
 * net-effect edge carrying the sign of the AND requirement. Self-loops are
 * legal but usually an authoring slip.
 */
public final class LogicGateAdvisor {
    private static final Logger log = LogManager.getLogger(LogicGateAdvisor.class);

    /**
     * @return one human-readable finding per departure, also logged at WARN
     */
    public List<String> review(RegulatoryNetwork network) {
        Map<String, int[]> perTarget = new LinkedHashMap<>();
        List<String> findings = new ArrayList<>();
        for (NetworkEdge e : network.edges()) {
            // [logic arcs, net-effect edges]
            int[] counts = perTarget.computeIfAbsent(e.target(), k -> new int[2]);
            if (e.edgeClass() == EdgeClass.LOGIC_ARC)
                counts[0]++;
            else
                counts[1]++;
            if (e.source().equals(e.target()))
                findings.add("Self-loop on '" + e.source() + "' (" + e.edgeClass().token() + ")");
        }
        for (Map.Entry<String, int[]> entry : perTarget.entrySet()) {
            int[] counts = entry.getValue();
            if (counts[0] > 0 && counts[1] != 1)
                findings.add("Target '" + entry.getKey() + "' has " + counts[0] + " logic_arc input(s) and "
                        + counts[1] + " net-effect edge(s); expected exactly one net-effect edge");
        }
        for (String finding : findings)
            log.warn(finding);
        return findings;
    }
}
