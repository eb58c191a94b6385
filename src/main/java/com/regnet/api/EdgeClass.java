package com.regnet.api;

/**
 * Causal relation carried by an edge.
 *
 * <p>
 * A {@link #LOGIC_ARC} marks one input of a multi-parent AND requirement. By
 * convention the inputs of a gate are followed by exactly one net-effect edge
 * ({@link #isNetEffect()}) to the same target.
 */
public enum EdgeClass {
    POSITIVE_INFLUENCE("positive_influence", "positive influence"),
    NEGATIVE_INFLUENCE("negative_influence", "negative influence"),
    LOGIC_ARC("logic_arc", "logic arc"),
    NECESSARY_STIMULATION("necessary_stimulation", "necessary stimulation");

    private final String token;
    private final String sbgnClass;

    EdgeClass(String token, String sbgnClass) {
        this.token = token;
        this.sbgnClass = sbgnClass;
    }

    public String token() {
        return token;
    }

    /** Arc class string used in SBGN-ML. */
    public String sbgnClass() {
        return sbgnClass;
    }

    public boolean isNetEffect() {
        return this != LOGIC_ARC;
    }

    public static EdgeClass lookup(String text) {
        String key = Tokens.canonical(text);
        for (EdgeClass c : values()) {
            if (c.token.equals(key)) {
                return c;
            }
        }
        return null;
    }
}
