package com.regnet.api;

/**
 * SBGN entity class of a node.
 */
public enum NodeClass {
    MACROMOLECULE("macromolecule", "macromolecule"),
    BIOLOGICAL_ACTIVITY("biological_activity", "biological activity");

    private final String token;
    private final String sbgnClass;

    NodeClass(String token, String sbgnClass) {
        this.token = token;
        this.sbgnClass = sbgnClass;
    }

    public String token() {
        return token;
    }

    /** Glyph class string used in SBGN-ML. */
    public String sbgnClass() {
        return sbgnClass;
    }

    public static NodeClass lookup(String text) {
        String key = Tokens.canonical(text);
        for (NodeClass c : values()) {
            if (c.token.equals(key)) {
                return c;
            }
        }
        return null;
    }
}
