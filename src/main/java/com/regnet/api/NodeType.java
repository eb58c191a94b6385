package com.regnet.api;

/**
 * Biological role of a node. Exactly one node of a network is the
 * {@link #PROCESS} trait node.
 */
public enum NodeType {
    RECEPTOR("receptor"),
    HORMONE("hormone"),
    COMPLEX("complex"),
    ADAPTER("adapter"),
    REPRESSOR("repressor"),
    TRANSPORTER("transporter"),
    TRANSCRIPTION_FACTOR("transcription_factor"),
    PROCESS("process");

    private final String token;

    NodeType(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /**
     * Resolves a table cell to a type.
     *
     * @return the matching type, or {@code null} when the text is outside the
     *         enumeration
     */
    public static NodeType lookup(String text) {
        String key = Tokens.canonical(text);
        for (NodeType t : values()) {
            if (t.token.equals(key)) {
                return t;
            }
        }
        return null;
    }
}
