package com.regnet.api;

public enum Confidence {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String token;

    Confidence(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static Confidence lookup(String text) {
        String key = Tokens.canonical(text);
        for (Confidence c : values()) {
            if (c.token.equals(key)) {
                return c;
            }
        }
        return null;
    }
}
