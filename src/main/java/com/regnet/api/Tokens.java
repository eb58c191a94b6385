package com.regnet.api;

/**
 * Spelling rules shared by the enumerations.
 *
 * <p>
 * Authors write multi-word values either with underscores
 * ({@code positive_influence}) or with single spaces
 * ({@code positive influence}); both spell the same value. Case is
 * significant.
 */
final class Tokens {
    private Tokens() {
        // Utility class
    }

    static String canonical(String text) {
        if (text == null)
            return "";
        return text.strip().replace(' ', '_');
    }
}
