package com.regnet.render;

/**
 * Escapes text for XML element content and double- or single-quoted
 * attributes. Characters XML 1.0 cannot carry at all (C0 controls other than
 * tab, line feed and carriage return, and U+FFFE/U+FFFF) become U+FFFD.
 */
public final class XmlEscaper {
    static final String REPLACEMENT = "\uFFFD";

    private XmlEscaper() {
        // Utility class
    }

    public static String escape(String text) {
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String rep = switch (c) {
                case '&' -> "&amp;";
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '"' -> "&quot;";
                case '\'' -> "&apos;";
                default -> isXmlChar(c) ? null : REPLACEMENT;
            };
            if (rep == null) {
                if (sb != null)
                    sb.append(c);
                continue;
            }
            if (sb == null)
                sb = new StringBuilder(text.length() + 16).append(text, 0, i);
            sb.append(rep);
        }
        return sb == null ? text : sb.toString();
    }

    private static boolean isXmlChar(char c) {
        if (c < 0x20)
            return c == '\t' || c == '\n' || c == '\r';
        return c != '\uFFFE' && c != '\uFFFF';
    }
}
