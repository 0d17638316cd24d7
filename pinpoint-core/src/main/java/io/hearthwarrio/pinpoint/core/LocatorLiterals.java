package io.hearthwarrio.pinpoint.core;

/**
 * String-literal helpers for the selector and locator grammars the engine emits.
 */
public final class LocatorLiterals {

    private LocatorLiterals() {
        // utility class
    }

    /**
     * Single-quoted literal for semantic-query locators: {@code 'it\'s'}.
     */
    public static String singleQuoted(String value) {
        String v = value == null ? "" : value;
        return "'" + v.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    /**
     * Java string literal: {@code "say \"hi\""}. Single quotes are escaped as well.
     */
    public static String javaString(String value) {
        String v = value == null ? "" : value;
        v = v.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("'", "\\'")
                .replace("\n", "\\n")
                .replace("\r", "\\r");
        return "\"" + v + "\"";
    }

    /**
     * Double-quoted CSS attribute value: {@code [name="a\"b"]}.
     */
    public static String cssAttributeValue(String value) {
        String v = value == null ? "" : value;
        return "\"" + v.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    /**
     * Escapes a CSS identifier (id or class token) so it can follow {@code #} or {@code .}.
     */
    public static String cssIdentifier(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length() + 4);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            boolean leading = i == 0 || (i == 1 && value.charAt(0) == '-');
            if (leading && ch >= '0' && ch <= '9') {
                // an identifier cannot start with a digit: code point escape, e.g. "1a" becomes "\31 a"
                sb.append('\\').append(Integer.toHexString(ch)).append(' ');
                continue;
            }
            boolean ok = Character.isLetterOrDigit(ch) || ch == '-' || ch == '_';
            if (ok) {
                sb.append(ch);
            } else {
                sb.append('\\').append(ch);
            }
        }
        return sb.toString();
    }

    /**
     * XPath string literal, falling back to {@code concat(...)} when the value holds both quote kinds.
     */
    public static String xpath(String value) {
        if (value == null) {
            return "''";
        }
        if (!value.contains("'")) {
            return "'" + value + "'";
        }
        if (!value.contains("\"")) {
            return "\"" + value + "\"";
        }

        String[] parts = value.split("'", -1);
        StringBuilder sb = new StringBuilder("concat(");
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append(", \"'\", ");
            }
            sb.append("'").append(parts[i]).append("'");
        }
        sb.append(")");
        return sb.toString();
    }
}
