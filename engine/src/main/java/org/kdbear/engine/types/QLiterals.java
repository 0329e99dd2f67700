package org.kdbear.engine.types;

import java.util.regex.Pattern;

/**
 * Small helpers for writing q literal text.
 */
public final class QLiterals {

    private static final Pattern NAME = Pattern.compile("[A-Za-z.][A-Za-z0-9_.]*");

    private QLiterals() {
    }

    /**
     * Renders text as a double-quoted q string, escaping quotes, backslashes and
     * control characters.
     */
    public static String string(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Renders a list of symbol names as a q symbol list, e.g. {@code `a`b}.
     */
    public static String symbols(Iterable<String> names) {
        StringBuilder sb = new StringBuilder();
        for (String name : names) {
            sb.append('`').append(name);
        }
        return sb.toString();
    }

    /**
     * Checks that {@code name} can be spliced into q text as a table or column name.
     *
     * @return the name
     * @throws IllegalArgumentException if it is not a plain q name
     */
    public static String requireName(String name) {
        if (name == null || !NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a valid q name: " + name);
        }
        return name;
    }
}
