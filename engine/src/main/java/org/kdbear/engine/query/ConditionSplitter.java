package org.kdbear.engine.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits condition text into individual conditions.
 *
 * Every comma separates two conditions, including commas inside parentheses or
 * quotes. Function arguments are therefore separated with {@code ;}.
 */
public final class ConditionSplitter {

    private ConditionSplitter() {
    }

    /**
     * @return trimmed, non-empty segments in order
     */
    public static List<String> split(String text) {
        List<String> segments = new ArrayList<>();
        if (text == null) {
            return segments;
        }
        for (String part : text.split(",", -1)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                segments.add(trimmed);
            }
        }
        return segments;
    }
}
