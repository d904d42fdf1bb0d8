package org.lexicon.core.analysis;

import java.util.Locale;

/**
 * Order of the positions recorded for a term that occurs more than once in a field.
 */
public enum PositionOrder {
    /** Positions appended as tokens are scanned: {@code [1, 4, 9]}. */
    ASCENDING,
    /** Positions pushed to the head of the list as tokens are scanned: {@code [9, 4, 1]}. */
    DESCENDING;

    public static PositionOrder parse(String value) {
        try {
            return PositionOrder.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown position order: '" + value + "'. Valid options: ascending, descending", e);
        }
    }
}
