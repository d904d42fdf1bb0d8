package org.lexicon.core.model;

import java.util.List;

/**
 * One row of a term-position table: a term and the token positions (1-based) it occurs at.
 */
public record TermPositions(String term, List<Integer> positions) {

    public TermPositions {
        positions = List.copyOf(positions);
    }

    public int frequency() {
        return positions.size();
    }
}
