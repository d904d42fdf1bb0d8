package org.lexicon.core.analysis;

import org.lexicon.core.model.TermPositions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

/**
 * Builds the term-position table of one field from its token sequence.
 *
 * <p>Terms keep the order of their first occurrence. Positions start at 1.</p>
 */
public final class TermPositionTable {
    private TermPositionTable() {}

    public static List<TermPositions> build(List<String> tokens, PositionOrder order) {
        Map<String, LinkedList<Integer>> table = new LinkedHashMap<>();

        int position = 1;
        for (String token : tokens) {
            LinkedList<Integer> positions = table.computeIfAbsent(token, t -> new LinkedList<>());
            if (order == PositionOrder.DESCENDING) {
                positions.addFirst(position);
            } else {
                positions.addLast(position);
            }
            position++;
        }

        List<TermPositions> result = new ArrayList<>(table.size());
        table.forEach((term, positions) -> result.add(new TermPositions(term, positions)));
        return result;
    }
}
