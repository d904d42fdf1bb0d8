package org.lexicon.core.model;

import java.util.List;

/**
 * The term-position table of one analysed field, terms kept in order of first occurrence.
 */
public record FieldTerms(String field, List<TermPositions> terms) {

    public FieldTerms {
        terms = List.copyOf(terms);
    }

    /** Total number of tokens the field was analysed into. */
    public int tokenCount() {
        return terms.stream().mapToInt(TermPositions::frequency).sum();
    }
}
