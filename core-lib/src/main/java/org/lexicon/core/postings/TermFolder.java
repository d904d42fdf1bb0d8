package org.lexicon.core.postings;

import java.util.List;

/**
 * Accumulator step of {@link PostingsGenerator#foldTerms}.
 */
@FunctionalInterface
public interface TermFolder<A> {
	A visit(String fieldName, String term, List<Integer> positions, A accumulator);
}
