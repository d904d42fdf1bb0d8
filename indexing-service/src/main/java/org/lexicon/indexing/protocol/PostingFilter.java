package org.lexicon.indexing.protocol;

import java.util.Map;

/**
 * Caller-supplied predicate applied to each posting a stream would emit.
 */
@FunctionalInterface
public interface PostingFilter {
	PostingFilter ACCEPT_ALL = (value, props) -> true;

	boolean accept(String value, Map<String, Object> props);
}
