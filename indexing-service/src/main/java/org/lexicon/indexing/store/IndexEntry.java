package org.lexicon.indexing.store;

import java.util.Map;

/**
 * A posting as held by the index store.
 */
public record IndexEntry(
        String index,
        String field,
        String term,
        int subType,
        long subTerm,
        String value,
        Map<String, Object> props,
        long timestamp
) {}
