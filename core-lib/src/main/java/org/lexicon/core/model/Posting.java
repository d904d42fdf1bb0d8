package org.lexicon.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single (index, field, term, document) record handed to the index store.
 *
 * <p>{@code properties} always starts with {@link #WORD_POS} and {@link #FREQ}, followed by
 * the document's facets in document order.</p>
 */
public record Posting(
        String indexName,
        String fieldName,
        String term,
        String docId,
        Map<String, Object> properties
) {
    public static final String WORD_POS = "word_pos";
    public static final String FREQ = "freq";

    public Posting {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public List<Integer> wordPositions() {
        return ((List<?>) properties.get(WORD_POS)).stream()
                .map(Integer.class::cast)
                .toList();
    }

    public int frequency() {
        return ((Number) properties.get(FREQ)).intValue();
    }
}
