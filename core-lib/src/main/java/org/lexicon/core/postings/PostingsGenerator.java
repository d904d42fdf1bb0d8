package org.lexicon.core.postings;

import org.lexicon.core.model.Document;
import org.lexicon.core.model.FieldTerms;
import org.lexicon.core.model.FieldValue;
import org.lexicon.core.model.Posting;
import org.lexicon.core.model.TermPositions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns an analysed {@link Document} into the postings handed to the index store.
 */
public final class PostingsGenerator {
    private PostingsGenerator() {}

    /**
     * One posting per (field, term) pair, in field order then term order.
     *
     * <p>Postings are neither sorted nor deduplicated: a term present in two fields yields two
     * postings. A document that has not been analysed yields none.</p>
     */
    public static List<Posting> postings(Document document) {
        List<FieldValue> facets = document.facets();
        List<Posting> postings = new ArrayList<>();
        return foldTerms(document, postings, (fieldName, term, positions, acc) -> {
            acc.add(new Posting(document.indexName(), fieldName, term, document.id(), buildProperties(positions, facets)));
            return acc;
        });
    }

    /**
     * Folds over every (field, term, positions) triple of an analysed document.
     */
    public static <A> A foldTerms(Document document, A initial, TermFolder<A> folder) {
        A acc = initial;
        for (FieldTerms fieldTerms : document.fieldTerms()) {
            for (TermPositions termPositions : fieldTerms.terms()) {
                acc = folder.visit(fieldTerms.field(), termPositions.term(), termPositions.positions(), acc);
            }
        }
        return acc;
    }

    // word_pos and freq come first and are never overridden by a facet of the same name
    static Map<String, Object> buildProperties(List<Integer> positions, List<FieldValue> facets) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(Posting.WORD_POS, List.copyOf(positions));
        props.put(Posting.FREQ, positions.size());
        for (FieldValue facet : facets) {
            props.putIfAbsent(facet.name(), facet.value());
        }
        return props;
    }
}
