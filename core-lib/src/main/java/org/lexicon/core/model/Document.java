package org.lexicon.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structured representation of a document to be indexed.
 *
 * <p>Immutable: every mutator returns a new {@code Document}. {@code fieldTerms} and
 * {@code facets} are derived by analysis and stay empty until a document has been analysed.
 * Fields and props are lists rather than maps, so a name may occur more than once.</p>
 */
public record Document(
        String id,
        String indexName,
        List<FieldValue> fields,
        List<FieldValue> props,
        List<FieldTerms> fieldTerms,
        List<FieldValue> facets
) {

    public Document {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(indexName, "indexName");
        fields = List.copyOf(fields);
        props = List.copyOf(props);
        fieldTerms = List.copyOf(fieldTerms);
        facets = List.copyOf(facets);
    }

    public static Document of(String id, String indexName) {
        return new Document(id, indexName, List.of(), List.of(), List.of(), List.of());
    }

    public static Document of(String id, List<FieldValue> fields, List<FieldValue> props, String indexName) {
        return new Document(id, indexName, fields, props, List.of(), List.of());
    }

    /**
     * Adds a field in front of the existing ones, so the most recently added field is iterated first.
     */
    public Document addField(String name, String value) {
        return setFields(prepend(new FieldValue(name, value), fields));
    }

    public Document setFields(List<FieldValue> newFields) {
        return new Document(id, indexName, newFields, props, fieldTerms, facets);
    }

    /** Removes all raw fields; previously derived terms and facets are kept. */
    public Document clearFields() {
        return setFields(List.of());
    }

    /**
     * Adds a property in front of the existing ones, so the most recently added property is iterated first.
     */
    public Document addProp(String name, String value) {
        return setProps(prepend(new FieldValue(name, value), props));
    }

    public Document setProps(List<FieldValue> newProps) {
        return new Document(id, indexName, fields, newProps, fieldTerms, facets);
    }

    /** Removes all props; previously derived terms and facets are kept. */
    public Document clearProps() {
        return setProps(List.of());
    }

    public Document withAnalysis(List<FieldTerms> newFieldTerms, List<FieldValue> newFacets) {
        return new Document(id, indexName, fields, props, newFieldTerms, newFacets);
    }

    public boolean isAnalyzed() {
        return !fieldTerms.isEmpty() || !facets.isEmpty();
    }

    private static List<FieldValue> prepend(FieldValue head, List<FieldValue> tail) {
        List<FieldValue> result = new ArrayList<>(tail.size() + 1);
        result.add(head);
        result.addAll(tail);
        return result;
    }
}
