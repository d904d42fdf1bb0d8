package org.lexicon.core.schema;

import java.util.List;

/**
 * Schema definition of a single field: whether it is a facet and how its values are analysed.
 */
public record SchemaField(String name, boolean facet, String analyzerFactory, List<String> analyzerArgs) {

    public SchemaField {
        analyzerArgs = analyzerArgs == null ? List.of() : List.copyOf(analyzerArgs);
    }
}
