package org.lexicon.core.schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field definitions of one index.
 *
 * <p>Fields that are not declared resolve to a regular (non-facet) field analysed with the
 * schema's default analyzer.</p>
 */
public final class Schema {
    private final String name;
    private final String defaultAnalyzerFactory;
    private final List<String> defaultAnalyzerArgs;
    private final Map<String, SchemaField> fields;

    public Schema(String name, String defaultAnalyzerFactory, List<String> defaultAnalyzerArgs, List<SchemaField> fields) {
        this.name = name;
        this.defaultAnalyzerFactory = defaultAnalyzerFactory;
        this.defaultAnalyzerArgs = defaultAnalyzerArgs == null ? List.of() : List.copyOf(defaultAnalyzerArgs);
        this.fields = new LinkedHashMap<>();
        for (SchemaField field : fields) {
            this.fields.put(field.name(), field);
        }
    }

    public String name() {
        return name;
    }

    public List<SchemaField> fields() {
        return List.copyOf(fields.values());
    }

    public SchemaField findField(String fieldName) {
        SchemaField field = fields.get(fieldName);
        if (field != null) {
            return field;
        }
        return new SchemaField(fieldName, false, defaultAnalyzerFactory, defaultAnalyzerArgs);
    }

    public boolean isFieldFacet(SchemaField field) {
        return field.facet();
    }

    public String analyzerFactory(SchemaField field) {
        return field.analyzerFactory() != null ? field.analyzerFactory() : defaultAnalyzerFactory;
    }

    /**
     * Args declared on the field win; a field without args and without its own analyzer takes the default args.
     */
    public List<String> analyzerArgs(SchemaField field) {
        if (field.analyzerFactory() != null || !field.analyzerArgs().isEmpty()) {
            return field.analyzerArgs();
        }
        return defaultAnalyzerArgs;
    }

    @Override
    public String toString() {
        return "Schema{name='" + name + "', fields=" + fields.keySet() + "}";
    }
}
