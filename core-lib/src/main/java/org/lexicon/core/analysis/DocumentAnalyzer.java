package org.lexicon.core.analysis;

import org.lexicon.core.model.Document;
import org.lexicon.core.model.FieldTerms;
import org.lexicon.core.model.FieldValue;
import org.lexicon.core.schema.Schema;
import org.lexicon.core.schema.SchemaField;
import org.lexicon.core.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the per-field term positions and the facets of a document.
 *
 * <p>Facet fields (as declared by the index schema) are kept verbatim; every other field is
 * tokenized on its own, with positions restarting at 1 for each field entry. Fields sharing
 * a name are analysed as independent entries. Analysis is all-or-nothing: a failure on any
 * field aborts the whole document.</p>
 */
public class DocumentAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(DocumentAnalyzer.class);

    private final SchemaRegistry schemaRegistry;
    private final AnalyzerProvider analyzerProvider;
    private final PositionOrder positionOrder;

    public DocumentAnalyzer(SchemaRegistry schemaRegistry, AnalyzerProvider analyzerProvider, PositionOrder positionOrder) {
        this.schemaRegistry = schemaRegistry;
        this.analyzerProvider = analyzerProvider;
        this.positionOrder = positionOrder;
    }

    /**
     * Analyzes a document with an analyzer session acquired for this call only.
     *
     * @return a copy of {@code document} with field terms and facets populated
     */
    public Document analyze(Document document) throws AnalysisException {
        try (TextAnalyzer analyzer = analyzerProvider.open()) {
            return analyze(document, analyzer);
        }
    }

    /**
     * Analyzes a document with a caller-owned analyzer session.
     */
    public Document analyze(Document document, TextAnalyzer analyzer) throws AnalysisException {
        Schema schema = schemaRegistry.getSchema(document.indexName());

        List<FieldValue> facetFields = new ArrayList<>();
        List<FieldValue> regularFields = new ArrayList<>();
        for (FieldValue field : document.fields()) {
            SchemaField schemaField = schema.findField(field.name());
            if (schema.isFieldFacet(schemaField)) {
                facetFields.add(field);
            } else {
                regularFields.add(field);
            }
        }

        List<FieldTerms> fieldTerms = new ArrayList<>(regularFields.size());
        for (FieldValue field : regularFields) {
            List<String> tokens = analyzeField(field, schema, analyzer);
            fieldTerms.add(new FieldTerms(field.name(), TermPositionTable.build(tokens, positionOrder)));
        }

        logger.debug("Analyzed document {}/{}: {} regular fields, {} facets",
                document.indexName(), document.id(), fieldTerms.size(), facetFields.size());
        return document.withAnalysis(fieldTerms, facetFields);
    }

    private List<String> analyzeField(FieldValue field, Schema schema, TextAnalyzer analyzer) throws AnalyzerException {
        SchemaField schemaField = schema.findField(field.name());
        String factory = schema.analyzerFactory(schemaField);
        List<String> args = schema.analyzerArgs(schemaField);
        try {
            return analyzer.analyze(field.value(), factory, args);
        } catch (AnalyzerException e) {
            throw new AnalyzerException("Failed to analyze field '" + field.name() + "': " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new AnalyzerException("Analyzer crashed on field '" + field.name() + "'", e);
        }
    }
}
