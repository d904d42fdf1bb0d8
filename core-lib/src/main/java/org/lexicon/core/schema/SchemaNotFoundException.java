package org.lexicon.core.schema;

import org.lexicon.core.analysis.AnalysisException;

/**
 * Thrown when a document names an index that has no registered schema.
 */
public class SchemaNotFoundException extends AnalysisException {
	public SchemaNotFoundException(String indexName) {
		super("No schema registered for index '" + indexName + "'");
	}
}
