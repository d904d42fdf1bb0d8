package org.lexicon.core.schema;

public interface SchemaRegistry {
	/**
	 * Resolve the schema of an index
	 * @throws SchemaNotFoundException if no schema is registered under that name
	 */
	Schema getSchema(String indexName) throws SchemaNotFoundException;
}
