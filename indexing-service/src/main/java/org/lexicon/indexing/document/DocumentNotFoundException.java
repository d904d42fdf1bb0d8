package org.lexicon.indexing.document;

import org.lexicon.indexing.store.StoreException;

/**
 * Indicates no document is stored under the given index and id.
 */
public class DocumentNotFoundException extends StoreException {
	public DocumentNotFoundException(String indexName, String id) {
		super("Document " + id + " not found in index " + indexName);
	}
}
