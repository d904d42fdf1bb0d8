package org.lexicon.indexing.store;

import java.io.IOException;

/**
 * Failure reported by a storage collaborator (index store or object store).
 */
public class StoreException extends IOException {
	public StoreException(String message) {
		super(message);
	}

	public StoreException(String message, Throwable cause) {
		super(message, cause);
	}
}
