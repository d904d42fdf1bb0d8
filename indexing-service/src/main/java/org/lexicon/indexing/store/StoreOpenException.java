package org.lexicon.indexing.store;

/**
 * Indicates the index store of a partition could not be opened or created.
 */
public class StoreOpenException extends StoreException {
	public StoreOpenException(String message, Throwable cause) {
		super(message, cause);
	}
}
