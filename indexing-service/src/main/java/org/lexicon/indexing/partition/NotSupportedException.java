package org.lexicon.indexing.partition;

import org.lexicon.indexing.store.StoreException;

/**
 * Key-based operations a postings partition cannot serve, such as listing or deleting keys.
 */
public class NotSupportedException extends StoreException {
	public NotSupportedException(String operation) {
		super(operation + " is not supported by a postings partition");
	}
}
