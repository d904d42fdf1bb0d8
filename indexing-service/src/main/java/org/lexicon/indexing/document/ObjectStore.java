package org.lexicon.indexing.document;

import org.lexicon.indexing.store.StoreException;

import java.util.Optional;

public interface ObjectStore {
	/**
	 * Get the object stored under bucket/key, empty if there is none
	 */
	Optional<StoredObject> get(String bucket, String key) throws StoreException;

	/**
	 * Write an object under its own bucket/key, replacing any previous one
	 */
	void put(StoredObject object) throws StoreException;

	/**
	 * Delete the object stored under bucket/key; deleting a missing object is not an error
	 */
	void delete(String bucket, String key) throws StoreException;
}
