package org.lexicon.indexing.document;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Object store held in a plain map, for tests that do not need a Hazelcast member.
 */
public class InMemoryObjectStore implements ObjectStore {
	private final Map<String, StoredObject> objects = new ConcurrentHashMap<>();

	@Override
	public Optional<StoredObject> get(String bucket, String key) {
		return Optional.ofNullable(objects.get(bucket + "/" + key));
	}

	@Override
	public void put(StoredObject object) {
		objects.put(object.bucket() + "/" + object.key(), object);
	}

	@Override
	public void delete(String bucket, String key) {
		objects.remove(bucket + "/" + key);
	}

	public int size() {
		return objects.size();
	}
}
