package org.lexicon.indexing.document;

import com.hazelcast.core.HazelcastException;
import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import org.lexicon.indexing.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Object store backed by Hazelcast: one distributed map per bucket, named {@code <prefix><bucket>}.
 */
public class HazelcastObjectStore implements ObjectStore {
    private static final Logger logger = LoggerFactory.getLogger(HazelcastObjectStore.class);

    private final HazelcastInstance hazelcast;
    private final String mapPrefix;

    public HazelcastObjectStore(HazelcastInstance hazelcast, String mapPrefix) {
        this.hazelcast = hazelcast;
        this.mapPrefix = mapPrefix;
    }

    @Override
    public Optional<StoredObject> get(String bucket, String key) throws StoreException {
        try {
            return Optional.ofNullable(map(bucket).get(key));
        } catch (HazelcastException e) {
            throw new StoreException("Failed to read " + bucket + "/" + key, e);
        }
    }

    @Override
    public void put(StoredObject object) throws StoreException {
        try {
            map(object.bucket()).set(object.key(), object);
            logger.debug("Stored {}", object);
        } catch (HazelcastException e) {
            throw new StoreException("Failed to write " + object.bucket() + "/" + object.key(), e);
        }
    }

    @Override
    public void delete(String bucket, String key) throws StoreException {
        try {
            map(bucket).delete(key);
        } catch (HazelcastException e) {
            throw new StoreException("Failed to delete " + bucket + "/" + key, e);
        }
    }

    private IMap<String, StoredObject> map(String bucket) {
        return hazelcast.getMap(mapPrefix + bucket);
    }
}
