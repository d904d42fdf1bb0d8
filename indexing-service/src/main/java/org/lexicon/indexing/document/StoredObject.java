package org.lexicon.indexing.document;

import org.jetbrains.annotations.NotNull;

import java.io.Serial;
import java.io.Serializable;

/**
 * A value held by the object store under (bucket, key).
 */
public record StoredObject(
        String bucket,
        String key,
        String value,
        long revision,
        long lastModified
) implements Serializable {

    public static StoredObject create(String bucket, String key, String value) {
        return new StoredObject(bucket, key, value, 1, System.currentTimeMillis());
    }

    /**
     * Same object with a new value and the next revision.
     */
    public StoredObject update(String newValue) {
        return new StoredObject(bucket, key, newValue, revision + 1, System.currentTimeMillis());
    }

    @NotNull
    @Override
    public String toString() {
        return String.format("StoredObject{%s/%s, rev=%d, %d chars}", bucket, key, revision, value.length());
    }

    @Serial
    private static final long serialVersionUID = 1L;
}
