package org.lexicon.indexing.protocol;

import org.jetbrains.annotations.NotNull;

import java.io.Serial;
import java.io.Serializable;

/** Identity of a partition of the index store. */
public record PartitionId(int value) implements Serializable {

    public static PartitionId of(int value) {
        return new PartitionId(value);
    }

    @NotNull
    @Override
    public String toString() {
        return String.valueOf(value);
    }

    @Serial
    private static final long serialVersionUID = 1L;
}
