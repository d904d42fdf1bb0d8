package org.lexicon.indexing.protocol;

import org.jetbrains.annotations.NotNull;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/** Identity of the node hosting a set of partitions. */
public record NodeId(String name) implements Serializable {

    public NodeId {
        Objects.requireNonNull(name, "name");
    }

    public static NodeId of(String name) {
        return new NodeId(name);
    }

    @NotNull
    @Override
    public String toString() {
        return name;
    }

    @Serial
    private static final long serialVersionUID = 1L;
}
