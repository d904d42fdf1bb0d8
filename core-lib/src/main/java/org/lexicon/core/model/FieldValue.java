package org.lexicon.core.model;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A single name/value pair of a document: a raw field, a property or a facet.
 */
public record FieldValue(String name, String value) {

    public FieldValue {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    @NotNull
    @Override
    public String toString() {
        return name + "=" + value;
    }
}
