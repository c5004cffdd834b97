package io.typeflow.core.schema;

/**
 * Alias and description attached to a class, enum, property or enum value. Either may be
 * {@code null}.
 */
public record Metadata(String alias, String description) {

    public static final Metadata EMPTY = new Metadata(null, null);

    public boolean isEmpty() {
        return alias == null && description == null;
    }

    /** The alias if set, otherwise the given name. */
    public String aliasOr(String name) {
        return alias != null ? alias : name;
    }
}
