package io.typeflow.core.schema;

import java.util.Objects;

/**
 * A class property. {@code type} is only {@code null} in the unvalidated view used by {@link
 * SchemaRegistry#describe()}; a {@link SchemaSnapshot} never contains untyped properties.
 */
public record PropertyDef(String name, TypeRef type, Metadata metadata) {

    public PropertyDef {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
    }

    /** The key a producer is expected to emit: the alias when set, otherwise the name. */
    public String renderedName() {
        return metadata.aliasOr(name);
    }
}
