package io.typeflow.core.schema;

import java.util.Objects;

public record EnumValueDef(String name, Metadata metadata) {

    public EnumValueDef {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
    }
}
