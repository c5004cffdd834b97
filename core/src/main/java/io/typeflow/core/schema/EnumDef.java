package io.typeflow.core.schema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Immutable enum definition with values in declaration order. */
public record EnumDef(String name, Metadata metadata, List<EnumValueDef> values) {

    public EnumDef {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        values = List.copyOf(values);
    }

    public Optional<EnumValueDef> value(String valueName) {
        return values.stream().filter(v -> v.name().equals(valueName)).findFirst();
    }
}
