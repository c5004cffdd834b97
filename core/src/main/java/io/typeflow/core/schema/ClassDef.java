package io.typeflow.core.schema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Immutable class definition with properties in declaration order. */
public record ClassDef(String name, Metadata metadata, List<PropertyDef> properties) {

    public ClassDef {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        properties = List.copyOf(properties);
    }

    public Optional<PropertyDef> property(String propertyName) {
        return properties.stream().filter(p -> p.name().equals(propertyName)).findFirst();
    }
}
