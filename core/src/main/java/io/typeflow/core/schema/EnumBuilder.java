package io.typeflow.core.schema;

import io.typeflow.core.error.DuplicatePropertyException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Builder for an enum definition. Obtained from {@link SchemaRegistry#defineEnum(String)}. */
public final class EnumBuilder {

    private final String name;
    private final MetadataHolder meta;
    private final Map<String, EnumValueBuilder> values = new LinkedHashMap<>();

    EnumBuilder(String name) {
        this.name = name;
        this.meta = new MetadataHolder(name);
    }

    public String name() {
        return name;
    }

    /**
     * Adds a value.
     *
     * @throws DuplicatePropertyException if the enum already has a value with this name
     */
    public EnumValueBuilder value(String valueName) {
        if (valueName == null || valueName.isBlank()) {
            throw new IllegalArgumentException("enum value name must not be null or blank");
        }
        if (values.containsKey(valueName)) {
            throw new DuplicatePropertyException(name, valueName);
        }
        EnumValueBuilder value = new EnumValueBuilder(name, valueName);
        values.put(valueName, value);
        return value;
    }

    public Optional<EnumValueBuilder> existingValue(String valueName) {
        return Optional.ofNullable(values.get(valueName));
    }

    public List<String> valueNames() {
        return List.copyOf(values.keySet());
    }

    public EnumBuilder withMeta(String key, String value) {
        meta.put(key, value);
        return this;
    }

    public EnumBuilder alias(String alias) {
        return withMeta(MetaKey.ALIAS.key(), alias);
    }

    public EnumBuilder description(String description) {
        return withMeta(MetaKey.DESCRIPTION.key(), description);
    }

    /** A reference to this enum, for use as a property or return type. */
    public TypeRef type() {
        return TypeRef.named(name);
    }

    EnumDef toDef() {
        List<EnumValueDef> defs = new ArrayList<>(values.size());
        values.values().forEach(v -> defs.add(v.toDef()));
        return new EnumDef(name, meta.toMetadata(), defs);
    }
}
