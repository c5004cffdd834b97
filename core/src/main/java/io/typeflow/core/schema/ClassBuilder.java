package io.typeflow.core.schema;

import io.typeflow.core.error.DuplicatePropertyException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Builder for a class definition. Obtained from {@link SchemaRegistry#defineClass(String)}. */
public final class ClassBuilder {

    private final String name;
    private final MetadataHolder meta;
    private final Map<String, PropertyBuilder> properties = new LinkedHashMap<>();

    ClassBuilder(String name) {
        this.name = name;
        this.meta = new MetadataHolder(name);
    }

    public String name() {
        return name;
    }

    /**
     * Adds a property.
     *
     * @throws DuplicatePropertyException if the class already has a property with this name
     */
    public PropertyBuilder property(String propertyName) {
        if (propertyName == null || propertyName.isBlank()) {
            throw new IllegalArgumentException("property name must not be null or blank");
        }
        if (properties.containsKey(propertyName)) {
            throw new DuplicatePropertyException(name, propertyName);
        }
        PropertyBuilder property = new PropertyBuilder(name, propertyName);
        properties.put(propertyName, property);
        return property;
    }

    /** Shorthand for {@code property(name).type(type)}. */
    public PropertyBuilder property(String propertyName, TypeRef type) {
        return property(propertyName).type(type);
    }

    /** Returns an already-added property, to adjust its type or metadata. */
    public Optional<PropertyBuilder> existingProperty(String propertyName) {
        return Optional.ofNullable(properties.get(propertyName));
    }

    public List<String> propertyNames() {
        return List.copyOf(properties.keySet());
    }

    public ClassBuilder withMeta(String key, String value) {
        meta.put(key, value);
        return this;
    }

    public ClassBuilder alias(String alias) {
        return withMeta(MetaKey.ALIAS.key(), alias);
    }

    public ClassBuilder description(String description) {
        return withMeta(MetaKey.DESCRIPTION.key(), description);
    }

    /** A reference to this class, for use as a property or return type. */
    public TypeRef type() {
        return TypeRef.named(name);
    }

    ClassDef toDef() {
        List<PropertyDef> defs = new ArrayList<>(properties.size());
        properties.values().forEach(p -> defs.add(p.toDef()));
        return new ClassDef(name, meta.toMetadata(), defs);
    }
}
