package io.typeflow.core.schema;

import java.util.Objects;

/** Builder for one class property. Obtained from {@link ClassBuilder#property(String)}. */
public final class PropertyBuilder {

    private final String name;
    private final MetadataHolder meta;
    private TypeRef type;

    PropertyBuilder(String className, String name) {
        this.name = name;
        this.meta = new MetadataHolder(className + "." + name);
    }

    public String name() {
        return name;
    }

    /**
     * Sets the declared type. Named references are not checked here; they are validated by
     * {@link SchemaRegistry#snapshot()} so that classes may refer to each other in any order.
     */
    public PropertyBuilder type(TypeRef type) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        return this;
    }

    /**
     * Sets the declared type from a textual expression such as {@code Item[]?}.
     *
     * @throws io.typeflow.core.error.TypeSyntaxException if the expression is malformed
     */
    public PropertyBuilder type(String expression) {
        return type(TypeRef.parse(expression));
    }

    /**
     * Attaches metadata.
     *
     * @throws io.typeflow.core.error.UnsupportedMetadataKeyException if {@code key} is neither
     *     {@code alias} nor {@code description}
     */
    public PropertyBuilder withMeta(String key, String value) {
        meta.put(key, value);
        return this;
    }

    public PropertyBuilder alias(String alias) {
        return withMeta(MetaKey.ALIAS.key(), alias);
    }

    public PropertyBuilder description(String description) {
        return withMeta(MetaKey.DESCRIPTION.key(), description);
    }

    PropertyDef toDef() {
        return new PropertyDef(name, type, meta.toMetadata());
    }
}
