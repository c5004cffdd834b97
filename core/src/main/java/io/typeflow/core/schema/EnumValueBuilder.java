package io.typeflow.core.schema;

/** Builder for one enum value. Obtained from {@link EnumBuilder#value(String)}. */
public final class EnumValueBuilder {

    private final String name;
    private final MetadataHolder meta;

    EnumValueBuilder(String enumName, String name) {
        this.name = name;
        this.meta = new MetadataHolder(enumName + "." + name);
    }

    public String name() {
        return name;
    }

    public EnumValueBuilder withMeta(String key, String value) {
        meta.put(key, value);
        return this;
    }

    public EnumValueBuilder alias(String alias) {
        return withMeta(MetaKey.ALIAS.key(), alias);
    }

    public EnumValueBuilder description(String description) {
        return withMeta(MetaKey.DESCRIPTION.key(), description);
    }

    EnumValueDef toDef() {
        return new EnumValueDef(name, meta.toMetadata());
    }
}
