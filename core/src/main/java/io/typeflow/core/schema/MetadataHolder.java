package io.typeflow.core.schema;

import io.typeflow.core.error.UnsupportedMetadataKeyException;

/** Mutable metadata shared by all builders. */
final class MetadataHolder {

    private final String owner;
    private String alias;
    private String description;

    MetadataHolder(String owner) {
        this.owner = owner;
    }

    void put(String key, String value) {
        MetaKey metaKey = MetaKey.fromKey(key).orElseThrow(() -> new UnsupportedMetadataKeyException(key, owner));
        switch (metaKey) {
            case ALIAS -> alias = value;
            case DESCRIPTION -> description = value;
        }
    }

    Metadata toMetadata() {
        return alias == null && description == null ? Metadata.EMPTY : new Metadata(alias, description);
    }
}
