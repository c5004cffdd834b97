package io.typeflow.core.schema;

import java.util.Optional;

/** Recognized metadata keys. Anything else is rejected at build time. */
public enum MetaKey {
    ALIAS("alias"),
    DESCRIPTION("description");

    private final String key;

    MetaKey(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<MetaKey> fromKey(String key) {
        for (MetaKey metaKey : values()) {
            if (metaKey.key.equals(key)) {
                return Optional.of(metaKey);
            }
        }
        return Optional.empty();
    }
}
