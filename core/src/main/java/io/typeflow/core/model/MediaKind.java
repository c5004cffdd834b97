package io.typeflow.core.model;

import java.util.Locale;
import java.util.Optional;

/** Kind tag of an opaque media value. */
public enum MediaKind {
    IMAGE,
    AUDIO;

    /** The lowercase name used in type expressions and serialized values. */
    public String typeName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Looks up a kind by its type name, ignoring case. */
    public static Optional<MediaKind> fromTypeName(String typeName) {
        for (MediaKind kind : values()) {
            if (kind.typeName().equalsIgnoreCase(typeName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
