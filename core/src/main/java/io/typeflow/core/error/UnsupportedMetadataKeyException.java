package io.typeflow.core.error;

/** Thrown when metadata is attached under a key other than {@code alias} or {@code description}. */
public final class UnsupportedMetadataKeyException extends SchemaException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public UnsupportedMetadataKeyException(String key, String typeName) {
        super("Unsupported metadata key '" + key + "' on '" + typeName + "' (allowed: alias, description)", typeName);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
