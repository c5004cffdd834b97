package io.typeflow.core.error;

/** Thrown when a YAML schema document has invalid syntax, unknown keys or missing fields. */
public final class SchemaParseException extends SchemaException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public SchemaParseException(String message, String typeName, String source) {
        super(message, typeName);
        this.source = source;
    }

    public SchemaParseException(String message, Throwable cause, String typeName, String source) {
        super(message, cause, typeName);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
