package io.typeflow.core.error;

/**
 * Abstract parent for schema build-time errors. Thrown immediately by the offending registry
 * call, or by {@code SchemaRegistry.snapshot()}. Carries the name of the class or enum being
 * built, when one is known.
 */
public abstract class SchemaException extends TypeflowException {

    private static final long serialVersionUID = 1L;

    private final String typeName;

    protected SchemaException(String message, String typeName) {
        super(message, Phase.BUILD);
        this.typeName = typeName;
    }

    protected SchemaException(String message, Throwable cause, String typeName) {
        super(message, cause, Phase.BUILD);
        this.typeName = typeName;
    }

    /** The class or enum that triggered the error, or {@code null} if not identified. */
    public String typeName() {
        return typeName;
    }
}
