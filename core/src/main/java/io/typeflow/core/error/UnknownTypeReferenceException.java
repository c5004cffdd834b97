package io.typeflow.core.error;

/**
 * Thrown when a type name is looked up and is not defined: extending a class or enum that was
 * never defined, or opening a decode session for a target naming a type absent from the snapshot.
 */
public final class UnknownTypeReferenceException extends SchemaException {

    private static final long serialVersionUID = 1L;

    public UnknownTypeReferenceException(String typeName) {
        super("Unknown type '" + typeName + "'", typeName);
    }
}
