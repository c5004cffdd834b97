package io.typeflow.core.error;

/** Thrown when a class or enum name is already used by another class or enum of the registry. */
public final class DuplicateDefinitionException extends SchemaException {

    private static final long serialVersionUID = 1L;

    public DuplicateDefinitionException(String typeName) {
        super("Type '" + typeName + "' is already defined", typeName);
    }
}
