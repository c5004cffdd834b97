package io.typeflow.core.error;

/** Thrown when a property (or enum value) name is reused within one class (or enum). */
public final class DuplicatePropertyException extends SchemaException {

    private static final long serialVersionUID = 1L;

    private final String memberName;

    public DuplicatePropertyException(String typeName, String memberName) {
        super("'" + memberName + "' is already defined in '" + typeName + "'", typeName);
        this.memberName = memberName;
    }

    /** The property or enum value name that was defined twice. */
    public String memberName() {
        return memberName;
    }
}
