package io.typeflow.core.error;

import java.util.List;

/**
 * Thrown by {@code SchemaRegistry.snapshot()} when one or more property types reference a class
 * or enum that is not defined. Lists every dangling reference, not only the first.
 */
public final class UnresolvedTypeReferenceException extends SchemaException {

    private static final long serialVersionUID = 1L;

    /**
     * One dangling reference.
     *
     * @param owner the class declaring the property
     * @param property the property whose type is dangling
     * @param reference the missing type name, or {@code null} when no type was set at all
     */
    public record DanglingReference(String owner, String property, String reference) {

        @Override
        public String toString() {
            return owner + "." + property + " -> " + (reference != null ? reference : "<unset>");
        }
    }

    private final List<DanglingReference> references;

    public UnresolvedTypeReferenceException(List<DanglingReference> references) {
        super("Unresolved type references: " + references, null);
        this.references = List.copyOf(references);
    }

    public List<DanglingReference> references() {
        return references;
    }
}
