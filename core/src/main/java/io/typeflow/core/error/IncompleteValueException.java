package io.typeflow.core.error;

import java.util.List;

/**
 * Thrown by the final resolution pass when a required value is still unresolved at end-of-input
 * (missing, malformed, or an enum token that matches no value or several values).
 */
public final class IncompleteValueException extends DecodeException {

    private static final long serialVersionUID = 1L;

    /**
     * A required path left unresolved.
     *
     * @param path value path, {@code $} for the root
     * @param reason short diagnostic
     */
    public record Unresolved(String path, String reason) {

        @Override
        public String toString() {
            return path + " (" + reason + ")";
        }
    }

    private final List<Unresolved> unresolved;

    public IncompleteValueException(String targetType, List<Unresolved> unresolved) {
        super(
                "Incomplete value for " + targetType + ": " + unresolved,
                targetType,
                unresolved.stream().map(Unresolved::path).toList());
        this.unresolved = List.copyOf(unresolved);
    }

    public List<Unresolved> unresolved() {
        return unresolved;
    }
}
