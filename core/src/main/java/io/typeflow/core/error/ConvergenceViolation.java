package io.typeflow.core.error;

/**
 * Signals an internal defect: a decode session retracted or altered a previously resolved leaf,
 * or finalized to a value that disagrees with its last partial value. Not a user-input error and
 * not part of the {@link TypeflowException} hierarchy; callers should treat it as fatal.
 */
public final class ConvergenceViolation extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String path;

    public ConvergenceViolation(String message, String path) {
        super(message + " at " + path);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
