package io.typeflow.core.error;

/**
 * Abstract base for all typeflow exceptions. Never thrown directly: use the concrete subclasses
 * under {@link SchemaException}, {@link DispatchException} or {@link DecodeException}.
 *
 * <p>Internal defects are reported through {@link ConvergenceViolation}, which deliberately sits
 * outside this hierarchy.
 */
public abstract class TypeflowException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        BUILD,
        DISPATCH,
        DECODE
    }

    private final Phase phase;

    protected TypeflowException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected TypeflowException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
