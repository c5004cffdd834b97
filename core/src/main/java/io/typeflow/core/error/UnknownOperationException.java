package io.typeflow.core.error;

/** Thrown when an operation is unknown, or declared without any implementation bound to it. */
public final class UnknownOperationException extends DispatchException {

    private static final long serialVersionUID = 1L;

    public UnknownOperationException(String operation) {
        super("No implementation registered for operation '" + operation + "'", operation);
    }
}
