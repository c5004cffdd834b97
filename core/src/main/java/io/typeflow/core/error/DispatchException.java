package io.typeflow.core.error;

/**
 * Abstract parent for operation dispatch errors, reported synchronously by {@code
 * OperationRegistry}. Carries the operation name.
 */
public abstract class DispatchException extends TypeflowException {

    private static final long serialVersionUID = 1L;

    private final String operation;

    protected DispatchException(String message, String operation) {
        super(message, Phase.DISPATCH);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
