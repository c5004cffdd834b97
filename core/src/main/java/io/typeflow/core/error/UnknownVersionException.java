package io.typeflow.core.error;

/** Thrown when an explicit implementation version is not registered for the operation. */
public final class UnknownVersionException extends DispatchException {

    private static final long serialVersionUID = 1L;

    private final String version;

    public UnknownVersionException(String operation, String version) {
        super("Operation '" + operation + "' has no version '" + version + "'", operation);
        this.version = version;
    }

    public String version() {
        return version;
    }
}
