package io.typeflow.core.error;

/** Thrown when the same (operation, version) pair is registered twice. */
public final class DuplicateVersionException extends DispatchException {

    private static final long serialVersionUID = 1L;

    private final String version;

    public DuplicateVersionException(String operation, String version) {
        super("Operation '" + operation + "' already has version '" + version + "'", operation);
        this.version = version;
    }

    public String version() {
        return version;
    }
}
