package io.typeflow.core.error;

import java.util.List;

/**
 * Operation-boundary wrapper for any terminal decode problem. Raised by {@code
 * OperationRegistry.call()} and stream handles; the cause is the underlying {@link
 * DecodeException}.
 */
public final class DecodeFailureException extends DecodeException {

    private static final long serialVersionUID = 1L;

    private final String operation;
    private final String version;

    public DecodeFailureException(String operation, String version, DecodeException cause) {
        super(
                "Operation '" + operation + "@" + version + "' failed to decode " + cause.targetType() + ": "
                        + cause.getMessage(),
                cause,
                cause.targetType(),
                cause.paths());
        this.operation = operation;
        this.version = version;
    }

    public DecodeFailureException(String operation, String version, String targetType, String detail) {
        super(
                "Operation '" + operation + "@" + version + "' failed to decode " + targetType + ": " + detail,
                targetType,
                List.of());
        this.operation = operation;
        this.version = version;
    }

    public String operation() {
        return operation;
    }

    public String version() {
        return version;
    }
}
