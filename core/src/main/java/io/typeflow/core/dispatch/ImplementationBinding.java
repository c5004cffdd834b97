package io.typeflow.core.dispatch;

import io.typeflow.core.schema.TypeRef;
import io.typeflow.core.spi.OperationHandler;
import java.util.Objects;

/**
 * One versioned implementation of an operation: the type its payload decodes to and the handler
 * that produces the payload.
 *
 * @param version implementation version, unique within the operation
 * @param returnType decode target for the handler's payload
 * @param handler payload producer
 */
public record ImplementationBinding(String version, TypeRef returnType, OperationHandler handler) {

    public ImplementationBinding {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version must not be null or blank");
        }
        Objects.requireNonNull(returnType, "returnType must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
    }
}
