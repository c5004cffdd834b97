package io.typeflow.core.spi;

import java.util.List;

/**
 * One implementation of a named operation. Receives the caller's positional arguments and
 * produces the raw payload that the runtime decodes against the implementation's return type.
 */
@FunctionalInterface
public interface OperationHandler {

    /**
     * @param args positional arguments, passed through unchanged
     * @return the payload; closed by the runtime
     */
    PayloadStream open(List<Object> args);
}
