package io.typeflow.core.error;

import java.util.List;

/** Thrown when the accumulated payload exceeds the configured size or nesting depth. */
public final class DecodeBudgetExceededException extends DecodeException {

    private static final long serialVersionUID = 1L;

    public DecodeBudgetExceededException(String message, String targetType) {
        super(message, targetType, List.of());
    }
}
