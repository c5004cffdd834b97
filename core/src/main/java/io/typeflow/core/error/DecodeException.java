package io.typeflow.core.error;

import java.util.List;

/**
 * Abstract parent for decode errors. Local leaf problems are absorbed by the decoder; only
 * terminal problems surface as a {@code DecodeException}. Carries the rendered target type and
 * the paths that could not be resolved.
 */
public abstract class DecodeException extends TypeflowException {

    private static final long serialVersionUID = 1L;

    private final String targetType;
    private final List<String> paths;

    protected DecodeException(String message, String targetType, List<String> paths) {
        super(message, Phase.DECODE);
        this.targetType = targetType;
        this.paths = List.copyOf(paths);
    }

    protected DecodeException(String message, Throwable cause, String targetType, List<String> paths) {
        super(message, cause, Phase.DECODE);
        this.targetType = targetType;
        this.paths = List.copyOf(paths);
    }

    /** The target type expression, e.g. {@code User} or {@code Item[]}. */
    public String targetType() {
        return targetType;
    }

    /** Unresolved value paths, e.g. {@code status} or {@code items[2].name}. */
    public List<String> paths() {
        return paths;
    }
}
