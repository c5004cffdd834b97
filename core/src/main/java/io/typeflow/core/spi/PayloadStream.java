package io.typeflow.core.spi;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pull-style source of raw payload increments produced by an operation implementation (for
 * example a model completion streamed over the network).
 *
 * <p>Implementations need not be thread-safe; one invocation reads one stream.
 */
public interface PayloadStream extends AutoCloseable {

    /**
     * Blocks until the next increment is available.
     *
     * @return the next increment, or empty at end-of-input
     */
    Optional<String> next();

    /** Releases the underlying source. Called on completion, failure and cancellation. */
    @Override
    default void close() {}

    /** A stream over fixed increments. */
    static PayloadStream of(String... increments) {
        return of(List.of(increments));
    }

    static PayloadStream of(List<String> increments) {
        List<String> remaining = new ArrayList<>(increments);
        return () -> remaining.isEmpty() ? Optional.empty() : Optional.of(remaining.remove(0));
    }
}
