package io.typeflow.core.decode;

/**
 * Resource limits for one decode session. Guards against runaway producers that never stop
 * streaming or nest without bound.
 *
 * <p>Immutable and thread-safe.
 *
 * @param maxPayloadChars maximum accumulated payload length in characters (default: 4 MiB)
 * @param maxDepth maximum nesting of objects and lists (default: 64)
 */
public record DecodeBudget(int maxPayloadChars, int maxDepth) {

    /** Default budget: 4 MiB payload, depth 64. */
    public static final DecodeBudget DEFAULT = new DecodeBudget(4 * 1024 * 1024, 64);

    public DecodeBudget {
        if (maxPayloadChars <= 0) {
            throw new IllegalArgumentException("maxPayloadChars must be positive, got: " + maxPayloadChars);
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
    }
}
