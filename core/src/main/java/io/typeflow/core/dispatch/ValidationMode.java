package io.typeflow.core.dispatch;

/**
 * Validation applied to a final value before it is returned.
 *
 * <ul>
 * <li>{@link #LENIENT}: the decoder's own type checks only (default).</li>
 * <li>{@link #STRICT}: additionally validate the value against the JSON Schema exported for the
 * target type; violations fail the invocation.</li>
 * </ul>
 */
public enum ValidationMode {
    /** Decoder type checks only. */
    LENIENT,

    /** Validate the final value against the exported JSON Schema. */
    STRICT
}
