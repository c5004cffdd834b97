package io.typeflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A snapshot of a value that is still arriving: unresolved fields are absent, unresolved list
 * elements are {@code null}. Each emission is an independent deep copy; later increments never
 * mutate an instance already handed out.
 */
public final class PartialValue {

    private final JsonNode value;
    private final int sequence;

    public PartialValue(JsonNode value, int sequence) {
        this.value = Objects.requireNonNull(value, "value must not be null").deepCopy();
        this.sequence = sequence;
    }

    /** A copy of the current value. */
    public JsonNode value() {
        return value.deepCopy();
    }

    /** Zero-based emission index within its decode session. */
    public int sequence() {
        return sequence;
    }

    public Optional<JsonNode> get(String path) {
        return ValuePaths.get(value, path).map(JsonNode::deepCopy);
    }

    public boolean isResolved(String path) {
        return ValuePaths.get(value, path).isPresent();
    }

    /** Resolved scalar leaves keyed by path. */
    public Map<String, JsonNode> leaves() {
        return ValuePaths.leaves(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartialValue that)) return false;
        return sequence == that.sequence && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, sequence);
    }

    @Override
    public String toString() {
        return "PartialValue[#" + sequence + " " + value + "]";
    }
}
