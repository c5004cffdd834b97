package io.typeflow.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The fully resolved result of a decode session. Every declared class property is present;
 * optional values that never resolved are JSON {@code null}.
 *
 * <p>Immutable: accessors hand out copies.
 */
public final class FinalValue {

    private static final ObjectMapper MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final JsonNode value;
    private final String targetType;

    public FinalValue(JsonNode value, String targetType) {
        this.value = Objects.requireNonNull(value, "value must not be null").deepCopy();
        this.targetType = Objects.requireNonNull(targetType, "targetType must not be null");
    }

    /** A copy of the value. */
    public JsonNode value() {
        return value.deepCopy();
    }

    /** The target type expression this value was decoded against. */
    public String targetType() {
        return targetType;
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

    /**
     * Binds the value to a caller type through Jackson, ignoring unknown properties.
     *
     * @throws IllegalArgumentException if the value cannot be bound to {@code type}
     */
    public <T> T as(Class<T> type) {
        try {
            return MAPPER.treeToValue(value, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot bind " + targetType + " value to " + type.getName(), e);
        }
    }

    /** Compact JSON rendering. */
    public String toJson() {
        return value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FinalValue that)) return false;
        return value.equals(that.value) && targetType.equals(that.targetType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, targetType);
    }

    @Override
    public String toString() {
        return "FinalValue[" + targetType + " " + value + "]";
    }
}
