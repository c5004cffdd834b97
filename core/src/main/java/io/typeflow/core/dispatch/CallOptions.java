package io.typeflow.core.dispatch;

import io.typeflow.core.schema.SchemaSnapshot;
import java.util.Objects;

/**
 * Per-invocation settings.
 *
 * @param version implementation version, or {@code null} for the operation's default
 * @param schema schema to decode against instead of the registry's, or {@code null}
 * @param validationMode validation applied to the final value
 */
public record CallOptions(String version, SchemaSnapshot schema, ValidationMode validationMode) {

    public static final CallOptions DEFAULT = new CallOptions(null, null, ValidationMode.LENIENT);

    public CallOptions {
        Objects.requireNonNull(validationMode, "validationMode must not be null");
    }

    public static CallOptions version(String version) {
        return DEFAULT.withVersion(version);
    }

    public CallOptions withVersion(String version) {
        return new CallOptions(version, schema, validationMode);
    }

    public CallOptions withSchema(SchemaSnapshot schema) {
        return new CallOptions(version, schema, validationMode);
    }

    public CallOptions withValidationMode(ValidationMode validationMode) {
        return new CallOptions(version, schema, validationMode);
    }
}
