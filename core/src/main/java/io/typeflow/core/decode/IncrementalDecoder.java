package io.typeflow.core.decode;

import io.typeflow.core.error.UnknownTypeReferenceException;
import io.typeflow.core.model.FinalValue;
import io.typeflow.core.schema.SchemaSnapshot;
import io.typeflow.core.schema.TypeRef;
import java.util.Objects;

/**
 * Opens {@link DecodeSession}s against a frozen schema.
 *
 * <p>Thread-safe: sessions share nothing but the immutable snapshot.
 */
public final class IncrementalDecoder {

    private final SchemaSnapshot schema;
    private final ValueCoercer coercer;
    private final DecodeBudget budget;

    public IncrementalDecoder(SchemaSnapshot schema) {
        this(schema, DecodeBudget.DEFAULT);
    }

    public IncrementalDecoder(SchemaSnapshot schema, DecodeBudget budget) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.coercer = new ValueCoercer(schema);
    }

    /**
     * @throws UnknownTypeReferenceException if {@code target} names a type the schema lacks
     */
    public DecodeSession open(TypeRef target) {
        schema.requireResolvable(target);
        return new DecodeSession(target, coercer, budget, startOf(target));
    }

    /** Decodes a complete payload in one step. */
    public FinalValue decode(TypeRef target, String payload) {
        DecodeSession session = open(target);
        session.feed(payload);
        return session.finish();
    }

    public SchemaSnapshot schema() {
        return schema;
    }

    public DecodeBudget budget() {
        return budget;
    }

    private RawParser.Start startOf(TypeRef target) {
        TypeRef type = target.unwrapOptional();
        if (type instanceof TypeRef.ListOf) {
            return RawParser.Start.ARRAY;
        }
        if (type instanceof TypeRef.MapOf) {
            return RawParser.Start.OBJECT;
        }
        if (type instanceof TypeRef.Named named) {
            return schema.classDef(named.name()).isPresent() ? RawParser.Start.OBJECT : RawParser.Start.SCALAR;
        }
        if (type instanceof TypeRef.Primitive || type instanceof TypeRef.Literal) {
            return RawParser.Start.SCALAR;
        }
        return RawParser.Start.ANY;
    }
}
