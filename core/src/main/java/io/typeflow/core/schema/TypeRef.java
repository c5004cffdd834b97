package io.typeflow.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.typeflow.core.model.MediaKind;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reference to a type: a primitive, a literal, a named class or enum, or a composition of other
 * references. Named references are resolved by name against a {@link SchemaSnapshot}, never
 * through live pointers, so mutually recursive classes need no special handling.
 *
 * <p>{@link #toString()} renders the textual form accepted by {@link #parse(String)}, e.g.
 * {@code map<string, Item[]>?} or {@code "draft" | "final"}.
 */
public sealed interface TypeRef
        permits TypeRef.Primitive,
                TypeRef.Literal,
                TypeRef.Named,
                TypeRef.OptionalOf,
                TypeRef.ListOf,
                TypeRef.MapOf,
                TypeRef.UnionOf,
                TypeRef.Media {

    /** Scalar kinds. */
    enum PrimitiveKind {
        STRING,
        INT,
        FLOAT,
        BOOL;

        public String typeName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    record Primitive(PrimitiveKind kind) implements TypeRef {
        public Primitive {
            Objects.requireNonNull(kind, "kind must not be null");
        }

        @Override
        public String toString() {
            return kind.typeName();
        }
    }

    /** Exactly one string, integer or boolean value. */
    record Literal(JsonNode value) implements TypeRef {
        public Literal {
            Objects.requireNonNull(value, "value must not be null");
            if (!value.isTextual() && !value.isIntegralNumber() && !value.isBoolean()) {
                throw new IllegalArgumentException("a literal must be a string, integer or boolean, got: " + value);
            }
            if (value.isIntegralNumber()) {
                if (!value.canConvertToLong()) {
                    throw new IllegalArgumentException("integer literal out of range: " + value);
                }
                value = LongNode.valueOf(value.longValue());
            }
        }

        @Override
        public String toString() {
            if (value.isTextual()) {
                return "\"" + value.textValue().replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
            }
            return value.asText();
        }
    }

    /** A class or enum, looked up by name at snapshot time. */
    record Named(String name) implements TypeRef {
        public Named {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("type name must not be null or blank");
            }
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record OptionalOf(TypeRef inner) implements TypeRef {
        public OptionalOf {
            Objects.requireNonNull(inner, "inner must not be null");
        }

        @Override
        public String toString() {
            return (inner instanceof UnionOf ? "(" + inner + ")" : inner.toString()) + "?";
        }
    }

    record ListOf(TypeRef element) implements TypeRef {
        public ListOf {
            Objects.requireNonNull(element, "element must not be null");
        }

        @Override
        public String toString() {
            return (element instanceof UnionOf ? "(" + element + ")" : element.toString()) + "[]";
        }
    }

    /** String-keyed map. */
    record MapOf(TypeRef value) implements TypeRef {
        public MapOf {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String toString() {
            return "map<string, " + value + ">";
        }
    }

    record UnionOf(List<TypeRef> alternatives) implements TypeRef {
        public UnionOf {
            if (alternatives == null || alternatives.size() < 2) {
                throw new IllegalArgumentException("a union needs at least two alternatives");
            }
            alternatives = List.copyOf(alternatives);
        }

        @Override
        public String toString() {
            return alternatives.stream().map(TypeRef::toString).collect(Collectors.joining(" | "));
        }
    }

    record Media(MediaKind kind) implements TypeRef {
        public Media {
            Objects.requireNonNull(kind, "kind must not be null");
        }

        @Override
        public String toString() {
            return kind.typeName();
        }
    }

    // --- Factories ---

    static TypeRef string() {
        return new Primitive(PrimitiveKind.STRING);
    }

    static TypeRef integer() {
        return new Primitive(PrimitiveKind.INT);
    }

    static TypeRef floating() {
        return new Primitive(PrimitiveKind.FLOAT);
    }

    static TypeRef bool() {
        return new Primitive(PrimitiveKind.BOOL);
    }

    static TypeRef literal(String value) {
        return new Literal(TextNode.valueOf(value));
    }

    static TypeRef literal(long value) {
        return new Literal(LongNode.valueOf(value));
    }

    static TypeRef literal(boolean value) {
        return new Literal(BooleanNode.valueOf(value));
    }

    static TypeRef image() {
        return new Media(MediaKind.IMAGE);
    }

    static TypeRef audio() {
        return new Media(MediaKind.AUDIO);
    }

    static TypeRef named(String name) {
        return new Named(name);
    }

    static TypeRef listOf(TypeRef element) {
        return new ListOf(element);
    }

    static TypeRef mapOf(TypeRef value) {
        return new MapOf(value);
    }

    static TypeRef unionOf(TypeRef... alternatives) {
        return new UnionOf(List.of(alternatives));
    }

    /**
     * Parses a textual type expression.
     *
     * @throws io.typeflow.core.error.TypeSyntaxException if the expression is malformed
     */
    static TypeRef parse(String expression) {
        return new TypeExpressionParser(expression).parse();
    }

    // --- Combinators ---

    /** Returns this type made optional; already-optional types are returned unchanged. */
    default TypeRef optional() {
        return this instanceof OptionalOf ? this : new OptionalOf(this);
    }

    default TypeRef list() {
        return new ListOf(this);
    }

    default boolean isOptional() {
        return this instanceof OptionalOf;
    }

    /** Strips any optional wrapper. */
    default TypeRef unwrapOptional() {
        TypeRef current = this;
        while (current instanceof OptionalOf o) {
            current = o.inner();
        }
        return current;
    }
}
