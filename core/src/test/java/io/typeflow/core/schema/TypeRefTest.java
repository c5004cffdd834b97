package io.typeflow.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import io.typeflow.core.error.TypeSyntaxException;
import io.typeflow.core.model.MediaKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link TypeRef} factories, combinators and the textual grammar. */
@DisplayName("TypeRef")
class TypeRefTest {

    @Test
    @DisplayName("Keywords parse to primitives and media, anything else to a named type")
    void keywordsAndNames() {
        assertThat(TypeRef.parse("string")).isEqualTo(TypeRef.string());
        assertThat(TypeRef.parse("int")).isEqualTo(TypeRef.integer());
        assertThat(TypeRef.parse("float")).isEqualTo(TypeRef.floating());
        assertThat(TypeRef.parse("bool")).isEqualTo(TypeRef.bool());
        assertThat(TypeRef.parse("image")).isEqualTo(new TypeRef.Media(MediaKind.IMAGE));
        assertThat(TypeRef.parse("audio")).isEqualTo(TypeRef.audio());
        assertThat(TypeRef.parse("User")).isEqualTo(TypeRef.named("User"));
    }

    @Test
    @DisplayName("Quoted strings, integers and true/false parse to literals")
    void literals() {
        assertThat(TypeRef.parse("\"draft\" | \"final\""))
                .isEqualTo(TypeRef.unionOf(TypeRef.literal("draft"), TypeRef.literal("final")));
        assertThat(TypeRef.parse("-1")).isEqualTo(TypeRef.literal(-1));
        assertThat(TypeRef.parse("true")).isEqualTo(TypeRef.literal(true));
        assertThat(TypeRef.parse("\"say \\\"hi\\\"\"")).isEqualTo(TypeRef.literal("say \"hi\""));
        assertThat(TypeRef.literal("say \"hi\"").toString()).isEqualTo("\"say \\\"hi\\\"\"");
        assertThat(new TypeRef.Literal(IntNode.valueOf(3))).isEqualTo(TypeRef.literal(3));
        assertThatThrownBy(() -> new TypeRef.Literal(DoubleNode.valueOf(1.5)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Postfix operators apply left to right")
    void postfixOperators() {
        assertThat(TypeRef.parse("Item[]?")).isEqualTo(TypeRef.named("Item").list().optional());
        assertThat(TypeRef.parse("Item?[]")).isEqualTo(TypeRef.listOf(TypeRef.named("Item").optional()));
    }

    @Test
    @DisplayName("Union binds looser than postfix; parentheses group")
    void unionPrecedence() {
        assertThat(TypeRef.parse("int | string[]"))
                .isEqualTo(TypeRef.unionOf(TypeRef.integer(), TypeRef.string().list()));
        assertThat(TypeRef.parse("(int | string)[]"))
                .isEqualTo(TypeRef.listOf(TypeRef.unionOf(TypeRef.integer(), TypeRef.string())));
    }

    @Test
    @DisplayName("Maps take string keys and any value type")
    void maps() {
        assertThat(TypeRef.parse("map<string, Item[]>"))
                .isEqualTo(TypeRef.mapOf(TypeRef.named("Item").list()));
        assertThatThrownBy(() -> TypeRef.parse("map<int, string>"))
                .isInstanceOf(TypeSyntaxException.class)
                .hasMessageContaining("Map keys must be 'string'");
    }

    @ParameterizedTest
    @ValueSource(strings = {"string", "int?", "Item[]", "(int | string)[]", "map<string, Item[]>?", "A | B | C", "image?", "\"draft\" | \"final\"", "(1 | 2)[]", "false?"})
    @DisplayName("toString renders an expression that parses back to the same type")
    void renderingIsParseable(String expression) {
        TypeRef type = TypeRef.parse(expression);

        assertThat(type.toString()).isEqualTo(expression);
        assertThat(TypeRef.parse(type.toString())).isEqualTo(type);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "int)", "[]", "Item[", "int |", "9lives", "map<string int>", "\"open", "-", "99999999999999999999"})
    @DisplayName("Malformed expressions fail with TypeSyntaxException")
    void malformedExpressions(String expression) {
        assertThatThrownBy(() -> TypeRef.parse(expression))
                .isInstanceOf(TypeSyntaxException.class)
                .satisfies(e -> assertThat(((TypeSyntaxException) e).expression()).isEqualTo(expression));
    }

    @Test
    @DisplayName("optional() is idempotent and unwrapOptional() strips it")
    void optionalCombinators() {
        TypeRef optional = TypeRef.string().optional();

        assertThat(optional.optional()).isSameAs(optional);
        assertThat(optional.isOptional()).isTrue();
        assertThat(optional.unwrapOptional()).isEqualTo(TypeRef.string());
        assertThat(TypeRef.string().isOptional()).isFalse();
    }

    @Test
    @DisplayName("A union needs at least two alternatives")
    void unionArity() {
        assertThatThrownBy(() -> TypeRef.unionOf(TypeRef.string()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
