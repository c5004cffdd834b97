package io.typeflow.core.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.typeflow.core.error.DuplicateVersionException;
import io.typeflow.core.error.UnknownOperationException;
import io.typeflow.core.error.UnknownVersionException;
import io.typeflow.core.schema.TypeRef;
import io.typeflow.core.spi.OperationHandler;
import io.typeflow.core.spi.PayloadStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for operation registration and implementation resolution. */
@DisplayName("OperationRegistry")
class OperationRegistryTest {

    private static final OperationHandler EMPTY = args -> PayloadStream.of();

    private OperationRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new OperationRegistry(Fixtures.schema());
    }

    @Test
    @DisplayName("Without a version or default, the first registered implementation is used")
    void firstRegisteredIsDefault() {
        registry.register("extractUser", "v1", TypeRef.named("User"), EMPTY);
        registry.register("extractUser", "v2", TypeRef.named("Account"), EMPTY);

        assertThat(registry.resolve("extractUser", null).version()).isEqualTo("v1");
        assertThat(registry.resolve("extractUser", "v2").returnType()).isEqualTo(TypeRef.named("Account"));
    }

    @Test
    @DisplayName("An explicit default version overrides registration order")
    void explicitDefault() {
        registry.register("extractUser", "v1", TypeRef.named("User"), EMPTY);
        registry.register("extractUser", "v2", TypeRef.named("User"), EMPTY);

        registry.setDefaultVersion("extractUser", "v2");

        assertThat(registry.resolve("extractUser", null).version()).isEqualTo("v2");
        assertThat(registry.resolve("extractUser", "v1").version()).isEqualTo("v1");
        assertThat(registry.operation("extractUser").orElseThrow().defaultVersion()).isEqualTo("v2");
    }

    @Test
    @DisplayName("Unknown operations and versions are rejected")
    void unknownLookups() {
        registry.register("extractUser", "v1", TypeRef.named("User"), EMPTY);

        assertThatThrownBy(() -> registry.resolve("summarize", null))
                .isInstanceOfSatisfying(
                        UnknownOperationException.class, e -> assertThat(e.operation()).isEqualTo("summarize"));
        assertThatThrownBy(() -> registry.resolve("extractUser", "v9"))
                .isInstanceOfSatisfying(UnknownVersionException.class, e -> {
                    assertThat(e.operation()).isEqualTo("extractUser");
                    assertThat(e.version()).isEqualTo("v9");
                });
        assertThatThrownBy(() -> registry.setDefaultVersion("extractUser", "v9"))
                .isInstanceOf(UnknownVersionException.class);
        assertThatThrownBy(() -> registry.setDefaultVersion("summarize", "v1"))
                .isInstanceOf(UnknownOperationException.class);
    }

    @Test
    @DisplayName("A declared operation without implementations cannot be resolved")
    void declaredButUnbound() {
        registry.declare("summarize");

        assertThat(registry.operation("summarize")).hasValueSatisfying(spec -> {
            assertThat(spec.isCallable()).isFalse();
            assertThat(spec.versions()).isEmpty();
        });
        assertThatThrownBy(() -> registry.resolve("summarize", null)).isInstanceOf(UnknownOperationException.class);
        assertThatThrownBy(() -> registry.stream("summarize", null)).isInstanceOf(UnknownOperationException.class);
    }

    @Test
    @DisplayName("Registering a version twice fails and keeps the first binding")
    void duplicateVersion() {
        registry.register("extractUser", "v1", TypeRef.named("User"), EMPTY);

        assertThatThrownBy(() -> registry.register("extractUser", "v1", TypeRef.named("Account"), EMPTY))
                .isInstanceOfSatisfying(DuplicateVersionException.class, e -> assertThat(e.version())
                        .isEqualTo("v1"));
        assertThat(registry.resolve("extractUser", "v1").returnType()).isEqualTo(TypeRef.named("User"));
    }

    @Test
    @DisplayName("Operation names are listed in declaration order")
    void declarationOrder() {
        registry.register("b", "v1", TypeRef.named("User"), EMPTY);
        registry.declare("a");
        registry.register("c", "v1", TypeRef.named("User"), EMPTY);
        registry.register("b", "v2", TypeRef.named("User"), EMPTY);

        assertThat(registry.operationNames()).containsExactly("b", "a", "c");
        assertThat(registry.operation("b").orElseThrow().versions()).containsExactly("v1", "v2");
        assertThat(registry.operation("missing")).isEmpty();
    }

    @Test
    @DisplayName("Blank names and versions are rejected")
    void blankNames() {
        assertThatThrownBy(() -> registry.declare(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register("op", " ", TypeRef.named("User"), EMPTY))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
