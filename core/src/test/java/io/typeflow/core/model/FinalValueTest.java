package io.typeflow.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link PartialValue} and {@link FinalValue}. */
@DisplayName("PartialValue / FinalValue")
class FinalValueTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    record User(String name, Integer age) {}

    @Test
    @DisplayName("Emitted values are isolated from the source node and from callers")
    void deepCopies() throws Exception {
        ObjectNode source = (ObjectNode) JSON.readTree("{\"name\":\"Ann\"}");
        PartialValue partial = new PartialValue(source, 0);

        source.put("name", "Bob");
        ((ObjectNode) partial.value()).put("name", "Eve");

        assertThat(partial.get("name").orElseThrow().asText()).isEqualTo("Ann");
    }

    @Test
    @DisplayName("Final values bind to caller types through Jackson")
    void bindsToRecord() throws Exception {
        FinalValue value = new FinalValue(JSON.readTree("{\"name\":\"Ann\",\"age\":null,\"extra\":1}"), "User");

        User user = value.as(User.class);

        assertThat(user).isEqualTo(new User("Ann", null));
        assertThat(value.isResolved("name")).isTrue();
        assertThat(value.isResolved("age")).isFalse();
        assertThat(value.toJson()).isEqualTo("{\"name\":\"Ann\",\"age\":null,\"extra\":1}");
    }

    @Test
    @DisplayName("Binding failures are reported as IllegalArgumentException")
    void bindingFailure() throws Exception {
        FinalValue value = new FinalValue(JSON.readTree("{\"name\":\"Ann\",\"age\":\"old\"}"), "User");

        assertThatThrownBy(() -> value.as(User.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("User");
    }

    @Test
    @DisplayName("Leaves of a partial value exclude placeholders")
    void partialLeaves() throws Exception {
        JsonNode node = JSON.readTree("{\"items\":[null,\"b\"]}");
        PartialValue partial = new PartialValue(node, 3);

        assertThat(partial.sequence()).isEqualTo(3);
        assertThat(partial.leaves()).containsOnlyKeys("items[1]");
        assertThat(partial.isResolved("items[0]")).isFalse();
    }
}
