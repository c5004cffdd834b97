package io.typeflow.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for value paths and leaf flattening. */
@DisplayName("ValuePaths")
class ValuePathsTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    @DisplayName("Paths compose from the root")
    void pathComposition() {
        assertThat(ValuePaths.field(ValuePaths.ROOT, "items")).isEqualTo("items");
        assertThat(ValuePaths.index("items", 2)).isEqualTo("items[2]");
        assertThat(ValuePaths.field("items[2]", "name")).isEqualTo("items[2].name");
        assertThat(ValuePaths.index(ValuePaths.ROOT, 0)).isEqualTo("[0]");
    }

    @Test
    @DisplayName("Leaves are scalars in document order; nulls are not leaves")
    void leaves() throws Exception {
        JsonNode value = JSON.readTree("{\"name\":\"Ann\",\"age\":null,\"tags\":[\"a\",null],\"meta\":{\"n\":1}}");

        Map<String, JsonNode> leaves = ValuePaths.leaves(value);

        assertThat(leaves).containsExactly(
                Map.entry("name", TextNode.valueOf("Ann")),
                Map.entry("tags[0]", TextNode.valueOf("a")),
                Map.entry("meta.n", IntNode.valueOf(1)));
    }

    @Test
    @DisplayName("A scalar root is a single leaf at $")
    void scalarRoot() {
        assertThat(ValuePaths.leaves(TextNode.valueOf("x"))).containsOnlyKeys("$");
    }

    @Test
    @DisplayName("get() follows fields and indices and skips nulls")
    void lookup() throws Exception {
        JsonNode value = JSON.readTree("{\"items\":[{\"name\":\"pen\"},{\"name\":null}]}");

        assertThat(ValuePaths.get(value, "items[0].name")).contains(TextNode.valueOf("pen"));
        assertThat(ValuePaths.get(value, "items[1].name")).isEmpty();
        assertThat(ValuePaths.get(value, "items[5].name")).isEmpty();
        assertThat(ValuePaths.get(value, "missing")).isEmpty();
        assertThat(ValuePaths.get(value, "$")).contains(value);
    }

    @Test
    @DisplayName("Keys containing path syntax are quoted and never collide with nested fields")
    void quotedKeys() throws Exception {
        assertThat(ValuePaths.field("attrs", "a.b")).isEqualTo("attrs[\"a.b\"]");
        assertThat(ValuePaths.field(ValuePaths.ROOT, "x[0]")).isEqualTo("[\"x[0]\"]");
        assertThat(ValuePaths.field(ValuePaths.ROOT, "say \"hi\"")).isEqualTo("[\"say \\\"hi\\\"\"]");
        assertThat(ValuePaths.field(ValuePaths.ROOT, "")).isEqualTo("[\"\"]");
        assertThat(ValuePaths.field(ValuePaths.ROOT, "$")).isEqualTo("[\"$\"]");

        JsonNode value = JSON.readTree("{\"a.b\":\"1\",\"a\":{\"b\":\"2\"}}");

        assertThat(ValuePaths.leaves(value)).containsExactly(
                Map.entry("[\"a.b\"]", TextNode.valueOf("1")),
                Map.entry("a.b", TextNode.valueOf("2")));
    }

    @Test
    @DisplayName("get() reads quoted keys, escapes included")
    void quotedLookup() throws Exception {
        JsonNode value = JSON.readTree("{\"m\":{\"a.b\":[{\"q\\\"k\":7}]}}");

        assertThat(ValuePaths.get(value, "m[\"a.b\"][0][\"q\\\"k\"]")).contains(IntNode.valueOf(7));
        assertThat(ValuePaths.get(value, "m[\"a.b\"")).isEmpty();
        for (Map.Entry<String, JsonNode> leaf : ValuePaths.leaves(value).entrySet()) {
            assertThat(ValuePaths.get(value, leaf.getKey())).contains(leaf.getValue());
        }
    }
}
