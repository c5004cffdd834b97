package io.typeflow.core.decode;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.typeflow.core.model.FinalValue;
import io.typeflow.core.model.PartialValue;
import io.typeflow.core.schema.ClassBuilder;
import io.typeflow.core.schema.SchemaRegistry;
import io.typeflow.core.schema.TypeRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Feeds the same payload in increments of different sizes and checks that every split converges
 * to the value a one-shot decode produces, without retracting or altering a resolved leaf.
 */
@DisplayName("Streaming convergence")
class StreamingConvergenceTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final String PAYLOAD = """
            Sure! Here is the order you asked for:

            ```json
            {
              "id": "ord-1042",
              customer: {"name": "Ada Lovelace", "mail": 'ada@example.com'},
              "lines": [
                {"sku": "A-1", "qty": 2, "price": 12.5},
                {"sku": "B-7", "qty": "3", "price": "call for quote"},
              ],
              "status": "dispatched",
              "notes": null,
              "attributes": {"gift": "yes", "channel": "web"}
            }
            ```
            Let me know if you need anything else.
            """;

    private static final String EXPECTED = """
            {"id": "ord-1042",
             "customer": {"name": "Ada Lovelace", "email": "ada@example.com"},
             "lines": [{"sku": "A-1", "qty": 2, "price": 12.5},
                       {"sku": "B-7", "qty": 3, "price": "call for quote"}],
             "status": "SHIPPED",
             "notes": null,
             "attributes": {"gift": "yes", "channel": "web"}}
            """;

    private static IncrementalDecoder decoder;

    @BeforeAll
    static void schema() {
        SchemaRegistry registry = new SchemaRegistry();
        ClassBuilder customer = registry.defineClass("Customer");
        customer.property("name").type("string");
        customer.property("email").type("string?").alias("mail");

        ClassBuilder line = registry.defineClass("Line");
        line.property("sku").type("string");
        line.property("qty").type("int");
        line.property("price").type("float | string");

        registry.defineEnum("OrderStatus").value("PLACED");
        registry.extendEnum("OrderStatus").value("SHIPPED").alias("dispatched");
        registry.extendEnum("OrderStatus").value("CANCELLED");

        ClassBuilder order = registry.defineClass("Order");
        order.property("id").type("string");
        order.property("customer").type("Customer");
        order.property("lines").type("Line[]");
        order.property("status").type("OrderStatus");
        order.property("notes").type("string?");
        order.property("attributes").type("map<string, string>");
        decoder = new IncrementalDecoder(registry.snapshot());
    }

    private static List<String> split(String payload, int size) {
        List<String> chunks = new ArrayList<>();
        for (int i = 0; i < payload.length(); i += size) {
            chunks.add(payload.substring(i, Math.min(payload.length(), i + size)));
        }
        return chunks;
    }

    @Test
    @DisplayName("One-shot decode produces the expected order")
    void oneShot() throws Exception {
        FinalValue value = decoder.decode(TypeRef.named("Order"), PAYLOAD);

        assertThat(value.value()).isEqualTo(JSON.readTree(EXPECTED));
    }

    @ParameterizedTest(name = "increments of {0} characters")
    @ValueSource(ints = {1, 2, 3, 4, 5, 6, 7, 64})
    @DisplayName("Every split converges to the one-shot value")
    void everySplitConverges(int size) throws Exception {
        DecodeSession session = decoder.open(TypeRef.named("Order"));
        ConvergenceTracker tracker = new ConvergenceTracker();

        for (String chunk : split(PAYLOAD, size)) {
            Optional<PartialValue> partial = session.feed(chunk);
            partial.ifPresent(tracker::observePartial);
        }
        FinalValue value = session.finish();
        tracker.observeFinal(value);

        assertThat(value.value()).isEqualTo(JSON.readTree(EXPECTED));
        assertThat(tracker.partialCount()).isEqualTo(session.emittedCount()).isPositive();
    }

    @Test
    @DisplayName("Character-by-character feeding emits the customer before the lines")
    void leavesResolveInOrder() {
        DecodeSession session = decoder.open(TypeRef.named("Order"));
        List<PartialValue> partials = new ArrayList<>();
        for (String chunk : split(PAYLOAD, 1)) {
            session.feed(chunk).ifPresent(partials::add);
        }

        int firstCustomer = indexOfFirst(partials, "customer.name");
        int firstLine = indexOfFirst(partials, "lines[0].sku");
        assertThat(firstCustomer).isNotNegative().isLessThan(firstLine);
        assertThat(partials.get(partials.size() - 1).isResolved("attributes.channel")).isTrue();
    }

    private static int indexOfFirst(List<PartialValue> partials, String path) {
        for (int i = 0; i < partials.size(); i++) {
            if (partials.get(i).isResolved(path)) {
                return i;
            }
        }
        return -1;
    }
}
