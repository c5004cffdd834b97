package io.typeflow.core.decode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.typeflow.core.error.ConvergenceViolation;
import io.typeflow.core.model.FinalValue;
import io.typeflow.core.model.PartialValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConvergenceTracker")
class ConvergenceTrackerTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static PartialValue partial(int sequence, String json) throws Exception {
        return new PartialValue(JSON.readTree(json), sequence);
    }

    private static FinalValue finalValue(String json) throws Exception {
        JsonNode node = JSON.readTree(json);
        return new FinalValue(node, "User");
    }

    @Test
    @DisplayName("Growing values and a matching final value pass")
    void acceptsConvergingStream() throws Exception {
        ConvergenceTracker tracker = new ConvergenceTracker();

        tracker.observePartial(partial(0, "{}"));
        tracker.observePartial(partial(1, "{\"name\":\"Ann\"}"));
        tracker.observePartial(partial(2, "{\"name\":\"Ann\",\"tags\":[\"a\"]}"));
        tracker.observeFinal(finalValue("{\"name\":\"Ann\",\"tags\":[\"a\"],\"age\":null}"));

        assertThat(tracker.partialCount()).isEqualTo(3);
        assertThat(tracker.isFinalized()).isTrue();
    }

    @Test
    @DisplayName("A retracted leaf is a violation naming its path")
    void retractedLeaf() throws Exception {
        ConvergenceTracker tracker = new ConvergenceTracker();
        tracker.observePartial(partial(0, "{\"items\":[{\"sku\":\"a\"}]}"));

        assertThatThrownBy(() -> tracker.observePartial(partial(1, "{\"items\":[]}")))
                .isInstanceOfSatisfying(
                        ConvergenceViolation.class, v -> assertThat(v.path()).isEqualTo("items[0].sku"));
    }

    @Test
    @DisplayName("A changed leaf is a violation")
    void changedLeaf() throws Exception {
        ConvergenceTracker tracker = new ConvergenceTracker();
        tracker.observePartial(partial(0, "{\"age\":4}"));

        assertThatThrownBy(() -> tracker.observePartial(partial(1, "{\"age\":42}")))
                .isInstanceOf(ConvergenceViolation.class)
                .hasMessageContaining("changed resolved leaf");
    }

    @Test
    @DisplayName("A final value that drops a partial leaf is a violation")
    void finalDropsLeaf() throws Exception {
        ConvergenceTracker tracker = new ConvergenceTracker();
        tracker.observePartial(partial(0, "{\"name\":\"Ann\"}"));

        assertThatThrownBy(() -> tracker.observeFinal(finalValue("{\"name\":null}")))
                .isInstanceOf(ConvergenceViolation.class);
    }

    @Test
    @DisplayName("Sequence numbers must increase")
    void sequenceOrder() throws Exception {
        ConvergenceTracker tracker = new ConvergenceTracker();
        tracker.observePartial(partial(3, "{}"));

        assertThatThrownBy(() -> tracker.observePartial(partial(3, "{}")))
                .isInstanceOf(ConvergenceViolation.class);
    }

    @Test
    @DisplayName("Nothing may be observed after the final value")
    void closedAfterFinal() throws Exception {
        ConvergenceTracker tracker = new ConvergenceTracker();
        tracker.observeFinal(finalValue("{}"));

        assertThatThrownBy(() -> tracker.observePartial(partial(0, "{}")))
                .isExactlyInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> tracker.observeFinal(finalValue("{}")))
                .isExactlyInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Null values do not count as resolved leaves")
    void nullIsNotALeaf() throws Exception {
        ConvergenceTracker tracker = new ConvergenceTracker();
        tracker.observePartial(partial(0, "{\"notes\":null}"));

        assertThatCode(() -> tracker.observePartial(partial(1, "{}"))).doesNotThrowAnyException();
    }
}
