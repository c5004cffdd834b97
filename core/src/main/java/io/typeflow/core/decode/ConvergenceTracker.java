package io.typeflow.core.decode;

import com.fasterxml.jackson.databind.JsonNode;
import io.typeflow.core.error.ConvergenceViolation;
import io.typeflow.core.model.FinalValue;
import io.typeflow.core.model.PartialValue;
import java.util.Map;

/**
 * Checks that a stream of values converges: a resolved leaf is never retracted or changed by a
 * later partial value, and the final value keeps every leaf of the last partial value.
 *
 * <p>Not thread-safe: one tracker per invocation.
 */
public final class ConvergenceTracker {

    private Map<String, JsonNode> resolved = Map.of();
    private int lastSequence = -1;
    private int partialCount;
    private boolean finalized;

    /**
     * @throws ConvergenceViolation if {@code partial} drops or alters a previously resolved leaf
     */
    public void observePartial(PartialValue partial) {
        if (finalized) {
            throw new IllegalStateException("Partial value observed after the final value");
        }
        if (partial.sequence() <= lastSequence) {
            throw new ConvergenceViolation(
                    "Partial #" + partial.sequence() + " arrived after #" + lastSequence, "$");
        }
        Map<String, JsonNode> next = partial.leaves();
        verify(next, "Partial #" + partial.sequence());
        resolved = next;
        lastSequence = partial.sequence();
        partialCount++;
    }

    /**
     * @throws ConvergenceViolation if the final value disagrees with the last partial value
     */
    public void observeFinal(FinalValue value) {
        if (finalized) {
            throw new IllegalStateException("Final value already observed");
        }
        verify(value.leaves(), "Final value");
        finalized = true;
    }

    public int partialCount() {
        return partialCount;
    }

    public boolean isFinalized() {
        return finalized;
    }

    private void verify(Map<String, JsonNode> next, String subject) {
        for (Map.Entry<String, JsonNode> leaf : resolved.entrySet()) {
            JsonNode now = next.get(leaf.getKey());
            if (now == null) {
                throw new ConvergenceViolation(subject + " retracted resolved leaf", leaf.getKey());
            }
            if (!now.equals(leaf.getValue())) {
                throw new ConvergenceViolation(
                        subject + " changed resolved leaf from " + leaf.getValue() + " to " + now, leaf.getKey());
            }
        }
    }
}
