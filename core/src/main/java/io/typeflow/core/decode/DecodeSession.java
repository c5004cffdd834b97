package io.typeflow.core.decode;

import com.fasterxml.jackson.databind.JsonNode;
import io.typeflow.core.error.DecodeBudgetExceededException;
import io.typeflow.core.error.IncompleteValueException;
import io.typeflow.core.error.IncompleteValueException.Unresolved;
import io.typeflow.core.model.FinalValue;
import io.typeflow.core.model.PartialValue;
import io.typeflow.core.model.ValuePaths;
import io.typeflow.core.schema.TypeRef;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes one streamed payload against one target type. Increments are appended with
 * {@link #feed(String)}, which returns a new {@link PartialValue} whenever the resolved portion of
 * the value changed; {@link #finish()} runs the final resolution pass.
 *
 * <p>Each evaluation re-parses the whole accumulated payload; local failures and union choices
 * persist across evaluations. Once the payload is large, {@code feed} re-evaluates only after the
 * payload has grown by a sixty-fourth since the last evaluation, so the work spent on a session
 * grows linearly with the payload rather than with the square of it. {@link #finish()} always
 * evaluates the complete payload.
 *
 * <p>Not thread-safe: one producer feeds one session.
 */
public final class DecodeSession {

    private static final Logger LOG = LoggerFactory.getLogger(DecodeSession.class);

    private static final int GROWTH_DIVISOR = 64;

    /** Lifecycle: {@code EMPTY -> ACCUMULATING -> FINALIZING -> COMPLETED | FAILED}. */
    public enum State {
        EMPTY,
        ACCUMULATING,
        FINALIZING,
        COMPLETED,
        FAILED
    }

    private final TypeRef target;
    private final String targetName;
    private final ValueCoercer coercer;
    private final DecodeBudget budget;
    private final RawParser.Start start;
    private final StringBuilder buffer = new StringBuilder();
    private final DecodeMemory memory = new DecodeMemory();

    private State state = State.EMPTY;
    private JsonNode lastEmitted;
    private int emitted;
    private int evaluatedLength;
    private int evaluations;

    DecodeSession(TypeRef target, ValueCoercer coercer, DecodeBudget budget, RawParser.Start start) {
        this.target = target;
        this.targetName = target.toString();
        this.coercer = coercer;
        this.budget = budget;
        this.start = start;
    }

    /**
     * Appends an increment and, unless the payload has grown too little since the last
     * evaluation, re-evaluates the value.
     *
     * @return the new partial value, or empty if nothing changed since the previous emission or
     *     the payload was not re-evaluated
     * @throws DecodeBudgetExceededException if the payload outgrows the budget
     * @throws IllegalStateException after {@link #finish()}
     */
    public Optional<PartialValue> feed(String increment) {
        Objects.requireNonNull(increment, "increment must not be null");
        requireOpen("feed");
        state = State.ACCUMULATING;
        buffer.append(increment);
        if (buffer.length() > budget.maxPayloadChars()) {
            state = State.FAILED;
            throw new DecodeBudgetExceededException(
                    "Payload exceeds " + budget.maxPayloadChars() + " characters", targetName);
        }

        if (buffer.length() - evaluatedLength < Math.max(1, evaluatedLength / GROWTH_DIVISOR)) {
            return Optional.empty();
        }
        evaluatedLength = buffer.length();
        evaluations++;

        RawValue raw = parse(false);
        JsonNode value = coercer.coerce(target, raw, ValuePaths.ROOT, ValueCoercer.Pass.partial(memory));
        if (value == null || value.equals(lastEmitted)) {
            return Optional.empty();
        }
        lastEmitted = value;
        PartialValue partial = new PartialValue(value, emitted++);
        LOG.debug("decode.partial target={} sequence={} leaves={}", targetName, partial.sequence(), partial.leaves().size());
        return Optional.of(partial);
    }

    /**
     * Runs the final resolution pass over the complete payload.
     *
     * @throws IncompleteValueException naming every required path left unresolved
     * @throws DecodeBudgetExceededException if the payload nests deeper than the budget
     * @throws IllegalStateException if already finished
     */
    public FinalValue finish() {
        requireOpen("finish");
        state = State.FINALIZING;

        RawValue raw = parse(true);
        ValueCoercer.Pass pass = ValueCoercer.Pass.finalPass(memory);
        JsonNode value = coercer.coerce(target, raw, ValuePaths.ROOT, pass);
        List<Unresolved> unresolved = pass.unresolved();
        if (unresolved.isEmpty() && value == null) {
            unresolved = List.of(new Unresolved(ValuePaths.ROOT, "missing"));
        }
        if (!unresolved.isEmpty()) {
            state = State.FAILED;
            throw new IncompleteValueException(targetName, unresolved);
        }
        state = State.COMPLETED;
        return new FinalValue(value, targetName);
    }

    public State state() {
        return state;
    }

    public TypeRef target() {
        return target;
    }

    /** Number of partial values emitted so far. */
    public int emittedCount() {
        return emitted;
    }

    /** Number of partial evaluations run so far. */
    int evaluations() {
        return evaluations;
    }

    private RawValue parse(boolean endOfInput) {
        RawParser.Result result = RawParser.parse(buffer.toString(), endOfInput, start, budget.maxDepth());
        if (result.depthExceeded()) {
            state = State.FAILED;
            throw new DecodeBudgetExceededException(
                    "Payload nests deeper than " + budget.maxDepth() + " levels", targetName);
        }
        return result.value();
    }

    private void requireOpen(String operation) {
        if (state != State.EMPTY && state != State.ACCUMULATING) {
            throw new IllegalStateException("Cannot " + operation + " a decode session in state " + state);
        }
    }
}
