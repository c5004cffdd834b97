package io.typeflow.core.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.typeflow.core.decode.ConvergenceTracker;
import io.typeflow.core.decode.DecodeSession;
import io.typeflow.core.decode.IncrementalDecoder;
import io.typeflow.core.error.DecodeException;
import io.typeflow.core.error.DecodeFailureException;
import io.typeflow.core.model.FinalValue;
import io.typeflow.core.model.PartialValue;
import io.typeflow.core.schema.JsonSchemaExporter;
import io.typeflow.core.spi.InvocationListener;
import io.typeflow.core.spi.PayloadStream;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drives one invocation: opens the payload, feeds the decode session, checks convergence and
 * reports to logs and the listener. Every step runs with the invocation id in the MDC.
 *
 * <p>Not thread-safe: owned by one {@link StreamHandle}.
 */
final class Invocation {

    static final String MDC_KEY = "invocationId";

    private static final Logger LOG = LoggerFactory.getLogger(Invocation.class);
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final String id = UUID.randomUUID().toString();
    private final String operation;
    private final ImplementationBinding binding;
    private final List<Object> args;
    private final IncrementalDecoder decoder;
    private final ValidationMode validationMode;
    private final InvocationListener listener;
    private final ConvergenceTracker tracker = new ConvergenceTracker();

    private PayloadStream payload;
    private DecodeSession session;
    private long startedAt;
    private boolean finished;

    Invocation(
            String operation,
            ImplementationBinding binding,
            List<Object> args,
            IncrementalDecoder decoder,
            ValidationMode validationMode,
            InvocationListener listener) {
        this.operation = operation;
        this.binding = binding;
        this.args = args;
        this.decoder = decoder;
        this.validationMode = validationMode;
        this.listener = listener;
    }

    String id() {
        return id;
    }

    /**
     * Pulls payload increments until the value changes or the payload ends.
     *
     * @return the next event, or {@code null} once the final value was produced
     */
    StreamEvent advance() {
        if (finished) {
            return null;
        }
        return withMdc(() -> {
            try {
                if (session == null) {
                    start();
                }
                while (true) {
                    Optional<String> increment = payload.next();
                    if (increment.isEmpty()) {
                        return new StreamEvent.Final(complete());
                    }
                    Optional<PartialValue> partial = session.feed(increment.get());
                    if (partial.isPresent()) {
                        tracker.observePartial(partial.get());
                        notifyPartial(partial.get());
                        return new StreamEvent.Partial(partial.get());
                    }
                }
            } catch (DecodeException e) {
                DecodeFailureException failure = e instanceof DecodeFailureException wrapped
                        ? wrapped
                        : new DecodeFailureException(operation, binding.version(), e);
                fail(failure);
                throw failure;
            } catch (RuntimeException e) {
                fail(e);
                throw e;
            }
        });
    }

    /** Abandons the invocation; partial values already handed out stay valid. */
    void cancel() {
        if (finished) {
            return;
        }
        withMdc(() -> {
            finished = true;
            LOG.debug("operation.cancelled operation={} version={}", operation, binding.version());
            closePayload();
            return null;
        });
    }

    private void start() {
        startedAt = System.nanoTime();
        session = decoder.open(binding.returnType());
        LOG.info(
                "operation.invoked operation={} version={} target={}",
                operation,
                binding.version(),
                binding.returnType());
        notifyStarted();
        payload = binding.handler().open(args);
        if (payload == null) {
            throw new IllegalStateException(
                    "Handler for '" + operation + "@" + binding.version() + "' returned no payload");
        }
    }

    private FinalValue complete() {
        FinalValue value = session.finish();
        tracker.observeFinal(value);
        if (validationMode == ValidationMode.STRICT) {
            validate(value);
        }
        finished = true;
        closePayload();
        long durationMs = elapsedMs();
        LOG.info(
                "decode.completed operation={} version={} target={} partials={} duration_ms={}",
                operation,
                binding.version(),
                value.targetType(),
                tracker.partialCount(),
                durationMs);
        notifyCompleted(durationMs);
        return value;
    }

    private void validate(FinalValue value) {
        JsonNode schemaNode = new JsonSchemaExporter(decoder.schema()).export(binding.returnType());
        JsonSchema schema = SCHEMA_FACTORY.getSchema(schemaNode);
        Set<ValidationMessage> errors = schema.validate(value.value());
        if (!errors.isEmpty()) {
            String detail = errors.stream().map(ValidationMessage::getMessage).collect(Collectors.joining("; "));
            throw new DecodeFailureException(
                    operation, binding.version(), value.targetType(), "schema validation failed: " + detail);
        }
    }

    private void fail(RuntimeException e) {
        finished = true;
        closePayload();
        long durationMs = session == null ? 0 : elapsedMs();
        LOG.warn(
                "decode.failed operation={} version={} target={} duration_ms={} error={}",
                operation,
                binding.version(),
                binding.returnType(),
                durationMs,
                e.getMessage());
        notifyFailed(durationMs, e.getMessage());
    }

    private void closePayload() {
        if (payload == null) {
            return;
        }
        try {
            payload.close();
        } catch (RuntimeException e) {
            LOG.warn("Closing payload for '{}@{}' failed", operation, binding.version(), e);
        }
    }

    private long elapsedMs() {
        return (System.nanoTime() - startedAt) / 1_000_000;
    }

    private <T> T withMdc(Supplier<T> step) {
        String previous = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, id);
        try {
            return step.get();
        } finally {
            if (previous == null) {
                MDC.remove(MDC_KEY);
            } else {
                MDC.put(MDC_KEY, previous);
            }
        }
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they never affect decoding.

    private void notifyStarted() {
        try {
            listener.onInvocationStarted(new InvocationListener.InvocationStartedEvent(
                    id, operation, binding.version(), binding.returnType().toString()));
        } catch (Exception e) {
            LOG.warn("InvocationListener.onInvocationStarted failed", e);
        }
    }

    private void notifyPartial(PartialValue partial) {
        try {
            listener.onPartialEmitted(new InvocationListener.PartialEmittedEvent(
                    id, operation, partial.sequence(), partial.leaves().size()));
        } catch (Exception e) {
            LOG.warn("InvocationListener.onPartialEmitted failed", e);
        }
    }

    private void notifyCompleted(long durationMs) {
        try {
            listener.onInvocationCompleted(new InvocationListener.InvocationCompletedEvent(
                    id, operation, binding.version(), tracker.partialCount(), durationMs));
        } catch (Exception e) {
            LOG.warn("InvocationListener.onInvocationCompleted failed", e);
        }
    }

    private void notifyFailed(long durationMs, String detail) {
        try {
            listener.onInvocationFailed(new InvocationListener.InvocationFailedEvent(
                    id, operation, binding.version(), durationMs, detail));
        } catch (Exception e) {
            LOG.warn("InvocationListener.onInvocationFailed failed", e);
        }
    }
}
