package io.typeflow.core.spi;

/**
 * Observability hooks for operation invocations. Adapters bridge these to metrics or tracing
 * systems; the core carries no telemetry dependency.
 *
 * <p>Implementations must be thread-safe and non-blocking. Exceptions thrown by a listener are
 * caught and logged by the runtime and never affect decoding.
 */
public interface InvocationListener {

    /** Listener that ignores every event. */
    InvocationListener NOOP = new InvocationListener() {
        @Override
        public void onInvocationStarted(InvocationStartedEvent event) {}

        @Override
        public void onPartialEmitted(PartialEmittedEvent event) {}

        @Override
        public void onInvocationCompleted(InvocationCompletedEvent event) {}

        @Override
        public void onInvocationFailed(InvocationFailedEvent event) {}
    };

    void onInvocationStarted(InvocationStartedEvent event);

    /**
     * Called for each partial value handed to a stream consumer.
     *
     * @param event contains the partial value's sequence number and resolved leaf count
     */
    void onPartialEmitted(PartialEmittedEvent event);

    void onInvocationCompleted(InvocationCompletedEvent event);

    /**
     * Called when the payload producer or decoding fails.
     *
     * @param event contains the failure detail
     */
    void onInvocationFailed(InvocationFailedEvent event);

    // --- Event records ---

    record InvocationStartedEvent(String invocationId, String operation, String version, String targetType) {}

    record PartialEmittedEvent(String invocationId, String operation, int sequence, int resolvedLeaves) {}

    record InvocationCompletedEvent(
            String invocationId, String operation, String version, int partials, long durationMs) {}

    record InvocationFailedEvent(
            String invocationId, String operation, String version, long durationMs, String errorDetail) {}
}
