package io.typeflow.core.dispatch;

import io.typeflow.core.error.DecodeFailureException;
import io.typeflow.core.model.FinalValue;
import io.typeflow.core.model.PartialValue;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, single-use sequence of an invocation's values: zero or more {@link PartialValue}s
 * followed by exactly one {@link FinalValue}. Nothing is produced until the first pull.
 * {@link #close()} before the final value cancels the invocation; partial values already
 * returned stay valid.
 *
 * <p>Single-reader: not thread-safe.
 */
public final class StreamHandle implements Iterator<StreamEvent>, AutoCloseable {

    private final Invocation invocation;
    private StreamEvent pending;
    private FinalValue finalValue;
    private boolean exhausted;
    private boolean cancelled;

    StreamHandle(Invocation invocation) {
        this.invocation = invocation;
    }

    /**
     * @throws DecodeFailureException if decoding fails while pulling the next value
     */
    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        try {
            pending = invocation.advance();
        } catch (RuntimeException e) {
            exhausted = true;
            throw e;
        }
        if (pending == null) {
            exhausted = true;
            return false;
        }
        return true;
    }

    @Override
    public StreamEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Stream exhausted");
        }
        StreamEvent event = pending;
        pending = null;
        if (event instanceof StreamEvent.Final last) {
            finalValue = last.value();
            exhausted = true;
        }
        return event;
    }

    /** The remaining events as a sequential stream; closing it closes this handle. */
    public Stream<StreamEvent> events() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED), false)
                .onClose(this::close);
    }

    /**
     * Drains the remaining events and returns the final value.
     *
     * @throws DecodeFailureException if decoding fails
     * @throws IllegalStateException if the handle was closed before the final value arrived
     */
    public FinalValue finalValue() {
        while (finalValue == null && hasNext()) {
            next();
        }
        if (finalValue == null) {
            throw new IllegalStateException(
                    cancelled ? "Stream was cancelled before its final value" : "Stream ended without a final value");
        }
        return finalValue;
    }

    /** Invocation id, as set in the logging MDC while this handle pulls values. */
    public String invocationId() {
        return invocation.id();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void close() {
        if (exhausted && pending == null) {
            return;
        }
        cancelled = finalValue == null;
        exhausted = true;
        pending = null;
        invocation.cancel();
    }
}
