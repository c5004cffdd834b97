package io.typeflow.core.decode;

import java.util.List;

/**
 * Structure recovered from a possibly truncated payload by {@link RawParser}, before any type is
 * applied. Every node knows whether it is complete: a later increment can no longer change it.
 */
sealed interface RawValue permits RawValue.RawObject, RawValue.RawArray, RawValue.RawString, RawValue.RawToken {

    boolean isComplete();

    /**
     * @param key unescaped key
     * @param value the value, or {@code null} if nothing after the colon has arrived yet
     */
    record Entry(String key, RawValue value) {}

    record RawObject(List<Entry> entries, boolean closed) implements RawValue {
        public RawObject {
            entries = List.copyOf(entries);
        }

        @Override
        public boolean isComplete() {
            return closed;
        }
    }

    record RawArray(List<RawValue> elements, boolean closed) implements RawValue {
        public RawArray {
            elements = List.copyOf(elements);
        }

        @Override
        public boolean isComplete() {
            return closed;
        }
    }

    /** A quoted string; {@code closed} once the terminating quote was seen. */
    record RawString(String text, boolean closed) implements RawValue {
        @Override
        public boolean isComplete() {
            return closed;
        }
    }

    /**
     * An unquoted token: number, boolean, {@code null} or bare word. Complete once a delimiter
     * follows it, or at end-of-input.
     */
    record RawToken(String text, boolean complete) implements RawValue {
        @Override
        public boolean isComplete() {
            return complete;
        }

        boolean isNull() {
            return complete && text.equalsIgnoreCase("null");
        }
    }
}
