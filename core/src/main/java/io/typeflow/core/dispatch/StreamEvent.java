package io.typeflow.core.dispatch;

import io.typeflow.core.model.FinalValue;
import io.typeflow.core.model.PartialValue;

/** An element of a {@link StreamHandle}: zero or more partial values, then one final value. */
public sealed interface StreamEvent permits StreamEvent.Partial, StreamEvent.Final {

    boolean isFinal();

    record Partial(PartialValue value) implements StreamEvent {
        @Override
        public boolean isFinal() {
            return false;
        }
    }

    record Final(FinalValue value) implements StreamEvent {
        @Override
        public boolean isFinal() {
            return true;
        }
    }
}
