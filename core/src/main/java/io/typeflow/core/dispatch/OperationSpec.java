package io.typeflow.core.dispatch;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a registered operation.
 *
 * @param name operation name
 * @param bindings implementations in registration order; empty for a declared-only operation
 * @param defaultVersion explicitly chosen default version, or {@code null}
 */
public record OperationSpec(String name, List<ImplementationBinding> bindings, String defaultVersion) {

    public OperationSpec {
        bindings = List.copyOf(bindings);
    }

    public List<String> versions() {
        return bindings.stream().map(ImplementationBinding::version).toList();
    }

    public Optional<ImplementationBinding> binding(String version) {
        return bindings.stream().filter(b -> b.version().equals(version)).findFirst();
    }

    /** Whether at least one implementation is bound. */
    public boolean isCallable() {
        return !bindings.isEmpty();
    }
}
