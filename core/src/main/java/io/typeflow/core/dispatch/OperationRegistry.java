package io.typeflow.core.dispatch;

import io.typeflow.core.decode.DecodeBudget;
import io.typeflow.core.decode.IncrementalDecoder;
import io.typeflow.core.error.DecodeFailureException;
import io.typeflow.core.error.DuplicateVersionException;
import io.typeflow.core.error.UnknownOperationException;
import io.typeflow.core.error.UnknownVersionException;
import io.typeflow.core.model.FinalValue;
import io.typeflow.core.schema.SchemaSnapshot;
import io.typeflow.core.schema.TypeRef;
import io.typeflow.core.spi.InvocationListener;
import io.typeflow.core.spi.OperationHandler;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named operations, each bound to one or more versioned implementations, and the entry point for
 * invoking them.
 *
 * <p>An invocation resolves a binding, lets its handler produce a payload and decodes that payload
 * against the binding's return type: {@link #call} returns the final value, {@link #stream}
 * exposes the partial values as they arrive.
 *
 * <p>Lookups and invocations are thread-safe. Registration is expected to happen before the
 * registry is shared.
 */
public final class OperationRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(OperationRegistry.class);

    private static final class Entry {
        private final List<ImplementationBinding> bindings = new CopyOnWriteArrayList<>();
        private volatile String defaultVersion;
    }

    private final ConcurrentHashMap<String, Entry> operations = new ConcurrentHashMap<>();
    private final Set<String> order = Collections.synchronizedSet(new LinkedHashSet<>());
    private final SchemaSnapshot schema;
    private final DecodeBudget budget;
    private final InvocationListener listener;
    private final IncrementalDecoder decoder;

    public OperationRegistry(SchemaSnapshot schema) {
        this(schema, DecodeBudget.DEFAULT, null);
    }

    /**
     * @param schema schema that binding return types are decoded against
     * @param budget limits applied to every decode session
     * @param listener telemetry hooks, or {@code null} for none
     */
    public OperationRegistry(SchemaSnapshot schema, DecodeBudget budget, InvocationListener listener) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.listener = listener != null ? listener : InvocationListener.NOOP;
        this.decoder = new IncrementalDecoder(schema, budget);
    }

    /**
     * Appends an implementation to the operation, creating the operation if needed.
     *
     * @throws DuplicateVersionException if the operation already has this version
     */
    public void register(String operation, ImplementationBinding binding) {
        requireName(operation);
        Objects.requireNonNull(binding, "binding must not be null");
        Entry entry = entry(operation);
        synchronized (entry) {
            if (entry.bindings.stream().anyMatch(b -> b.version().equals(binding.version()))) {
                throw new DuplicateVersionException(operation, binding.version());
            }
            entry.bindings.add(binding);
        }
        LOG.debug("Registered operation={} version={} target={}", operation, binding.version(), binding.returnType());
    }

    public void register(String operation, String version, TypeRef returnType, OperationHandler handler) {
        register(operation, new ImplementationBinding(version, returnType, handler));
    }

    /** Declares an operation without implementations; calling it fails until one is registered. */
    public void declare(String operation) {
        requireName(operation);
        entry(operation);
    }

    /**
     * Makes {@code version} the implementation used when a call names no version.
     *
     * @throws UnknownOperationException if the operation is not declared
     * @throws UnknownVersionException if the operation has no such version
     */
    public void setDefaultVersion(String operation, String version) {
        Entry entry = operations.get(operation);
        if (entry == null) {
            throw new UnknownOperationException(operation);
        }
        if (entry.bindings.stream().noneMatch(b -> b.version().equals(version))) {
            throw new UnknownVersionException(operation, version);
        }
        entry.defaultVersion = version;
    }

    /**
     * Selects the implementation for an invocation. An explicit version must match exactly;
     * without one, the explicit default applies, otherwise the first registered version.
     *
     * @param version requested version, or {@code null}
     * @throws UnknownOperationException if the operation has no implementations
     * @throws UnknownVersionException if the requested version is not registered
     */
    public ImplementationBinding resolve(String operation, String version) {
        Entry entry = operations.get(operation);
        if (entry == null || entry.bindings.isEmpty()) {
            throw new UnknownOperationException(operation);
        }
        String wanted = version != null ? version : entry.defaultVersion;
        if (wanted == null) {
            return entry.bindings.get(0);
        }
        return entry.bindings.stream()
                .filter(b -> b.version().equals(wanted))
                .findFirst()
                .orElseThrow(() -> new UnknownVersionException(operation, wanted));
    }

    public Optional<OperationSpec> operation(String name) {
        Entry entry = operations.get(name);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(new OperationSpec(name, new ArrayList<>(entry.bindings), entry.defaultVersion));
    }

    /** Operation names in declaration order. */
    public List<String> operationNames() {
        synchronized (order) {
            return List.copyOf(order);
        }
    }

    public SchemaSnapshot schema() {
        return schema;
    }

    /**
     * Invokes the operation and waits for its final value.
     *
     * @param version implementation version, or {@code null} for the default
     * @throws DecodeFailureException if the payload does not decode to the return type
     */
    public FinalValue call(String operation, String version, Object... args) {
        return call(CallOptions.DEFAULT.withVersion(version), operation, args);
    }

    public FinalValue call(CallOptions options, String operation, Object... args) {
        try (StreamHandle handle = stream(options, operation, args)) {
            return handle.finalValue();
        }
    }

    /**
     * Invokes the operation lazily. Resolution errors are thrown here; the handler is not opened
     * until the first value is pulled.
     */
    public StreamHandle stream(String operation, String version, Object... args) {
        return stream(CallOptions.DEFAULT.withVersion(version), operation, args);
    }

    public StreamHandle stream(CallOptions options, String operation, Object... args) {
        Objects.requireNonNull(options, "options must not be null");
        ImplementationBinding binding = resolve(operation, options.version());
        IncrementalDecoder sessionDecoder =
                options.schema() != null ? new IncrementalDecoder(options.schema(), budget) : decoder;
        List<Object> arguments = args == null ? List.of() : Collections.unmodifiableList(Arrays.asList(args));
        return new StreamHandle(new Invocation(
                operation, binding, arguments, sessionDecoder, options.validationMode(), listener));
    }

    private Entry entry(String operation) {
        return operations.computeIfAbsent(operation, name -> {
            order.add(name);
            return new Entry();
        });
    }

    private static void requireName(String operation) {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation name must not be null or blank");
        }
    }
}
