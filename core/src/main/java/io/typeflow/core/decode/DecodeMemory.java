package io.typeflow.core.decode;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Per-session state that outlives a single parse: sticky local failures, pinned union
 * alternatives and the leaves already shown for unions still undecided, all keyed by value path. Union resolution works on {@link #copy() copies} and
 * {@link #adopt(DecodeMemory) adopts} the winning trial.
 */
final class DecodeMemory {

    /** Why a path can no longer resolve. Hard failures are fatal even for optional values. */
    record Failure(String reason, boolean hard) {}

    private final Map<String, Failure> failures;
    private final Map<String, Integer> unionChoices;
    private final Map<String, Map<String, JsonNode>> unionLeaves;

    DecodeMemory() {
        this(new LinkedHashMap<>(), new HashMap<>(), new HashMap<>());
    }

    private DecodeMemory(
            Map<String, Failure> failures,
            Map<String, Integer> unionChoices,
            Map<String, Map<String, JsonNode>> unionLeaves) {
        this.failures = failures;
        this.unionChoices = unionChoices;
        this.unionLeaves = unionLeaves;
    }

    Optional<Failure> failure(String path) {
        return Optional.ofNullable(failures.get(path));
    }

    void fail(String path, String reason, boolean hard) {
        failures.putIfAbsent(path, new Failure(reason, hard));
    }

    int failureCount() {
        return failures.size();
    }

    OptionalInt unionChoice(String path) {
        Integer choice = unionChoices.get(path);
        return choice == null ? OptionalInt.empty() : OptionalInt.of(choice);
    }

    void pinUnion(String path, int alternative) {
        unionChoices.putIfAbsent(path, alternative);
    }

    /** Leaves, relative to the union value, shown while no alternative was the unique best. */
    Map<String, JsonNode> unionLeaves(String path) {
        return unionLeaves.getOrDefault(path, Map.of());
    }

    void showUnionLeaves(String path, Map<String, JsonNode> leaves) {
        unionLeaves.put(path, Map.copyOf(leaves));
    }

    DecodeMemory copy() {
        return new DecodeMemory(
                new LinkedHashMap<>(failures), new HashMap<>(unionChoices), new HashMap<>(unionLeaves));
    }

    void adopt(DecodeMemory trial) {
        trial.failures.forEach(failures::putIfAbsent);
        trial.unionChoices.forEach(unionChoices::putIfAbsent);
        unionLeaves.putAll(trial.unionLeaves);
    }

    Map<String, Failure> failures() {
        return Map.copyOf(failures);
    }
}
