package io.vulnwitness.witness;

import io.vulnwitness.model.CallStack;
import io.vulnwitness.model.Vuln;

import java.util.*;

/**
 * The witness mapping of one result: for every searched vuln, its call stack,
 * or nothing if no entry function reaches its call sink.
 * <p>
 * Vulns without a call sink are not searched and do not appear here.
 * Iteration follows the order of {@code Result.vulns()}.
 */
public final class Witnesses {

    private final Map<Vuln, CallStack> stacks;

    private Witnesses(Map<Vuln, CallStack> stacks) {
        this.stacks = Collections.unmodifiableMap(new LinkedHashMap<>(stacks));
    }

    /**
     * Creates a mapping; null values mark searched vulns without a witness.
     */
    public static Witnesses of(Map<Vuln, CallStack> stacks) {
        return new Witnesses(stacks);
    }

    public static Witnesses empty() {
        return new Witnesses(Map.of());
    }

    /**
     * Returns the searched vulns.
     */
    public List<Vuln> vulns() {
        return List.copyOf(stacks.keySet());
    }

    public boolean isSearched(Vuln vuln) {
        return stacks.containsKey(vuln);
    }

    /**
     * Returns the witness of the vuln, empty if it was not searched or has no witness.
     */
    public Optional<CallStack> witness(Vuln vuln) {
        return Optional.ofNullable(stacks.get(vuln));
    }

    /**
     * Returns the searched vulns that have a witness.
     */
    public List<Vuln> reachable() {
        return stacks.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Returns the searched vulns for which no witness was found.
     */
    public List<Vuln> unreachable() {
        return stacks.entrySet().stream()
                .filter(e -> e.getValue() == null)
                .map(Map.Entry::getKey)
                .toList();
    }

    public int size() {
        return stacks.size();
    }

    public boolean isEmpty() {
        return stacks.isEmpty();
    }
}
