package io.vulnwitness.model;

import java.util.*;
import java.util.stream.Collectors;

/**
 * The call graph of the analyzed program, as produced by the upstream analysis.
 * <p>
 * Functions are stored in an arena indexed by id. Call sites refer to functions
 * by id, and the incoming/outgoing call sites of a function are adjacency lists
 * keyed by the same id. Iteration order follows insertion order, so two graphs
 * built the same way iterate the same way.
 */
public final class CallGraph {

    private final Map<Integer, FuncNode> functions;
    private final Map<Integer, List<CallSite>> incoming;  // callee id -> call sites
    private final Map<Integer, List<CallSite>> outgoing;  // caller id -> call sites

    private CallGraph(
            Map<Integer, FuncNode> functions,
            Map<Integer, List<CallSite>> incoming,
            Map<Integer, List<CallSite>> outgoing
    ) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        this.incoming = copyAdjacency(incoming);
        this.outgoing = copyAdjacency(outgoing);
    }

    private static Map<Integer, List<CallSite>> copyAdjacency(Map<Integer, List<CallSite>> original) {
        return original.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        Map.Entry::getKey,
                        e -> List.copyOf(e.getValue())
                ));
    }

    /**
     * Returns the function with the given id, or empty if not found.
     */
    public Optional<FuncNode> function(int id) {
        return Optional.ofNullable(functions.get(id));
    }

    /**
     * Returns the function with the given id.
     *
     * @throws IllegalArgumentException if the graph has no such function
     */
    public FuncNode requireFunction(int id) {
        FuncNode node = functions.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown function id " + id);
        }
        return node;
    }

    /**
     * Returns all functions in insertion order.
     */
    public Collection<FuncNode> functions() {
        return functions.values();
    }

    /**
     * Checks whether this exact node belongs to the graph.
     */
    public boolean contains(FuncNode node) {
        return node != null && node.equals(functions.get(node.id()));
    }

    /**
     * Returns the call sites invoking the given function.
     */
    public List<CallSite> callersOf(int calleeId) {
        return incoming.getOrDefault(calleeId, List.of());
    }

    public List<CallSite> callersOf(FuncNode callee) {
        return callersOf(callee.id());
    }

    /**
     * Returns the call sites inside the given function.
     */
    public List<CallSite> calleesOf(int callerId) {
        return outgoing.getOrDefault(callerId, List.of());
    }

    public List<CallSite> calleesOf(FuncNode caller) {
        return calleesOf(caller.id());
    }

    /**
     * Resolves the calling function of a call site.
     */
    public FuncNode caller(CallSite site) {
        return requireFunction(site.caller());
    }

    /**
     * Resolves the called function of a call site.
     */
    public FuncNode callee(CallSite site) {
        return requireFunction(site.callee());
    }

    public int functionCount() {
        return functions.size();
    }

    public int callSiteCount() {
        return outgoing.values().stream().mapToInt(List::size).sum();
    }

    public static CallGraph empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing a CallGraph.
     */
    public static class Builder {
        private final Map<Integer, FuncNode> functions = new LinkedHashMap<>();
        private final List<CallSite> callSites = new ArrayList<>();

        public Builder addFunction(FuncNode function) {
            FuncNode previous = functions.putIfAbsent(function.id(), function);
            if (previous != null && !previous.equals(function)) {
                throw new IllegalStateException("Duplicate function id " + function.id()
                        + ": " + previous.displayName() + " and " + function.displayName());
            }
            return this;
        }

        public Builder addFunctions(Collection<FuncNode> nodes) {
            nodes.forEach(this::addFunction);
            return this;
        }

        public Builder addCall(CallSite site) {
            callSites.add(site);
            return this;
        }

        /**
         * Adds a call site named after its callee. Both functions are added if missing.
         */
        public Builder addCall(FuncNode caller, FuncNode callee, SourcePosition position, boolean resolved) {
            addFunction(caller);
            addFunction(callee);
            return addCall(CallSite.to(caller, callee, position, resolved));
        }

        public CallGraph build() {
            Map<Integer, List<CallSite>> incoming = new HashMap<>();
            Map<Integer, List<CallSite>> outgoing = new HashMap<>();
            for (CallSite site : callSites) {
                if (!functions.containsKey(site.caller())) {
                    throw new IllegalStateException("Call site " + site.qualifiedName()
                            + " refers to unknown caller id " + site.caller());
                }
                if (!functions.containsKey(site.callee())) {
                    throw new IllegalStateException("Call site " + site.qualifiedName()
                            + " refers to unknown callee id " + site.callee());
                }
                incoming.computeIfAbsent(site.callee(), k -> new ArrayList<>()).add(site);
                outgoing.computeIfAbsent(site.caller(), k -> new ArrayList<>()).add(site);
            }
            return new CallGraph(functions, incoming, outgoing);
        }
    }
}
