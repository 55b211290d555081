package io.vulnwitness.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A completed upstream analysis: the call graph, the program's entry functions,
 * and the vulnerabilities found in its dependencies.
 *
 * @param vulns          Vulnerabilities, in the order reported upstream
 * @param callGraph      The program's call graph
 * @param entryFunctions Externally reachable entry points (main, exported API, tests)
 */
public record Result(
        List<Vuln> vulns,
        CallGraph callGraph,
        List<FuncNode> entryFunctions
) {
    /**
     * Compact constructor with validation. Sinks and entries must be nodes of the call graph.
     */
    public Result {
        if (callGraph == null) {
            throw new IllegalArgumentException("Call graph cannot be null");
        }
        vulns = vulns == null ? List.of() : List.copyOf(vulns);
        entryFunctions = entryFunctions == null ? List.of() : List.copyOf(new LinkedHashSet<>(entryFunctions));

        for (FuncNode entry : entryFunctions) {
            if (!callGraph.contains(entry)) {
                throw new IllegalArgumentException("Entry function " + entry.displayName()
                        + " (id " + entry.id() + ") is not part of the call graph");
            }
        }
        for (Vuln vuln : vulns) {
            vuln.callSink().ifPresent(sink -> {
                if (!callGraph.contains(sink)) {
                    throw new IllegalArgumentException("Call sink " + sink.displayName() + " of " + vuln.osvId()
                            + " (id " + sink.id() + ") is not part of the call graph");
                }
            });
        }
    }

    /**
     * Returns the ids of the entry functions.
     */
    public Set<Integer> entryIds() {
        return entryFunctions.stream()
                .map(FuncNode::id)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Returns vulns that have a call sink, in result order.
     */
    public List<Vuln> vulnsWithCallSink() {
        return vulns.stream()
                .filter(Vuln::hasCallSink)
                .toList();
    }

    /**
     * Returns the call sinks of the other vulns sharing the given vuln's database entry and import sink.
     */
    public Set<Integer> siblingSinks(Vuln vuln) {
        return vulns.stream()
                .filter(v -> v.isSiblingOf(vuln))
                .flatMap(v -> v.callSink().stream())
                .map(FuncNode::id)
                .collect(Collectors.toUnmodifiableSet());
    }
}
