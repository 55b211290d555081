package io.vulnwitness.witness;

import io.vulnwitness.model.CallGraph;
import io.vulnwitness.model.CallSite;
import io.vulnwitness.model.CallStack;
import io.vulnwitness.model.FuncNode;
import io.vulnwitness.model.Result;
import io.vulnwitness.model.Vuln;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Finds the representative call stack of a single vulnerability.
 * <p>
 * The search walks callers breadth-first, starting at the vulnerable function and
 * going up until it reaches entry functions of the program:
 * <ul>
 *   <li>Each function is expanded at most once, so the search is linear in the number
 *       of call sites. Not all call stacks are considered.</li>
 *   <li>For each caller of an expanded function a single call site is followed, the first
 *       one in {@link SourceOrder#CALL_SITES} order. Callers are visited in
 *       {@link SourceOrder#FUNCTIONS} order.</li>
 *   <li>Call sinks of sibling vulns (same database entry, same import sink) are never
 *       expanded, so witnesses do not chain through another symbol of the same flaw.
 *       They can still be the entry frame of a stack.</li>
 *   <li>Candidates are collected for the first level at which an entry function is
 *       reached; the search stops after that level.</li>
 * </ul>
 * Instances are immutable and can be shared between threads.
 */
public class WitnessSearch {

    private static final Logger log = LoggerFactory.getLogger(WitnessSearch.class);

    private final Result result;
    private final CallGraph graph;
    private final Set<Integer> entries;
    private final SearchListener listener;

    public WitnessSearch(Result result) {
        this(result, SearchListener.NONE);
    }

    public WitnessSearch(Result result, SearchListener listener) {
        this.result = result;
        this.graph = result.callGraph();
        this.entries = result.entryIds();
        this.listener = listener != null ? listener : SearchListener.NONE;
    }

    /**
     * Returns the witness for the vuln: the shortest stack with the fewest
     * unresolved call sites, or empty if no entry function reaches the sink.
     */
    public Optional<CallStack> witness(Vuln vuln) {
        return StackRanker.best(candidates(vuln));
    }

    /**
     * Returns all shortest candidate stacks found for the vuln, in discovery order.
     * Returns an empty list when the vuln has no call sink.
     */
    public List<CallStack> candidates(Vuln vuln) {
        FuncNode sink = vuln.callSink().orElse(null);
        if (sink == null) {
            return List.of();
        }

        Set<Integer> siblingSinks = result.siblingSinks(vuln);
        Set<Integer> seen = new HashSet<>();
        List<CallStack> candidates = new ArrayList<>();

        List<CallChain> frontier = List.of(CallChain.sink(sink));
        int level = 0;
        int expanded = 0;
        while (!frontier.isEmpty() && candidates.isEmpty()) {
            List<CallChain> next = new ArrayList<>();
            for (CallChain chain : frontier) {
                FuncNode function = chain.function();
                if (!seen.add(function.id())) {
                    continue;
                }
                expanded++;
                listener.onExpand(vuln, function);

                for (CallSite site : callSitesByCaller(function, seen)) {
                    FuncNode caller = graph.caller(site);
                    CallChain extended = chain.calledFrom(caller, site);
                    if (!siblingSinks.contains(caller.id())) {
                        next.add(extended);
                    }
                    if (entries.contains(caller.id())) {
                        CallStack stack = extended.toCallStack();
                        candidates.add(stack);
                        listener.onCandidate(vuln, stack);
                    }
                }
            }
            frontier = next;
            level++;
        }

        log.debug("{}: {} candidate(s) after {} level(s), {} function(s) expanded",
                vuln, candidates.size(), level, expanded);
        return candidates;
    }

    /**
     * Picks one call site into the function for each caller not yet seen,
     * the smallest by source order, and returns them ordered by caller.
     */
    List<CallSite> callSitesByCaller(FuncNode callee, Set<Integer> seen) {
        Map<Integer, CallSite> smallest = new HashMap<>();
        for (CallSite site : graph.callersOf(callee)) {
            if (seen.contains(site.caller())) {
                continue;
            }
            smallest.merge(site.caller(), site,
                    (current, candidate) -> SourceOrder.CALL_SITES.compare(candidate, current) < 0 ? candidate : current);
        }

        return smallest.values().stream()
                .sorted(Comparator.comparing((CallSite site) -> graph.caller(site), SourceOrder.FUNCTIONS))
                .toList();
    }
}
