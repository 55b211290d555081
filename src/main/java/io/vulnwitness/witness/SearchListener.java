package io.vulnwitness.witness;

import io.vulnwitness.model.CallStack;
import io.vulnwitness.model.FuncNode;
import io.vulnwitness.model.Vuln;

/**
 * Observes witness searches. Searches for different vulns run concurrently,
 * so implementations must be thread-safe.
 */
public interface SearchListener {

    SearchListener NONE = new SearchListener() {};

    /**
     * Called when a function is taken off the frontier and its callers are examined.
     */
    default void onExpand(Vuln vuln, FuncNode function) {
    }

    /**
     * Called for every shortest candidate stack, in discovery order.
     */
    default void onCandidate(Vuln vuln, CallStack stack) {
    }
}
