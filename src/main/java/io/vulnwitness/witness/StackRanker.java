package io.vulnwitness.witness;

import io.vulnwitness.model.CallStack;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Orders candidate witnesses by how easy they are to understand.
 * <p>
 * Candidates passed in all have the same length. A stack with fewer unresolved
 * call sites ranks first; equal weights keep discovery order, which the search
 * makes deterministic.
 */
public final class StackRanker {

    public static final Comparator<CallStack> BY_WEIGHT = Comparator.comparingInt(CallStack::weight);

    private StackRanker() {
    }

    /**
     * Returns the candidates sorted best first.
     */
    public static List<CallStack> rank(List<CallStack> candidates) {
        List<CallStack> ranked = new ArrayList<>(candidates);
        ranked.sort(BY_WEIGHT);
        return ranked;
    }

    /**
     * Returns the best candidate, or empty if there are none.
     */
    public static Optional<CallStack> best(List<CallStack> candidates) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(rank(candidates).get(0));
    }
}
