package io.vulnwitness.witness;

import io.vulnwitness.model.CallSite;
import io.vulnwitness.model.CallStack;
import io.vulnwitness.model.FuncNode;
import io.vulnwitness.model.StackEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * A chain of calls discovered while walking callers, ending at the vulnerable function.
 * Chains share their tails, so extending one is constant time.
 *
 * @param function Function of the outermost frame
 * @param call     Call site from {@code function} into the next frame, null for the sink
 * @param child    The rest of the chain, null for the sink
 * @param frames   Number of frames in the chain
 */
record CallChain(
        FuncNode function,
        CallSite call,
        CallChain child,
        int frames
) {
    static CallChain sink(FuncNode sink) {
        return new CallChain(sink, null, null, 1);
    }

    /**
     * Prepends a frame for the caller of this chain's outermost function.
     */
    CallChain calledFrom(FuncNode caller, CallSite site) {
        return new CallChain(caller, site, this, frames + 1);
    }

    CallStack toCallStack() {
        List<StackEntry> entries = new ArrayList<>(frames);
        for (CallChain c = this; c != null; c = c.child) {
            entries.add(new StackEntry(c.function, c.call));
        }
        return new CallStack(entries);
    }
}
