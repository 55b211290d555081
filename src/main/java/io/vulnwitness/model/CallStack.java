package io.vulnwitness.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A call stack starting with an entry function and ending with the vulnerable symbol.
 *
 * @param entries Frames, outermost first
 */
public record CallStack(
        List<StackEntry> entries
) {
    public CallStack {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("Call stack must have at least one frame");
        }
        entries = List.copyOf(entries);
    }

    /**
     * Number of frames.
     */
    public int size() {
        return entries.size();
    }

    /**
     * The outermost frame (the entry function).
     */
    public FuncNode entry() {
        return entries.get(0).function();
    }

    /**
     * The innermost frame (the vulnerable function).
     */
    public FuncNode sink() {
        return entries.get(entries.size() - 1).function();
    }

    /**
     * How hard the stack is to follow as a witness: the number of unresolved call sites.
     * Lower is better.
     */
    public int weight() {
        return (int) entries.stream()
                .filter(StackEntry::isDynamicCall)
                .count();
    }

    /**
     * Human-readable form: "a -> b -> sink".
     */
    public String pathString() {
        return entries.stream()
                .map(e -> e.function().displayName())
                .collect(Collectors.joining(" -> "));
    }

    @Override
    public String toString() {
        return pathString();
    }
}
