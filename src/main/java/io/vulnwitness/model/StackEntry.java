package io.vulnwitness.model;

/**
 * An element of a call stack.
 *
 * @param function Function whose frame is on the stack
 * @param call     Call site inducing the next frame, null on the innermost frame
 */
public record StackEntry(
        FuncNode function,
        CallSite call
) {
    public StackEntry {
        if (function == null) {
            throw new IllegalArgumentException("Stack entry function cannot be null");
        }
        if (call != null && call.caller() != function.id()) {
            throw new IllegalArgumentException("Call site " + call.qualifiedName()
                    + " does not belong to " + function.displayName());
        }
    }

    /**
     * Creates the innermost frame.
     */
    public static StackEntry sink(FuncNode function) {
        return new StackEntry(function, null);
    }

    public boolean isLast() {
        return call == null;
    }

    /**
     * Checks whether the call to the next frame is a dynamic call site.
     */
    public boolean isDynamicCall() {
        return call != null && !call.resolved();
    }
}
