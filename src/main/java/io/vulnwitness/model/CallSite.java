package io.vulnwitness.model;

/**
 * A single call expression linking a caller to a callee.
 *
 * @param caller       Id of the calling function
 * @param callee       Id of the called function
 * @param name         Name of the called symbol
 * @param receiverType Receiver type of the called symbol, null for plain function calls
 * @param position     Position of the call expression, null if unknown
 * @param resolved     True if the target was statically resolved, false for dynamic dispatch
 *                     whose target set was approximated upstream
 */
public record CallSite(
        int caller,
        int callee,
        String name,
        String receiverType,
        SourcePosition position,
        boolean resolved
) {
    public CallSite {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Call site name cannot be null or blank");
        }
        if (receiverType != null && receiverType.isBlank()) {
            receiverType = null;
        }
    }

    /**
     * Creates a call site named after its callee.
     */
    public static CallSite to(FuncNode caller, FuncNode callee, SourcePosition position, boolean resolved) {
        return new CallSite(caller.id(), callee.id(), callee.name(), callee.receiver(), position, resolved);
    }

    /**
     * Receiver qualified name of the called symbol, e.g. "Type.Method" or "Func".
     */
    public String qualifiedName() {
        return receiverType != null ? receiverType + "." + name : name;
    }

    public boolean isDynamic() {
        return !resolved;
    }

    public boolean hasPosition() {
        return position != null;
    }
}
