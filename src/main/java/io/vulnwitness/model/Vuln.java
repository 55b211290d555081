package io.vulnwitness.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One pairing of a vulnerability database entry with an affected symbol used by the program.
 * <p>
 * Vulns have identity semantics: they are used as map keys in the witness mapping,
 * and two instances with equal fields are still distinct vulnerabilities.
 */
public final class Vuln {

    private final String osvId;
    private final String symbol;
    private final FuncNode callSink;
    private final String importSink;

    /**
     * @param osvId      Id of the originating database entry (e.g., "GO-2022-0969")
     * @param symbol     Affected symbol name as listed in the database entry
     * @param callSink   Vulnerable function in the call graph, null if the symbol is imported but never called
     * @param importSink Path of the vulnerable package, null if unknown
     */
    public Vuln(String osvId, String symbol, FuncNode callSink, String importSink) {
        if (osvId == null || osvId.isBlank()) {
            throw new IllegalArgumentException("Vulnerability id cannot be null or blank");
        }
        this.osvId = osvId;
        this.symbol = symbol != null ? symbol : "";
        this.callSink = callSink;
        this.importSink = importSink;
    }

    public String osvId() {
        return osvId;
    }

    public String symbol() {
        return symbol;
    }

    public Optional<FuncNode> callSink() {
        return Optional.ofNullable(callSink);
    }

    public Optional<String> importSink() {
        return Optional.ofNullable(importSink);
    }

    public boolean hasCallSink() {
        return callSink != null;
    }

    /**
     * Checks whether the other vuln is the same underlying flaw instantiated at another symbol:
     * same database entry and same import sink.
     */
    public boolean isSiblingOf(Vuln other) {
        return other != this
                && osvId.equals(other.osvId)
                && Objects.equals(importSink, other.importSink);
    }

    @Override
    public String toString() {
        String sink = callSink != null ? callSink.displayName() : (importSink != null ? importSink : symbol);
        return osvId + " (" + sink + ")";
    }
}
