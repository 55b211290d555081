package io.vulnwitness.output;

import io.vulnwitness.model.CallGraph;
import io.vulnwitness.model.CallStack;
import io.vulnwitness.model.Result;
import io.vulnwitness.model.StackEntry;
import io.vulnwitness.model.Vuln;
import io.vulnwitness.witness.Witnesses;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;

/**
 * Formats witnesses as human-readable traces, one block per reachable vulnerability.
 */
public class TextReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String DIM = "\u001B[2m";

    private final boolean useColor;
    private final boolean showUnreachable;

    public TextReporter() {
        this(false, false);
    }

    /**
     * @param useColor        Emit ANSI colors
     * @param showUnreachable Also list searched vulnerabilities that have no witness
     */
    public TextReporter(boolean useColor, boolean showUnreachable) {
        this.useColor = useColor;
        this.showUnreachable = showUnreachable;
    }

    @Override
    public void write(Result result, Witnesses witnesses, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);
        CallGraph graph = result.callGraph();
        List<Vuln> reachable = witnesses.reachable();

        int index = 1;
        for (Vuln vuln : reachable) {
            CallStack stack = witnesses.witness(vuln).orElseThrow();
            out.println(color(BOLD + RED, "Vulnerability #" + index++ + ": " + vuln.osvId()));
            out.println("  Symbol: " + stack.sink().displayName());
            vuln.importSink().ifPresent(pkg -> out.println("  Package: " + pkg));
            out.println("  Example trace (" + stack.size() + " frames, "
                    + stack.weight() + " dynamic " + (stack.weight() == 1 ? "call" : "calls") + "):");

            int step = 1;
            for (StackEntry entry : stack.entries()) {
                if (entry.isLast()) {
                    break;
                }
                out.println("    #" + step++ + ": " + traceLine(graph, entry));
            }
            out.println();
        }

        if (showUnreachable && !witnesses.unreachable().isEmpty()) {
            out.println(color(DIM, "No call stack found for:"));
            for (Vuln vuln : witnesses.unreachable()) {
                out.println(color(DIM, "  " + vuln));
            }
            out.println();
        }

        out.println("Your code reaches " + reachable.size() + " of "
                + witnesses.size() + " searched " + (witnesses.size() == 1 ? "vulnerability" : "vulnerabilities") + ".");
        out.flush();
    }

    /**
     * Formats "file:line:col: caller calls callee", marking dynamic calls.
     */
    String traceLine(CallGraph graph, StackEntry entry) {
        StringBuilder sb = new StringBuilder();
        if (entry.call().hasPosition()) {
            sb.append(entry.call().position()).append(": ");
        }
        sb.append(entry.function().displayName())
                .append(" calls ")
                .append(graph.callee(entry.call()).displayName());
        if (entry.isDynamicCall()) {
            sb.append(color(YELLOW, " (dynamic)"));
        }
        return sb.toString();
    }

    private String color(String code, String text) {
        return useColor ? code + text + RESET : text;
    }
}
