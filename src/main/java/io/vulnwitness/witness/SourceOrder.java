package io.vulnwitness.witness;

import io.vulnwitness.model.CallSite;
import io.vulnwitness.model.FuncNode;
import io.vulnwitness.model.SourcePosition;

import java.util.Comparator;
import java.util.function.Function;

/**
 * Total order over graph elements by source position, used for every sort and tie-break
 * in the witness search.
 * <p>
 * Elements with a position sort before elements without one. Two positions compare by
 * line, then column, then file name. When both positions are absent or equal, elements
 * compare by their own qualified name and finally by identity: functions by id, call sites
 * by caller id, callee id and then resolved before dynamic.
 *
 * @param <T> call sites or functions
 */
public final class SourceOrder<T> implements Comparator<T> {

    /**
     * Orders positions by line, column and file name.
     */
    public static final Comparator<SourcePosition> POSITIONS = Comparator
            .comparingInt(SourcePosition::line)
            .thenComparingInt(SourcePosition::column)
            .thenComparing(SourcePosition::filename);

    public static final SourceOrder<CallSite> CALL_SITES =
            new SourceOrder<>(CallSite::position, CallSite::qualifiedName, Comparator
                    .comparingInt(CallSite::caller)
                    .thenComparingInt(CallSite::callee)
                    .thenComparing(CallSite::resolved, Comparator.reverseOrder()));

    public static final SourceOrder<FuncNode> FUNCTIONS =
            new SourceOrder<>(FuncNode::position, FuncNode::displayName, Comparator.comparingInt(FuncNode::id));

    private final Function<T, SourcePosition> position;
    private final Function<T, String> name;
    private final Comparator<T> identity;

    private SourceOrder(Function<T, SourcePosition> position, Function<T, String> name, Comparator<T> identity) {
        this.position = position;
        this.name = name;
        this.identity = identity;
    }

    @Override
    public int compare(T a, T b) {
        SourcePosition pa = position.apply(a);
        SourcePosition pb = position.apply(b);
        if (pa != null && pb != null) {
            int c = POSITIONS.compare(pa, pb);
            if (c != 0) {
                return c;
            }
        } else if (pa != null) {
            return -1;
        } else if (pb != null) {
            return 1;
        }

        int c = name.apply(a).compareTo(name.apply(b));
        if (c != 0) {
            return c;
        }
        return identity.compare(a, b);
    }
}
