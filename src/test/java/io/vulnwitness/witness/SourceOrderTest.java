package io.vulnwitness.witness;

import io.vulnwitness.model.CallSite;
import io.vulnwitness.model.FuncNode;
import io.vulnwitness.model.SourcePosition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SourceOrderTest {

    private static FuncNode fn(int id, String name, SourcePosition position) {
        return FuncNode.builder().id(id).name(name).packagePath("app").position(position).build();
    }

    @Test
    void positions_compareLineThenColumnThenFile() {
        List<SourcePosition> positions = new ArrayList<>(List.of(
                new SourcePosition("b.go", 3, 1),
                new SourcePosition("a.go", 3, 1),
                new SourcePosition("z.go", 2, 9),
                new SourcePosition("a.go", 3, 0)
        ));

        positions.sort(SourceOrder.POSITIONS);

        assertThat(positions).extracting(SourcePosition::toString)
                .containsExactly("z.go:2:9", "a.go:3:0", "a.go:3:1", "b.go:3:1");
    }

    @Test
    void functions_withoutPositionSortLast() {
        FuncNode unknown = fn(1, "aaa", null);
        FuncNode late = fn(2, "zzz", new SourcePosition("x.go", 500, 1));

        assertThat(SourceOrder.FUNCTIONS.compare(late, unknown)).isNegative();
        assertThat(SourceOrder.FUNCTIONS.compare(unknown, late)).isPositive();
    }

    @Test
    void functions_fallBackToOwnQualifiedName() {
        FuncNode initB = fn(1, "initB", null);
        FuncNode initA = fn(2, "initA", null);
        SourcePosition same = new SourcePosition("x.go", 1, 1);

        assertThat(SourceOrder.FUNCTIONS.compare(initA, initB)).isNegative();
        assertThat(SourceOrder.FUNCTIONS.compare(fn(3, "b", same), fn(4, "a", same))).isPositive();
        assertThat(SourceOrder.FUNCTIONS.compare(fn(5, "a", same), fn(6, "a", same))).isNegative();
    }

    @Test
    void callSites_orderByPositionThenName() {
        CallSite early = new CallSite(1, 2, "Write", "*File", new SourcePosition("a.go", 4, 2), true);
        CallSite late = new CallSite(1, 2, "Read", "*File", new SourcePosition("a.go", 9, 2), true);
        CallSite nowhere = new CallSite(1, 2, "Close", null, null, true);
        CallSite nowhereToo = new CallSite(1, 2, "Append", null, null, true);

        List<CallSite> sites = new ArrayList<>(List.of(nowhere, late, nowhereToo, early));
        sites.sort(SourceOrder.CALL_SITES);

        assertThat(sites).containsExactly(early, late, nowhereToo, nowhere);
    }

    @Test
    void callSites_breakRemainingTiesByIdentityThenResolvedFirst() {
        CallSite dynamic = new CallSite(1, 2, "Close", null, null, false);
        CallSite resolved = new CallSite(1, 2, "Close", null, null, true);
        CallSite otherCallee = new CallSite(1, 3, "Close", null, null, true);
        CallSite otherCaller = new CallSite(0, 9, "Close", null, null, false);

        List<CallSite> sites = new ArrayList<>(List.of(dynamic, otherCallee, resolved, otherCaller));
        sites.sort(SourceOrder.CALL_SITES);

        assertThat(sites).containsExactly(otherCaller, resolved, dynamic, otherCallee);
        assertThat(SourceOrder.CALL_SITES.compare(resolved, new CallSite(1, 2, "Close", null, null, true))).isZero();
    }
}
