package io.vulnwitness.witness;

import io.vulnwitness.model.CallGraph;
import io.vulnwitness.model.CallSite;
import io.vulnwitness.model.CallStack;
import io.vulnwitness.model.Result;
import io.vulnwitness.model.Vuln;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Checks witnesses on random graphs against facts computed without the search itself.
 */
class WitnessSearchPropertiesTest {

    /**
     * Fewest calls from any entry to the sink, walking callers breadth-first without
     * passing through sibling sinks. Empty when no entry reaches the sink.
     */
    private static OptionalInt shortestCallCount(Result result, Vuln vuln) {
        CallGraph graph = result.callGraph();
        int sink = vuln.callSink().orElseThrow().id();
        Set<Integer> siblings = result.siblingSinks(vuln);

        Map<Integer, Integer> distance = new HashMap<>();
        Deque<Integer> queue = new ArrayDeque<>();
        distance.put(sink, 0);
        queue.add(sink);
        while (!queue.isEmpty()) {
            int function = queue.poll();
            if (function != sink && siblings.contains(function)) {
                continue;
            }
            for (CallSite site : graph.callersOf(function)) {
                if (!distance.containsKey(site.caller())) {
                    distance.put(site.caller(), distance.get(function) + 1);
                    queue.add(site.caller());
                }
            }
        }
        return result.entryIds().stream()
                .filter(id -> id != sink && distance.containsKey(id))
                .mapToInt(distance::get)
                .min();
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 2, 3, 5, 8})
    void witness_hasShortestPossibleLength(long seed) {
        Result result = GraphFixture.randomResult(new Random(seed), 150, 450, 30);
        WitnessSearch search = new WitnessSearch(result);

        int reachable = 0;
        for (Vuln vuln : result.vulns()) {
            OptionalInt calls = shortestCallCount(result, vuln);
            Optional<CallStack> witness = search.witness(vuln);

            assertThat(witness.isPresent()).as("reachability of %s", vuln).isEqualTo(calls.isPresent());
            if (witness.isPresent()) {
                reachable++;
                assertThat(witness.get().size()).as("frames of %s", vuln).isEqualTo(calls.getAsInt() + 1);
            }
        }
        assertThat(reachable).isPositive();
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 2, 3, 5, 8})
    void witness_isWellFormedStackFromEntryToSink(long seed) {
        Result result = GraphFixture.randomResult(new Random(seed), 150, 450, 30);
        WitnessSearch search = new WitnessSearch(result);

        for (Vuln vuln : result.vulns()) {
            search.witness(vuln).ifPresent(stack -> {
                Set<Integer> siblings = result.siblingSinks(vuln);
                assertThat(result.entryIds()).contains(stack.entry().id());
                assertThat(stack.sink()).isEqualTo(vuln.callSink().orElseThrow());
                for (int i = 0; i < stack.size() - 1; i++) {
                    assertThat(stack.entries().get(i).call().callee())
                            .isEqualTo(stack.entries().get(i + 1).function().id());
                    if (i > 0) {
                        assertThat(siblings).doesNotContain(stack.entries().get(i).function().id());
                    }
                }
            });
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 2, 3, 5, 8})
    void witness_hasLowestWeightAmongCandidates(long seed) {
        Result result = GraphFixture.randomResult(new Random(seed), 150, 450, 30);
        WitnessSearch search = new WitnessSearch(result);

        for (Vuln vuln : result.vulns()) {
            List<CallStack> candidates = search.candidates(vuln);
            Optional<CallStack> witness = search.witness(vuln);
            if (candidates.isEmpty()) {
                assertThat(witness).isEmpty();
                continue;
            }

            CallStack lightest = candidates.stream().min(Comparator.comparingInt(CallStack::weight)).orElseThrow();
            assertThat(witness).contains(lightest);
            assertThat(candidates).allSatisfy(c -> assertThat(c.size()).isEqualTo(lightest.size()));
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 2, 3, 5, 8})
    void witness_doesNotDependOnInsertionOrder(long seed) {
        Random random = new Random(seed);
        Result result = GraphFixture.randomResult(random, 150, 450, 30);
        Result shuffled = GraphFixture.shuffled(result, random);
        Result shuffledAgain = GraphFixture.shuffled(result, random);

        Witnesses expected = new WitnessFinder(1).findWitnesses(result);
        Witnesses actual = new WitnessFinder(4).findWitnesses(shuffled);
        Witnesses actualAgain = new WitnessFinder(2).findWitnesses(shuffledAgain);

        for (Vuln vuln : result.vulns()) {
            assertThat(actual.witness(vuln)).as("witness of %s", vuln).isEqualTo(expected.witness(vuln));
            assertThat(actualAgain.witness(vuln)).as("witness of %s", vuln).isEqualTo(expected.witness(vuln));
            assertThat(new WitnessSearch(shuffled).candidates(vuln))
                    .isEqualTo(new WitnessSearch(result).candidates(vuln));
        }
    }
}
