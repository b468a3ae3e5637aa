package com.github.hycon.automaton;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class AutomatonReducerTest {

    private static Automaton build(int[][] successors, int... values) {
        final Automaton automaton = new Automaton();
        for (int id=0; id < values.length; id++) {
            automaton.setStateValuation(id, Map.of("a", values[id]));
            final Integer[] targets = new Integer[successors[id].length];
            for (int k=0; k < targets.length; k++) {
                targets[k] = successors[id][k];
            }
            automaton.setTransitions(id, Arrays.asList(targets));
        }
        return automaton;
    }

    /** 0(a=0) -> 1(a=1) -> 2(a=0) -> 3(a=2) -> 0 */
    private static Automaton cycle() {
        return build(new int[][] { { 1 }, { 2 }, { 3 }, { 0 } }, 0, 1, 0, 2);
    }

    @Test
    void trimMergesEqualValuations() {
        Automaton automaton = cycle();
        automaton.trimRedundantStates();

        assertThat(automaton.size()).isEqualTo(3);
        assertThat(automaton.isContiguous()).isTrue();
        assertThat(automaton.getState(0).getValuation().get("a")).isEqualTo(0);
        assertThat(automaton.getState(1).getValuation().get("a")).isEqualTo(1);
        assertThat(automaton.getState(2).getValuation().get("a")).isEqualTo(2);
        // union of the successors of the old states 0 and 2
        assertThat(automaton.getState(0).getTransitions()).containsExactly(1, 2);
        assertThat(automaton.getState(1).getTransitions()).containsExactly(0);
        assertThat(automaton.getState(2).getTransitions()).containsExactly(0);
    }

    @Test
    void trimKeepsDistinctValuationsDistinct() {
        Automaton automaton = cycle();
        automaton.trimRedundantStates();

        for (AutomatonState state : automaton.getStates()) {
            assertThat(automaton.findAll(state.getState())).hasSize(1);
        }
        for (AutomatonState state : automaton.getStates()) {
            for (int target : state.getTransitions()) {
                assertThat(automaton.getState(target)).isNotNull();
            }
        }
    }

    @Test
    void trimIsIdempotent() {
        Automaton automaton = cycle();
        automaton.trimRedundantStates();
        String once = automaton.dumpXML(false);
        automaton.trimRedundantStates();
        assertThat(automaton.dumpXML(false)).isEqualTo(once);
    }

    @Test
    void trimCompactsIdsAndDropsDanglingTransitions() {
        Automaton automaton = new Automaton();
        automaton.setStateValuation(2, Map.of("a", 1));
        automaton.setTransitions(2, Arrays.asList(7, 4));
        automaton.setStateValuation(4, Map.of("a", 0));
        automaton.setTransitions(4, Collections.singletonList(2));

        automaton.trimRedundantStates();

        assertThat(automaton.isContiguous()).isTrue();
        assertThat(automaton.size()).isEqualTo(2);
        assertThat(automaton.getState(0).getValuation().get("a")).isEqualTo(1);
        assertThat(automaton.getState(0).getTransitions()).containsExactly(1);
        assertThat(automaton.getState(1).getTransitions()).containsExactly(0);
    }

    @Test
    void minimizeMergesOnlyBisimilarStates() {
        Automaton automaton = cycle();
        automaton.minimizeBisimilar();

        // states 0 and 2 share a valuation but have different futures
        assertThat(automaton.size()).isEqualTo(4);
        assertThat(automaton.getState(0).getTransitions()).containsExactly(1);
        assertThat(automaton.getState(2).getTransitions()).containsExactly(3);
    }

    @Test
    void minimizeMergesEquivalentBranches() {
        Automaton automaton = build(new int[][] { { 1, 2 }, { 0 }, { 0 } }, 0, 1, 1);
        automaton.minimizeBisimilar();

        assertThat(automaton.size()).isEqualTo(2);
        assertThat(automaton.getState(0).getTransitions()).containsExactly(1);
        assertThat(automaton.getState(1).getTransitions()).containsExactly(0);
    }

    @Test
    void minimizeSplitsByDistantFuture() {
        // 1 and 2 look alike and step to 3 and 4, which look alike, but only 4 can reach a=9
        Automaton automaton = build(new int[][] { { 1, 2 }, { 3 }, { 4 }, { 3 }, { 5 }, { 5 } },
                0, 1, 1, 2, 2, 9);
        automaton.minimizeBisimilar();

        assertThat(automaton.size()).isEqualTo(6);
    }

    @Test
    void emptyAutomaton() {
        Automaton automaton = new Automaton();
        automaton.trimRedundantStates();
        automaton.minimizeBisimilar();
        assertThat(automaton.size()).isZero();
    }

}
