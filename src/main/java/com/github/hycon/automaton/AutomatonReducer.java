package com.github.hycon.automaton;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * State-count reductions of an automaton. Both reductions group states into classes, keep the
 * lowest id of each class as its representative and renumber the representatives
 * {@code 0..k-1} in id order.
 */
final class AutomatonReducer {

    private static final Logger LOG = LoggerFactory.getLogger(AutomatonReducer.class);

    // Only provides static methods.
    private AutomatonReducer() {}

    /**
     * Group by valuation only, the representative receives the union of the group's
     * successors.
     */
    static void trimRedundant(@NotNull Automaton automaton) {
        final List<AutomatonState> states = automaton.getStates();
        final Map<Valuation, Integer> classes = new HashMap<>();
        final Map<Integer, Integer> classOf = new HashMap<>();
        for (AutomatonState state : states) {
            Integer existing = classes.putIfAbsent(state.getValuation(), classes.size());
            classOf.put(state.getId(), existing == null ? classes.size() - 1 : existing);
        }
        automaton.replaceStates(quotient(states, classOf, classes.size()));
        LOG.debug("Trimmed {} states to {}", states.size(), classes.size());
    }

    /**
     * Moore-style partition refinement: start from classes of equal valuation and split a
     * class whenever two of its states reach different sets of classes, until nothing splits.
     * States left in one class are bisimilar, so merging them keeps the behavior.
     */
    static void minimizeBisimilar(@NotNull Automaton automaton) {
        final List<AutomatonState> states = automaton.getStates();
        Map<Integer, Integer> classOf = new HashMap<>();
        final Map<Valuation, Integer> initial = new HashMap<>();
        for (AutomatonState state : states) {
            Integer existing = initial.putIfAbsent(state.getValuation(), initial.size());
            classOf.put(state.getId(), existing == null ? initial.size() - 1 : existing);
        }
        int classCount = initial.size();
        while (true) {
            final Map<List<Object>, Integer> signatures = new LinkedHashMap<>();
            final Map<Integer, Integer> refined = new HashMap<>();
            for (AutomatonState state : states) {
                final Set<Integer> reached = new TreeSet<>();
                for (int target : state.getTransitions()) {
                    Integer c = classOf.get(target);
                    if (c != null) {
                        reached.add(c);
                    }
                }
                final List<Object> signature = new ArrayList<>(2);
                signature.add(classOf.get(state.getId()));
                signature.add(reached);
                Integer existing = signatures.putIfAbsent(signature, signatures.size());
                refined.put(state.getId(), existing == null ? signatures.size() - 1 : existing);
            }
            classOf = refined;
            if (signatures.size() == classCount) {
                break;
            }
            classCount = signatures.size();
        }
        automaton.replaceStates(quotient(states, classOf, classCount));
        LOG.debug("Minimized {} states to {}", states.size(), classCount);
    }

    /**
     * Build the quotient automaton. Classes are numbered in order of their first (lowest id)
     * member, which becomes the representative; successors of all members are redirected to
     * classes and united. Transitions to ids without a state are dropped.
     */
    @NotNull
    private static List<AutomatonState> quotient(@NotNull List<AutomatonState> states,
                                                 @NotNull Map<Integer, Integer> classOf,
                                                 int classCount) {
        final AutomatonState[] representatives = new AutomatonState[classCount];
        final List<LinkedHashSet<Integer>> successors = new ArrayList<>(classCount);
        for (int c=0; c < classCount; c++) {
            successors.add(new LinkedHashSet<>());
        }
        for (AutomatonState state : states) {
            final int c = classOf.get(state.getId());
            if (representatives[c] == null) {
                representatives[c] = state;
            }
            for (int target : state.getTransitions()) {
                Integer redirected = classOf.get(target);
                if (redirected == null) {
                    LOG.warn("State {} has a transition to missing state {}, dropping it", state.getId(), target);
                } else {
                    successors.get(c).add(redirected);
                }
            }
        }
        final List<AutomatonState> result = new ArrayList<>(classCount);
        for (int c=0; c < classCount; c++) {
            result.add(new AutomatonState(c, representatives[c].getValuation(), successors.get(c)));
        }
        return result;
    }

}
