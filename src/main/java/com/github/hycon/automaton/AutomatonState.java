package com.github.hycon.automaton;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * One node of a controller automaton: the complete valuation of environment and system
 * variables at this node, and the ids of the nodes it may move to next.
 *
 * Successor ids form an ordered set, duplicates are dropped and the first occurrence decides
 * the position.
 */
public final class AutomatonState {

    private final int id;

    @NotNull
    private Valuation valuation;

    @NotNull
    private final LinkedHashSet<Integer> transitions;

    AutomatonState(int id, @NotNull Valuation valuation, @NotNull Collection<Integer> transitions) {
        if (id < 0) {
            throw new IllegalArgumentException("State id must be non-negative, got " + id);
        }
        this.id = id;
        this.valuation = valuation;
        this.transitions = new LinkedHashSet<>(transitions);
    }

    /**
     * Free standing state, e.g. to be added to an automaton later on.
     */
    public AutomatonState(int id, @NotNull Map<String, Integer> state, @NotNull Collection<Integer> transitions) {
        this(id, Valuation.of(new VariableTable(state.keySet()), state), transitions);
    }

    public int getId() {
        return id;
    }

    @NotNull
    public Valuation getValuation() {
        return valuation;
    }

    /**
     * Variable values of this node, in variable table order.
     */
    @NotNull
    public Map<String, Integer> getState() {
        return valuation.toMap();
    }

    @NotNull
    public List<Integer> getTransitions() {
        return Collections.unmodifiableList(new ArrayList<>(transitions));
    }

    public boolean hasTransition(int target) {
        return transitions.contains(target);
    }

    void setValuation(@NotNull Valuation valuation) {
        this.valuation = valuation;
    }

    void setTransitions(@NotNull Collection<Integer> transitions) {
        this.transitions.clear();
        this.transitions.addAll(transitions);
    }

    /**
     * Deep copy whose valuation is expressed over {@code table}.
     */
    @NotNull
    AutomatonState copy(@NotNull VariableTable table) {
        return new AutomatonState(id, valuation.rebase(table), transitions);
    }

    @Override
    public String toString() {
        return "AutomatonState{id=" + id + ", state=" + valuation + ", transition=" + transitions + "}";
    }
}
