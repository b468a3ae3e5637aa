package com.github.hycon.automaton;

import com.github.hycon.xml.ConXml;
import com.github.hycon.xml.FormatException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Finite-state controller synthesized from a reactive temporal logic formula. Each state is a full
 * snapshot of environment and system variables, a transition is a legal move to a successor
 * snapshot. At runtime the controller is driven by {@link #findNextState}.
 *
 * States are kept in slots indexed by id. Ids may arrive out of order or with gaps while an
 * automaton is built incrementally, so some slots may be empty. Ids far beyond the slots go to
 * an ordered overflow map instead and move into the slots once these grow past them. Automata
 * loaded from the
 * structured format or reduced by {@link #trimRedundantStates()} have contiguous ids
 * {@code 0..size()-1}.
 *
 * Not thread safe.
 */
public final class Automaton {

    private static final Logger LOG = LoggerFactory.getLogger(Automaton.class);

    // Slots may run this far ahead of twice the state count before ids overflow.
    private static final int SLACK = 16;

    @NotNull
    private VariableTable variables;

    @NotNull
    private ArrayList<AutomatonState> slots = new ArrayList<>();

    // Every key is at least slots.size().
    @NotNull
    private TreeMap<Integer, AutomatonState> overflow = new TreeMap<>();

    private int count = 0;

    public Automaton() {
        this(new VariableTable());
    }

    /**
     * Empty automaton whose valuations use the given variables (more may be added later).
     */
    public Automaton(@NotNull VariableTable variables) {
        this.variables = variables;
    }

    /**
     * Automaton holding deep copies of the given states, which are not shared afterwards.
     */
    @NotNull
    public static Automaton copyOf(@NotNull Collection<AutomatonState> states) {
        final Automaton result = new Automaton();
        for (AutomatonState state : states) {
            result.addState(state);
        }
        return result;
    }

    /**
     * Read the textual format of the synthesis tool, see {@link AutFileReader}.
     */
    @NotNull
    public static Automaton loadFile(@NotNull Path path, @NotNull Collection<String> expectedVariables) throws IOException {
        return new AutFileReader(expectedVariables).read(path);
    }

    @NotNull
    public VariableTable getVariables() {
        return variables;
    }

    public int size() {
        return count;
    }

    /**
     * True if the ids of the states are exactly {@code 0..size()-1}.
     */
    public boolean isContiguous() {
        return count == slots.size() && overflow.isEmpty();
    }

    /**
     * States ordered by id.
     */
    @NotNull
    public List<AutomatonState> getStates() {
        return Collections.unmodifiableList(ordered());
    }

    /**
     * State with the given id or null if there is none.
     */
    @Nullable
    public AutomatonState getState(int id) {
        if (id < 0) return null;
        if (id < slots.size()) return slots.get(id);
        return overflow.get(id);
    }

    /**
     * Add a copy of the state. A state with the same id is replaced.
     */
    public void addState(@NotNull AutomatonState state) {
        put(state.copy(variables));
    }

    /**
     * Replace the valuation of a state, creating the state if the id is new.
     */
    public void setStateValuation(int id, @NotNull Map<String, Integer> valuation) {
        final Valuation value = Valuation.of(variables, valuation);
        final AutomatonState state = getState(id);
        if (state != null) {
            state.setValuation(value);
            LOG.debug("Setting state of AutomatonState {}: {}", id, value);
        } else {
            put(new AutomatonState(id, value, Collections.emptyList()));
            LOG.debug("Adding state {}: {}", id, value);
        }
    }

    /**
     * Replace the successors of a state, creating the state (with no variables assigned) if
     * the id is new.
     */
    public void setTransitions(int id, @NotNull Collection<Integer> successors) {
        final AutomatonState state = getState(id);
        if (state != null) {
            state.setTransitions(successors);
            LOG.debug("Setting transition of AutomatonState {}: {}", id, successors);
        } else {
            put(new AutomatonState(id, Valuation.empty(variables), successors));
            LOG.debug("Adding AutomatonState {} with transition {}", id, successors);
        }
    }

    /**
     * First state (by id) whose valuation is exactly {@code valuation}, or null.
     */
    @Nullable
    public AutomatonState find(@NotNull Map<String, Integer> valuation) {
        for (AutomatonState state : ordered()) {
            if (state.getValuation().matches(valuation)) {
                return state;
            }
        }
        return null;
    }

    /**
     * All states whose valuation is exactly {@code valuation}, ordered by id.
     */
    @NotNull
    public List<AutomatonState> findAll(@NotNull Map<String, Integer> valuation) {
        final List<AutomatonState> result = new ArrayList<>();
        for (AutomatonState state : ordered()) {
            if (state.getValuation().matches(valuation)) {
                result.add(state);
            }
        }
        return result;
    }

    /**
     * First successor of {@code current} which agrees with the observed environment. Only the
     * variables present in {@code environment} are compared. When {@code current} is null,
     * every state is a candidate, which is how an initial state is chosen.
     *
     * If several successors agree, the first one wins, so the automaton should be
     * deterministic with respect to the environment. Transitions to ids with no state are
     * ignored.
     *
     * @return the next state, or null if no candidate agrees
     */
    @Nullable
    public AutomatonState findNextState(@Nullable AutomatonState current, @NotNull Map<String, Integer> environment) {
        final List<Integer> candidates;
        if (current == null) {
            candidates = new ArrayList<>(count);
            for (AutomatonState state : ordered()) {
                candidates.add(state.getId());
            }
        } else {
            candidates = current.getTransitions();
        }
        for (int id : candidates) {
            final AutomatonState next = getState(id);
            if (next != null && next.getValuation().agreesWith(environment)) {
                return next;
            }
        }
        return null;
    }

    /**
     * Collapse all states with identical valuations into one, renumbering ids contiguously.
     *
     * This is lossy: the surviving state gets the union of the outgoing transitions of the
     * collapsed ones, so the result may allow moves the original controller would not make.
     * Use {@link #minimizeBisimilar()} where behavior must be preserved.
     */
    public void trimRedundantStates() {
        AutomatonReducer.trimRedundant(this);
    }

    /**
     * Merge only states that cannot be told apart: same valuation and, recursively, the same
     * successors up to merging. Ids are renumbered contiguously.
     */
    public void minimizeBisimilar() {
        AutomatonReducer.minimizeBisimilar(this);
    }

    /**
     * Replace the content of this automaton by the automaton of a {@code tulipcon} document.
     * On failure this automaton is left untouched.
     */
    public void loadXML(@NotNull String xml) throws FormatException {
        final Automaton loaded = AutomatonXml.loadXML(xml);
        if (loaded == null) {
            throw new FormatException("Document holds no automaton");
        }
        variables = loaded.variables;
        slots = loaded.slots;
        overflow = loaded.overflow;
        count = loaded.count;
    }

    /**
     * Complete {@code tulipcon} document holding this automaton.
     */
    @NotNull
    public String dumpXML(boolean pretty) {
        final Document document = ConXml.newDocument();
        final Element root = ConXml.createEnvelope(document);
        root.appendChild(new AutomatonXml().write(document, this));
        return ConXml.toXml(document, pretty);
    }

    public void writeDotFile(@NotNull Path path) throws IOException {
        DotWriter.write(this, path);
    }

    /**
     * Graphviz description of this automaton, see {@link #writeDotFile(Path)}.
     */
    public void writeDot(@NotNull Appendable out) throws IOException {
        DotWriter.write(this, out);
    }

    /**
     * Swap in a new set of states, used by the reducers.
     */
    void replaceStates(@NotNull List<AutomatonState> states) {
        slots = new ArrayList<>();
        overflow = new TreeMap<>();
        count = 0;
        for (AutomatonState state : states) {
            put(state);
        }
    }

    @NotNull
    private List<AutomatonState> ordered() {
        final List<AutomatonState> result = new ArrayList<>(count);
        for (AutomatonState state : slots) {
            if (state != null) {
                result.add(state);
            }
        }
        result.addAll(overflow.values());
        return result;
    }

    private void put(@NotNull AutomatonState state) {
        final int id = state.getId();
        if (overflow.remove(id) != null) {
            count -= 1;
        }
        if (id >= slots.size() && (long) id >= 2L * count + SLACK) {
            overflow.put(id, state);
            count += 1;
            return;
        }
        if (slots.get(grow(id)) == null) {
            count += 1;
        }
        slots.set(id, state);
        while (!overflow.isEmpty() && (long) overflow.firstKey() < 2L * count + SLACK) {
            final AutomatonState moved = overflow.pollFirstEntry().getValue();
            slots.set(grow(moved.getId()), moved);
        }
    }

    private int grow(int id) {
        while (slots.size() <= id) {
            slots.add(null);
        }
        return id;
    }

}
