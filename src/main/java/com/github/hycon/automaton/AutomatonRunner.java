package com.github.hycon.automaton;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Executes a controller automaton against a stream of environment observations. The first
 * observation picks the initial state among all states, later ones move along transitions.
 */
public final class AutomatonRunner {

    private static final Logger LOG = LoggerFactory.getLogger(AutomatonRunner.class);

    @NotNull
    private final Automaton automaton;

    @Nullable
    private AutomatonState current = null;

    public AutomatonRunner(@NotNull Automaton automaton) {
        this.automaton = automaton;
    }

    /**
     * Move to the next state agreeing with the observation.
     *
     * @return the new state, or null if no successor agrees, in which case the runner stays
     * where it was
     */
    @Nullable
    public AutomatonState step(@NotNull Map<String, Integer> environment) {
        final AutomatonState next = automaton.findNextState(current, environment);
        if (next == null) {
            LOG.warn("No successor of state {} agrees with {}",
                    current == null ? "<initial>" : current.getId(), environment);
            return null;
        }
        LOG.debug("Step {} -> {}", current == null ? "<initial>" : current.getId(), next.getId());
        current = next;
        return next;
    }

    /**
     * Forget the current state, the next step chooses an initial state again.
     */
    public void reset() {
        current = null;
    }

    @Nullable
    public AutomatonState current() {
        return current;
    }

}
