package com.github.hycon.abstraction;

import com.github.hycon.geometry.GeometricOracle;
import com.github.hycon.geometry.Region;
import kotlin.Pair;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Computes which cells of an abstraction can be steered into which other cells.
 *
 * A candidate pair is any two cells at most {@link AbstractionConfig#getTransLength()}
 * adjacency hops apart. Both directions of every candidate pair are checked, each exactly once.
 * A transition {@code i -> j} exists if the feasibility solver leaves (up to
 * {@link AbstractionConfig#getAbsTol()}) nothing of cell {@code i} that cannot reach {@code j}
 * while staying inside the original region cell {@code i} was refined from.
 *
 * @param <D> Dynamics type of the oracle.
 */
public final class TransitionComputer<D> {

    private static final Logger LOG = LoggerFactory.getLogger(TransitionComputer.class);

    @NotNull
    private final GeometricOracle<D> oracle;

    @NotNull
    private final AbstractionConfig config;

    public TransitionComputer(@NotNull GeometricOracle<D> oracle, @NotNull AbstractionConfig config) {
        this.oracle = oracle;
        this.config = config;
    }

    public TransitionComputer(@NotNull GeometricOracle<D> oracle) {
        this(oracle, AbstractionConfig.defaults());
    }

    /**
     * Fill in the transition relation of the given abstraction. Any oracle failure aborts the
     * whole computation and is propagated as is.
     *
     * @return Copy of {@code system} with transitions set.
     */
    @NotNull
    public AbstractionSystem computeTransitions(@NotNull AbstractionSystem system, @NotNull D dynamics) {
        return system.withTransitions(transitionMatrix(system, dynamics));
    }

    /**
     * Same as {@link #computeTransitions}, but returns only the matrix, {@code result[j][i]}
     * meaning cell {@code i} can transition to cell {@code j}.
     */
    @NotNull
    public boolean[][] transitionMatrix(@NotNull AbstractionSystem system, @NotNull D dynamics) {
        final Partition partition = system.getPartition();
        final int n = partition.size();
        final boolean[][] candidates = config.getTransLength() > 1
                ? Matrices.power(partition.getAdjacency(), config.getTransLength())
                : partition.getAdjacency();

        final Deque<Pair<Integer, Integer>> worklist = new ArrayDeque<>();
        final Set<Pair<Integer, Integer>> queued = new HashSet<>();
        for (int j=0; j < n; j++) {
            for (int i=0; i < n; i++) {
                if (candidates[j][i]) {
                    enqueue(worklist, queued, new Pair<>(i, j));
                    enqueue(worklist, queued, new Pair<>(j, i));
                }
            }
        }
        LOG.info("Checking {} ordered cell pairs of {} cells (horizon {}, closed loop {})",
                worklist.size(), n, config.getHorizon(), config.isClosedLoop());

        final boolean[][] transitions = new boolean[n][n];
        int found = 0;
        while (!worklist.isEmpty()) {
            final Pair<Integer, Integer> pair = worklist.poll();
            final int from = pair.getFirst();
            final int to = pair.getSecond();
            if (isReachable(system, from, to, dynamics)) {
                transitions[to][from] = true;
                found += 1;
            }
        }
        LOG.info("Found {} transitions", found);
        return transitions;
    }

    private boolean isReachable(@NotNull AbstractionSystem system, int from, int to, @NotNull D dynamics) {
        final Region source = system.getPartition().getRegion(from);
        final Region target = system.getPartition().getRegion(to);
        // feasibility is checked against the original cell, not the refined one
        final Region excursion = system.getOriginalRegion(from);
        final Region feasible = oracle.solveFeasible(source, target, dynamics,
                config.getHorizon(), config.isClosedLoop(), excursion);
        final double missing = oracle.volume(oracle.setDifference(source, feasible));
        final boolean reachable = missing < config.getAbsTol();
        LOG.debug("{} -> {}: unreachable volume {}, transition {}", from, to, missing, reachable);
        return reachable;
    }

    private static void enqueue(@NotNull Deque<Pair<Integer, Integer>> worklist,
                                @NotNull Set<Pair<Integer, Integer>> queued,
                                @NotNull Pair<Integer, Integer> pair) {
        if (queued.add(pair)) {
            worklist.add(pair);
        }
    }

}
