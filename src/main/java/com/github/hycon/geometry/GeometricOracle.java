package com.github.hycon.geometry;

import org.jetbrains.annotations.NotNull;

/**
 * Geometric oracle provides the set operations the abstraction code needs on regions.
 * Implementations are expected to be side-effect free, so repeated calls with the same
 * arguments give the same answer. Failures are reported as {@link GeometryException}.
 *
 * Results of set operations carry no proposition labels, callers re-label them.
 *
 * @param <D> Dynamics descriptor understood by {@link #solveFeasible}.
 */
public interface GeometricOracle<D> {

    @NotNull
    Region intersect(@NotNull Region a, @NotNull Region b);

    /**
     * Points of {@code keep} that are not in {@code remove}.
     */
    @NotNull
    Region setDifference(@NotNull Region keep, @NotNull Region remove);

    double volume(@NotNull Region x);

    /**
     * True if the two regions share a boundary facet.
     */
    boolean isAdjacent(@NotNull Region a, @NotNull Region b);

    @NotNull
    ChebyshevBall chebyBall(@NotNull Region x);

    /**
     * Maximal subset of {@code source} from which {@code target} can be reached in at most
     * {@code horizon} steps of {@code dynamics} without leaving {@code excursion}.
     *
     * @param closedLoop if true, the input may be chosen anew after every step, otherwise a
     *                   single input sequence is fixed up front.
     */
    @NotNull
    Region solveFeasible(@NotNull Region source,
                         @NotNull Region target,
                         @NotNull D dynamics,
                         int horizon,
                         boolean closedLoop,
                         @NotNull Region excursion);

}
