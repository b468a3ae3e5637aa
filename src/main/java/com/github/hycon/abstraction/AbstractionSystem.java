package com.github.hycon.abstraction;

import com.github.hycon.geometry.Region;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Discrete abstraction of a continuous system: a partition, the coarser regions its cells were
 * refined from, and (once computed) the transition relation between cells.
 *
 * {@code transitions[j][i]} is true when every point of cell {@code i} can be steered into
 * cell {@code j}. The matrix is null until {@link TransitionComputer} has filled it in.
 */
public final class AbstractionSystem {

    @NotNull
    private final Partition partition;

    @NotNull
    private final int[] origin;

    @NotNull
    private final List<Region> originalRegions;

    @Nullable
    private final boolean[][] transitions;

    public AbstractionSystem(@NotNull Partition partition,
                             @NotNull int[] origin,
                             @NotNull List<Region> originalRegions,
                             @Nullable boolean[][] transitions) {
        if (origin.length != partition.size()) {
            throw new IllegalArgumentException("Origin has " + origin.length
                    + " entries but the partition has " + partition.size() + " regions");
        }
        for (int i=0; i < origin.length; i++) {
            if (origin[i] < 0 || origin[i] >= originalRegions.size()) {
                throw new IllegalArgumentException("Region " + i + " descends from unknown original region " + origin[i]);
            }
        }
        if (transitions != null && !Matrices.isSquare(transitions, partition.size())) {
            throw new IllegalArgumentException("Transitions must be a " + partition.size() + "x" + partition.size() + " matrix");
        }
        this.partition = partition;
        this.origin = Arrays.copyOf(origin, origin.length);
        this.originalRegions = Collections.unmodifiableList(new ArrayList<>(originalRegions));
        this.transitions = transitions == null ? null : Matrices.copy(transitions);
    }

    /**
     * Abstraction of an unrefined partition, every cell is its own original region.
     */
    @NotNull
    public static AbstractionSystem unrefined(@NotNull Partition partition) {
        final int[] origin = new int[partition.size()];
        for (int i=0; i < origin.length; i++) {
            origin[i] = i;
        }
        return new AbstractionSystem(partition, origin, partition.getRegions(), null);
    }

    @NotNull
    public Partition getPartition() {
        return partition;
    }

    @NotNull
    public int[] getOrigin() {
        return Arrays.copyOf(origin, origin.length);
    }

    public int getOrigin(int region) {
        return origin[region];
    }

    @NotNull
    public List<Region> getOriginalRegions() {
        return originalRegions;
    }

    /**
     * The unrefined region that cell {@code region} descends from.
     */
    @NotNull
    public Region getOriginalRegion(int region) {
        return originalRegions.get(origin[region]);
    }

    public boolean hasTransitions() {
        return transitions != null;
    }

    @Nullable
    public boolean[][] getTransitions() {
        return transitions == null ? null : Matrices.copy(transitions);
    }

    /**
     * True if cell {@code from} can be steered into cell {@code to}.
     */
    public boolean canTransition(int from, int to) {
        if (transitions == null) {
            throw new IllegalStateException("Transitions have not been computed");
        }
        return transitions[to][from];
    }

    @NotNull
    public List<Integer> successors(int from) {
        final List<Integer> result = new ArrayList<>();
        for (int to=0; to < partition.size(); to++) {
            if (canTransition(from, to)) {
                result.add(to);
            }
        }
        return result;
    }

    @NotNull
    public List<Integer> predecessors(int to) {
        final List<Integer> result = new ArrayList<>();
        for (int from=0; from < partition.size(); from++) {
            if (canTransition(from, to)) {
                result.add(from);
            }
        }
        return result;
    }

    @NotNull
    public AbstractionSystem withTransitions(@NotNull boolean[][] transitions) {
        return new AbstractionSystem(partition, origin, originalRegions, transitions);
    }

}
