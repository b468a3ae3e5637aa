package com.github.hycon.abstraction;

import com.github.hycon.geometry.GeometricOracle;
import com.github.hycon.geometry.Region;
import kotlin.Pair;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges two abstractions of the same domain into their common refinement.
 *
 * Every non-degenerate intersection of a cell of the first partition with a cell of the second
 * one becomes a cell of the result. Cells keep the proposition labels of their first parent and
 * the original region both parents descend from. Transitions of the result are not computed.
 */
public final class PartitionMerger {

    private static final Logger LOG = LoggerFactory.getLogger(PartitionMerger.class);

    @NotNull
    private final GeometricOracle<?> oracle;

    @NotNull
    private final AbstractionConfig config;

    public PartitionMerger(@NotNull GeometricOracle<?> oracle, @NotNull AbstractionConfig config) {
        this.oracle = oracle;
        this.config = config;
    }

    public PartitionMerger(@NotNull GeometricOracle<?> oracle) {
        this(oracle, AbstractionConfig.defaults());
    }

    @NotNull
    public AbstractionSystem mergePartitions(@NotNull AbstractionSystem first, @NotNull AbstractionSystem second) {
        final Partition part1 = first.getPartition();
        final Partition part2 = second.getPartition();
        checkCompatible(first, second);

        final List<Region> cells = new ArrayList<>();
        final List<Pair<Integer, Integer>> parents = new ArrayList<>();
        final List<Integer> origin = new ArrayList<>();
        for (int i=0; i < part1.size(); i++) {
            for (int j=0; j < part2.size(); j++) {
                final Region isect = oracle.intersect(part1.getRegion(i), part2.getRegion(j));
                final double radius = oracle.chebyBall(isect).getRadius();
                if (radius <= config.getChebyTol()) {
                    continue;
                }
                if (first.getOrigin(i) != second.getOrigin(j)) {
                    throw new IncompatiblePartitionsException("Cells " + i + " and " + j
                            + " overlap but descend from original regions " + first.getOrigin(i)
                            + " and " + second.getOrigin(j) + ", partitions don't share an origin");
                }
                LOG.debug("Keeping product cell {} of cells ({}, {}), radius {}", cells.size(), i, j, radius);
                cells.add(isect.withPropositions(part1.getRegion(i).getPropositions()));
                parents.add(new Pair<>(i, j));
                origin.add(first.getOrigin(i));
            }
        }

        final int n = cells.size();
        final boolean[][] adjacency = new boolean[n][n];
        for (int p=0; p < n; p++) {
            final int p1 = parents.get(p).getFirst();
            final int p2 = parents.get(p).getSecond();
            for (int q=p+1; q < n; q++) {
                final int q1 = parents.get(q).getFirst();
                final int q2 = parents.get(q).getSecond();
                // cheap filter on the parents, the geometric test decides
                boolean candidate = part1.isAdjacent(p1, q1) || part2.isAdjacent(p2, q2)
                        || p1 == q1 || p2 == q2;
                if (candidate && oracle.isAdjacent(cells.get(p), cells.get(q))) {
                    adjacency[p][q] = true;
                    adjacency[q][p] = true;
                }
            }
            adjacency[p][p] = true;
        }
        LOG.info("Merged {}x{} cells into {} cells with {} adjacency entries",
                part1.size(), part2.size(), n, Matrices.count(adjacency));

        final Partition merged = new Partition(part1.getDomain(), cells, adjacency, part1.getPropositionSymbols());
        final int[] originArray = new int[n];
        for (int p=0; p < n; p++) {
            originArray[p] = origin.get(p);
        }
        return new AbstractionSystem(merged, originArray, first.getOriginalRegions(), null);
    }

    private static void checkCompatible(@NotNull AbstractionSystem first, @NotNull AbstractionSystem second) {
        final Partition part1 = first.getPartition();
        final Partition part2 = second.getPartition();
        if (part1.getPropositionCount() != part2.getPropositionCount()) {
            throw new IncompatiblePartitionsException("Partitions have different number of propositions: "
                    + part1.getPropositionCount() + " vs " + part2.getPropositionCount());
        }
        if (!part1.getPropositionSymbols().equals(part2.getPropositionSymbols())) {
            throw new IncompatiblePartitionsException("Partitions have different propositions: "
                    + part1.getPropositionSymbols() + " vs " + part2.getPropositionSymbols());
        }
        if (first.getOriginalRegions().size() != second.getOriginalRegions().size()) {
            throw new IncompatiblePartitionsException("Partitions have different number of original regions: "
                    + first.getOriginalRegions().size() + " vs " + second.getOriginalRegions().size());
        }
        if (!part1.getDomain().equals(part2.getDomain())) {
            throw new IncompatiblePartitionsException("Partitions have different domains");
        }
    }

}
