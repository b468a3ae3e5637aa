package com.github.hycon.abstraction;

import com.github.hycon.geometry.Polytope;
import com.github.hycon.geometry.Region;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Proposition preserving partition of a convex domain into index-addressed regions.
 *
 * Adjacency is a symmetric, reflexive relation on region indices. The regions are expected
 * to be pairwise non-overlapping and to cover the domain; that is not checked here, since
 * doing so needs an oracle.
 */
public final class Partition {

    @NotNull
    private final Polytope domain;

    @NotNull
    private final List<Region> regions;

    @NotNull
    private final boolean[][] adjacency;

    @NotNull
    private final List<String> propositionSymbols;

    public Partition(@NotNull Polytope domain,
                     @NotNull List<Region> regions,
                     @NotNull boolean[][] adjacency,
                     @NotNull List<String> propositionSymbols) {
        final int n = regions.size();
        if (!Matrices.isSquare(adjacency, n)) {
            throw new IllegalArgumentException("Adjacency must be a " + n + "x" + n + " matrix");
        }
        if (!Matrices.isSymmetric(adjacency)) {
            throw new IllegalArgumentException("Adjacency must be symmetric");
        }
        if (!Matrices.hasTrueDiagonal(adjacency)) {
            throw new IllegalArgumentException("Every region must be adjacent to itself");
        }
        for (int i=0; i < n; i++) {
            int labels = regions.get(i).getPropositions().size();
            if (labels != 0 && labels != propositionSymbols.size()) {
                throw new IllegalArgumentException("Region " + i + " has " + labels
                        + " proposition labels, expected " + propositionSymbols.size());
            }
        }
        this.domain = domain;
        this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
        this.adjacency = Matrices.copy(adjacency);
        this.propositionSymbols = Collections.unmodifiableList(new ArrayList<>(propositionSymbols));
    }

    @NotNull
    public Polytope getDomain() {
        return domain;
    }

    @NotNull
    public List<Region> getRegions() {
        return regions;
    }

    @NotNull
    public Region getRegion(int index) {
        return regions.get(index);
    }

    public int size() {
        return regions.size();
    }

    @NotNull
    public boolean[][] getAdjacency() {
        return Matrices.copy(adjacency);
    }

    public boolean isAdjacent(int i, int j) {
        return adjacency[i][j];
    }

    @NotNull
    public List<String> getPropositionSymbols() {
        return propositionSymbols;
    }

    public int getPropositionCount() {
        return propositionSymbols.size();
    }

}
