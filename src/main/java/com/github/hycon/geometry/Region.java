package com.github.hycon.geometry;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A cell of the continuous state space: a union of convex pieces together with the
 * propositions that hold inside it.
 *
 * Propositions are stored positionally, {@code propositions.get(p)} is 1 when proposition
 * {@code p} of the owning partition holds in this region, 0 otherwise.
 *
 * Regions are immutable. A region without pieces is the empty set.
 */
public final class Region {

    @NotNull
    private final List<Polytope> pieces;

    @NotNull
    private final List<Integer> propositions;

    public Region(@NotNull List<Polytope> pieces, @NotNull List<Integer> propositions) {
        this.pieces = Collections.unmodifiableList(new ArrayList<>(pieces));
        this.propositions = Collections.unmodifiableList(new ArrayList<>(propositions));
    }

    public Region(@NotNull List<Polytope> pieces) {
        this(pieces, Collections.emptyList());
    }

    @NotNull
    public static Region of(@NotNull Polytope piece) {
        return new Region(Collections.singletonList(piece));
    }

    @NotNull
    public static Region empty() {
        return new Region(Collections.emptyList());
    }

    @NotNull
    public List<Polytope> getPieces() {
        return pieces;
    }

    @NotNull
    public List<Integer> getPropositions() {
        return propositions;
    }

    public boolean isEmpty() {
        return pieces.isEmpty();
    }

    /**
     * Same pieces, different labels.
     */
    @NotNull
    public Region withPropositions(@NotNull List<Integer> propositions) {
        return new Region(pieces, propositions);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Region)) return false;
        Region other = (Region) o;
        return pieces.equals(other.pieces) && propositions.equals(other.propositions);
    }

    @Override
    public int hashCode() {
        return 31 * pieces.hashCode() + propositions.hashCode();
    }

    @Override
    public String toString() {
        return "Region{pieces=" + pieces.size() + ", propositions=" + propositions + "}";
    }
}
