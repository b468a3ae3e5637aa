package com.github.hycon.geometry.box;

import com.github.hycon.geometry.GeometryException;
import com.github.hycon.geometry.Polytope;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * Rectangle is simply a double array of length 2*|dim|, {@code [low0, high0, low1, high1, ...]}.
 *
 * Note that every rectangle is considered immutable once it is created!
 *
 * An empty rectangle/empty set is represented using null.
 */
public final class Rectangle {

    /**
     * Tolerance used when deciding whether two bounds coincide.
     */
    static final double EPSILON = 1e-10;

    // Only provides static methods.
    private Rectangle() {}

    static int dimension(@NotNull double[] r) {
        return r.length / 2;
    }

    /**
     * Compute intersection of two rectangles. Intersection is always one valid rectangle unless
     * it is empty (or has no interior), in which case it's null.
     */
    @Nullable
    static double[] intersect(@Nullable double[] a, @Nullable double[] b) {
        if (a == null || b == null) return null;
        final int dim = a.length / 2;
        final double[] result = new double[a.length];
        for (int i=0; i < dim; i++) {
            final int iL = 2*i;
            final int iH = iL + 1;
            final double low = Math.max(a[iL], b[iL]);
            final double high = Math.min(a[iH], b[iH]);
            if (low >= high) {
                return null;
            }
            result[iL] = low;
            result[iH] = high;
        }
        if (Arrays.equals(a, result)) return a;
        if (Arrays.equals(b, result)) return b;
        return result;
    }

    /**
     * True if parent rectangle fully contains child rectangle.
     */
    static boolean encloses(@Nullable double[] parent, @Nullable double[] child) {
        if (parent == null) return false;
        if (child == null) return true;
        final int dim = parent.length / 2;
        for (int i=0; i < dim; i++) {
            final int iL = 2*i;
            final int iH = iL + 1;
            if (parent[iL] > child[iL] || parent[iH] < child[iH]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Subtract two rectangles. The subtraction can produce up-to 2*|dim| smaller rectangles,
     * which are pairwise disjoint.
     */
    @NotNull
    static double[][] subtract(@Nullable double[] keep, @Nullable double[] remove) {
        if (keep == null) return BoxOracle.EMPTY_SET;
        final double[] intersection = intersect(keep, remove);
        if (intersection == null) {
            return new double[][] { keep };
        }
        final int dim = keep.length / 2;
        final double[][] work = new double[2*dim][];
        int workIndex = 0;
        // Peel off the slabs below and above the intersection one dimension at a time,
        // then shrink the remainder to the intersection in that dimension.
        final double[] rest = Arrays.copyOf(keep, keep.length);
        for (int i=0; i < dim; i++) {
            final int iL = 2*i;
            final int iH = iL + 1;
            if (rest[iL] < intersection[iL]) {
                double[] below = Arrays.copyOf(rest, rest.length);
                below[iH] = intersection[iL];
                work[workIndex++] = below;
            }
            if (intersection[iH] < rest[iH]) {
                double[] above = Arrays.copyOf(rest, rest.length);
                above[iL] = intersection[iH];
                work[workIndex++] = above;
            }
            rest[iL] = intersection[iL];
            rest[iH] = intersection[iH];
        }
        return Arrays.copyOf(work, workIndex);
    }

    static double volume(@Nullable double[] r) {
        if (r == null) return 0.0;
        double result = 1.0;
        for (int i=0; i < r.length; i+=2) {
            result *= r[i+1] - r[i];
        }
        return result;
    }

    /**
     * Two closed rectangles touch if they share a facet: their projections overlap with positive
     * length in every dimension except at most one, where they meet in a single point.
     */
    static boolean touches(@NotNull double[] a, @NotNull double[] b) {
        final int dim = a.length / 2;
        int contacts = 0;
        for (int i=0; i < dim; i++) {
            final int iL = 2*i;
            final int iH = iL + 1;
            final double low = Math.max(a[iL], b[iL]);
            final double high = Math.min(a[iH], b[iH]);
            if (high - low > EPSILON) continue;
            if (Math.abs(high - low) <= EPSILON) {
                contacts += 1;
            } else {
                return false;
            }
        }
        return contacts <= 1;
    }

    /**
     * Read an inequality system as a rectangle. Every row has to constrain exactly one
     * coordinate, otherwise the polytope is not a box.
     */
    @Nullable
    static double[] fromPolytope(@NotNull Polytope p) {
        final int dim = p.getDimension();
        final double[] result = new double[2*dim];
        for (int i=0; i < dim; i++) {
            result[2*i] = Double.NEGATIVE_INFINITY;
            result[2*i+1] = Double.POSITIVE_INFINITY;
        }
        for (int row=0; row < p.getRowCount(); row++) {
            int axis = -1;
            for (int col=0; col < dim; col++) {
                if (p.coefficient(row, col) != 0.0) {
                    if (axis >= 0) {
                        throw new GeometryException("Row " + row + " of " + p + " is not axis aligned");
                    }
                    axis = col;
                }
            }
            final double k = p.bound(row);
            if (axis < 0) {
                // 0 <= k, trivially true or trivially infeasible
                if (k < 0) return null;
                continue;
            }
            final double a = p.coefficient(row, axis);
            final double limit = k / a;
            if (a > 0) {
                result[2*axis+1] = Math.min(result[2*axis+1], limit);
            } else {
                result[2*axis] = Math.max(result[2*axis], limit);
            }
        }
        for (int i=0; i < dim; i++) {
            if (Double.isInfinite(result[2*i]) || Double.isInfinite(result[2*i+1])) {
                throw new GeometryException("Polytope " + p + " is unbounded in dimension " + i);
            }
            if (result[2*i] >= result[2*i+1]) {
                return null;
            }
        }
        return result;
    }

    @NotNull
    static Polytope toPolytope(@NotNull double[] r) {
        final int dim = r.length / 2;
        final double[] low = new double[dim];
        final double[] high = new double[dim];
        for (int i=0; i < dim; i++) {
            low[i] = r[2*i];
            high[i] = r[2*i+1];
        }
        return Polytope.box(low, high);
    }

}
