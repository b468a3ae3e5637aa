package com.github.hycon.geometry;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

/**
 * Convex set given by the inequality system {@code H x <= K}.
 *
 * H is stored row-major as a {@code double[rows][dim]} matrix, K as a vector of length rows.
 * Polytopes are immutable, both arrays are copied on the way in and out.
 */
public final class Polytope {

    @NotNull
    private final double[][] h;

    @NotNull
    private final double[] k;

    private final int dim;

    public Polytope(@NotNull double[][] h, @NotNull double[] k) {
        if (h.length != k.length) {
            throw new IllegalArgumentException("H has " + h.length + " rows but K has " + k.length);
        }
        final int dim = h.length == 0 ? 0 : h[0].length;
        this.h = new double[h.length][];
        for (int i=0; i < h.length; i++) {
            if (h[i].length != dim) {
                throw new IllegalArgumentException("H row " + i + " has " + h[i].length + " columns, expected " + dim);
            }
            this.h[i] = Arrays.copyOf(h[i], dim);
        }
        this.k = Arrays.copyOf(k, k.length);
        this.dim = dim;
    }

    /**
     * Axis-aligned box {@code low <= x <= high}, encoded as {@code [I; -I] x <= [high; -low]}.
     */
    @NotNull
    public static Polytope box(@NotNull double[] low, @NotNull double[] high) {
        if (low.length != high.length) {
            throw new IllegalArgumentException("Bounds have different dimensions");
        }
        final int dim = low.length;
        final double[][] h = new double[2*dim][dim];
        final double[] k = new double[2*dim];
        for (int i=0; i < dim; i++) {
            h[i][i] = 1.0;
            k[i] = high[i];
            h[dim + i][i] = -1.0;
            k[dim + i] = -low[i];
        }
        return new Polytope(h, k);
    }

    /**
     * The nil polytope, i.e. an empty inequality system of dimension zero.
     */
    @NotNull
    public static Polytope empty() {
        return new Polytope(new double[0][], new double[0]);
    }

    public int getDimension() {
        return dim;
    }

    public int getRowCount() {
        return k.length;
    }

    @NotNull
    public double[][] getH() {
        final double[][] copy = new double[h.length][];
        for (int i=0; i < h.length; i++) {
            copy[i] = Arrays.copyOf(h[i], h[i].length);
        }
        return copy;
    }

    @NotNull
    public double[] getK() {
        return Arrays.copyOf(k, k.length);
    }

    public double coefficient(int row, int column) {
        return h[row][column];
    }

    public double bound(int row) {
        return k[row];
    }

    /**
     * True if the point satisfies every inequality up to the given tolerance.
     */
    public boolean contains(@NotNull double[] point, double tolerance) {
        for (int row=0; row < h.length; row++) {
            double sum = 0.0;
            for (int col=0; col < dim; col++) {
                sum += h[row][col] * point[col];
            }
            if (sum > k[row] + tolerance) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Polytope)) return false;
        Polytope other = (Polytope) o;
        return Arrays.deepEquals(h, other.h) && Arrays.equals(k, other.k);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.deepHashCode(h) + Arrays.hashCode(k);
    }

    @Override
    public String toString() {
        return "Polytope{H=" + Arrays.deepToString(h) + ", K=" + Arrays.toString(k) + "}";
    }
}
