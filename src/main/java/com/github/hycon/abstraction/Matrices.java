package com.github.hycon.abstraction;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

/**
 * Boolean square matrices used for adjacency and transition relations.
 */
public final class Matrices {

    // Only provides static methods.
    private Matrices() {}

    @NotNull
    public static boolean[][] identity(int n) {
        final boolean[][] result = new boolean[n][n];
        for (int i=0; i < n; i++) {
            result[i][i] = true;
        }
        return result;
    }

    @NotNull
    public static boolean[][] copy(@NotNull boolean[][] m) {
        final boolean[][] result = new boolean[m.length][];
        for (int i=0; i < m.length; i++) {
            result[i] = Arrays.copyOf(m[i], m[i].length);
        }
        return result;
    }

    /**
     * Boolean product: {@code result[i][j]} holds iff some {@code k} has {@code a[i][k] && b[k][j]}.
     */
    @NotNull
    public static boolean[][] multiply(@NotNull boolean[][] a, @NotNull boolean[][] b) {
        final int n = a.length;
        final boolean[][] result = new boolean[n][n];
        for (int i=0; i < n; i++) {
            for (int k=0; k < n; k++) {
                if (!a[i][k]) continue;
                for (int j=0; j < n; j++) {
                    if (b[k][j]) {
                        result[i][j] = true;
                    }
                }
            }
        }
        return result;
    }

    /**
     * {@code adjacency} raised to the given power. With a reflexive adjacency relation this is
     * exactly "reachable within {@code hops} hops".
     */
    @NotNull
    public static boolean[][] power(@NotNull boolean[][] adjacency, int hops) {
        if (hops < 1) {
            throw new IllegalArgumentException("Hop count must be positive, got " + hops);
        }
        boolean[][] result = copy(adjacency);
        for (int k=1; k < hops; k++) {
            result = multiply(result, adjacency);
        }
        return result;
    }

    public static boolean isSquare(@NotNull boolean[][] m, int n) {
        if (m.length != n) return false;
        for (boolean[] row : m) {
            if (row.length != n) return false;
        }
        return true;
    }

    public static boolean isSymmetric(@NotNull boolean[][] m) {
        for (int i=0; i < m.length; i++) {
            for (int j=i+1; j < m.length; j++) {
                if (m[i][j] != m[j][i]) return false;
            }
        }
        return true;
    }

    public static boolean hasTrueDiagonal(@NotNull boolean[][] m) {
        for (int i=0; i < m.length; i++) {
            if (!m[i][i]) return false;
        }
        return true;
    }

    public static int count(@NotNull boolean[][] m) {
        int result = 0;
        for (boolean[] row : m) {
            for (boolean b : row) {
                if (b) result += 1;
            }
        }
        return result;
    }

}
