package com.github.hycon.geometry;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

/**
 * Largest ball inscribed in a region. Empty regions have radius zero and an empty center.
 */
public final class ChebyshevBall {

    private final double radius;

    @NotNull
    private final double[] center;

    public ChebyshevBall(double radius, @NotNull double[] center) {
        this.radius = radius;
        this.center = Arrays.copyOf(center, center.length);
    }

    @NotNull
    public static ChebyshevBall degenerate() {
        return new ChebyshevBall(0.0, new double[0]);
    }

    public double getRadius() {
        return radius;
    }

    @NotNull
    public double[] getCenter() {
        return Arrays.copyOf(center, center.length);
    }

    @Override
    public String toString() {
        return "ChebyshevBall{radius=" + radius + ", center=" + Arrays.toString(center) + "}";
    }
}
