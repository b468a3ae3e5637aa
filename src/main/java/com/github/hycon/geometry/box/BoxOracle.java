package com.github.hycon.geometry.box;

import com.github.hycon.geometry.ChebyshevBall;
import com.github.hycon.geometry.GeometricOracle;
import com.github.hycon.geometry.GeometryException;
import com.github.hycon.geometry.Polytope;
import com.github.hycon.geometry.Region;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Oracle for regions that are unions of axis-aligned boxes. Internally, a region is simply an
 * array of rectangles. There is a way more efficient way to do this (interval decision
 * diagrams), but let's not get into that just now.
 *
 * The main rule is that the rectangles of one set do not overlap! Every operation returning a
 * set preserves this.
 *
 * Regions whose pieces are not boxes are rejected with a {@link GeometryException}.
 */
public final class BoxOracle implements GeometricOracle<TranslationDynamics> {

    @NotNull
    static final double[][] EMPTY_SET = new double[0][];

    private static final ThreadLocal<double[][]> workArray = new ThreadLocal<>();

    /**
     * Obtain an array of undefined rectangles of given count.
     * This array is immediately cached, so you don't have to return it.
     */
    private static double[][] getWorkArray(int items) {
        double[][] array = workArray.get();
        if (array == null || array.length < items) {
            array = new double[items][];
            workArray.set(array);
        }
        return array;
    }

    @NotNull
    @Override
    public Region intersect(@NotNull Region a, @NotNull Region b) {
        return toRegion(intersect(toRectangles(a), toRectangles(b)));
    }

    @NotNull
    @Override
    public Region setDifference(@NotNull Region keep, @NotNull Region remove) {
        return toRegion(subtract(toRectangles(keep), toRectangles(remove)));
    }

    @Override
    public double volume(@NotNull Region x) {
        return volume(toRectangles(x));
    }

    @Override
    public boolean isAdjacent(@NotNull Region a, @NotNull Region b) {
        final double[][] rA = toRectangles(a);
        final double[][] rB = toRectangles(b);
        for (double[] x : rA) {
            for (double[] y : rB) {
                checkDimensions(x, y);
                if (Rectangle.touches(x, y)) {
                    return true;
                }
            }
        }
        return false;
    }

    @NotNull
    @Override
    public ChebyshevBall chebyBall(@NotNull Region x) {
        ChebyshevBall best = ChebyshevBall.degenerate();
        for (double[] r : toRectangles(x)) {
            final int dim = Rectangle.dimension(r);
            double radius = Double.POSITIVE_INFINITY;
            final double[] center = new double[dim];
            for (int i=0; i < dim; i++) {
                radius = Math.min(radius, (r[2*i+1] - r[2*i]) / 2.0);
                center[i] = (r[2*i] + r[2*i+1]) / 2.0;
            }
            if (dim > 0 && radius > best.getRadius()) {
                best = new ChebyshevBall(radius, center);
            }
        }
        return best;
    }

    @NotNull
    @Override
    public Region solveFeasible(@NotNull Region source,
                                @NotNull Region target,
                                @NotNull TranslationDynamics dynamics,
                                int horizon,
                                boolean closedLoop,
                                @NotNull Region excursion) {
        final double[][] from = toRectangles(source);
        final double[][] to = toRectangles(target);
        final double[][] allowed = toRectangles(excursion);
        for (double[] r : from) {
            checkDimension(r, dynamics);
        }
        final double[][] reach = closedLoop
                ? closedLoopReach(to, dynamics, horizon, allowed)
                : openLoopReach(to, dynamics, horizon, allowed);
        return toRegion(intersect(from, reach));
    }

    /**
     * Backward reachability where the input is re-chosen after every step: iterate the one-step
     * predecessor operator, restricted to the allowed set, until the horizon or a fixpoint.
     */
    @NotNull
    private static double[][] closedLoopReach(@NotNull double[][] target,
                                              @NotNull TranslationDynamics dynamics,
                                              int horizon,
                                              @NotNull double[][] allowed) {
        double[][] reach = target;
        for (int step=0; step < horizon; step++) {
            final double[][] pre = new double[reach.length][];
            for (int i=0; i < reach.length; i++) {
                pre[i] = predecessor(reach[i], dynamics, 1);
            }
            final double[][] fresh = subtract(intersect(normalize(pre), allowed), reach);
            if (fresh.length == 0) {
                break;
            }
            reach = concat(reach, fresh);
        }
        return reach;
    }

    /**
     * Backward reachability with one input fixed for the whole run. Trajectories are straight
     * lines, so a run stays inside a convex box of the allowed set iff both of its ends do.
     */
    @NotNull
    private static double[][] openLoopReach(@NotNull double[][] target,
                                            @NotNull TranslationDynamics dynamics,
                                            int horizon,
                                            @NotNull double[][] allowed) {
        double[][] reach = target;
        for (double[] box : allowed) {
            for (double[] t : target) {
                final double[] end = Rectangle.intersect(t, box);
                if (end == null) continue;
                for (int steps=1; steps <= horizon; steps++) {
                    final double[] start = Rectangle.intersect(predecessor(end, dynamics, steps), box);
                    if (start != null) {
                        reach = union(reach, new double[][] { start });
                    }
                }
            }
        }
        return reach;
    }

    /**
     * States from which {@code steps} constant inputs lead into the rectangle.
     */
    @NotNull
    private static double[] predecessor(@NotNull double[] r, @NotNull TranslationDynamics dynamics, int steps) {
        final double[] result = new double[r.length];
        for (int i=0; i < r.length / 2; i++) {
            result[2*i] = r[2*i] - steps * dynamics.getInputHigh(i);
            result[2*i+1] = r[2*i+1] - steps * dynamics.getInputLow(i);
        }
        return result;
    }

    @NotNull
    static double[][] intersect(@NotNull double[][] a, @NotNull double[][] b) {
        if (a.length == 0) return a;
        if (b.length == 0) return b;
        final double[][] workArray = getWorkArray(a.length * b.length);
        int workIndex = 0;
        for (double[] rA : a) {
            for (double[] rB : b) {
                checkDimensions(rA, rB);
                double[] intersection = Rectangle.intersect(rA, rB);
                if (intersection != null) {
                    workArray[workIndex] = intersection;
                    workIndex += 1;
                }
            }
        }
        return Arrays.copyOf(workArray, workIndex);
    }

    @NotNull
    static double[][] subtract(@NotNull double[][] keep, @NotNull double[][] remove) {
        double[][] result = keep;
        for (double[] r : remove) {
            final List<double[]> next = new ArrayList<>();
            for (double[] k : result) {
                checkDimensions(k, r);
                if (Rectangle.encloses(r, k)) continue;
                next.addAll(Arrays.asList(Rectangle.subtract(k, r)));
            }
            result = next.toArray(EMPTY_SET);
        }
        return result;
    }

    @NotNull
    static double[][] union(@NotNull double[][] a, @NotNull double[][] b) {
        if (a.length == 0) return b;
        if (b.length == 0) return a;
        return concat(a, subtract(b, a));
    }

    static double volume(@NotNull double[][] x) {
        double result = 0.0;
        for (double[] r : x) {
            result += Rectangle.volume(r);
        }
        return result;
    }

    /**
     * Make a possibly overlapping collection of rectangles disjoint.
     */
    @NotNull
    private static double[][] normalize(@NotNull double[][] x) {
        double[][] result = EMPTY_SET;
        for (double[] r : x) {
            result = union(result, new double[][] { r });
        }
        return result;
    }

    @NotNull
    private static double[][] concat(@NotNull double[][] a, @NotNull double[][] b) {
        final double[][] result = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }

    @NotNull
    static double[][] toRectangles(@NotNull Region region) {
        final List<double[]> result = new ArrayList<>(region.getPieces().size());
        for (Polytope p : region.getPieces()) {
            double[] r = Rectangle.fromPolytope(p);
            if (r != null) {
                result.add(r);
            }
        }
        return result.toArray(EMPTY_SET);
    }

    @NotNull
    static Region toRegion(@NotNull double[][] rectangles) {
        final List<Polytope> pieces = new ArrayList<>(rectangles.length);
        for (double[] r : rectangles) {
            pieces.add(Rectangle.toPolytope(r));
        }
        return new Region(pieces);
    }

    private static void checkDimensions(@NotNull double[] a, @NotNull double[] b) {
        if (a.length != b.length) {
            throw new GeometryException("Dimension mismatch: " + Rectangle.dimension(a) + " vs " + Rectangle.dimension(b));
        }
    }

    private static void checkDimension(@NotNull double[] r, @NotNull TranslationDynamics dynamics) {
        if (Rectangle.dimension(r) != dynamics.getDimension()) {
            throw new GeometryException("Region has dimension " + Rectangle.dimension(r)
                    + " but dynamics act on dimension " + dynamics.getDimension());
        }
    }

}
