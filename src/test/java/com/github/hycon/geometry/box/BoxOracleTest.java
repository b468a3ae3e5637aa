package com.github.hycon.geometry.box;

import com.github.hycon.geometry.ChebyshevBall;
import com.github.hycon.geometry.GeometryException;
import com.github.hycon.geometry.Polytope;
import com.github.hycon.geometry.Region;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class BoxOracleTest {

    private final BoxOracle oracle = new BoxOracle();

    private static Region interval(double low, double high) {
        return Region.of(Polytope.box(new double[] { low }, new double[] { high }));
    }

    private static Region square(double x0, double x1, double y0, double y1) {
        return Region.of(Polytope.box(new double[] { x0, y0 }, new double[] { x1, y1 }));
    }

    private static TranslationDynamics input(double low, double high) {
        return new TranslationDynamics(new double[] { low }, new double[] { high });
    }

    @Test
    void setOperations() {
        Region a = square(0, 2, 0, 2);
        Region b = square(1, 3, 1, 3);
        assertThat(oracle.volume(oracle.intersect(a, b))).isCloseTo(1.0, within(1e-12));
        assertThat(oracle.volume(oracle.setDifference(a, b))).isCloseTo(3.0, within(1e-12));
        assertThat(oracle.setDifference(a, a).isEmpty()).isTrue();
        assertThat(oracle.volume(Region.empty())).isZero();
    }

    @Test
    void unionOfPiecesIsDisjoint() {
        Region twoPieces = new Region(Arrays.asList(
                Polytope.box(new double[] { 0 }, new double[] { 2 }),
                Polytope.box(new double[] { 3 }, new double[] { 4 })));
        assertThat(oracle.volume(oracle.intersect(twoPieces, interval(1, 3.5)))).isCloseTo(1.5, within(1e-12));
    }

    @Test
    void adjacency() {
        assertThat(oracle.isAdjacent(interval(0, 1), interval(1, 2))).isTrue();
        assertThat(oracle.isAdjacent(interval(0, 1), interval(2, 3))).isFalse();
        assertThat(oracle.isAdjacent(square(0, 1, 0, 1), square(0, 1, 1, 2))).isTrue();
        assertThat(oracle.isAdjacent(square(0, 1, 0, 1), square(1, 2, 1, 2))).isFalse();
    }

    @Test
    void chebyshevBallOfBox() {
        ChebyshevBall ball = oracle.chebyBall(square(0, 2, 0, 4));
        assertThat(ball.getRadius()).isCloseTo(1.0, within(1e-12));
        assertThat(ball.getCenter()).containsExactly(1.0, 2.0);
        assertThat(oracle.chebyBall(Region.empty()).getRadius()).isZero();
    }

    @Test
    void oneStepReachability() {
        Region feasible = oracle.solveFeasible(interval(0, 1), interval(1, 2), input(0.5, 1.0),
                1, true, interval(0, 2));
        assertThat(oracle.volume(feasible)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void shortHorizonLeavesPartOfSource() {
        Region feasible = oracle.solveFeasible(interval(0, 1), interval(1, 2), input(0.1, 0.2),
                1, true, interval(0, 2));
        assertThat(oracle.volume(feasible)).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void longerHorizonReachesWholeSource() {
        Region closed = oracle.solveFeasible(interval(0, 1), interval(1, 2), input(0.1, 0.2),
                10, true, interval(0, 2));
        assertThat(oracle.volume(closed)).isCloseTo(1.0, within(1e-9));

        Region open = oracle.solveFeasible(interval(0, 1), interval(1, 2), input(0.1, 0.2),
                10, false, interval(0, 2));
        assertThat(oracle.volume(open)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void excursionSetRestrictsTrajectories() {
        Region feasible = oracle.solveFeasible(interval(0, 1), interval(1, 2), input(0.1, 0.2),
                10, true, interval(0.5, 2));
        assertThat(oracle.volume(feasible)).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void movingAwayNeverReaches() {
        Region feasible = oracle.solveFeasible(interval(0, 1), interval(1, 2), input(-1, -0.5),
                10, true, interval(-10, 10));
        assertThat(oracle.volume(feasible)).isZero();
    }

    @Test
    void dimensionMismatchFails() {
        assertThatThrownBy(() -> oracle.intersect(interval(0, 1), square(0, 1, 0, 1)))
                .isInstanceOf(GeometryException.class);
        assertThatThrownBy(() -> oracle.solveFeasible(square(0, 1, 0, 1), square(1, 2, 0, 1),
                input(0, 1), 1, true, square(0, 2, 0, 1)))
                .isInstanceOf(GeometryException.class);
    }

}
