package com.github.hycon.geometry.box;

import com.github.hycon.geometry.GeometryException;
import com.github.hycon.geometry.Polytope;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RectangleTest {

    private static double[] box(double... bounds) {
        return bounds;
    }

    @Test
    void intersectionOfOverlappingRectangles() {
        double[] result = Rectangle.intersect(box(0, 2, 0, 2), box(1, 3, 1, 3));
        assertThat(result).containsExactly(1, 2, 1, 2);
    }

    @Test
    void touchingRectanglesHaveNoIntersection() {
        assertThat(Rectangle.intersect(box(0, 1, 0, 1), box(1, 2, 0, 1))).isNull();
        assertThat(Rectangle.intersect(null, box(0, 1))).isNull();
    }

    @Test
    void subtractSplitsIntoDisjointPieces() {
        double[][] pieces = Rectangle.subtract(box(0, 2, 0, 2), box(1, 3, 1, 3));
        assertThat(BoxOracle.volume(pieces)).isCloseTo(3.0, within(1e-12));
        for (int i=0; i < pieces.length; i++) {
            for (int j=i+1; j < pieces.length; j++) {
                assertThat(Rectangle.intersect(pieces[i], pieces[j])).isNull();
            }
            assertThat(Rectangle.intersect(pieces[i], box(1, 3, 1, 3))).isNull();
        }
    }

    @Test
    void subtractHoleInTheMiddle() {
        double[][] pieces = Rectangle.subtract(box(0, 3), box(1, 2));
        assertThat(pieces).hasNumberOfRows(2);
        assertThat(pieces[0]).containsExactly(0, 1);
        assertThat(pieces[1]).containsExactly(2, 3);
    }

    @Test
    void subtractDisjointKeepsOriginal() {
        double[] keep = box(0, 1);
        assertThat(Rectangle.subtract(keep, box(2, 3))).isDeepEqualTo(new double[][] { keep });
        assertThat(Rectangle.subtract(keep, box(-1, 4))).isEmpty();
    }

    @Test
    void touchesOnSharedFacetOnly() {
        assertThat(Rectangle.touches(box(0, 1, 0, 1), box(1, 2, 0, 1))).isTrue();
        // corner contact is not a facet
        assertThat(Rectangle.touches(box(0, 1, 0, 1), box(1, 2, 1, 2))).isFalse();
        assertThat(Rectangle.touches(box(0, 1, 0, 1), box(2, 3, 0, 1))).isFalse();
    }

    @Test
    void enclosesChild() {
        assertThat(Rectangle.encloses(box(0, 4, 0, 4), box(1, 2, 1, 2))).isTrue();
        assertThat(Rectangle.encloses(box(0, 4, 0, 4), box(1, 5, 1, 2))).isFalse();
        assertThat(Rectangle.encloses(null, box(0, 1))).isFalse();
    }

    @Test
    void polytopeConversion() {
        Polytope p = Polytope.box(new double[] { 0, -1 }, new double[] { 2, 1 });
        double[] r = Rectangle.fromPolytope(p);
        assertThat(r).containsExactly(0, 2, -1, 1);
        assertThat(Rectangle.toPolytope(r)).isEqualTo(p);
    }

    @Test
    void infeasiblePolytopeIsEmpty() {
        Polytope p = Polytope.box(new double[] { 2 }, new double[] { 1 });
        assertThat(Rectangle.fromPolytope(p)).isNull();
    }

    @Test
    void nonBoxPolytopesAreRejected() {
        Polytope diagonal = new Polytope(new double[][] { { 1, 1 }, { -1, 0 }, { 0, -1 } }, new double[] { 1, 0, 0 });
        assertThatThrownBy(() -> Rectangle.fromPolytope(diagonal)).isInstanceOf(GeometryException.class);

        Polytope halfLine = new Polytope(new double[][] { { 1 } }, new double[] { 1 });
        assertThatThrownBy(() -> Rectangle.fromPolytope(halfLine))
                .isInstanceOf(GeometryException.class)
                .hasMessageContaining("unbounded");
    }

}
