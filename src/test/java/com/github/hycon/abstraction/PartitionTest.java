package com.github.hycon.abstraction;

import com.github.hycon.geometry.Polytope;
import com.github.hycon.geometry.Region;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PartitionTest {

    private static final Polytope DOMAIN = Polytope.box(new double[] { 0 }, new double[] { 2 });

    private static final List<Region> CELLS = Arrays.asList(
            Region.of(Polytope.box(new double[] { 0 }, new double[] { 1 })),
            Region.of(Polytope.box(new double[] { 1 }, new double[] { 2 })));

    @Test
    void adjacencyMustBeSymmetricAndReflexive() {
        assertThatThrownBy(() -> new Partition(DOMAIN, CELLS, new boolean[][] { { true, true }, { false, true } },
                Collections.emptyList())).hasMessageContaining("symmetric");
        assertThatThrownBy(() -> new Partition(DOMAIN, CELLS, new boolean[][] { { true, false }, { false, false } },
                Collections.emptyList())).hasMessageContaining("itself");
        assertThatThrownBy(() -> new Partition(DOMAIN, CELLS, Matrices.identity(3),
                Collections.emptyList())).hasMessageContaining("2x2");
    }

    @Test
    void labelsMatchSymbols() {
        List<Region> labelled = Arrays.asList(CELLS.get(0).withPropositions(Arrays.asList(1, 0)), CELLS.get(1));
        assertThatThrownBy(() -> new Partition(DOMAIN, labelled, Matrices.identity(2),
                Collections.singletonList("goal"))).isInstanceOf(IllegalArgumentException.class);
        assertThat(new Partition(DOMAIN, labelled, Matrices.identity(2), Arrays.asList("goal", "lot"))
                .getPropositionCount()).isEqualTo(2);
    }

    @Test
    void adjacencyIsCopied() {
        boolean[][] adjacency = Matrices.identity(2);
        Partition partition = new Partition(DOMAIN, CELLS, adjacency, Collections.emptyList());
        adjacency[0][1] = true;
        partition.getAdjacency()[1][0] = true;
        assertThat(partition.isAdjacent(0, 1)).isFalse();
        assertThat(partition.isAdjacent(1, 0)).isFalse();
    }

    @Test
    void abstractionValidatesOrigin() {
        Partition partition = new Partition(DOMAIN, CELLS, Matrices.identity(2), Collections.emptyList());
        assertThatThrownBy(() -> new AbstractionSystem(partition, new int[] { 0 }, CELLS, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AbstractionSystem(partition, new int[] { 0, 2 }, CELLS, null))
                .hasMessageContaining("unknown original region 2");
        assertThatThrownBy(() -> new AbstractionSystem(partition, new int[] { 0, 1 }, CELLS, new boolean[1][1]))
                .hasMessageContaining("2x2");

        AbstractionSystem system = AbstractionSystem.unrefined(partition);
        assertThat(system.getOriginalRegion(1)).isEqualTo(CELLS.get(1));
        assertThat(system.withTransitions(Matrices.identity(2)).successors(1)).containsExactly(1);
    }

}
