package org.mimetica.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link NetworkModel}.
 */
@Tag("unit")
class NetworkModelTest {

    /** Path 0-1-2-3 plus isolated node 4. */
    private static NetworkModel pathWithIsolatedNode() {
        return NetworkModel.fromEdges(5, new int[][]{{0, 1}, {1, 2}, {2, 3}});
    }

    @Test
    void neighborsAreSortedAndSymmetric() {
        NetworkModel net = NetworkModel.fromEdges(4, new int[][]{{2, 0}, {0, 1}, {3, 0}});

        assertThat(net.neighbors(0)).containsExactly(1, 2, 3);
        assertThat(net.neighbors(2)).containsExactly(0);
        assertThat(net.hasEdge(3, 0)).isTrue();
        assertThat(net.hasEdge(1, 2)).isFalse();
        assertThat(net.edgeCount()).isEqualTo(3);
    }

    @Test
    void duplicateEdgesAreCollapsed() {
        NetworkModel net = NetworkModel.fromEdges(2, new int[][]{{0, 1}, {1, 0}, {0, 1}});

        assertThat(net.edgeCount()).isEqualTo(1);
        assertThat(net.degree(0)).isEqualTo(1);
    }

    @Test
    void distancesFollowShortestPaths() {
        NetworkModel net = pathWithIsolatedNode();

        assertThat(net.distance(0, 0)).isEqualTo(0.0);
        assertThat(net.distance(0, 1)).isEqualTo(1.0);
        assertThat(net.distance(0, 3)).isEqualTo(3.0);
        assertThat(net.distance(3, 0)).isEqualTo(3.0);
        assertThat(net.distance(0, 4)).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void socialDistanceIsFlooredAtOne() {
        NetworkModel net = pathWithIsolatedNode();

        assertThat(net.socialDistance(2, 2)).isEqualTo(1.0);
        assertThat(net.socialDistance(1, 2)).isEqualTo(1.0);
        assertThat(net.socialDistance(0, 2)).isEqualTo(2.0);
        assertThat(net.socialDistance(1, 4)).isInfinite();
    }

    @Test
    void forEachEdgeVisitsEachEdgeOnceInOrder() {
        NetworkModel net = NetworkModel.fromEdges(4, new int[][]{{3, 1}, {0, 2}, {1, 0}});
        List<String> visited = new ArrayList<>();

        net.forEachEdge((u, v) -> visited.add(u + "-" + v));

        assertThat(visited).containsExactly("0-1", "0-2", "1-3");
    }

    @Test
    void rejectsMalformedEdges() {
        assertThatThrownBy(() -> NetworkModel.fromEdges(3, new int[][]{{0, 3}}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("out of range");
        assertThatThrownBy(() -> NetworkModel.fromEdges(3, new int[][]{{1, 1}}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Self-loops");
        assertThatThrownBy(() -> NetworkModel.fromEdges(3, new int[][]{{0, 1, 2}}))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
