package org.mimetica.runtime.dynamics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.mimetica.runtime.model.NetworkModel;
import org.mimetica.runtime.model.Population;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link DecayEngine}.
 */
@Tag("unit")
class DecayEngineTest {

    @Test
    void scalesEveryAliveRow() {
        Population population = new Population(NetworkModel.fromEdges(3, new int[][]{{0, 1}}), 1, false);
        population.setAggression(0, 1, 2.0);
        population.setAggression(2, 0, 1.0);

        new DecayEngine(0.25).apply(population);

        assertThat(population.aggression(0, 1)).isCloseTo(1.5, within(1e-12));
        assertThat(population.aggression(2, 0)).isCloseTo(0.75, within(1e-12));
    }

    @Test
    void zeroRateLeavesAggressionUnchanged() {
        Population population = new Population(NetworkModel.fromEdges(2, new int[][]{{0, 1}}), 1, false);
        population.setAggression(0, 1, 2.0);

        new DecayEngine(0.0).apply(population);

        assertThat(population.aggression(0, 1)).isEqualTo(2.0);
    }
}
