package org.mimetica.runtime.dynamics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.mimetica.runtime.model.NetworkModel;
import org.mimetica.runtime.model.Population;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link StatusUpdateEngine}.
 */
@Tag("unit")
class StatusUpdateEngineTest {

    private Population population;

    @BeforeEach
    void setUp() {
        population = new Population(NetworkModel.fromEdges(3, new int[][]{{0, 1}, {1, 2}}), 1, true);
        population.setStatus(0, 0.5);
        population.setStatus(1, 0.5);
        population.setStatus(2, 0.002);
    }

    @Test
    void mostTargetedAgentLosesFullRate() {
        population.setAggression(0, 1, 4.0);
        population.setAggression(1, 0, 2.0);

        new StatusUpdateEngine(0.1, 1e-12).apply(population);

        assertThat(population.status(1)).isCloseTo(0.4, within(1e-12));
        assertThat(population.status(0)).isCloseTo(0.45, within(1e-12));
        assertThat(population.status(2)).isEqualTo(0.002);
    }

    @Test
    void statusIsClippedAtZero() {
        population.setAggression(1, 2, 1.0);

        new StatusUpdateEngine(0.1, 1e-12).apply(population);

        assertThat(population.status(2)).isZero();
    }

    @Test
    void noAggressionLeavesStatusUnchanged() {
        new StatusUpdateEngine(0.1, 1e-12).apply(population);

        assertThat(population.status()).containsExactly(0.5, 0.5, 0.002);
    }
}
