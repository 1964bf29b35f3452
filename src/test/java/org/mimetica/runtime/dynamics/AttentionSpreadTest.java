package org.mimetica.runtime.dynamics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;

import org.mimetica.runtime.internal.services.SeededRandomProvider;
import org.mimetica.runtime.model.NetworkModel;
import org.mimetica.runtime.model.Population;
import org.mimetica.runtime.model.PrestigeWeights;
import org.mimetica.runtime.topology.WattsStrogatzGenerator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Unit tests for {@link AttentionSpread}.
 */
@Tag("unit")
class AttentionSpreadTest {

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 0.5, 1.0, 2.0, 5.0, 40.0})
    void redistributionConservesMass(double gamma) {
        double[] h = {0.0, 0.3, 1.2, 0.05, 2.5};

        double[] pull = AttentionSpread.redistribute(h, gamma);

        assertThat(Arrays.stream(pull).sum()).isCloseTo(Arrays.stream(h).sum(), within(1e-12));
        assertThat(pull[0]).isZero();
        assertThat(Arrays.stream(pull).min().getAsDouble()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    void gammaOneIsIdentity() {
        double[] h = {0.0, 0.3, 1.2, 0.05};

        assertThat(AttentionSpread.redistribute(h, 1.0)).containsExactly(h, within(1e-12));
    }

    @Test
    void gammaTwoSharpensTowardLargestEntry() {
        double[] pull = AttentionSpread.redistribute(new double[]{1.0, 3.0}, 2.0);

        assertThat(pull).containsExactly(new double[]{0.4, 3.6}, within(1e-12));
    }

    @Test
    void gammaZeroSpreadsEvenlyOverPositiveEntries() {
        double[] pull = AttentionSpread.redistribute(new double[]{0.0, 1.0, 3.0}, 0.0);

        assertThat(pull).containsExactly(new double[]{0.0, 2.0, 2.0}, within(1e-12));
    }

    @Test
    void zeroVectorStaysZero() {
        assertThat(AttentionSpread.redistribute(new double[]{0.0, 0.0, 0.0}, 2.0)).containsOnly(0.0);
    }

    @Test
    void tinyValuesDoNotUnderflow() {
        double[] pull = AttentionSpread.redistribute(new double[]{1e-200, 2e-200}, 4.0);

        assertThat(pull[0] + pull[1]).isCloseTo(3e-200, within(1e-212));
        assertThat(pull[1] / pull[0]).isCloseTo(16.0, within(1e-9));
    }

    @Test
    void gammaOneMatchesLinearSpread() {
        NetworkModel network = WattsStrogatzGenerator.generate(12, 4, 0.2, new SeededRandomProvider(5L));
        SeededRandomProvider random = new SeededRandomProvider(11L);
        PrestigeWeights prestige = PrestigeWeights.sample(network, random);
        Population linear = new Population(network, 1, false);
        Population attention = new Population(network, 1, false);
        for (int i = 0; i < 12; i++) {
            for (int j = 0; j < 12; j++) {
                if (i != j) {
                    double value = random.nextDouble();
                    linear.setAggression(i, j, value);
                    attention.setAggression(i, j, value);
                }
            }
        }

        new LinearSpread(0.3).apply(linear, prestige);
        new AttentionSpread(0.3, 1.0).apply(attention, prestige);

        for (int i = 0; i < 12; i++) {
            assertThat(attention.aggression(i)).containsExactly(linear.aggression(i), within(1e-12));
        }
    }

    @Test
    void zeroHostilityLeavesOnlyAutonomyTerm() {
        NetworkModel network = NetworkModel.fromEdges(3, new int[][]{{0, 1}, {0, 2}});
        Population population = new Population(network, 1, false);
        population.setAggression(0, 1, 2.0);

        new AttentionSpread(0.25, 2.0).apply(population, PrestigeWeights.uniform(network, 1.0));

        assertThat(population.aggression(0)).containsExactly(new double[]{0.0, 0.5, 0.0}, within(1e-12));
    }
}
