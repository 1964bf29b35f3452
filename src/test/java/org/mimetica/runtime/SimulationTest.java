package org.mimetica.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import org.mimetica.runtime.dynamics.LinearSpread;
import org.mimetica.runtime.model.ExpulsionEvent;
import org.mimetica.runtime.model.Metric;
import org.mimetica.runtime.model.NetworkModel;
import org.mimetica.runtime.model.Population;
import org.mimetica.runtime.model.PrestigeWeights;
import org.mimetica.runtime.spi.IAggressionSource;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.typesafe.config.ConfigFactory;

/**
 * Unit tests for {@link Simulation}: phase composition, state invariants and reproducibility.
 */
@Tag("unit")
class SimulationTest {

    private static SimulationConfig.Builder small() {
        return SimulationConfig.builder()
            .agents(20)
            .neighbors(4)
            .steps(60)
            .seed(3L);
    }

    private static void assertStateInvariants(Population population) {
        int n = population.size();
        for (int i = 0; i < n; i++) {
            assertThat(population.aggression(i, i)).as("self aggression of %d", i).isZero();
            for (int j = 0; j < n; j++) {
                assertThat(population.aggression(i, j)).isGreaterThanOrEqualTo(0.0);
                if (!population.isAlive(i) || !population.isAlive(j)) {
                    assertThat(population.aggression(i, j)).as("aggression %d -> %d", i, j).isZero();
                }
            }
            for (double d : population.desire(i)) {
                assertThat(d).isGreaterThanOrEqualTo(0.0);
            }
            if (population.hasStatus()) {
                assertThat(population.status(i)).isBetween(0.0, 1.0);
            }
        }
    }

    @ParameterizedTest
    @EnumSource(Variant.class)
    void invariantsHoldAfterEveryStep(Variant variant) {
        Simulation simulation = new Simulation(small().expulsionThreshold(1.5).build(), variant);
        Population population = simulation.getPopulation();
        int previousAlive = population.aliveCount();

        for (int s = 0; s < 60; s++) {
            simulation.step();
            assertStateInvariants(population);
            assertThat(population.aliveCount()).isLessThanOrEqualTo(previousAlive);
            previousAlive = population.aliveCount();
        }

        assertThat(simulation.getCurrentStep()).isEqualTo(60);
        assertThat(simulation.getHistory().length()).isEqualTo(60);
        assertThat(simulation.getHistory().getCatharsisEvents())
            .hasSameSizeAs(simulation.getHistory().getExpulsionEvents());
    }

    @Test
    void expelledAgentsNeverReturn() {
        Simulation simulation = new Simulation(small().expulsionThreshold(1.0).build(), Variant.AC);

        simulation.run();

        for (ExpulsionEvent event : simulation.getHistory().getExpulsionEvents()) {
            assertThat(simulation.getPopulation().isAlive(event.victim())).isFalse();
            assertThat(simulation.getPopulation().receivedAggression()[event.victim()]).isZero();
        }
        assertThat(simulation.getHistory().getExpulsionEvents())
            .extracting(ExpulsionEvent::victim)
            .doesNotHaveDuplicates();
        assertThat(simulation.getPopulation().aliveCount())
            .isEqualTo(20 - simulation.getHistory().getExpulsionEvents().size());
    }

    @Test
    void activeAgentSeriesIsNonIncreasing() {
        Simulation simulation = new Simulation(small().expulsionThreshold(1.0).build(), Variant.AC);

        simulation.run();

        double[] active = simulation.getHistory().series(Metric.ACTIVE_AGENTS);
        for (int t = 1; t < active.length; t++) {
            assertThat(active[t]).isLessThanOrEqualTo(active[t - 1]);
        }
    }

    @Test
    void disabledExpulsionKeepsEveryone() {
        Simulation simulation = new Simulation(small().disableExpulsion().build(), Variant.AC);

        simulation.run();

        assertThat(simulation.getHistory().getExpulsionEvents()).isEmpty();
        assertThat(simulation.getHistory().getCatharsisEvents()).isEmpty();
        assertThat(simulation.getPopulation().aliveCount()).isEqualTo(20);
    }

    @Test
    void sameSeedGivesIdenticalRuns() {
        SimulationConfig config = small().expulsionThreshold(1.5).build();
        Simulation first = new Simulation(config, Variant.RA);
        Simulation second = new Simulation(config, Variant.RA);

        first.run();
        second.run();

        for (Metric metric : Metric.values()) {
            assertThat(second.getHistory().series(metric)).containsExactly(first.getHistory().series(metric));
        }
        assertThat(second.getHistory().getExpulsionEvents()).isEqualTo(first.getHistory().getExpulsionEvents());
    }

    @Test
    void differentSeedsGiveDifferentRuns() {
        Simulation first = new Simulation(small().seed(1L).build(), Variant.AC);
        Simulation second = new Simulation(small().seed(2L).build(), Variant.AC);

        first.run(10);
        second.run(10);

        assertThat(second.getHistory().series(Metric.TENSION)).isNotEqualTo(first.getHistory().series(Metric.TENSION));
    }

    @Test
    void historyCanBeSwitchedOff() {
        Simulation simulation = new Simulation(small().recordHistory(false).build(), Variant.LM);

        simulation.run();

        assertThat(simulation.getHistory().length()).isZero();
        assertThat(simulation.getCurrentStep()).isEqualTo(60);
    }

    @Test
    void runCanBeResumed() {
        Simulation simulation = new Simulation(small().build(), Variant.LM);

        simulation.run(5);
        simulation.run(0);
        simulation.run(7);

        assertThat(simulation.getCurrentStep()).isEqualTo(12);
        assertThat(simulation.getHistory().length()).isEqualTo(12);
        assertThatThrownBy(() -> simulation.run(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void initialStateFollowsConfiguration() {
        SimulationConfig config = small().build();
        Simulation simulation = new Simulation(config, Variant.RL);
        Population population = simulation.getPopulation();

        assertThat(simulation.getNetwork().edgeCount()).isEqualTo(40);
        assertThat(population.hasStatus()).isTrue();
        for (int i = 0; i < 20; i++) {
            assertThat(population.status(i)).isBetween(0.4, 0.6);
            assertThat(population.desire(i)).hasSize(8);
            for (double d : population.desire(i)) {
                assertThat(d).isBetween(0.0, 0.3);
            }
            assertThat(population.aggression(i)).containsOnly(0.0);
        }

        Simulation objectMode = new Simulation(config, Variant.LM);
        assertThat(objectMode.getPopulation().hasStatus()).isFalse();
    }

    @Test
    void statusModeRefreshesPrestigeFromStatus() {
        Simulation simulation = new Simulation(small().build(), Variant.RL);
        PrestigeWeights prestige = simulation.getPrestige();
        int model = simulation.getNetwork().neighbors(0)[0];
        double baseline = prestige.baseline(0, model);

        simulation.refreshPrestige();

        double status = simulation.getPopulation().status(model);
        assertThat(prestige.weight(0, model)).isEqualTo(baseline * (0.5 + status));
    }

    @Test
    void createsFromStringSelectors() {
        Simulation simulation = Simulation.create(small().build(), "status", "attention");

        assertThat(simulation.getSourceMode()).isEqualTo(SourceMode.STATUS);
        assertThat(simulation.getSpreadMode()).isEqualTo(SpreadMode.ATTENTION);
        assertThatThrownBy(() -> Simulation.create(small().build(), "bogus", "linear"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("bogus");
        assertThatThrownBy(() -> Simulation.create(small().build(), "object", "bogus"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createsFromConfigurationBlock() {
        Simulation simulation = Simulation.fromConfig(
            ConfigFactory.parseResources("test-simulation.conf").getConfig("simulation"));

        simulation.run();

        assertThat(simulation.getSourceMode()).isEqualTo(SourceMode.STATUS);
        assertThat(simulation.getSpreadMode()).isEqualTo(SpreadMode.LINEAR);
        assertThat(simulation.getConfig().agents()).isEqualTo(12);
        assertThat(simulation.getHistory().length()).isEqualTo(25);
        assertThat(simulation.getHistory().getExpulsionEvents()).isEmpty();
    }

    @Test
    void acceptsSuppliedNetworkOfMatchingSize() {
        NetworkModel ring = NetworkModel.fromEdges(4, new int[][]{{0, 1}, {1, 2}, {2, 3}, {3, 0}});
        SimulationConfig config = SimulationConfig.builder().agents(4).neighbors(2).steps(10).build();

        Simulation simulation = new Simulation(config, SourceMode.OBJECT, SpreadMode.LINEAR, ring);
        simulation.run();

        assertThat(simulation.getNetwork()).isSameAs(ring);
        assertThatThrownBy(() -> new Simulation(small().build(), SourceMode.OBJECT, SpreadMode.LINEAR, ring))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("agents");
    }

    @Test
    void substitutedSourceRunsOncePerStep() {
        IAggressionSource source = mock(IAggressionSource.class);
        SimulationConfig config = small().disableExpulsion().build();

        Simulation simulation = new Simulation(config, SourceMode.OBJECT, SpreadMode.LINEAR, null,
            source, new LinearSpread(config.alpha()));
        simulation.run(4);

        verify(source, times(4)).apply(any(Population.class), any(PrestigeWeights.class));
        // Without any source the aggression stays at its initial zero.
        assertThat(simulation.getHistory().series(Metric.TENSION)).containsOnly(0.0);
    }

    @Test
    void rejectsNullArguments() {
        assertThatThrownBy(() -> new Simulation(null, SourceMode.OBJECT, SpreadMode.LINEAR))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Simulation(small().build(), null, SpreadMode.LINEAR))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
