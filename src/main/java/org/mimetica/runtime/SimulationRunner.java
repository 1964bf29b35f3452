package org.mimetica.runtime;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Convenience entry points for creating and running simulations in batches.
 */
public final class SimulationRunner {

    private static final Logger LOG = LoggerFactory.getLogger(SimulationRunner.class);

    /** Seed offset between consecutive runs of a batch. */
    public static final long SEED_STRIDE = 1000L;

    private SimulationRunner() {
    }

    /**
     * Creates a simulation from a canonical variant name.
     *
     * @param variant One of LM, AC, RL, RA (case-insensitive).
     * @throws IllegalArgumentException if the variant is unknown.
     */
    public static Simulation create(SimulationConfig config, String variant) {
        return create(config, Variant.parse(variant));
    }

    public static Simulation create(SimulationConfig config, Variant variant) {
        return new Simulation(config, variant);
    }

    /**
     * Runs {@code runs} independent simulations sequentially with seeds
     * {@code seed0 + r * 1000}, each for the configured number of steps.
     *
     * @param config The base parameters; only the seed varies between runs.
     * @param source The source mode.
     * @param spread The spread mode.
     * @param runs   Number of runs, non-negative.
     * @param seed0  Seed of the first run.
     * @return The completed simulations, in run order.
     */
    public static List<Simulation> runMany(SimulationConfig config, SourceMode source, SpreadMode spread,
                                           int runs, long seed0) {
        if (runs < 0) {
            throw new IllegalArgumentException("Run count must be non-negative, got " + runs);
        }
        List<Simulation> simulations = new ArrayList<>(runs);
        for (int r = 0; r < runs; r++) {
            SimulationConfig runConfig = config.toBuilder().seed(seed0 + r * SEED_STRIDE).build();
            Simulation simulation = new Simulation(runConfig, source, spread);
            simulation.run();
            simulations.add(simulation);
            LOG.debug("Completed run {}/{} (seed {})", r + 1, runs, runConfig.seed());
        }
        return simulations;
    }

    /**
     * {@link #runMany(SimulationConfig, SourceMode, SpreadMode, int, long)} starting at the
     * configured seed.
     */
    public static List<Simulation> runMany(SimulationConfig config, SourceMode source, SpreadMode spread, int runs) {
        return runMany(config, source, spread, runs, config.seed());
    }
}
