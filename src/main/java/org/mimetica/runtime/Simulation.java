package org.mimetica.runtime;

import java.util.Optional;

import org.mimetica.runtime.dynamics.AttentionSpread;
import org.mimetica.runtime.dynamics.DecayEngine;
import org.mimetica.runtime.dynamics.DesireUpdateEngine;
import org.mimetica.runtime.dynamics.ExpulsionEngine;
import org.mimetica.runtime.dynamics.LinearSpread;
import org.mimetica.runtime.dynamics.ObjectRivalrySource;
import org.mimetica.runtime.dynamics.StatusRivalrySource;
import org.mimetica.runtime.dynamics.StatusUpdateEngine;
import org.mimetica.runtime.internal.services.SeededRandomProvider;
import org.mimetica.runtime.metrics.MetricsEngine;
import org.mimetica.runtime.model.History;
import org.mimetica.runtime.model.NetworkModel;
import org.mimetica.runtime.model.Population;
import org.mimetica.runtime.model.PrestigeWeights;
import org.mimetica.runtime.model.StepMetrics;
import org.mimetica.runtime.spi.IAggressionSource;
import org.mimetica.runtime.spi.IAggressionSpread;
import org.mimetica.runtime.spi.IRandomProvider;
import org.mimetica.runtime.topology.WattsStrogatzGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the mimetic dynamics step by step and records their history.
 * <p>
 * One step executes the following phases in fixed order, each fully completed before the next
 * starts:
 * <ol>
 *   <li>prestige refresh, desire update</li>
 *   <li>aggression sourcing</li>
 *   <li>prestige refresh, aggression spread</li>
 *   <li>decay</li>
 *   <li>expulsion check</li>
 *   <li>status update (status mode only)</li>
 *   <li>metrics recording</li>
 * </ol>
 * Every phase is also public, so instrumentation can inspect intermediate state or replace a
 * single phase while reusing the others; {@link #step()} and {@link #run()} only compose them.
 * </p>
 * <p>
 * A simulation owns its network, prestige weights, population and random stream exclusively.
 * It is single-threaded and fully deterministic for a given configuration and seed; independent
 * instances may run in parallel.
 * </p>
 */
public class Simulation {

    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    private final SimulationConfig config;
    private final SourceMode sourceMode;
    private final SpreadMode spreadMode;
    private final IRandomProvider randomProvider;
    private final NetworkModel network;
    private final PrestigeWeights prestige;
    private final Population population;
    private final History history = new History();

    private final DesireUpdateEngine desireEngine;
    private final IAggressionSource aggressionSource;
    private final IAggressionSpread aggressionSpread;
    private final DecayEngine decayEngine;
    private final ExpulsionEngine expulsionEngine;
    private final StatusUpdateEngine statusEngine;

    private long currentStep = 0L;

    /**
     * Creates a simulation on a generated small-world network.
     *
     * @param config The parameters.
     * @param source The rivalry source mode.
     * @param spread The aggression spread mode.
     */
    public Simulation(SimulationConfig config, SourceMode source, SpreadMode spread) {
        this(config, source, spread, null);
    }

    /**
     * Creates a simulation for a canonical variant.
     */
    public Simulation(SimulationConfig config, Variant variant) {
        this(config, variant.source(), variant.spread(), null);
    }

    /**
     * Creates a simulation on a supplied network.
     *
     * @param config  The parameters; {@code agents} must equal the network size.
     * @param source  The rivalry source mode.
     * @param spread  The aggression spread mode.
     * @param network The network, or {@code null} to generate one from the configuration.
     * @throws IllegalArgumentException if a mode is null or the network size does not match.
     */
    public Simulation(SimulationConfig config, SourceMode source, SpreadMode spread, NetworkModel network) {
        this(config, source, spread, network,
                createSource(config, source), createSpread(config, spread));
    }

    /**
     * Creates a simulation with explicit source and spread strategies, for ablation experiments
     * that substitute one mechanism. {@code source} still decides whether status exists and
     * whether prestige follows status.
     */
    public Simulation(SimulationConfig config, SourceMode source, SpreadMode spread, NetworkModel network,
                      IAggressionSource sourceStrategy, IAggressionSpread spreadStrategy) {
        if (config == null) {
            throw new IllegalArgumentException("Simulation config must not be null");
        }
        if (source == null || spread == null) {
            throw new IllegalArgumentException("Source and spread modes must not be null");
        }
        if (sourceStrategy == null || spreadStrategy == null) {
            throw new IllegalArgumentException("Source and spread strategies must not be null");
        }
        this.config = config;
        this.sourceMode = source;
        this.spreadMode = spread;
        this.randomProvider = new SeededRandomProvider(config.seed());

        if (network == null) {
            network = WattsStrogatzGenerator.generate(config.agents(), config.neighbors(),
                    config.rewireProbability(), randomProvider.deriveFor("topology", 0));
        } else if (network.size() != config.agents()) {
            throw new IllegalArgumentException("Network has " + network.size()
                    + " nodes but configuration expects " + config.agents() + " agents");
        }
        this.network = network;
        // Initial state has its own stream; desire noise stays on the main one.
        IRandomProvider initRandom = randomProvider.deriveFor("initialization", 0);
        this.prestige = PrestigeWeights.sample(network, initRandom);
        this.population = initialPopulation(config, network, source == SourceMode.STATUS, initRandom);

        this.desireEngine = new DesireUpdateEngine(config.alpha(), config.desireNoise(), randomProvider);
        this.aggressionSource = sourceStrategy;
        this.aggressionSpread = spreadStrategy;
        this.decayEngine = new DecayEngine(config.aggressionDecay());
        this.expulsionEngine = new ExpulsionEngine(config.expulsionThreshold());
        this.statusEngine = new StatusUpdateEngine(config.statusLossRate(), config.epsilon());

        LOG.info("Created simulation: source={}, spread={}, agents={}, edges={}, alpha={}, gamma={}, threshold={}, seed={}",
                source.key(), spread.key(), network.size(), network.edgeCount(), config.alpha(),
                config.salienceExponent(), config.expulsionThreshold(), config.seed());
    }

    /**
     * Creates a simulation from string selectors.
     *
     * @throws IllegalArgumentException if a selector is not a known mode.
     */
    public static Simulation create(SimulationConfig config, String source, String spread) {
        return new Simulation(config, SourceMode.parse(source), SpreadMode.parse(spread));
    }

    /**
     * Creates a simulation from a {@code simulation} configuration block, including its
     * {@code source} and {@code spread} selectors.
     *
     * @param config The {@code simulation} block.
     * @throws IllegalArgumentException if a selector or parameter is invalid.
     */
    public static Simulation fromConfig(com.typesafe.config.Config config) {
        SimulationConfig parameters = SimulationConfig.fromConfig(config);
        String source = config.hasPath("source") ? config.getString("source") : SourceMode.OBJECT.key();
        String spread = config.hasPath("spread") ? config.getString("spread") : SpreadMode.ATTENTION.key();
        return create(parameters, source, spread);
    }

    private static IAggressionSource createSource(SimulationConfig config, SourceMode source) {
        if (config == null || source == null) {
            throw new IllegalArgumentException("Simulation config and source mode must not be null");
        }
        return switch (source) {
            case OBJECT -> new ObjectRivalrySource(config.rivalryToAggression(), config.alpha(), config.rivalrousObjects());
            case STATUS -> new StatusRivalrySource(config.rivalryIntensity(), config.alpha(), config.betaUp(), config.sigmaStatus());
        };
    }

    private static IAggressionSpread createSpread(SimulationConfig config, SpreadMode spread) {
        if (config == null || spread == null) {
            throw new IllegalArgumentException("Simulation config and spread mode must not be null");
        }
        return switch (spread) {
            case LINEAR -> new LinearSpread(config.alpha());
            case ATTENTION -> new AttentionSpread(config.alpha(), config.salienceExponent());
        };
    }

    /**
     * Draws initial desires uniformly in {@code [0, desireInitMax)} (agent by agent, object by
     * object), then, in status mode, initial status uniformly in {@code [statusInitLow, statusInitHigh)}.
     */
    private static Population initialPopulation(SimulationConfig config, NetworkModel network,
                                                boolean withStatus, IRandomProvider random) {
        Population population = new Population(network, config.objects(), withStatus);
        for (int i = 0; i < network.size(); i++) {
            double[] desire = population.desire(i);
            for (int o = 0; o < desire.length; o++) {
                desire[o] = random.nextDouble(0.0, config.desireInitMax());
            }
        }
        if (withStatus) {
            double[] status = population.status();
            for (int i = 0; i < network.size(); i++) {
                status[i] = random.nextDouble(config.statusInitLow(), config.statusInitHigh());
            }
        }
        return population;
    }

    // ==================== Phases ====================

    /**
     * Recomputes prestige weights from status in status mode; a no-op in object mode, where the
     * weights are static.
     */
    public void refreshPrestige() {
        if (sourceMode == SourceMode.STATUS) {
            prestige.refreshFromStatus(population.status(), config.prestigeStatusBaseline());
        }
    }

    public void stepDesire() {
        desireEngine.apply(population, prestige);
    }

    public void stepAggressionSource() {
        aggressionSource.apply(population, prestige);
    }

    public void stepAggressionSpread() {
        aggressionSpread.apply(population, prestige);
    }

    public void stepDecay() {
        decayEngine.apply(population);
    }

    /**
     * Runs the expulsion check and records any resulting events.
     *
     * @return The expulsion outcome, or empty if no agent was expelled.
     */
    public Optional<ExpulsionEngine.Outcome> stepExpulsion() {
        Optional<ExpulsionEngine.Outcome> outcome = expulsionEngine.apply(population, currentStep);
        outcome.ifPresent(o -> {
            history.recordExpulsion(o.expulsion());
            history.recordCatharsis(o.catharsis());
        });
        return outcome;
    }

    /**
     * Degrades status of targeted survivors; a no-op in object mode.
     */
    public void stepStatusUpdate() {
        if (sourceMode == SourceMode.STATUS) {
            statusEngine.apply(population);
        }
    }

    /**
     * Computes the current metrics and appends them to the history.
     *
     * @return The recorded metrics.
     */
    public StepMetrics recordMetrics() {
        StepMetrics metrics = MetricsEngine.compute(population);
        history.record(metrics);
        return metrics;
    }

    /**
     * Executes one complete step and advances the step counter.
     */
    public void step() {
        refreshPrestige();
        stepDesire();

        stepAggressionSource();

        refreshPrestige();
        stepAggressionSpread();

        stepDecay();
        stepExpulsion();
        stepStatusUpdate();

        if (config.recordHistory()) {
            recordMetrics();
        }
        currentStep++;
    }

    /**
     * Runs the configured number of steps.
     */
    public void run() {
        run(config.steps());
    }

    /**
     * Runs {@code steps} further steps.
     *
     * @param steps Number of steps, non-negative.
     */
    public void run(int steps) {
        if (steps < 0) {
            throw new IllegalArgumentException("Step count must be non-negative, got " + steps);
        }
        long start = System.currentTimeMillis();
        for (int s = 0; s < steps; s++) {
            step();
        }
        if (LOG.isInfoEnabled()) {
            LOG.info("Ran {} steps in {} ms: {} expulsions, {} agents alive",
                    steps, System.currentTimeMillis() - start,
                    history.getExpulsionEvents().size(), population.aliveCount());
        }
    }

    // ==================== State access ====================

    public SimulationConfig getConfig() {
        return config;
    }

    public SourceMode getSourceMode() {
        return sourceMode;
    }

    public SpreadMode getSpreadMode() {
        return spreadMode;
    }

    public NetworkModel getNetwork() {
        return network;
    }

    public PrestigeWeights getPrestige() {
        return prestige;
    }

    public Population getPopulation() {
        return population;
    }

    public History getHistory() {
        return history;
    }

    public IRandomProvider getRandomProvider() {
        return randomProvider;
    }

    /**
     * @return Number of completed steps; also the step number recorded by events in the next step.
     */
    public long getCurrentStep() {
        return currentStep;
    }
}
