package org.mimetica.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.mimetica.cli.CommandLineInterface;
import org.mimetica.runtime.Simulation;
import org.mimetica.runtime.SimulationConfig;
import org.mimetica.runtime.SourceMode;
import org.mimetica.runtime.SpreadMode;
import org.mimetica.runtime.Variant;
import org.mimetica.runtime.metrics.ConvergenceDetector;
import org.mimetica.runtime.model.CatharsisEvent;
import org.mimetica.runtime.model.ExpulsionEvent;
import org.mimetica.runtime.model.History;
import org.mimetica.runtime.model.Metric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs a single simulation and prints a convergence summary.
 * <p>
 * Parameters come from the {@code simulation} configuration block; command-line options
 * override individual values.
 */
@Command(
    name = "run",
    mixinStandardHelpOptions = true,
    description = "Run one simulation and print a convergence summary"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(names = {"--variant"}, description = "Canonical variant: LM, AC, RL or RA (overrides --source/--spread)")
    private String variant;

    @Option(names = {"--source"}, description = "Rivalry source: object or status")
    private String source;

    @Option(names = {"--spread"}, description = "Aggression spread: linear or attention")
    private String spread;

    @Option(names = {"--steps"}, description = "Number of steps")
    private Integer steps;

    @Option(names = {"--seed"}, description = "Random seed")
    private Long seed;

    @Option(names = {"--alpha"}, description = "Autonomy coefficient in [0, 1]")
    private Double alpha;

    @Option(names = {"--gamma"}, description = "Salience exponent for attention spread")
    private Double gamma;

    @Option(names = {"--threshold"}, description = "Expulsion threshold")
    private Double threshold;

    @Option(names = {"--no-expulsion"}, description = "Disable expulsion")
    private boolean noExpulsion;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            Config config = parent.getConfig();
            Config block = config.hasPath("simulation") ? config.getConfig("simulation") : ConfigFactory.empty();

            SimulationConfig parameters = applyOverrides(SimulationConfig.fromConfig(block));
            SourceMode sourceMode;
            SpreadMode spreadMode;
            if (variant != null) {
                Variant v = Variant.parse(variant);
                sourceMode = v.source();
                spreadMode = v.spread();
            } else {
                sourceMode = SourceMode.parse(source != null ? source
                        : block.hasPath("source") ? block.getString("source") : SourceMode.OBJECT.key());
                spreadMode = SpreadMode.parse(spread != null ? spread
                        : block.hasPath("spread") ? block.getString("spread") : SpreadMode.ATTENTION.key());
            }

            Simulation simulation = new Simulation(parameters, sourceMode, spreadMode);
            simulation.run();
            printSummary(out, simulation);
            out.flush();
            return 0;

        } catch (Exception e) {
            log.error("Simulation run failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private SimulationConfig applyOverrides(SimulationConfig base) {
        SimulationConfig.Builder b = base.toBuilder();
        if (steps != null) b.steps(steps);
        if (seed != null) b.seed(seed);
        if (alpha != null) b.alpha(alpha);
        if (gamma != null) b.salienceExponent(gamma);
        if (threshold != null) b.expulsionThreshold(threshold);
        if (noExpulsion) b.disableExpulsion();
        return b.build();
    }

    private static void printSummary(PrintWriter out, Simulation simulation) {
        History history = simulation.getHistory();
        SimulationConfig config = simulation.getConfig();

        out.println("\n=== Simulation Summary ===");
        out.printf("Variant:            source=%s, spread=%s%n",
                simulation.getSourceMode().key(), simulation.getSpreadMode().key());
        out.printf("Parameters:         %s%n", config);
        out.printf("Steps:              %d%n", simulation.getCurrentStep());
        out.printf("Active agents:      %d/%d%n", simulation.getPopulation().aliveCount(), config.agents());

        if (history.length() > 0) {
            double[] modal = history.series(Metric.MODAL_AGREEMENT);
            int converged = ConvergenceDetector.firstSustained(modal);
            out.printf("Peak modal:         %.3f%n", history.peak(Metric.MODAL_AGREEMENT));
            out.printf("Final modal:        %.3f%n", modal[modal.length - 1]);
            out.printf("Peak Gini:          %.3f%n", history.peak(Metric.GINI));
            out.printf("Peak tension:       %.3f%n", history.peak(Metric.TENSION));
            out.printf("Convergence (t95):  %s%n", converged >= 0 ? Integer.toString(converged) : "--");
        }

        out.printf("Expulsions:         %d%n", history.getExpulsionEvents().size());
        for (int i = 0; i < history.getExpulsionEvents().size(); i++) {
            ExpulsionEvent e = history.getExpulsionEvents().get(i);
            CatharsisEvent c = history.getCatharsisEvents().get(i);
            out.printf("  step %d: agent #%d expelled (received %.3f, catharsis %.3f)%n",
                    e.step(), e.victim(), e.receivedAggression(), c.catharsis());
        }
    }
}
