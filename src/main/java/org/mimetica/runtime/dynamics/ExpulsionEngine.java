package org.mimetica.runtime.dynamics;

import java.util.Optional;

import org.mimetica.runtime.model.CatharsisEvent;
import org.mimetica.runtime.model.ExpulsionEvent;
import org.mimetica.runtime.model.Population;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes the most-targeted agent once its received aggression reaches the threshold.
 * <p>
 * Each call expels at most one agent. Among alive agents with equal maximal received aggression
 * the lowest id is chosen. Expulsion is one-way: the victim's alive flag is cleared, its own row
 * is zeroed and every survivor's aggression toward it is zeroed.
 * </p>
 * <p>
 * Catharsis measures the fractional drop in total tension (sum of received aggression over alive
 * agents) caused by the removal: {@code max(0, (pre - post) / pre)}, or 0 when {@code pre == 0}.
 * </p>
 */
public class ExpulsionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ExpulsionEngine.class);

    private final Double threshold;

    /**
     * @param threshold The expulsion threshold, or {@code null} to disable expulsion entirely.
     */
    public ExpulsionEngine(Double threshold) {
        this.threshold = threshold;
    }

    public boolean isEnabled() {
        return threshold != null;
    }

    /**
     * The expulsion and its catharsis, emitted together.
     */
    public record Outcome(ExpulsionEvent expulsion, CatharsisEvent catharsis) {
    }

    /**
     * Checks the threshold and expels the most-targeted agent if it is reached.
     *
     * @param population The population.
     * @param step       Current step number, recorded in the events.
     * @return The outcome, or empty if nothing happened.
     */
    public Optional<Outcome> apply(Population population, long step) {
        if (threshold == null || population.aliveCount() == 0) {
            return Optional.empty();
        }

        double[] received = population.receivedAggression();
        int victim = -1;
        double maxReceived = Double.NEGATIVE_INFINITY;
        double preTension = 0.0;
        for (int v = 0; v < received.length; v++) {
            if (!population.isAlive(v)) {
                continue;
            }
            preTension += received[v];
            if (received[v] > maxReceived) {
                maxReceived = received[v];
                victim = v;
            }
        }
        if (maxReceived < threshold) {
            return Optional.empty();
        }

        population.expel(victim);
        ExpulsionEvent expulsion = new ExpulsionEvent(step, victim, maxReceived);

        double catharsis = 0.0;
        if (preTension > 0.0) {
            double postTension = population.totalTension();
            catharsis = Math.max(0.0, (preTension - postTension) / preTension);
        }
        LOG.info("Step {}: agent {} expelled (received aggression {}, catharsis {}), {} agents remain",
                step, victim, String.format("%.3f", maxReceived), String.format("%.3f", catharsis),
                population.aliveCount());
        return Optional.of(new Outcome(expulsion, new CatharsisEvent(step, victim, catharsis)));
    }
}
