package org.mimetica.runtime.dynamics;

import org.mimetica.runtime.model.NetworkModel;
import org.mimetica.runtime.model.Population;
import org.mimetica.runtime.model.PrestigeWeights;
import org.mimetica.runtime.spi.IAggressionSpread;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared double-buffered driver for the spread strategies.
 * <p>
 * For every alive agent {@code i} the driver computes the neighbor hostility {@code h_i}: the
 * prestige-weighted mean of the alive neighbors' aggression rows, with the entries toward
 * {@code i} and toward dead agents zeroed (the zero vector if all weights are 0). Subclasses
 * combine {@code h_i} with the agent's own row. Agents without an alive neighbor keep their row.
 * Every resulting row is masked, then all rows are committed together.
 * </p>
 */
public abstract class AbstractSpread implements IAggressionSpread {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractSpread.class);

    protected final double alpha;

    protected AbstractSpread(double alpha) {
        this.alpha = alpha;
    }

    @Override
    public final void apply(Population population, PrestigeWeights prestige) {
        int n = population.size();
        double[][] updated = new double[n][];
        for (int i = 0; i < n; i++) {
            if (!population.isAlive(i)) {
                continue;
            }
            double[] own = population.aggression(i);
            double[] result;
            if (!population.hasAliveNeighbor(i)) {
                result = own.clone();
            } else {
                result = combine(own, neighborHostility(population, prestige, i));
            }
            population.mask(i, result);
            updated[i] = result;
        }
        for (int i = 0; i < n; i++) {
            if (updated[i] != null) {
                population.commitAggression(i, updated[i]);
            }
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} spread applied, total tension {}", getClass().getSimpleName(), population.totalTension());
        }
    }

    /**
     * Combines an agent's own aggression row with its neighbor hostility.
     *
     * @param own       The agent's current row (must not be modified).
     * @param hostility The masked neighbor hostility vector (may be modified).
     * @return A new row; masking is applied by the caller.
     */
    protected abstract double[] combine(double[] own, double[] hostility);

    /**
     * Prestige-weighted mean of alive neighbors' aggression rows, masked for {@code agent}.
     *
     * @return A fresh vector of length {@code population.size()}.
     */
    public static double[] neighborHostility(Population population, PrestigeWeights prestige, int agent) {
        NetworkModel network = population.getNetwork();
        int n = population.size();
        double[] hostility = new double[n];
        double totalWeight = 0.0;
        int[] nbrs = network.neighbors(agent);
        for (int idx = 0; idx < nbrs.length; idx++) {
            int k = nbrs[idx];
            if (!population.isAlive(k)) {
                continue;
            }
            double w = prestige.weightAt(agent, idx);
            if (w == 0.0) {
                continue;
            }
            double[] row = population.aggression(k);
            for (int j = 0; j < n; j++) {
                hostility[j] += w * row[j];
            }
            totalWeight += w;
        }
        if (totalWeight > 0.0) {
            for (int j = 0; j < n; j++) {
                hostility[j] /= totalWeight;
            }
        }
        population.mask(agent, hostility);
        return hostility;
    }
}
