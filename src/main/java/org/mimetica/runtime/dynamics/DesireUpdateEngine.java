package org.mimetica.runtime.dynamics;

import org.mimetica.runtime.model.NetworkModel;
import org.mimetica.runtime.model.Population;
import org.mimetica.runtime.model.PrestigeWeights;
import org.mimetica.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mimetic blending of desire vectors.
 * <p>
 * For every alive agent with at least one alive neighbor:
 * {@code d' = alpha * d + (1 - alpha) * m + noise}, clipped at zero, where {@code m} is the
 * prestige-weighted mean of the alive neighbors' desires (the zero vector if all weights are 0)
 * and {@code noise} is an independent {@code N(0, noiseScale)} draw per object. Agents without an
 * alive neighbor keep their desire unchanged and consume no randomness.
 * </p>
 * <p>
 * All new vectors are computed from the old state and committed together.
 * </p>
 */
public class DesireUpdateEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DesireUpdateEngine.class);

    private final double alpha;
    private final double noiseScale;
    private final IRandomProvider random;

    /**
     * @param alpha      Weight of the agent's own desire.
     * @param noiseScale Standard deviation of the per-object Gaussian noise.
     * @param random     The simulation's random stream.
     */
    public DesireUpdateEngine(double alpha, double noiseScale, IRandomProvider random) {
        this.alpha = alpha;
        this.noiseScale = noiseScale;
        this.random = random;
    }

    public void apply(Population population, PrestigeWeights prestige) {
        NetworkModel network = population.getNetwork();
        int objects = population.getObjectCount();
        int n = population.size();
        double[][] updated = new double[n][];

        for (int i = 0; i < n; i++) {
            if (!population.isAlive(i) || !population.hasAliveNeighbor(i)) {
                continue;
            }
            double[] pull = new double[objects];
            double totalWeight = 0.0;
            int[] nbrs = network.neighbors(i);
            for (int idx = 0; idx < nbrs.length; idx++) {
                int k = nbrs[idx];
                if (!population.isAlive(k)) {
                    continue;
                }
                double w = prestige.weightAt(i, idx);
                double[] dk = population.desire(k);
                for (int o = 0; o < objects; o++) {
                    pull[o] += w * dk[o];
                }
                totalWeight += w;
            }
            // All-zero weights leave pull at the zero vector.
            if (totalWeight > 0.0) {
                for (int o = 0; o < objects; o++) {
                    pull[o] /= totalWeight;
                }
            }

            double[] own = population.desire(i);
            double[] next = new double[objects];
            for (int o = 0; o < objects; o++) {
                double value = alpha * own[o] + (1.0 - alpha) * pull[o] + noiseScale * random.nextGaussian();
                next[o] = Math.max(0.0, value);
            }
            updated[i] = next;
        }

        int committed = 0;
        for (int i = 0; i < n; i++) {
            if (updated[i] != null) {
                population.commitDesire(i, updated[i]);
                committed++;
            }
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Desire update committed {} of {} agents", committed, n);
        }
    }
}
