package org.mimetica.runtime.dynamics;

import org.mimetica.runtime.model.NetworkModel;
import org.mimetica.runtime.model.Population;
import org.mimetica.runtime.model.PrestigeWeights;
import org.mimetica.runtime.spi.IAggressionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Acquisitive rivalry over shared objects.
 * <p>
 * For every alive agent {@code i} and alive neighbor {@code k}:
 * {@code aggression[i][k] += c * (1 - alpha) * sum_{o < R} min(d_i[o], d_k[o]) / dist(i, k)},
 * where {@code R} is the number of rivalrous objects and {@code dist} is the graph distance
 * floored at 1. Unreachable pairs contribute nothing.
 * </p>
 */
public class ObjectRivalrySource implements IAggressionSource {

    private static final Logger LOG = LoggerFactory.getLogger(ObjectRivalrySource.class);

    private final double rivalryToAggression;
    private final double alpha;
    private final int rivalrousObjects;

    public ObjectRivalrySource(double rivalryToAggression, double alpha, int rivalrousObjects) {
        this.rivalryToAggression = rivalryToAggression;
        this.alpha = alpha;
        this.rivalrousObjects = rivalrousObjects;
    }

    @Override
    public void apply(Population population, PrestigeWeights prestige) {
        NetworkModel network = population.getNetwork();
        double mimeticFactor = 1.0 - alpha;
        int n = population.size();
        for (int i = 0; i < n; i++) {
            if (!population.isAlive(i)) {
                continue;
            }
            double[] di = population.desire(i);
            for (int k : network.neighbors(i)) {
                if (!population.isAlive(k)) {
                    continue;
                }
                double distance = network.socialDistance(i, k);
                if (Double.isInfinite(distance)) {
                    continue;
                }
                double[] dk = population.desire(k);
                double shared = 0.0;
                for (int o = 0; o < rivalrousObjects; o++) {
                    shared += Math.min(di[o], dk[o]);
                }
                population.addAggression(i, k, rivalryToAggression * mimeticFactor * shared / distance);
            }
        }
        population.maskAll();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Object rivalry sourced, total tension {}", population.totalTension());
        }
    }
}
