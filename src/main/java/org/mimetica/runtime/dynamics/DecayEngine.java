package org.mimetica.runtime.dynamics;

import org.mimetica.runtime.model.Population;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uniform exponential dissipation: every alive agent's aggression row is multiplied by
 * {@code 1 - decayRate}.
 */
public class DecayEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DecayEngine.class);

    private final double factor;

    public DecayEngine(double decayRate) {
        this.factor = 1.0 - decayRate;
    }

    public void apply(Population population) {
        for (int i = 0; i < population.size(); i++) {
            if (!population.isAlive(i)) {
                continue;
            }
            double[] row = population.aggression(i);
            for (int j = 0; j < row.length; j++) {
                row[j] *= factor;
            }
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Decay applied with factor {} to {} alive agents", factor, population.aliveCount());
        }
    }
}
