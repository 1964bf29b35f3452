package org.mimetica.runtime.dynamics;

import org.mimetica.runtime.model.Population;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Status loss of heavily targeted survivors, applied after expulsion in status mode.
 * <p>
 * {@code S_k <- clip(S_k - lossRate * r_k / max(r_max, epsilon), 0, 1)}, where {@code r_k} is the
 * aggression received by alive agent {@code k} and {@code r_max} the maximum over alive agents.
 * </p>
 */
public class StatusUpdateEngine {

    private static final Logger LOG = LoggerFactory.getLogger(StatusUpdateEngine.class);

    private final double lossRate;
    private final double epsilon;

    public StatusUpdateEngine(double lossRate, double epsilon) {
        this.lossRate = lossRate;
        this.epsilon = epsilon;
    }

    public void apply(Population population) {
        if (!population.hasStatus() || population.aliveCount() == 0) {
            return;
        }
        double[] received = population.receivedAggression();
        double maxReceived = 0.0;
        for (int k = 0; k < received.length; k++) {
            if (population.isAlive(k)) {
                maxReceived = Math.max(maxReceived, received[k]);
            }
        }
        double denominator = Math.max(maxReceived, epsilon);
        double[] status = population.status();
        for (int k = 0; k < received.length; k++) {
            if (!population.isAlive(k)) {
                continue;
            }
            double next = status[k] - lossRate * received[k] / denominator;
            status[k] = Math.min(1.0, Math.max(0.0, next));
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Status update applied, max received aggression {}", maxReceived);
        }
    }
}
