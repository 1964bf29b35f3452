package org.mimetica.runtime.dynamics;

import org.mimetica.runtime.model.NetworkModel;
import org.mimetica.runtime.model.Population;
import org.mimetica.runtime.model.PrestigeWeights;
import org.mimetica.runtime.spi.IAggressionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rivalry over status.
 * <p>
 * For every alive agent {@code i} and alive neighbor {@code k}:
 * {@code aggression[i][k] += rho * (1 - alpha) * (1 + betaUp * max(0, S_k - S_i)) * exp(-|S_i - S_k| / sigma)}.
 * Status-proximate rivals generate more aggression than distant ones, and higher-status rivals
 * more than lower-status ones.
 * </p>
 */
public class StatusRivalrySource implements IAggressionSource {

    private static final Logger LOG = LoggerFactory.getLogger(StatusRivalrySource.class);

    private final double rivalryIntensity;
    private final double alpha;
    private final double betaUp;
    private final double sigmaStatus;

    public StatusRivalrySource(double rivalryIntensity, double alpha, double betaUp, double sigmaStatus) {
        this.rivalryIntensity = rivalryIntensity;
        this.alpha = alpha;
        this.betaUp = betaUp;
        this.sigmaStatus = sigmaStatus;
    }

    @Override
    public void apply(Population population, PrestigeWeights prestige) {
        NetworkModel network = population.getNetwork();
        double[] status = population.status();
        double mimeticFactor = 1.0 - alpha;
        int n = population.size();
        for (int i = 0; i < n; i++) {
            if (!population.isAlive(i)) {
                continue;
            }
            double si = status[i];
            for (int k : network.neighbors(i)) {
                if (!population.isAlive(k)) {
                    continue;
                }
                population.addAggression(i, k, increment(si, status[k], mimeticFactor));
            }
        }
        population.maskAll();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Status rivalry sourced, total tension {}", population.totalTension());
        }
    }

    /**
     * Aggression increment from an agent of status {@code si} toward a rival of status {@code sk}.
     */
    double increment(double si, double sk, double mimeticFactor) {
        double proximity = Math.exp(-Math.abs(si - sk) / sigmaStatus);
        double upward = 1.0 + betaUp * Math.max(0.0, sk - si);
        return rivalryIntensity * mimeticFactor * upward * proximity;
    }
}
