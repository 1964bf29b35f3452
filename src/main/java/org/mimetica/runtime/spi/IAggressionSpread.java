package org.mimetica.runtime.spi;

import org.mimetica.runtime.model.Population;
import org.mimetica.runtime.model.PrestigeWeights;

/**
 * Propagates aggression between neighbors through imitation.
 * <p>
 * New rows are computed entirely from the state at the start of the phase and committed for all
 * agents at once. Afterwards, every alive agent's row is zero toward itself and toward every
 * dead agent.
 * </p>
 *
 * @see org.mimetica.runtime.dynamics.LinearSpread
 * @see org.mimetica.runtime.dynamics.AttentionSpread
 */
public interface IAggressionSpread {

    /**
     * Replaces every alive agent's aggression row.
     *
     * @param population The population to update.
     * @param prestige   The current prestige weights.
     */
    void apply(Population population, PrestigeWeights prestige);
}
