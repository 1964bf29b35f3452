package org.mimetica.runtime.spi;

import org.mimetica.runtime.model.Population;
import org.mimetica.runtime.model.PrestigeWeights;

/**
 * Converts rivalry between neighboring agents into aggression increments.
 * <p>
 * Implementations add to the existing aggression of every alive directed edge and never
 * normalise. They run once per step, after the desire update.
 * </p>
 *
 * @see org.mimetica.runtime.dynamics.ObjectRivalrySource
 * @see org.mimetica.runtime.dynamics.StatusRivalrySource
 */
public interface IAggressionSource {

    /**
     * Applies this step's aggression increments in place.
     *
     * @param population The population to update.
     * @param prestige   The current prestige weights (network access).
     */
    void apply(Population population, PrestigeWeights prestige);
}
