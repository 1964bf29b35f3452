package org.mimetica.runtime.spi;

/**
 * Source of deterministic randomness for a single simulation instance.
 * <p>
 * Each {@link org.mimetica.runtime.Simulation} owns exactly one provider, created from the
 * configured seed. Helpers never read a shared or global random source; they receive the
 * provider (or a derived sub-stream) explicitly.
 * </p>
 * <p>
 * Two providers constructed with the same seed produce identical sequences, which makes
 * complete runs reproducible.
 * </p>
 */
public interface IRandomProvider {

    /**
     * @return A uniformly distributed double in {@code [0, 1)}.
     */
    double nextDouble();

    /**
     * Returns a uniformly distributed double in {@code [low, high)}.
     *
     * @param low  Inclusive lower bound.
     * @param high Exclusive upper bound.
     * @return The sampled value.
     */
    default double nextDouble(double low, double high) {
        return low + (high - low) * nextDouble();
    }

    /**
     * @return A standard normal deviate (mean 0, standard deviation 1).
     */
    double nextGaussian();

    /**
     * @param bound Exclusive upper bound, must be positive.
     * @return A uniformly distributed int in {@code [0, bound)}.
     */
    int nextInt(int bound);

    /**
     * Derives an independent, deterministic sub-stream for a named consumer.
     * <p>
     * The derived stream depends only on this provider's seed, the context and the salt, never
     * on how many values have already been drawn from this provider.
     * </p>
     *
     * @param context A name for the consumer (e.g. "topology").
     * @param salt    Additional discriminator for multiple streams of the same context.
     * @return A new provider.
     */
    IRandomProvider deriveFor(String context, long salt);
}
