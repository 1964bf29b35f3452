package org.mimetica.runtime.internal.services;

import java.util.Random;

import org.mimetica.runtime.spi.IRandomProvider;

/**
 * {@link IRandomProvider} backed by a {@link Random} seeded once at construction.
 */
public class SeededRandomProvider implements IRandomProvider {

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private final long seed;
    private final Random random;

    /**
     * @param seed The seed for this stream.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public double nextGaussian() {
        return random.nextGaussian();
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    @Override
    public IRandomProvider deriveFor(String context, long salt) {
        long h = seed;
        h = mix(h ^ context.hashCode());
        h = mix(h + salt * GOLDEN_GAMMA);
        return new SeededRandomProvider(h);
    }

    /**
     * @return The seed this provider was constructed with.
     */
    public long getSeed() {
        return seed;
    }

    // SplitMix64 finalizer
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
