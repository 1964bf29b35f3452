package org.mimetica.runtime.metrics;

/**
 * Detects sustained convergence in a recorded series, typically modal agreement.
 */
public final class ConvergenceDetector {

    public static final double DEFAULT_THRESHOLD = 0.95;
    public static final int DEFAULT_CONSECUTIVE = 10;

    private ConvergenceDetector() {
    }

    /**
     * Finds the first step {@code t} such that {@code series[t .. t + consecutive - 1]} are all at
     * least {@code threshold}.
     *
     * @param series      The recorded values.
     * @param threshold   The level to sustain.
     * @param consecutive Number of consecutive steps required, at least 1.
     * @return The first such step, or -1 if the level is never sustained.
     */
    public static int firstSustained(double[] series, double threshold, int consecutive) {
        if (consecutive < 1) {
            throw new IllegalArgumentException("consecutive must be >= 1, got " + consecutive);
        }
        int run = 0;
        for (int t = 0; t < series.length; t++) {
            if (series[t] >= threshold) {
                run++;
                if (run == consecutive) {
                    return t - consecutive + 1;
                }
            } else {
                run = 0;
            }
        }
        return -1;
    }

    /**
     * {@link #firstSustained(double[], double, int)} with threshold 0.95 over 10 steps.
     */
    public static int firstSustained(double[] series) {
        return firstSustained(series, DEFAULT_THRESHOLD, DEFAULT_CONSECUTIVE);
    }

    /**
     * @return Whether the series sustains {@code threshold} for {@code consecutive} steps anywhere.
     */
    public static boolean converges(double[] series, double threshold, int consecutive) {
        return firstSustained(series, threshold, consecutive) >= 0;
    }
}
