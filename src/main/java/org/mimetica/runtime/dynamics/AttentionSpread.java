package org.mimetica.runtime.dynamics;

/**
 * Attention (salience) spread: neighbor hostility is concentrated on the most salient targets
 * without changing its total mass.
 * <p>
 * With {@code H = sum(h)}, the pull is {@code pull = h^gamma / sum(h^gamma) * H}, so
 * {@code sum(pull) == H} for every {@code gamma}. {@code gamma > 1} sharpens toward
 * winner-take-all, {@code gamma == 1} reproduces {@link LinearSpread}. The new row is
 * {@code alpha * a + (1 - alpha) * pull}; when {@code H == 0} only the autonomy term remains.
 * </p>
 */
public class AttentionSpread extends AbstractSpread {

    private final double salienceExponent;

    /**
     * @param alpha            Weight of the agent's own aggression.
     * @param salienceExponent The sharpening exponent gamma, non-negative.
     */
    public AttentionSpread(double alpha, double salienceExponent) {
        super(alpha);
        this.salienceExponent = salienceExponent;
    }

    public double getSalienceExponent() {
        return salienceExponent;
    }

    @Override
    protected double[] combine(double[] own, double[] hostility) {
        double[] pull = redistribute(hostility, salienceExponent);
        double[] result = new double[own.length];
        for (int j = 0; j < own.length; j++) {
            result[j] = alpha * own[j] + (1.0 - alpha) * pull[j];
        }
        return result;
    }

    /**
     * Mass-conserving convex redistribution of a non-negative vector.
     * <p>
     * Only strictly positive entries carry salience, so zero entries (self, dead targets) stay
     * zero for every {@code gamma}, including {@code gamma == 0}, where the mass is spread evenly
     * over the positive entries. Entries are scaled by their maximum before exponentiation, which
     * leaves the normalised weights unchanged but keeps {@code pow} away from underflow and overflow.
     * </p>
     *
     * @param hostility Non-negative vector {@code h}.
     * @param gamma     Salience exponent, non-negative.
     * @return {@code h^gamma / sum(h^gamma) * sum(h)}, or the zero vector if {@code sum(h) == 0}.
     */
    public static double[] redistribute(double[] hostility, double gamma) {
        int n = hostility.length;
        double[] pull = new double[n];
        double total = 0.0;
        double max = 0.0;
        for (double h : hostility) {
            if (h > 0.0) {
                total += h;
                max = Math.max(max, h);
            }
        }
        if (total <= 0.0) {
            return pull;
        }

        double sharpenedTotal = 0.0;
        for (int j = 0; j < n; j++) {
            double h = hostility[j];
            if (h > 0.0) {
                double s = Math.pow(h / max, gamma);
                pull[j] = s;
                sharpenedTotal += s;
            }
        }
        // The maximum entry contributes exactly 1, so sharpenedTotal >= 1.
        double scale = total / sharpenedTotal;
        for (int j = 0; j < n; j++) {
            pull[j] *= scale;
        }
        return pull;
    }
}
