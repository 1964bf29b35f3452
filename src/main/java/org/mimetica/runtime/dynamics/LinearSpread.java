package org.mimetica.runtime.dynamics;

/**
 * Linear mimetic spread: {@code a' = alpha * a + (1 - alpha) * h}.
 */
public class LinearSpread extends AbstractSpread {

    public LinearSpread(double alpha) {
        super(alpha);
    }

    @Override
    protected double[] combine(double[] own, double[] hostility) {
        double[] result = new double[own.length];
        for (int j = 0; j < own.length; j++) {
            result[j] = alpha * own[j] + (1.0 - alpha) * hostility[j];
        }
        return result;
    }
}
