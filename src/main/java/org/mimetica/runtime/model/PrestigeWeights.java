package org.mimetica.runtime.model;

import java.util.Arrays;

import org.mimetica.runtime.spi.IRandomProvider;

/**
 * Directed influence weights {@code w(subject, model)}: how strongly {@code subject} imitates
 * {@code model}.
 * <p>
 * Weights exist only on network edges and are stored in arrays parallel to
 * {@link NetworkModel#neighbors(int)}. A lookup for a non-adjacent pair returns 0.
 * </p>
 * <p>
 * Every weight has a static baseline. In status-rivalry mode the current weight is recomputed
 * each step as {@code baseline * (statusBaseline + status[model])}; otherwise the current weight
 * equals the baseline.
 * </p>
 */
public final class PrestigeWeights {

    /** Lower bound of the uniform baseline distribution. */
    public static final double BASELINE_LOW = 0.1;
    /** Upper bound of the uniform baseline distribution. */
    public static final double BASELINE_HIGH = 1.0;

    private final NetworkModel network;
    private final double[][] baseline;
    private final double[][] current;

    private PrestigeWeights(NetworkModel network, double[][] baseline) {
        this.network = network;
        this.baseline = baseline;
        this.current = new double[baseline.length][];
        for (int i = 0; i < baseline.length; i++) {
            this.current[i] = baseline[i].clone();
        }
    }

    /**
     * Samples baseline weights uniformly in {@code [0.1, 1.0)}, independently for both directions
     * of every edge. Edges are visited in {@link NetworkModel#forEachEdge} order, and for each edge
     * {@code (u, v)} the weight {@code w(u, v)} is drawn before {@code w(v, u)}.
     *
     * @param network The network.
     * @param random  The simulation's random stream.
     * @return The sampled weights.
     */
    public static PrestigeWeights sample(NetworkModel network, IRandomProvider random) {
        double[][] base = allocate(network);
        network.forEachEdge((u, v) -> {
            base[u][network.neighborIndex(u, v)] = random.nextDouble(BASELINE_LOW, BASELINE_HIGH);
            base[v][network.neighborIndex(v, u)] = random.nextDouble(BASELINE_LOW, BASELINE_HIGH);
        });
        return new PrestigeWeights(network, base);
    }

    /**
     * Creates weights with the same baseline on every directed edge.
     *
     * @param network The network.
     * @param weight  Non-negative weight.
     * @return The weights.
     */
    public static PrestigeWeights uniform(NetworkModel network, double weight) {
        checkWeight(weight);
        double[][] base = allocate(network);
        for (double[] row : base) {
            Arrays.fill(row, weight);
        }
        return new PrestigeWeights(network, base);
    }

    public NetworkModel getNetwork() {
        return network;
    }

    /**
     * Current weight of a directed pair.
     *
     * @return The weight, or 0 if the agents are not adjacent.
     */
    public double weight(int subject, int model) {
        int idx = network.neighborIndex(subject, model);
        return idx < 0 ? 0.0 : current[subject][idx];
    }

    /**
     * Current weight by neighbor position, for loops that already iterate
     * {@link NetworkModel#neighbors(int)}.
     */
    public double weightAt(int subject, int neighborIndex) {
        return current[subject][neighborIndex];
    }

    /**
     * Baseline weight of a directed pair, or 0 if not adjacent.
     */
    public double baseline(int subject, int model) {
        int idx = network.neighborIndex(subject, model);
        return idx < 0 ? 0.0 : baseline[subject][idx];
    }

    /**
     * Replaces the baseline of an existing directed edge. The current weight is reset to the new
     * baseline and is recomputed at the next status refresh.
     *
     * @throws IllegalArgumentException if the agents are not adjacent or the weight is negative.
     */
    public void setBaseline(int subject, int model, double weight) {
        checkWeight(weight);
        int idx = network.neighborIndex(subject, model);
        if (idx < 0) {
            throw new IllegalArgumentException("No edge between " + subject + " and " + model);
        }
        baseline[subject][idx] = weight;
        current[subject][idx] = weight;
    }

    /**
     * Recomputes every current weight from the baseline and the model's status:
     * {@code w(i, k) = baseline(i, k) * (statusBaseline + status[k])}.
     *
     * @param status         Status scalar per agent, each in [0, 1].
     * @param statusBaseline Constant added to the model's status; non-negative.
     */
    public void refreshFromStatus(double[] status, double statusBaseline) {
        for (int i = 0; i < baseline.length; i++) {
            int[] nbrs = network.neighbors(i);
            double[] base = baseline[i];
            double[] cur = current[i];
            for (int idx = 0; idx < nbrs.length; idx++) {
                cur[idx] = base[idx] * (statusBaseline + status[nbrs[idx]]);
            }
        }
    }

    private static double[][] allocate(NetworkModel network) {
        double[][] base = new double[network.size()][];
        for (int i = 0; i < base.length; i++) {
            base[i] = new double[network.degree(i)];
        }
        return base;
    }

    private static void checkWeight(double weight) {
        if (!(weight >= 0.0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("Prestige weight must be finite and non-negative, got " + weight);
        }
    }
}
