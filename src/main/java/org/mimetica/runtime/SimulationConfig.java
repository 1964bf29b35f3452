package org.mimetica.runtime;

import com.typesafe.config.Config;

/**
 * Immutable parameter bundle for one simulation run.
 * <p>
 * Instances are created through {@link #builder()} or {@link #fromConfig(Config)}; modified copies
 * through {@link #toBuilder()}. Every instance is validated on construction.
 * </p>
 *
 * <h2>Configuration</h2>
 * <pre>{@code
 * simulation {
 *   network { agents = 50, neighbors = 6, rewire-probability = 0.15 }
 *   objects { count = 8, rivalrous = 5, desire-init-max = 0.3, desire-noise = 0.02 }
 *   dynamics {
 *     alpha = 0.15
 *     rivalry-to-aggression = 0.2
 *     aggression-decay = 0.03
 *     expulsion-threshold = 8.0   # null disables expulsion
 *     salience-exponent = 2.0
 *   }
 *   status {
 *     rivalry-intensity = 0.15, sigma = 0.10, beta-up = 1.0, prestige-baseline = 0.5
 *     init-low = 0.4, init-high = 0.6, loss-rate = 0.005, epsilon = 1e-12
 *   }
 *   steps = 600
 *   record-history = true
 *   seed = 42
 * }
 * }</pre>
 */
public final class SimulationConfig {

    private final int agents;
    private final int neighbors;
    private final double rewireProbability;
    private final int objects;
    private final int rivalrousObjects;
    private final double desireInitMax;
    private final double desireNoise;
    private final double alpha;
    private final double rivalryToAggression;
    private final double aggressionDecay;
    private final Double expulsionThreshold;
    private final double salienceExponent;
    private final double rivalryIntensity;
    private final double sigmaStatus;
    private final double betaUp;
    private final double prestigeStatusBaseline;
    private final double statusInitLow;
    private final double statusInitHigh;
    private final double statusLossRate;
    private final double epsilon;
    private final int steps;
    private final boolean recordHistory;
    private final long seed;

    private SimulationConfig(Builder b) {
        this.agents = b.agents;
        this.neighbors = b.neighbors;
        this.rewireProbability = b.rewireProbability;
        this.objects = b.objects;
        this.rivalrousObjects = b.rivalrousObjects;
        this.desireInitMax = b.desireInitMax;
        this.desireNoise = b.desireNoise;
        this.alpha = b.alpha;
        this.rivalryToAggression = b.rivalryToAggression;
        this.aggressionDecay = b.aggressionDecay;
        this.expulsionThreshold = b.expulsionThreshold;
        this.salienceExponent = b.salienceExponent;
        this.rivalryIntensity = b.rivalryIntensity;
        this.sigmaStatus = b.sigmaStatus;
        this.betaUp = b.betaUp;
        this.prestigeStatusBaseline = b.prestigeStatusBaseline;
        this.statusInitLow = b.statusInitLow;
        this.statusInitHigh = b.statusInitHigh;
        this.statusLossRate = b.statusLossRate;
        this.epsilon = b.epsilon;
        this.steps = b.steps;
        this.recordHistory = b.recordHistory;
        this.seed = b.seed;
        validate();
    }

    /**
     * @return A builder populated with the default parameters.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return The default parameters.
     */
    public static SimulationConfig defaults() {
        return builder().build();
    }

    /**
     * Reads parameters from a {@code simulation} block. Missing keys keep their defaults.
     *
     * @param config The {@code simulation} block.
     * @return The validated configuration.
     * @throws IllegalArgumentException if a value is out of range.
     * @throws com.typesafe.config.ConfigException if a value has the wrong type.
     */
    public static SimulationConfig fromConfig(Config config) {
        Builder b = builder();
        if (config.hasPath("network")) {
            Config net = config.getConfig("network");
            if (net.hasPath("agents")) b.agents(net.getInt("agents"));
            if (net.hasPath("neighbors")) b.neighbors(net.getInt("neighbors"));
            if (net.hasPath("rewire-probability")) b.rewireProbability(net.getDouble("rewire-probability"));
        }
        if (config.hasPath("objects")) {
            Config obj = config.getConfig("objects");
            if (obj.hasPath("count")) b.objects(obj.getInt("count"));
            if (obj.hasPath("rivalrous")) b.rivalrousObjects(obj.getInt("rivalrous"));
            if (obj.hasPath("desire-init-max")) b.desireInitMax(obj.getDouble("desire-init-max"));
            if (obj.hasPath("desire-noise")) b.desireNoise(obj.getDouble("desire-noise"));
        }
        if (config.hasPath("dynamics")) {
            Config dyn = config.getConfig("dynamics");
            if (dyn.hasPath("alpha")) b.alpha(dyn.getDouble("alpha"));
            if (dyn.hasPath("rivalry-to-aggression")) b.rivalryToAggression(dyn.getDouble("rivalry-to-aggression"));
            if (dyn.hasPath("aggression-decay")) b.aggressionDecay(dyn.getDouble("aggression-decay"));
            if (dyn.hasPathOrNull("expulsion-threshold")) {
                b.expulsionThreshold(dyn.getIsNull("expulsion-threshold") ? null : dyn.getDouble("expulsion-threshold"));
            }
            if (dyn.hasPath("salience-exponent")) b.salienceExponent(dyn.getDouble("salience-exponent"));
        }
        if (config.hasPath("status")) {
            Config st = config.getConfig("status");
            if (st.hasPath("rivalry-intensity")) b.rivalryIntensity(st.getDouble("rivalry-intensity"));
            if (st.hasPath("sigma")) b.sigmaStatus(st.getDouble("sigma"));
            if (st.hasPath("beta-up")) b.betaUp(st.getDouble("beta-up"));
            if (st.hasPath("prestige-baseline")) b.prestigeStatusBaseline(st.getDouble("prestige-baseline"));
            if (st.hasPath("init-low")) b.statusInitLow(st.getDouble("init-low"));
            if (st.hasPath("init-high")) b.statusInitHigh(st.getDouble("init-high"));
            if (st.hasPath("loss-rate")) b.statusLossRate(st.getDouble("loss-rate"));
            if (st.hasPath("epsilon")) b.epsilon(st.getDouble("epsilon"));
        }
        if (config.hasPath("steps")) b.steps(config.getInt("steps"));
        if (config.hasPath("record-history")) b.recordHistory(config.getBoolean("record-history"));
        if (config.hasPath("seed")) b.seed(config.getLong("seed"));
        return b.build();
    }

    /**
     * @return A builder pre-populated with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
            .agents(agents)
            .neighbors(neighbors)
            .rewireProbability(rewireProbability)
            .objects(objects)
            .rivalrousObjects(rivalrousObjects)
            .desireInitMax(desireInitMax)
            .desireNoise(desireNoise)
            .alpha(alpha)
            .rivalryToAggression(rivalryToAggression)
            .aggressionDecay(aggressionDecay)
            .expulsionThreshold(expulsionThreshold)
            .salienceExponent(salienceExponent)
            .rivalryIntensity(rivalryIntensity)
            .sigmaStatus(sigmaStatus)
            .betaUp(betaUp)
            .prestigeStatusBaseline(prestigeStatusBaseline)
            .statusInitLow(statusInitLow)
            .statusInitHigh(statusInitHigh)
            .statusLossRate(statusLossRate)
            .epsilon(epsilon)
            .steps(steps)
            .recordHistory(recordHistory)
            .seed(seed);
    }

    private void validate() {
        require(agents >= 1, "network.agents must be >= 1, got " + agents);
        require(neighbors >= 0 && (agents == 1 ? neighbors == 0 : neighbors < agents),
                "network.neighbors must be in [0, agents), got " + neighbors);
        requireProbability(rewireProbability, "network.rewire-probability");
        require(objects >= 0, "objects.count must be >= 0, got " + objects);
        require(rivalrousObjects >= 0 && rivalrousObjects <= objects,
                "objects.rivalrous must be in [0, objects.count], got " + rivalrousObjects);
        requireNonNegative(desireInitMax, "objects.desire-init-max");
        requireNonNegative(desireNoise, "objects.desire-noise");
        requireProbability(alpha, "dynamics.alpha");
        requireNonNegative(rivalryToAggression, "dynamics.rivalry-to-aggression");
        requireProbability(aggressionDecay, "dynamics.aggression-decay");
        if (expulsionThreshold != null) {
            require(!expulsionThreshold.isNaN(), "dynamics.expulsion-threshold must be a number or null");
        }
        requireNonNegative(salienceExponent, "dynamics.salience-exponent");
        requireNonNegative(rivalryIntensity, "status.rivalry-intensity");
        require(sigmaStatus > 0.0, "status.sigma must be > 0, got " + sigmaStatus);
        requireNonNegative(betaUp, "status.beta-up");
        requireNonNegative(prestigeStatusBaseline, "status.prestige-baseline");
        requireProbability(statusInitLow, "status.init-low");
        requireProbability(statusInitHigh, "status.init-high");
        require(statusInitLow <= statusInitHigh, "status.init-low must not exceed status.init-high");
        requireNonNegative(statusLossRate, "status.loss-rate");
        require(epsilon > 0.0, "status.epsilon must be > 0, got " + epsilon);
        require(steps >= 0, "steps must be >= 0, got " + steps);
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    private static void requireNonNegative(double value, String name) {
        require(value >= 0.0 && !Double.isInfinite(value), name + " must be finite and >= 0, got " + value);
    }

    private static void requireProbability(double value, String name) {
        require(value >= 0.0 && value <= 1.0, name + " must be in [0, 1], got " + value);
    }

    // ==================== Accessors ====================

    public int agents() { return agents; }
    public int neighbors() { return neighbors; }
    public double rewireProbability() { return rewireProbability; }
    public int objects() { return objects; }
    public int rivalrousObjects() { return rivalrousObjects; }
    public double desireInitMax() { return desireInitMax; }
    public double desireNoise() { return desireNoise; }
    public double alpha() { return alpha; }
    public double rivalryToAggression() { return rivalryToAggression; }
    public double aggressionDecay() { return aggressionDecay; }

    /**
     * @return The expulsion threshold, or {@code null} if expulsion is disabled.
     */
    public Double expulsionThreshold() { return expulsionThreshold; }

    public boolean isExpulsionEnabled() { return expulsionThreshold != null; }
    public double salienceExponent() { return salienceExponent; }
    public double rivalryIntensity() { return rivalryIntensity; }
    public double sigmaStatus() { return sigmaStatus; }
    public double betaUp() { return betaUp; }
    public double prestigeStatusBaseline() { return prestigeStatusBaseline; }
    public double statusInitLow() { return statusInitLow; }
    public double statusInitHigh() { return statusInitHigh; }
    public double statusLossRate() { return statusLossRate; }
    public double epsilon() { return epsilon; }
    public int steps() { return steps; }
    public boolean recordHistory() { return recordHistory; }
    public long seed() { return seed; }

    @Override
    public String toString() {
        return "SimulationConfig{agents=" + agents + ", neighbors=" + neighbors + ", rewire=" + rewireProbability
            + ", objects=" + objects + "/" + rivalrousObjects + ", alpha=" + alpha + ", gamma=" + salienceExponent
            + ", decay=" + aggressionDecay + ", threshold=" + expulsionThreshold + ", steps=" + steps
            + ", seed=" + seed + "}";
    }

    /**
     * Mutable builder; {@link #build()} validates and freezes the values.
     */
    public static final class Builder {
        private int agents = 50;
        private int neighbors = 6;
        private double rewireProbability = 0.15;
        private int objects = 8;
        private int rivalrousObjects = 5;
        private double desireInitMax = 0.3;
        private double desireNoise = 0.02;
        private double alpha = 0.15;
        private double rivalryToAggression = 0.2;
        private double aggressionDecay = 0.03;
        private Double expulsionThreshold = 8.0;
        private double salienceExponent = 2.0;
        private double rivalryIntensity = 0.15;
        private double sigmaStatus = 0.10;
        private double betaUp = 1.0;
        private double prestigeStatusBaseline = 0.5;
        private double statusInitLow = 0.4;
        private double statusInitHigh = 0.6;
        private double statusLossRate = 0.005;
        private double epsilon = 1e-12;
        private int steps = 600;
        private boolean recordHistory = true;
        private long seed = 42L;

        private Builder() {
        }

        public Builder agents(int value) { this.agents = value; return this; }
        public Builder neighbors(int value) { this.neighbors = value; return this; }
        public Builder rewireProbability(double value) { this.rewireProbability = value; return this; }
        public Builder objects(int value) { this.objects = value; return this; }
        public Builder rivalrousObjects(int value) { this.rivalrousObjects = value; return this; }
        public Builder desireInitMax(double value) { this.desireInitMax = value; return this; }
        public Builder desireNoise(double value) { this.desireNoise = value; return this; }
        public Builder alpha(double value) { this.alpha = value; return this; }
        public Builder rivalryToAggression(double value) { this.rivalryToAggression = value; return this; }
        public Builder aggressionDecay(double value) { this.aggressionDecay = value; return this; }

        /**
         * @param value The threshold, or {@code null} to disable expulsion.
         */
        public Builder expulsionThreshold(Double value) { this.expulsionThreshold = value; return this; }

        public Builder disableExpulsion() { this.expulsionThreshold = null; return this; }
        public Builder salienceExponent(double value) { this.salienceExponent = value; return this; }
        public Builder rivalryIntensity(double value) { this.rivalryIntensity = value; return this; }
        public Builder sigmaStatus(double value) { this.sigmaStatus = value; return this; }
        public Builder betaUp(double value) { this.betaUp = value; return this; }
        public Builder prestigeStatusBaseline(double value) { this.prestigeStatusBaseline = value; return this; }
        public Builder statusInitLow(double value) { this.statusInitLow = value; return this; }
        public Builder statusInitHigh(double value) { this.statusInitHigh = value; return this; }
        public Builder statusLossRate(double value) { this.statusLossRate = value; return this; }
        public Builder epsilon(double value) { this.epsilon = value; return this; }
        public Builder steps(int value) { this.steps = value; return this; }
        public Builder recordHistory(boolean value) { this.recordHistory = value; return this; }
        public Builder seed(long value) { this.seed = value; return this; }

        /**
         * @throws IllegalArgumentException if any value is out of range.
         */
        public SimulationConfig build() {
            return new SimulationConfig(this);
        }
    }
}
