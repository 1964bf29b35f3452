package org.mimetica.runtime.model;

/**
 * Per-step series recorded in {@link History}.
 */
public enum Metric {
    /** Sum of received aggression over alive agents. */
    TENSION("tension"),
    /** Number of alive agents. */
    ACTIVE_AGENTS("active-agents"),
    GINI("gini"),
    /** Shannon entropy (base 2) of the received-aggression distribution. */
    ENTROPY("entropy"),
    MAX_SHARE("max-share"),
    /** Ratio of the largest to the second largest received aggression. */
    CONVERGENCE_RATIO("convergence-ratio"),
    MODAL_AGREEMENT("modal-agreement"),
    /** Agents whose outgoing aggression exceeds the eligibility epsilon. */
    ELIGIBLE_AGENTS("eligible-agents"),
    MEAN_AGGRESSION("mean-aggression"),
    TOP_TARGET_AGGRESSION("top-target-aggression");

    private final String key;

    Metric(String key) {
        this.key = key;
    }

    /**
     * @return The stable, kebab-case series name.
     */
    public String key() {
        return key;
    }

    /**
     * Resolves a metric by its series name or enum constant name, case-insensitively.
     *
     * @throws IllegalArgumentException if no metric matches.
     */
    public static Metric fromKey(String name) {
        for (Metric m : values()) {
            if (m.key.equalsIgnoreCase(name) || m.name().equalsIgnoreCase(name)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown metric: '" + name + "'");
    }
}
