package org.mimetica.runtime.model;

/**
 * Summary statistics of the received-aggression distribution after one step.
 */
public record StepMetrics(
        double tension,
        int activeAgents,
        double gini,
        double entropy,
        double maxShare,
        double convergenceRatio,
        double modalAgreement,
        int eligibleAgents,
        double meanAggression,
        double topTargetAggression) {

    /**
     * @return The value of one metric as a double.
     */
    public double get(Metric metric) {
        return switch (metric) {
            case TENSION -> tension;
            case ACTIVE_AGENTS -> activeAgents;
            case GINI -> gini;
            case ENTROPY -> entropy;
            case MAX_SHARE -> maxShare;
            case CONVERGENCE_RATIO -> convergenceRatio;
            case MODAL_AGREEMENT -> modalAgreement;
            case ELIGIBLE_AGENTS -> eligibleAgents;
            case MEAN_AGGRESSION -> meanAggression;
            case TOP_TARGET_AGGRESSION -> topTargetAggression;
        };
    }
}
