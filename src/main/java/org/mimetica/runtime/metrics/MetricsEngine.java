package org.mimetica.runtime.metrics;

import java.util.Arrays;

import org.mimetica.runtime.model.Population;
import org.mimetica.runtime.model.StepMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.Int2IntLinkedOpenHashMap;

/**
 * Convergence statistics of the received-aggression distribution over alive agents.
 * <p>
 * Every statistic has a defined value for degenerate input (empty population, all-zero
 * aggression, a single survivor); none of them throws during stepping.
 * </p>
 */
public final class MetricsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsEngine.class);

    /** Minimum outgoing aggression for an agent to count in modal agreement. */
    public static final double ELIGIBILITY_EPSILON = 1e-8;

    private MetricsEngine() {
    }

    /**
     * Result of the modal agreement computation.
     *
     * @param agreement   Fraction of eligible agents whose top target is the modal target.
     * @param eligible    Number of eligible agents.
     * @param modalTarget The most common top target, or -1 if there are no eligible agents.
     */
    public record ModalAgreement(double agreement, int eligible, int modalTarget) {
        static final ModalAgreement NONE = new ModalAgreement(0.0, 0, -1);
    }

    /**
     * Computes all metrics for the current state of a population.
     */
    public static StepMetrics compute(Population population) {
        int[] alive = population.aliveIds();
        double[] received = population.receivedAggression(alive);
        double total = sum(received);
        double max = received.length == 0 ? 0.0 : Arrays.stream(received).max().getAsDouble();
        ModalAgreement modal = modalAgreement(population, alive);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Metrics: tension {}, alive {}, modal agreement {} over {} eligible",
                    total, alive.length, modal.agreement(), modal.eligible());
        }
        return new StepMetrics(
                total,
                alive.length,
                gini(received),
                entropy(received),
                maxShare(received),
                convergenceRatio(received),
                modal.agreement(),
                modal.eligible(),
                received.length == 0 ? 0.0 : total / received.length,
                max);
    }

    /**
     * Gini coefficient of non-negative values: {@code (2 * sum(i * x_(i)) - (n + 1) * sum(x)) / (n * sum(x))}
     * over the ascending order statistics {@code x_(1..n)}.
     *
     * @return A value in [0, 1]; 0 for empty or all-zero input.
     */
    public static double gini(double[] values) {
        int n = values.length;
        if (n == 0) {
            return 0.0;
        }
        double total = sum(values);
        if (total <= 0.0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double weighted = 0.0;
        for (int i = 0; i < n; i++) {
            weighted += (i + 1) * sorted[i];
        }
        double g = (2.0 * weighted - (n + 1.0) * total) / (n * total);
        // Rounding can push an all-equal vector a hair below zero.
        return Math.min(1.0, Math.max(0.0, g));
    }

    /**
     * Shannon entropy in bits of the distribution obtained by normalising {@code values}.
     *
     * @return The entropy; 0 for all-zero input.
     */
    public static double entropy(double[] values) {
        double total = sum(values);
        if (total <= 0.0) {
            return 0.0;
        }
        double h = 0.0;
        for (double v : values) {
            if (v > 0.0) {
                double p = v / total;
                h -= p * (Math.log(p) / Math.log(2.0));
            }
        }
        return h;
    }

    /**
     * @return {@code max / sum}, or 0 if the sum is 0.
     */
    public static double maxShare(double[] values) {
        double total = sum(values);
        if (total <= 0.0 || values.length == 0) {
            return 0.0;
        }
        return Arrays.stream(values).max().getAsDouble() / total;
    }

    /**
     * Ratio of the largest to the second-largest value.
     *
     * @return {@code top1 / top2}; {@code top1} itself if {@code top2 == 0}; 0 if both are 0 or
     *         fewer than two values are given.
     */
    public static double convergenceRatio(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double top1 = Double.NEGATIVE_INFINITY;
        double top2 = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (v > top1) {
                top2 = top1;
                top1 = v;
            } else if (v > top2) {
                top2 = v;
            }
        }
        if (top2 > 0.0) {
            return top1 / top2;
        }
        return top1 > 0.0 ? top1 : 0.0;
    }

    /**
     * Fraction of eligible agents that share the population's most common top target.
     * <p>
     * An alive agent is eligible when its aggression toward other alive agents sums to at least
     * {@link #ELIGIBILITY_EPSILON}. Its top target is the first alive agent (ascending id) with the
     * maximal aggression. Count ties between targets go to the target first chosen in ascending
     * order of the choosing agents.
     * </p>
     */
    public static ModalAgreement modalAgreement(Population population) {
        return modalAgreement(population, population.aliveIds());
    }

    private static ModalAgreement modalAgreement(Population population, int[] alive) {
        if (alive.length < 2) {
            return ModalAgreement.NONE;
        }
        Int2IntLinkedOpenHashMap counts = new Int2IntLinkedOpenHashMap();
        int eligible = 0;
        for (int i : alive) {
            double[] row = population.aggression(i);
            double total = 0.0;
            int top = -1;
            double topValue = Double.NEGATIVE_INFINITY;
            for (int j : alive) {
                if (j == i) {
                    continue;
                }
                double value = row[j];
                total += value;
                if (value > topValue) {
                    topValue = value;
                    top = j;
                }
            }
            if (total < ELIGIBILITY_EPSILON) {
                continue;
            }
            eligible++;
            counts.addTo(top, 1);
        }
        if (eligible == 0) {
            return new ModalAgreement(0.0, 0, -1);
        }
        int modalTarget = -1;
        int modalCount = 0;
        for (var entry : counts.int2IntEntrySet()) {
            if (entry.getIntValue() > modalCount) {
                modalCount = entry.getIntValue();
                modalTarget = entry.getIntKey();
            }
        }
        return new ModalAgreement((double) modalCount / eligible, eligible, modalTarget);
    }

    private static double sum(double[] values) {
        double total = 0.0;
        for (double v : values) {
            total += v;
        }
        return total;
    }
}
