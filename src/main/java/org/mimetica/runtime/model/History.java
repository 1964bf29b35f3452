package org.mimetica.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

/**
 * Append-only record of a simulation run: one entry per recorded step for every {@link Metric},
 * plus the expulsion and catharsis event logs. Nothing is ever modified retroactively.
 */
public final class History {

    private final Map<Metric, DoubleArrayList> series = new EnumMap<>(Metric.class);
    private final List<ExpulsionEvent> expulsions = new ArrayList<>();
    private final List<CatharsisEvent> catharses = new ArrayList<>();
    private StepMetrics latest;

    public History() {
        for (Metric metric : Metric.values()) {
            series.put(metric, new DoubleArrayList());
        }
    }

    /**
     * Appends one step's metrics to every series.
     */
    public void record(StepMetrics metrics) {
        for (Metric metric : Metric.values()) {
            series.get(metric).add(metrics.get(metric));
        }
        latest = metrics;
    }

    public void recordExpulsion(ExpulsionEvent event) {
        expulsions.add(event);
    }

    public void recordCatharsis(CatharsisEvent event) {
        catharses.add(event);
    }

    /**
     * @return Number of recorded steps.
     */
    public int length() {
        return series.get(Metric.TENSION).size();
    }

    /**
     * @return A copy of the named series.
     */
    public double[] series(Metric metric) {
        return series.get(metric).toDoubleArray();
    }

    /**
     * @return A copy of the series with the given name (see {@link Metric#key()}).
     */
    public double[] series(String name) {
        return series(Metric.fromKey(name));
    }

    /**
     * @return The most recently recorded metrics, or {@code null} before the first record.
     */
    public StepMetrics latest() {
        return latest;
    }

    public List<ExpulsionEvent> getExpulsionEvents() {
        return Collections.unmodifiableList(expulsions);
    }

    public List<CatharsisEvent> getCatharsisEvents() {
        return Collections.unmodifiableList(catharses);
    }

    /**
     * Largest value ever recorded in a series, or 0 if nothing was recorded.
     */
    public double peak(Metric metric) {
        DoubleArrayList values = series.get(metric);
        double max = 0.0;
        for (int i = 0; i < values.size(); i++) {
            max = Math.max(max, values.getDouble(i));
        }
        return max;
    }
}
