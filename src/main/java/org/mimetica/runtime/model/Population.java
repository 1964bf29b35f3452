package org.mimetica.runtime.model;

import java.util.Arrays;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Mutable per-agent state of one simulation: desire vectors, the aggression matrix, alive flags
 * and (in status mode) status scalars.
 * <p>
 * Agents are never physically removed. Expulsion clears the alive flag, zeroes the agent's own
 * aggression row and every alive agent's aggression toward it. After every completed phase the
 * following holds for every alive agent {@code i}: {@code aggression[i][i] == 0} and
 * {@code aggression[i][d] == 0} for every dead {@code d}.
 * </p>
 * <p>
 * The raw arrays are exposed for engines and instrumentation; callers outside the engines should
 * treat them as read-only.
 * </p>
 */
public final class Population {

    private final NetworkModel network;
    private final int objectCount;
    private final double[][] desires;
    private final double[][] aggression;
    private final boolean[] alive;
    private final double[] status;
    private int aliveCount;

    /**
     * Creates a population with zero desire, zero aggression and every agent alive.
     *
     * @param network     The network the agents live on.
     * @param objectCount Length of each desire vector.
     * @param withStatus  Whether agents carry a status scalar (initialised to 0).
     */
    public Population(NetworkModel network, int objectCount, boolean withStatus) {
        this.network = network;
        this.objectCount = objectCount;
        int n = network.size();
        this.desires = new double[n][objectCount];
        this.aggression = new double[n][n];
        this.alive = new boolean[n];
        Arrays.fill(alive, true);
        this.aliveCount = n;
        this.status = withStatus ? new double[n] : null;
    }

    public NetworkModel getNetwork() {
        return network;
    }

    public int size() {
        return alive.length;
    }

    public int getObjectCount() {
        return objectCount;
    }

    // ==================== Alive set ====================

    public boolean isAlive(int agent) {
        return alive[agent];
    }

    public int aliveCount() {
        return aliveCount;
    }

    /**
     * @return Ids of alive agents in ascending order.
     */
    public int[] aliveIds() {
        int[] ids = new int[aliveCount];
        int k = 0;
        for (int i = 0; i < alive.length; i++) {
            if (alive[i]) {
                ids[k++] = i;
            }
        }
        return ids;
    }

    /**
     * @return Alive neighbors of {@code agent} in ascending order.
     */
    public int[] aliveNeighbors(int agent) {
        int[] nbrs = network.neighbors(agent);
        IntArrayList result = new IntArrayList(nbrs.length);
        for (int k : nbrs) {
            if (alive[k]) {
                result.add(k);
            }
        }
        return result.toIntArray();
    }

    public boolean hasAliveNeighbor(int agent) {
        for (int k : network.neighbors(agent)) {
            if (alive[k]) {
                return true;
            }
        }
        return false;
    }

    // ==================== Desire ====================

    /**
     * @return The live desire vector of {@code agent}.
     */
    public double[] desire(int agent) {
        return desires[agent];
    }

    /**
     * Replaces the desire vector of {@code agent} by a copy of {@code values}.
     *
     * @throws IllegalArgumentException if the length differs or an entry is negative.
     */
    public void setDesire(int agent, double[] values) {
        if (values.length != objectCount) {
            throw new IllegalArgumentException("Desire vector must have length " + objectCount + ", got " + values.length);
        }
        for (double v : values) {
            if (!(v >= 0.0)) {
                throw new IllegalArgumentException("Desire entries must be non-negative, got " + v);
            }
        }
        System.arraycopy(values, 0, desires[agent], 0, objectCount);
    }

    /**
     * Swaps in a freshly computed desire vector. Used by the double-buffered desire update.
     * The population takes ownership of {@code values}; the caller must not keep writing to it.
     *
     * @throws IllegalArgumentException if {@code values} is null or not of the object count.
     */
    public void commitDesire(int agent, double[] values) {
        if (values == null || values.length != objectCount) {
            throw new IllegalArgumentException("Desire vector must have length " + objectCount
                    + ", got " + (values == null ? "null" : values.length));
        }
        desires[agent] = values;
    }

    // ==================== Aggression ====================

    /**
     * @return The live aggression row of {@code agent} (one entry per possible target).
     */
    public double[] aggression(int agent) {
        return aggression[agent];
    }

    public double aggression(int sender, int target) {
        return aggression[sender][target];
    }

    public void setAggression(int sender, int target, double value) {
        aggression[sender][target] = value;
    }

    public void addAggression(int sender, int target, double increment) {
        aggression[sender][target] += increment;
    }

    /**
     * Swaps in a freshly computed aggression row. Used by the double-buffered spread update.
     * The population takes ownership of {@code row}; the caller must not keep writing to it.
     *
     * @throws IllegalArgumentException if {@code row} is null or not one entry per agent.
     */
    public void commitAggression(int agent, double[] row) {
        if (row == null || row.length != aggression.length) {
            throw new IllegalArgumentException("Aggression row must have length " + aggression.length
                    + ", got " + (row == null ? "null" : row.length));
        }
        aggression[agent] = row;
    }

    /**
     * Zeroes the entries of {@code row} toward {@code self} and toward every dead agent.
     *
     * @param self The owner of the row.
     * @param row  A full-length aggression vector.
     */
    public void mask(int self, double[] row) {
        row[self] = 0.0;
        if (aliveCount == alive.length) {
            return;
        }
        for (int j = 0; j < alive.length; j++) {
            if (!alive[j]) {
                row[j] = 0.0;
            }
        }
    }

    /**
     * Applies {@link #mask(int, double[])} to every alive agent's row.
     */
    public void maskAll() {
        for (int i = 0; i < alive.length; i++) {
            if (alive[i]) {
                mask(i, aggression[i]);
            }
        }
    }

    /**
     * Total aggression received by every agent from alive senders other than itself.
     *
     * @return Array indexed by agent id; entries for dead agents are 0.
     */
    public double[] receivedAggression() {
        double[] received = new double[alive.length];
        for (int sender = 0; sender < alive.length; sender++) {
            if (!alive[sender]) {
                continue;
            }
            double[] row = aggression[sender];
            for (int v = 0; v < alive.length; v++) {
                if (v != sender && alive[v]) {
                    received[v] += row[v];
                }
            }
        }
        return received;
    }

    /**
     * Received aggression restricted to alive agents, aligned with {@code aliveIds}.
     *
     * @param aliveIds The alive ids, as returned by {@link #aliveIds()}.
     * @return One entry per alive agent.
     */
    public double[] receivedAggression(int[] aliveIds) {
        double[] all = receivedAggression();
        double[] result = new double[aliveIds.length];
        for (int k = 0; k < aliveIds.length; k++) {
            result[k] = all[aliveIds[k]];
        }
        return result;
    }

    /**
     * @return Sum of received aggression over alive agents.
     */
    public double totalTension() {
        double total = 0.0;
        for (double r : receivedAggression()) {
            total += r;
        }
        return total;
    }

    /**
     * Removes an agent from the population. Monotonic: an expelled agent is never revived.
     *
     * @param agent The agent to expel.
     * @throws IllegalStateException if the agent is already dead.
     */
    public void expel(int agent) {
        if (!alive[agent]) {
            throw new IllegalStateException("Agent " + agent + " is already expelled");
        }
        alive[agent] = false;
        aliveCount--;
        for (int i = 0; i < alive.length; i++) {
            if (alive[i]) {
                aggression[i][agent] = 0.0;
            }
        }
        Arrays.fill(aggression[agent], 0.0);
    }

    // ==================== Status ====================

    public boolean hasStatus() {
        return status != null;
    }

    /**
     * @return The live status array.
     * @throws IllegalStateException if this population carries no status.
     */
    public double[] status() {
        if (status == null) {
            throw new IllegalStateException("Population has no status scalars (object-rivalry mode)");
        }
        return status;
    }

    public double status(int agent) {
        return status()[agent];
    }

    /**
     * @throws IllegalArgumentException if the value is outside [0, 1].
     */
    public void setStatus(int agent, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException("Status must lie in [0, 1], got " + value);
        }
        status()[agent] = value;
    }
}
