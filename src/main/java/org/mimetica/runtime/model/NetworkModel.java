package org.mimetica.runtime.model;

import java.util.Arrays;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * Fixed social network over agent ids {@code 0..N-1}.
 * <p>
 * Adjacency is stored as one sorted neighbor array per agent, so lookups in the hot loops of the
 * dynamics never hash id pairs. All-pairs shortest-path distances are computed once by BFS at
 * construction. The node and edge sets never change afterwards.
 * </p>
 */
public final class NetworkModel {

    /** Marker for unreachable pairs in the distance table. */
    private static final int UNREACHABLE = -1;

    private final int size;
    private final int[][] neighbors;
    private final int[][] distances;
    private final int edgeCount;

    private NetworkModel(int size, int[][] neighbors) {
        this.size = size;
        this.neighbors = neighbors;
        int degreeSum = 0;
        for (int[] row : neighbors) {
            degreeSum += row.length;
        }
        this.edgeCount = degreeSum / 2;
        this.distances = computeDistances(size, neighbors);
    }

    /**
     * Builds a network from an undirected edge list.
     *
     * @param size  Number of agents.
     * @param edges Pairs {@code {u, v}}; duplicates are collapsed.
     * @return The network.
     * @throws IllegalArgumentException if an endpoint is out of range or an edge is a self-loop.
     */
    public static NetworkModel fromEdges(int size, int[][] edges) {
        if (size < 0) {
            throw new IllegalArgumentException("Network size must be non-negative, got " + size);
        }
        IntOpenHashSet[] adjacency = new IntOpenHashSet[size];
        for (int i = 0; i < size; i++) {
            adjacency[i] = new IntOpenHashSet();
        }
        for (int[] edge : edges) {
            if (edge.length != 2) {
                throw new IllegalArgumentException("Edge must have exactly two endpoints: " + Arrays.toString(edge));
            }
            int u = edge[0];
            int v = edge[1];
            if (u < 0 || u >= size || v < 0 || v >= size) {
                throw new IllegalArgumentException("Edge endpoint out of range [0, " + size + "): " + Arrays.toString(edge));
            }
            if (u == v) {
                throw new IllegalArgumentException("Self-loops are not allowed: " + Arrays.toString(edge));
            }
            adjacency[u].add(v);
            adjacency[v].add(u);
        }
        return fromAdjacency(adjacency);
    }

    /**
     * Builds a network from mutable adjacency sets (used by topology generators).
     *
     * @param adjacency One neighbor set per agent; must be symmetric.
     * @return The network.
     */
    public static NetworkModel fromAdjacency(IntOpenHashSet[] adjacency) {
        int[][] neighbors = new int[adjacency.length][];
        for (int i = 0; i < adjacency.length; i++) {
            int[] row = adjacency[i].toIntArray();
            Arrays.sort(row);
            neighbors[i] = row;
        }
        return new NetworkModel(adjacency.length, neighbors);
    }

    public int size() {
        return size;
    }

    public int edgeCount() {
        return edgeCount;
    }

    /**
     * Returns the sorted neighbor ids of an agent. The returned array must not be modified.
     *
     * @param agent The agent id.
     * @return Neighbor ids in ascending order.
     */
    public int[] neighbors(int agent) {
        return neighbors[agent];
    }

    public int degree(int agent) {
        return neighbors[agent].length;
    }

    /**
     * @return Position of {@code other} in {@link #neighbors(int)} of {@code agent}, or a negative
     *         value if they are not adjacent.
     */
    public int neighborIndex(int agent, int other) {
        return Arrays.binarySearch(neighbors[agent], other);
    }

    public boolean hasEdge(int u, int v) {
        return neighborIndex(u, v) >= 0;
    }

    /**
     * Shortest-path distance in hops.
     *
     * @return The hop count, or {@link Double#POSITIVE_INFINITY} if {@code v} is unreachable from {@code u}.
     */
    public double distance(int u, int v) {
        int d = distances[u][v];
        return d == UNREACHABLE ? Double.POSITIVE_INFINITY : d;
    }

    /**
     * Distance used to attenuate rivalry: the graph distance floored at 1.
     */
    public double socialDistance(int u, int v) {
        return Math.max(1.0, distance(u, v));
    }

    /**
     * Visits every undirected edge once as {@code (u, v)} with {@code u < v}, ordered by {@code u}
     * then {@code v}.
     */
    public void forEachEdge(EdgeVisitor visitor) {
        for (int u = 0; u < size; u++) {
            for (int v : neighbors[u]) {
                if (u < v) {
                    visitor.visit(u, v);
                }
            }
        }
    }

    @FunctionalInterface
    public interface EdgeVisitor {
        void visit(int u, int v);
    }

    private static int[][] computeDistances(int size, int[][] neighbors) {
        int[][] result = new int[size][size];
        IntArrayList queue = new IntArrayList(size);
        for (int source = 0; source < size; source++) {
            int[] dist = result[source];
            Arrays.fill(dist, UNREACHABLE);
            dist[source] = 0;
            queue.clear();
            queue.add(source);
            for (int head = 0; head < queue.size(); head++) {
                int current = queue.getInt(head);
                for (int next : neighbors[current]) {
                    if (dist[next] == UNREACHABLE) {
                        dist[next] = dist[current] + 1;
                        queue.add(next);
                    }
                }
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "NetworkModel{size=" + size + ", edges=" + edgeCount + "}";
    }
}
