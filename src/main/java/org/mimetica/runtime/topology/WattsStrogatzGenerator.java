package org.mimetica.runtime.topology;

import org.mimetica.runtime.model.NetworkModel;
import org.mimetica.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * Small-world network generator.
 * <p>
 * Starts from a ring lattice in which every node is joined to its {@code k/2} nearest neighbors
 * on each side, then visits each lattice edge {@code (u, u+j)} (by offset {@code j}, then by
 * {@code u}) and with probability {@code p} replaces it by an edge {@code (u, w)} to a uniformly
 * chosen node {@code w} that is neither {@code u} nor already adjacent to {@code u}. Odd
 * {@code k} is rounded down. A node that is already connected to everyone keeps its edge.
 * </p>
 */
public final class WattsStrogatzGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(WattsStrogatzGenerator.class);

    private WattsStrogatzGenerator() {
    }

    /**
     * Generates a network.
     *
     * @param n      Number of nodes.
     * @param k      Lattice degree; each node links to {@code k/2} neighbors per side.
     * @param p      Rewiring probability in [0, 1].
     * @param random Random stream consumed by rewiring decisions and target choice.
     * @return The generated network.
     * @throws IllegalArgumentException if {@code k >= n} (for {@code n > 1}) or {@code p} is out of range.
     */
    public static NetworkModel generate(int n, int k, double p, IRandomProvider random) {
        if (n < 0) {
            throw new IllegalArgumentException("Node count must be non-negative, got " + n);
        }
        if (k < 0 || (n > 1 && k >= n)) {
            throw new IllegalArgumentException("Lattice degree k must satisfy 0 <= k < n, got k=" + k + ", n=" + n);
        }
        if (!(p >= 0.0 && p <= 1.0)) {
            throw new IllegalArgumentException("Rewiring probability must be in [0, 1], got " + p);
        }

        IntOpenHashSet[] adjacency = new IntOpenHashSet[n];
        for (int i = 0; i < n; i++) {
            adjacency[i] = new IntOpenHashSet();
        }
        int half = k / 2;
        for (int j = 1; j <= half; j++) {
            for (int u = 0; u < n; u++) {
                link(adjacency, u, (u + j) % n);
            }
        }

        int rewired = 0;
        for (int j = 1; j <= half; j++) {
            for (int u = 0; u < n; u++) {
                int v = (u + j) % n;
                if (random.nextDouble() >= p) {
                    continue;
                }
                // Edge may already have been rewired away by an earlier step.
                if (!adjacency[u].contains(v) || adjacency[u].size() >= n - 1) {
                    continue;
                }
                int w = random.nextInt(n);
                while (w == u || adjacency[u].contains(w)) {
                    w = random.nextInt(n);
                }
                adjacency[u].remove(v);
                adjacency[v].remove(u);
                link(adjacency, u, w);
                rewired++;
            }
        }

        NetworkModel network = NetworkModel.fromAdjacency(adjacency);
        LOG.debug("Generated small-world network: n={}, k={}, p={}, edges={}, rewired={}",
                n, k, p, network.edgeCount(), rewired);
        return network;
    }

    private static void link(IntOpenHashSet[] adjacency, int u, int v) {
        adjacency[u].add(v);
        adjacency[v].add(u);
    }
}
