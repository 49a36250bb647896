package com.riskmgmt.quant.engine.network;

import com.riskmgmt.quant.model.CentralityMeasure;
import com.riskmgmt.quant.model.CorrelationMatrix;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Undirected, unweighted graph over the risks of a correlation matrix: i and j are adjacent
 * iff their correlation is at least the threshold. Node indices follow the matrix order, and
 * neighbour lists are kept in ascending index order so traversals are deterministic.
 */
public final class RiskNetwork {

    private static final int UNREACHABLE = -1;

    private final CorrelationMatrix matrix;
    private final double threshold;
    private final List<List<Integer>> adjacency;
    private final int edgeCount;

    private RiskNetwork(CorrelationMatrix matrix, double threshold) {
        this.matrix = matrix;
        this.threshold = threshold;
        int n = matrix.size();
        List<List<Integer>> lists = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            lists.add(new ArrayList<>());
        }
        int edges = 0;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (matrix.get(i, j) >= threshold) {
                    lists.get(i).add(j);
                    lists.get(j).add(i);
                    edges++;
                }
            }
        }
        List<List<Integer>> frozen = new ArrayList<>(n);
        for (List<Integer> list : lists) {
            Collections.sort(list);
            frozen.add(List.copyOf(list));
        }
        this.adjacency = List.copyOf(frozen);
        this.edgeCount = edges;
    }

    public static RiskNetwork of(CorrelationMatrix matrix, double threshold) {
        return new RiskNetwork(matrix, threshold);
    }

    public CorrelationMatrix getMatrix() {
        return matrix;
    }

    public double getThreshold() {
        return threshold;
    }

    public int nodeCount() {
        return adjacency.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public List<Integer> neighbours(int node) {
        return adjacency.get(node);
    }

    public boolean adjacent(int a, int b) {
        return Collections.binarySearch(adjacency.get(a), b) >= 0;
    }

    /**
     * Edges present over edges possible; 0 for fewer than two nodes.
     */
    public double density() {
        int n = nodeCount();
        if (n < 2) {
            return 0.0;
        }
        return edgeCount / (n * (n - 1) / 2.0);
    }

    /**
     * Mean local clustering coefficient. Nodes with fewer than two neighbours contribute 0.
     */
    public double clusteringCoefficient() {
        int n = nodeCount();
        if (n == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (int v = 0; v < n; v++) {
            List<Integer> nb = adjacency.get(v);
            int k = nb.size();
            if (k < 2) {
                continue;
            }
            int links = 0;
            for (int a = 0; a < k; a++) {
                for (int b = a + 1; b < k; b++) {
                    if (adjacent(nb.get(a), nb.get(b))) {
                        links++;
                    }
                }
            }
            sum += links / (k * (k - 1) / 2.0);
        }
        return sum / n;
    }

    /**
     * Hop distances from {@code source}; -1 marks unreachable nodes.
     */
    public int[] distancesFrom(int source) {
        int[] dist = new int[nodeCount()];
        Arrays.fill(dist, UNREACHABLE);
        dist[source] = 0;
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(source);
        while (!queue.isEmpty()) {
            int v = queue.poll();
            for (int w : adjacency.get(v)) {
                if (dist[w] == UNREACHABLE) {
                    dist[w] = dist[v] + 1;
                    queue.add(w);
                }
            }
        }
        return dist;
    }

    /**
     * Mean shortest-path length over all ordered pairs, or null if any pair is disconnected.
     */
    public Double averagePathLength() {
        int n = nodeCount();
        if (n < 2) {
            return null;
        }
        long total = 0;
        for (int s = 0; s < n; s++) {
            for (int d : distancesFrom(s)) {
                if (d == UNREACHABLE) {
                    return null;
                }
                total += d;
            }
        }
        return (double) total / ((long) n * (n - 1));
    }

    /**
     * One shortest path from a to b (inclusive), lowest-index neighbours first; empty if b is
     * unreachable.
     */
    public List<Integer> shortestPath(int a, int b) {
        int n = nodeCount();
        int[] parent = new int[n];
        Arrays.fill(parent, UNREACHABLE);
        boolean[] seen = new boolean[n];
        seen[a] = true;
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(a);
        while (!queue.isEmpty() && !seen[b]) {
            int v = queue.poll();
            for (int w : adjacency.get(v)) {
                if (!seen[w]) {
                    seen[w] = true;
                    parent[w] = v;
                    queue.add(w);
                }
            }
        }
        if (!seen[b]) {
            return List.of();
        }
        List<Integer> path = new ArrayList<>();
        for (int v = b; v != UNREACHABLE; v = parent[v]) {
            path.add(v);
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * Connected components, each sorted by node index, ordered by their lowest index.
     */
    public List<List<Integer>> components() {
        int n = nodeCount();
        boolean[] seen = new boolean[n];
        List<List<Integer>> components = new ArrayList<>();
        for (int start = 0; start < n; start++) {
            if (seen[start]) {
                continue;
            }
            int[] dist = distancesFrom(start);
            List<Integer> component = new ArrayList<>();
            for (int v = 0; v < n; v++) {
                if (dist[v] != UNREACHABLE) {
                    seen[v] = true;
                    component.add(v);
                }
            }
            components.add(List.copyOf(component));
        }
        return components;
    }

    /**
     * Degree, closeness and betweenness centrality per risk id, each normalized to [0, 1].
     *
     * Closeness uses the Wasserman-Faust form (r/(n-1)) * (r/sum d) so disconnected graphs are
     * handled; betweenness is Brandes' algorithm normalized by (n-1)(n-2)/2.
     */
    public Map<String, CentralityMeasure> centrality() {
        int n = nodeCount();
        double[] betweenness = betweenness();
        Map<String, CentralityMeasure> result = new LinkedHashMap<>();
        for (int v = 0; v < n; v++) {
            double degree = n > 1 ? (double) adjacency.get(v).size() / (n - 1) : 0.0;

            int reachable = 0;
            long distanceSum = 0;
            for (int d : distancesFrom(v)) {
                if (d > 0) {
                    reachable++;
                    distanceSum += d;
                }
            }
            double closeness = reachable == 0 ? 0.0
                    : ((double) reachable / (n - 1)) * ((double) reachable / distanceSum);

            result.put(matrix.getRiskIds().get(v), new CentralityMeasure(degree, closeness, betweenness[v]));
        }
        return result;
    }

    private double[] betweenness() {
        int n = nodeCount();
        double[] cb = new double[n];
        for (int s = 0; s < n; s++) {
            Deque<Integer> stack = new ArrayDeque<>();
            List<List<Integer>> predecessors = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                predecessors.add(new ArrayList<>());
            }
            double[] sigma = new double[n];
            int[] dist = new int[n];
            Arrays.fill(dist, UNREACHABLE);
            sigma[s] = 1.0;
            dist[s] = 0;

            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(s);
            while (!queue.isEmpty()) {
                int v = queue.poll();
                stack.push(v);
                for (int w : adjacency.get(v)) {
                    if (dist[w] == UNREACHABLE) {
                        dist[w] = dist[v] + 1;
                        queue.add(w);
                    }
                    if (dist[w] == dist[v] + 1) {
                        sigma[w] += sigma[v];
                        predecessors.get(w).add(v);
                    }
                }
            }

            double[] delta = new double[n];
            while (!stack.isEmpty()) {
                int w = stack.pop();
                for (int v : predecessors.get(w)) {
                    delta[v] += (sigma[v] / sigma[w]) * (1.0 + delta[w]);
                }
                if (w != s) {
                    cb[w] += delta[w];
                }
            }
        }

        if (n < 3) {
            return new double[n];
        }
        // Each undirected pair was counted from both ends.
        double scale = (n - 1) * (n - 2);
        for (int v = 0; v < n; v++) {
            cb[v] = cb[v] / scale;
        }
        return cb;
    }
}
