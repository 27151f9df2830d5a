package io.medpack.integrator.resolve;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Groups candidates that denote the same concept.
 *
 * Connected components over an undirected graph whose nodes are candidate indices and whose edges
 * come from identical normalized names and from merge directives.
 */
final class CandidateClusterer {

    private final int size;
    private final List<List<Integer>> adjacency;

    CandidateClusterer(int size) {
        this.size = size;
        this.adjacency = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            adjacency.add(new ArrayList<>());
        }
    }

    void connect(int a, int b) {
        if (a == b) {
            return;
        }
        adjacency.get(a).add(b);
        adjacency.get(b).add(a);
    }

    /**
     * Connects every pair of indices sharing a key.
     */
    void connectByKey(List<String> keys) {
        Map<String, Integer> first = new TreeMap<>();
        for (int i = 0; i < keys.size(); i++) {
            Integer previous = first.putIfAbsent(keys.get(i), i);
            if (previous != null) {
                connect(previous, i);
            }
        }
    }

    void connectAll(int anchor, Collection<Integer> others) {
        for (Integer other : others) {
            connect(anchor, other);
        }
    }

    /**
     * Returns the components, each sorted, ordered by smallest member.
     */
    List<List<Integer>> components() {
        boolean[] visited = new boolean[size];
        List<List<Integer>> clusters = new ArrayList<>();

        for (int i = 0; i < size; i++) {
            if (visited[i]) {
                continue;
            }
            TreeSet<Integer> cluster = new TreeSet<>();
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(i);
            visited[i] = true;
            while (!stack.isEmpty()) {
                int node = stack.pop();
                cluster.add(node);
                for (int neighbor : adjacency.get(node)) {
                    if (!visited[neighbor]) {
                        visited[neighbor] = true;
                        stack.push(neighbor);
                    }
                }
            }
            clusters.add(new ArrayList<>(cluster));
        }
        return clusters;
    }
}
