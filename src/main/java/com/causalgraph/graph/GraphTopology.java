package com.causalgraph.graph;

import com.causalgraph.domain.model.TemporalEntity;
import com.causalgraph.domain.model.TemporalRelation;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural measures over a {@link GraphSnapshot}, reported by the statistics endpoint.
 */
public final class GraphTopology {

    private GraphTopology() {}

    /** Directed density: relations / (n * (n - 1)). Parallel edges count separately. */
    public static double density(GraphSnapshot snapshot) {
        long n = snapshot.entityCount();
        if (n < 2) {
            return 0.0;
        }
        return snapshot.getRelations().size() / (double) (n * (n - 1));
    }

    /**
     * Number of strongly connected components, isolated entities included.
     *
     * <p>Iterative Tarjan so that long relation paths cannot overflow the stack.
     */
    public static int stronglyConnectedComponents(GraphSnapshot snapshot) {
        List<TemporalEntity> entities = snapshot.getEntities();
        int n = entities.size();
        if (n == 0) {
            return 0;
        }

        Map<String, Integer> indexOf = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++) {
            indexOf.put(entities.get(i).getId(), i);
        }
        List<List<Integer>> adjacency = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            adjacency.add(new ArrayList<>());
        }
        for (TemporalRelation relation : snapshot.getRelations()) {
            Integer from = indexOf.get(relation.getSourceEntity());
            Integer to = indexOf.get(relation.getTargetEntity());
            if (from != null && to != null) {
                adjacency.get(from).add(to);
            }
        }

        int[] index = new int[n];
        int[] lowLink = new int[n];
        int[] edgeCursor = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, -1);

        Deque<Integer> tarjanStack = new ArrayDeque<>();
        Deque<Integer> callStack = new ArrayDeque<>();
        int nextIndex = 0;
        int components = 0;

        for (int root = 0; root < n; root++) {
            if (index[root] != -1) {
                continue;
            }
            callStack.push(root);
            while (!callStack.isEmpty()) {
                int node = callStack.peek();
                if (index[node] == -1) {
                    index[node] = nextIndex;
                    lowLink[node] = nextIndex;
                    nextIndex++;
                    tarjanStack.push(node);
                    onStack[node] = true;
                }

                List<Integer> neighbours = adjacency.get(node);
                if (edgeCursor[node] < neighbours.size()) {
                    int next = neighbours.get(edgeCursor[node]++);
                    if (index[next] == -1) {
                        callStack.push(next);
                    } else if (onStack[next]) {
                        lowLink[node] = Math.min(lowLink[node], index[next]);
                    }
                    continue;
                }

                callStack.pop();
                if (!callStack.isEmpty()) {
                    int parent = callStack.peek();
                    lowLink[parent] = Math.min(lowLink[parent], lowLink[node]);
                }
                if (lowLink[node] == index[node]) {
                    int member;
                    do {
                        member = tarjanStack.pop();
                        onStack[member] = false;
                    } while (member != node);
                    components++;
                }
            }
        }
        return components;
    }
}
