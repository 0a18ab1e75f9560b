package com.graphkit.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Iterative three-colour DFS over the bipartite operation/data graph.
 *
 * Node ids are unified as: operation oi -> oi, data di -> O + di. Edges run
 * operation -> provided data and data -> consuming operation. The traversal
 * keeps an explicit stack, so recursion depth is never an issue on large
 * networks.
 */
final class CycleDetector {
    private static final byte WHITE = 0, GRAY = 1, BLACK = 2;

    private CycleDetector() {
    }

    /** A detected cycle: alternating names closed by the first one, and its operations. */
    record Cycle(List<String> path, List<String> operations) {
    }

    /**
     * Finds one cycle, or returns null when the graph is acyclic.
     *
     * @param includeOps Restricts the search to these operations; null means all.
     */
    static Cycle findCycle(Network net, boolean[] includeOps) {
        final int o = net.operationCount();
        final int n = o + net.dataCount();
        byte[] color = new byte[n];
        int[] stack = new int[n];
        int[] cursor = new int[n];
        int[] stackPos = new int[n];

        // Roots in declaration order keep the reported cycle deterministic.
        for (int root = 0; root < o; root++) {
            if (color[root] != WHITE || !included(includeOps, root))
                continue;
            int top = 0;
            stack[0] = root;
            cursor[0] = 0;
            stackPos[root] = 0;
            color[root] = GRAY;

            while (top >= 0) {
                int node = stack[top];
                if (cursor[top] >= childCount(net, o, node)) {
                    color[node] = BLACK;
                    top--;
                    continue;
                }
                int child = child(net, o, node, cursor[top]++);
                if (child < o && !included(includeOps, child))
                    continue;
                if (color[child] == GRAY)
                    return toCycle(net, o, stack, stackPos[child], top);
                if (color[child] == WHITE) {
                    top++;
                    stack[top] = child;
                    cursor[top] = 0;
                    stackPos[child] = top;
                    color[child] = GRAY;
                }
            }
        }
        return null;
    }

    private static boolean included(boolean[] includeOps, int oi) {
        return includeOps == null || includeOps[oi];
    }

    private static int childCount(Network net, int o, int node) {
        return node < o ? net.provideCount(node) : net.consumerCount(node - o);
    }

    private static int child(Network net, int o, int node, int i) {
        return node < o ? o + net.provide(node, i) : net.consumer(node - o, i);
    }

    private static Cycle toCycle(Network net, int o, int[] stack, int from, int to) {
        List<Integer> nodes = new ArrayList<>(to - from + 1);
        for (int i = from; i <= to; i++)
            nodes.add(stack[i]);
        // Report cycles starting at an operation.
        if (nodes.get(0) >= o)
            nodes.add(nodes.remove(0));

        List<String> path = new ArrayList<>(nodes.size() + 1);
        List<String> ops = new ArrayList<>();
        for (int node : nodes) {
            if (node < o) {
                path.add(net.operationName(node));
                ops.add(net.operationName(node));
            } else {
                path.add(net.dataName(node - o));
            }
        }
        path.add(path.get(0));
        return new Cycle(List.copyOf(path), List.copyOf(ops));
    }
}
