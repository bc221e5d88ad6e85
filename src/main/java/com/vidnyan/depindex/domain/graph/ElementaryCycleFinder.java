package com.vidnyan.depindex.domain.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Enumerates elementary directed cycles using Johnson's algorithm.
 * <p>
 * Vertices are processed in lexicographic order; every cycle is reported exactly once,
 * starting at its lexicographically smallest vertex. Vertices outside non-trivial
 * strongly connected components are skipped up front.
 */
final class ElementaryCycleFinder {

    private final String[] names;
    private final int[][] adjacency;
    private final int[][] reverse;
    private final int[] componentOf;

    // per-run search state
    private int start;
    private BitSet allowed;
    private boolean[] blocked;
    private List<Set<Integer>> blockedBy;
    private int[] cursor;
    private boolean[] found;
    private final Deque<Integer> stack = new ArrayDeque<>();
    private List<List<String>> cycles;
    private int limit;

    ElementaryCycleFinder(List<String> orderedNodes, Map<String, ? extends Set<String>> successors) {
        this.names = orderedNodes.toArray(new String[0]);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            index.put(names[i], i);
        }
        this.adjacency = new int[names.length][];
        for (int i = 0; i < names.length; i++) {
            Set<String> succ = successors.get(names[i]);
            if (succ == null) {
                adjacency[i] = new int[0];
                continue;
            }
            int[] targets = succ.stream()
                    .map(index::get)
                    .filter(Objects::nonNull)
                    .mapToInt(Integer::intValue)
                    .sorted()
                    .toArray();
            adjacency[i] = targets;
        }
        this.reverse = invert(adjacency);
        this.componentOf = new StronglyConnected(adjacency).components();
    }

    /**
     * Find up to {@code maxCycles} elementary cycles.
     */
    List<List<String>> find(int maxCycles) {
        cycles = new ArrayList<>();
        limit = maxCycles;
        if (maxCycles <= 0) {
            return cycles;
        }

        int n = names.length;
        blocked = new boolean[n];
        cursor = new int[n];
        found = new boolean[n];
        blockedBy = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            blockedBy.add(new HashSet<>());
        }

        for (start = 0; start < n && cycles.size() < limit; start++) {
            if (!onSomeCycle(start)) {
                continue;
            }
            allowed = componentFrom(start);
            if (allowed.cardinality() == 1 && !hasSelfLoop(start)) {
                continue;
            }
            for (int v = allowed.nextSetBit(0); v >= 0; v = allowed.nextSetBit(v + 1)) {
                blocked[v] = false;
                blockedBy.get(v).clear();
            }
            circuit();
        }
        return cycles;
    }

    /**
     * Johnson's CIRCUIT from {@code start}, driven by an explicit frame stack so that
     * long components cannot exhaust the thread stack. {@code stack} holds the current
     * path; {@code cursor[v]} and {@code found[v]} are the frame state of each vertex on it.
     */
    private void circuit() {
        stack.push(start);
        blocked[start] = true;
        cursor[start] = 0;
        found[start] = false;

        while (!stack.isEmpty()) {
            int v = stack.peek();
            if (cycles.size() < limit && cursor[v] < adjacency[v].length) {
                int w = adjacency[v][cursor[v]++];
                if (!allowed.get(w)) {
                    continue;
                }
                if (w == start) {
                    emitCycle();
                    found[v] = true;
                } else if (!blocked[w]) {
                    stack.push(w);
                    blocked[w] = true;
                    cursor[w] = 0;
                    found[w] = false;
                }
                continue;
            }

            if (found[v]) {
                unblock(v);
            } else {
                for (int w : adjacency[v]) {
                    if (allowed.get(w)) {
                        blockedBy.get(w).add(v);
                    }
                }
            }
            stack.pop();
            if (found[v] && !stack.isEmpty()) {
                found[stack.peek()] = true;
            }
        }
    }

    private void unblock(int u) {
        blocked[u] = false;
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(u);
        while (!pending.isEmpty()) {
            Set<Integer> waiting = blockedBy.get(pending.pop());
            for (int w : waiting) {
                if (blocked[w]) {
                    blocked[w] = false;
                    pending.push(w);
                }
            }
            waiting.clear();
        }
    }

    private void emitCycle() {
        List<String> cycle = new ArrayList<>(stack.size());
        for (int v : stack) {
            cycle.add(names[v]);
        }
        // stack iterates top-first
        Collections.reverse(cycle);
        cycles.add(List.copyOf(cycle));
    }

    /**
     * Whether a cycle through {@code v} may use only vertices {@code >= v}: it needs
     * both a successor and a predecessor in that range and in the same component.
     */
    private boolean onSomeCycle(int v) {
        return hasNeighbourFrom(adjacency[v], v) && hasNeighbourFrom(reverse[v], v);
    }

    private boolean hasNeighbourFrom(int[] neighbours, int v) {
        int c = componentOf[v];
        for (int w : neighbours) {
            if (w >= v && componentOf[w] == c) {
                return true;
            }
        }
        return false;
    }

    private boolean hasSelfLoop(int v) {
        return Arrays.binarySearch(adjacency[v], v) >= 0;
    }

    /**
     * Vertices of the strongly connected component containing {@code s}
     * in the subgraph induced by vertices {@code >= s}.
     */
    private BitSet componentFrom(int s) {
        int c = componentOf[s];
        BitSet forward = new BitSet(names.length);
        Deque<Integer> queue = new ArrayDeque<>();
        forward.set(s);
        queue.add(s);
        while (!queue.isEmpty()) {
            int v = queue.poll();
            for (int w : adjacency[v]) {
                if (w >= s && componentOf[w] == c && !forward.get(w)) {
                    forward.set(w);
                    queue.add(w);
                }
            }
        }

        BitSet result = new BitSet(names.length);
        result.set(s);
        queue.add(s);
        while (!queue.isEmpty()) {
            int v = queue.poll();
            for (int u : reverse[v]) {
                if (forward.get(u) && !result.get(u)) {
                    result.set(u);
                    queue.add(u);
                }
            }
        }
        return result;
    }

    private static int[][] invert(int[][] adjacency) {
        int n = adjacency.length;
        int[] inDegree = new int[n];
        for (int[] targets : adjacency) {
            for (int w : targets) {
                inDegree[w]++;
            }
        }
        int[][] reversed = new int[n][];
        for (int i = 0; i < n; i++) {
            reversed[i] = new int[inDegree[i]];
        }
        int[] fill = new int[n];
        for (int v = 0; v < n; v++) {
            for (int w : adjacency[v]) {
                reversed[w][fill[w]++] = v;
            }
        }
        return reversed;
    }

    /**
     * Iterative Tarjan; returns a component id per vertex.
     */
    static final class StronglyConnected {

        private final int[][] adjacency;

        StronglyConnected(int[][] adjacency) {
            this.adjacency = adjacency;
        }

        int[] components() {
            int n = adjacency.length;
            int[] index = new int[n];
            int[] low = new int[n];
            int[] component = new int[n];
            boolean[] onStack = new boolean[n];
            Arrays.fill(index, -1);
            Deque<Integer> sccStack = new ArrayDeque<>();
            int[] edgeCursor = new int[n];
            int counter = 0;
            int componentCount = 0;

            for (int root = 0; root < n; root++) {
                if (index[root] != -1) {
                    continue;
                }
                Deque<Integer> callStack = new ArrayDeque<>();
                callStack.push(root);
                index[root] = low[root] = counter++;
                sccStack.push(root);
                onStack[root] = true;

                while (!callStack.isEmpty()) {
                    int v = callStack.peek();
                    if (edgeCursor[v] < adjacency[v].length) {
                        int w = adjacency[v][edgeCursor[v]++];
                        if (index[w] == -1) {
                            index[w] = low[w] = counter++;
                            sccStack.push(w);
                            onStack[w] = true;
                            callStack.push(w);
                        } else if (onStack[w]) {
                            low[v] = Math.min(low[v], index[w]);
                        }
                        continue;
                    }
                    callStack.pop();
                    if (!callStack.isEmpty()) {
                        int parent = callStack.peek();
                        low[parent] = Math.min(low[parent], low[v]);
                    }
                    if (low[v] == index[v]) {
                        int w;
                        do {
                            w = sccStack.pop();
                            onStack[w] = false;
                            component[w] = componentCount;
                        } while (w != v);
                        componentCount++;
                    }
                }
            }
            return component;
        }
    }
}
