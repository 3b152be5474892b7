package com.vertexcover;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Current candidate solution: exactly {@code size()} member vertices plus the
 * cached number of covered edges.
 *
 * Members and non-members live in two dense index arrays so a uniform pick
 * from either side is O(1), and each edge keeps a count of its member
 * endpoints so a swap only touches the edges incident to the two vertices.
 */
public final class CoverState<V> {

    private final Graph<V> graph;
    private final int[] members;
    private final int[] nonMembers;
    private final int[] pos;          // slot of each vertex in members[] or nonMembers[]
    private final boolean[] inCover;
    private final int[] edgeHits;     // member endpoints per edge
    private int covered;

    private CoverState(Graph<V> graph, int[] order, int k) {
        final int n = graph.vertexCount();
        this.graph = graph;
        this.members = new int[k];
        this.nonMembers = new int[n - k];
        this.pos = new int[n];
        this.inCover = new boolean[n];
        for (int i = 0; i < n; i++) {
            int v = order[i];
            if (i < k) {
                members[i] = v;
                pos[v] = i;
                inCover[v] = true;
            } else {
                nonMembers[i - k] = v;
                pos[v] = i - k;
            }
        }
        this.edgeHits = new int[graph.edgeCount()];
        for (int e = 0; e < edgeHits.length; e++) {
            int a = graph.edgeU(e), b = graph.edgeV(e);
            int hits = inCover[a] ? 1 : 0;
            if (b != a && inCover[b]) hits++;
            edgeHits[e] = hits;
            if (hits > 0) covered++;
        }
    }

    /** Uniformly random {@code k}-subset of the graph's vertices. */
    public static <V> CoverState<V> random(Graph<V> graph, int k, Random rng) {
        final int n = graph.vertexCount();
        if (k < 0 || k > n) throw new IllegalArgumentException("cover size " + k + " outside [0," + n + "]");
        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) order.add(i);
        Collections.shuffle(order, rng);
        int[] a = new int[n];
        for (int i = 0; i < n; i++) a[i] = order.get(i);
        return new CoverState<>(graph, a, k);
    }

    /** State holding exactly the given vertices. */
    public static <V> CoverState<V> of(Graph<V> graph, Iterable<V> cover) {
        final int n = graph.vertexCount();
        boolean[] chosen = new boolean[n];
        int k = 0;
        for (V v : cover) {
            int i = graph.index(v);
            if (!chosen[i]) { chosen[i] = true; k++; }
        }
        int[] a = new int[n];
        int head = 0, tail = k;
        for (int i = 0; i < n; i++) {
            if (chosen[i]) a[head++] = i; else a[tail++] = i;
        }
        return new CoverState<>(graph, a, k);
    }

    public Graph<V> graph() { return graph; }
    public int size() { return members.length; }
    public int coveredEdges() { return covered; }
    public int nonMemberCount() { return nonMembers.length; }

    public boolean contains(V v) { return inCover[graph.index(v)]; }

    /** Snapshot of the members, in slot order. */
    public List<V> members() {
        List<V> out = new ArrayList<>(members.length);
        for (int v : members) out.add(graph.vertexAt(v));
        return out;
    }

    int memberAt(int slot) { return members[slot]; }
    int nonMemberAt(int slot) { return nonMembers[slot]; }
    boolean isMember(int vertexIndex) { return inCover[vertexIndex]; }
    int edgeHits(int e) { return edgeHits[e]; }

    /** Change in covered edges if {@code move} were applied. Does not mutate. */
    public int delta(Move<V> move) {
        return CoverageEvaluator.swapDelta(this, move.outIndex(), move.inIndex());
    }

    /** Swaps {@code move.out()} for {@code move.in()} in place, keeping the cached count exact. */
    public void apply(Move<V> move) {
        final int out = move.outIndex(), in = move.inIndex();
        if (!inCover[out] || inCover[in])
            throw new IllegalStateException("Move " + move + " does not fit the current cover");

        for (int e : graph.incidentEdges(out)) {
            if (--edgeHits[e] == 0) covered--;
        }
        for (int e : graph.incidentEdges(in)) {
            if (edgeHits[e]++ == 0) covered++;
        }

        int outSlot = pos[out], inSlot = pos[in];
        members[outSlot] = in;
        pos[in] = outSlot;
        nonMembers[inSlot] = out;
        pos[out] = inSlot;
        inCover[out] = false;
        inCover[in] = true;
    }

    @Override
    public String toString() {
        return "CoverState[size=" + members.length + ", covered=" + covered + "]";
    }
}
