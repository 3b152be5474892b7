package com.vertexcover;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Counts edges with at least one endpoint in a vertex set.
 *
 * {@link #countCovered} is the O(M) reference count. {@link #swapDelta} is the
 * incremental form the search uses; both must agree on every state.
 */
public final class CoverageEvaluator {

    private CoverageEvaluator() {}

    public static <V> int countCovered(Collection<V> members, Graph<V> graph) {
        Set<V> cover = members instanceof Set ? (Set<V>) members : new HashSet<>(members);
        int count = 0;
        for (Edge<V> e : graph.edges()) {
            if (cover.contains(e.getU()) || cover.contains(e.getV())) count++;
        }
        return count;
    }

    /**
     * Change in covered edges when member {@code out} is replaced by non-member {@code in}.
     * An edge is lost only if {@code out} was its sole member endpoint and it does not touch
     * {@code in}; an edge is gained only if it touches {@code in} and had no member endpoint.
     */
    static <V> int swapDelta(CoverState<V> state, int out, int in) {
        final Graph<V> g = state.graph();
        int lost = 0;
        for (int e : g.incidentEdges(out)) {
            if (state.edgeHits(e) == 1 && g.edgeU(e) != in && g.edgeV(e) != in) lost++;
        }
        int gained = 0;
        for (int e : g.incidentEdges(in)) {
            if (state.edgeHits(e) == 0) gained++;
        }
        return gained - lost;
    }
}
