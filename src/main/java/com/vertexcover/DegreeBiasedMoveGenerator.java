package com.vertexcover;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Optional;
import java.util.Random;

/**
 * Improved policy: the added vertex is the non-member of maximum degree,
 * ties going to the vertex that comes first in graph order.
 *
 * Vertices are pre-sorted by (degree desc, graph order asc), so the pick is
 * the first non-member in that list.
 */
public final class DegreeBiasedMoveGenerator<V> implements MoveGenerator<V> {

    private final Graph<V> graph;
    private final int[] byDegree;

    public DegreeBiasedMoveGenerator(Graph<V> graph) {
        this.graph = graph;
        Integer[] idx = new Integer[graph.vertexCount()];
        for (int i = 0; i < idx.length; i++) idx[i] = i;
        // Arrays.sort on objects is stable, so equal degrees keep graph order
        Arrays.sort(idx, Comparator.comparingInt((Integer i) -> graph.degreeAt(i)).reversed());
        this.byDegree = new int[idx.length];
        for (int i = 0; i < idx.length; i++) byDegree[i] = idx[i];
    }

    @Override
    public Optional<Move<V>> propose(CoverState<V> current, Random rng) {
        if (current.graph() != graph)
            throw new IllegalArgumentException("Cover state belongs to a different graph");
        if (current.nonMemberCount() == 0 || current.size() == 0) return Optional.empty();
        int out = MoveGenerator.pickOut(current, rng);
        for (int v : byDegree) {
            if (!current.isMember(v)) return Optional.of(Move.of(graph, out, v));
        }
        return Optional.empty();
    }
}
