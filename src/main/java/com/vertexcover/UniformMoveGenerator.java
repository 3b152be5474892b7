package com.vertexcover;

import java.util.Optional;
import java.util.Random;

/** Baseline policy: the added vertex is uniform over the non-members. */
public final class UniformMoveGenerator<V> implements MoveGenerator<V> {

    @Override
    public Optional<Move<V>> propose(CoverState<V> current, Random rng) {
        if (current.nonMemberCount() == 0 || current.size() == 0) return Optional.empty();
        int out = MoveGenerator.pickOut(current, rng);
        int in = current.nonMemberAt(rng.nextInt(current.nonMemberCount()));
        return Optional.of(Move.of(current.graph(), out, in));
    }
}
