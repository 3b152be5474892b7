package com.vertexcover;

import java.util.Optional;
import java.util.Random;

/**
 * Proposes a single swap against the current cover. The removed vertex is
 * always a uniformly random member; implementations differ in how the added
 * non-member is chosen.
 */
public interface MoveGenerator<V> {

    /** @return the proposed move, or empty when every vertex is already a member */
    Optional<Move<V>> propose(CoverState<V> current, Random rng);

    static <V> int pickOut(CoverState<V> current, Random rng) {
        return current.memberAt(rng.nextInt(current.size()));
    }
}
