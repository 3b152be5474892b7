package com.vertexcover;

/**
 * Observer called once at the end of every iteration, including iterations
 * where no move was available. The state must not be mutated.
 */
@FunctionalInterface
public interface IterationListener<V> {
    void onIteration(int iteration, CoverState<V> current, int bestCovered, double temperature);

    static <V> IterationListener<V> none() {
        return (i, current, best, t) -> { };
    }
}
