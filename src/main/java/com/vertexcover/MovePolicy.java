package com.vertexcover;

/** How the added vertex of a swap is chosen. */
public enum MovePolicy {
    DEGREE_BIASED,
    UNIFORM;

    public <V> MoveGenerator<V> newGenerator(Graph<V> graph) {
        switch (this) {
            case DEGREE_BIASED: return new DegreeBiasedMoveGenerator<>(graph);
            case UNIFORM: return new UniformMoveGenerator<>();
            default: throw new IllegalStateException("Unknown policy: " + this);
        }
    }
}
