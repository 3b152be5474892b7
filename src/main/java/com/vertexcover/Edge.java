package com.vertexcover;

import java.util.Objects;

/** Unordered pair of vertices. {@code (u,v)} and {@code (v,u)} are the same edge. */
public final class Edge<V> {
    private final V u;
    private final V v;

    public Edge(V u, V v) {
        this.u = Objects.requireNonNull(u, "u");
        this.v = Objects.requireNonNull(v, "v");
    }

    public V getU() { return u; }
    public V getV() { return v; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge<?> e = (Edge<?>) o;
        return (u.equals(e.u) && v.equals(e.v)) || (u.equals(e.v) && v.equals(e.u));
    }

    @Override
    public int hashCode() {
        // symmetric in the endpoints
        return u.hashCode() + v.hashCode();
    }

    @Override
    public String toString() {
        return "(" + u + "," + v + ")";
    }
}
