package com.vertexcover;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only undirected graph view used by the search.
 *
 * Vertices keep their insertion order; that order is the tie-break order for
 * degree-biased moves. Parallel edges collapse to one. Internally every vertex
 * and edge also has a dense index so the cover state can work on int arrays.
 */
public final class Graph<V> {

    private final List<V> vertices;
    private final Map<V, Integer> indexOf;
    private final List<Edge<V>> edges;
    private final int[] edgeU;       // endpoint indices per edge
    private final int[] edgeV;
    private final int[][] incident;  // edge indices per vertex (self-loop listed once)
    private final int[] degree;

    private Graph(List<V> vertices, List<Edge<V>> edges) {
        this.vertices = Collections.unmodifiableList(vertices);
        this.edges = Collections.unmodifiableList(edges);
        this.indexOf = new HashMap<>(vertices.size() * 2);
        for (int i = 0; i < vertices.size(); i++) indexOf.put(vertices.get(i), i);

        final int n = vertices.size(), m = edges.size();
        edgeU = new int[m];
        edgeV = new int[m];
        degree = new int[n];
        int[] incCount = new int[n];
        for (int e = 0; e < m; e++) {
            Edge<V> edge = edges.get(e);
            int a = indexOf.get(edge.getU());
            int b = indexOf.get(edge.getV());
            edgeU[e] = a;
            edgeV[e] = b;
            // a self-loop adds 2 to the degree, as usual
            degree[a]++;
            degree[b]++;
            incCount[a]++;
            if (a != b) incCount[b]++;
        }
        incident = new int[n][];
        for (int i = 0; i < n; i++) incident[i] = new int[incCount[i]];
        int[] fill = new int[n];
        for (int e = 0; e < m; e++) {
            int a = edgeU[e], b = edgeV[e];
            incident[a][fill[a]++] = e;
            if (a != b) incident[b][fill[b]++] = e;
        }
    }

    public List<V> nodes() { return vertices; }
    public List<Edge<V>> edges() { return edges; }
    public int vertexCount() { return vertices.size(); }
    public int edgeCount() { return edges.size(); }

    public int degree(V v) {
        return degree[index(v)];
    }

    int index(V v) {
        Integer i = indexOf.get(v);
        if (i == null) throw new IllegalArgumentException("Unknown vertex: " + v);
        return i;
    }

    V vertexAt(int i) { return vertices.get(i); }
    int degreeAt(int i) { return degree[i]; }
    int edgeU(int e) { return edgeU[e]; }
    int edgeV(int e) { return edgeV[e]; }
    int[] incidentEdges(int vertexIndex) { return incident[vertexIndex]; }

    public static <V> Builder<V> builder() { return new Builder<>(); }

    /** Convenience for tests and small callers: a graph made of the given edges. */
    @SafeVarargs
    public static <V> Graph<V> of(Edge<V>... edges) {
        Builder<V> b = new Builder<>();
        for (Edge<V> e : edges) b.addEdge(e.getU(), e.getV());
        return b.build();
    }

    public static final class Builder<V> {
        private final Set<V> vertices = new LinkedHashSet<>();
        private final Set<Edge<V>> edges = new LinkedHashSet<>();

        public Builder<V> addVertex(V v) {
            vertices.add(Objects.requireNonNull(v, "vertex"));
            return this;
        }

        /** Adds an undirected edge, declaring missing endpoints. Duplicates are ignored. */
        public Builder<V> addEdge(V u, V v) {
            addVertex(u);
            addVertex(v);
            edges.add(new Edge<>(u, v));
            return this;
        }

        public Graph<V> build() {
            return new Graph<>(new ArrayList<>(vertices), new ArrayList<>(edges));
        }
    }

    @Override
    public String toString() {
        return "Graph[n=" + vertices.size() + ", m=" + edges.size() + "]";
    }
}
