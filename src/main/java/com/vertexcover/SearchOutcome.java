package com.vertexcover;

import java.util.Collections;
import java.util.List;

/** Best cover seen during a run, with the run's counters. */
public final class SearchOutcome<V> {
    private final List<V> cover;
    private final int coveredEdges;
    private final SearchStats stats;

    SearchOutcome(List<V> cover, int coveredEdges, SearchStats stats) {
        this.cover = Collections.unmodifiableList(cover);
        this.coveredEdges = coveredEdges;
        this.stats = stats;
    }

    public List<V> getCover() { return cover; }
    public int getCoveredEdges() { return coveredEdges; }
    public SearchStats getStats() { return stats; }

    @Override
    public String toString() {
        return "SearchOutcome{covered=" + coveredEdges + ", cover=" + cover + "}";
    }
}
