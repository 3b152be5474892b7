package com.vertexcover;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;
import java.util.*;

public class AnnealingSearchTest {

    private final AnnealingSearch search = new AnnealingSearch();

    @Test
    public void cycleOfFourIsFullyCoveredByTwoOppositeVertices() {
        Graph<Integer> g = TestGraphs.cycle4();
        for (long seed = 1; seed <= 10; seed++) {
            AnnealParams p = AnnealParams.builder().maxNode(2).maxIteration(200).seed(seed).build();
            SearchOutcome<Integer> out = search.search(g, p);
            assertEquals(4, out.getCoveredEdges(), "seed " + seed);
            Set<Integer> cover = new HashSet<>(out.getCover());
            assertTrue(cover.equals(Set.of(1, 3)) || cover.equals(Set.of(2, 4)), "cover " + cover);
        }
    }

    @Test
    public void cycleOfFourWithBaselineVariant() {
        Graph<Integer> g = TestGraphs.cycle4();
        AnnealParams p = AnnealParams.builder().baseline().maxNode(2).maxIteration(200).seed(3).build();
        assertEquals(4, search.search(g, p).getCoveredEdges());
    }

    @Test
    public void starConvergesToItsCenter() {
        Graph<String> g = TestGraphs.star5();
        for (long seed = 1; seed <= 10; seed++) {
            SearchOutcome<String> out = search.search(g, AnnealParams.builder().maxNode(1).seed(seed).build());
            assertEquals(List.of("c"), out.getCover(), "seed " + seed);
            assertEquals(5, out.getCoveredEdges());
        }
        SearchOutcome<String> uniform = search.search(g,
                AnnealParams.builder().baseline().maxNode(1).maxIteration(300).seed(4).build());
        assertEquals(List.of("c"), uniform.getCover());
    }

    @Test
    public void invariantsHoldOnEveryIteration() {
        Graph<Integer> g = TestGraphs.random(40, 120, 21L);
        for (AnnealParams p : List.of(
                AnnealParams.builder().maxNode(10).seed(5).build(),
                AnnealParams.builder().baseline().maxNode(10).seed(5).build(),
                AnnealParams.builder().maxNode(10).seed(5).deltaReference(AnnealParams.DeltaReference.CURRENT).build())) {
            int[] lastBest = {-1};
            int[] calls = {0};
            SearchOutcome<Integer> out = search.search(g, p, new Random(p.seed), (i, current, best, t) -> {
                assertEquals(calls[0]++, i);
                assertEquals(10, current.size());
                assertEquals(10, new HashSet<>(current.members()).size());
                assertEquals(CoverageEvaluator.countCovered(current.members(), g), current.coveredEdges());
                assertTrue(best >= lastBest[0], "best covered decreased at iteration " + i);
                assertTrue(best >= current.coveredEdges());
                assertTrue(t >= 0.0);
                lastBest[0] = best;
            });
            assertEquals(out.getStats().iterations, calls[0]);
            assertEquals(10, out.getCover().size());
            assertEquals(lastBest[0], out.getCoveredEdges());
            assertEquals(CoverageEvaluator.countCovered(out.getCover(), g), out.getCoveredEdges());
            SearchStats st = out.getStats();
            assertEquals(st.iterations, st.accepted + st.rejected + st.noMoveIterations);
        }
    }

    @Test
    public void fixedSeedIsDeterministic() {
        Graph<Integer> g = TestGraphs.random(60, 150, 99L);
        AnnealParams p = AnnealParams.builder().maxNode(15).seed(1234).build();
        SearchOutcome<Integer> a = search.search(g, p);
        SearchOutcome<Integer> b = search.search(g, p);
        assertEquals(a.getCover(), b.getCover());
        assertEquals(a.getCoveredEdges(), b.getCoveredEdges());
        assertEquals(a.getStats().iterations, b.getStats().iterations);
    }

    @Test
    public void fullCoverCoversEverythingAndNeverMoves() {
        Graph<Integer> g = TestGraphs.random(8, 15, 4L);
        AnnealParams p = AnnealParams.builder().maxNode(g.vertexCount()).maxIteration(50).build();
        SearchOutcome<Integer> out = search.search(g, p);
        assertEquals(g.edgeCount(), out.getCoveredEdges());
        assertEquals(50, out.getStats().noMoveIterations);
        assertEquals(0, out.getStats().accepted + out.getStats().rejected);
        assertEquals(SearchStats.StopReason.MAX_ITERATIONS, out.getStats().stopReason);
    }

    @Test
    public void zeroIterationsReturnsInitialSample() {
        Graph<Integer> g = TestGraphs.random(30, 70, 8L);
        AnnealParams p = AnnealParams.builder().maxNode(7).maxIteration(0).seed(77).build();
        SearchOutcome<Integer> out = search.search(g, p);

        CoverState<Integer> initial = CoverState.random(g, 7, new Random(77));
        assertEquals(initial.members(), out.getCover());
        assertEquals(initial.coveredEdges(), out.getCoveredEdges());
        assertEquals(out.getStats().initialCovered, out.getCoveredEdges());
        assertEquals(0, out.getStats().iterations);
    }

    @Test
    public void bestIsKeptWhenTheWalkLeavesIt() {
        // constant, very high temperature: almost every worsening move is taken
        Graph<String> g = TestGraphs.star5();
        AnnealParams p = AnnealParams.builder().maxNode(1).initialTemp(1e9)
                .coolingLaw(CoolingLaw.GEOMETRIC).coolingRate(1.0).earlyStop(20).seed(2).build();
        SearchOutcome<String> out = search.search(g, p);
        assertEquals(SearchStats.StopReason.EARLY_STOP, out.getStats().stopReason);
        assertTrue(out.getStats().iterations < 1500);
        assertEquals(List.of("c"), out.getCover());
        assertEquals(5, out.getCoveredEdges());
    }

    @Test
    public void rejectionsCountTowardStagnationOnlyWhenConfigured() {
        Graph<String> g = TestGraphs.star5();
        AnnealParams all = AnnealParams.builder().maxNode(1).seed(6)
                .stagnationPolicy(AnnealParams.StagnationPolicy.ALL_NON_IMPROVING).build();
        SearchOutcome<String> out = search.search(g, all);
        assertEquals(SearchStats.StopReason.EARLY_STOP, out.getStats().stopReason);
        assertTrue(out.getStats().iterations <= 151, "iterations " + out.getStats().iterations);
        assertEquals(5, out.getCoveredEdges());

        // rejected moves alone never stop a run under the default policy
        AnnealParams cold = AnnealParams.builder().maxNode(1).seed(6).initialTemp(1e-300)
                .maxIteration(400).build();
        SearchOutcome<String> coldOut = search.search(g, cold);
        assertEquals(SearchStats.StopReason.MAX_ITERATIONS, coldOut.getStats().stopReason);
        assertEquals(400, coldOut.getStats().iterations);
    }

    @Test
    public void timeLimitStopsTheRun() {
        Graph<Integer> g = TestGraphs.random(50, 100, 3L);
        AnnealParams p = AnnealParams.builder().maxNode(10).noEarlyStop().maxIteration(Integer.MAX_VALUE)
                .timeLimitMillis(50).build();
        SearchOutcome<Integer> out = search.search(g, p);
        assertEquals(SearchStats.StopReason.TIME_LIMIT, out.getStats().stopReason);
    }

    @Test
    public void hugeTimeLimitDoesNotStopTheRun() {
        AnnealParams p = AnnealParams.builder().maxNode(2).maxIteration(100).noEarlyStop()
                .timeLimitMillis(Long.MAX_VALUE).build();
        SearchOutcome<Integer> out = search.search(TestGraphs.cycle4(), p);
        assertEquals(SearchStats.StopReason.MAX_ITERATIONS, out.getStats().stopReason);
        assertEquals(100, out.getStats().iterations);
        assertEquals(4, out.getCoveredEdges());
    }

    @Test
    public void preconditionsFailBeforeSearching() {
        Graph<Integer> empty = Graph.<Integer>builder().build();
        assertThrows(DegenerateGraphException.class, () -> search.search(empty, AnnealParams.improved(1)));
        assertThrows(InvalidParameterException.class,
                () -> search.search(TestGraphs.cycle4(), AnnealParams.improved(5)));
    }

    @Test
    public void graphWithoutEdgesCoversNothing() {
        Graph<String> g = Graph.<String>builder().addVertex("x").addVertex("y").addVertex("z").build();
        SearchOutcome<String> out = search.search(g, AnnealParams.builder().maxNode(2).maxIteration(20).build());
        assertEquals(0, out.getCoveredEdges());
        assertEquals(2, out.getCover().size());
    }
}
