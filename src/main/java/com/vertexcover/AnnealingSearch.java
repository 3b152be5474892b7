package com.vertexcover;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulated-annealing search for a fixed-size vertex set covering as many
 * edges as possible.
 *
 * One call is one run: it owns its cover state, scheduler and random source,
 * so separate calls can run on separate threads. The returned cover is the
 * best one seen, which is not necessarily where the walk ended.
 *
 * Per iteration:
 * <ol>
 *   <li>stop if the stagnation budget is spent, the iteration budget is spent,
 *       or the time limit has passed;</li>
 *   <li>propose a swap; with no non-member left, just cool and go on;</li>
 *   <li>score the candidate incrementally and ask the scheduler, comparing
 *       against the best score (or the current one, if so configured);</li>
 *   <li>on accept, apply the swap; a strictly better score replaces the best
 *       snapshot and resets stagnation, anything else counts as stagnation;</li>
 *   <li>cool.</li>
 * </ol>
 */
public final class AnnealingSearch {

    private static final Logger log = LoggerFactory.getLogger(AnnealingSearch.class);

    public <V> SearchOutcome<V> search(Graph<V> graph, AnnealParams params) {
        return search(graph, params, new Random(params.seed), IterationListener.none());
    }

    public <V> SearchOutcome<V> search(Graph<V> graph, AnnealParams params, Random rng) {
        return search(graph, params, rng, IterationListener.none());
    }

    public <V> SearchOutcome<V> search(Graph<V> graph, AnnealParams params, Random rng,
                                       IterationListener<V> listener) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(rng, "rng");
        Objects.requireNonNull(listener, "listener");
        checkPreconditions(graph, params);

        log.debug("Starting search on {} with {}", graph, params);

        final CoverState<V> current = CoverState.random(graph, params.maxNode, rng);
        final MoveGenerator<V> generator = params.movePolicy.newGenerator(graph);
        final AnnealingScheduler scheduler = AnnealingScheduler.from(params);
        final boolean againstBest = params.deltaReference == AnnealParams.DeltaReference.BEST;
        final boolean countRejections = params.stagnationPolicy == AnnealParams.StagnationPolicy.ALL_NON_IMPROVING;
        final int earlyStop = params.earlyStop.orElse(Integer.MAX_VALUE);
        final boolean timed = params.timeLimitMillis > 0;
        final long limitNanos = TimeUnit.MILLISECONDS.toNanos(params.timeLimitMillis);   // saturates
        final long start = System.nanoTime();

        List<V> best = current.members();
        int bestCovered = current.coveredEdges();
        int stagnation = 0;
        int i = 0;

        SearchStats st = new SearchStats();
        st.initialCovered = bestCovered;

        while (true) {
            if (stagnation >= earlyStop) { st.stopReason = SearchStats.StopReason.EARLY_STOP; break; }
            if (i >= params.maxIteration) { st.stopReason = SearchStats.StopReason.MAX_ITERATIONS; break; }
            if (timed && System.nanoTime() - start >= limitNanos) {
                st.stopReason = SearchStats.StopReason.TIME_LIMIT;
                break;
            }

            Optional<Move<V>> proposed = generator.propose(current, rng);
            if (proposed.isPresent()) {
                Move<V> move = proposed.get();
                int candidateCovered = current.coveredEdges() + current.delta(move);
                int reference = againstBest ? bestCovered : current.coveredEdges();

                if (scheduler.accept(candidateCovered - reference, rng)) {
                    current.apply(move);
                    st.accepted++;
                    if (candidateCovered > bestCovered) {
                        best = current.members();
                        bestCovered = candidateCovered;
                        stagnation = 0;
                        st.improvements++;
                        if (log.isTraceEnabled())
                            log.trace("iteration {}: {} improves best to {}", i, move, bestCovered);
                    } else {
                        stagnation++;
                    }
                } else {
                    st.rejected++;
                    if (countRejections) stagnation++;
                }
            } else {
                st.noMoveIterations++;
            }

            scheduler.cool(i);
            listener.onIteration(i, current, bestCovered, scheduler.temperature());
            i++;
        }

        st.iterations = i;
        st.stagnation = stagnation;
        st.finalTemperature = scheduler.temperature();
        log.info("Search stopped ({}) after {} iterations: covered {}/{} edges with {} vertices",
                st.stopReason, i, bestCovered, graph.edgeCount(), params.maxNode);
        log.debug("{}", st);

        return new SearchOutcome<>(best, bestCovered, st);
    }

    private static void checkPreconditions(Graph<?> graph, AnnealParams params) {
        if (graph.vertexCount() == 0)
            throw new DegenerateGraphException("Graph has no vertices");
        if (params.maxNode > graph.vertexCount())
            throw new InvalidParameterException("Max_Node " + params.maxNode
                    + " exceeds vertex count " + graph.vertexCount());
    }
}
