package com.vertexcover;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one independent search per named graph and collects the results in
 * job order. Runs share nothing but the parameter template; with more than one
 * thread they go to a fixed pool.
 */
public final class BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    public static final class Result {
        public final String name;
        public final int maxNode;
        public final SearchOutcome<String> outcome;   // null when the job failed
        public final double seconds;
        public final String error;

        private Result(String name, int maxNode, SearchOutcome<String> outcome, double seconds, String error) {
            this.name = name;
            this.maxNode = maxNode;
            this.outcome = outcome;
            this.seconds = seconds;
            this.error = error;
        }

        public boolean isSuccess() { return outcome != null; }
    }

    private final AnnealParams.Builder template;
    private final int threads;
    private final AnnealingSearch search = new AnnealingSearch();

    /** {@code template} supplies every parameter except the per-job cover size. */
    public BatchRunner(AnnealParams.Builder template, int threads) {
        this.template = template.copy();
        this.threads = Math.max(1, threads);
    }

    public List<Result> run(List<BatchJob> jobs) throws InterruptedException {
        List<Callable<Result>> tasks = new ArrayList<>(jobs.size());
        for (BatchJob job : jobs) {
            try {
                AnnealParams params = template.copy().maxNode(job.getMaxNode()).build();
                tasks.add(() -> runOne(job, params));
            } catch (InvalidParameterException e) {
                tasks.add(() -> failed(job, e.getMessage()));
            }
        }

        if (threads == 1 || tasks.size() <= 1) {
            List<Result> out = new ArrayList<>(tasks.size());
            for (Callable<Result> t : tasks) out.add(call(t));
            return out;
        }

        AtomicInteger n = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, tasks.size()), r -> {
            Thread t = new Thread(r, "cover-search-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<Result>> futures = pool.invokeAll(tasks);
            List<Result> out = new ArrayList<>(futures.size());
            for (Future<Result> f : futures) {
                try {
                    out.add(f.get());
                } catch (ExecutionException e) {
                    throw new IllegalStateException("Search task failed", e.getCause());
                }
            }
            return out;
        } finally {
            pool.shutdownNow();
        }
    }

    private Result runOne(BatchJob job, AnnealParams params) {
        Graph<String> graph;
        try {
            graph = GraphReader.readFromFile(job.getPath());
        } catch (IOException e) {
            return failed(job, "cannot read " + job.getPath() + ": " + e.getMessage());
        }
        try {
            long t0 = System.nanoTime();
            SearchOutcome<String> outcome = search.search(graph, params);
            double secs = (System.nanoTime() - t0) / 1_000_000_000.0;
            log.info("{}: covered {} of {} edges in {}s", job.getName(),
                    outcome.getCoveredEdges(), graph.edgeCount(), String.format(Locale.ROOT, "%.3f", secs));
            return new Result(job.getName(), job.getMaxNode(), outcome, secs, null);
        } catch (IllegalArgumentException e) {
            return failed(job, e.getMessage());
        }
    }

    private static Result failed(BatchJob job, String message) {
        log.warn("{} failed: {}", job.getName(), message);
        return new Result(job.getName(), job.getMaxNode(), null, 0.0, message);
    }

    private static Result call(Callable<Result> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Search task failed", e);
        }
    }

    /** Prints one block per graph; failed jobs print their error instead. */
    public static void writeResults(List<Result> results, PrintWriter out, boolean printCover) {
        for (Result r : results) {
            out.println("Graph: " + r.name);
            if (r.isSuccess()) {
                out.println("Covered Edges: " + r.outcome.getCoveredEdges() + " Edges");
                out.printf(Locale.ROOT, "Runtime: %.6f seconds%n", r.seconds);
                if (printCover) out.println("Vertex Cover: " + r.outcome.getCover());
            } else {
                out.println("Error: " + r.error);
            }
            out.println();
        }
        out.flush();
    }
}
