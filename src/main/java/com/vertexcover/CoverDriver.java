package com.vertexcover;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one CLI invocation: parse options, collect the jobs, search every
 * graph and print the results block per graph.
 *
 * Exit codes: 0 all jobs succeeded, 1 I/O error or a failed job,
 * 2 bad arguments, -1 unexpected failure.
 */
public final class CoverDriver {

    private static final Logger log = LoggerFactory.getLogger(CoverDriver.class);

    private final PrintWriter out;
    private final PrintStream err;

    public CoverDriver() {
        this(new PrintWriter(System.out, true), System.err);
    }

    public CoverDriver(PrintWriter out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public int run(String[] args) {
        OptionsParser.Parsed parsed;
        try {
            parsed = OptionsParser.parse(args);
            // surface parameter errors before any file is read; job files bring their own Max_Node
            AnnealParams.Builder check = parsed.params.copy();
            if (parsed.inputPaths.isEmpty()) check.maxNode(1);
            check.build();
        } catch (IllegalArgumentException e) {
            usage();
            err.println("Argument error: " + e.getMessage());
            return 2;
        }

        try {
            List<BatchJob> jobs = new ArrayList<>();
            if (parsed.jobsFile != null) jobs.addAll(BatchJob.readJobs(Paths.get(parsed.jobsFile)));
            for (String p : parsed.inputPaths) {
                jobs.add(BatchJob.forFile(Paths.get(p), parsed.params.maxNode()));
            }
            log.debug("Running {} job(s) on {} thread(s)", jobs.size(), parsed.threads);

            List<BatchRunner.Result> results = new BatchRunner(parsed.params, parsed.threads).run(jobs);
            BatchRunner.writeResults(results, out, parsed.printCover);
            return results.stream().allMatch(BatchRunner.Result::isSuccess) ? 0 : 1;
        } catch (FileNotFoundException e) {
            err.println("File not found: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("*interrupted");
            return -1;
        } catch (RuntimeException e) {
            log.error("Unrecoverable error", e);
            err.println("*unrecoverable error: " + e.getMessage());
            return -1;
        }
    }


    private void usage() {
        err.println(
                "Usage: vertex-cover [options] <graph-file>...\n" +
                        "       vertex-cover [options] -jobs <job-file>\n" +
                        "Graph files: .gexf, or an edge list ('u v' per line)\n" +
                        "Job file lines: <name> <graph-file> <maxNode>\n" +
                        "Options:\n" +
                        "  -maxnode N        cover size (required for graph files)\n" +
                        "  -baseline         baseline variant: uniform moves, geometric 0.95, no early stop\n" +
                        "  -temp T           initial temperature (1500)\n" +
                        "  -cooling R        cooling rate in (0,1] (0.9, baseline 0.95)\n" +
                        "  -iterations N     max iterations (1500)\n" +
                        "  -earlystop N|off  stop after N accepted non-improving moves (150)\n" +
                        "  -policy degree|uniform      added-vertex choice\n" +
                        "  -law geometric|decay        cooling law\n" +
                        "  -delta best|current         acceptance compares with best or current score\n" +
                        "  -stagnation accepted|all    which non-improving moves count toward early stop\n" +
                        "  -seed N           random seed (1)\n" +
                        "  -timelimit MS     wall-clock limit per run (0 = none)\n" +
                        "  -threads N        run graphs in parallel\n" +
                        "  -printcover       print the cover of each graph\n"
        );
    }
}
