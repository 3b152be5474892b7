package com.vertexcover;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class BatchRunnerTest {

    private Path dir;

    @BeforeEach
    public void setUp() throws IOException {
        dir = Files.createTempDirectory("batch");
        Files.writeString(dir.resolve("cycle.edges"), "1 2\n2 3\n3 4\n4 1\n");
        Files.writeString(dir.resolve("star.edges"), "c l1\nc l2\nc l3\nc l4\nc l5\n");
    }

    @AfterEach
    public void tearDown() throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            for (Path p : (Iterable<Path>) files::iterator) Files.deleteIfExists(p);
        }
        Files.deleteIfExists(dir);
    }

    @Test
    public void readsJobFileRelativeToItsDirectory() throws IOException {
        Path jobs = dir.resolve("jobs.txt");
        Files.writeString(jobs, "# name path maxNode\ncycle cycle.edges 2\n\nstar star.edges 1\n");
        List<BatchJob> list = BatchJob.readJobs(jobs);
        assertEquals(2, list.size());
        assertEquals("cycle", list.get(0).getName());
        assertEquals(dir.resolve("cycle.edges").toAbsolutePath(), list.get(0).getPath());
        assertEquals(1, list.get(1).getMaxNode());
    }

    @Test
    public void badJobLineFails() throws IOException {
        Path jobs = dir.resolve("jobs.txt");
        Files.writeString(jobs, "cycle cycle.edges two\n");
        assertThrows(IOException.class, () -> BatchJob.readJobs(jobs));
    }

    @Test
    public void jobNameDropsExtension() {
        assertEquals("yeast", BatchJob.forFile(Path.of("data", "yeast.gexf"), 763).getName());
    }

    @Test
    public void runsJobsInOrderOnAPool() throws InterruptedException {
        List<BatchJob> jobs = List.of(
                new BatchJob("cycle", dir.resolve("cycle.edges"), 2),
                new BatchJob("star", dir.resolve("star.edges"), 1),
                new BatchJob("too-big", dir.resolve("star.edges"), 10),
                new BatchJob("missing", dir.resolve("nope.edges"), 1),
                new BatchJob("zero", dir.resolve("star.edges"), 0));
        AnnealParams.Builder template = AnnealParams.builder().maxIteration(300).seed(7);
        List<BatchRunner.Result> results = new BatchRunner(template, 3).run(jobs);

        assertEquals(5, results.size());
        assertEquals("cycle", results.get(0).name);
        assertEquals(4, results.get(0).outcome.getCoveredEdges());
        assertEquals(List.of("c"), results.get(1).outcome.getCover());
        assertFalse(results.get(2).isSuccess());
        assertTrue(results.get(2).error.contains("exceeds"));
        assertFalse(results.get(3).isSuccess());
        assertFalse(results.get(4).isSuccess());
    }

    @Test
    public void callerTemplateKeepsItsSettings() throws InterruptedException {
        AnnealParams.Builder template = AnnealParams.builder().maxNode(3).maxIteration(100);
        BatchRunner runner = new BatchRunner(template, 2);
        template.maxIteration(0);
        List<BatchRunner.Result> results = runner.run(List.of(
                new BatchJob("cycle", dir.resolve("cycle.edges"), 2),
                new BatchJob("star", dir.resolve("star.edges"), 1)));
        assertEquals(3, template.maxNode());
        assertEquals(2, results.get(0).maxNode);
        assertEquals(100, results.get(0).outcome.getStats().iterations);
    }

    @Test
    public void sequentialAndPooledRunsAgree() throws InterruptedException {
        List<BatchJob> jobs = List.of(
                new BatchJob("cycle", dir.resolve("cycle.edges"), 2),
                new BatchJob("star", dir.resolve("star.edges"), 2));
        List<BatchRunner.Result> one = new BatchRunner(AnnealParams.builder().seed(3), 1).run(jobs);
        List<BatchRunner.Result> two = new BatchRunner(AnnealParams.builder().seed(3), 2).run(jobs);
        for (int i = 0; i < jobs.size(); i++) {
            assertEquals(one.get(i).outcome.getCover(), two.get(i).outcome.getCover());
        }
    }

    @Test
    public void writesOneBlockPerGraph() throws InterruptedException {
        List<BatchRunner.Result> results = new BatchRunner(AnnealParams.builder(), 1).run(List.of(
                new BatchJob("star", dir.resolve("star.edges"), 1),
                new BatchJob("missing", dir.resolve("nope.edges"), 1)));
        StringWriter sw = new StringWriter();
        BatchRunner.writeResults(results, new PrintWriter(sw), true);
        String out = sw.toString();
        assertTrue(out.contains("Graph: star"));
        assertTrue(out.contains("Covered Edges: 5 Edges"));
        assertTrue(out.contains("Runtime: "));
        assertTrue(out.contains("Vertex Cover: [c]"));
        assertTrue(out.contains("Graph: missing"));
        assertTrue(out.contains("Error: cannot read"));
    }
}
