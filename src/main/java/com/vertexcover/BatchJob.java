package com.vertexcover;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** One named graph to search, with its own cover size. */
public final class BatchJob {
    private final String name;
    private final Path path;
    private final int maxNode;

    public BatchJob(String name, Path path, int maxNode) {
        this.name = Objects.requireNonNull(name, "name");
        this.path = Objects.requireNonNull(path, "path");
        this.maxNode = maxNode;
    }

    public String getName() { return name; }
    public Path getPath() { return path; }
    public int getMaxNode() { return maxNode; }

    /** Job named after the file, without its extension. */
    public static BatchJob forFile(Path path, int maxNode) {
        String base = path.getFileName().toString();
        int dot = base.lastIndexOf('.');
        if (dot > 0) base = base.substring(0, dot);
        return new BatchJob(base, path, maxNode);
    }

    /**
     * Reads {@code name path maxNode} lines. Relative paths resolve against the
     * job file's directory; {@code #} starts a comment line.
     */
    public static List<BatchJob> readJobs(Path jobFile) throws IOException {
        Path dir = jobFile.toAbsolutePath().getParent();
        List<BatchJob> jobs = new ArrayList<>();
        try (BufferedReader br = Files.newBufferedReader(jobFile, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                String t = line.trim();
                if (t.isEmpty() || t.startsWith("#")) continue;
                String[] tok = t.split("\\s+");
                if (tok.length != 3)
                    throw new IOException(jobFile + ":" + lineNo + ": expected 'name path maxNode', got: " + t);
                int maxNode;
                try {
                    maxNode = Integer.parseInt(tok[2]);
                } catch (NumberFormatException e) {
                    throw new IOException(jobFile + ":" + lineNo + ": bad maxNode '" + tok[2] + "'", e);
                }
                Path p = Path.of(tok[1]);
                if (!p.isAbsolute() && dir != null) p = dir.resolve(p);
                jobs.add(new BatchJob(tok[0], p, maxNode));
            }
        }
        return jobs;
    }

    @Override
    public String toString() {
        return name + "(" + path + ", maxNode=" + maxNode + ")";
    }
}
