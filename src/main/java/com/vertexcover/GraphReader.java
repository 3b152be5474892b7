package com.vertexcover;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;

import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads undirected graphs with string vertex ids.
 *
 * Two formats are understood, picked by file extension:
 * <ul>
 *   <li>{@code .gexf}: GEXF XML, read with a streaming StAX parser. Only
 *       {@code node/@id} and {@code edge/@source,@target} are used; directed
 *       and parallel edges collapse to one undirected edge.</li>
 *   <li>anything else: an edge list. One {@code u v} pair per line; a single
 *       token declares an isolated vertex; blank lines and lines starting with
 *       {@code #} or {@code *} are comments.</li>
 * </ul>
 */
public final class GraphReader {

    private static final Logger log = LoggerFactory.getLogger(GraphReader.class);

    private static final ThreadLocal<XMLInputFactory2> FACTORY = ThreadLocal.withInitial(() -> {
        XMLInputFactory2 f = (XMLInputFactory2) XMLInputFactory.newInstance();
        f.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        f.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        f.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
        f.setXMLResolver((publicId, systemId, baseURI, ns) -> null);
        return f;
    });

    private GraphReader() {}

    public static Graph<String> readFromFile(String filename) throws IOException {
        return readFromFile(Paths.get(filename));
    }

    public static Graph<String> readFromFile(Path path) throws IOException {
        Graph<String> g;
        try {
            if (path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".gexf")) {
                try (InputStream in = Files.newInputStream(path)) {
                    g = readGexf(in);
                }
            } else {
                try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                    g = readEdgeList(br);
                }
            }
        } catch (NoSuchFileException e) {
            throw new FileNotFoundException(path.toString());
        }
        log.debug("Read {} from {}", g, path);
        return g;
    }

    public static Graph<String> readEdgeList(Reader reader) throws IOException {
        BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        Graph.Builder<String> b = Graph.builder();
        String line;
        int lineNo = 0;
        while ((line = br.readLine()) != null) {
            lineNo++;
            String t = line.trim();
            if (t.isEmpty() || t.startsWith("#") || t.startsWith("*")) continue;
            String[] tok = t.split("\\s+");
            switch (tok.length) {
                case 1: b.addVertex(tok[0]); break;
                case 2: b.addEdge(tok[0], tok[1]); break;
                default:
                    throw new IOException("Line " + lineNo + ": expected 'u v' or a single vertex, got: " + t);
            }
        }
        return b.build();
    }

    public static Graph<String> readGexf(InputStream in) throws IOException {
        XMLStreamReader2 r = null;
        try {
            r = (XMLStreamReader2) FACTORY.get().createXMLStreamReader(in);
            Graph.Builder<String> b = Graph.builder();
            Set<String> declared = new HashSet<>();
            boolean sawGraph = false;

            while (r.hasNext()) {
                if (r.next() != XMLStreamConstants.START_ELEMENT) continue;
                switch (r.getLocalName()) {
                    case "graph":
                        sawGraph = true;
                        break;
                    case "node": {
                        String id = requireAttribute(r, "id");
                        declared.add(id);
                        b.addVertex(id);
                        break;
                    }
                    case "edge": {
                        String s = requireAttribute(r, "source");
                        String t = requireAttribute(r, "target");
                        if (!declared.contains(s) || !declared.contains(t))
                            throw new IOException("Edge " + s + "->" + t + " references an undeclared node"
                                    + at(r));
                        b.addEdge(s, t);
                        break;
                    }
                    default:
                        break;
                }
            }
            if (!sawGraph) throw new IOException("No <graph> element found");
            return b.build();
        } catch (XMLStreamException e) {
            throw new IOException("Malformed GEXF: " + e.getMessage(), e);
        } finally {
            if (r != null) {
                try {
                    r.closeCompletely();
                } catch (XMLStreamException e) {
                    log.warn("Failed to close GEXF reader", e);
                }
            }
        }
    }

    private static String requireAttribute(XMLStreamReader2 r, String name) throws IOException {
        String v = r.getAttributeValue(null, name);
        if (v == null || v.isBlank())
            throw new IOException("<" + r.getLocalName() + "> without '" + name + "' attribute" + at(r));
        return v.trim();
    }

    private static String at(XMLStreamReader2 r) {
        return r.getLocation() != null ? " (line " + r.getLocation().getLineNumber() + ")" : "";
    }
}
