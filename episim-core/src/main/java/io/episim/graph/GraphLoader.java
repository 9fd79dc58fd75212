/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.episim.graph;

import io.episim.api.GraphInconsistencyException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/// Reads contact graphs from GML files or plain edge lists.
///
/// The GML reader understands the subset igraph and networkx write: a top level
/// `graph [ ... ]` list holding `node [ id .. label .. ]` and
/// `edge [ source .. target .. ]` entries. A node is identified by its `label` when it has
/// one and by its `id` otherwise. Any other key is skipped, including nested lists.
///
/// Every structural problem surfaces as [GraphInconsistencyException] before the graph is
/// handed to the rest of the pipeline.
public class GraphLoader {
    private static final Logger logger = LogManager.getLogger(GraphLoader.class);

    /// Loads a graph, choosing the format from the file extension.
    public ContactGraph load(Path path) throws IOException {
        return load(path, GraphFormat.forPath(path));
    }

    /// Loads a graph in the given format. The graph is named after the file, without its extension.
    public ContactGraph load(Path path, GraphFormat format) throws IOException {
        String name = baseName(path);
        logger.debug("Loading {} graph '{}' from {}", format, name, path);
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            ContactGraph graph = read(name, reader, format);
            logger.info("Loaded graph '{}' with {} vertices and {} edges", name, graph.size(), graph.edgeCount());
            return graph;
        }
    }

    /// Parses a graph from text, mostly for tests and embedded fixtures.
    public ContactGraph parse(String name, String text, GraphFormat format) {
        try {
            return read(name, new StringReader(text), format);
        } catch (IOException e) {
            throw new GraphInconsistencyException("Unable to read graph text for '" + name + "'", e);
        }
    }

    private ContactGraph read(String name, Reader reader, GraphFormat format) throws IOException {
        switch (format) {
            case GML:
                return readGml(name, reader);
            case EDGELIST:
                return readEdgeList(name, reader);
            default:
                throw new IllegalStateException("Unhandled graph format " + format);
        }
    }

    private ContactGraph readEdgeList(String name, Reader reader) throws IOException {
        ContactGraph.Builder builder = ContactGraph.builder(name);
        BufferedReader lines = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        String line;
        int lineNumber = 0;
        while ((line = lines.readLine()) != null) {
            lineNumber++;
            int comment = line.indexOf('#');
            if (comment >= 0) {
                line = line.substring(0, comment);
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] fields = line.split("[\\s,]+");
            if (fields.length == 1) {
                builder.ensureVertex(fields[0]);
            } else if (fields.length == 2) {
                builder.ensureVertex(fields[0]).ensureVertex(fields[1]).addEdge(fields[0], fields[1]);
            } else {
                throw new GraphInconsistencyException(
                    "Line " + lineNumber + " of '" + name + "' has " + fields.length + " fields, expected 1 or 2");
            }
        }
        return builder.build();
    }

    private ContactGraph readGml(String name, Reader reader) throws IOException {
        GmlTokenizer tokens = new GmlTokenizer(reader);
        Map<String, Object> root = tokens.readList(false);
        Object graphEntry = root.get("graph");
        if (!(graphEntry instanceof GmlList)) {
            throw new GraphInconsistencyException("GML input for '" + name + "' has no 'graph [ ... ]' section");
        }
        GmlList graph = (GmlList) graphEntry;
        if ("1".equals(graph.scalar("directed"))) {
            logger.debug("Graph '{}' is declared directed; edges are treated as undirected", name);
        }

        ContactGraph.Builder builder = ContactGraph.builder(name);
        Map<String, String> vertexByNodeId = new HashMap<>();
        for (GmlList node : graph.lists("node")) {
            String id = node.scalar("id");
            if (id == null) {
                throw new GraphInconsistencyException("GML node without an id in '" + name + "'");
            }
            if (vertexByNodeId.containsKey(id)) {
                throw new GraphInconsistencyException("Duplicate GML node id " + id + " in '" + name + "'");
            }
            String label = node.scalar("label");
            String vertex = label != null ? label : id;
            builder.addVertex(vertex);
            vertexByNodeId.put(id, vertex);
        }
        for (GmlList edge : graph.lists("edge")) {
            String source = edge.scalar("source");
            String target = edge.scalar("target");
            if (source == null || target == null) {
                throw new GraphInconsistencyException("GML edge without source or target in '" + name + "'");
            }
            String a = vertexByNodeId.get(source);
            String b = vertexByNodeId.get(target);
            if (a == null || b == null) {
                throw new GraphInconsistencyException(
                    "GML edge (" + source + ", " + target + ") references unknown node id " + (a == null ? source : target)
                        + " in '" + name + "'");
            }
            builder.addEdge(a, b);
        }
        return builder.build();
    }

    private static String baseName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /// The ordered key/value pairs of one GML list. Keys repeat, so values are kept per key.
    private static final class GmlList extends HashMap<String, Object> {
        private final Map<String, List<Object>> all = new HashMap<>();

        void add(String key, Object value) {
            putIfAbsent(key, value);
            all.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        }

        String scalar(String key) {
            Object value = get(key);
            return value instanceof String ? (String) value : null;
        }

        List<GmlList> lists(String key) {
            List<GmlList> result = new ArrayList<>();
            for (Object value : all.getOrDefault(key, List.of())) {
                if (value instanceof GmlList) {
                    result.add((GmlList) value);
                }
            }
            return result;
        }
    }

    private static final class GmlTokenizer {
        private static final Pattern INTEGRAL = Pattern.compile("-?\\d+(\\.0*)?");

        private final Reader reader;
        private int peeked = -2;

        GmlTokenizer(Reader reader) {
            this.reader = reader;
        }

        GmlList readList(boolean nested) throws IOException {
            GmlList list = new GmlList();
            while (true) {
                String key = next();
                if (key == null) {
                    if (nested) {
                        throw new GraphInconsistencyException("Unterminated GML list");
                    }
                    return list;
                }
                if ("]".equals(key)) {
                    if (!nested) {
                        throw new GraphInconsistencyException("Unbalanced ']' in GML input");
                    }
                    return list;
                }
                String value = next();
                if (value == null) {
                    throw new GraphInconsistencyException("GML key '" + key + "' has no value");
                }
                if ("[".equals(value)) {
                    list.add(key, readList(true));
                } else {
                    list.add(key, normalize(value));
                }
            }
        }

        private String next() throws IOException {
            int c = skipWhitespaceAndComments();
            if (c < 0) {
                return null;
            }
            if (c == '[' || c == ']') {
                return String.valueOf((char) c);
            }
            StringBuilder token = new StringBuilder();
            if (c == '"') {
                token.append('"');
                while ((c = read()) >= 0 && c != '"') {
                    token.append((char) c);
                }
                if (c < 0) {
                    throw new GraphInconsistencyException("Unterminated string in GML input");
                }
                return token.append('"').toString();
            }
            token.append((char) c);
            while ((c = read()) >= 0 && !Character.isWhitespace(c) && c != '[' && c != ']') {
                token.append((char) c);
            }
            if (c >= 0) {
                peeked = c;
            }
            return token.toString();
        }

        private int skipWhitespaceAndComments() throws IOException {
            int c = read();
            while (c >= 0) {
                if (c == '#') {
                    while ((c = read()) >= 0 && c != '\n') {
                        // skip to end of line
                    }
                } else if (Character.isWhitespace(c)) {
                    c = read();
                } else {
                    return c;
                }
            }
            return -1;
        }

        private int read() throws IOException {
            if (peeked != -2) {
                int c = peeked;
                peeked = -2;
                return c;
            }
            return reader.read();
        }

        /// Strips quotes from strings and writes integral numbers like `3.0` as `3`.
        private static String normalize(String value) {
            if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                return value.substring(1, value.length() - 1);
            }
            if (INTEGRAL.matcher(value).matches()) {
                int dot = value.indexOf('.');
                return dot >= 0 ? value.substring(0, dot) : value;
            }
            return value;
        }
    }
}
