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

package io.episim.command.common;

import io.episim.graph.ContactGraph;
import io.episim.graph.GraphFormat;
import io.episim.graph.GraphLoader;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Shared graph file parameter with optional inline format specification.
 * All supporting types are inner classes for self-contained encapsulation.
 */
public class GraphFileOption {

    /**
     * Immutable graph file specification with an optional explicit format.
     * Supports paths with an inline format suffix in the form {@code path/to/graph:format}.
     * <p>
     * Examples:
     * <ul>
     *   <li>{@code karate.gml} - format chosen from the extension</li>
     *   <li>{@code contacts.dat:edgelist} - read as an edge list regardless of extension</li>
     *   <li>{@code export.txt:gml} - read as GML</li>
     * </ul>
     *
     * @param path   the graph file path (never null)
     * @param format the explicit format, or null to choose from the extension
     */
    public record GraphFile(Path path, GraphFormat format) {

        /**
         * Compact constructor with validation.
         */
        public GraphFile {
            if (path == null) {
                throw new IllegalArgumentException("Graph path cannot be null");
            }
        }

        /**
         * Gets the format to read with, falling back to the file extension.
         */
        public GraphFormat effectiveFormat() {
            return format != null ? format : GraphFormat.forPath(path);
        }

        /**
         * Checks that the graph file exists.
         */
        public void validate() {
            if (!Files.exists(path)) {
                throw new IllegalStateException("Graph file does not exist: " + path);
            }
        }

        @Override
        public String toString() {
            if (format != null) {
                return path + " (" + format.name().toLowerCase(Locale.ROOT) + ")";
            }
            return path.toString();
        }
    }

    /**
     * Picocli type converter for {@link GraphFile} specifications.
     */
    public static class GraphFileConverter implements CommandLine.ITypeConverter<GraphFile> {

        @Override
        public GraphFile convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new IllegalArgumentException("Graph file path cannot be empty");
            }

            // Skip a Windows drive letter (e.g. "C:") before looking for the format suffix
            int searchStart = value.length() >= 2 && value.charAt(1) == ':' ? 2 : 0;
            int colonIndex = value.indexOf(':', searchStart);
            if (colonIndex == -1) {
                return new GraphFile(Paths.get(value), null);
            }
            String formatName = value.substring(colonIndex + 1);
            return new GraphFile(Paths.get(value.substring(0, colonIndex)), GraphFormat.fromName(formatName));
        }
    }

    @CommandLine.Parameters(
        index = "0",
        paramLabel = "GRAPH",
        description = "The contact graph file (.gml or edge list). Append ':gml' or ':edgelist' to force a format",
        converter = GraphFileConverter.class
    )
    private GraphFile graphFile;

    /**
     * Gets the graph file path.
     */
    public Path getGraphPath() {
        return graphFile != null ? graphFile.path() : null;
    }

    /**
     * Validates and loads the graph.
     *
     * @throws IOException if the file cannot be read
     */
    public ContactGraph load() throws IOException {
        if (graphFile == null) {
            throw new IllegalStateException("Graph file is required");
        }
        graphFile.validate();
        return new GraphLoader().load(graphFile.path(), graphFile.effectiveFormat());
    }

    @Override
    public String toString() {
        return graphFile != null ? graphFile.toString() : "null";
    }
}
