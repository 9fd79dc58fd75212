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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/// An immutable, undirected contact graph.
///
/// Vertices are opaque string identifiers kept in load order; each vertex is also
/// addressed by its position in that order (its index). Neighbour lists are sorted by
/// index, which gives every traversal over the graph a fixed, reproducible order.
///
/// Vaccination never mutates a graph. [#without(Collection)] derives the induced
/// subgraph on the vertices that remain.
public final class ContactGraph {

    private final String name;
    private final List<String> vertices;
    private final Map<String, Integer> indexById;
    private final int[][] adjacency;
    private final int edgeCount;

    private ContactGraph(String name, List<String> vertices, Map<String, Integer> indexById, int[][] adjacency) {
        this.name = name;
        this.vertices = Collections.unmodifiableList(vertices);
        this.indexById = Collections.unmodifiableMap(indexById);
        this.adjacency = adjacency;
        int degreeSum = 0;
        for (int[] neighbors : adjacency) {
            degreeSum += neighbors.length;
        }
        this.edgeCount = degreeSum / 2;
    }

    /// Starts building a graph with the given name.
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    /// @return the vertex identifiers in index order
    public List<String> vertices() {
        return vertices;
    }

    public int size() {
        return vertices.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean hasEdges() {
        return edgeCount > 0;
    }

    public boolean contains(String vertex) {
        return indexById.containsKey(vertex);
    }

    /// @return the index of the vertex, or -1 if it is not in this graph
    public int indexOf(String vertex) {
        Integer index = indexById.get(vertex);
        return index != null ? index : -1;
    }

    public String vertexAt(int index) {
        return vertices.get(index);
    }

    public int degree(int index) {
        return adjacency[index].length;
    }

    /// @return the index of the n-th neighbour of the vertex at `index`, in ascending index order
    public int neighbor(int index, int n) {
        return adjacency[index][n];
    }

    /// @return a copy of the neighbour indices of the vertex at `index`
    public int[] neighbors(int index) {
        return adjacency[index].clone();
    }

    public boolean adjacent(String a, String b) {
        int ia = indexOf(a);
        int ib = indexOf(b);
        if (ia < 0 || ib < 0) {
            return false;
        }
        return Arrays.binarySearch(adjacency[ia], ib) >= 0;
    }

    /// Derives the induced subgraph on every vertex not listed in `removed`.
    ///
    /// Retained vertices keep their relative order. Identifiers in `removed` that are not
    /// part of this graph are ignored.
    ///
    /// @param removed the vertices to drop, together with their incident edges
    /// @return a new graph; this graph is left untouched
    public ContactGraph without(Collection<String> removed) {
        if (removed.isEmpty()) {
            return this;
        }
        Set<String> drop = removed instanceof Set ? (Set<String>) removed : new HashSet<>(removed);
        int[] remap = new int[vertices.size()];
        List<String> kept = new ArrayList<>(vertices.size());
        Map<String, Integer> keptIndex = new HashMap<>();
        for (int i = 0; i < vertices.size(); i++) {
            String vertex = vertices.get(i);
            if (drop.contains(vertex)) {
                remap[i] = -1;
            } else {
                remap[i] = kept.size();
                keptIndex.put(vertex, kept.size());
                kept.add(vertex);
            }
        }
        int[][] reduced = new int[kept.size()][];
        for (int i = 0; i < vertices.size(); i++) {
            if (remap[i] < 0) {
                continue;
            }
            int[] source = adjacency[i];
            int[] target = new int[source.length];
            int count = 0;
            for (int neighbor : source) {
                if (remap[neighbor] >= 0) {
                    target[count++] = remap[neighbor];
                }
            }
            reduced[remap[i]] = Arrays.copyOf(target, count);
        }
        return new ContactGraph(name, kept, keptIndex, reduced);
    }

    @Override
    public String toString() {
        return "ContactGraph{" + name + ", vertices=" + size() + ", edges=" + edgeCount + "}";
    }

    /// Collects vertices and edges, then freezes them into a [ContactGraph].
    ///
    /// Duplicate vertices and edges to unknown vertices are rejected with
    /// [GraphInconsistencyException]. Repeated edges collapse into one, and self loops are
    /// dropped.
    public static final class Builder {
        private static final Logger logger = LogManager.getLogger(Builder.class);

        private final String name;
        private final Map<String, Integer> indexById = new LinkedHashMap<>();
        private final List<String> vertices = new ArrayList<>();
        private final List<TreeSet<Integer>> neighbors = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        /// Adds a new vertex; fails if the identifier was already added.
        public Builder addVertex(String vertex) {
            if (vertex == null || vertex.isEmpty()) {
                throw new GraphInconsistencyException("Vertex identifier must not be empty");
            }
            if (indexById.containsKey(vertex)) {
                throw new GraphInconsistencyException("Duplicate vertex identifier '" + vertex + "'");
            }
            indexById.put(vertex, vertices.size());
            vertices.add(vertex);
            neighbors.add(new TreeSet<>());
            return this;
        }

        /// Adds the vertex unless it is already present.
        public Builder ensureVertex(String vertex) {
            if (!indexById.containsKey(vertex)) {
                addVertex(vertex);
            }
            return this;
        }

        public boolean hasVertex(String vertex) {
            return indexById.containsKey(vertex);
        }

        /// Adds an undirected edge between two vertices that were already added.
        public Builder addEdge(String a, String b) {
            Integer ia = indexById.get(a);
            Integer ib = indexById.get(b);
            if (ia == null || ib == null) {
                throw new GraphInconsistencyException(
                    "Edge (" + a + ", " + b + ") references unknown vertex '" + (ia == null ? a : b) + "'");
            }
            if (ia.equals(ib)) {
                logger.warn("Ignoring self loop on vertex '{}' in graph '{}'", a, name);
                return this;
            }
            neighbors.get(ia).add(ib);
            neighbors.get(ib).add(ia);
            return this;
        }

        public ContactGraph build() {
            int[][] adjacency = new int[vertices.size()][];
            for (int i = 0; i < adjacency.length; i++) {
                adjacency[i] = neighbors.get(i).stream().mapToInt(Integer::intValue).toArray();
            }
            return new ContactGraph(name, new ArrayList<>(vertices), new HashMap<>(indexById), adjacency);
        }
    }
}
