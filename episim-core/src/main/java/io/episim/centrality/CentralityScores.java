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

package io.episim.centrality;

import io.episim.graph.ContactGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Centrality scores for one graph snapshot.
///
/// Scores are only meaningful for the graph they were computed on; they are never
/// carried over to a derived graph.
public final class CentralityScores {

    private final ContactGraph graph;
    private final CentralityMeasure measure;
    private final double[] values;

    public CentralityScores(ContactGraph graph, CentralityMeasure measure, double[] values) {
        if (values.length != graph.size()) {
            throw new IllegalArgumentException(
                "Expected " + graph.size() + " scores for graph '" + graph.name() + "', got " + values.length);
        }
        this.graph = graph;
        this.measure = measure;
        this.values = values.clone();
    }

    /// Scores of zero for every vertex, used once a graph has no edges left.
    public static CentralityScores zero(ContactGraph graph, CentralityMeasure measure) {
        return new CentralityScores(graph, measure, new double[graph.size()]);
    }

    public ContactGraph graph() {
        return graph;
    }

    public CentralityMeasure measure() {
        return measure;
    }

    public double scoreAt(int index) {
        return values[index];
    }

    /// @throws IllegalArgumentException if the vertex is not part of the scored graph
    public double score(String vertex) {
        int index = graph.indexOf(vertex);
        if (index < 0) {
            throw new IllegalArgumentException("Vertex '" + vertex + "' is not part of graph '" + graph.name() + "'");
        }
        return values[index];
    }

    /// @return vertex to score, in graph order
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(graph.vertexAt(i), values[i]);
        }
        return Collections.unmodifiableMap(map);
    }

    /// Orders vertices by score descending, breaking ties by identifier ascending.
    public List<String> ranking() {
        List<Integer> order = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            order.add(i);
        }
        order.sort(rankComparator());
        List<String> ranked = new ArrayList<>(order.size());
        for (Integer index : order) {
            ranked.add(graph.vertexAt(index));
        }
        return ranked;
    }

    /// @return the highest ranked vertex, or null for an empty graph
    public String top() {
        int best = -1;
        Comparator<Integer> comparator = rankComparator();
        for (int i = 0; i < values.length; i++) {
            if (best < 0 || comparator.compare(i, best) < 0) {
                best = i;
            }
        }
        return best < 0 ? null : graph.vertexAt(best);
    }

    private Comparator<Integer> rankComparator() {
        return Comparator.<Integer>comparingDouble(i -> values[i]).reversed()
            .thenComparing(graph::vertexAt);
    }
}
