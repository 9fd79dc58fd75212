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

/// Spread centrality: how much the largest adjacency eigenvalue, which bounds the epidemic
/// threshold, drops when a single vertex is removed.
///
/// This costs one eigen decomposition per vertex.
final class SpreadCentrality implements CentralityFunction {

    @Override
    public double[] compute(ContactGraph graph) {
        int n = graph.size();
        double[] scores = new double[n];
        if (!graph.hasEdges()) {
            return scores;
        }
        double[][] adjacency = AdjacencySpectrum.adjacencyMatrix(graph);
        double full = AdjacencySpectrum.largestEigenvalue(adjacency);
        for (int i = 0; i < n; i++) {
            if (graph.degree(i) == 0) {
                continue;
            }
            double reduced = AdjacencySpectrum.largestEigenvalue(AdjacencySpectrum.minor(adjacency, i));
            scores[i] = AdjacencySpectrum.snap(full - reduced);
        }
        return scores;
    }
}
