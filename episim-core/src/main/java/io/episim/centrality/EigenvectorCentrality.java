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

final class EigenvectorCentrality implements CentralityFunction {

    @Override
    public double[] compute(ContactGraph graph) {
        double[] scores = new double[graph.size()];
        if (!graph.hasEdges()) {
            return scores;
        }
        double[] vector = AdjacencySpectrum.leadingEigenvector(AdjacencySpectrum.adjacencyMatrix(graph));
        for (int i = 0; i < scores.length; i++) {
            scores[i] = AdjacencySpectrum.snap(vector[i]);
        }
        return scores;
    }
}
