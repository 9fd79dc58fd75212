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

import java.util.Arrays;

/// Brandes' betweenness for unweighted, undirected graphs.
///
/// Each unordered pair of endpoints is counted once, so a path centre on a 3-vertex line
/// scores 1.
final class BetweennessCentrality implements CentralityFunction {

    @Override
    public double[] compute(ContactGraph graph) {
        int n = graph.size();
        double[] scores = new double[n];
        int[] distance = new int[n];
        double[] sigma = new double[n];
        double[] delta = new double[n];
        int[] stack = new int[n];
        int[] queue = new int[n];

        for (int s = 0; s < n; s++) {
            Arrays.fill(distance, -1);
            Arrays.fill(sigma, 0.0d);
            Arrays.fill(delta, 0.0d);
            distance[s] = 0;
            sigma[s] = 1.0d;
            int head = 0;
            int tail = 0;
            int depth = 0;
            queue[tail++] = s;
            while (head < tail) {
                int v = queue[head++];
                stack[depth++] = v;
                for (int k = 0; k < graph.degree(v); k++) {
                    int w = graph.neighbor(v, k);
                    if (distance[w] < 0) {
                        distance[w] = distance[v] + 1;
                        queue[tail++] = w;
                    }
                    if (distance[w] == distance[v] + 1) {
                        sigma[w] += sigma[v];
                    }
                }
            }
            // predecessors of w are exactly the neighbours one step closer to s
            while (depth > 0) {
                int w = stack[--depth];
                for (int k = 0; k < graph.degree(w); k++) {
                    int v = graph.neighbor(w, k);
                    if (distance[v] == distance[w] - 1) {
                        delta[v] += (sigma[v] / sigma[w]) * (1.0d + delta[w]);
                    }
                }
                if (w != s) {
                    scores[w] += delta[w];
                }
            }
        }
        // dependency sums accumulate in source order, so tied vertices differ in the last bits
        for (int i = 0; i < n; i++) {
            scores[i] = AdjacencySpectrum.snap(scores[i] / 2.0d);
        }
        return scores;
    }
}
