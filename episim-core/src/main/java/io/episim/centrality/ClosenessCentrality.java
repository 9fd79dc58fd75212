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

/// Closeness over the component each vertex belongs to: `(reached - 1) / sum(distance)`,
/// then scaled by `1 / n` for the whole graph. Isolated vertices score 0.
final class ClosenessCentrality implements CentralityFunction {

    @Override
    public double[] compute(ContactGraph graph) {
        int n = graph.size();
        double[] scores = new double[n];
        int[] distance = new int[n];
        int[] queue = new int[n];
        for (int source = 0; source < n; source++) {
            Arrays.fill(distance, -1);
            distance[source] = 0;
            int head = 0;
            int tail = 0;
            queue[tail++] = source;
            long total = 0;
            while (head < tail) {
                int v = queue[head++];
                total += distance[v];
                for (int k = 0; k < graph.degree(v); k++) {
                    int w = graph.neighbor(v, k);
                    if (distance[w] < 0) {
                        distance[w] = distance[v] + 1;
                        queue[tail++] = w;
                    }
                }
            }
            int reached = tail;
            scores[source] = total == 0 ? 0.0d : ((reached - 1) / (double) total) / n;
        }
        return scores;
    }
}
