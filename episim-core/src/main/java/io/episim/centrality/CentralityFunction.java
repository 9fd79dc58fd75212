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

/// Computes one score per vertex of a graph.
///
/// Implementations must not modify the graph and must return a finite value for every
/// vertex, using 0 where the measure is undefined (isolated vertices, edgeless graphs).
@FunctionalInterface
public interface CentralityFunction {

    /// @return scores indexed like [ContactGraph#vertices()]
    double[] compute(ContactGraph graph);
}
