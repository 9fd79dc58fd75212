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

/// Source of centrality scores for the vaccination selector.
///
/// A provider must be pure: it may be called once per selection round on successively
/// reduced graphs and must not cache scores across graphs.
@FunctionalInterface
public interface CentralityProvider {

    CentralityScores compute(ContactGraph graph, CentralityMeasure measure);

    /// The provider backed by the functions bound to each [CentralityMeasure].
    static CentralityProvider standard() {
        return (graph, measure) -> measure.compute(graph);
    }
}
