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

import io.episim.api.InvalidParameterException;
import io.episim.graph.ContactGraph;

import java.util.Locale;

/// The supported centrality measures, each bound to the function that computes it.
public enum CentralityMeasure {
    /// Number of neighbours
    DEGREE("degree", new DegreeCentrality()),
    /// Inverse mean distance to reachable vertices, scaled by 1/n
    CLOSENESS("closeness", new ClosenessCentrality()),
    /// Share of shortest paths passing through a vertex (Brandes)
    BETWEENNESS("betweenness", new BetweennessCentrality()),
    /// Leading eigenvector of the adjacency matrix
    EIGENVECTOR("eigenvector", new EigenvectorCentrality()),
    /// Drop in the leading adjacency eigenvalue when the vertex is removed
    SPREAD("spread", new SpreadCentrality());

    private final String label;
    private final CentralityFunction function;

    CentralityMeasure(String label, CentralityFunction function) {
        this.label = label;
        this.function = function;
    }

    /// Looks up a measure by its lower case name, ignoring case.
    ///
    /// @throws InvalidParameterException for any other name
    public static CentralityMeasure fromName(String name) {
        if (name != null) {
            String wanted = name.trim().toLowerCase(Locale.ROOT);
            for (CentralityMeasure measure : values()) {
                if (measure.label.equals(wanted)) {
                    return measure;
                }
            }
        }
        throw InvalidParameterException.unknownName("centrality", name, values());
    }

    public String label() {
        return label;
    }

    public CentralityScores compute(ContactGraph graph) {
        return new CentralityScores(graph, this, function.compute(graph));
    }

    @Override
    public String toString() {
        return label;
    }
}
