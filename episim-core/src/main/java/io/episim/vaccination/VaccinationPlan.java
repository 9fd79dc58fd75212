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

package io.episim.vaccination;

import io.episim.api.InvalidParameterException;
import io.episim.centrality.CentralityMeasure;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// The vertices to vaccinate, in the order they were selected.
///
/// A plan is created once per simulation configuration and excluded from the graph for
/// every trial of that configuration.
///
/// @param vertices distinct vertex identifiers in selection order
/// @param measure  the centrality that ranked them, or null for an empty plan without selection
/// @param strategy the strategy that picked them, or null for an empty plan without selection
public record VaccinationPlan(List<String> vertices, CentralityMeasure measure, SelectionStrategy strategy) {

    public static final int DEFAULT_PERCENT = 50;

    public VaccinationPlan {
        vertices = List.copyOf(vertices);
        if (new LinkedHashSet<>(vertices).size() != vertices.size()) {
            throw new IllegalArgumentException("Vaccination plan contains duplicate vertices: " + vertices);
        }
    }

    /// A plan that vaccinates nobody.
    public static VaccinationPlan none() {
        return new VaccinationPlan(List.of(), null, null);
    }

    /// Number of vertices to vaccinate for a percentage of a graph.
    ///
    /// `round(percent / 100 * vertexCount)`, rounding halves up, clamped to
    /// `[0, vertexCount - 1]` so at least one vertex always remains.
    ///
    /// @throws InvalidParameterException if percent is outside [1, 99]
    public static int targetCount(int percent, int vertexCount) {
        if (percent < 1 || percent > 99) {
            throw new InvalidParameterException("percent-to-vaccinate", percent + " is outside [1, 99]");
        }
        if (vertexCount <= 0) {
            return 0;
        }
        long k = Math.round(percent * (double) vertexCount / 100.0d);
        return (int) Math.max(0, Math.min(k, vertexCount - 1));
    }

    public int size() {
        return vertices.size();
    }

    public boolean isEmpty() {
        return vertices.isEmpty();
    }

    public boolean contains(String vertex) {
        return vertices.contains(vertex);
    }

    /// @return the plan as an unordered set, for graph derivation
    public Set<String> asSet() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(vertices));
    }
}
