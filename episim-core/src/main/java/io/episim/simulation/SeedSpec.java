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

package io.episim.simulation;

import io.episim.api.InvalidSeedException;
import io.episim.graph.ContactGraph;
import io.episim.vaccination.VaccinationPlan;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/// Which vertices start a trial infected.
///
/// Either one explicit seed set, or every vertex that survived vaccination as its own
/// singleton seed set.
public final class SeedSpec {

    private final List<String> explicit;

    private SeedSpec(List<String> explicit) {
        this.explicit = explicit;
    }

    /// One configuration seeded by all of the given vertices.
    public static SeedSpec of(List<String> seeds) {
        return new SeedSpec(List.copyOf(new LinkedHashSet<>(seeds)));
    }

    public static SeedSpec of(String... seeds) {
        return of(List.of(seeds));
    }

    /// One singleton configuration per non-vaccinated vertex.
    public static SeedSpec everyVertex() {
        return new SeedSpec(null);
    }

    public boolean isExplicit() {
        return explicit != null;
    }

    /// Expands this spec into the seed sets to simulate, in enumeration order.
    ///
    /// @param original the graph before vaccination, used to tell absent from vaccinated seeds
    /// @param plan     the vertices removed from `original`
    /// @throws InvalidSeedException if an explicit seed is absent or vaccinated, or none was given
    public List<List<String>> configurations(ContactGraph original, VaccinationPlan plan) {
        List<List<String>> configurations = new ArrayList<>();
        if (explicit == null) {
            for (String vertex : original.vertices()) {
                if (!plan.contains(vertex)) {
                    configurations.add(List.of(vertex));
                }
            }
            return configurations;
        }
        if (explicit.isEmpty()) {
            throw InvalidSeedException.empty();
        }
        for (String seed : explicit) {
            if (!original.contains(seed)) {
                throw InvalidSeedException.absent(seed);
            }
            if (plan.contains(seed)) {
                throw InvalidSeedException.vaccinated(seed);
            }
        }
        configurations.add(explicit);
        return configurations;
    }

    @Override
    public String toString() {
        return explicit == null ? "every vertex" : String.join(";", explicit);
    }
}
