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

package io.episim.output;

import io.episim.centrality.CentralityScores;
import io.episim.simulation.SimulationConfig;
import io.episim.vaccination.VaccinationPlan;

import java.util.List;

/// The run-level values repeated on every output row.
///
/// @param graphName       name of the simulated graph
/// @param plan            the vaccination plan of the run
/// @param config          trial parameters
/// @param seedCentrality  scores of the full graph under the configured measure, or null when none was configured
public record RunDescriptor(String graphName, VaccinationPlan plan, SimulationConfig config, CentralityScores seedCentrality) {

    /// The centrality of a seed set: the seed's score for a singleton set, otherwise empty.
    String seedCentralityOf(List<String> seeds) {
        if (seedCentrality == null || seeds.size() != 1) {
            return "";
        }
        return TrialCsvWriter.formatNumber(seedCentrality.score(seeds.get(0)));
    }

    String strategyLabel() {
        if (plan.strategy() != null) {
            return plan.strategy().label();
        }
        return "";
    }

    String centralityLabel() {
        if (plan.measure() != null) {
            return plan.measure().label();
        }
        return seedCentrality != null ? seedCentrality.measure().label() : "";
    }
}
