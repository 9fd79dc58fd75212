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
import io.episim.centrality.CentralityProvider;
import io.episim.centrality.CentralityScores;
import io.episim.graph.ContactGraph;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/// Chooses which vertices to vaccinate from a centrality ranking.
///
/// Rankings order vertices by score descending and then by identifier ascending, so
/// every selection is reproducible. Neither strategy touches the caller's graph: the
/// recursive strategy works on a chain of derived graphs.
public class VaccinationSelector {
    private static final Logger logger = LogManager.getLogger(VaccinationSelector.class);

    private final CentralityProvider centralityProvider;

    public VaccinationSelector() {
        this(CentralityProvider.standard());
    }

    public VaccinationSelector(CentralityProvider centralityProvider) {
        this.centralityProvider = centralityProvider;
    }

    /// Selects by measure and strategy name.
    ///
    /// @throws InvalidParameterException for unknown names or a count outside [0, |V|]
    public VaccinationPlan select(ContactGraph graph, String centralityName, String strategyName, int k) {
        return select(graph, CentralityMeasure.fromName(centralityName), SelectionStrategy.fromName(strategyName), k);
    }

    /// Selects exactly `k` distinct vertices of `graph`.
    ///
    /// @throws InvalidParameterException if `k` is outside [0, |V|]
    public VaccinationPlan select(ContactGraph graph, CentralityMeasure measure, SelectionStrategy strategy, int k) {
        if (measure == null || strategy == null) {
            throw new InvalidParameterException("vaccination", "both a centrality and a strategy are required");
        }
        if (k < 0 || k > graph.size()) {
            throw new InvalidParameterException("vaccination count", k + " is outside [0, " + graph.size() + "]");
        }
        if (k == 0) {
            return new VaccinationPlan(List.of(), measure, strategy);
        }
        logger.debug("Selecting {} of {} vertices of '{}' by {} centrality ({})",
            k, graph.size(), graph.name(), measure, strategy);
        List<String> selected;
        switch (strategy) {
            case BATCH:
                selected = selectBatch(graph, measure, k);
                break;
            case RECURSIVE:
                selected = selectRecursive(graph, measure, k);
                break;
            default:
                throw new IllegalStateException("Unhandled strategy " + strategy);
        }
        return new VaccinationPlan(selected, measure, strategy);
    }

    private List<String> selectBatch(ContactGraph graph, CentralityMeasure measure, int k) {
        CentralityScores scores = centralityProvider.compute(graph, measure);
        return new ArrayList<>(scores.ranking().subList(0, k));
    }

    private List<String> selectRecursive(ContactGraph graph, CentralityMeasure measure, int k) {
        List<String> selected = new ArrayList<>(k);
        ContactGraph working = graph;
        while (selected.size() < k) {
            if (!working.hasEdges()) {
                // no structure left: every remaining score is zero, so identifiers decide
                List<String> rest = CentralityScores.zero(working, measure).ranking();
                selected.addAll(rest.subList(0, k - selected.size()));
                logger.debug("Graph '{}' became edgeless; took remaining picks by identifier", graph.name());
                break;
            }
            CentralityScores scores = centralityProvider.compute(working, measure);
            String best = scores.top();
            logger.debug("Pick {}: '{}' with {} {}", selected.size() + 1, best, measure, scores.score(best));
            selected.add(best);
            working = working.without(Set.of(best));
        }
        return selected;
    }
}
