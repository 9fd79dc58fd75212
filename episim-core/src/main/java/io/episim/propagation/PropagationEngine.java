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

package io.episim.propagation;

import io.episim.api.InvalidParameterException;
import io.episim.api.InvalidSeedException;
import io.episim.graph.ContactGraph;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Runs one stochastic trial of infection spread in discrete synchronous rounds.
///
/// Every round reads only the state left by the previous round:
///
/// 1. each vertex infected at the start of the round, in vertex order, tries to infect
///    each of its neighbours that was susceptible at the start of the round, in neighbour
///    order, with one draw per edge; several successful draws on one neighbour still mean
///    one infection
/// 2. each vertex infected at the start of the round, in vertex order, is then offered to
///    the recovery rule; a recovering vertex has already transmitted in this round
///
/// Under [PropagationModel#SIR] recovery is final, under [PropagationModel#SIS] the vertex
/// becomes susceptible again. The trial stops when nothing is infected or after
/// `maxRounds` rounds.
///
/// All randomness comes from the supplied provider in the order above, so a provider in
/// the same state always yields the same trial.
public class PropagationEngine {
    private static final Logger logger = LogManager.getLogger(PropagationEngine.class);

    /// Runs a trial with Bernoulli recovery at probability `pd`.
    public TrialResult runTrial(
        ContactGraph graph,
        Collection<String> seeds,
        PropagationModel model,
        double pb,
        double pd,
        int maxRounds,
        UniformRandomProvider rng
    ) {
        return runTrial(graph, seeds, model, pb, RecoveryRules.bernoulli(pd), maxRounds, rng);
    }

    /// Runs a trial with an arbitrary recovery rule.
    ///
    /// @param graph     the graph with vaccinated vertices already removed
    /// @param seeds     vertices that start infected; each must be a vertex of `graph`
    /// @param maxRounds upper bound on rounds, positive
    /// @throws InvalidSeedException      if the seed set is empty or names a vertex not in `graph`
    /// @throws InvalidParameterException if `pb` is not a probability or `maxRounds` is not positive
    public TrialResult runTrial(
        ContactGraph graph,
        Collection<String> seeds,
        PropagationModel model,
        double pb,
        RecoveryRule recoveryRule,
        int maxRounds,
        UniformRandomProvider rng
    ) {
        InvalidParameterException.requireProbability("pb", pb);
        InvalidParameterException.requirePositive("rounds", maxRounds);
        Set<String> seedSet = new LinkedHashSet<>(seeds);
        if (seedSet.isEmpty()) {
            throw InvalidSeedException.empty();
        }

        int n = graph.size();
        HealthState[] current = new HealthState[n];
        Arrays.fill(current, HealthState.SUSCEPTIBLE);
        for (String seed : seedSet) {
            int index = graph.indexOf(seed);
            if (index < 0) {
                throw InvalidSeedException.absent(seed);
            }
            current[index] = HealthState.INFECTED;
        }

        RecoveryRule.Recovery recovery = recoveryRule.begin(n, rng);
        HealthState recovered = model.afterRecovery();
        int infected = seedSet.size();
        List<Integer> infectedPerRound = new ArrayList<>();
        int round = 0;
        while (infected > 0 && round < maxRounds) {
            round++;
            HealthState[] next = current.clone();
            for (int v = 0; v < n; v++) {
                if (current[v] != HealthState.INFECTED) {
                    continue;
                }
                for (int k = 0; k < graph.degree(v); k++) {
                    int u = graph.neighbor(v, k);
                    if (current[u] == HealthState.SUSCEPTIBLE && rng.nextDouble() < pb) {
                        next[u] = HealthState.INFECTED;
                    }
                }
            }
            for (int v = 0; v < n; v++) {
                if (current[v] == HealthState.INFECTED && recovery.recovers(v, round)) {
                    next[v] = recovered;
                }
            }
            current = next;
            infected = 0;
            for (HealthState state : current) {
                if (state == HealthState.INFECTED) {
                    infected++;
                }
            }
            infectedPerRound.add(infected);
        }

        if (logger.isTraceEnabled()) {
            logger.trace("Trial from {} on '{}' ended after {} rounds with {} infected",
                seedSet, graph.name(), round, infected);
        }
        Map<String, HealthState> finalStates = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            finalStates.put(graph.vertexAt(i), current[i]);
        }
        return new TrialResult(new ArrayList<>(seedSet), finalStates, round, infectedPerRound);
    }
}
