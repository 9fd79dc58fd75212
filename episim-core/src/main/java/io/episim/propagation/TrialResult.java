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

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/// The outcome of one trial.
///
/// @param seeds            the vertices that started infected
/// @param finalStates      the state of every vertex of the trial graph when the trial ended, in graph order
/// @param roundsExecuted   rounds actually run, fewer than the limit if the infection died out
/// @param infectedPerRound number of infected vertices at the end of each executed round
public record TrialResult(
    List<String> seeds,
    Map<String, HealthState> finalStates,
    int roundsExecuted,
    List<Integer> infectedPerRound
) {

    public TrialResult {
        seeds = List.copyOf(seeds);
        finalStates = Collections.unmodifiableMap(finalStates);
        infectedPerRound = List.copyOf(infectedPerRound);
        if (infectedPerRound.size() != roundsExecuted) {
            throw new IllegalArgumentException(
                "Expected " + roundsExecuted + " per-round counts, got " + infectedPerRound.size());
        }
    }

    /// @return how many vertices ended in the given state
    public int count(HealthState state) {
        return counts().get(state);
    }

    /// @return the final count for every state, including zero counts
    public Map<HealthState, Integer> counts() {
        Map<HealthState, Integer> counts = new EnumMap<>(HealthState.class);
        for (HealthState state : HealthState.values()) {
            counts.put(state, 0);
        }
        for (HealthState state : finalStates.values()) {
            counts.merge(state, 1, Integer::sum);
        }
        return counts;
    }

    /// @return the final state of a vertex, or null if it was not part of the trial graph
    public HealthState stateOf(String vertex) {
        return finalStates.get(vertex);
    }
}
