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

import io.episim.propagation.HealthState;
import io.episim.propagation.TrialResult;

import java.util.List;

/// The summary of one trial that is kept after the trial ends: counts, not per-vertex state.
///
/// @param seedSetIndex     position of the seed configuration in the enumeration
/// @param trialIndex       trial number within that configuration, from 0
/// @param seeds            the seed vertices
/// @param susceptible      final susceptible count
/// @param infected         final infected count
/// @param recovered        final recovered count
/// @param roundsExecuted   rounds run before the trial stopped
/// @param infectedPerRound infected count at the end of each executed round
public record TrialRecord(
    int seedSetIndex,
    int trialIndex,
    List<String> seeds,
    int susceptible,
    int infected,
    int recovered,
    int roundsExecuted,
    List<Integer> infectedPerRound
) {

    public TrialRecord {
        seeds = List.copyOf(seeds);
        infectedPerRound = List.copyOf(infectedPerRound);
    }

    public static TrialRecord of(int seedSetIndex, int trialIndex, TrialResult result) {
        return new TrialRecord(
            seedSetIndex,
            trialIndex,
            result.seeds(),
            result.count(HealthState.SUSCEPTIBLE),
            result.count(HealthState.INFECTED),
            result.count(HealthState.RECOVERED),
            result.roundsExecuted(),
            result.infectedPerRound()
        );
    }
}
