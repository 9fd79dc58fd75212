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

import io.episim.api.InvalidParameterException;
import io.episim.propagation.PropagationModel;
import io.episim.propagation.RecoveryRule;
import io.episim.propagation.RecoveryRules;

/// Immutable trial parameters, validated on construction so that a bad value fails
/// before any trial runs.
///
/// @param model    the propagation model
/// @param pb       per-edge, per-round infection probability
/// @param pd       per-round recovery probability for the Bernoulli recovery rule
/// @param recovery the recovery rule used by every trial
/// @param rounds   the round limit per trial
/// @param trials   trials per seed configuration
/// @param seed     the top-level random seed
public record SimulationConfig(
    PropagationModel model,
    double pb,
    double pd,
    RecoveryRule recovery,
    int rounds,
    int trials,
    long seed
) {

    public static final int DEFAULT_TRIALS = 100;
    public static final int DEFAULT_ROUNDS = 100;
    public static final double DEFAULT_PB = 0.05d;
    public static final double DEFAULT_PD = 0.05d;
    public static final long DEFAULT_SEED = 42L;

    public SimulationConfig {
        if (model == null) {
            throw new InvalidParameterException("model", "a propagation model is required");
        }
        InvalidParameterException.requireProbability("pb", pb);
        InvalidParameterException.requireProbability("pd", pd);
        InvalidParameterException.requirePositive("rounds", rounds);
        InvalidParameterException.requirePositive("trials", trials);
        if (recovery == null) {
            recovery = RecoveryRules.bernoulli(pd);
        }
    }

    /// A configuration with Bernoulli recovery at probability `pd`.
    public static SimulationConfig of(PropagationModel model, double pb, double pd, int rounds, int trials, long seed) {
        return new SimulationConfig(model, pb, pd, null, rounds, trials, seed);
    }

    public SimulationConfig withRecovery(RecoveryRule rule) {
        return new SimulationConfig(model, pb, pd, rule, rounds, trials, seed);
    }
}
