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
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Locale;

/// The recovery rules that can be selected from configuration.
///
/// Spec strings:
/// - `bernoulli`: recover each round with the configured recovery probability
/// - `uniform:MIN:MAX`: each vertex recovers from a fixed round drawn uniformly in [MIN, MAX)
/// - `normal:MU:SIGMA`: recover at round t with probability Φ((t - MU) / SIGMA)
public final class RecoveryRules {

    private RecoveryRules() {
    }

    /// Recovery as an independent Bernoulli trial with probability `pd` every round.
    public static RecoveryRule bernoulli(double pd) {
        InvalidParameterException.requireProbability("pd", pd);
        return new RecoveryRule() {
            @Override
            public Recovery begin(int vertexCount, UniformRandomProvider rng) {
                return (vertex, round) -> rng.nextDouble() < pd;
            }

            @Override
            public String describe() {
                return "bernoulli(" + pd + ")";
            }
        };
    }

    /// Recovery at a round drawn once per vertex at trial start, `min + floor((max - min) * u)`.
    ///
    /// The draws happen in vertex order before any spread draw.
    public static RecoveryRule uniform(int min, int max) {
        if (min < 0 || max < min) {
            throw new InvalidParameterException("recovery", "uniform bounds must satisfy 0 <= min <= max, got "
                + min + ".." + max);
        }
        return new RecoveryRule() {
            @Override
            public Recovery begin(int vertexCount, UniformRandomProvider rng) {
                int[] recoveryRound = new int[vertexCount];
                for (int i = 0; i < vertexCount; i++) {
                    recoveryRound[i] = min + (int) ((max - min) * rng.nextDouble());
                }
                return (vertex, round) -> round >= recoveryRound[vertex];
            }

            @Override
            public String describe() {
                return "uniform(" + min + ", " + max + ")";
            }
        };
    }

    /// Recovery whose probability grows with the round number along a normal CDF.
    public static RecoveryRule normal(double mu, double sigma) {
        if (!(sigma > 0.0d)) {
            throw new InvalidParameterException("recovery", "normal sigma must be positive, got " + sigma);
        }
        NormalDistribution distribution = new NormalDistribution(null, mu, sigma);
        return new RecoveryRule() {
            @Override
            public Recovery begin(int vertexCount, UniformRandomProvider rng) {
                return (vertex, round) -> rng.nextDouble() < distribution.cumulativeProbability(round);
            }

            @Override
            public String describe() {
                return "normal(" + mu + ", " + sigma + ")";
            }
        };
    }

    /// Parses a recovery spec string.
    ///
    /// @param spec the rule, or null for `bernoulli`
    /// @param pd   the recovery probability used by `bernoulli`
    /// @throws InvalidParameterException for an unknown rule or malformed arguments
    public static RecoveryRule parse(String spec, double pd) {
        if (spec == null || spec.isBlank()) {
            return bernoulli(pd);
        }
        String[] parts = spec.trim().split(":");
        String name = parts[0].toLowerCase(Locale.ROOT);
        try {
            switch (name) {
                case "bernoulli":
                    expectArguments(spec, parts, 0);
                    return bernoulli(pd);
                case "uniform":
                    expectArguments(spec, parts, 2);
                    return uniform(Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
                case "normal":
                    expectArguments(spec, parts, 2);
                    return normal(Double.parseDouble(parts[1]), Double.parseDouble(parts[2]));
                default:
                    throw InvalidParameterException.unknownName("recovery", spec,
                        new String[]{"bernoulli", "uniform:MIN:MAX", "normal:MU:SIGMA"});
            }
        } catch (NumberFormatException e) {
            throw new InvalidParameterException("recovery", "'" + spec + "' has a non-numeric argument");
        }
    }

    private static void expectArguments(String spec, String[] parts, int count) {
        if (parts.length - 1 != count) {
            throw new InvalidParameterException("recovery", "'" + spec + "' expects " + count + " arguments");
        }
    }
}
