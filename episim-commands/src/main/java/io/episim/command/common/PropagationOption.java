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

package io.episim.command.common;

import io.episim.api.InvalidParameterException;
import io.episim.propagation.PropagationModel;
import io.episim.propagation.RecoveryRules;
import io.episim.simulation.SimulationConfig;
import picocli.CommandLine;

/**
 * Shared trial parameter options, turned into a validated {@link SimulationConfig}.
 */
public class PropagationOption {

    /**
     * Picocli type converter for {@link PropagationModel} names.
     */
    public static class ModelConverter implements CommandLine.ITypeConverter<PropagationModel> {
        @Override
        public PropagationModel convert(String value) {
            try {
                return PropagationModel.fromName(value);
            } catch (InvalidParameterException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    @CommandLine.Option(
        names = {"-m", "--model"},
        description = "Propagation model: SIR or SIS (default: ${DEFAULT-VALUE})",
        defaultValue = "SIR",
        converter = ModelConverter.class
    )
    private PropagationModel model = PropagationModel.SIR;

    @CommandLine.Option(
        names = {"-t", "--trials"},
        description = "Trials per seed configuration (default: ${DEFAULT-VALUE})",
        defaultValue = "" + SimulationConfig.DEFAULT_TRIALS
    )
    private int trials = SimulationConfig.DEFAULT_TRIALS;

    @CommandLine.Option(
        names = {"-r", "--rounds"},
        description = "Maximum rounds per trial (default: ${DEFAULT-VALUE})",
        defaultValue = "" + SimulationConfig.DEFAULT_ROUNDS
    )
    private int rounds = SimulationConfig.DEFAULT_ROUNDS;

    @CommandLine.Option(
        names = {"-b", "--pb"},
        description = "Per-edge, per-round infection probability (default: ${DEFAULT-VALUE})",
        defaultValue = "" + SimulationConfig.DEFAULT_PB
    )
    private double pb = SimulationConfig.DEFAULT_PB;

    @CommandLine.Option(
        names = {"-d", "--pd"},
        description = "Per-round recovery probability (default: ${DEFAULT-VALUE})",
        defaultValue = "" + SimulationConfig.DEFAULT_PD
    )
    private double pd = SimulationConfig.DEFAULT_PD;

    @CommandLine.Option(
        names = {"--recovery"},
        description = "Recovery rule: bernoulli, uniform:MIN:MAX or normal:MU:SIGMA (default: ${DEFAULT-VALUE})",
        defaultValue = "bernoulli"
    )
    private String recovery = "bernoulli";

    /**
     * Builds the trial configuration.
     *
     * @param seed the top-level random seed
     * @throws InvalidParameterException if any value is out of range or the recovery rule is malformed
     */
    public SimulationConfig toConfig(long seed) {
        SimulationConfig config = SimulationConfig.of(model, pb, pd, rounds, trials, seed);
        return config.withRecovery(RecoveryRules.parse(recovery, pd));
    }
}
