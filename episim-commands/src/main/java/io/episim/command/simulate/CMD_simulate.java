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

package io.episim.command.simulate;

import io.episim.api.SimulationException;
import io.episim.centrality.CentralityMeasure;
import io.episim.centrality.CentralityScores;
import io.episim.command.common.GraphFileOption;
import io.episim.command.common.OutputFileOption;
import io.episim.command.common.ParallelExecutionOption;
import io.episim.command.common.PropagationOption;
import io.episim.command.common.RandomSeedOption;
import io.episim.command.common.VaccinationOption;
import io.episim.command.common.VerbosityOption;
import io.episim.graph.ContactGraph;
import io.episim.output.RunDescriptor;
import io.episim.output.TrialCsvWriter;
import io.episim.propagation.PropagationEngine;
import io.episim.simulation.SeedSpec;
import io.episim.simulation.SimulationConfig;
import io.episim.simulation.TrialOrchestrator;
import io.episim.simulation.TrialRecord;
import io.episim.vaccination.VaccinationPlan;
import io.episim.vaccination.VaccinationSelector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Runs repeated outbreak trials on a contact graph and writes one CSV row per trial
///
/// The run goes through these stages, and any configuration error stops it before the
/// first trial:
///
/// 1. load the graph
/// 2. select the vertices to vaccinate, if a strategy was given
/// 3. run `trials` trials for each seed configuration on the graph without them
/// 4. write the rows, only once every trial has finished
///
/// Without `--patient0` every non-vaccinated vertex is tried as a single seed in turn.
@CommandLine.Command(name = "simulate",
    description = "Simulate outbreaks on a contact graph, optionally after vaccinating central vertices")
public class CMD_simulate implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_simulate.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_FILE_EXISTS = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Mixin
    private GraphFileOption graphFileOption = new GraphFileOption();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Option(names = {"-p", "--patient0"},
        description = "Seed vertex infected at round 0; repeat or separate with commas for several. "
            + "Without it, every non-vaccinated vertex is tried alone",
        split = ",")
    private List<String> patient0 = new ArrayList<>();

    @CommandLine.Mixin
    private VaccinationOption vaccinationOption = new VaccinationOption();

    @CommandLine.Mixin
    private PropagationOption propagationOption = new PropagationOption();

    @CommandLine.Mixin
    private RandomSeedOption randomSeedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private ParallelExecutionOption parallelExecutionOption = new ParallelExecutionOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @Override
    public Integer call() {
        SimulationConfig config;
        try {
            verbosityOption.apply();
            vaccinationOption.validate();
            config = propagationOption.toConfig(randomSeedOption.getSeed());
            if (!randomSeedOption.isSeedSpecified()) {
                logger.debug("No --seed given, using {}", randomSeedOption);
            }
        } catch (SimulationException | IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        }

        if (outputFileOption.outputExistsWithoutForce()) {
            logger.error("Error: Output file {} already exists. Use --force to overwrite.",
                outputFileOption.getNormalizedOutputPath());
            return EXIT_FILE_EXISTS;
        }

        if (parallelExecutionOption.exceedsAvailableCores()) {
            logger.warn("Specified thread count ({}) exceeds available cores ({}). This may cause contention.",
                parallelExecutionOption.getExplicitThreads(), Runtime.getRuntime().availableProcessors());
        }

        try {
            ContactGraph graph = graphFileOption.load();
            VaccinationPlan plan = vaccinationOption.plan(graph, new VaccinationSelector());
            if (!plan.isEmpty()) {
                logger.info("Vaccinating {} of {} vertices: {}", plan.size(), graph.size(), plan.vertices());
            }

            CentralityMeasure measure = vaccinationOption.getCentrality();
            CentralityScores seedCentrality = measure != null ? measure.compute(graph) : null;

            SeedSpec seedSpec = patient0.isEmpty() ? SeedSpec.everyVertex() : SeedSpec.of(patient0);
            TrialOrchestrator orchestrator =
                new TrialOrchestrator(new PropagationEngine(), parallelExecutionOption.getThreadCount());
            List<TrialRecord> records = orchestrator.run(graph, plan, seedSpec, config);

            TrialCsvWriter writer = new TrialCsvWriter(new RunDescriptor(graph.name(), plan, config, seedCentrality));
            writer.write(outputFileOption.getNormalizedOutputPath(), records);
            return EXIT_SUCCESS;
        } catch (SimulationException | IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("I/O error: {}", e.getMessage());
            return EXIT_ERROR;
        }
    }
}
