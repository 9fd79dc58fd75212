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

package io.episim.command.select;

import io.episim.api.SimulationException;
import io.episim.command.common.GraphFileOption;
import io.episim.command.common.VaccinationOption;
import io.episim.command.common.VerbosityOption;
import io.episim.graph.ContactGraph;
import io.episim.vaccination.VaccinationPlan;
import io.episim.vaccination.VaccinationSelector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.concurrent.Callable;

/// Prints the vertices a vaccination strategy would select, one per line in selection order
@CommandLine.Command(name = "select",
    description = "Print the vaccination plan for a graph, strategy and centrality")
public class CMD_select implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_select.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Mixin
    private GraphFileOption graphFileOption = new GraphFileOption();

    @CommandLine.Mixin
    private VaccinationOption vaccinationOption = new VaccinationOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @Override
    public Integer call() {
        try {
            verbosityOption.apply();
            vaccinationOption.requireSelection();
            ContactGraph graph = graphFileOption.load();
            VaccinationPlan plan = vaccinationOption.plan(graph, new VaccinationSelector());
            for (String vertex : plan.vertices()) {
                System.out.println(vertex);
            }
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
