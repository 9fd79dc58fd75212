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

package io.episim.command.centrality;

import io.episim.api.SimulationException;
import io.episim.centrality.CentralityMeasure;
import io.episim.centrality.CentralityScores;
import io.episim.command.common.GraphFileOption;
import io.episim.command.common.VaccinationOption;
import io.episim.command.common.VerbosityOption;
import io.episim.graph.ContactGraph;
import io.episim.output.TrialCsvWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

/// Prints `vertex,score` rows for one centrality measure
///
/// Rows follow graph order, or ranking order (score descending, then identifier) with `--ranked`.
@CommandLine.Command(name = "centrality",
    description = "Print the centrality score of every vertex")
public class CMD_centrality implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_centrality.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Mixin
    private GraphFileOption graphFileOption = new GraphFileOption();

    @CommandLine.Option(names = {"-c", "--centrality"},
        description = "Centrality measure: degree, closeness, betweenness, eigenvector or spread",
        required = true,
        converter = VaccinationOption.CentralityConverter.class)
    private CentralityMeasure centrality;

    @CommandLine.Option(names = {"--ranked"},
        description = "Order rows by score descending instead of graph order")
    private boolean ranked = false;

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @Override
    public Integer call() {
        try {
            verbosityOption.apply();
            ContactGraph graph = graphFileOption.load();
            CentralityScores scores = centrality.compute(graph);
            List<String> order = ranked ? scores.ranking() : graph.vertices();
            System.out.println("vertex,score");
            for (String vertex : order) {
                System.out.println(TrialCsvWriter.quote(vertex) + "," + TrialCsvWriter.formatNumber(scores.score(vertex)));
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
