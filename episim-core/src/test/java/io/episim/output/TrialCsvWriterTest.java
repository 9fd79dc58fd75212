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

package io.episim.output;

import io.episim.TestGraphs;
import io.episim.centrality.CentralityMeasure;
import io.episim.centrality.CentralityScores;
import io.episim.graph.ContactGraph;
import io.episim.propagation.PropagationModel;
import io.episim.simulation.SeedSpec;
import io.episim.simulation.SimulationConfig;
import io.episim.simulation.TrialOrchestrator;
import io.episim.simulation.TrialRecord;
import io.episim.vaccination.SelectionStrategy;
import io.episim.vaccination.VaccinationPlan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TrialCsvWriter")
class TrialCsvWriterTest {

    @TempDir
    Path tempDir;

    private final ContactGraph star = TestGraphs.star();
    private final SimulationConfig fiveRounds = SimulationConfig.of(PropagationModel.SIR, 0.25d, 0.05d, 5, 2, 7L);

    private TrialCsvWriter writer(SimulationConfig config, VaccinationPlan plan, CentralityScores scores) {
        return new TrialCsvWriter(new RunDescriptor(star.name(), plan, config, scores));
    }

    @Nested
    @DisplayName("Header")
    class HeaderTest {

        @Test
        @DisplayName("should list fixed columns then one zero padded column per round")
        void shouldListColumns() {
            List<String> header = writer(fiveRounds, VaccinationPlan.none(), null).header();

            assertThat(header).startsWith("graph", "seeds", "seed_centrality", "strategy", "centrality", "vaccinated",
                "model", "pb", "pd", "rounds", "seed", "trial", "rounds_executed", "susceptible", "infected", "recovered");
            assertThat(header).endsWith("infected_000", "infected_001", "infected_002", "infected_003", "infected_004");
            assertThat(header).hasSize(16 + 5);
        }

        @Test
        @DisplayName("should widen padding for large round limits")
        void shouldWidenPadding() {
            SimulationConfig longRun = SimulationConfig.of(PropagationModel.SIR, 0.25d, 0.05d, 1000, 1, 7L);

            List<String> header = writer(longRun, VaccinationPlan.none(), null).header();

            assertThat(header.get(16)).isEqualTo("infected_0000");
            assertThat(header.get(header.size() - 1)).isEqualTo("infected_0999");
        }
    }

    @Nested
    @DisplayName("Rows")
    class RowTest {

        @Test
        @DisplayName("should pad rounds after an early stop with zeros")
        void shouldPadEarlyStop() {
            TrialRecord record = new TrialRecord(0, 1, List.of("l1"), 2, 0, 2, 2, List.of(1, 0));

            List<String> row = writer(fiveRounds, VaccinationPlan.none(), null).row(record);

            assertThat(row).containsExactly("star", "l1", "", "", "", "0", "SIR", "0.25", "0.05", "5", "7", "1", "2",
                "2", "0", "2", "1", "0", "0", "0", "0");
        }

        @Test
        @DisplayName("should report vaccination and the seed's full-graph centrality")
        void shouldReportVaccination() {
            CentralityScores degree = CentralityMeasure.DEGREE.compute(star);
            VaccinationPlan plan = new VaccinationPlan(List.of("h"), CentralityMeasure.DEGREE, SelectionStrategy.RECURSIVE);
            TrialRecord record = new TrialRecord(0, 0, List.of("l2"), 2, 0, 1, 1, List.of(0));

            List<String> row = writer(fiveRounds, plan, degree).row(record);

            assertThat(row.subList(0, 6)).containsExactly("star", "l2", "1", "recursive", "degree", "1");
        }

        @Test
        @DisplayName("should leave seed centrality empty for multi-vertex seed sets")
        void shouldLeaveMultiSeedCentralityEmpty() {
            CentralityScores degree = CentralityMeasure.DEGREE.compute(star);
            TrialRecord record = new TrialRecord(0, 0, List.of("l1", "l2"), 2, 0, 2, 1, List.of(0));

            List<String> row = writer(fiveRounds, VaccinationPlan.none(), degree).row(record);

            assertThat(row.get(1)).isEqualTo("l1;l2");
            assertThat(row.get(2)).isEmpty();
            assertThat(row.get(4)).isEqualTo("degree");
        }
    }

    @Test
    @DisplayName("numbers and quoting are locale independent")
    void formatsNumbersAndQuotes() {
        assertThat(TrialCsvWriter.formatNumber(3.0d)).isEqualTo("3");
        assertThat(TrialCsvWriter.formatNumber(0.05d)).isEqualTo("0.05");
        assertThat(TrialCsvWriter.formatNumber(1.0e-7d)).isEqualTo("0.0000001");
        assertThat(TrialCsvWriter.quote("plain")).isEqualTo("plain");
        assertThat(TrialCsvWriter.quote("a,b")).isEqualTo("\"a,b\"");
        assertThat(TrialCsvWriter.quote("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
    }

    @Test
    @DisplayName("writes a header and one line per record")
    void writesFile() throws IOException {
        List<TrialRecord> records = new TrialOrchestrator().run(star, VaccinationPlan.none(), SeedSpec.of("h"), fiveRounds);
        Path out = tempDir.resolve("nested/out.csv");

        writer(fiveRounds, VaccinationPlan.none(), null).write(out, records);

        List<String> lines = Files.readAllLines(out);
        assertThat(lines).hasSize(1 + records.size());
        assertThat(lines.get(0)).startsWith("graph,seeds,seed_centrality");
        assertThat(lines.get(1)).startsWith("star,h,,,,0,SIR,0.25,0.05,5,7,0,");
    }

    @Test
    @DisplayName("identical runs serialise to identical text")
    void identicalRunsIdenticalText() throws IOException {
        StringWriter first = new StringWriter();
        StringWriter second = new StringWriter();
        TrialCsvWriter csv = writer(fiveRounds, VaccinationPlan.none(), null);

        csv.write(first, new TrialOrchestrator().run(star, VaccinationPlan.none(), SeedSpec.everyVertex(), fiveRounds));
        csv.write(second, new TrialOrchestrator().run(star, VaccinationPlan.none(), SeedSpec.everyVertex(), fiveRounds));

        assertThat(second.toString()).isEqualTo(first.toString());
    }
}
