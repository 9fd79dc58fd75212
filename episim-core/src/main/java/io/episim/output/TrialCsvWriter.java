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

import io.episim.simulation.TrialRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/// Writes trial records as CSV, one row per (seed configuration, trial).
///
/// Columns, in this order:
///
/// | column | content |
/// |---|---|
/// | graph | graph name |
/// | seeds | seed vertices joined with `;` |
/// | seed_centrality | full-graph score of a single seed, empty otherwise |
/// | strategy, centrality | vaccination selection, empty without vaccination |
/// | vaccinated | number of vaccinated vertices |
/// | model, pb, pd, rounds, seed | trial parameters |
/// | trial | trial index from 0 |
/// | rounds_executed | rounds run before the trial stopped |
/// | susceptible, infected, recovered | final counts |
/// | infected_000 .. | infected count after each round; 0 after an early stop |
///
/// Per-round columns are zero padded to the width of the round limit, at least three digits.
public class TrialCsvWriter {
    private static final Logger logger = LogManager.getLogger(TrialCsvWriter.class);

    private static final List<String> FIXED_COLUMNS = List.of(
        "graph", "seeds", "seed_centrality", "strategy", "centrality", "vaccinated",
        "model", "pb", "pd", "rounds", "seed", "trial", "rounds_executed",
        "susceptible", "infected", "recovered"
    );

    private final RunDescriptor run;

    public TrialCsvWriter(RunDescriptor run) {
        this.run = run;
    }

    /// @return the header columns for the configured round limit
    public List<String> header() {
        int rounds = run.config().rounds();
        int width = String.valueOf(rounds).length();
        List<String> header = new ArrayList<>(FIXED_COLUMNS);
        for (int round = 0; round < rounds; round++) {
            header.add(String.format(Locale.ROOT, "infected_%0" + Math.max(width, 3) + "d", round));
        }
        return header;
    }

    /// Writes the header and all records to a file, replacing it if it exists.
    public void write(Path path, List<TrialRecord> records) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(writer, records);
        }
        logger.info("Wrote {} rows to {}", records.size(), path);
    }

    /// Writes the header and all records.
    public void write(Writer writer, List<TrialRecord> records) throws IOException {
        writeRow(writer, header());
        for (TrialRecord record : records) {
            writeRow(writer, row(record));
        }
        writer.flush();
    }

    /// @return the fields of one record, in header order
    public List<String> row(TrialRecord record) {
        int rounds = run.config().rounds();
        List<String> fields = new ArrayList<>(FIXED_COLUMNS.size() + rounds);
        fields.add(run.graphName());
        fields.add(String.join(";", record.seeds()));
        fields.add(run.seedCentralityOf(record.seeds()));
        fields.add(run.strategyLabel());
        fields.add(run.centralityLabel());
        fields.add(Integer.toString(run.plan().size()));
        fields.add(run.config().model().name());
        fields.add(formatNumber(run.config().pb()));
        fields.add(formatNumber(run.config().pd()));
        fields.add(Integer.toString(rounds));
        fields.add(Long.toString(run.config().seed()));
        fields.add(Integer.toString(record.trialIndex()));
        fields.add(Integer.toString(record.roundsExecuted()));
        fields.add(Integer.toString(record.susceptible()));
        fields.add(Integer.toString(record.infected()));
        fields.add(Integer.toString(record.recovered()));
        List<Integer> perRound = record.infectedPerRound();
        for (int round = 0; round < rounds; round++) {
            fields.add(round < perRound.size() ? perRound.get(round).toString() : "0");
        }
        return fields;
    }

    /// Formats a number without exponent or locale-specific separators.
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static void writeRow(Writer writer, List<String> fields) throws IOException {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(quote(fields.get(i)));
        }
        writer.write('\n');
    }

    public static String quote(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0 && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
