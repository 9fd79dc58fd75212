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
import io.episim.api.SimulationException;
import io.episim.graph.ContactGraph;
import io.episim.propagation.PropagationEngine;
import io.episim.propagation.TrialResult;
import io.episim.vaccination.VaccinationPlan;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/// Runs every trial of a simulation configuration and collects their summaries.
///
/// Seed configurations are enumerated in graph order (or as given), each one run for
/// `trials` trials. Results always come back ordered by seed configuration, then trial
/// index, whether the trials ran on one thread or many. The first failing trial aborts
/// the run.
public class TrialOrchestrator {
    private static final Logger logger = LogManager.getLogger(TrialOrchestrator.class);

    private final PropagationEngine engine;
    private final int threads;

    public TrialOrchestrator() {
        this(new PropagationEngine(), 1);
    }

    /// @param threads worker threads for trials; 1 runs everything on the calling thread
    public TrialOrchestrator(PropagationEngine engine, int threads) {
        this.engine = engine;
        this.threads = InvalidParameterException.requirePositive("threads", threads);
    }

    /// Runs all trials.
    ///
    /// @param graph    the graph before vaccination; it is not modified
    /// @param plan     the vertices to remove before every trial
    /// @param seedSpec the seed configurations to run
    /// @param config   trial parameters
    /// @return one record per (seed configuration, trial), in canonical order
    public List<TrialRecord> run(ContactGraph graph, VaccinationPlan plan, SeedSpec seedSpec, SimulationConfig config) {
        List<List<String>> configurations = seedSpec.configurations(graph, plan);
        ContactGraph reduced = graph.without(plan.asSet());
        logger.info("Running {} trials for each of {} seed configurations on '{}' ({} of {} vertices vaccinated, {}, pb={}, {})",
            config.trials(), configurations.size(), graph.name(), plan.size(), graph.size(),
            config.model(), config.pb(), config.recovery().describe());

        if (threads <= 1) {
            return runSequential(reduced, configurations, config);
        }
        return runParallel(reduced, configurations, config);
    }

    private List<TrialRecord> runSequential(ContactGraph reduced, List<List<String>> configurations, SimulationConfig config) {
        List<TrialRecord> records = new ArrayList<>(configurations.size() * config.trials());
        for (int c = 0; c < configurations.size(); c++) {
            List<String> seeds = configurations.get(c);
            logger.debug("Starting trials with seeds {}", seeds);
            for (int trial = 0; trial < config.trials(); trial++) {
                records.add(runOne(reduced, c, seeds, trial, config));
            }
        }
        return records;
    }

    private List<TrialRecord> runParallel(ContactGraph reduced, List<List<String>> configurations, SimulationConfig config) {
        ExecutorService executor = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "episim-trial");
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<Future<TrialRecord>> futures = new ArrayList<>(configurations.size() * config.trials());
            for (int c = 0; c < configurations.size(); c++) {
                int configurationIndex = c;
                List<String> seeds = configurations.get(c);
                for (int trial = 0; trial < config.trials(); trial++) {
                    int trialIndex = trial;
                    futures.add(executor.submit(() -> runOne(reduced, configurationIndex, seeds, trialIndex, config)));
                }
            }
            List<TrialRecord> records = new ArrayList<>(futures.size());
            for (Future<TrialRecord> future : futures) {
                records.add(future.get());
            }
            return records;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SimulationException) {
                throw (SimulationException) cause;
            }
            throw new SimulationException("Trial failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SimulationException("Interrupted while waiting for trials", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private TrialRecord runOne(ContactGraph reduced, int configurationIndex, List<String> seeds, int trial, SimulationConfig config) {
        TrialResult result = engine.runTrial(
            reduced,
            seeds,
            config.model(),
            config.pb(),
            config.recovery(),
            config.rounds(),
            RandomStreams.forTrial(config.seed(), seeds, trial)
        );
        return TrialRecord.of(configurationIndex, trial, result);
    }
}
