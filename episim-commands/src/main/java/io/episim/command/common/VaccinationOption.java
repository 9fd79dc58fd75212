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
import io.episim.centrality.CentralityMeasure;
import io.episim.graph.ContactGraph;
import io.episim.vaccination.SelectionStrategy;
import io.episim.vaccination.VaccinationPlan;
import io.episim.vaccination.VaccinationSelector;
import picocli.CommandLine;

/**
 * Shared vaccination options: selection strategy, centrality measure and percentage.
 */
public class VaccinationOption {

    /**
     * Picocli type converter for {@link SelectionStrategy} names.
     */
    public static class StrategyConverter implements CommandLine.ITypeConverter<SelectionStrategy> {
        @Override
        public SelectionStrategy convert(String value) {
            try {
                return SelectionStrategy.fromName(value);
            } catch (InvalidParameterException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    /**
     * Picocli type converter for {@link CentralityMeasure} names.
     */
    public static class CentralityConverter implements CommandLine.ITypeConverter<CentralityMeasure> {
        @Override
        public CentralityMeasure convert(String value) {
            try {
                return CentralityMeasure.fromName(value);
            } catch (InvalidParameterException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    @CommandLine.Option(
        names = {"-x", "--strategy"},
        description = "Vaccination strategy: batch or recursive",
        converter = StrategyConverter.class
    )
    private SelectionStrategy strategy;

    @CommandLine.Option(
        names = {"-c", "--centrality"},
        description = "Centrality measure: degree, closeness, betweenness, eigenvector or spread",
        converter = CentralityConverter.class
    )
    private CentralityMeasure centrality;

    @CommandLine.Option(
        names = {"-f", "--percent-to-vax"},
        description = "Percentage of vertices to vaccinate, 1 to 99 (default: ${DEFAULT-VALUE})",
        defaultValue = "" + VaccinationPlan.DEFAULT_PERCENT
    )
    private int percent = VaccinationPlan.DEFAULT_PERCENT;

    public SelectionStrategy getStrategy() {
        return strategy;
    }

    public CentralityMeasure getCentrality() {
        return centrality;
    }

    public int getPercent() {
        return percent;
    }

    /**
     * Checks if a vaccination strategy was requested.
     */
    public boolean isVaccinating() {
        return strategy != null;
    }

    /**
     * Checks that a strategy comes with a centrality and that the percentage is usable.
     *
     * @throws InvalidParameterException when the combination is invalid
     */
    public void validate() {
        if (strategy != null && centrality == null) {
            throw new InvalidParameterException("centrality", "strategy '" + strategy + "' requires a centrality measure");
        }
        VaccinationPlan.targetCount(percent, 1);
    }

    /**
     * Checks that both a strategy and a centrality were given.
     *
     * @throws InvalidParameterException when either is missing
     */
    public void requireSelection() {
        if (strategy == null) {
            throw new InvalidParameterException("strategy", "a vaccination strategy is required");
        }
        validate();
    }

    /**
     * Builds the vaccination plan for a graph, or an empty plan when no strategy was requested.
     */
    public VaccinationPlan plan(ContactGraph graph, VaccinationSelector selector) {
        validate();
        if (!isVaccinating()) {
            return VaccinationPlan.none();
        }
        return selector.select(graph, centrality, strategy, VaccinationPlan.targetCount(percent, graph.size()));
    }

    @Override
    public String toString() {
        if (!isVaccinating()) {
            return "none";
        }
        return strategy + " by " + centrality + " (" + percent + "%)";
    }
}
