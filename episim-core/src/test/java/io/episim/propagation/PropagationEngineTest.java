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

import io.episim.TestGraphs;
import io.episim.api.InvalidParameterException;
import io.episim.api.InvalidSeedException;
import io.episim.graph.ContactGraph;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PropagationEngine")
class PropagationEngineTest {

    private final PropagationEngine engine = new PropagationEngine();

    private static UniformRandomProvider rng(long seed) {
        return RandomSource.XO_SHI_RO_256_PP.create(seed);
    }

    @Nested
    @DisplayName("Four-cycle scenarios")
    class CycleTest {

        @Test
        @DisplayName("certain infection without recovery reaches every vertex")
        void certainInfectionReachesEveryVertex() {
            TrialResult result = engine.runTrial(TestGraphs.cycle4(), List.of("a"), PropagationModel.SIR,
                1.0d, 0.0d, 3, rng(1L));

            assertThat(result.roundsExecuted()).isEqualTo(3);
            assertThat(result.count(HealthState.INFECTED)).isEqualTo(4);
            assertThat(result.infectedPerRound()).containsExactly(3, 4, 4);
        }

        @Test
        @DisplayName("certain recovery without infection stops after one round")
        void certainRecoveryStopsAfterOneRound() {
            TrialResult result = engine.runTrial(TestGraphs.cycle4(), List.of("a"), PropagationModel.SIR,
                0.0d, 1.0d, 10, rng(1L));

            assertThat(result.roundsExecuted()).isEqualTo(1);
            assertThat(result.count(HealthState.RECOVERED)).isEqualTo(1);
            assertThat(result.count(HealthState.SUSCEPTIBLE)).isEqualTo(3);
            assertThat(result.stateOf("a")).isEqualTo(HealthState.RECOVERED);
            assertThat(result.infectedPerRound()).containsExactly(0);
        }

        @Test
        @DisplayName("a recovering vertex still transmits in its last round")
        void recoveringVertexStillTransmits() {
            TrialResult result = engine.runTrial(TestGraphs.cycle4(), List.of("a"), PropagationModel.SIR,
                1.0d, 1.0d, 10, rng(1L));

            assertThat(result.infectedPerRound()).containsExactly(2, 1, 0);
            assertThat(result.count(HealthState.RECOVERED)).isEqualTo(4);
        }

        @Test
        @DisplayName("under SIS recovered vertices become susceptible again")
        void sisReturnsToSusceptible() {
            TrialResult result = engine.runTrial(TestGraphs.cycle4(), List.of("a"), PropagationModel.SIS,
                1.0d, 1.0d, 4, rng(1L));

            assertThat(result.roundsExecuted()).isEqualTo(4);
            assertThat(result.infectedPerRound()).containsExactly(2, 2, 2, 2);
            assertThat(result.count(HealthState.RECOVERED)).isZero();
            assertThat(result.stateOf("a")).isEqualTo(HealthState.INFECTED);
            assertThat(result.stateOf("b")).isEqualTo(HealthState.SUSCEPTIBLE);
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 42L, 9001L})
    @DisplayName("zero infection probability never spreads")
    void zeroInfectionNeverSpreads(long seed) {
        ContactGraph graph = TestGraphs.cascade();

        TrialResult result = engine.runTrial(graph, List.of("X", "Z"), PropagationModel.SIR, 0.0d, 0.3d, 50, rng(seed));

        assertThat(result.count(HealthState.SUSCEPTIBLE)).isEqualTo(graph.size() - 2);
        assertThat(result.infectedPerRound()).allMatch(count -> count <= 2);
    }

    @Test
    @DisplayName("the same stream yields the same trial")
    void sameStreamSameTrial() {
        ContactGraph graph = TestGraphs.cascade();

        TrialResult first = engine.runTrial(graph, List.of("x1"), PropagationModel.SIR, 0.4d, 0.2d, 30, rng(7L));
        TrialResult second = engine.runTrial(graph, List.of("x1"), PropagationModel.SIR, 0.4d, 0.2d, 30, rng(7L));

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("counts always cover every vertex of the trial graph")
    void countsCoverEveryVertex() {
        ContactGraph graph = TestGraphs.cascade();

        TrialResult result = engine.runTrial(graph, List.of("Y"), PropagationModel.SIR, 0.5d, 0.1d, 20, rng(3L));

        int total = result.count(HealthState.SUSCEPTIBLE) + result.count(HealthState.INFECTED)
            + result.count(HealthState.RECOVERED);
        assertThat(total).isEqualTo(graph.size());
        assertThat(result.infectedPerRound()).hasSize(result.roundsExecuted());
    }

    @Nested
    @DisplayName("Recovery rules")
    class RecoveryRuleTest {

        @Test
        @DisplayName("uniform recovery happens at the drawn round")
        void uniformRecoveryAtDrawnRound() {
            TrialResult result = engine.runTrial(TestGraphs.path3(), List.of("a"), PropagationModel.SIR,
                0.0d, RecoveryRules.uniform(2, 2), 10, rng(1L));

            assertThat(result.infectedPerRound()).containsExactly(1, 0);
            assertThat(result.stateOf("a")).isEqualTo(HealthState.RECOVERED);
        }

        @Test
        @DisplayName("normal recovery follows the cumulative distribution")
        void normalRecoveryFollowsCdf() {
            TrialResult early = engine.runTrial(TestGraphs.path3(), List.of("a"), PropagationModel.SIR,
                0.0d, RecoveryRules.normal(0.0d, 0.001d), 10, rng(1L));
            TrialResult late = engine.runTrial(TestGraphs.path3(), List.of("a"), PropagationModel.SIR,
                0.0d, RecoveryRules.normal(1000.0d, 1.0d), 5, rng(1L));

            assertThat(early.roundsExecuted()).isEqualTo(1);
            assertThat(late.roundsExecuted()).isEqualTo(5);
            assertThat(late.stateOf("a")).isEqualTo(HealthState.INFECTED);
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTest {

        @Test
        @DisplayName("a vaccinated seed is not part of the reduced graph")
        void vaccinatedSeedIsRejected() {
            ContactGraph reduced = TestGraphs.cycle4().without(Set.of("a"));

            assertThatThrownBy(() -> engine.runTrial(reduced, List.of("a"), PropagationModel.SIR, 0.5d, 0.5d, 5, rng(1L)))
                .isInstanceOf(InvalidSeedException.class)
                .extracting(e -> ((InvalidSeedException) e).getVertex())
                .isEqualTo("a");
        }

        @Test
        @DisplayName("an empty seed set is rejected")
        void emptySeedSetIsRejected() {
            assertThatThrownBy(() -> engine.runTrial(TestGraphs.cycle4(), List.of(), PropagationModel.SIR,
                0.5d, 0.5d, 5, rng(1L)))
                .isInstanceOf(InvalidSeedException.class);
        }

        @Test
        @DisplayName("probabilities and rounds are range checked")
        void parametersAreRangeChecked() {
            ContactGraph graph = TestGraphs.cycle4();

            assertThatThrownBy(() -> engine.runTrial(graph, List.of("a"), PropagationModel.SIR, 1.5d, 0.5d, 5, rng(1L)))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("pb");
            assertThatThrownBy(() -> engine.runTrial(graph, List.of("a"), PropagationModel.SIR, 0.5d, -0.1d, 5, rng(1L)))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("pd");
            assertThatThrownBy(() -> engine.runTrial(graph, List.of("a"), PropagationModel.SIR, 0.5d, 0.5d, 0, rng(1L)))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("rounds");
        }
    }
}
