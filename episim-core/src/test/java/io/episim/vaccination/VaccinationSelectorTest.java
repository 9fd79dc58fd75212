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

package io.episim.vaccination;

import io.episim.TestGraphs;
import io.episim.api.InvalidParameterException;
import io.episim.centrality.CentralityMeasure;
import io.episim.centrality.CentralityProvider;
import io.episim.graph.ContactGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("VaccinationSelector")
class VaccinationSelectorTest {

    private final VaccinationSelector selector = new VaccinationSelector();

    @ParameterizedTest
    @EnumSource(CentralityMeasure.class)
    @DisplayName("both strategies return exactly k distinct vertices of the graph")
    void shouldReturnExactlyKDistinctVertices(CentralityMeasure measure) {
        ContactGraph graph = TestGraphs.cascade();
        for (SelectionStrategy strategy : SelectionStrategy.values()) {
            VaccinationPlan plan = selector.select(graph, measure, strategy, 5);

            assertThat(plan.vertices()).hasSize(5).doesNotHaveDuplicates();
            assertThat(graph.vertices()).containsAll(plan.vertices());
            assertThat(plan.measure()).isEqualTo(measure);
            assertThat(plan.strategy()).isEqualTo(strategy);
        }
    }

    @ParameterizedTest
    @EnumSource(CentralityMeasure.class)
    @DisplayName("structural ties go to the smallest identifier regardless of load order")
    void tiesBreakByIdentifierOnVertexTransitiveGraph(CentralityMeasure measure) {
        ContactGraph graph = TestGraphs.circulant(12, 5, 1, 3);
        assertThat(graph.vertices().get(0)).isEqualTo("v05");
        assertThat(graph.vertices().get(11)).isEqualTo("v00");

        for (SelectionStrategy strategy : SelectionStrategy.values()) {
            VaccinationPlan plan = selector.select(graph, measure, strategy, 1);
            assertThat(plan.vertices()).as(strategy.label()).containsExactly("v00");
        }
    }

    @Test
    @DisplayName("batch and recursive differ once removal changes the ranking")
    void batchAndRecursiveDiffer() {
        ContactGraph graph = TestGraphs.cascade();

        VaccinationPlan batch = selector.select(graph, CentralityMeasure.DEGREE, SelectionStrategy.BATCH, 2);
        VaccinationPlan recursive = selector.select(graph, CentralityMeasure.DEGREE, SelectionStrategy.RECURSIVE, 2);

        assertThat(batch.vertices()).containsExactly("X", "Y");
        assertThat(recursive.vertices()).containsExactly("X", "Z");
    }

    @Test
    @DisplayName("selection never mutates the caller's graph")
    void shouldNotMutateGraph() {
        ContactGraph graph = TestGraphs.cascade();
        List<String> before = new ArrayList<>(graph.vertices());
        int edges = graph.edgeCount();

        selector.select(graph, CentralityMeasure.BETWEENNESS, SelectionStrategy.RECURSIVE, 4);

        assertThat(graph.vertices()).isEqualTo(before);
        assertThat(graph.edgeCount()).isEqualTo(edges);
    }

    @Test
    @DisplayName("k = 0 yields an empty plan")
    void shouldReturnEmptyPlanForZero() {
        VaccinationPlan plan = selector.select(TestGraphs.star(), CentralityMeasure.DEGREE, SelectionStrategy.BATCH, 0);

        assertThat(plan.isEmpty()).isTrue();
        assertThat(plan.size()).isZero();
    }

    @Test
    @DisplayName("recursive selection falls back to identifier order once no edges remain")
    void recursiveFallsBackOnEdgelessGraph() {
        ContactGraph graph = TestGraphs.of("g", "a-b", "d", "c");
        List<CentralityMeasure> calls = new ArrayList<>();
        CentralityProvider counting = (g, measure) -> {
            calls.add(measure);
            return measure.compute(g);
        };

        VaccinationPlan plan = new VaccinationSelector(counting)
            .select(graph, CentralityMeasure.DEGREE, SelectionStrategy.RECURSIVE, 3);

        assertThat(plan.vertices()).containsExactly("a", "b", "c");
        assertThat(calls).hasSize(1);
    }

    @Test
    @DisplayName("recursive recomputes centrality once per pick, batch once in total")
    void recursiveRecomputesPerPick() {
        List<ContactGraph> seen = new ArrayList<>();
        CentralityProvider counting = (g, measure) -> {
            seen.add(g);
            return measure.compute(g);
        };
        VaccinationSelector countingSelector = new VaccinationSelector(counting);

        countingSelector.select(TestGraphs.cascade(), CentralityMeasure.DEGREE, SelectionStrategy.RECURSIVE, 3);
        assertThat(seen).hasSize(3);
        assertThat(seen).extracting(ContactGraph::size).containsExactly(11, 10, 9);

        seen.clear();
        countingSelector.select(TestGraphs.cascade(), CentralityMeasure.DEGREE, SelectionStrategy.BATCH, 3);
        assertThat(seen).hasSize(1);
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTest {

        @Test
        @DisplayName("should reject k outside [0, |V|]")
        void shouldRejectBadCount() {
            ContactGraph graph = TestGraphs.star();

            assertThatThrownBy(() -> selector.select(graph, CentralityMeasure.DEGREE, SelectionStrategy.BATCH, 5))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("outside [0, 4]");
            assertThatThrownBy(() -> selector.select(graph, CentralityMeasure.DEGREE, SelectionStrategy.BATCH, -1))
                .isInstanceOf(InvalidParameterException.class);
        }

        @Test
        @DisplayName("should reject unknown strategy and centrality names")
        void shouldRejectUnknownNames() {
            ContactGraph graph = TestGraphs.star();

            assertThatThrownBy(() -> selector.select(graph, "degree", "random", 1))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("strategy");
            assertThatThrownBy(() -> selector.select(graph, "katz", "batch", 1))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("centrality");
        }

        @Test
        @DisplayName("should accept names")
        void shouldAcceptNames() {
            VaccinationPlan plan = selector.select(TestGraphs.star(), "degree", "batch", 1);

            assertThat(plan.vertices()).containsExactly("h");
        }
    }
}
