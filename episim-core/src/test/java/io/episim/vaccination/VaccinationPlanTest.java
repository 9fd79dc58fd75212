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

import io.episim.api.InvalidParameterException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class VaccinationPlanTest {

    @ParameterizedTest
    @CsvSource({
        "50, 10, 5",
        "25, 2, 1",
        "1, 10, 0",
        "99, 10, 9",
        "50, 1, 0",
        "33, 34, 11"
    })
    void testTargetCountRoundsAndKeepsOneVertex(int percent, int vertices, int expected) {
        assertThat(VaccinationPlan.targetCount(percent, vertices)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 100, -5})
    void testTargetCountRejectsPercentOutOfRange(int percent) {
        assertThatThrownBy(() -> VaccinationPlan.targetCount(percent, 10))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("outside [1, 99]");
    }

    @Test
    void testRejectsDuplicateVertices() {
        assertThatThrownBy(() -> new VaccinationPlan(List.of("a", "a"), null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testNoneVaccinatesNobody() {
        VaccinationPlan none = VaccinationPlan.none();

        assertThat(none.isEmpty()).isTrue();
        assertThat(none.contains("a")).isFalse();
        assertThat(none.asSet()).isEmpty();
    }
}
