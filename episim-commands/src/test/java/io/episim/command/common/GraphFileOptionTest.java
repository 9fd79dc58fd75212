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
import io.episim.graph.GraphFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GraphFileOption")
class GraphFileOptionTest {

    @Nested
    @DisplayName("GraphFileConverter")
    class ConverterTest {

        private final GraphFileOption.GraphFileConverter converter = new GraphFileOption.GraphFileConverter();

        @Test
        @DisplayName("should choose the format from the extension without a suffix")
        void shouldUseExtension() {
            GraphFileOption.GraphFile file = converter.convert("data/karate.gml");

            assertThat(file.path()).isEqualTo(Paths.get("data/karate.gml"));
            assertThat(file.format()).isNull();
            assertThat(file.effectiveFormat()).isEqualTo(GraphFormat.GML);
        }

        @Test
        @DisplayName("should honour an inline format suffix")
        void shouldHonourSuffix() {
            GraphFileOption.GraphFile file = converter.convert("contacts.dat:edgelist");

            assertThat(file.path()).isEqualTo(Paths.get("contacts.dat"));
            assertThat(file.effectiveFormat()).isEqualTo(GraphFormat.EDGELIST);
            assertThat(file.toString()).isEqualTo("contacts.dat (edgelist)");
        }

        @Test
        @DisplayName("should not mistake a drive letter for a format suffix")
        void shouldSkipDriveLetter() {
            GraphFileOption.GraphFile file = converter.convert("C:/graphs/karate.gml");

            assertThat(file.format()).isNull();
            assertThat(file.effectiveFormat()).isEqualTo(GraphFormat.GML);
        }

        @Test
        @DisplayName("should reject unknown formats and empty paths")
        void shouldRejectBadInput() {
            assertThatThrownBy(() -> converter.convert("graph.xml:graphml"))
                .isInstanceOf(InvalidParameterException.class);
            assertThatThrownBy(() -> converter.convert(" "))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("should compare graph files by path and format")
    void shouldCompareByValue() {
        GraphFileOption.GraphFile plain = new GraphFileOption.GraphFile(Paths.get("karate.gml"), null);
        GraphFileOption.GraphFile forced = new GraphFileOption.GraphFile(Paths.get("karate.gml"), GraphFormat.EDGELIST);

        assertThat(new GraphFileOption.GraphFileConverter().convert("karate.gml")).isEqualTo(plain);
        assertThat(forced).isNotEqualTo(plain);
        assertThat(plain.toString()).isEqualTo("karate.gml");
        assertThatThrownBy(() -> new GraphFileOption.GraphFile(null, GraphFormat.GML))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should fail to load a missing file")
    void shouldFailOnMissingFile(@TempDir Path tempDir) {
        GraphFileOption option = CommandLine.populateCommand(new GraphFileOption(),
            tempDir.resolve("absent.gml").toString());

        assertThat(option.getGraphPath()).isEqualTo(tempDir.resolve("absent.gml"));
        assertThatThrownBy(option::load)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("does not exist");
    }
}
