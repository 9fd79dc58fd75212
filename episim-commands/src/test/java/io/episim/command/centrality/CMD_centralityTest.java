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

import io.episim.command.GraphFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

public class CMD_centralityTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureStdout() {
        originalOut = System.out;
        System.setOut(new PrintStream(outContent));
    }

    @AfterEach
    void restoreStdout() {
        System.setOut(originalOut);
    }

    @Test
    public void testPrintsScoresInGraphOrder() throws IOException {
        Path graph = GraphFixtures.copy("star.gml", tempDir);

        int exitCode = new CommandLine(new CMD_centrality()).execute(graph.toString(), "-c", "degree");

        assertThat(exitCode).isZero();
        assertThat(outContent.toString().lines()).containsExactly("vertex,score", "h,3", "l1,1", "l2,1", "l3,1");
    }

    @Test
    public void testRankedOrderUsesIdentifierTieBreak() throws IOException {
        Path graph = GraphFixtures.copy("cascade.txt", tempDir);

        int exitCode = new CommandLine(new CMD_centrality()).execute(graph.toString(), "-c", "degree", "--ranked");

        assertThat(exitCode).isZero();
        assertThat(outContent.toString().lines()).startsWith("vertex,score", "X,4", "Y,3", "Z,3");
    }

    @Test
    public void testForcedFormatOverridesExtension() throws IOException {
        Path graph = GraphFixtures.copy("star.gml", tempDir);
        Path renamed = graph.resolveSibling("star.dat");
        Files.move(graph, renamed);

        int exitCode = new CommandLine(new CMD_centrality()).execute(renamed + ":gml", "-c", "degree");

        assertThat(exitCode).isZero();
        assertThat(outContent.toString()).contains("h,3");
    }

    @Test
    public void testUnknownMeasureIsRejected() throws IOException {
        Path graph = GraphFixtures.copy("star.gml", tempDir);

        assertThat(new CommandLine(new CMD_centrality()).execute(graph.toString(), "-c", "pagerank")).isEqualTo(2);
    }
}
