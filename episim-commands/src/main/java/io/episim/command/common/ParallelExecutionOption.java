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

import picocli.CommandLine;

/**
 * Shared options for running trials on several threads.
 * Parallel runs produce the same rows as sequential ones; only wall-clock time changes.
 */
public class ParallelExecutionOption {

    @CommandLine.Option(
        names = {"--parallel"},
        description = "Run trials in parallel on all but one of the available cores"
    )
    private boolean parallel = false;

    @CommandLine.Option(
        names = {"--threads"},
        description = "Number of trial threads (implies --parallel)"
    )
    private Integer explicitThreads;

    /**
     * Gets the explicitly specified thread count, if any.
     *
     * @return the thread count, or null if auto-detect should be used
     */
    public Integer getExplicitThreads() {
        return explicitThreads;
    }

    /**
     * Calculates the trial thread count.
     * Auto-detection leaves one core free; sequential mode uses 1.
     *
     * @return the thread count, at least 1
     */
    public int getThreadCount() {
        if (explicitThreads != null) {
            return Math.max(1, explicitThreads);
        }
        if (parallel) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        }
        return 1;
    }

    /**
     * Checks if the user explicitly asked for more threads than there are cores.
     */
    public boolean exceedsAvailableCores() {
        return explicitThreads != null && explicitThreads > Runtime.getRuntime().availableProcessors();
    }
}
