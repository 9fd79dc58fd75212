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

import org.apache.commons.rng.UniformRandomProvider;

/// Decides when an infected vertex recovers.
///
/// A rule is stateless and shared by every trial; [#begin] creates the per-trial state,
/// drawing from the trial's own random stream.
public interface RecoveryRule {

    /// Starts a trial over `vertexCount` vertices.
    Recovery begin(int vertexCount, UniformRandomProvider rng);

    /// Short description used in logs, such as `bernoulli(0.05)`.
    String describe();

    /// Per-trial recovery decisions.
    @FunctionalInterface
    interface Recovery {
        /// @param vertex the index of a vertex that was infected at the start of the round
        /// @param round  the 1-based round being computed
        /// @return true if the vertex is recovered at the end of that round
        boolean recovers(int vertex, int round);
    }
}
