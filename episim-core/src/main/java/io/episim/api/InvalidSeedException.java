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

package io.episim.api;

/// Thrown when a seed vertex is not part of the graph a trial runs on, either
/// because it never existed or because it was vaccinated.
public class InvalidSeedException extends SimulationException {

    private final String vertex;

    public InvalidSeedException(String vertex, String message) {
        super(message);
        this.vertex = vertex;
    }

    public static InvalidSeedException absent(String vertex) {
        return new InvalidSeedException(vertex, "Seed vertex '" + vertex + "' does not exist in the graph");
    }

    public static InvalidSeedException vaccinated(String vertex) {
        return new InvalidSeedException(vertex, "Seed vertex '" + vertex + "' is vaccinated and was removed from the graph");
    }

    public static InvalidSeedException empty() {
        return new InvalidSeedException(null, "At least one seed vertex is required");
    }

    /// @return the offending vertex, or null when the seed set itself was empty
    public String getVertex() {
        return vertex;
    }
}
