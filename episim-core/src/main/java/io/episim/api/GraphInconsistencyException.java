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

/// Thrown when a graph description is structurally invalid: duplicate vertex
/// identifiers, edges that reference unknown vertices, or unreadable input.
public class GraphInconsistencyException extends SimulationException {

    public GraphInconsistencyException(String message) {
        super(message);
    }

    public GraphInconsistencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
