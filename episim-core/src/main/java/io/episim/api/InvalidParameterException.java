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

import java.util.Arrays;
import java.util.stream.Collectors;

/// Thrown for an unknown strategy, centrality, model or recovery name, or for a
/// numeric parameter outside its allowed range.
public class InvalidParameterException extends SimulationException {

    private final String parameter;

    public InvalidParameterException(String parameter, String message) {
        super("Invalid " + parameter + ": " + message);
        this.parameter = parameter;
    }

    /// Creates the exception for a name that is not one of the supported values.
    public static InvalidParameterException unknownName(String parameter, String value, Object[] supported) {
        String names = Arrays.stream(supported).map(Object::toString).collect(Collectors.joining(", "));
        return new InvalidParameterException(parameter, "'" + value + "' is not one of [" + names + "]");
    }

    /// Checks that a probability lies in [0, 1].
    public static double requireProbability(String parameter, double value) {
        if (!(value >= 0.0d && value <= 1.0d)) {
            throw new InvalidParameterException(parameter, value + " is outside [0, 1]");
        }
        return value;
    }

    /// Checks that a count is strictly positive.
    public static int requirePositive(String parameter, int value) {
        if (value <= 0) {
            throw new InvalidParameterException(parameter, value + " must be positive");
        }
        return value;
    }

    public String getParameter() {
        return parameter;
    }
}
